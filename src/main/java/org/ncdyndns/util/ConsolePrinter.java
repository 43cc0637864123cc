package org.ncdyndns.util;

import java.io.PrintStream;

/**
 * Utility class for printing colored console messages.
 * <p>
 * Works on terminals that support ANSI escape codes (Linux, macOS, and Windows 10+).
 * Colors are left out when {@code NO_COLOR} is set or no console is attached.
 */
public final class ConsolePrinter {

    private ConsolePrinter() {}

    private static final String RESET = "\u001B[0m";
    private static final String GREEN = "\u001B[32m";
    private static final String RED = "\u001B[31m";
    private static final String BLUE = "\u001B[34m";

    private static final boolean COLORS = System.getenv("NO_COLOR") == null && System.console() != null;

    /**
     * Prints a success message in green.
     */
    public static void printSuccess(String message) {
        print(System.out, GREEN, message);
    }

    /**
     * Prints a failure message in red, on standard error.
     */
    public static void printFail(String message) {
        print(System.err, RED, message);
    }

    public static void printInfo(String message) {
        print(System.out, BLUE, message);
    }

    /**
     * Prints preformatted text, such as a table, without coloring.
     */
    public static void printPlain(String text) {
        System.out.println(text);
    }

    private static void print(PrintStream out, String color, String message) {
        out.println(COLORS ? color + message + RESET : message);
    }
}
