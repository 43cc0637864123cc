package org.ncdyndns.util;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.core.config.Configurator;

/**
 * Switches the root log level at runtime.
 */
public final class LogLevels {

    private LogLevels() {
    }

    /**
     * @param level a level name such as {@code DEBUG} or {@code info}; unknown names mean INFO
     * @return the level that was applied
     */
    public static String applyRootLevel(String level) {
        Level resolved = Level.toLevel(level == null ? null : level.trim().toUpperCase(), Level.INFO);
        Configurator.setRootLevel(resolved);
        return resolved.name();
    }
}
