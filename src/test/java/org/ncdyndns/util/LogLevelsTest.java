package org.ncdyndns.util;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LogLevelsTest {

    @AfterEach
    void restore() {
        LogLevels.applyRootLevel("WARN");
    }

    @Test
    void applyRootLevel_acceptsAnyCase() {
        assertEquals("DEBUG", LogLevels.applyRootLevel(" debug "));
        assertEquals(Level.DEBUG, LogManager.getRootLogger().getLevel());
    }

    @Test
    void applyRootLevel_fallsBackToInfo() {
        assertEquals("INFO", LogLevels.applyRootLevel("chatty"));
        assertEquals("INFO", LogLevels.applyRootLevel(null));
    }
}
