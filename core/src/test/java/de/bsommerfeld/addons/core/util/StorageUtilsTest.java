package de.bsommerfeld.addons.core.util;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class StorageUtilsTest {

    @Test
    void getAppDataDir_shouldContainAppName() {
        Path dir = StorageUtils.getAppDataDir("test-app");
        assertTrue(dir.toString().contains("test-app"));
    }

    @Test
    void getAppDataDir_shouldBeAbsolute() {
        assertTrue(StorageUtils.getAppDataDir("test-app").isAbsolute());
    }

    @Test
    void getLogsDir_shouldBeSubdirOfAppDataDir() {
        Path appDir = StorageUtils.getAppDataDir("test-app");
        Path logsDir = StorageUtils.getLogsDir(appDir);

        assertEquals(appDir, logsDir.getParent());
        assertEquals("logs", logsDir.getFileName().toString());
    }
}
