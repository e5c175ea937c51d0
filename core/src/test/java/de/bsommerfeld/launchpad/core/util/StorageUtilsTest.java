package de.bsommerfeld.launchpad.core.util;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class StorageUtilsTest {

    @Test
    void getAppDataDir_shouldBeAbsoluteAndContainAppName() {
        Path dir = StorageUtils.getAppDataDir("test-app");

        assertTrue(dir.isAbsolute());
        assertTrue(dir.toString().contains("test-app"));
    }

    @Test
    void getLogsDir_shouldBeSubdirOfAppDataDir() {
        assertEquals(StorageUtils.getAppDataDir("test-app").resolve("logs"), StorageUtils.getLogsDir("test-app"));
    }

    @Test
    void configAndCatalog_shouldLiveNextToEachOther() {
        Path config = StorageUtils.getConfigFile("test-app");
        Path catalog = StorageUtils.getCatalogFile("test-app");

        assertEquals(config.getParent(), catalog.getParent());
        assertEquals("config.toml", config.getFileName().toString());
        assertEquals("catalog.toml", catalog.getFileName().toString());
    }
}
