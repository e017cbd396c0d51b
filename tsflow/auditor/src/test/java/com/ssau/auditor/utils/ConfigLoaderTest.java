package com.ssau.auditor.utils;

import java.io.IOException;
import java.util.Properties;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ConfigLoaderTest {

    @Test
    void load_readsClasspathResource() throws Exception {
        Properties props = ConfigLoader.load("auditor-test.properties");

        assertEquals("/data/timestream", props.getProperty("audit.input.dir"));
        assertEquals("4", props.getProperty("audit.workers"));
    }

    @Test
    void loadDefault_readsBundledDefaults() throws Exception {
        Properties props = ConfigLoader.loadDefault();

        assertEquals("1000", props.getProperty("audit.checkpoint.interval"));
    }

    @Test
    void load_failsForMissingFile() {
        IOException e = assertThrows(IOException.class, () -> ConfigLoader.load("missing-auditor.properties"));
        assertTrue(e.getMessage().contains("missing-auditor.properties"));
    }
}
