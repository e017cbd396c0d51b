package com.ssau.auditor.service;

import java.nio.file.Paths;
import java.util.Properties;

import org.junit.jupiter.api.Test;

import com.ssau.auditor.utils.ConfigLoader;
import com.ssau.pipeline.report.QuotePolicy;

import static org.junit.jupiter.api.Assertions.*;

class AuditSettingsTest {

    @Test
    void fromProperties_readsAllKeys() throws Exception {
        AuditSettings settings = AuditSettings.fromProperties(ConfigLoader.load("auditor-test.properties"));

        assertEquals(Paths.get("/data/timestream"), settings.inputDir());
        assertEquals(Paths.get("/data/audit.tsv"), settings.reportFile());
        assertEquals(4, settings.workers());
        assertEquals(1000, settings.checkpointInterval());
        assertEquals(QuotePolicy.NON_NUMERIC, settings.quotePolicy());
        assertFalse(settings.imageStats());
        assertEquals(Paths.get("/data/mirror"), settings.mirrorDir());
        assertEquals("com.ssau.pipeline.step.CopyStep", settings.extraSteps());
    }

    @Test
    void fromProperties_appliesDefaults() {
        Properties props = new Properties();
        props.setProperty("audit.input.dir", "in");
        props.setProperty("audit.report.file", "report.tsv");

        AuditSettings settings = AuditSettings.fromProperties(props);

        assertEquals(1, settings.workers());
        assertEquals(QuotePolicy.NUMERIC, settings.quotePolicy());
        assertTrue(settings.imageStats());
        assertNull(settings.mirrorDir());
    }

    @Test
    void fromProperties_requiresInputAndReport() {
        Properties props = new Properties();
        props.setProperty("audit.input.dir", "in");

        assertThrows(IllegalStateException.class, () -> AuditSettings.fromProperties(props));
    }

    @Test
    void rejectsNonPositiveCheckpointInterval() {
        Properties props = new Properties();
        props.setProperty("audit.input.dir", "in");
        props.setProperty("audit.report.file", "report.tsv");
        props.setProperty("audit.checkpoint.interval", "0");

        assertThrows(IllegalArgumentException.class, () -> AuditSettings.fromProperties(props));
    }
}
