package com.ssau.pipeline.model;

import java.time.LocalDateTime;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import com.ssau.pipeline.exception.MalformedTimestampException;
import com.ssau.pipeline.exception.NoTimestampInPathException;

import static org.junit.jupiter.api.Assertions.*;

class FrameInstantTest {

    private static final LocalDateTime MOMENT = LocalDateTime.of(2017, 1, 2, 3, 4, 5);

    @Test
    void fromPath_extractsDateSubsecondAndIndex() {
        FrameInstant instant = FrameInstant.fromPath("2017_01_02_03_04_05_00_cam1.jpg");

        assertEquals(MOMENT, instant.getDateTime());
        assertEquals(0, instant.getSubsecond());
        assertEquals("cam1", instant.getIndex());
        assertEquals("2017_01_02_03_04_05_00_cam1", instant.toString());
    }

    @Test
    void fromPath_ignoresDirectoriesAndSurroundingText() {
        FrameInstant instant = FrameInstant.fromPath("/data/GC02L/2017/2017_01/GC02L~fullres_2017_01_02_03_04_05_07.JPG");

        assertEquals(MOMENT, instant.getDateTime());
        assertEquals(7, instant.getSubsecond());
        assertNull(instant.getIndex());
        assertEquals("2017_01_02_03_04_05_07", instant.toString());
    }

    @Test
    void fromPath_subsecondAndIndexAreOptional() {
        FrameInstant bare = FrameInstant.fromPath("2017_01_02_03_04_05.png");
        assertEquals(0, bare.getSubsecond());
        assertNull(bare.getIndex());
        assertEquals("2017_01_02_03_04_05_00", bare.toString());

        FrameInstant indexOnly = FrameInstant.fromPath("2017_01_02_03_04_05_topview.png");
        assertEquals(0, indexOnly.getSubsecond());
        assertEquals("topview", indexOnly.getIndex());
    }

    @Test
    void fromPath_numericIndexAfterSubsecond() {
        FrameInstant instant = FrameInstant.fromPath("2017_01_02_03_04_05_00_0011.cr2");

        assertEquals(0, instant.getSubsecond());
        assertEquals("0011", instant.getIndex());
        assertEquals("2017_01_02_03_04_05_00_0011", instant.toString());
    }

    @Test
    void fromPath_oversizedSubsecondFallsBackToZero() {
        FrameInstant instant = FrameInstant.fromPath("2017_01_02_03_04_05_99999999999.jpg");

        assertEquals(0, instant.getSubsecond());
        assertNull(instant.getIndex());
    }

    @Test
    void fromPath_failsWithoutTimestamp() {
        NoTimestampInPathException e = assertThrows(NoTimestampInPathException.class,
            () -> FrameInstant.fromPath("/tmp/holiday-photo.jpg"));
        assertEquals("/tmp/holiday-photo.jpg", e.getPath());
    }

    @Test
    void fromPath_invalidCalendarDateIsMalformed() {
        assertThrows(MalformedTimestampException.class, () -> FrameInstant.fromPath("2017_13_02_03_04_05.jpg"));
    }

    @Test
    void of_parsesIsoAndDropsOffset() {
        FrameInstant instant = FrameInstant.of("2017-01-02T03:04:05+10:00");

        assertEquals(MOMENT, instant.getDateTime());
        assertEquals("2017_01_02_03_04_05_00", instant.toString());
    }

    @Test
    void of_rejectsNegativeSubsecond() {
        assertThrows(IllegalArgumentException.class, () -> FrameInstant.of(MOMENT, -1, null));
    }

    @ParameterizedTest
    @ValueSource(strings = {"2017_01_02_03_04_05", "2017-01-02T03:04:05", "2017-01-02 03:04:05Z"})
    void canonicalStringParsesBackToSameMoment(String timestamp) {
        FrameInstant instant = FrameInstant.of(timestamp, 3, "a");
        String canonical = instant.toString();

        FrameInstant reparsed = FrameInstant.fromPath(canonical);
        assertEquals(instant, reparsed);
        assertEquals(canonical, reparsed.toString());
    }

    @Test
    void toIsoString_rendersSeconds() {
        assertEquals("2017-01-02T03:04:05", FrameInstant.of(MOMENT.withNano(500)).toIsoString());
    }

    @Test
    void compareTo_followsCanonicalString() {
        FrameInstant early = FrameInstant.of(MOMENT);
        FrameInstant sameSecondLater = FrameInstant.of(MOMENT, 1, null);
        FrameInstant nextDay = FrameInstant.of(MOMENT.plusDays(1));

        assertTrue(early.compareTo(sameSecondLater) < 0);
        assertTrue(sameSecondLater.compareTo(nextDay) < 0);
        assertEquals(0, early.compareTo(FrameInstant.fromPath("2017_01_02_03_04_05.jpg")));
    }

    @Test
    void fromPath_keepsNonAsciiIndex() {
        FrameInstant first = FrameInstant.fromPath("2017_01_02_03_04_05_00_kamera_\u00e4.jpg");
        FrameInstant second = FrameInstant.fromPath("2017_01_02_03_04_05_00_kamera_\u00f6.jpg");

        assertEquals("kamera_\u00e4", first.getIndex());
        assertNotEquals(first, second);
        assertNotEquals(first.toString(), second.toString());
        assertEquals("caf\u00e9", FrameInstant.fromPath("/data/2017_01_02_03_04_05_00_caf\u00e9.jpg").getIndex());
    }

    @Test
    void equals_agreesWithCompareToBelowOneSecond() {
        FrameInstant whole = FrameInstant.of(MOMENT);
        FrameInstant withNanos = FrameInstant.of(MOMENT.withNano(500));

        assertEquals(0, whole.compareTo(withNanos));
        assertEquals(whole, withNanos);
        assertEquals(whole.hashCode(), withNanos.hashCode());
        assertEquals(MOMENT, FrameInstant.of("2017-01-02T03:04:05.25").getDateTime());
    }
}
