package com.clawcron.cron;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class CronParseTest {

    @Test
    void normalizeUtcIso_explicitZoneKept() {
        assertEquals("2024-01-01T12:00:00Z", CronParse.normalizeUtcIso("2024-01-01T12:00:00Z"));
        assertEquals("2024-01-01T12:00:00-05:00", CronParse.normalizeUtcIso("2024-01-01T12:00:00-05:00"));
    }

    @Test
    void normalizeUtcIso_compactOffsetGainsColon() {
        assertEquals("2024-01-01T12:00:00+08:00", CronParse.normalizeUtcIso("2024-01-01T12:00:00+0800"));
    }

    @Test
    void normalizeUtcIso_dateOnlyIsMidnightUtc() {
        assertEquals("2024-03-15T00:00:00Z", CronParse.normalizeUtcIso("2024-03-15"));
    }

    @Test
    void normalizeUtcIso_localDateTimeIsUtc() {
        assertEquals("2024-03-15T08:30:00Z", CronParse.normalizeUtcIso("2024-03-15T08:30:00"));
    }

    @ParameterizedTest
    @NullAndEmptySource
    void parseAbsoluteTime_nullOrEmpty(String input) {
        assertNull(CronParse.parseAbsoluteTime(input));
        assertNull(CronParse.parseAbsoluteTimeMs(input));
    }

    @Test
    void parseAbsoluteTime_epochMillis() {
        assertEquals(Instant.ofEpochMilli(1704067200000L), CronParse.parseAbsoluteTime(" 1704067200000 "));
    }

    @Test
    void parseAbsoluteTime_offsetConvertedToUtc() {
        // 09:00 at +08:00 is 01:00Z
        assertEquals(Instant.parse("2024-01-01T01:00:00Z"),
                CronParse.parseAbsoluteTime("2024-01-01T09:00:00+08:00"));
        assertEquals(Instant.parse("2024-01-01T01:00:00Z"),
                CronParse.parseAbsoluteTime("2024-01-01T09:00:00+0800"));
    }

    @Test
    void parseAbsoluteTimeMs_isoDate() {
        assertEquals(1704067200000L, CronParse.parseAbsoluteTimeMs("2024-01-01"));
    }

    @ParameterizedTest
    @CsvSource({ "0", "tomorrow", "2024-13-01", "12:00" })
    void parseAbsoluteTime_rejectsNonAbsolute(String input) {
        assertNull(CronParse.parseAbsoluteTime(input));
    }
}
