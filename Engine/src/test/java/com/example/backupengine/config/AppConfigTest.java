package com.example.backupengine.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.example.backupengine.archive.Archive.Platform;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Map;
import org.junit.jupiter.api.Test;

class AppConfigTest {

    @Test
    void defaultsWhenUnset() {
        AppConfig config = AppConfig.fromMap(Map.of());

        assertEquals(Platform.ANDROID, config.platform());
        assertEquals("unknown", config.appVersion());
        assertEquals("https://www.googleapis.com", config.driveApiBaseUrl());
        assertEquals(4, config.driveRetryMaxAttempts());
        assertEquals(50L * 1024 * 1024, config.largeFileWarningBytes());
        assertEquals(10, config.keepDriveBackups());
        assertEquals(ZoneOffset.UTC, config.backupZone());
        assertTrue(config.driveRootFolderId().isEmpty());
    }

    @Test
    void numericValuesAreClampedAndInvalidOnesIgnored() {
        AppConfig config = AppConfig.fromMap(Map.of(
                AppConfig.DRIVE_RETRY_MAX_ATTEMPTS, "99",
                AppConfig.KEEP_LOCAL, "0",
                AppConfig.KEEP_DRIVE, "abc",
                AppConfig.DRIVE_RETRY_BASE_DELAY_MS, "5000",
                AppConfig.DRIVE_RETRY_MAX_DELAY_MS, "100"));

        assertEquals(10, config.driveRetryMaxAttempts());
        assertEquals(1, config.keepLocalBackups());
        assertEquals(10, config.keepDriveBackups());
        assertEquals(5000, config.driveRetryMaxDelayMs());
    }

    @Test
    void invalidPlatformFailsFast() {
        AppConfig config = AppConfig.fromMap(Map.of(AppConfig.PLATFORM, "desktop"));

        assertThrows(IllegalStateException.class, config::platform);
    }

    @Test
    void invalidTimezoneFallsBackToUtc() {
        assertEquals(ZoneOffset.UTC, AppConfig.fromMap(Map.of(AppConfig.TIMEZONE, "Mars/Base")).backupZone());
        assertEquals(ZoneId.of("America/Sao_Paulo"),
                AppConfig.fromMap(Map.of(AppConfig.TIMEZONE, "America/Sao_Paulo")).backupZone());
    }

    @Test
    void overridesWinAndCanBeRemoved() {
        AppConfig config = AppConfig.fromMap(Map.of(AppConfig.APP_VERSION, "1.0.0"));

        config.override(AppConfig.APP_VERSION, "2.0.0");
        assertEquals("2.0.0", config.appVersion());
        config.override(AppConfig.APP_VERSION, null);
        assertEquals("1.0.0", config.appVersion());
    }

    @Test
    void requireFailsForMissingKey() {
        AppConfig config = AppConfig.fromMap(Map.of(AppConfig.DRIVE_ROOT_FOLDER_ID, "  "));

        assertThrows(IllegalStateException.class, () -> config.require(AppConfig.DRIVE_ROOT_FOLDER_ID));
    }

    @Test
    void toStringNeverLeaksToken() {
        AppConfig config = AppConfig.fromMap(Map.of(AppConfig.DRIVE_ACCESS_TOKEN, "ya29.secret-token"));

        assertFalse(config.toString().contains("ya29.secret-token"));
    }
}
