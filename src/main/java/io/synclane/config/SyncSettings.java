package io.synclane.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.synclane.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

public record SyncSettings(
        long heartbeatIntervalMs,
        long heartbeatTimeoutMs,
        long progressTimeoutMs,
        long metadataLockTimeoutMs,
        long metadataAcquireWaitMs,
        int metadataMaxRetries,
        long metadataRetryDelayMs,
        int transferMaxAttempts,
        long transferBaseBackoffMs,
        long transferMaxBackoffMs,
        int pushMaxAttempts,
        long connectTimeoutMs,
        String remoteName,
        String pointerPrefix,
        String payloadPrefix,
        String lfsEndpoint,
        Map<String, String> componentVersions,
        boolean allowOutdatedSync
) {
    private static final Logger logger = LoggerFactory.getLogger(SyncSettings.class);

    public SyncSettings {
        componentVersions = componentVersions == null ? Map.of() : Map.copyOf(componentVersions);
    }

    public static SyncSettings defaults() {
        return new SyncSettings(
                SyncLaneConfig.DEFAULT_HEARTBEAT_INTERVAL_MS,
                SyncLaneConfig.DEFAULT_HEARTBEAT_TIMEOUT_MS,
                SyncLaneConfig.DEFAULT_PROGRESS_TIMEOUT_MS,
                SyncLaneConfig.DEFAULT_METADATA_LOCK_TIMEOUT_MS,
                SyncLaneConfig.DEFAULT_METADATA_ACQUIRE_WAIT_MS,
                SyncLaneConfig.DEFAULT_METADATA_MAX_RETRIES,
                SyncLaneConfig.DEFAULT_METADATA_RETRY_DELAY_MS,
                SyncLaneConfig.DEFAULT_TRANSFER_MAX_ATTEMPTS,
                SyncLaneConfig.DEFAULT_TRANSFER_BASE_BACKOFF_MS,
                SyncLaneConfig.DEFAULT_TRANSFER_MAX_BACKOFF_MS,
                SyncLaneConfig.DEFAULT_PUSH_MAX_ATTEMPTS,
                SyncLaneConfig.DEFAULT_CONNECT_TIMEOUT_MS,
                SyncLaneConfig.DEFAULT_REMOTE,
                SyncLaneConfig.DEFAULT_POINTER_PREFIX,
                SyncLaneConfig.DEFAULT_PAYLOAD_PREFIX,
                "",
                Map.of(),
                false
        );
    }

    /**
     * Loads settings from {@code file}, falling back to defaults when the file is absent or unreadable.
     */
    public static SyncSettings load(Path file) {
        SyncSettings defaults = defaults();
        if (file == null || !Files.isRegularFile(file)) {
            return defaults;
        }
        try {
            SyncSettingsFile parsed = Jsons.mapper().readValue(file.toFile(), SyncSettingsFile.class);
            return fromFile(parsed, defaults);
        } catch (IOException e) {
            logger.warn("Ignoring unreadable settings file {}: {}", file, e.getMessage());
            return defaults;
        }
    }

    static SyncSettings fromFile(SyncSettingsFile file, SyncSettings defaults) {
        if (file == null) {
            return defaults;
        }
        long interval = sanitizeLong(file.heartbeatIntervalMs(), defaults.heartbeatIntervalMs(), 10L);
        long heartbeatTimeout = sanitizeLong(file.heartbeatTimeoutMs(), defaults.heartbeatTimeoutMs(), interval);
        if (heartbeatTimeout < interval) {
            heartbeatTimeout = interval;
        }
        long progressTimeout = sanitizeLong(file.progressTimeoutMs(), defaults.progressTimeoutMs(), 1_000L);
        long metadataLockTimeout = sanitizeLong(file.metadataLockTimeoutMs(), defaults.metadataLockTimeoutMs(), 100L);
        long metadataAcquireWait = sanitizeLong(file.metadataAcquireWaitMs(), defaults.metadataAcquireWaitMs(), 0L);
        int metadataMaxRetries = sanitizeInt(file.metadataMaxRetries(), defaults.metadataMaxRetries(), 1);
        long metadataRetryDelay = sanitizeLong(file.metadataRetryDelayMs(), defaults.metadataRetryDelayMs(), 0L);
        int transferMaxAttempts = sanitizeInt(file.transferMaxAttempts(), defaults.transferMaxAttempts(), 1);
        long transferBaseBackoff = sanitizeLong(file.transferBaseBackoffMs(), defaults.transferBaseBackoffMs(), 0L);
        long transferMaxBackoff = sanitizeLong(file.transferMaxBackoffMs(), defaults.transferMaxBackoffMs(), transferBaseBackoff);
        if (transferMaxBackoff < transferBaseBackoff) {
            transferMaxBackoff = transferBaseBackoff;
        }
        int pushMaxAttempts = sanitizeInt(file.pushMaxAttempts(), defaults.pushMaxAttempts(), 1);
        long connectTimeout = sanitizeLong(file.connectTimeoutMs(), defaults.connectTimeoutMs(), 100L);
        return new SyncSettings(
                interval,
                heartbeatTimeout,
                progressTimeout,
                metadataLockTimeout,
                metadataAcquireWait,
                metadataMaxRetries,
                metadataRetryDelay,
                transferMaxAttempts,
                transferBaseBackoff,
                transferMaxBackoff,
                pushMaxAttempts,
                connectTimeout,
                sanitizeText(file.remoteName(), defaults.remoteName()),
                sanitizePrefix(file.pointerPrefix(), defaults.pointerPrefix()),
                sanitizePrefix(file.payloadPrefix(), defaults.payloadPrefix()),
                sanitizeText(file.lfsEndpoint(), defaults.lfsEndpoint()),
                sanitizeVersions(file.componentVersions(), defaults.componentVersions()),
                sanitizeBoolean(file.allowOutdatedSync(), defaults.allowOutdatedSync())
        );
    }

    public SyncSettings withLockTimeouts(long intervalMs, long heartbeatTimeoutMs, long progressTimeoutMs) {
        return new SyncSettings(intervalMs, heartbeatTimeoutMs, progressTimeoutMs, metadataLockTimeoutMs,
                metadataAcquireWaitMs, metadataMaxRetries, metadataRetryDelayMs, transferMaxAttempts,
                transferBaseBackoffMs, transferMaxBackoffMs, pushMaxAttempts, connectTimeoutMs, remoteName,
                pointerPrefix, payloadPrefix, lfsEndpoint, componentVersions, allowOutdatedSync);
    }

    public SyncSettings withMetadataLocking(long lockTimeoutMs, long acquireWaitMs, int maxRetries, long retryDelayMs) {
        return new SyncSettings(heartbeatIntervalMs, heartbeatTimeoutMs, progressTimeoutMs, lockTimeoutMs,
                acquireWaitMs, maxRetries, retryDelayMs, transferMaxAttempts, transferBaseBackoffMs,
                transferMaxBackoffMs, pushMaxAttempts, connectTimeoutMs, remoteName, pointerPrefix, payloadPrefix,
                lfsEndpoint, componentVersions, allowOutdatedSync);
    }

    public SyncSettings withTransferRetry(int maxAttempts, long baseBackoffMs, long maxBackoffMs) {
        return new SyncSettings(heartbeatIntervalMs, heartbeatTimeoutMs, progressTimeoutMs, metadataLockTimeoutMs,
                metadataAcquireWaitMs, metadataMaxRetries, metadataRetryDelayMs, maxAttempts, baseBackoffMs,
                maxBackoffMs, pushMaxAttempts, connectTimeoutMs, remoteName, pointerPrefix, payloadPrefix, lfsEndpoint,
                componentVersions, allowOutdatedSync);
    }

    public SyncSettings withComponentVersions(Map<String, String> versions, boolean allowOutdated) {
        return new SyncSettings(heartbeatIntervalMs, heartbeatTimeoutMs, progressTimeoutMs, metadataLockTimeoutMs,
                metadataAcquireWaitMs, metadataMaxRetries, metadataRetryDelayMs, transferMaxAttempts,
                transferBaseBackoffMs, transferMaxBackoffMs, pushMaxAttempts, connectTimeoutMs, remoteName,
                pointerPrefix, payloadPrefix, lfsEndpoint, versions, allowOutdated);
    }

    public SyncSettings withLfsEndpoint(String endpoint) {
        return new SyncSettings(heartbeatIntervalMs, heartbeatTimeoutMs, progressTimeoutMs, metadataLockTimeoutMs,
                metadataAcquireWaitMs, metadataMaxRetries, metadataRetryDelayMs, transferMaxAttempts,
                transferBaseBackoffMs, transferMaxBackoffMs, pushMaxAttempts, connectTimeoutMs, remoteName,
                pointerPrefix, payloadPrefix, endpoint == null ? "" : endpoint, componentVersions, allowOutdatedSync);
    }

    private static long sanitizeLong(Long value, long fallback, long min) {
        if (value == null) {
            return fallback;
        }
        return Math.max(min, value);
    }

    private static int sanitizeInt(Integer value, int fallback, int min) {
        if (value == null) {
            return fallback;
        }
        return Math.max(min, value);
    }

    private static boolean sanitizeBoolean(Boolean value, boolean fallback) {
        return value == null ? fallback : value;
    }

    private static String sanitizeText(String value, String fallback) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        return value.trim();
    }

    private static String sanitizePrefix(String value, String fallback) {
        String text = sanitizeText(value, fallback).replace('\\', '/');
        while (text.startsWith("/")) {
            text = text.substring(1);
        }
        while (text.endsWith("/")) {
            text = text.substring(0, text.length() - 1);
        }
        return text.isBlank() ? fallback : text;
    }

    private static Map<String, String> sanitizeVersions(Map<String, String> value, Map<String, String> fallback) {
        if (value == null) {
            return fallback;
        }
        Map<String, String> out = new LinkedHashMap<>();
        value.forEach((component, version) -> {
            if (component != null && !component.isBlank() && version != null && !version.isBlank()) {
                out.put(component.trim(), version.trim());
            }
        });
        return out;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SyncSettingsFile(
            Long heartbeatIntervalMs,
            Long heartbeatTimeoutMs,
            Long progressTimeoutMs,
            Long metadataLockTimeoutMs,
            Long metadataAcquireWaitMs,
            Integer metadataMaxRetries,
            Long metadataRetryDelayMs,
            Integer transferMaxAttempts,
            Long transferBaseBackoffMs,
            Long transferMaxBackoffMs,
            Integer pushMaxAttempts,
            Long connectTimeoutMs,
            String remoteName,
            String pointerPrefix,
            String payloadPrefix,
            String lfsEndpoint,
            Map<String, String> componentVersions,
            Boolean allowOutdatedSync
    ) {
    }
}
