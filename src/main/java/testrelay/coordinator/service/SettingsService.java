package testrelay.coordinator.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import testrelay.coordinator.repository.SettingsRepository;

import java.util.Optional;

/**
 * Typed access to runtime-tunable settings.
 * Missing or malformed values fall back to the caller's default.
 */
public class SettingsService {

    private static final Logger log = LoggerFactory.getLogger(SettingsService.class);

    /** Kill switch for the scheduled dispatch pass */
    public static final String DISPATCH_ENABLED = "scheduled_triggers_cron_enabled";
    public static final String RETENTION_DAYS = "execution_data_retention_days";
    public static final String AGENT_HEARTBEAT_INTERVAL = "agent_heartbeat_interval_seconds";
    public static final String AGENT_POLL_INTERVAL = "agent_poll_interval_seconds";

    public static final int DEFAULT_RETENTION_DAYS = 30;
    public static final int DEFAULT_HEARTBEAT_INTERVAL_SECONDS = 60;
    public static final int DEFAULT_POLL_INTERVAL_SECONDS = 10;

    private final SettingsRepository settingsRepository;

    public SettingsService(SettingsRepository settingsRepository) {
        this.settingsRepository = settingsRepository;
    }

    public Optional<String> get(String key) {
        requireKey(key);
        return settingsRepository.find(key);
    }

    public void put(String key, String value) {
        requireKey(key);
        if (value == null) {
            throw new IllegalArgumentException("value is required");
        }
        settingsRepository.put(key, value);
        log.info("Setting {} updated to '{}'", key, value);
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        return get(key)
                .map(String::trim)
                .map(v -> {
                    if ("true".equalsIgnoreCase(v)) {
                        return Boolean.TRUE;
                    }
                    if ("false".equalsIgnoreCase(v)) {
                        return Boolean.FALSE;
                    }
                    log.warn("Setting {} has non-boolean value '{}', using {}", key, v, defaultValue);
                    return defaultValue;
                })
                .orElse(defaultValue);
    }

    public int getInt(String key, int defaultValue) {
        Optional<String> raw = get(key);
        if (raw.isEmpty()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(raw.get().trim());
        } catch (NumberFormatException e) {
            log.warn("Setting {} has non-numeric value '{}', using {}", key, raw.get(), defaultValue);
            return defaultValue;
        }
    }

    public boolean dispatchEnabled() {
        return getBoolean(DISPATCH_ENABLED, true);
    }

    public int retentionDays() {
        int days = getInt(RETENTION_DAYS, DEFAULT_RETENTION_DAYS);
        return days > 0 ? days : DEFAULT_RETENTION_DAYS;
    }

    private static void requireKey(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("key is required");
        }
    }
}
