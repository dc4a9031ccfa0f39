package testrelay.coordinator.repository;

import java.util.Optional;

/**
 * Key/value store for runtime-tunable settings.
 */
public interface SettingsRepository {

    Optional<String> find(String key);

    void put(String key, String value);
}
