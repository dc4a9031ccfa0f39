package testrelay.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request DTO for writing a setting.
 * PUT /api/v1/settings/{key}
 */
public record SettingRequest(
        @JsonProperty("value") String value) {

    public void validate() {
        if (value == null) {
            throw new IllegalArgumentException("value is required");
        }
    }
}
