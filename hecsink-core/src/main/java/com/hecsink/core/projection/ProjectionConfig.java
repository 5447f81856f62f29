package com.hecsink.core.projection;

import com.hecsink.transport.InvalidSettingsException;
import java.util.List;

/**
 * Which fields an event carries and how the API key is masked.
 *
 * @param fields wire names to emit, in order; empty selects {@link AnalyticsField#DEFAULTS}
 * @param obfuscateApiKeys mask {@code api_key} when it is explicitly requested
 * @param obfuscateApiKeysLength trailing characters of the key left visible
 */
public record ProjectionConfig(List<String> fields, boolean obfuscateApiKeys, int obfuscateApiKeysLength) {

    public ProjectionConfig {
        fields = fields == null ? List.of() : List.copyOf(fields);
        if (obfuscateApiKeysLength < 0) {
            throw new InvalidSettingsException("obfuscate_api_keys_length must not be negative: " + obfuscateApiKeysLength);
        }
    }

    public static ProjectionConfig defaults() {
        return new ProjectionConfig(List.of(), false, 0);
    }

    public boolean isExplicit() {
        return !fields.isEmpty();
    }
}
