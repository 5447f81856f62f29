package com.hecsink.core.projection;

import com.hecsink.core.model.AnalyticsRecord;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps an {@link AnalyticsRecord} to the key/value body of one HEC event.
 *
 * <p>Requested names are resolved against {@link AnalyticsField} once, here; {@link #transform}
 * itself has no side effects and returns an equal map for equal input.
 */
public final class EventTransformer {
    private static final Logger log = LoggerFactory.getLogger(EventTransformer.class);

    static final String MASK = "****";

    private final List<AnalyticsField> selected;
    private final boolean explicit;
    private final boolean obfuscateApiKeys;
    private final int visibleSuffix;

    public EventTransformer(ProjectionConfig config) {
        Objects.requireNonNull(config, "config");
        this.explicit = config.isExplicit();
        this.obfuscateApiKeys = config.obfuscateApiKeys();
        this.visibleSuffix = config.obfuscateApiKeysLength();
        this.selected = explicit ? resolve(config.fields()) : AnalyticsField.DEFAULTS;
    }

    public Map<String, Object> transform(AnalyticsRecord record) {
        Objects.requireNonNull(record, "record");
        Map<String, Object> event = new LinkedHashMap<>();
        for (AnalyticsField field : selected) {
            if (explicit && field == AnalyticsField.API_KEY && obfuscateApiKeys) {
                mask(record.apiKey()).ifPresent(masked -> event.put(field.wireName(), masked));
            } else {
                event.put(field.wireName(), field.extract(record));
            }
        }
        return event;
    }

    /** Fields this transformer emits, in order. */
    public List<AnalyticsField> selectedFields() {
        return selected;
    }

    // lengths count code points so a suffix never starts inside a surrogate pair
    Optional<String> mask(String apiKey) {
        if (apiKey == null) return Optional.empty();
        int codePoints = apiKey.codePointCount(0, apiKey.length());
        if (codePoints <= visibleSuffix) return Optional.empty();
        int suffixStart = apiKey.offsetByCodePoints(0, codePoints - visibleSuffix);
        return Optional.of(MASK + apiKey.substring(suffixStart));
    }

    private static List<AnalyticsField> resolve(List<String> names) {
        Set<AnalyticsField> fields = new LinkedHashSet<>();
        List<String> unknown = new ArrayList<>();
        for (String name : names) {
            Optional<AnalyticsField> field = AnalyticsField.fromWireName(name);
            if (field.isPresent()) {
                fields.add(field.get());
            } else {
                unknown.add(name);
            }
        }
        if (!unknown.isEmpty()) {
            log.warn("Ignoring unknown event fields {}", unknown);
        }
        return List.copyOf(fields);
    }
}
