package com.questrail.cot.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * CotConfig
 * =============================================================================
 * Immutable, string-keyed configuration for one transport endpoint.
 *
 * <p>A config carries a <em>name</em> (the section it came from, used to key
 * the endpoint inside the runtime) and a flat map of settings. Typed accessors
 * parse on read; the underlying values are never mutated once built.</p>
 *
 * <p>Parsing of configuration files or command lines happens outside this
 * library. Callers assemble a {@code CotConfig} from whatever source they use
 * and hand it to the runtime.</p>
 */
public final class CotConfig
{
    /** Values accepted as {@code true} by {@link #getBoolean(String)}. */
    private static final Set<String> BOOLEAN_TRUTH = Set.of("true", "yes", "y", "on", "1");

    private final String name;
    private final Map<String, String> values;

    private CotConfig(String name, Map<String, String> values) {
        this.name = Objects.requireNonNull(name, "name");
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public static CotConfig of(String name, Map<String, String> values) {
        Objects.requireNonNull(values, "values");
        return new CotConfig(name, values);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String name() {
        return name;
    }

    public boolean contains(String key) {
        String v = values.get(key);
        return v != null && !v.isBlank();
    }

    /**
     * Returns the value for {@code key}, treating blank values as absent.
     */
    public Optional<String> get(String key) {
        String v = values.get(key);
        if (v == null || v.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(v.trim());
    }

    public String get(String key, String defaultValue) {
        return get(key).orElse(defaultValue);
    }

    /**
     * @throws CotConfigurationException if the value is present but not an integer
     */
    public int getInt(String key, int defaultValue) {
        Optional<String> v = get(key);
        if (v.isEmpty()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(v.get());
        } catch (NumberFormatException e) {
            throw new CotConfigurationException("Invalid integer value: " + key + "=" + v.get(), e);
        }
    }

    public boolean getBoolean(String key) {
        return get(key)
                .map(v -> BOOLEAN_TRUTH.contains(v.toLowerCase(Locale.ROOT)))
                .orElse(false);
    }

    /** Destination descriptor, falling back to the ATAK default multicast group. */
    public String cotUrl() {
        return get(CotConfigKeys.COT_URL, CotConfigKeys.DEFAULT_COT_URL);
    }

    public Map<String, String> asMap() {
        return values;
    }

    /**
     * Returns a copy of this config with {@code overrides} applied on top.
     */
    public CotConfig withOverrides(Map<String, String> overrides) {
        Map<String, String> merged = new LinkedHashMap<>(values);
        merged.putAll(Objects.requireNonNull(overrides, "overrides"));
        return new CotConfig(name, merged);
    }

    @Override
    public String toString() {
        return "CotConfig[" + name + ", " + get(CotConfigKeys.COT_URL).orElse("<default>") + "]";
    }

    public static final class Builder {
        private final String name;
        private final Map<String, String> values = new LinkedHashMap<>();

        private Builder(String name) {
            this.name = Objects.requireNonNull(name, "name");
        }

        public Builder put(String key, String value) {
            values.put(Objects.requireNonNull(key, "key"), Objects.requireNonNull(value, "value"));
            return this;
        }

        public Builder put(String key, int value) {
            return put(key, Integer.toString(value));
        }

        public Builder putAll(Map<String, String> entries) {
            entries.forEach(this::put);
            return this;
        }

        public Builder withCotUrl(String url) {
            return put(CotConfigKeys.COT_URL, url);
        }

        public CotConfig build() {
            return new CotConfig(name, values);
        }
    }
}
