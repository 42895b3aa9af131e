package com.geoledger.stages.api;

import com.geoledger.core.config.ConfigurationException;
import com.geoledger.core.model.ReprocessThreshold;
import com.geoledger.core.model.SkipRules;

import java.util.Map;
import java.util.Objects;

/**
 * Validated, immutable per-stage configuration. Built once when the pipeline is assembled.
 */
public record StageSettings(
        String id,
        boolean enabled,
        SkipRules skipRules,
        ReprocessThreshold reprocessThreshold,
        Map<String, Object> params
) {
    public StageSettings {
        Objects.requireNonNull(id, "id is required");
        if (id.isBlank()) {
            throw new ConfigurationException("stages[].id", "Stage id must not be blank");
        }
        skipRules = skipRules == null ? SkipRules.defaults() : skipRules;
        params = params == null ? Map.of() : Map.copyOf(params);
    }

    public static StageSettings of(String id) {
        return new StageSettings(id, true, SkipRules.defaults(), null, Map.of());
    }

    public StageSettings withSkipRules(SkipRules value) {
        return new StageSettings(id, enabled, value, reprocessThreshold, params);
    }

    public StageSettings withReprocessThreshold(ReprocessThreshold value) {
        return new StageSettings(id, enabled, skipRules, value, params);
    }

    public StageSettings withParams(Map<String, Object> value) {
        return new StageSettings(id, enabled, skipRules, reprocessThreshold, value);
    }

    public <T> T requiredParam(String key, Class<T> type) {
        Object value = params.get(key);
        if (value == null) {
            throw ConfigurationException.missing(settingName(key));
        }
        if (!type.isInstance(value)) {
            throw new ConfigurationException(settingName(key), "Config key '" + settingName(key) + "' must be " + type.getSimpleName());
        }
        return type.cast(value);
    }

    public double doubleParam(String key, double defaultValue) {
        Object value = params.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (!(value instanceof Number number)) {
            throw new ConfigurationException(settingName(key), "Config key '" + settingName(key) + "' must be a number");
        }
        return number.doubleValue();
    }

    private String settingName(String key) {
        return "stages." + id + ".params." + key;
    }
}
