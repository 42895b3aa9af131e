package com.geoledger.service.config;

import com.geoledger.core.model.ReprocessThreshold;
import com.geoledger.core.model.SkipRules;
import com.geoledger.stages.api.StageSettings;

import java.util.Map;

public record StageConfig(
        String id,
        String type,
        Boolean enabled,
        SkipRules skipRules,
        ReprocessThreshold reprocessThreshold,
        Map<String, Object> params
) {
    public StageSettings toSettings(SkipRules defaultSkipRules) {
        return new StageSettings(
                id,
                enabled == null || enabled,
                skipRules == null ? defaultSkipRules : skipRules,
                reprocessThreshold,
                params
        );
    }
}
