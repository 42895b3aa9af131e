package com.geoledger.service.config;

import java.util.List;

public record PipelineConfig(
        String name,
        Boolean failFast,
        Integer workers,
        StorageConfig storage,
        String centroidsFile,
        List<StageConfig> stages
) {
    public PipelineConfig {
        name = name == null || name.isBlank() ? "pipeline" : name;
        failFast = failFast != null && failFast;
        workers = workers == null ? 1 : workers;
        storage = storage == null ? new StorageConfig(null, null) : storage;
        stages = stages == null ? List.of() : List.copyOf(stages);
    }

    /** Where records and run history live. A null journal file means an in-memory store. */
    public record StorageConfig(String journalFile, String historyFile) {
    }
}
