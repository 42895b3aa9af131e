package com.geoledger.service.pipeline;

import java.util.Objects;

public record PipelineSettings(String name, boolean failFast, int workers) {
    public PipelineSettings {
        Objects.requireNonNull(name, "name is required");
        if (workers < 1) {
            throw new IllegalArgumentException("workers must be at least 1: " + workers);
        }
    }

    public static PipelineSettings named(String name) {
        return new PipelineSettings(name, false, 1);
    }

    public PipelineSettings withFailFast(boolean value) {
        return new PipelineSettings(name, value, workers);
    }

    public PipelineSettings withWorkers(int value) {
        return new PipelineSettings(name, failFast, value);
    }
}
