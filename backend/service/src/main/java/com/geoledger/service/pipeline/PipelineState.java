package com.geoledger.service.pipeline;

public enum PipelineState {
    IDLE,
    RUNNING,
    COMPLETED,
    ABORTED
}
