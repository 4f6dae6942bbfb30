package com.docqa.service.orchestrator;

public enum PipelineState {
    START,
    ROUTE,
    RETRIEVE,
    REASON,
    UTILITY,
    DONE,
    ERRORED
}
