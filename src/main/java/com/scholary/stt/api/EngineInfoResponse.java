package com.scholary.stt.api;

/** Active engine backend and model. */
public record EngineInfoResponse(
    String backend,
    String model,
    String modelFile,
    int approxMemoryMb,
    int threads,
    int threadCap,
    String defaultLanguage) {}
