package com.scholary.stt.engine;

/**
 * Text produced by one engine call.
 *
 * @param text recognized text, possibly empty
 * @param confidence aggregate confidence in [0, 1]
 * @param processingTimeSeconds wall time spent inside the engine
 */
public record EngineResult(String text, double confidence, double processingTimeSeconds) {}
