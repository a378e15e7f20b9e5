package com.scholary.stt.api;

/** Response returned when an async job is accepted. */
public record AsyncJobResponse(String jobId, String statusUrl) {}
