package com.scholary.stt.pipeline;

import com.scholary.stt.chunking.ChunkWindow;
import com.scholary.stt.transcript.ChunkResult;
import java.util.List;

/**
 * Windows actually processed and their results, one result per window.
 *
 * @param fallback whether chunking was abandoned for a single pass over the whole file
 */
public record ChunkRun(List<ChunkWindow> windows, List<ChunkResult> results, boolean fallback) {}
