package com.scholary.stt.pipeline;

/** Notified after each chunk completes, whatever its result. */
@FunctionalInterface
public interface ChunkProgressListener {

  ChunkProgressListener NONE = (processed, total) -> {};

  void onChunkProcessed(int chunksProcessed, int chunksTotal);
}
