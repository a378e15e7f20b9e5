package com.scholary.stt.media;

import com.scholary.stt.chunking.ChunkWindow;
import com.scholary.stt.pipeline.AudioSource;
import java.nio.file.Path;

/** Cuts a window out of a source file as 16 kHz mono PCM. */
public interface AudioSegmenter {

  /**
   * Write the given window of {@code source} to {@code target}.
   *
   * @throws SegmentExtractionException if the source is unreadable, the window lies outside the
   *     clip, or extraction fails
   * @throws ExtractionUnavailableException if the extraction tool cannot be run at all
   */
  void extract(AudioSource source, ChunkWindow window, Path target);

  /** Whether the extraction tool can be invoked on this host. */
  boolean isAvailable();
}
