package com.scholary.stt.engine;

/** Quantized whisper.cpp models that can be deployed. */
public enum WhisperModel {
  SMALL("ggml-small-q5_1.bin", 500),
  MEDIUM("ggml-medium-q5_1.bin", 2000);

  private final String fileName;
  private final int approxMemoryMb;

  WhisperModel(String fileName, int approxMemoryMb) {
    this.fileName = fileName;
    this.approxMemoryMb = approxMemoryMb;
  }

  public String fileName() {
    return fileName;
  }

  public int approxMemoryMb() {
    return approxMemoryMb;
  }
}
