package com.scholary.stt.media;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Set;

/** Container formats accepted for transcription. */
public final class AudioFormats {

  public static final Set<String> SUPPORTED_EXTENSIONS =
      Set.of(
          "mp3", "wav", "m4a", "mp4", "aac", "ogg", "flac", "wma", "webm", "mkv", "avi", "mov");

  private AudioFormats() {}

  public static boolean isSupported(Path file) {
    return SUPPORTED_EXTENSIONS.contains(extension(file));
  }

  public static String extension(Path file) {
    String name = file.getFileName().toString();
    int dot = name.lastIndexOf('.');
    return dot < 0 ? "" : name.substring(dot + 1).toLowerCase(Locale.ROOT);
  }
}
