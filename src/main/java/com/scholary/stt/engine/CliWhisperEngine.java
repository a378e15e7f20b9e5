package com.scholary.stt.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.stt.media.ProcessRunner;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.FileSystemUtils;

/**
 * Engine that shells out to the whisper.cpp command line tool per segment.
 *
 * <p>Each call writes a full JSON report ({@code -ojf}) into a private temporary directory; it is
 * parsed for the text and per-token probabilities, then the directory is deleted. Special tokens such as {@code [_BEG_]}
 * are excluded from the confidence.
 */
public class CliWhisperEngine implements EngineAdapter {

  private static final Logger LOGGER = LoggerFactory.getLogger(CliWhisperEngine.class);
  private static final String OUTPUT_NAME = "result";

  private final ProcessRunner processRunner;
  private final ObjectMapper objectMapper;
  private final Path executable;
  private final Path modelPath;
  private final Duration timeout;

  private volatile boolean open;

  public CliWhisperEngine(
      ProcessRunner processRunner,
      ObjectMapper objectMapper,
      Path executable,
      Path modelPath,
      Duration timeout) {
    this.processRunner = processRunner;
    this.objectMapper = objectMapper;
    this.executable = executable;
    this.modelPath = modelPath;
    this.timeout = timeout;
  }

  @Override
  public void open() {
    if (!Files.isRegularFile(executable)) {
      throw new EngineException("whisper executable not found: " + executable);
    }
    if (!Files.isExecutable(executable)) {
      throw new EngineException("whisper executable is not executable: " + executable);
    }
    if (!Files.isRegularFile(modelPath)) {
      throw new EngineException("whisper model not found: " + modelPath);
    }
    open = true;
    LOGGER.info("Initialized whisper CLI engine: executable={}, model={}", executable, modelPath);
  }

  @Override
  public EngineResult transcribe(Path segment, String language, int threads) {
    if (!open) {
      throw new EngineException("Engine is not open");
    }
    if (!Files.isRegularFile(segment)) {
      throw new EngineException("Segment file does not exist: " + segment);
    }

    Path outputDir;
    try {
      outputDir = Files.createTempDirectory("whisper-out-");
    } catch (IOException e) {
      throw new EngineException("Cannot create whisper output directory", e);
    }
    Path outputBase = outputDir.resolve(OUTPUT_NAME);
    Path jsonFile = outputDir.resolve(OUTPUT_NAME + ".json");
    List<String> command = buildCommand(segment, language, threads, outputBase);

    long started = System.nanoTime();
    try {
      ProcessRunner.ProcessResult result;
      try {
        result = processRunner.run(command, timeout);
      } catch (IOException e) {
        throw new EngineException("whisper could not be started: " + e.getMessage(), e);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new EngineException("Interrupted while running whisper", e);
      }

      if (result.timedOut()) {
        throw new EngineException(
            "whisper timed out after " + timeout.toSeconds() + "s on " + segment.getFileName());
      }
      if (result.exitCode() != 0) {
        throw new EngineException(
            String.format("whisper failed (exit=%d): %s", result.exitCode(), result.output()));
      }
      if (!Files.isRegularFile(jsonFile)) {
        throw new EngineException("whisper produced no output for " + segment.getFileName());
      }

      EngineResult parsed = parse(jsonFile, (System.nanoTime() - started) / 1_000_000_000.0);
      LOGGER.debug(
          "Transcribed {}: chars={}, confidence={}",
          segment.getFileName(),
          parsed.text().length(),
          parsed.confidence());
      return parsed;
    } finally {
      try {
        FileSystemUtils.deleteRecursively(outputDir);
      } catch (IOException e) {
        LOGGER.warn("Failed to delete whisper output {}", outputDir, e);
      }
    }
  }

  List<String> buildCommand(Path segment, String language, int threads, Path outputBase) {
    List<String> cmd = new ArrayList<>();
    cmd.add(executable.toString());
    cmd.add("-m");
    cmd.add(modelPath.toString());
    cmd.add("-f");
    cmd.add(segment.toAbsolutePath().toString());
    cmd.add("-l");
    cmd.add(language);
    cmd.add("-t");
    cmd.add(String.valueOf(threads));
    cmd.add("--no-timestamps");
    cmd.add("--no-context");
    cmd.add("-ojf");
    cmd.add("-of");
    cmd.add(outputBase.toAbsolutePath().toString());
    return cmd;
  }

  EngineResult parse(Path jsonFile, double elapsedSeconds) {
    JsonNode root;
    try {
      root = objectMapper.readTree(jsonFile.toFile());
    } catch (IOException e) {
      throw new EngineException("Unreadable whisper output " + jsonFile.getFileName(), e);
    }
    JsonNode segments = root.path("transcription");
    if (!segments.isArray()) {
      throw new EngineException("whisper output has no transcription array");
    }

    StringBuilder text = new StringBuilder();
    double probabilitySum = 0.0;
    int tokenCount = 0;
    for (JsonNode segment : segments) {
      String segmentText = segment.path("text").asText("").trim();
      if (!segmentText.isEmpty()) {
        if (text.length() > 0) {
          text.append(' ');
        }
        text.append(segmentText);
      }
      for (JsonNode token : segment.path("tokens")) {
        String tokenText = token.path("text").asText("");
        if (tokenText.startsWith("[_") || !token.has("p")) {
          continue;
        }
        probabilitySum += token.path("p").asDouble();
        tokenCount++;
      }
    }
    double confidence = tokenCount == 0 ? 0.0 : probabilitySum / tokenCount;
    return new EngineResult(text.toString(), confidence, elapsedSeconds);
  }

  @Override
  public String name() {
    return "whisper-cli";
  }

  @Override
  public void close() {
    open = false;
    LOGGER.info("Closed whisper CLI engine");
  }
}
