package com.scholary.stt.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublisher;
import java.net.http.HttpRequest.BodyPublishers;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.MediaTypeFactory;

/**
 * Engine backed by a long-running whisper.cpp HTTP server.
 *
 * <p>The server holds the loaded model; this adapter only owns the HTTP client. Each segment is sent
 * as multipart/form-data and the verbose JSON response is parsed for text and segment
 * log-probabilities. Failures are reported immediately; there is no retry.
 *
 * <p>The server picks its own thread count at startup, so the per-call {@code threads} hint is
 * ignored here.
 */
public class HttpWhisperEngine implements EngineAdapter {

  private static final Logger LOGGER = LoggerFactory.getLogger(HttpWhisperEngine.class);

  private final EngineProperties.HttpProperties properties;
  private final ObjectMapper objectMapper;
  private final URI inferenceUri;

  private volatile HttpClient httpClient;

  public HttpWhisperEngine(EngineProperties.HttpProperties properties, ObjectMapper objectMapper) {
    this.properties = properties;
    this.objectMapper = objectMapper;
    this.inferenceUri = URI.create(stripTrailingSlash(properties.baseUrl()) + properties.inferencePath());
  }

  @Override
  public void open() {
    this.httpClient =
        HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(properties.connectTimeoutSeconds()))
            .build();
    LOGGER.info("Initialized whisper HTTP engine: endpoint={}", inferenceUri);
  }

  @Override
  public EngineResult transcribe(Path segment, String language, int threads) {
    HttpClient client = this.httpClient;
    if (client == null) {
      throw new EngineException("Engine is not open");
    }
    if (!Files.isRegularFile(segment)) {
      throw new EngineException("Segment file does not exist: " + segment);
    }

    long started = System.nanoTime();
    String boundary = UUID.randomUUID().toString();
    HttpResponse<String> response;
    try {
      HttpRequest request =
          HttpRequest.newBuilder()
              .uri(inferenceUri)
              .timeout(Duration.ofSeconds(properties.readTimeoutSeconds()))
              .header("Content-Type", "multipart/form-data; boundary=" + boundary)
              .POST(buildMultipartBody(segment, language, boundary))
              .build();
      response = client.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
    } catch (IOException e) {
      throw new EngineException("Whisper server request failed: " + e.getMessage(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new EngineException("Interrupted while waiting for whisper server", e);
    }

    if (response.statusCode() != 200) {
      throw new EngineException(
          String.format(
              "Whisper server returned status %d: %s", response.statusCode(), response.body()));
    }

    InferenceResponse body;
    try {
      body = objectMapper.readValue(response.body(), InferenceResponse.class);
    } catch (JsonProcessingException e) {
      throw new EngineException("Unreadable whisper server response", e);
    }
    if (body.error() != null && !body.error().isBlank()) {
      throw new EngineException("Whisper server error: " + body.error());
    }

    double elapsed = (System.nanoTime() - started) / 1_000_000_000.0;
    EngineResult result = new EngineResult(body.resolvedText(), body.resolvedConfidence(), elapsed);
    LOGGER.debug(
        "Transcribed {}: chars={}, confidence={}, took={}s",
        segment.getFileName(),
        result.text().length(),
        result.confidence(),
        elapsed);
    return result;
  }

  @Override
  public String name() {
    return "whisper-http";
  }

  @Override
  public void close() {
    this.httpClient = null;
    LOGGER.info("Closed whisper HTTP engine");
  }

  /**
   * Build the multipart body by hand; {@link HttpClient} has no multipart support.
   *
   * <pre>
   * --boundary
   * Content-Disposition: form-data; name="file"; filename="chunk_0000.wav"
   * Content-Type: audio/x-wav
   *
   * [binary data]
   * --boundary
   * Content-Disposition: form-data; name="language"
   *
   * vi
   * --boundary--
   * </pre>
   */
  private BodyPublisher buildMultipartBody(Path segment, String language, String boundary)
      throws IOException {
    byte[] fileBytes = Files.readAllBytes(segment);

    StringBuilder sb = new StringBuilder();
    sb.append("--").append(boundary).append("\r\n");
    sb.append("Content-Disposition: form-data; name=\"file\"; filename=\"")
        .append(segment.getFileName())
        .append("\"\r\n");
    sb.append("Content-Type: ").append(contentType(segment)).append("\r\n\r\n");
    byte[] prefix = sb.toString().getBytes(StandardCharsets.UTF_8);

    sb = new StringBuilder();
    sb.append("\r\n");
    appendField(sb, boundary, "language", language);
    appendField(sb, boundary, "response_format", "verbose_json");
    appendField(sb, boundary, "temperature", "0.0");
    sb.append("--").append(boundary).append("--\r\n");
    byte[] suffix = sb.toString().getBytes(StandardCharsets.UTF_8);

    byte[] body = new byte[prefix.length + fileBytes.length + suffix.length];
    System.arraycopy(prefix, 0, body, 0, prefix.length);
    System.arraycopy(fileBytes, 0, body, prefix.length, fileBytes.length);
    System.arraycopy(suffix, 0, body, prefix.length + fileBytes.length, suffix.length);
    return BodyPublishers.ofByteArray(body);
  }

  /** Segments are WAV; the unconverted source used as a fallback keeps its own type. */
  private static String contentType(Path audio) {
    return MediaTypeFactory.getMediaType(audio.getFileName().toString())
        .map(MediaType::toString)
        .orElse(MediaType.APPLICATION_OCTET_STREAM_VALUE);
  }

  private static void appendField(StringBuilder sb, String boundary, String name, String value) {
    sb.append("--").append(boundary).append("\r\n");
    sb.append("Content-Disposition: form-data; name=\"").append(name).append("\"\r\n\r\n");
    sb.append(value).append("\r\n");
  }

  private static String stripTrailingSlash(String url) {
    return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
  }
}
