package com.scholary.stt.config;

import com.scholary.stt.transcript.ConcatenationMerger;
import com.scholary.stt.transcript.MergeStrategy;
import com.scholary.stt.transcript.TranscriptMerger;
import com.scholary.stt.transcript.WordOverlapMerger;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the transcript merger.
 *
 * <p>The merge strategy is chosen once from {@code transcription.merge.strategy}.
 */
@Configuration
@EnableConfigurationProperties(TranscriptionProperties.class)
public class TranscriptionConfig {

  @Bean
  public MergeStrategy mergeStrategy(TranscriptionProperties properties) {
    TranscriptionProperties.MergeProperties merge = properties.merge();
    if (merge.strategy() == TranscriptionProperties.MergeMode.WORD_OVERLAP) {
      return new WordOverlapMerger(merge.contextWindowWords(), merge.minMatchWords());
    }
    return new ConcatenationMerger();
  }

  @Bean
  public TranscriptMerger transcriptMerger(MergeStrategy mergeStrategy) {
    return new TranscriptMerger(mergeStrategy);
  }
}
