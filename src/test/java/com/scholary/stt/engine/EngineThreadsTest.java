package com.scholary.stt.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class EngineThreadsTest {

  @Test
  void resolve_auto_cappedByConfiguredMaximum() {
    assertThat(EngineThreads.resolve(0, 8, 16)).isEqualTo(8);
  }

  @Test
  void resolve_auto_usesAvailableProcessorsBelowCap() {
    assertThat(EngineThreads.resolve(0, 8, 4)).isEqualTo(4);
  }

  @Test
  void resolve_explicit_cappedToo() {
    assertThat(EngineThreads.resolve(12, 8, 16)).isEqualTo(8);
    assertThat(EngineThreads.resolve(2, 8, 16)).isEqualTo(2);
  }

  @Test
  void resolve_defaultRuntime_withinBounds() {
    assertThat(EngineThreads.resolve(0, 8)).isBetween(1, 8);
  }

  @Test
  void resolve_invalidCap_throws() {
    assertThatThrownBy(() -> EngineThreads.resolve(0, 0, 4))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
