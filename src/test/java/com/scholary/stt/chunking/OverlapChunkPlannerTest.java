package com.scholary.stt.chunking;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OverlapChunkPlannerTest {

  private OverlapChunkPlanner planner;

  @BeforeEach
  void setUp() {
    planner = new OverlapChunkPlanner();
  }

  @Test
  void plan_shortClip_returnsSingleWindow() {
    List<ChunkWindow> windows = planner.plan(25, 30, 1);

    assertThat(windows).containsExactly(new ChunkWindow(0, 0, 25));
  }

  @Test
  void plan_clipExactlyOneChunk_returnsSingleWindow() {
    List<ChunkWindow> windows = planner.plan(30, 30, 1);

    assertThat(windows).containsExactly(new ChunkWindow(0, 0, 30));
  }

  @Test
  void plan_hundredSeconds_matchesIterativeRule() {
    List<ChunkWindow> windows = planner.plan(100, 30, 1);

    assertThat(windows)
        .containsExactly(
            new ChunkWindow(0, 0, 30),
            new ChunkWindow(1, 29, 59),
            new ChunkWindow(2, 58, 88),
            new ChunkWindow(3, 87, 100));
  }

  @Test
  void plan_longClip_producesTenWindowsEndingAtDuration() {
    List<ChunkWindow> windows = planner.plan(278.65, 30, 1);

    assertThat(windows).hasSize(10);
    assertThat(windows.get(9).start()).isEqualTo(261.0);
    assertThat(windows.get(9).end()).isEqualTo(278.65);
  }

  @Test
  void plan_zeroOverlap_windowsAreContiguous() {
    List<ChunkWindow> windows = planner.plan(90, 30, 0);

    assertThat(windows)
        .containsExactly(
            new ChunkWindow(0, 0, 30), new ChunkWindow(1, 30, 60), new ChunkWindow(2, 60, 90));
  }

  @Test
  void plan_randomInputs_consecutiveWindowsShareOverlap() {
    Random random = new Random(42);
    for (int i = 0; i < 200; i++) {
      double chunkLength = 5 + random.nextInt(60);
      double overlap = random.nextInt((int) chunkLength);
      double duration = chunkLength + 0.5 + random.nextDouble() * 3000;

      List<ChunkWindow> windows = planner.plan(duration, chunkLength, overlap);

      assertThat(windows.get(0).start()).isZero();
      assertThat(windows.get(windows.size() - 1).end()).isEqualTo(duration);
      for (int w = 0; w + 1 < windows.size(); w++) {
        assertThat(windows.get(w).index()).isEqualTo(w);
        assertThat(windows.get(w + 1).start())
            .isCloseTo(windows.get(w).end() - overlap, within(1e-9));
        assertThat(windows.get(w).duration()).isLessThanOrEqualTo(chunkLength);
      }
    }
  }

  @Test
  void plan_sameArguments_sameWindows() {
    assertThat(planner.plan(1108.69, 30, 1)).isEqualTo(planner.plan(1108.69, 30, 1));
  }

  @Test
  void plan_overlapEqualToChunkLength_throws() {
    assertThatThrownBy(() -> planner.plan(100, 30, 30))
        .isInstanceOf(ChunkingConfigurationException.class)
        .hasMessageContaining("must be less than chunk duration");
  }

  @Test
  void plan_negativeOverlap_throws() {
    assertThatThrownBy(() -> planner.plan(100, 30, -1))
        .isInstanceOf(ChunkingConfigurationException.class);
  }

  @Test
  void plan_nonPositiveChunkLength_throws() {
    assertThatThrownBy(() -> planner.plan(100, 0, 0))
        .isInstanceOf(ChunkingConfigurationException.class);
  }

  @Test
  void plan_nonPositiveDuration_throws() {
    assertThatThrownBy(() -> planner.plan(0, 30, 1))
        .isInstanceOf(ChunkingConfigurationException.class);
    assertThatThrownBy(() -> planner.plan(Double.NaN, 30, 1))
        .isInstanceOf(ChunkingConfigurationException.class);
  }
}
