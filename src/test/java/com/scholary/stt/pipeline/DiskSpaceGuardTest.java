package com.scholary.stt.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class DiskSpaceGuardTest {

  @TempDir Path tempDir;

  @Test
  void requiredBytes_oneSegmentTimesSafetyPlusReserve() {
    DiskSpaceGuard guard = new DiskSpaceGuard(16000, 3.0, 100);

    // 30s * 16000 samples * 2 bytes * 3 + 100MB
    assertThat(guard.requiredBytes(30)).isEqualTo(2_880_000L + 104_857_600L);
  }

  @Test
  void check_enoughSpace_passes() {
    DiskSpaceGuard guard = new DiskSpaceGuard(16000, 1.0, 0);

    assertThatCode(() -> guard.check(tempDir, 30)).doesNotThrowAnyException();
  }

  @Test
  void check_notEnoughSpace_throws() {
    DiskSpaceGuard guard =
        new DiskSpaceGuard(16000, 1.0, 0) {
          @Override
          long usableSpace(Path dir) {
            return 1_000;
          }
        };

    assertThatThrownBy(() -> guard.check(tempDir, 30))
        .isInstanceOf(InsufficientDiskSpaceException.class)
        .hasMessageContaining("need 960000 bytes, have 1000");
  }

  @Test
  void check_fileStoreUnreadable_throws() {
    DiskSpaceGuard guard =
        new DiskSpaceGuard(16000, 1.0, 0) {
          @Override
          long usableSpace(Path dir) throws IOException {
            throw new IOException("no such file store");
          }
        };

    assertThatThrownBy(() -> guard.check(tempDir, 30))
        .isInstanceOf(InsufficientDiskSpaceException.class)
        .hasCauseInstanceOf(IOException.class);
  }
}
