package com.github.spud.sample.ai.pollwatch.domain.detect;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

/**
 * ChangeDetector 单元测试
 */
class ChangeDetectorTest {

  @Test
  void shouldFireOncePerTransition() {
    ChangeDetector detector = new ChangeDetector("a", "https://room");

    assertThat(detector.observe("a")).isFalse();
    assertThat(detector.observe("b")).isTrue();
    assertThat(detector.observe("b")).isFalse();
    assertThat(detector.observe("a")).isTrue();
    assertThat(detector.lastFingerprint()).isEqualTo("a");
  }

  @Test
  void emptyFingerprintNeitherFiresNorOverwrites() {
    ChangeDetector detector = new ChangeDetector("a", null);

    assertThat(detector.observe("")).isFalse();
    assertThat(detector.observe(null)).isFalse();
    assertThat(detector.lastFingerprint()).isEqualTo("a");

    // 读取失败后恢复为同一摘要不算变化
    assertThat(detector.observe("a")).isFalse();
  }

  @Test
  void firstRealFingerprintAfterEmptyBaselineCountsAsChange() {
    ChangeDetector detector = new ChangeDetector("", null);

    assertThat(detector.lastFingerprint()).isNull();
    assertThat(detector.observe("a")).isTrue();
  }

  @Test
  void shouldDetectLocationChange() {
    ChangeDetector detector = new ChangeDetector("a", "https://room/1");

    assertThat(detector.observeLocation("https://room/1")).isFalse();
    assertThat(detector.observeLocation(null)).isFalse();
    assertThat(detector.observeLocation("https://room/2")).isTrue();
    assertThat(detector.lastLocation()).isEqualTo("https://room/2");
  }

  @Test
  void rebaseShouldNotProduceEvent() {
    ChangeDetector detector = new ChangeDetector("a", null);

    detector.rebase("b");
    assertThat(detector.observe("b")).isFalse();

    detector.rebase("");
    assertThat(detector.lastFingerprint()).isEqualTo("b");
  }
}
