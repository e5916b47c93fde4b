package com.github.spud.sample.ai.pollwatch.domain.oracle;

import java.util.Locale;

/**
 * 答案置信度
 */
public enum Confidence {
  HIGH,
  MEDIUM,
  LOW;

  /**
   * 解析置信度标签；缺失或无法识别的标签按 LOW 处理
   */
  public static Confidence fromLabel(String label) {
    if (label == null) {
      return LOW;
    }
    switch (label.trim().toLowerCase(Locale.ROOT)) {
      case "high":
        return HIGH;
      case "medium":
        return MEDIUM;
      default:
        return LOW;
    }
  }

  public String label() {
    return name().toLowerCase(Locale.ROOT);
  }
}
