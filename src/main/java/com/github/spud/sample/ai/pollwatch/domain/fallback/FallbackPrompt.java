package com.github.spud.sample.ai.pollwatch.domain.fallback;

import com.github.spud.sample.ai.pollwatch.domain.session.QuestionSnapshot;
import java.util.OptionalInt;

/**
 * 兜底消息的格式化与回复解析
 */
public final class FallbackPrompt {

  private FallbackPrompt() {
  }

  public static String format(QuestionSnapshot snapshot) {
    StringBuilder sb = new StringBuilder();
    sb.append("Poll help needed\n");
    sb.append("Q: ").append(snapshot.getQuestion()).append('\n');
    for (int i = 1; i <= snapshot.optionCount(); i++) {
      sb.append(i).append(". ").append(snapshot.option(i)).append('\n');
    }
    sb.append("Reply with 1-").append(snapshot.optionCount());
    return sb.toString();
  }

  /**
   * 解析回复为有效选项号
   *
   * @return 1..optionCount 之间的整数，否则 empty
   */
  public static OptionalInt parseReply(String text, int optionCount) {
    if (text == null) {
      return OptionalInt.empty();
    }
    String trimmed = text.trim();
    if (trimmed.isEmpty() || !trimmed.chars().allMatch(Character::isDigit)) {
      return OptionalInt.empty();
    }
    try {
      int choice = Integer.parseInt(trimmed);
      return choice >= 1 && choice <= optionCount ? OptionalInt.of(choice) : OptionalInt.empty();
    } catch (NumberFormatException e) {
      return OptionalInt.empty();
    }
  }
}
