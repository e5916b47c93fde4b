package com.github.spud.sample.ai.pollwatch.domain.session;

import java.util.List;
import java.util.Objects;
import lombok.Getter;

/**
 * 题目快照：题干与有序选项，选项 k 即列表第 k 个元素（从 1 开始）
 * <p>
 * 相等性只比较题干：题干不变时选项顺序或文字的变化不视为新题。
 */
@Getter
public final class QuestionSnapshot {

  private final String question;
  private final List<String> options;

  public QuestionSnapshot(String question, List<String> options) {
    this.question = Objects.requireNonNull(question, "question");
    this.options = List.copyOf(options);
  }

  public int optionCount() {
    return options.size();
  }

  public String option(int optionNumber) {
    return options.get(optionNumber - 1);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof QuestionSnapshot)) {
      return false;
    }
    return question.equals(((QuestionSnapshot) o).question);
  }

  @Override
  public int hashCode() {
    return question.hashCode();
  }

  @Override
  public String toString() {
    return "QuestionSnapshot{question='" + question + "', options=" + options + "}";
  }
}
