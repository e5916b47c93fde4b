package com.github.spud.sample.ai.pollwatch.domain.session;

import java.util.Optional;

/**
 * 一个已登录的直播答题页面
 * <p>
 * 所有方法都可能阻塞；读取失败时 fingerprint 返回空串而不是抛出异常。
 */
public interface PageSession extends AutoCloseable {

  /**
   * 当前显示内容的摘要，仅用于变化检测；瞬时读取失败时返回空串
   */
  String fingerprint();

  /**
   * 当前页面地址
   */
  String currentLocation();

  /**
   * 读取当前显示的题目，没有题目时返回 empty
   */
  Optional<QuestionSnapshot> readQuestion();

  /**
   * 选择第 optionNumber 个选项（从 1 开始）
   */
  boolean applyChoice(int optionNumber);

  /**
   * 取消当前已选择的选项
   *
   * @return 是否取消了至少一个选项
   */
  boolean clearChoice();

  @Override
  void close();
}
