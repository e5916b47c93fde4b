package com.github.spud.sample.ai.pollwatch.domain.state;

/**
 * 单次轮询中回复检查的结果
 */
public enum ReplyKind {
  /**
   * 没有比水位更新的消息（或本轮未检查）
   */
  NONE,

  /**
   * 新消息不是有效选项号
   */
  INVALID,

  /**
   * 新消息是有效选项号
   */
  VALID
}
