package com.github.spud.sample.ai.pollwatch.domain.state;

/**
 * 人工兜底状态枚举
 * <pre>
 * IDLE → MESSAGE_SENT → LISTENING ⇄ OVERRIDDEN
 *                    ↘            ↘ ABORTED / TIMED_OUT
 * </pre>
 */
public enum FallbackState {
  /**
   * 尚未发送求助消息
   */
  IDLE,

  /**
   * 求助消息已发送，水位已记录
   */
  MESSAGE_SENT,

  /**
   * 轮询回复并检查题目是否变化
   */
  LISTENING,

  /**
   * 已应用人工选择，随后回到 LISTENING 继续监听
   */
  OVERRIDDEN,

  /**
   * 题目关闭/切换、发送失败、通道错误或全局关闭（终态）
   */
  ABORTED,

  /**
   * 超过最长等待时间（终态）
   */
  TIMED_OUT;

  /**
   * 是否为终态
   */
  public static boolean isFinal(FallbackState state) {
    return state == ABORTED || state == TIMED_OUT;
  }
}
