package com.github.spud.sample.ai.pollwatch.domain.state;

/**
 * 人工兜底状态机事件枚举
 */
public enum FallbackEvent {
  /**
   * 求助消息发送成功
   */
  SEND_OK,

  /**
   * 求助消息发送失败
   */
  SEND_FAILED,

  /**
   * 开始轮询
   */
  LISTEN,

  /**
   * 页面内容已变化
   */
  CONTENT_CHANGED,

  /**
   * 已应用一条有效回复
   */
  REPLY_APPLIED,

  /**
   * 改选完成，继续监听
   */
  RESUME,

  /**
   * 通道查询失败
   */
  CHANNEL_FAILED,

  /**
   * 全局关闭
   */
  SHUTDOWN,

  /**
   * 超过最长等待时间
   */
  DEADLINE_PASSED
}
