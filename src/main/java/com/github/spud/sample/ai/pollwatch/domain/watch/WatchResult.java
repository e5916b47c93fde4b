package com.github.spud.sample.ai.pollwatch.domain.watch;

/**
 * watcher 退出原因
 */
public enum WatchResult {
  /**
   * 课程时间窗口已结束
   */
  ENDED,

  /**
   * 收到全局关闭信号
   */
  SHUTDOWN,

  /**
   * 无法打开页面会话，本次运行不再重试该课程
   */
  UNAVAILABLE,

  /**
   * 运行中出现不可恢复的错误
   */
  FAILED
}
