package com.github.spud.sample.ai.pollwatch.domain.session;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * 全局关闭信号，自上而下显式传递给调度器、watcher 与兜底监听
 * <p>
 * 协作式取消：各循环在迭代边界检查；sleep 在取消时提前返回。
 */
public class CancellationToken {

  private final CountDownLatch cancelled = new CountDownLatch(1);

  public void cancel() {
    cancelled.countDown();
  }

  public boolean isCancelled() {
    return cancelled.getCount() == 0;
  }

  /**
   * 休眠给定时长，或直到被取消
   *
   * @return 返回时是否已取消（或当前线程被中断）
   */
  public boolean sleep(Duration duration) {
    try {
      return cancelled.await(duration.toNanos(), TimeUnit.NANOSECONDS);
    } catch (InterruptedException e) {
      // 线程被中断时按已取消处理，由调用方退出循环
      Thread.currentThread().interrupt();
      return true;
    }
  }
}
