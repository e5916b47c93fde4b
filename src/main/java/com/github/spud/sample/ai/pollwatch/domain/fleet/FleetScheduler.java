package com.github.spud.sample.ai.pollwatch.domain.fleet;

import com.github.spud.sample.ai.pollwatch.application.config.PollWatchProperties;
import com.github.spud.sample.ai.pollwatch.domain.schedule.ClassSchedule;
import com.github.spud.sample.ai.pollwatch.domain.session.CancellationToken;
import com.github.spud.sample.ai.pollwatch.domain.session.SessionRegistry;
import com.github.spud.sample.ai.pollwatch.domain.session.SessionState;
import com.github.spud.sample.ai.pollwatch.domain.watch.SessionWatcher;
import com.github.spud.sample.ai.pollwatch.domain.watch.WatchResult;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalTime;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * 课程调度器
 * <p>
 * 按固定间隔检查课程表，为进入时间窗口且尚未被监控的课程各启动一个独立的 watcher 线程；
 * watcher 退出时自行注销。无法打开会话的课程在本次运行内不再重试。
 */
@Slf4j
@Component
public class FleetScheduler {

  private final SessionRegistry registry;
  private final SessionWatcher sessionWatcher;
  private final ExecutorService watcherExecutor;
  private final PollWatchProperties properties;
  private final Clock clock;

  private final Set<String> unavailableClasses = ConcurrentHashMap.newKeySet();

  public FleetScheduler(SessionRegistry registry, SessionWatcher sessionWatcher,
    @Qualifier("watcherExecutor") ExecutorService watcherExecutor,
    PollWatchProperties properties, Clock clock) {
    this.registry = registry;
    this.sessionWatcher = sessionWatcher;
    this.watcherExecutor = watcherExecutor;
    this.properties = properties;
    this.clock = clock;
  }

  /**
   * 调度主循环，直到收到关闭信号
   */
  public void run(Map<String, ClassSchedule> schedules, CancellationToken token) {
    log.info("Scheduler started with {} class(es): {}", schedules.size(),
      String.join(", ", schedules.keySet()));

    while (!token.isCancelled()) {
      tick(schedules, token);
      if (token.sleep(properties.getTickInterval())) {
        break;
      }
    }

    log.info("Scheduler stopped issuing ticks");
  }

  /**
   * 为所有处于时间窗口内且未注册的课程启动 watcher
   *
   * @return 本次新启动的 watcher 数量
   */
  public int tick(Map<String, ClassSchedule> schedules, CancellationToken token) {
    LocalTime now = LocalTime.now(clock);
    int started = 0;
    for (ClassSchedule schedule : schedules.values()) {
      if (token.isCancelled()) {
        break;
      }
      if (schedule.isActiveAt(now) && startSession(schedule, token)) {
        started++;
      }
    }
    return started;
  }

  /**
   * 启动课程监控；课程已在监控中或已被标记为不可用时不做任何事
   *
   * @return 是否新启动了 watcher
   */
  public boolean startSession(ClassSchedule schedule, CancellationToken token) {
    if (unavailableClasses.contains(schedule.getName())) {
      return false;
    }

    try {
      Optional<SessionState> registered = registry.register(schedule,
        state -> watcherExecutor.submit(() -> runWatcher(state, token)));
      registered.ifPresent(state -> log.info("[{}] Watcher started", state.getClassName()));
      return registered.isPresent();
    } catch (RejectedExecutionException e) {
      log.error("[{}] Could not start watcher: {}", schedule.getName(), e.getMessage());
      return false;
    }
  }

  private void runWatcher(SessionState state, CancellationToken token) {
    try {
      WatchResult result = sessionWatcher.watch(state, token);
      if (result == WatchResult.UNAVAILABLE) {
        unavailableClasses.add(state.getClassName());
      }
      log.info("[{}] Watcher finished: {}", state.getClassName(), result);
    } finally {
      registry.deregister(state);
    }
  }

  /**
   * 尽力等待所有 watcher 结束，每个 watcher 最多等待 timeout
   *
   * @return 返回时是否所有 watcher 都已结束
   */
  public boolean awaitTermination(Duration timeout) {
    for (SessionState state : registry.snapshot()) {
      Future<?> handle = state.getHandle();
      if (handle == null) {
        continue;
      }
      try {
        handle.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
      } catch (TimeoutException e) {
        log.warn("[{}] Watcher did not stop within {}", state.getClassName(), timeout);
      } catch (ExecutionException e) {
        log.error("[{}] Watcher failed: {}", state.getClassName(), e.getCause().getMessage(),
          e.getCause());
      } catch (CancellationException e) {
        log.warn("[{}] Watcher was cancelled", state.getClassName());
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        log.warn("Interrupted while waiting for watchers");
        return false;
      }
    }
    return registry.snapshot().stream().noneMatch(SessionState::isAlive);
  }

  public boolean isWatching(String className) {
    return registry.isRegistered(className);
  }

  public boolean isUnavailable(String className) {
    return unavailableClasses.contains(className);
  }
}
