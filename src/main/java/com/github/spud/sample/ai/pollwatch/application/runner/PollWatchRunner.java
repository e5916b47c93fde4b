package com.github.spud.sample.ai.pollwatch.application.runner;

import com.github.spud.sample.ai.pollwatch.application.config.PollWatchProperties;
import com.github.spud.sample.ai.pollwatch.domain.fleet.FleetScheduler;
import com.github.spud.sample.ai.pollwatch.domain.schedule.ClassSchedule;
import com.github.spud.sample.ai.pollwatch.domain.schedule.ScheduleStore;
import com.github.spud.sample.ai.pollwatch.domain.session.CancellationToken;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * 进程入口：加载课程表，运行调度器直到收到关闭信号，然后等待所有 watcher 结束
 * <p>
 * 课程表缺失或格式错误时抛出 ConfigException，启动失败。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PollWatchRunner implements ApplicationRunner, DisposableBean {

  private final ScheduleStore scheduleStore;
  private final FleetScheduler fleetScheduler;
  private final ConsoleShutdownListener consoleShutdownListener;
  private final PollWatchProperties properties;

  private final CancellationToken shutdownToken = new CancellationToken();

  @Override
  public void run(ApplicationArguments args) {
    log.info("Poll watch monitor starting");
    Map<String, ClassSchedule> schedules = scheduleStore.loadSchedules();

    if (properties.isConsoleListener()) {
      consoleShutdownListener.start(shutdownToken);
    }

    try {
      fleetScheduler.run(schedules, shutdownToken);
    } finally {
      log.info("Shutdown requested, waiting for sessions to close...");
      boolean clean = fleetScheduler.awaitTermination(properties.getShutdownJoinTimeout());
      log.info(clean ? "All sessions closed" : "Some sessions did not close in time");
    }
  }

  /**
   * 上下文关闭（如 Ctrl+C）时发出关闭信号
   */
  @Override
  public void destroy() {
    shutdownToken.cancel();
  }

  public CancellationToken shutdownToken() {
    return shutdownToken;
  }
}
