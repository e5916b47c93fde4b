package com.github.spud.sample.ai.pollwatch.application.runner;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.github.spud.sample.ai.pollwatch.application.config.PollWatchProperties;
import com.github.spud.sample.ai.pollwatch.domain.fleet.FleetScheduler;
import com.github.spud.sample.ai.pollwatch.domain.schedule.ClassSchedule;
import com.github.spud.sample.ai.pollwatch.domain.schedule.ConfigException;
import com.github.spud.sample.ai.pollwatch.domain.schedule.ScheduleStore;
import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.DefaultApplicationArguments;

/**
 * PollWatchRunner 启动与关闭流程测试
 */
@ExtendWith(MockitoExtension.class)
class PollWatchRunnerTest {

  @Mock
  private ScheduleStore scheduleStore;

  @Mock
  private FleetScheduler fleetScheduler;

  @Mock
  private ConsoleShutdownListener consoleListener;

  private PollWatchProperties properties;
  private PollWatchRunner runner;

  @BeforeEach
  void setUp() {
    properties = new PollWatchProperties();
    properties.setConsoleListener(false);
    properties.setShutdownJoinTimeout(Duration.ofSeconds(2));
    runner = new PollWatchRunner(scheduleStore, fleetScheduler, consoleListener, properties);
  }

  @Test
  void shouldRunSchedulerThenWaitForWatchers() {
    Map<String, ClassSchedule> schedules =
      Map.of("CS 101", ClassSchedule.builder().name("CS 101").build());
    when(scheduleStore.loadSchedules()).thenReturn(schedules);

    runner.run(new DefaultApplicationArguments());

    InOrder order = inOrder(fleetScheduler);
    order.verify(fleetScheduler).run(eq(schedules), eq(runner.shutdownToken()));
    order.verify(fleetScheduler).awaitTermination(Duration.ofSeconds(2));
    verifyNoInteractions(consoleListener);
  }

  @Test
  void shouldStartConsoleListenerWhenEnabled() {
    properties.setConsoleListener(true);
    when(scheduleStore.loadSchedules()).thenReturn(Map.of());

    runner.run(new DefaultApplicationArguments());

    verify(consoleListener).start(runner.shutdownToken());
  }

  @Test
  void configErrorShouldAbortStartup() {
    when(scheduleStore.loadSchedules()).thenThrow(new ConfigException("Schedule file not found"));

    assertThatThrownBy(() -> runner.run(new DefaultApplicationArguments()))
      .isInstanceOf(ConfigException.class);
    verify(fleetScheduler, never()).run(any(), any());
  }

  @Test
  void destroyShouldCancelToken() {
    runner.destroy();

    assertThat(runner.shutdownToken().isCancelled()).isTrue();
  }
}
