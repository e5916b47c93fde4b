package com.github.spud.sample.ai.pollwatch.domain.fleet;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.github.spud.sample.ai.pollwatch.application.config.PollWatchProperties;
import com.github.spud.sample.ai.pollwatch.domain.schedule.ClassSchedule;
import com.github.spud.sample.ai.pollwatch.domain.session.CancellationToken;
import com.github.spud.sample.ai.pollwatch.domain.session.SessionRegistry;
import com.github.spud.sample.ai.pollwatch.domain.watch.SessionWatcher;
import com.github.spud.sample.ai.pollwatch.domain.watch.WatchResult;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * FleetScheduler 调度测试，时钟固定在 09:30
 */
class FleetSchedulerTest {

  private final Clock clock = Clock.fixed(Instant.parse("2024-03-04T09:30:00Z"), ZoneOffset.UTC);

  private SessionWatcher watcher;
  private ExecutorService executor;
  private CancellationToken token;
  private FleetScheduler scheduler;

  @BeforeEach
  void setUp() {
    watcher = mock(SessionWatcher.class);
    executor = Executors.newCachedThreadPool();
    token = new CancellationToken();

    PollWatchProperties properties = new PollWatchProperties();
    properties.setTickInterval(Duration.ofMillis(1));
    scheduler = new FleetScheduler(new SessionRegistry(), watcher, executor, properties, clock);
  }

  @AfterEach
  void tearDown() {
    executor.shutdownNow();
  }

  private static ClassSchedule schedule(String name, String start, String end) {
    return ClassSchedule.builder()
      .name(name)
      .startTime(start != null ? LocalTime.parse(start) : null)
      .endTime(end != null ? LocalTime.parse(end) : null)
      .build();
  }

  private static Map<String, ClassSchedule> schedules(ClassSchedule... items) {
    Map<String, ClassSchedule> map = new LinkedHashMap<>();
    for (ClassSchedule item : items) {
      map.put(item.getName(), item);
    }
    return map;
  }

  @Test
  void tickShouldStartActiveClassesOnce() {
    CountDownLatch release = new CountDownLatch(1);
    when(watcher.watch(any(), any())).thenAnswer(invocation -> {
      release.await(5, TimeUnit.SECONDS);
      return WatchResult.ENDED;
    });
    Map<String, ClassSchedule> schedules = schedules(
      schedule("CS 101", "09:00", "10:15"),
      schedule("HIST 5", "11:00", "12:00"),
      schedule("Office Hours", null, null));

    assertThat(scheduler.tick(schedules, token)).isEqualTo(2);
    assertThat(scheduler.tick(schedules, token)).isZero();
    assertThat(scheduler.isWatching("CS 101")).isTrue();
    assertThat(scheduler.isWatching("HIST 5")).isFalse();

    release.countDown();
    assertThat(scheduler.awaitTermination(Duration.ofSeconds(5))).isTrue();
    assertThat(scheduler.isWatching("CS 101")).isFalse();
    assertThat(scheduler.isWatching("Office Hours")).isFalse();
  }

  @Test
  void unavailableClassShouldNotBeRetried() {
    when(watcher.watch(any(), any())).thenReturn(WatchResult.UNAVAILABLE);
    Map<String, ClassSchedule> schedules = schedules(schedule("CS 101", "09:00", "10:15"));

    assertThat(scheduler.tick(schedules, token)).isEqualTo(1);
    scheduler.awaitTermination(Duration.ofSeconds(5));

    assertThat(scheduler.isUnavailable("CS 101")).isTrue();
    assertThat(scheduler.tick(schedules, token)).isZero();
    verify(watcher, times(1)).watch(any(), any());
  }

  @Test
  void failedWatcherMayBeRestartedOnNextTick() {
    when(watcher.watch(any(), any())).thenReturn(WatchResult.FAILED);
    Map<String, ClassSchedule> schedules = schedules(schedule("CS 101", "09:00", "10:15"));

    assertThat(scheduler.tick(schedules, token)).isEqualTo(1);
    scheduler.awaitTermination(Duration.ofSeconds(5));

    assertThat(scheduler.isUnavailable("CS 101")).isFalse();
    assertThat(scheduler.tick(schedules, token)).isEqualTo(1);
  }

  @Test
  void runShouldReturnOnceCancelled() {
    token.cancel();

    scheduler.run(schedules(schedule("CS 101", "09:00", "10:15")), token);

    verifyNoInteractions(watcher);
  }

  @Test
  void rejectedSubmissionShouldNotRegister() {
    executor.shutdown();

    boolean started = scheduler.startSession(schedule("CS 101", "09:00", "10:15"), token);

    assertThat(started).isFalse();
    assertThat(scheduler.isWatching("CS 101")).isFalse();
  }
}
