package com.github.spud.sample.ai.pollwatch.domain.session;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.github.spud.sample.ai.pollwatch.domain.schedule.ClassSchedule;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * SessionRegistry 单元测试
 */
class SessionRegistryTest {

  private final ClassSchedule schedule = ClassSchedule.builder().name("CS 101").build();

  private SessionRegistry registry;

  @BeforeEach
  void setUp() {
    registry = new SessionRegistry();
  }

  @Test
  void shouldRegisterOncePerClass() {
    AtomicInteger launches = new AtomicInteger();

    Optional<SessionState> first = registry.register(schedule, state -> {
      launches.incrementAndGet();
      return new CompletableFuture<>();
    });
    Optional<SessionState> second = registry.register(schedule, state -> {
      launches.incrementAndGet();
      return new CompletableFuture<>();
    });

    assertThat(first).isPresent();
    assertThat(second).isEmpty();
    assertThat(launches).hasValue(1);
    assertThat(first.get().isAlive()).isTrue();
  }

  @Test
  void concurrentRegistrationShouldLaunchOneWatcher() throws Exception {
    int threads = 8;
    AtomicInteger launches = new AtomicInteger();
    CountDownLatch ready = new CountDownLatch(1);
    ExecutorService pool = Executors.newFixedThreadPool(threads);
    try {
      for (int i = 0; i < threads; i++) {
        pool.submit(() -> {
          ready.await();
          return registry.register(schedule, state -> {
            launches.incrementAndGet();
            return new CompletableFuture<>();
          });
        });
      }
      ready.countDown();
    } finally {
      pool.shutdown();
      assertThat(pool.awaitTermination(5, TimeUnit.SECONDS)).isTrue();
    }

    assertThat(launches).hasValue(1);
    assertThat(registry.size()).isEqualTo(1);
  }

  @Test
  void deregisterShouldOnlyRemoveSameInstance() {
    SessionState state = registry.register(schedule,
      s -> CompletableFuture.completedFuture(null)).orElseThrow();

    assertThat(state.isAlive()).isFalse();
    assertThat(registry.deregister(new SessionState(schedule))).isFalse();
    assertThat(registry.isRegistered("CS 101")).isTrue();

    assertThat(registry.deregister(state)).isTrue();
    assertThat(registry.isRegistered("CS 101")).isFalse();
  }

  @Test
  void failedLaunchShouldNotLeaveRegistration() {
    assertThatThrownBy(() -> registry.register(schedule, state -> {
      throw new IllegalStateException("pool closed");
    })).isInstanceOf(IllegalStateException.class);

    assertThat(registry.find("CS 101")).isEmpty();
  }
}
