package com.github.spud.sample.ai.pollwatch.application.config;

import com.github.spud.sample.ai.pollwatch.domain.session.SessionRegistry;
import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

/**
 * 调度核心的基础 Bean
 */
@Configuration
public class PollWatchConfig {

  @Bean
  public Clock clock() {
    return Clock.systemDefaultZone();
  }

  @Bean
  public SessionRegistry sessionRegistry() {
    return new SessionRegistry();
  }

  /**
   * 每个活跃课程一个线程，watcher 之间互不阻塞
   */
  @Bean(name = "watcherExecutor", destroyMethod = "shutdownNow")
  public ExecutorService watcherExecutor() {
    CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("watcher-");
    threadFactory.setDaemon(true);
    return Executors.newCachedThreadPool(threadFactory);
  }
}
