package com.github.spud.sample.ai.pollwatch.autoconfigure;

import com.github.spud.sample.ai.pollwatch.domain.decision.OperatorNotifier;
import com.github.spud.sample.ai.pollwatch.domain.fallback.FallbackChannel;
import com.github.spud.sample.ai.pollwatch.domain.session.PageSessionProvider;
import com.github.spud.sample.ai.pollwatch.infrastructure.channel.DisabledFallbackChannel;
import com.github.spud.sample.ai.pollwatch.infrastructure.notify.LoggingOperatorNotifier;
import com.github.spud.sample.ai.pollwatch.infrastructure.session.UnconfiguredPageSessionProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;

/**
 * 外部协作方的默认实现
 * <p>
 * 在用户配置之后处理，应用声明了同类型 Bean 时默认实现不会注册。
 */
@AutoConfiguration
public class CollaboratorDefaultsAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean
  public PageSessionProvider pageSessionProvider() {
    return new UnconfiguredPageSessionProvider();
  }

  @Bean
  @ConditionalOnMissingBean
  public FallbackChannel fallbackChannel() {
    return new DisabledFallbackChannel();
  }

  @Bean
  @ConditionalOnMissingBean
  public OperatorNotifier operatorNotifier() {
    return new LoggingOperatorNotifier();
  }
}
