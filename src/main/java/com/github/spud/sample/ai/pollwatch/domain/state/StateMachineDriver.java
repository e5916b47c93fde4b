package com.github.spud.sample.ai.pollwatch.domain.state;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.Message;
import org.springframework.messaging.support.MessageBuilder;
import org.springframework.statemachine.StateMachine;
import org.springframework.statemachine.StateMachineEventResult.ResultType;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * 兜底状态机的同步包装
 * <p>
 * FallbackMediator 在 watcher 线程上串行推进状态机，这里把响应式 API 阻塞为普通调用。
 * 每次兜底使用独立实例，用完必须 {@link #stop} 。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StateMachineDriver {

  private final FallbackStateMachineFactory stateMachineFactory;

  public StateMachine<FallbackState, FallbackEvent> create(String machineId) {
    StateMachine<FallbackState, FallbackEvent> sm = stateMachineFactory.create(machineId);
    sm.startReactively().block();
    log.debug("[{}] Fallback machine started in {}", machineId, getCurrentState(sm));
    return sm;
  }

  public FallbackState getCurrentState(StateMachine<FallbackState, FallbackEvent> sm) {
    return sm.getState().getId();
  }

  /**
   * 投递事件并阻塞到所有区域处理完毕
   *
   * @return 至少一个区域接受了事件；非法转移返回 false，状态不变
   */
  public boolean sendEvent(StateMachine<FallbackState, FallbackEvent> sm, FallbackEvent event) {
    FallbackState before = getCurrentState(sm);
    Message<FallbackEvent> message = MessageBuilder.withPayload(event).build();

    Boolean accepted = sm.sendEvent(Mono.just(message))
      .map(result -> result.getResultType() == ResultType.ACCEPTED)
      .reduce(Boolean.FALSE, Boolean::logicalOr)
      .block();

    if (Boolean.TRUE.equals(accepted)) {
      log.debug("[{}] {} --{}--> {}", sm.getId(), before, event, getCurrentState(sm));
      return true;
    }
    log.warn("[{}] No transition for {} in {}", sm.getId(), event, before);
    return false;
  }

  public void stop(StateMachine<FallbackState, FallbackEvent> sm) {
    sm.stopReactively().block();
  }

  public boolean isInFinalState(StateMachine<FallbackState, FallbackEvent> sm) {
    return FallbackState.isFinal(getCurrentState(sm));
  }
}
