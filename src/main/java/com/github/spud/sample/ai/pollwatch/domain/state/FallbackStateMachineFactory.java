package com.github.spud.sample.ai.pollwatch.domain.state;

import java.util.EnumSet;
import org.springframework.statemachine.StateMachine;
import org.springframework.statemachine.config.StateMachineBuilder;
import org.springframework.stereotype.Component;

/**
 * 人工兜底状态机工厂，每次兜底创建一个独立实例
 * <pre>
 * 状态流转:
 *   IDLE --(SEND_OK)--> MESSAGE_SENT
 *   IDLE --(SEND_FAILED)--> ABORTED
 *   MESSAGE_SENT --(LISTEN)--> LISTENING
 *   MESSAGE_SENT --(CHANNEL_FAILED | SHUTDOWN)--> ABORTED
 *   LISTENING --(REPLY_APPLIED)--> OVERRIDDEN
 *   OVERRIDDEN --(RESUME)--> LISTENING
 *   LISTENING --(CONTENT_CHANGED | CHANNEL_FAILED | SHUTDOWN)--> ABORTED
 *   LISTENING --(DEADLINE_PASSED)--> TIMED_OUT
 * </pre>
 */
@Component
public class FallbackStateMachineFactory {

  public StateMachine<FallbackState, FallbackEvent> create(String machineId) {
    try {
      StateMachineBuilder.Builder<FallbackState, FallbackEvent> builder =
        StateMachineBuilder.builder();

      builder.configureConfiguration()
        .withConfiguration()
        .machineId(machineId)
        .autoStartup(false);

      builder.configureStates()
        .withStates()
        .initial(FallbackState.IDLE)
        .states(EnumSet.allOf(FallbackState.class))
        .end(FallbackState.ABORTED)
        .end(FallbackState.TIMED_OUT);

      builder.configureTransitions()
        // IDLE -> MESSAGE_SENT / ABORTED
        .withExternal()
        .source(FallbackState.IDLE).target(FallbackState.MESSAGE_SENT)
        .event(FallbackEvent.SEND_OK)
        .and()
        .withExternal()
        .source(FallbackState.IDLE).target(FallbackState.ABORTED)
        .event(FallbackEvent.SEND_FAILED)
        .and()

        // MESSAGE_SENT -> LISTENING
        .withExternal()
        .source(FallbackState.MESSAGE_SENT).target(FallbackState.LISTENING)
        .event(FallbackEvent.LISTEN)
        .and()
        .withExternal()
        .source(FallbackState.MESSAGE_SENT).target(FallbackState.ABORTED)
        .event(FallbackEvent.CHANNEL_FAILED)
        .and()
        .withExternal()
        .source(FallbackState.MESSAGE_SENT).target(FallbackState.ABORTED)
        .event(FallbackEvent.SHUTDOWN)
        .and()

        // LISTENING <-> OVERRIDDEN，人工可以多次改选
        .withExternal()
        .source(FallbackState.LISTENING).target(FallbackState.OVERRIDDEN)
        .event(FallbackEvent.REPLY_APPLIED)
        .and()
        .withExternal()
        .source(FallbackState.OVERRIDDEN).target(FallbackState.LISTENING)
        .event(FallbackEvent.RESUME)
        .and()

        // 终止条件
        .withExternal()
        .source(FallbackState.LISTENING).target(FallbackState.ABORTED)
        .event(FallbackEvent.CONTENT_CHANGED)
        .and()
        .withExternal()
        .source(FallbackState.LISTENING).target(FallbackState.ABORTED)
        .event(FallbackEvent.CHANNEL_FAILED)
        .and()
        .withExternal()
        .source(FallbackState.LISTENING).target(FallbackState.ABORTED)
        .event(FallbackEvent.SHUTDOWN)
        .and()
        .withExternal()
        .source(FallbackState.LISTENING).target(FallbackState.TIMED_OUT)
        .event(FallbackEvent.DEADLINE_PASSED);

      return builder.build();
    } catch (Exception e) {
      throw new IllegalStateException("Failed to build fallback state machine: " + machineId, e);
    }
  }
}
