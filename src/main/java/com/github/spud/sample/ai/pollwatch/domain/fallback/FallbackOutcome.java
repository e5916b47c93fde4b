package com.github.spud.sample.ai.pollwatch.domain.fallback;

import com.github.spud.sample.ai.pollwatch.domain.state.FallbackState;

/**
 * 一次兜底流程的结果
 *
 * @param finalState        终态：ABORTED 或 TIMED_OUT
 * @param overrides         人工改选次数
 * @param lastAppliedOption 最后一次人工选择的选项，没有则为 0
 */
public record FallbackOutcome(FallbackState finalState, int overrides, int lastAppliedOption) {

}
