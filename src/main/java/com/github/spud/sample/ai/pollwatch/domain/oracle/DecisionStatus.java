package com.github.spud.sample.ai.pollwatch.domain.oracle;

public enum DecisionStatus {
  ANSWERED,
  LOW_CONFIDENCE,
  ERROR
}
