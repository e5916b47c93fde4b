package com.github.spud.sample.ai.pollwatch.support;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * 可手动拨动的时钟
 */
public class MutableClock extends Clock {

  private static final LocalDate DAY = LocalDate.of(2024, 3, 4);

  private volatile Instant instant;

  public MutableClock(LocalTime time) {
    set(time);
  }

  public void set(LocalTime time) {
    this.instant = DAY.atTime(time).toInstant(ZoneOffset.UTC);
  }

  @Override
  public ZoneId getZone() {
    return ZoneOffset.UTC;
  }

  @Override
  public Clock withZone(ZoneId zone) {
    return this;
  }

  @Override
  public Instant instant() {
    return instant;
  }
}
