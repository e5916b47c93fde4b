package com.github.spud.sample.ai.pollwatch.infrastructure.session;

import com.github.spud.sample.ai.pollwatch.domain.schedule.ClassSchedule;
import com.github.spud.sample.ai.pollwatch.domain.session.PageSession;
import com.github.spud.sample.ai.pollwatch.domain.session.PageSessionProvider;
import com.github.spud.sample.ai.pollwatch.domain.session.SessionUnavailableException;

/**
 * 未注册浏览器驱动时的占位实现：所有课程都视为不可用
 */
public class UnconfiguredPageSessionProvider implements PageSessionProvider {

  @Override
  public PageSession open(ClassSchedule schedule) {
    throw new SessionUnavailableException(
      "No page session provider registered; cannot open a session for " + schedule.getName());
  }
}
