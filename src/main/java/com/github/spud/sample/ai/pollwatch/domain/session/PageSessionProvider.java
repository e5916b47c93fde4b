package com.github.spud.sample.ai.pollwatch.domain.session;

import com.github.spud.sample.ai.pollwatch.domain.schedule.ClassSchedule;

/**
 * 为课程打开页面会话
 */
public interface PageSessionProvider {

  /**
   * @throws SessionUnavailableException 没有可用的已登录会话
   */
  PageSession open(ClassSchedule schedule);
}
