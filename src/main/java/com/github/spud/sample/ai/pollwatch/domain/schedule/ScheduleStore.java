package com.github.spud.sample.ai.pollwatch.domain.schedule;

import java.util.Map;

/**
 * 课程表存储
 */
public interface ScheduleStore {

  /**
   * 加载所有已配置的课程
   *
   * @return 课程名 -> 课程表，保持配置顺序
   * @throws ConfigException 存储缺失或格式错误
   */
  Map<String, ClassSchedule> loadSchedules();
}
