package com.github.spud.sample.ai.pollwatch.domain.schedule;

import java.time.LocalTime;
import java.util.Map;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * 单个课程的时间窗口与连接参数，加载后不可变
 */
@Value
@Builder
public class ClassSchedule {

  /**
   * 课程名称（唯一标识）
   */
  String name;

  /**
   * 连接参数，对核心逻辑不透明（如 section、经纬度）
   */
  @Singular("connection")
  Map<String, Object> connection;

  /**
   * 开始时间；为空表示始终处于活跃状态
   */
  LocalTime startTime;

  /**
   * 结束时间；为空表示不会自动结束
   */
  LocalTime endTime;

  /**
   * 判断给定时刻是否处于课程时间窗口 [startTime, endTime) 内
   */
  public boolean isActiveAt(LocalTime now) {
    if (startTime == null) {
      return true;
    }
    if (endTime == null) {
      return !now.isBefore(startTime);
    }
    return !now.isBefore(startTime) && now.isBefore(endTime);
  }

  /**
   * 判断课程是否已经结束
   */
  public boolean hasEndedAt(LocalTime now) {
    return endTime != null && !now.isBefore(endTime);
  }

  public Object connectionParameter(String key) {
    return connection.get(key);
  }
}
