package com.github.spud.sample.ai.pollwatch.application.config;

import java.time.Duration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * 监控调度配置属性
 */
@Data
@Component
@ConfigurationProperties(prefix = "app.pollwatch")
public class PollWatchProperties {

  /**
   * 课程表 JSON 文件路径
   */
  private String schedulesFile = "data/classes.json";

  /**
   * 调度器检查活跃课程的间隔
   */
  private Duration tickInterval = Duration.ofSeconds(10);

  /**
   * 单个课程页面的轮询间隔
   */
  private Duration watchInterval = Duration.ofMillis(500);

  /**
   * 关闭时等待每个 watcher 结束的最长时间
   */
  private Duration shutdownJoinTimeout = Duration.ofSeconds(5);

  /**
   * 是否监听标准输入的 exit/quit/stop 命令
   */
  private boolean consoleListener = true;

  /**
   * 人工兜底配置
   */
  private Fallback fallback = new Fallback();

  @Data
  public static class Fallback {

    /**
     * 接收兜底消息的联系人，为空时禁用兜底
     */
    private String recipient;

    /**
     * 回复轮询间隔
     */
    private Duration pollInterval = Duration.ofSeconds(2);

    /**
     * 最长等待时间；为空表示不设上限，直到题目关闭或切换
     */
    private Duration maxWait;
  }
}
