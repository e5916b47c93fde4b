package com.github.spud.sample.ai.pollwatch.application.runner;

import com.github.spud.sample.ai.pollwatch.domain.session.CancellationToken;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 监听标准输入，输入 exit / quit / stop 时请求优雅关闭
 */
@Slf4j
@Component
public class ConsoleShutdownListener {

  private static final Set<String> STOP_COMMANDS = Set.of("exit", "quit", "stop");

  /**
   * 在守护线程中监听 System.in
   */
  public Thread start(CancellationToken token) {
    Thread thread = new Thread(() -> listen(System.in, token), "console-listener");
    thread.setDaemon(true);
    thread.start();
    log.info("Type 'exit' and press ENTER to stop all sessions gracefully");
    return thread;
  }

  /**
   * 逐行读取直到收到停止命令、输入结束或已取消
   *
   * @return 是否由停止命令触发了关闭
   */
  public boolean listen(InputStream in, CancellationToken token) {
    try (BufferedReader reader = new BufferedReader(
      new InputStreamReader(in, StandardCharsets.UTF_8))) {
      String line;
      while (!token.isCancelled() && (line = reader.readLine()) != null) {
        if (STOP_COMMANDS.contains(line.trim().toLowerCase(Locale.ROOT))) {
          log.info("Stop command received, shutting down");
          token.cancel();
          return true;
        }
      }
    } catch (IOException e) {
      log.warn("Console listener stopped: {}", e.getMessage());
    }
    return false;
  }
}
