package com.github.spud.sample.ai.pollwatch.application.runner;

import static org.assertj.core.api.Assertions.assertThat;

import com.github.spud.sample.ai.pollwatch.domain.session.CancellationToken;
import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

/**
 * ConsoleShutdownListener 单元测试
 */
class ConsoleShutdownListenerTest {

  private final ConsoleShutdownListener listener = new ConsoleShutdownListener();

  private static ByteArrayInputStream input(String text) {
    return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
  }

  @Test
  void stopCommandShouldCancelToken() {
    CancellationToken token = new CancellationToken();

    assertThat(listener.listen(input("hello\n  QUIT \n"), token)).isTrue();
    assertThat(token.isCancelled()).isTrue();
  }

  @Test
  void endOfInputShouldNotCancel() {
    CancellationToken token = new CancellationToken();

    assertThat(listener.listen(input("status\nexiting soon\n"), token)).isFalse();
    assertThat(token.isCancelled()).isFalse();
  }
}
