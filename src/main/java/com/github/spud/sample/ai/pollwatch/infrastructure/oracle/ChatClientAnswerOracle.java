package com.github.spud.sample.ai.pollwatch.infrastructure.oracle;

import com.github.spud.sample.ai.pollwatch.domain.oracle.AnswerOracle;
import com.github.spud.sample.ai.pollwatch.domain.oracle.OracleDecision;
import com.github.spud.sample.ai.pollwatch.domain.oracle.protocol.OracleResponseParser;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * 基于 Spring AI ChatClient 的答案服务
 * <p>
 * 要求模型总是给出一个最佳选项，并按是否依赖题外上下文给出 high/medium/low 置信度。
 */
@Slf4j
@Component
public class ChatClientAnswerOracle implements AnswerOracle {

  private static final String DEFAULT_SYSTEM_PROMPT =
    """
      You answer multiple choice poll questions. Always pick your best option, even when the
      question is subjective or needs outside context.
      Confidence: "high" when the question is self-contained and you are very sure;
      "medium" for minor ambiguity; "low" when the question refers to something not shown
      (a board, a diagram, code, a previous slide) or you are guessing.
      Respond with ONLY this JSON:
      {"analysis": {"question_type": "factual|subjective|requires_context", "reasoning": "..."},
       "answer": {"best_option": <integer>, "confidence": "high|medium|low", "explanation": "..."}}
      """;

  private final ChatClient chatClient;
  private final OracleResponseParser responseParser;

  @Value("${app.oracle.system-prompt:}")
  private String systemPrompt;

  public ChatClientAnswerOracle(ChatClient chatClient, OracleResponseParser responseParser) {
    this.chatClient = chatClient;
    this.responseParser = responseParser;
  }

  @Override
  public OracleDecision ask(String question, List<String> options) {
    if (options == null || options.isEmpty()) {
      return OracleDecision.failed("No options to choose from");
    }

    try {
      String content = chatClient.prompt()
        .system(effectiveSystemPrompt())
        .user(buildUserPrompt(question, options))
        .call()
        .content();

      log.debug("Oracle response: {}", truncate(content, 300));
      return responseParser.parseDecision(content, options.size());

    } catch (Exception e) {
      log.error("Oracle call failed: {}", e.getMessage(), e);
      return OracleDecision.failed(e.getMessage() != null ? e.getMessage()
        : e.getClass().getSimpleName());
    }
  }

  String buildUserPrompt(String question, List<String> options) {
    StringBuilder sb = new StringBuilder();
    sb.append("QUESTION: ").append(question).append("\n\nOPTIONS:\n");
    for (int i = 0; i < options.size(); i++) {
      sb.append("  ").append(i + 1).append(". ").append(options.get(i)).append('\n');
    }
    sb.append("\nbest_option must be an integer from 1 to ").append(options.size()).append('.');
    return sb.toString();
  }

  private String effectiveSystemPrompt() {
    return systemPrompt == null || systemPrompt.isBlank() ? DEFAULT_SYSTEM_PROMPT : systemPrompt;
  }

  private String truncate(String text, int maxLen) {
    if (text == null) {
      return null;
    }
    return text.length() > maxLen ? text.substring(0, maxLen) + "..." : text;
  }
}
