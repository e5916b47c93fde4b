package com.github.spud.sample.ai.pollwatch.domain.oracle.protocol;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.spud.sample.ai.pollwatch.domain.oracle.Confidence;
import com.github.spud.sample.ai.pollwatch.domain.oracle.OracleDecision;
import com.github.spud.sample.ai.pollwatch.infrastructure.util.JsonUtils;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * 答案服务回复解析器
 * <p>
 * 支持：去除 markdown 代码块包裹、从混合文本中提取第一个括号配平的 JSON 对象、校验选项号。
 */
@Slf4j
@Component
public class OracleResponseParser {

  private static final Pattern CODE_BLOCK_PATTERN =
    Pattern.compile("```(?:json)?\\s*([\\s\\S]*?)```", Pattern.CASE_INSENSITIVE);

  /**
   * 解析模型原始输出
   *
   * @throws OracleResponseParseException 找不到 JSON 或反序列化失败
   */
  public OracleAnswerPayload parse(String modelText) throws OracleResponseParseException {
    if (modelText == null || modelText.isBlank()) {
      throw new OracleResponseParseException("Model output is empty or null", modelText);
    }

    String cleaned = removeCodeBlockWrapper(modelText.trim());
    String jsonText = extractFirstJsonObject(cleaned);
    if (jsonText == null) {
      throw new OracleResponseParseException("No JSON object found in model output", modelText);
    }

    try {
      JsonNode tree = JsonUtils.readTree(jsonText);
      return JsonUtils.convert(tree, OracleAnswerPayload.class);
    } catch (Exception e) {
      throw new OracleResponseParseException(
        "JSON deserialization failed: " + e.getMessage(), jsonText, e);
    }
  }

  /**
   * 将解析结果转换为决定
   * <p>
   * 选项号必须是 [1, optionCount] 内的整数，否则不论置信度如何都返回 Failed。
   */
  public OracleDecision toDecision(OracleAnswerPayload payload, int optionCount) {
    OracleAnswerPayload.Answer answer = payload.getAnswer();
    JsonNode bestOption = answer != null ? answer.getBestOption() : null;

    if (bestOption == null || !bestOption.isIntegralNumber() || !bestOption.canConvertToInt()) {
      return OracleDecision.failed("Invalid option number: " + describe(bestOption));
    }
    int option = bestOption.intValue();
    if (option < 1 || option > optionCount) {
      return OracleDecision.failed("Invalid option number: " + option);
    }

    Confidence confidence = Confidence.fromLabel(answer.getConfidence());
    return OracleDecision.of(option, confidence, rationaleOf(payload));
  }

  /**
   * 解析并转换，任何解析失败都规整为 Failed
   */
  public OracleDecision parseDecision(String modelText, int optionCount) {
    try {
      return toDecision(parse(modelText), optionCount);
    } catch (OracleResponseParseException e) {
      log.warn("Failed to parse oracle response: {} - Original text: {}",
        e.getReason(), truncate(e.getOriginalText(), 200));
      return OracleDecision.failed("Could not parse JSON: " + e.getReason());
    }
  }

  private String rationaleOf(OracleAnswerPayload payload) {
    OracleAnswerPayload.Analysis analysis = payload.getAnalysis();
    String reasoning = analysis != null ? analysis.getReasoning() : null;
    String explanation = payload.getAnswer().getExplanation();
    if (StringUtils.hasText(reasoning) && StringUtils.hasText(explanation)) {
      return reasoning + " / " + explanation;
    }
    return StringUtils.hasText(reasoning) ? reasoning
      : (explanation != null ? explanation : "");
  }

  private String removeCodeBlockWrapper(String text) {
    Matcher matcher = CODE_BLOCK_PATTERN.matcher(text);
    if (matcher.find()) {
      return matcher.group(1).trim();
    }
    return text;
  }

  /**
   * 按括号深度提取第一个完整 JSON 对象，忽略字符串字面量中的括号
   */
  private String extractFirstJsonObject(String text) {
    int start = text.indexOf('{');
    if (start < 0) {
      return null;
    }

    int depth = 0;
    boolean inString = false;
    boolean escaped = false;
    for (int i = start; i < text.length(); i++) {
      char c = text.charAt(i);
      if (inString) {
        if (escaped) {
          escaped = false;
        } else if (c == '\\') {
          escaped = true;
        } else if (c == '"') {
          inString = false;
        }
        continue;
      }
      if (c == '"') {
        inString = true;
      } else if (c == '{') {
        depth++;
      } else if (c == '}') {
        depth--;
        if (depth == 0) {
          return text.substring(start, i + 1);
        }
      }
    }
    return null;
  }

  private String describe(JsonNode node) {
    return node == null || node.isNull() ? "null" : node.toString();
  }

  private String truncate(String text, int maxLen) {
    if (text == null) {
      return null;
    }
    return text.length() > maxLen ? text.substring(0, maxLen) + "..." : text;
  }
}
