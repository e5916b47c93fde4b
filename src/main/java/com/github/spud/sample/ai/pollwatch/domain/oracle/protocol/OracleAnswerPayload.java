package com.github.spud.sample.ai.pollwatch.domain.oracle.protocol;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 答案服务回复的 JSON 结构
 * <p>
 * { "analysis": { "question_type": "...", "reasoning": "..." },
 *   "answer": { "best_option": 2, "confidence": "high|medium|low", "explanation": "..." } }
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class OracleAnswerPayload {

  private Analysis analysis;

  private Answer answer;

  @Data
  @NoArgsConstructor
  @AllArgsConstructor
  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class Analysis {

    /**
     * factual | subjective | requires_context
     */
    @JsonProperty("question_type")
    private String questionType;

    private String reasoning;
  }

  @Data
  @NoArgsConstructor
  @AllArgsConstructor
  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class Answer {

    /**
     * 原始 JSON 值，保留类型以便拒绝字符串、小数等非整数
     */
    @JsonProperty("best_option")
    private JsonNode bestOption;

    private String confidence;

    private String explanation;
  }
}
