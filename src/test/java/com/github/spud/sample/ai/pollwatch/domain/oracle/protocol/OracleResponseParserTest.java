package com.github.spud.sample.ai.pollwatch.domain.oracle.protocol;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.github.spud.sample.ai.pollwatch.domain.oracle.Confidence;
import com.github.spud.sample.ai.pollwatch.domain.oracle.DecisionStatus;
import com.github.spud.sample.ai.pollwatch.domain.oracle.OracleDecision;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * OracleResponseParser 单元测试
 */
class OracleResponseParserTest {

  private OracleResponseParser parser;

  @BeforeEach
  void setUp() {
    parser = new OracleResponseParser();
  }

  private static String reply(String bestOption, String confidence) {
    return """
      {"analysis": {"question_type": "factual", "reasoning": "Stacks are LIFO"},
       "answer": {"best_option": %s, "confidence": "%s", "explanation": "Option two"}}
      """.formatted(bestOption, confidence);
  }

  @Test
  void shouldParsePureJson() throws Exception {
    OracleAnswerPayload payload = parser.parse(reply("2", "high"));

    assertThat(payload.getAnalysis().getQuestionType()).isEqualTo("factual");
    assertThat(payload.getAnswer().getBestOption().intValue()).isEqualTo(2);
    assertThat(payload.getAnswer().getConfidence()).isEqualTo("high");
  }

  @Test
  void shouldParseJsonWithCodeBlock() {
    String text = "```json\n" + reply("3", "medium") + "```";

    OracleDecision decision = parser.parseDecision(text, 4);

    assertThat(decision).isInstanceOf(OracleDecision.Answered.class);
    OracleDecision.Answered answered = (OracleDecision.Answered) decision;
    assertThat(answered.option()).isEqualTo(3);
    assertThat(answered.confidence()).isEqualTo(Confidence.MEDIUM);
    assertThat(answered.rationale()).isEqualTo("Stacks are LIFO / Option two");
  }

  @Test
  void shouldParseJsonFromMixedText() {
    String text = "Sure! Here is my answer:\n" + reply("1", "high") + "\nGood luck {with the quiz}";

    OracleDecision decision = parser.parseDecision(text, 4);

    assertThat(decision.status()).isEqualTo(DecisionStatus.ANSWERED);
  }

  @Test
  void bracesInsideStringsShouldNotBreakExtraction() {
    String text = """
      {"analysis": {"reasoning": "a set {1, 2} has two elements }"},
       "answer": {"best_option": 2, "confidence": "high", "explanation": "}"}}
      """;

    OracleDecision decision = parser.parseDecision(text, 3);

    assertThat(decision).isInstanceOf(OracleDecision.Answered.class);
  }

  @Test
  void lowConfidenceShouldKeepOption() {
    OracleDecision decision = parser.parseDecision(reply("4", "low"), 4);

    assertThat(decision).isInstanceOf(OracleDecision.LowConfidence.class);
    assertThat(((OracleDecision.LowConfidence) decision).option()).isEqualTo(4);
  }

  @Test
  void unknownConfidenceShouldBeTreatedAsLow() {
    OracleDecision decision = parser.parseDecision(reply("1", "certain-ish"), 4);

    assertThat(decision.status()).isEqualTo(DecisionStatus.LOW_CONFIDENCE);
    assertThat(parser.parseDecision(reply("1", "very high"), 4).status())
      .isEqualTo(DecisionStatus.LOW_CONFIDENCE);
    assertThat(parser.parseDecision(reply("1", "HIGH"), 4).status())
      .isEqualTo(DecisionStatus.ANSWERED);
  }

  @Test
  void outOfRangeOptionShouldFailRegardlessOfConfidence() {
    OracleDecision decision = parser.parseDecision(reply("5", "high"), 4);

    assertThat(decision).isInstanceOf(OracleDecision.Failed.class);
    assertThat(decision.rationale()).contains("Invalid option number");
  }

  @Test
  void zeroAndNonIntegerOptionsShouldFail() {
    assertThat(parser.parseDecision(reply("0", "high"), 4).status())
      .isEqualTo(DecisionStatus.ERROR);
    assertThat(parser.parseDecision(reply("2.5", "high"), 4).status())
      .isEqualTo(DecisionStatus.ERROR);
    assertThat(parser.parseDecision(reply("\"2\"", "high"), 4).status())
      .isEqualTo(DecisionStatus.ERROR);
    assertThat(parser.parseDecision(reply("null", "high"), 4).status())
      .isEqualTo(DecisionStatus.ERROR);
  }

  @Test
  void nonJsonOutputShouldFail() {
    OracleDecision decision = parser.parseDecision("I think the answer is B.", 4);

    assertThat(decision).isInstanceOf(OracleDecision.Failed.class);
    assertThat(decision.rationale()).startsWith("Could not parse JSON");
  }

  @Test
  void emptyOutputShouldThrow() {
    assertThatThrownBy(() -> parser.parse("   "))
      .isInstanceOf(OracleResponseParseException.class)
      .hasMessageContaining("empty");
  }
}
