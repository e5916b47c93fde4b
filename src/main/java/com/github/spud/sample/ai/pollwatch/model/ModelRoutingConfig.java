package com.github.spud.sample.ai.pollwatch.model;

import java.util.Locale;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

/**
 * 模型路由配置 基于配置选择答案服务使用 OpenAI 或 Ollama
 */
@Slf4j
@Configuration
public class ModelRoutingConfig {

  @Value("${app.model.provider:openai}")
  private String modelProvider;

  /**
   * 答案服务使用的 ChatClient
   */
  @Bean
  @Primary
  public ChatClient chatClient(
    @Qualifier("openAiChatModel") ChatModel openAiChatModel,
    @Qualifier("ollamaChatModel") ChatModel ollamaChatModel) {

    ChatModel selectedModel = selectChatModel(openAiChatModel, ollamaChatModel);
    log.info("Using {} as oracle chat model", modelProvider);

    return ChatClient.builder(selectedModel).build();
  }

  /**
   * 根据 provider 选择 ChatModel
   */
  public ChatModel selectChatModel(ChatModel openAiChatModel, ChatModel ollamaChatModel) {
    switch (modelProvider.toLowerCase(Locale.ROOT)) {
      case "ollama":
        return ollamaChatModel;
      default:
        return openAiChatModel;
    }
  }
}
