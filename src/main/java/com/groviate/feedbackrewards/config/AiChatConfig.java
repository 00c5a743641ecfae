package com.groviate.feedbackrewards.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Конфигурационный класс для создания бина ChatClient (оценка качества отзывов).
 */
@Configuration
@Slf4j
public class AiChatConfig {

    @Bean
    public ChatClient chatClient(OpenAiChatModel openAiChatModel) {
        log.info("ChatClient для оценки качества отзывов инициализирован");
        return ChatClient.builder(openAiChatModel)
                .build();
    }
}
