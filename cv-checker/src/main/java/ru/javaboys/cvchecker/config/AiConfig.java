package ru.javaboys.cvchecker.config;

import org.springframework.ai.chat.client.ChatClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import ru.javaboys.cvchecker.ai.LlmService;
import ru.javaboys.cvchecker.ai.OpenAiLlmService;

/**
 * Retries of model calls are done by Spring AI's own retry template, see {@code spring.ai.retry.*}.
 */
@Configuration
public class AiConfig {

    @Bean
    public ChatClient chatClient(ChatClient.Builder builder) {
        return builder.build();
    }

    @Bean
    public LlmService llmService(ChatClient chatClient) {
        return new OpenAiLlmService(chatClient);
    }
}
