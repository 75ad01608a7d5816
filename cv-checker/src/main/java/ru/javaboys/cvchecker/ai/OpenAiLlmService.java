package ru.javaboys.cvchecker.ai;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.prompt.Prompt;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@RequiredArgsConstructor
@Slf4j
public class OpenAiLlmService implements LlmService {

    private final ChatClient chatClient;

    @Override
    public String complete(String systemInstructions, String userPrompt) {
        String conversationId = "llm-" + UUID.randomUUID();
        List<Message> promptMessages = new ArrayList<>();
        promptMessages.add(new SystemMessage(systemInstructions));
        promptMessages.add(new UserMessage(userPrompt));

        log.debug("LLM call {} (prompt length {})", conversationId, userPrompt.length());
        String fullResponse;
        try {
            fullResponse = chatClient
                    .prompt(new Prompt(promptMessages))
                    .call()
                    .content();
        } catch (RuntimeException e) {
            throw new LlmException("LLM call " + conversationId + " failed: " + e.getMessage(), e);
        }

        if (fullResponse == null || fullResponse.isBlank()) {
            throw new LlmException("LLM call " + conversationId + " returned empty content");
        }
        log.debug("LLM call {} answered {} chars", conversationId, fullResponse.length());
        return fullResponse;
    }
}
