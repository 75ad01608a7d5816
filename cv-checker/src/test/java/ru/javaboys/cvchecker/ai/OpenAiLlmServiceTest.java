package ru.javaboys.cvchecker.ai;

import org.junit.jupiter.api.Test;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.prompt.Prompt;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.RETURNS_DEEP_STUBS;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class OpenAiLlmServiceTest {

    private final ChatClient chatClient = mock(ChatClient.class, RETURNS_DEEP_STUBS);
    private final OpenAiLlmService service = new OpenAiLlmService(chatClient);

    @Test
    void complete_shouldReturnModelContent() {
        when(chatClient.prompt(any(Prompt.class)).call().content()).thenReturn("{\"ok\":true}");

        assertThat(service.complete("system", "user")).isEqualTo("{\"ok\":true}");
    }

    @Test
    void complete_shouldWrapClientFailure() {
        when(chatClient.prompt(any(Prompt.class))).thenThrow(new IllegalStateException("401 Unauthorized"));

        assertThatThrownBy(() -> service.complete("system", "user"))
                .isInstanceOf(LlmException.class)
                .hasMessageContaining("401 Unauthorized")
                .hasCauseInstanceOf(IllegalStateException.class);
    }

    @Test
    void complete_shouldTreatBlankContentAsFailure() {
        when(chatClient.prompt(any(Prompt.class)).call().content()).thenReturn(" ");

        assertThatThrownBy(() -> service.complete("system", "user"))
                .isInstanceOf(LlmException.class)
                .hasMessageContaining("empty content");
    }
}
