package eu.virtualparadox.citeqa.rag.llm;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.metadata.ChatResponseMetadata;
import org.springframework.ai.chat.metadata.DefaultUsage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.model.Generation;
import org.springframework.ai.chat.prompt.Prompt;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link SpringAiGenerativeModelClient}.
 */
class SpringAiGenerativeModelClientTest {

    private ChatModel chatModel;
    private SpringAiGenerativeModelClient client;

    @BeforeEach
    void setUp() {
        chatModel = mock(ChatModel.class);
        client = new SpringAiGenerativeModelClient(chatModel);
    }

    @Test
    @DisplayName("Request options and usage are mapped")
    void mapsRequestAndUsage() {
        final ChatResponse response = ChatResponse.builder()
                .generations(List.of(new Generation(new AssistantMessage("AML is..."))))
                .metadata(ChatResponseMetadata.builder().usage(new DefaultUsage(120, 30)).build())
                .build();
        when(chatModel.call(any(Prompt.class))).thenReturn(response);

        final ModelResponse result = client.generate(
                new GenerationRequest("llama3.1:8b", "What is AML?", 0.15, 1536, "chat_answer", null));

        assertThat(result.text()).isEqualTo("AML is...");
        assertThat(result.usage()).isEqualTo(new TokenUsage(120, 30, 150));

        final ArgumentCaptor<Prompt> captor = ArgumentCaptor.forClass(Prompt.class);
        verify(chatModel).call(captor.capture());
        assertThat(captor.getValue().getOptions().getModel()).isEqualTo("llama3.1:8b");
        assertThat(captor.getValue().getOptions().getTemperature()).isEqualTo(0.15);
        assertThat(captor.getValue().getOptions().getMaxTokens()).isEqualTo(1536);
        assertThat(captor.getValue().getContents()).isEqualTo("What is AML?");
    }

    @Test
    @DisplayName("Empty model output is a failure")
    void emptyOutputFails() {
        final ChatResponse response = ChatResponse.builder()
                .generations(List.of(new Generation(new AssistantMessage(" "))))
                .build();
        when(chatModel.call(any(Prompt.class))).thenReturn(response);

        assertThatThrownBy(() -> client.generate(new GenerationRequest("m", "p", 0.2, 10, "chat_answer", null)))
                .isInstanceOf(IllegalStateException.class);
    }
}
