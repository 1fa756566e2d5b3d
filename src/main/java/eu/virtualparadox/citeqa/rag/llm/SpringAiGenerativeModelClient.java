package eu.virtualparadox.citeqa.rag.llm;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.metadata.Usage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.stereotype.Service;

/**
 * {@link GenerativeModelClient} backed by the Spring AI {@link ChatModel}.
 * The model of each call is selected through the chat options.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SpringAiGenerativeModelClient implements GenerativeModelClient {

    private final ChatModel chatModel;

    @Override
    public ModelResponse generate(final GenerationRequest request) {
        final ChatOptions options = ChatOptions.builder()
                .model(request.model())
                .temperature(request.temperature())
                .maxTokens(request.maxOutputTokens())
                .build();

        final Prompt prompt = new Prompt(new UserMessage(request.prompt()), options);
        log.debug(" !!! Prompt for {} ({}):\n{}", request.model(), request.operation(), request.prompt());

        final ChatResponse response = chatModel.call(prompt);
        if (response == null || response.getResult() == null || response.getResult().getOutput() == null) {
            throw new IllegalStateException("Model " + request.model() + " returned no result");
        }

        final String text = response.getResult().getOutput().getText();
        if (text == null || text.isBlank()) {
            throw new IllegalStateException("Model " + request.model() + " returned an empty answer");
        }

        return new ModelResponse(text, toTokenUsage(response));
    }

    private TokenUsage toTokenUsage(final ChatResponse response) {
        if (response.getMetadata() == null) {
            return TokenUsage.NONE;
        }
        final Usage usage = response.getMetadata().getUsage();
        if (usage == null) {
            return TokenUsage.NONE;
        }
        return TokenUsage.of(usage.getPromptTokens(), usage.getCompletionTokens(), usage.getTotalTokens());
    }
}
