package com.judgmentrag.service.llm;

import java.util.List;

import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.stereotype.Service;

import com.judgmentrag.config.ModelConfig;
import com.judgmentrag.exception.ProviderTransientException;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Service
@RequiredArgsConstructor
public class LegalLlmService {

    static final String RETRY_NAME = "generation";

    private final ChatModel chatModel;
    private final ProviderCallGuard callGuard;
    private final ModelConfig modelConfig;
    
    /**
     * Generate text with system and user messages under the stage's time budget.
     *
     * @throws ProviderTransientException when the call still fails after the bounded retry
     * @throws com.judgmentrag.exception.ConfigurationException when the model is not usable at all
     */
    public String generate(GenerationStage stage, String systemPrompt, String userPrompt, int maxTokens) {
        log.debug("Generating {} response ({} prompt chars)", stage, userPrompt.length());

        Prompt prompt = new Prompt(
                List.<Message>of(new SystemMessage(systemPrompt), new UserMessage(userPrompt)),
                ChatOptions.builder()
                        .maxTokens(maxTokens)
                        .temperature(modelConfig.getTemperature())
                        .build()
        );

        String content = callGuard.call(RETRY_NAME, stage.timeLimiterName(), () -> call(prompt));

        log.debug("{} response generated ({} chars)", stage, content.length());
        return content;
    }

    private String call(Prompt prompt) {
        ChatResponse response = chatModel.call(prompt);
        String content = response != null && response.getResult() != null
                ? response.getResult().getOutput().getText()
                : null;

        if (content == null || content.isBlank()) {
            throw new ProviderTransientException("Generation model returned an empty response");
        }
        return content;
    }
}
