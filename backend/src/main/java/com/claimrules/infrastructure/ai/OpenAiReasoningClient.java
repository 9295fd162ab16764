package com.claimrules.infrastructure.ai;

import com.claimrules.domain.extraction.model.ReasoningPrompt;
import com.claimrules.domain.extraction.model.ReasoningResponse;
import com.claimrules.domain.extraction.service.ReasoningClient;
import com.openai.client.OpenAIClient;
import com.openai.models.chat.completions.ChatCompletion;
import com.openai.models.chat.completions.ChatCompletionCreateParams;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Single chat-completion call per prompt. Retries are applied by the caller.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OpenAiReasoningClient implements ReasoningClient {

    private final OpenAIClient openAIClient;
    private final ReasoningUsageTracker usageTracker;

    @Value("${openai.model}")
    private String model;

    @Value("${openai.temperature:0.3}")
    private double temperature;

    @Value("${openai.max-tokens:4000}")
    private int maxTokens;

    @Override
    public ReasoningResponse analyze(ReasoningPrompt prompt) {
        try {
            ChatCompletionCreateParams params = ChatCompletionCreateParams.builder()
                    .model(model)
                    .temperature(temperature)
                    .maxCompletionTokens(maxTokens)
                    .addSystemMessage(prompt.systemPrompt())
                    .addUserMessage(prompt.userMessage())
                    .build();

            ChatCompletion completion = openAIClient.chat().completions().create(params);

            long promptTokens = 0;
            long completionTokens = 0;

            if (completion.usage().isPresent()) {
                var usage = completion.usage().get();
                promptTokens = usage.promptTokens();
                completionTokens = usage.completionTokens();
                log.info("[Reasoning] Token usage [{}] - prompt: {}, completion: {}, total: {}",
                        model, promptTokens, completionTokens, usage.totalTokens());
            }
            usageTracker.recordUsage(promptTokens, completionTokens);

            String content = completion.choices().stream()
                    .findFirst()
                    .flatMap(choice -> choice.message().content())
                    .orElseThrow(() -> new ReasoningCallException("Reasoning response has no content"));

            return new ReasoningResponse(content.trim(), promptTokens, completionTokens);
        } catch (ReasoningCallException e) {
            usageTracker.recordFailure();
            throw e;
        } catch (Exception e) {
            usageTracker.recordFailure();
            log.warn("[Reasoning] Call failed [{}]: {}", model, e.getMessage());
            throw new ReasoningCallException("Reasoning call failed: " + e.getMessage(), e);
        }
    }
}
