package com.myorg.hitl.drafting.llm;

import com.myorg.hitl.contracts.core.exception.ConnectivityException;
import com.myorg.hitl.contracts.core.exception.HitlException;
import com.myorg.hitl.drafting.Rephraser;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import lombok.RequiredArgsConstructor;

import java.util.List;

@RequiredArgsConstructor
public class LlmRephraser implements Rephraser {

    static final String TEMPLATE = """
            Your task is to rephrase the given text to make it more polite and professional.
            Please ensure that the meaning of the text remains unchanged.
            Text: %s
            """;

    private final ChatModel chatModel;

    @Override
    public String rephrase(String text, double temperature) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("text must not be blank");
        }
        if (Double.isNaN(temperature) || temperature < 0.0 || temperature > 1.0) {
            throw new IllegalArgumentException("temperature must be in [0,1], got " + temperature);
        }

        ChatResponse response;
        try {
            response = chatModel.chat(ChatRequest.builder()
                    .messages(List.of(UserMessage.from(TEMPLATE.formatted(text))))
                    .temperature(temperature)
                    .build());
        } catch (HitlException e) {
            throw e;
        } catch (RuntimeException e) {
            throw CompletionErrorClassifier.classify("rephrase", e);
        }

        String out = response == null || response.aiMessage() == null ? null : response.aiMessage().text();
        if (out == null || out.isBlank()) {
            throw new ConnectivityException("rephrase returned no text");
        }
        return out.trim();
    }
}
