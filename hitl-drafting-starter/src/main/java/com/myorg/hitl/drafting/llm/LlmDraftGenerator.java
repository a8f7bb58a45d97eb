package com.myorg.hitl.drafting.llm;

import com.myorg.hitl.contracts.core.exception.DraftParseException;
import com.myorg.hitl.contracts.core.exception.HitlException;
import com.myorg.hitl.contracts.drafting.DraftRequest;
import com.myorg.hitl.contracts.drafting.DraftResult;
import com.myorg.hitl.drafting.DraftGenerator;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RequiredArgsConstructor
public class LlmDraftGenerator implements DraftGenerator {

    private final ChatModel chatModel;
    private final DraftResponseParser parser;
    private final double temperature;

    @Override
    public DraftResult draft(DraftRequest request) {
        ChatResponse response;
        try {
            response = chatModel.chat(ChatRequest.builder()
                    .messages(DraftPrompt.messages(request))
                    .temperature(temperature)
                    .build());
        } catch (HitlException e) {
            throw e;
        } catch (RuntimeException e) {
            throw CompletionErrorClassifier.classify("draft completion", e);
        }

        if (response == null || response.aiMessage() == null) {
            throw new DraftParseException("no completion returned for ticket " + request.ticketId());
        }
        DraftResult result = parser.parse(request.ticketId(), response.aiMessage().text());
        log.debug("Drafted ticket {} confidence={} policy={}", request.ticketId(), result.confidence(), result.usedPolicy());
        return result;
    }
}
