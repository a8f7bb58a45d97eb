package com.myorg.hitl.drafting.llm;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.myorg.hitl.contracts.core.exception.ConnectivityException;
import com.myorg.hitl.contracts.core.exception.DraftParseException;
import com.myorg.hitl.contracts.core.exception.UpstreamRejectedException;
import com.myorg.hitl.contracts.drafting.DraftRequest;
import com.myorg.hitl.contracts.drafting.DraftResult;
import com.myorg.hitl.contracts.drafting.RetrievedSnippet;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.exception.HttpException;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class LlmDraftGeneratorTest {

    private final ChatModel chatModel = mock(ChatModel.class);
    private final LlmDraftGenerator generator =
            new LlmDraftGenerator(chatModel, new DraftResponseParser(new ObjectMapper()), 0.2);

    @Test
    void draft_emptyContext_promptsWithNoEvidenceMarkers() {
        answer("{\"reply\": \"Thanks for reaching out.\", \"tone\": \"neutral\", \"confidence\": 0.3, \"used_policy\": null}");

        DraftResult r = generator.draft(new DraftRequest("TKT_0007", "Where is my order?", List.of(), List.of()));

        assertEquals("Thanks for reaching out.", r.reply());
        assertNull(r.usedPolicy());

        ChatRequest sent = captureRequest();
        assertEquals(0.2, sent.parameters().temperature().doubleValue());
        assertInstanceOf(SystemMessage.class, sent.messages().get(0));
        String user = ((UserMessage) sent.messages().get(1)).singleText();
        assertTrue(user.contains("TKT_0007"));
        assertTrue(user.contains("Where is my order?"));
        assertTrue(user.contains("No specific Policy Provided"));
        assertTrue(user.contains("No Previous Records Found"));
    }

    @Test
    void draft_rendersRetrievedEvidence() {
        answer("{\"reply\": \"r\", \"tone\": \"polite\", \"confidence\": 0.9, \"used_policy\": \"Refund Policy\", "
                + "\"used_reference_ticket_id\": \"REF_0101\"}");

        generator.draft(new DraftRequest("TKT_0011", "refund late",
                List.of(new RetrievedSnippet("Refunds within 30 days.", Map.of("policy", "Refund Policy"), 0.1)),
                List.of(new RetrievedSnippet("Issue: refund late. Resolution: issued.", Map.of("ticket_id", "REF_0101"), 0.3))));

        String user = ((UserMessage) captureRequest().messages().get(1)).singleText();
        assertTrue(user.contains("Refunds within 30 days."));
        assertTrue(user.contains("ticket_id=REF_0101"));
        assertFalse(user.contains("No specific Policy Provided"));
    }

    @Test
    void draft_serverErrorOrRateLimit_isRetryable() {
        when(chatModel.chat(any(ChatRequest.class))).thenThrow(new HttpException(503, "upstream busy"));
        assertThrows(ConnectivityException.class, this::draftAny);

        reset(chatModel);
        when(chatModel.chat(any(ChatRequest.class))).thenThrow(new HttpException(429, "slow down"));
        assertThrows(ConnectivityException.class, this::draftAny);

        reset(chatModel);
        when(chatModel.chat(any(ChatRequest.class))).thenThrow(new RuntimeException("Read timed out"));
        ConnectivityException ex = assertThrows(ConnectivityException.class, this::draftAny);
        assertTrue(ex.isRetryable());
    }

    @Test
    void draft_clientError_isPermanent() {
        when(chatModel.chat(any(ChatRequest.class))).thenThrow(new HttpException(401, "invalid api key"));
        UpstreamRejectedException auth = assertThrows(UpstreamRejectedException.class, this::draftAny);
        assertEquals("AUTH", auth.getReason());
        assertFalse(auth.isRetryable());

        reset(chatModel);
        when(chatModel.chat(any(ChatRequest.class))).thenThrow(new HttpException(400, "context too long"));
        assertThrows(UpstreamRejectedException.class, this::draftAny);
    }

    @Test
    void draft_outOfRangeConfidence_isParseError() {
        answer("{\"reply\": \"r\", \"tone\": \"polite\", \"confidence\": 1.4}");
        assertThrows(DraftParseException.class, this::draftAny);
    }

    private DraftResult draftAny() {
        return generator.draft(new DraftRequest("TKT_X", "issue", List.of(), List.of()));
    }

    private void answer(String json) {
        when(chatModel.chat(any(ChatRequest.class)))
                .thenReturn(ChatResponse.builder().aiMessage(AiMessage.from(json)).build());
    }

    private ChatRequest captureRequest() {
        ArgumentCaptor<ChatRequest> captor = ArgumentCaptor.forClass(ChatRequest.class);
        verify(chatModel).chat(captor.capture());
        return captor.getValue();
    }
}
