package com.myorg.hitl.drafting.llm;

import com.myorg.hitl.contracts.drafting.DraftRequest;
import com.myorg.hitl.contracts.drafting.RetrievedSnippet;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Instruction contract for the draft generator.
 */
public final class DraftPrompt {

    static final String NO_POLICY = "No specific Policy Provided";
    static final String NO_RECORDS = "No Previous Records Found";

    static final String INSTRUCTIONS = """
            You are a professional customer support agent for a large e-commerce platform.

            Your task:
            - Draft a safe, policy-compliant response for a human support agent to review.
            - Follow the provided policy strictly.
            - Use previous resolved tickets only as reference, not as guarantees.
            - Do NOT make promises outside the policy.
            - Do NOT mention internal processes or timelines unless stated in the policy.
            - Maintain a professional and calm tone at all times.

            --- OUTPUT RULES ---
            Answer with a single JSON object and nothing else:
            {
              "ticket_id": "<the ticket id you are drafting>",
              "reply": "<policy-compliant reply draft for human review>",
              "tone": "<tone of the reply: polite, neutral, apologetic, professional>",
              "confidence": <number between 0 and 1: how confident you are in the draft>,
              "used_policy": "<policy reference used in drafting, or null>",
              "used_reference_ticket_id": "<id of the previously solved ticket used as reference, or null>"
            }

            If no specific policy applies, set "used_policy" to null.
            """;

    private DraftPrompt() {
    }

    public static List<ChatMessage> messages(DraftRequest req) {
        return List.of(SystemMessage.from(INSTRUCTIONS), UserMessage.from(render(req)));
    }

    static String render(DraftRequest req) {
        return """
                Ticket Id:
                %s

                Customer issue:
                %s

                Relevant policy:
                %s

                Previous resolved tickets (for reference only):
                %s
                """.formatted(
                req.ticketId(),
                req.issue(),
                snippets(req.policyContext(), NO_POLICY),
                snippets(req.previousRecordContext(), NO_RECORDS));
    }

    private static String snippets(List<RetrievedSnippet> list, String whenEmpty) {
        if (list.isEmpty()) return whenEmpty;
        StringBuilder sb = new StringBuilder();
        int i = 1;
        for (RetrievedSnippet s : list) {
            sb.append('[').append(i++).append("] ");
            sb.append(String.format(Locale.ROOT, "(similarity %.2f", s.confidence()));
            for (Map.Entry<String, Object> e : s.metadata().entrySet()) {
                sb.append(", ").append(e.getKey()).append('=').append(e.getValue());
            }
            sb.append(") ").append(s.content()).append('\n');
        }
        return sb.toString().stripTrailing();
    }
}
