package com.myorg.hitl.drafting.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.myorg.hitl.contracts.core.exception.DraftParseException;
import com.myorg.hitl.contracts.drafting.DraftResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.Locale;
import java.util.Set;

/**
 * Validates the completion's JSON against the draft schema.
 */
@Slf4j
@RequiredArgsConstructor
public class DraftResponseParser {

    /** Values models emit when they mean "nothing". */
    private static final Set<String> ABSENT = Set.of("", "null", "n/a", "none");

    private final ObjectMapper mapper;

    public DraftResult parse(String ticketId, String raw) {
        if (raw == null || raw.isBlank()) {
            throw new DraftParseException("empty completion for ticket " + ticketId);
        }

        JsonNode root;
        try {
            root = mapper.readTree(extractObject(raw));
        } catch (JsonProcessingException e) {
            throw new DraftParseException("completion for ticket " + ticketId + " is not valid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new DraftParseException("completion for ticket " + ticketId + " is not a JSON object");
        }

        String reply = requiredText(root, "reply", ticketId);
        String tone = requiredText(root, "tone", ticketId);
        double confidence = confidence(root, ticketId);
        String usedPolicy = optionalText(root, "used_policy", ticketId);
        String usedRef = optionalText(root, "used_reference_ticket_id", ticketId);

        String echoed = optionalText(root, "ticket_id", ticketId);
        if (echoed != null && !echoed.equals(ticketId)) {
            log.warn("Draft for ticket {} echoed ticket id {}; keeping {}", ticketId, echoed, ticketId);
        }

        return new DraftResult(ticketId, reply, tone, confidence, usedPolicy, usedRef);
    }

    /** Tolerates markdown fences and chatter around the object. */
    static String extractObject(String raw) {
        int start = raw.indexOf('{');
        int end = raw.lastIndexOf('}');
        if (start < 0 || end < start) return raw.trim();
        return raw.substring(start, end + 1);
    }

    private static String requiredText(JsonNode root, String field, String ticketId) {
        String v = optionalText(root, field, ticketId);
        if (v == null) {
            throw new DraftParseException("draft for ticket " + ticketId + " is missing '" + field + "'");
        }
        return v;
    }

    private static String optionalText(JsonNode root, String field, String ticketId) {
        JsonNode n = root.get(field);
        if (n == null || n.isNull() || n.isMissingNode()) return null;
        if (!n.isValueNode()) {
            throw new DraftParseException("draft for ticket " + ticketId + ": '" + field + "' must be a string");
        }
        String s = n.asText().trim();
        return ABSENT.contains(s.toLowerCase(Locale.ROOT)) ? null : s;
    }

    private static double confidence(JsonNode root, String ticketId) {
        JsonNode n = root.get("confidence");
        double c;
        if (n != null && n.isNumber()) {
            c = n.asDouble();
        } else if (n != null && n.isTextual()) {
            try {
                c = Double.parseDouble(n.asText().trim());
            } catch (NumberFormatException e) {
                throw new DraftParseException("draft for ticket " + ticketId + ": confidence '" + n.asText() + "' is not a number", e);
            }
        } else {
            throw new DraftParseException("draft for ticket " + ticketId + " is missing 'confidence'");
        }
        if (Double.isNaN(c) || c < 0.0 || c > 1.0) {
            throw new DraftParseException("draft for ticket " + ticketId + ": confidence " + c + " outside [0,1]");
        }
        return c;
    }
}
