package com.myorg.hitl.store.jdbc;

import com.myorg.hitl.contracts.ticket.DraftingState;
import com.myorg.hitl.contracts.ticket.Ticket;
import com.myorg.hitl.contracts.ticket.TicketMetadata;
import com.myorg.hitl.contracts.ticket.TicketStage;
import org.springframework.jdbc.core.RowMapper;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.regex.Pattern;

/**
 * Column layout shared by the four stage tables.
 */
final class TicketRows {

    static final String COLUMNS = """
            ticket_id, issue, category, priority, created_at, closed_at, is_drafted, tone,
            escalation_reason, confidence, used_policy, used_reference_ticket_id,
            ai_drafted_response, resolution, manually_handled,
            claim_owner, lease_until, draft_attempts, needs_attention, last_error""";

    static final String PLACEHOLDERS = "?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?";

    static final RowMapper<Ticket> MAPPER = TicketRows::map;

    private static final int MAX_ERROR = 2000;

    /** Flyway placeholder used for table names in {@code db/migration}. */
    static final String PREFIX_PLACEHOLDER = "hitl_table_prefix";

    private static final Pattern PREFIX_PATTERN = Pattern.compile("[a-z][a-z0-9_]{0,30}");

    private TicketRows() {
    }

    static String table(HitlStoreProperties props, TicketStage stage) {
        return checkedPrefix(props) + "_" + stage.storeName();
    }

    static String registry(HitlStoreProperties props) {
        return checkedPrefix(props) + "_ticket_registry";
    }

    /** The prefix is spliced into SQL, so only plain lower-case identifiers are accepted. */
    static String checkedPrefix(HitlStoreProperties props) {
        String prefix = props.getTablePrefix();
        if (prefix == null || !PREFIX_PATTERN.matcher(prefix).matches()) {
            throw new IllegalArgumentException("hitl.store.table-prefix must match " + PREFIX_PATTERN + ": " + prefix);
        }
        return prefix;
    }

    static Object[] values(Ticket t) {
        TicketMetadata m = t.getMetadata();
        DraftingState d = t.getDrafting();
        return new Object[] {
                t.getTicketId(),
                t.getIssue(),
                m.getCategory(),
                m.getPriority(),
                ts(m.getCreatedAt()),
                ts(m.getClosedAt()),
                m.isDrafted(),
                m.getTone(),
                m.getEscalationReason(),
                t.getConfidence(),
                t.getUsedPolicy(),
                t.getUsedReferenceTicketId(),
                t.getAiDraftedResponse(),
                t.getResolution(),
                m.isManuallyHandled(),
                d == null ? null : d.claimOwner(),
                d == null ? null : ts(d.leaseUntil()),
                d == null ? 0 : d.attempts(),
                d != null && d.needsAttention(),
                d == null ? null : truncate(d.lastError())
        };
    }

    static String truncate(String error) {
        if (error == null) return null;
        return error.length() > MAX_ERROR ? error.substring(0, MAX_ERROR) : error;
    }

    static Timestamp ts(Instant i) {
        return i == null ? null : Timestamp.from(i);
    }

    private static Instant instant(Timestamp ts) {
        return ts == null ? null : ts.toInstant();
    }

    private static Ticket map(ResultSet rs, int rowNum) throws SQLException {
        TicketMetadata meta = TicketMetadata.builder()
                .category(rs.getString("category"))
                .priority(rs.getString("priority"))
                .createdAt(instant(rs.getTimestamp("created_at")))
                .closedAt(instant(rs.getTimestamp("closed_at")))
                .drafted(rs.getBoolean("is_drafted"))
                .tone(rs.getString("tone"))
                .escalationReason(rs.getString("escalation_reason"))
                .manuallyHandled(rs.getBoolean("manually_handled"))
                .build();

        double c = rs.getDouble("confidence");
        Double confidence = rs.wasNull() ? null : c;

        String owner = rs.getString("claim_owner");
        Instant leaseUntil = instant(rs.getTimestamp("lease_until"));
        int attempts = rs.getInt("draft_attempts");
        boolean needsAttention = rs.getBoolean("needs_attention");
        String lastError = rs.getString("last_error");
        DraftingState drafting = null;
        if (owner != null || leaseUntil != null || attempts > 0 || needsAttention || lastError != null) {
            drafting = new DraftingState(owner, leaseUntil, attempts, needsAttention, lastError);
        }

        return Ticket.builder()
                .ticketId(rs.getString("ticket_id"))
                .issue(rs.getString("issue"))
                .metadata(meta)
                .confidence(confidence)
                .usedPolicy(rs.getString("used_policy"))
                .usedReferenceTicketId(rs.getString("used_reference_ticket_id"))
                .aiDraftedResponse(rs.getString("ai_drafted_response"))
                .resolution(rs.getString("resolution"))
                .drafting(drafting)
                .build();
    }
}
