package com.myorg.hitl.store.jdbc;

import com.myorg.hitl.contracts.ticket.Ticket;
import com.myorg.hitl.contracts.ticket.TicketStage;
import com.myorg.hitl.store.ClaimQueue;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.support.TransactionOperations;

import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;

import static com.myorg.hitl.store.jdbc.JdbcTicketStore.translate;

/**
 * Claim primitive over the pending table. A claim flips {@code is_drafted} and stamps the
 * owner and lease; every other state change is guarded by the owner so a worker whose lease
 * was reaped cannot touch a ticket someone else holds now.
 */
@Slf4j
@RequiredArgsConstructor
public class JdbcClaimQueue implements ClaimQueue {

    private static final String ELIGIBLE = "is_drafted = FALSE AND needs_attention = FALSE";
    private static final int MAX_ROUNDS = 5;

    private final JdbcTemplate jdbc;
    private final TransactionOperations tx;
    private final HitlStoreProperties props;
    private final Clock clock;

    private String t() {
        return TicketRows.table(props, TicketStage.PENDING);
    }

    @Override
    public Optional<Ticket> claimNext(String owner) {
        requireOwner(owner);
        Instant leaseUntil = clock.instant().truncatedTo(ChronoUnit.MILLIS).plus(props.getLease());
        return translate("claim", () -> {
            if (props.getClaimStrategy() == HitlStoreProperties.ClaimStrategy.SKIP_LOCKED) {
                return tx.execute(st -> claimSkipLocked(owner, leaseUntil));
            }
            return claimConditional(owner, leaseUntil);
        });
    }

    private Optional<Ticket> claimSkipLocked(String owner, Instant leaseUntil) {
        // row lock held until commit; concurrent claimers skip it instead of waiting
        List<String> ids = jdbc.queryForList("""
                SELECT ticket_id
                FROM %s
                WHERE %s
                ORDER BY created_at, ticket_id
                LIMIT 1
                FOR UPDATE SKIP LOCKED
                """.formatted(t(), ELIGIBLE), String.class);
        if (ids.isEmpty()) return Optional.empty();

        String id = ids.get(0);
        jdbc.update("UPDATE " + t() + " SET is_drafted = TRUE, claim_owner = ?, lease_until = ? WHERE ticket_id = ?",
                owner, Timestamp.from(leaseUntil), id);
        return readPending(id);
    }

    private Optional<Ticket> claimConditional(String owner, Instant leaseUntil) {
        for (int round = 0; round < MAX_ROUNDS; round++) {
            List<String> candidates = jdbc.queryForList("""
                    SELECT ticket_id
                    FROM %s
                    WHERE %s
                    ORDER BY created_at, ticket_id
                    LIMIT ?
                    """.formatted(t(), ELIGIBLE), String.class, Math.max(1, props.getClaimCandidates()));
            if (candidates.isEmpty()) return Optional.empty();

            for (String id : candidates) {
                int won;
                try {
                    won = jdbc.update("UPDATE " + t() + " SET is_drafted = TRUE, claim_owner = ?, lease_until = ? "
                                    + "WHERE ticket_id = ? AND " + ELIGIBLE,
                            owner, Timestamp.from(leaseUntil), id);
                } catch (ConcurrencyFailureException e) {
                    log.debug("Lost claim race for {}: {}", id, e.getMessage());
                    continue;
                }
                if (won == 1) {
                    return readPending(id);
                }
            }
        }
        return Optional.empty();
    }

    @Override
    public boolean release(String ticketId, String owner, String error) {
        requireOwner(owner);
        return translate("release " + ticketId, () -> jdbc.update("""
                UPDATE %s
                SET is_drafted = FALSE,
                    claim_owner = NULL,
                    lease_until = NULL,
                    draft_attempts = draft_attempts + 1,
                    last_error = ?
                WHERE ticket_id = ? AND is_drafted = TRUE AND claim_owner = ?
                """.formatted(t()), TicketRows.truncate(error), ticketId, owner) == 1);
    }

    @Override
    public boolean abandon(String ticketId, String owner) {
        requireOwner(owner);
        return translate("abandon " + ticketId, () -> jdbc.update("""
                UPDATE %s
                SET is_drafted = FALSE,
                    claim_owner = NULL,
                    lease_until = NULL
                WHERE ticket_id = ? AND is_drafted = TRUE AND claim_owner = ?
                """.formatted(t()), ticketId, owner) == 1);
    }

    @Override
    public boolean markNeedsAttention(String ticketId, String owner, String reason) {
        requireOwner(owner);
        return translate("flag " + ticketId, () -> jdbc.update("""
                UPDATE %s
                SET is_drafted = FALSE,
                    needs_attention = TRUE,
                    claim_owner = NULL,
                    lease_until = NULL,
                    draft_attempts = draft_attempts + 1,
                    last_error = ?
                WHERE ticket_id = ? AND claim_owner = ?
                """.formatted(t()), TicketRows.truncate(reason), ticketId, owner) == 1);
    }

    @Override
    public boolean retryDraft(String ticketId) {
        return translate("retry " + ticketId, () -> jdbc.update("""
                UPDATE %s
                SET is_drafted = FALSE,
                    needs_attention = FALSE,
                    claim_owner = NULL,
                    lease_until = NULL,
                    draft_attempts = 0,
                    last_error = NULL
                WHERE ticket_id = ? AND needs_attention = TRUE
                """.formatted(t()), ticketId) == 1);
    }

    @Override
    public int releaseExpiredClaims() {
        Timestamp now = Timestamp.from(clock.instant());
        int released = translate("reap", () -> jdbc.update("""
                UPDATE %s
                SET is_drafted = FALSE,
                    claim_owner = NULL,
                    lease_until = NULL,
                    draft_attempts = draft_attempts + 1,
                    last_error = 'claim lease expired'
                WHERE is_drafted = TRUE
                  AND lease_until IS NOT NULL
                  AND lease_until < ?
                """.formatted(t()), now));
        if (released > 0) {
            log.warn("Released {} expired drafting claims", released);
        }
        return released;
    }

    @Override
    public List<Ticket> listNeedsAttention(int limit) {
        return translate("list needs-attention", () -> jdbc.query(
                "SELECT " + TicketRows.COLUMNS + " FROM " + t()
                        + " WHERE needs_attention = TRUE ORDER BY created_at, ticket_id LIMIT ?",
                TicketRows.MAPPER, Math.max(0, limit)));
    }

    @Override
    public int countEligible() {
        Integer v = translate("count eligible", () -> jdbc.queryForObject(
                "SELECT COUNT(*) FROM " + t() + " WHERE " + ELIGIBLE, Integer.class));
        return v == null ? 0 : v;
    }

    private Optional<Ticket> readPending(String id) {
        return jdbc.query("SELECT " + TicketRows.COLUMNS + " FROM " + t() + " WHERE ticket_id = ?",
                TicketRows.MAPPER, id).stream().findFirst();
    }

    private static void requireOwner(String owner) {
        if (owner == null || owner.isBlank()) {
            throw new IllegalArgumentException("owner must not be blank");
        }
    }
}
