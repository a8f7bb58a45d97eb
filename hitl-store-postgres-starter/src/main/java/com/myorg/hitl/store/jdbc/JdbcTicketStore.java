package com.myorg.hitl.store.jdbc;

import com.myorg.hitl.contracts.core.exception.DuplicateTicketException;
import com.myorg.hitl.contracts.core.exception.TicketStoreException;
import com.myorg.hitl.contracts.ticket.Ticket;
import com.myorg.hitl.contracts.ticket.TicketStage;
import com.myorg.hitl.store.TicketSchema;
import com.myorg.hitl.store.TicketStore;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.support.TransactionOperations;

import java.sql.Timestamp;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * One table per lifecycle stage plus a registry table whose primary key makes ticket ids
 * unique across all four stores. Writes that touch both run in one transaction; callers that
 * already hold one (the transition engine) are joined.
 */
@RequiredArgsConstructor
public class JdbcTicketStore implements TicketStore {

    private final JdbcTemplate jdbc;
    private final TransactionOperations tx;
    private final HitlStoreProperties props;
    private final Clock clock;

    @Override
    public void create(TicketStage stage, Ticket ticket) {
        TicketSchema.validate(stage, ticket);
        try {
            tx.executeWithoutResult(st -> {
                jdbc.update("INSERT INTO " + TicketRows.registry(props) + " (ticket_id, stage, updated_at) VALUES (?, ?, ?)",
                        ticket.getTicketId(), stage.name(), Timestamp.from(clock.instant()));
                insert(stage, ticket);
            });
        } catch (DuplicateKeyException e) {
            throw new DuplicateTicketException(ticket.getTicketId(), e);
        } catch (DataAccessException e) {
            throw new TicketStoreException("create " + ticket.getTicketId() + " in " + stage.storeName() + " failed", e);
        }
    }

    @Override
    public void put(TicketStage stage, Ticket ticket) {
        TicketSchema.validate(stage, ticket);
        String id = ticket.getTicketId();
        translate("put " + id + " into " + stage.storeName(), () -> tx.execute(st -> {
            Timestamp now = Timestamp.from(clock.instant());
            int updated = jdbc.update("UPDATE " + TicketRows.registry(props) + " SET stage = ?, updated_at = ? WHERE ticket_id = ?",
                    stage.name(), now, id);
            if (updated == 0) {
                jdbc.update("INSERT INTO " + TicketRows.registry(props) + " (ticket_id, stage, updated_at) VALUES (?, ?, ?)",
                        id, stage.name(), now);
            }
            jdbc.update("DELETE FROM " + TicketRows.table(props, stage) + " WHERE ticket_id = ?", id);
            insert(stage, ticket);
            return null;
        }));
    }

    @Override
    public Optional<Ticket> findById(TicketStage stage, String ticketId) {
        return translate("read " + ticketId, () -> jdbc.query(
                "SELECT " + TicketRows.COLUMNS + " FROM " + TicketRows.table(props, stage) + " WHERE ticket_id = ?",
                TicketRows.MAPPER, ticketId).stream().findFirst());
    }

    /**
     * Locks the row, then deletes it. Inside a transaction a concurrent caller blocks on the
     * lock and then sees no row.
     */
    @Override
    public Optional<Ticket> findAndDelete(TicketStage stage, String ticketId) {
        String table = TicketRows.table(props, stage);
        return translate("take " + ticketId + " from " + stage.storeName(), () -> {
            List<Ticket> rows = jdbc.query(
                    "SELECT " + TicketRows.COLUMNS + " FROM " + table + " WHERE ticket_id = ? FOR UPDATE",
                    TicketRows.MAPPER, ticketId);
            if (rows.isEmpty()) return Optional.empty();

            int deleted = jdbc.update("DELETE FROM " + table + " WHERE ticket_id = ?", ticketId);
            return deleted == 1 ? Optional.of(rows.get(0)) : Optional.empty();
        });
    }

    @Override
    public List<Ticket> listRecent(TicketStage stage, int limit) {
        return translate("list " + stage.storeName(), () -> jdbc.query(
                "SELECT " + TicketRows.COLUMNS + " FROM " + TicketRows.table(props, stage)
                        + " ORDER BY created_at DESC, ticket_id DESC LIMIT ?",
                TicketRows.MAPPER, Math.max(0, limit)));
    }

    @Override
    public Optional<TicketStage> locate(String ticketId) {
        return translate("locate " + ticketId, () -> jdbc.queryForList(
                        "SELECT stage FROM " + TicketRows.registry(props) + " WHERE ticket_id = ?", String.class, ticketId)
                .stream().findFirst().map(TicketStage::valueOf));
    }

    private void insert(TicketStage stage, Ticket ticket) {
        jdbc.update("INSERT INTO " + TicketRows.table(props, stage) + " (" + TicketRows.COLUMNS + ") VALUES ("
                + TicketRows.PLACEHOLDERS + ")", TicketRows.values(ticket));
    }

    static <T> T translate(String what, Supplier<T> call) {
        try {
            return call.get();
        } catch (DataAccessException e) {
            throw new TicketStoreException(what + " failed", e);
        }
    }
}
