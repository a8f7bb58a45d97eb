package com.myorg.hitl.store.memory;

import com.myorg.hitl.contracts.core.exception.DuplicateTicketException;
import com.myorg.hitl.contracts.ticket.DraftingState;
import com.myorg.hitl.contracts.ticket.Ticket;
import com.myorg.hitl.contracts.ticket.TicketStage;
import com.myorg.hitl.store.ClaimQueue;
import com.myorg.hitl.store.TicketSchema;
import com.myorg.hitl.store.TicketStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.transaction.support.SimpleTransactionStatus;
import org.springframework.transaction.support.TransactionCallback;
import org.springframework.transaction.support.TransactionOperations;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

/**
 * Keeps the four stores in RAM ({@link ConcurrentHashMap} per stage). Meant for dev and
 * single-process setups: claims are exclusive inside this JVM only.
 *
 * <p>{@link #transactionOperations()} gives moves all-or-nothing semantics by journaling
 * undo actions for every store mutation made inside the callback.
 */
@Slf4j
public class InMemoryTicketStore implements TicketStore, ClaimQueue {

    private static final Comparator<Ticket> OLDEST_FIRST = Comparator
            .comparing((Ticket t) -> t.getMetadata().getCreatedAt())
            .thenComparing(Ticket::getTicketId);

    private final Map<TicketStage, ConcurrentHashMap<String, Ticket>> stores = new EnumMap<>(TicketStage.class);
    private final ConcurrentHashMap<String, TicketStage> registry = new ConcurrentHashMap<>();
    private final Object claimLock = new Object();
    private final ThreadLocal<Deque<Runnable>> journal = new ThreadLocal<>();

    private final Clock clock;
    private final Duration lease;

    public InMemoryTicketStore(Clock clock, Duration lease) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.lease = requirePositive(lease, "lease");
        for (TicketStage s : TicketStage.values()) {
            stores.put(s, new ConcurrentHashMap<>());
        }
    }

    // ---- TicketStore ----

    @Override
    public void create(TicketStage stage, Ticket ticket) {
        TicketSchema.validate(stage, ticket);
        String id = ticket.getTicketId();
        if (registry.putIfAbsent(id, stage) != null) {
            throw new DuplicateTicketException(id);
        }
        stores.get(stage).put(id, copy(ticket));
        onRollback(() -> {
            stores.get(stage).remove(id);
            registry.remove(id, stage);
        });
    }

    @Override
    public void put(TicketStage stage, Ticket ticket) {
        TicketSchema.validate(stage, ticket);
        String id = ticket.getTicketId();
        TicketStage previousStage = registry.put(id, stage);
        Ticket previous = stores.get(stage).put(id, copy(ticket));
        onRollback(() -> {
            if (previous == null) stores.get(stage).remove(id);
            else stores.get(stage).put(id, previous);
            if (previousStage == null) registry.remove(id);
            else registry.put(id, previousStage);
        });
    }

    @Override
    public Optional<Ticket> findById(TicketStage stage, String ticketId) {
        return Optional.ofNullable(stores.get(stage).get(ticketId)).map(InMemoryTicketStore::copy);
    }

    @Override
    public Optional<Ticket> findAndDelete(TicketStage stage, String ticketId) {
        Ticket removed = stores.get(stage).remove(ticketId);
        if (removed != null) {
            onRollback(() -> stores.get(stage).put(ticketId, removed));
        }
        return Optional.ofNullable(removed).map(InMemoryTicketStore::copy);
    }

    @Override
    public List<Ticket> listRecent(TicketStage stage, int limit) {
        return stores.get(stage).values().stream()
                .sorted(OLDEST_FIRST.reversed())
                .limit(Math.max(0, limit))
                .map(InMemoryTicketStore::copy)
                .toList();
    }

    @Override
    public Optional<TicketStage> locate(String ticketId) {
        TicketStage stage = registry.get(ticketId);
        if (stage == null || !stores.get(stage).containsKey(ticketId)) {
            return Optional.empty();
        }
        return Optional.of(stage);
    }

    /**
     * Transaction boundary for moves against this store. Nested calls join the outer one.
     */
    public TransactionOperations transactionOperations() {
        return new TransactionOperations() {
            @Override
            public <T> T execute(TransactionCallback<T> action) {
                if (journal.get() != null) {
                    return action.doInTransaction(new SimpleTransactionStatus(false));
                }
                Deque<Runnable> undo = new ArrayDeque<>();
                journal.set(undo);
                try {
                    return action.doInTransaction(new SimpleTransactionStatus(true));
                } catch (RuntimeException | Error e) {
                    while (!undo.isEmpty()) {
                        undo.pop().run();
                    }
                    throw e;
                } finally {
                    journal.remove();
                }
            }
        };
    }

    // ---- ClaimQueue ----

    @Override
    public Optional<Ticket> claimNext(String owner) {
        requireOwner(owner);
        ConcurrentHashMap<String, Ticket> pending = stores.get(TicketStage.PENDING);

        synchronized (claimLock) {
            List<Ticket> candidates = pending.values().stream()
                    .filter(InMemoryTicketStore::isEligible)
                    .sorted(OLDEST_FIRST)
                    .toList();

            Instant leaseUntil = clock.instant().plus(lease);
            for (Ticket candidate : candidates) {
                AtomicReference<Ticket> claimed = new AtomicReference<>();
                pending.computeIfPresent(candidate.getTicketId(), (id, cur) -> {
                    if (!isEligible(cur)) return cur;
                    DraftingState d = cur.draftingOrDefault();
                    Ticket next = cur.toBuilder()
                            .metadata(cur.getMetadata().toBuilder().drafted(true).build())
                            .drafting(new DraftingState(owner, leaseUntil, d.attempts(), false, d.lastError()))
                            .build();
                    claimed.set(next);
                    return next;
                });
                if (claimed.get() != null) {
                    return Optional.of(copy(claimed.get()));
                }
            }
            return Optional.empty();
        }
    }

    @Override
    public boolean release(String ticketId, String owner, String error) {
        requireOwner(owner);
        return updatePending(ticketId, cur -> {
            DraftingState d = cur.draftingOrDefault();
            if (!cur.isDrafted() || !owner.equals(d.claimOwner())) return null;
            return unclaimed(cur, d.attempts() + 1, error);
        });
    }

    @Override
    public boolean abandon(String ticketId, String owner) {
        requireOwner(owner);
        return updatePending(ticketId, cur -> {
            DraftingState d = cur.draftingOrDefault();
            if (!cur.isDrafted() || !owner.equals(d.claimOwner())) return null;
            return unclaimed(cur, d.attempts(), d.lastError());
        });
    }

    @Override
    public boolean markNeedsAttention(String ticketId, String owner, String reason) {
        requireOwner(owner);
        return updatePending(ticketId, cur -> {
            DraftingState d = cur.draftingOrDefault();
            if (!owner.equals(d.claimOwner())) return null;
            return cur.toBuilder()
                    .metadata(cur.getMetadata().toBuilder().drafted(false).build())
                    .drafting(new DraftingState(null, null, d.attempts() + 1, true, reason))
                    .build();
        });
    }

    @Override
    public boolean retryDraft(String ticketId) {
        return updatePending(ticketId, cur -> {
            if (!cur.draftingOrDefault().needsAttention()) return null;
            return unclaimed(cur, 0, null);
        });
    }

    @Override
    public int releaseExpiredClaims() {
        Instant now = clock.instant();
        int released = 0;
        for (String id : new ArrayList<>(stores.get(TicketStage.PENDING).keySet())) {
            boolean changed = updatePending(id, cur -> {
                DraftingState d = cur.draftingOrDefault();
                if (!cur.isDrafted() || d.leaseUntil() == null || !d.leaseUntil().isBefore(now)) return null;
                return unclaimed(cur, d.attempts() + 1, "claim lease expired");
            });
            if (changed) released++;
        }
        if (released > 0) {
            log.warn("Released {} expired drafting claims", released);
        }
        return released;
    }

    @Override
    public List<Ticket> listNeedsAttention(int limit) {
        return stores.get(TicketStage.PENDING).values().stream()
                .filter(t -> t.draftingOrDefault().needsAttention())
                .sorted(OLDEST_FIRST)
                .limit(Math.max(0, limit))
                .map(InMemoryTicketStore::copy)
                .toList();
    }

    @Override
    public int countEligible() {
        return (int) stores.get(TicketStage.PENDING).values().stream()
                .filter(InMemoryTicketStore::isEligible)
                .count();
    }

    /** Applies {@code change} atomically; a null result means "leave as is". */
    private boolean updatePending(String ticketId, UnaryOperator<Ticket> change) {
        AtomicReference<Boolean> changed = new AtomicReference<>(false);
        stores.get(TicketStage.PENDING).computeIfPresent(ticketId, (id, cur) -> {
            Ticket next = change.apply(cur);
            if (next == null) return cur;
            changed.set(true);
            return next;
        });
        return changed.get();
    }

    private void onRollback(Runnable undo) {
        Deque<Runnable> j = journal.get();
        if (j != null) j.push(undo);
    }

    private static Ticket unclaimed(Ticket cur, int attempts, String lastError) {
        return cur.toBuilder()
                .metadata(cur.getMetadata().toBuilder().drafted(false).build())
                .drafting(new DraftingState(null, null, attempts, false, lastError))
                .build();
    }

    private static boolean isEligible(Ticket t) {
        return !t.isDrafted() && !t.draftingOrDefault().needsAttention();
    }

    private static Ticket copy(Ticket t) {
        return t.toBuilder()
                .metadata(t.getMetadata() == null ? null : t.getMetadata().toBuilder().build())
                .build();
    }

    private static void requireOwner(String owner) {
        if (owner == null || owner.isBlank()) {
            throw new IllegalArgumentException("owner must not be blank");
        }
    }

    private static Duration requirePositive(Duration d, String name) {
        if (d == null || d.isZero() || d.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
        return d;
    }
}
