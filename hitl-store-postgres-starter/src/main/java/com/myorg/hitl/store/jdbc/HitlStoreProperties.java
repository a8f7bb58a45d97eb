package com.myorg.hitl.store.jdbc;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "hitl.store")
public class HitlStoreProperties {

    public enum Backend { JDBC, MEMORY }

    public enum ClaimStrategy {
        /** PostgreSQL: SELECT ... FOR UPDATE SKIP LOCKED, then UPDATE, in one transaction. */
        SKIP_LOCKED,
        /** Portable: UPDATE ... WHERE is_drafted = FALSE per candidate; first row changed wins. */
        CONDITIONAL_UPDATE
    }

    private Backend backend = Backend.JDBC;

    /** Tables are {@code <prefix>_pending}, {@code <prefix>_drafted}, ... and {@code <prefix>_ticket_registry}. */
    private String tablePrefix = "hitl";

    private ClaimStrategy claimStrategy = ClaimStrategy.SKIP_LOCKED;

    /** How long a claim stays valid before the reaper may hand the ticket to another worker. */
    private Duration lease = Duration.ofMinutes(5);

    /** CONDITIONAL_UPDATE only: candidates read per claim round. */
    private int claimCandidates = 10;
}
