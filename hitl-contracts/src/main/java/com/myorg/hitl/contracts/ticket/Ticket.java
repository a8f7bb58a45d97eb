package com.myorg.hitl.contracts.ticket;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One support ticket. The same shape is stored in every lifecycle store; which optional
 * fields are populated depends on the store (see {@code TicketSchema}).
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Ticket {
    private String ticketId;
    private String issue;
    private TicketMetadata metadata;

    private Double confidence; // [0,1], once drafted
    private String usedPolicy;
    private String usedReferenceTicketId;
    private String aiDraftedResponse;
    private String resolution; // completed only

    private DraftingState drafting; // pending only

    @JsonIgnore
    public boolean isDrafted() {
        return metadata != null && metadata.isDrafted();
    }

    @JsonIgnore
    public DraftingState draftingOrDefault() {
        return drafting == null ? DraftingState.unclaimed() : drafting;
    }
}
