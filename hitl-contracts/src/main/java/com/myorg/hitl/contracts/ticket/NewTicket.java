package com.myorg.hitl.contracts.ticket;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Intake request. Stage-specific fields are only read for the matching target stage.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NewTicket {
    private String ticketId;
    private String issue;
    private String category;
    private String priority;

    // drafted target
    private String aiDraftedResponse;
    private Double confidence;
    private String tone;

    // escalated target
    private String escalationReason;

    // completed target
    private String resolution;
}
