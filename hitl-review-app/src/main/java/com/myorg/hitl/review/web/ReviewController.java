package com.myorg.hitl.review.web;

import com.myorg.hitl.contracts.drafting.RetrievalContext;
import com.myorg.hitl.contracts.ticket.NewTicket;
import com.myorg.hitl.contracts.ticket.TicketStage;
import com.myorg.hitl.review.ReviewService;
import com.myorg.hitl.review.TicketView;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;

@RestController
@RequiredArgsConstructor
public class ReviewController {

    private static final double DEFAULT_REPHRASE_TEMPERATURE = 0.5;

    private final ReviewService review;

    @GetMapping("/api/tickets")
    public List<TicketView> list(
            @RequestParam(name = "stage", defaultValue = "pending") String stage,
            @RequestParam(name = "limit", defaultValue = "10") int limit
    ) {
        return review.list(TicketStage.fromName(stage), limit);
    }

    @GetMapping("/api/tickets/needs-attention")
    public List<TicketView> needsAttention(@RequestParam(name = "limit", defaultValue = "10") int limit) {
        return review.needsAttention(limit);
    }

    @GetMapping("/api/tickets/{ticketId}")
    public TicketView get(@PathVariable("ticketId") String ticketId) {
        return review.get(ticketId);
    }

    @GetMapping("/api/tickets/{ticketId}/evidence")
    public RetrievalContext evidence(@PathVariable("ticketId") String ticketId) {
        return review.evidence(ticketId).orElseThrow(() -> new ResponseStatusException(
                HttpStatus.SERVICE_UNAVAILABLE, "No embedding model configured"));
    }

    @PostMapping("/api/tickets")
    @ResponseStatus(HttpStatus.CREATED)
    public TicketView raise(
            @RequestParam(name = "stage", defaultValue = "pending") String stage,
            @RequestBody NewTicket body
    ) {
        return review.raise(body, TicketStage.fromName(stage));
    }

    @PostMapping("/api/tickets/{ticketId}/approve")
    public TicketView approve(@PathVariable("ticketId") String ticketId, @RequestBody ReviewRequests.Approve body) {
        return review.approve(ticketId, TicketStage.fromName(body.from()), body.resolution());
    }

    @PostMapping("/api/tickets/{ticketId}/escalate")
    public TicketView escalate(@PathVariable("ticketId") String ticketId, @RequestBody ReviewRequests.Escalate body) {
        return review.escalate(ticketId, TicketStage.fromName(body.from()), body.reason());
    }

    @PostMapping("/api/tickets/{ticketId}/resolve")
    public TicketView resolve(@PathVariable("ticketId") String ticketId, @RequestBody ReviewRequests.Resolve body) {
        return review.resolve(ticketId, body.resolution());
    }

    @PostMapping("/api/tickets/{ticketId}/retry-draft")
    public TicketView retryDraft(@PathVariable("ticketId") String ticketId) {
        if (!review.retryDraft(ticketId)) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, "Ticket " + ticketId + " is not waiting for attention");
        }
        return review.get(ticketId);
    }

    @PostMapping("/api/rephrase")
    public ReviewRequests.Rephrased rephrase(@RequestBody ReviewRequests.Rephrase body) {
        double temperature = body.temperature() == null ? DEFAULT_REPHRASE_TEMPERATURE : body.temperature();
        return review.rephrase(body.text(), temperature)
                .map(ReviewRequests.Rephrased::new)
                .orElseThrow(() -> new ResponseStatusException(
                        HttpStatus.SERVICE_UNAVAILABLE, "No completion model configured"));
    }
}
