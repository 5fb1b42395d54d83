package com.example.autopilot.service;

import com.example.autopilot.domain.Batch;
import com.example.autopilot.domain.Classification;
import com.example.autopilot.domain.Decision;
import com.example.autopilot.domain.SensitivityCategory;
import com.example.autopilot.reasoning.ReasoningClient;
import com.example.autopilot.reasoning.ReasoningRequest;
import com.example.autopilot.reasoning.ReasoningResult;
import java.time.Clock;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Turns a closed batch into a {@link Decision}. Only allowlisted categories with a usable reply are
 * answered automatically; anything the reasoning collaborator gets wrong or cannot deliver ends up
 * with a human.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DecisionRouter {

    static final String REASONING_FAILED_LABEL = "Reasoning unavailable";

    private final ReasoningClient reasoningClient;
    private final Clock clock;

    public Decision classify(Batch batch, ConversationContext context) {
        ReasoningResult result;
        try {
            result = reasoningClient.analyze(ReasoningRequest.builder()
                    .conversationId(batch.getConversationId())
                    .displayName(context.getDisplayName())
                    .history(context.getHistory())
                    .batchMessages(batch.texts())
                    .listing(context.getListing())
                    .localTime(context.getLocalTime())
                    .build());
        } catch (RuntimeException ex) {
            log.warn("Reasoning failed for batch {} of conversation {}: {}",
                    batch.getId(), batch.getConversationId(), ex.getMessage());
            return escalate(batch, REASONING_FAILED_LABEL, "Reasoning call failed: " + ex.getMessage());
        }
        if (result == null) {
            log.warn("Reasoning returned nothing for batch {}", batch.getId());
            return escalate(batch, REASONING_FAILED_LABEL, "Reasoning returned no result.");
        }

        Optional<SensitivityCategory> category = SensitivityCategory.fromLabel(result.getCategory());
        if (category.isEmpty()) {
            log.warn("Reasoning returned unknown category '{}' for batch {}", result.getCategory(), batch.getId());
            return escalate(batch, intentLabel(result, SensitivityCategory.ESCALATION),
                    "Unrecognised category: " + result.getCategory())
                    .toBuilder()
                    .proposedReply(trimToNull(result.getReplyIfAccepted()))
                    .declineSuggestion(trimToNull(result.getReplyIfDeclined()))
                    .build();
        }

        SensitivityCategory resolved = category.get();
        String reply = trimToNull(result.getReplyIfAccepted());
        boolean meetupConfirmed = Boolean.TRUE.equals(result.getMeetupConfirmed());
        boolean auto = resolved.isAutoAnswerable()
                && !Boolean.TRUE.equals(result.getRequiresApproval())
                && !meetupConfirmed
                && reply != null;

        Decision decision = Decision.builder()
                .batchId(batch.getId())
                .conversationId(batch.getConversationId())
                .classification(auto ? Classification.AUTO : Classification.NEEDS_APPROVAL)
                .category(resolved)
                .proposedReply(reply)
                .declineSuggestion(trimToNull(result.getReplyIfDeclined()))
                .intentLabel(intentLabel(result, resolved))
                .ownerNotes(trimToNull(result.getNotesForOwner()))
                .meetupConfirmed(meetupConfirmed)
                .meetupTimeText(trimToNull(result.getMeetupTimeText()))
                .batchText(batch.combinedText())
                .decidedAt(clock.instant())
                .build();
        log.info("Batch {} of conversation {} classified {} ({})",
                batch.getId(), batch.getConversationId(), decision.getClassification(), resolved);
        return decision;
    }

    private Decision escalate(Batch batch, String intentLabel, String ownerNotes) {
        return Decision.builder()
                .batchId(batch.getId())
                .conversationId(batch.getConversationId())
                .classification(Classification.NEEDS_APPROVAL)
                .category(SensitivityCategory.ESCALATION)
                .intentLabel(intentLabel)
                .ownerNotes(ownerNotes)
                .batchText(batch.combinedText())
                .decidedAt(clock.instant())
                .build();
    }

    private String intentLabel(ReasoningResult result, SensitivityCategory category) {
        String summary = trimToNull(result.getIntentSummary());
        return summary != null ? summary : category.getLabel();
    }

    private String trimToNull(String value) {
        return StringUtils.hasText(value) ? value.trim() : null;
    }
}
