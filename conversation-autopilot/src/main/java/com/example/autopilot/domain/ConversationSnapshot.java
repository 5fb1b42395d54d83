package com.example.autopilot.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.util.CollectionUtils;
import org.springframework.util.StringUtils;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ConversationSnapshot implements Serializable {

    private String conversationId;
    private String displayName;
    private String threadUrl;
    private ConversationStatus status;
    private OpenBatchMarker openBatch;
    private String pendingApprovalToken;
    private String quarantineReason;
    private String lastError;
    private Instant createdAt;
    private Instant updatedAt;
    private Long version;

    public static ConversationSnapshot fresh(String conversationId, Instant now) {
        return ConversationSnapshot.builder()
                .conversationId(conversationId)
                .status(ConversationStatus.IDLE)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    @JsonIgnore
    public boolean isArchived() {
        return status == ConversationStatus.ARCHIVED;
    }

    @JsonIgnore
    public boolean isQuarantined() {
        return status == ConversationStatus.QUARANTINED;
    }

    /**
     * Lists the ways this snapshot is internally inconsistent; empty when it can be trusted.
     */
    public List<String> invariantViolations() {
        List<String> violations = new ArrayList<>();
        boolean hasToken = StringUtils.hasText(pendingApprovalToken);
        if (openBatch != null && hasToken) {
            violations.add("open batch %s and pending approval %s coexist"
                    .formatted(openBatch.getBatchId(), pendingApprovalToken));
        }
        if (status == ConversationStatus.AWAITING_APPROVAL && !hasToken) {
            violations.add("status AWAITING_APPROVAL without a pending approval token");
        }
        if (status == ConversationStatus.COLLECTING && openBatch == null) {
            violations.add("status COLLECTING without an open batch");
        }
        if (openBatch != null
                && (!StringUtils.hasText(openBatch.getBatchId()) || CollectionUtils.isEmpty(openBatch.getMessageKeys()))) {
            violations.add("open batch marker without id or members");
        }
        return violations;
    }
}
