package com.example.autopilot.domain;

import java.io.Serializable;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.util.StringUtils;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ApprovalRequest implements Serializable {

    private String token;
    private String conversationId;
    private String displayName;
    private Decision decision;
    private ApprovalStatus status;
    private Instant requestedAt;
    private Instant resolvedAt;
    private String replyOverride;
    private String resolutionNote;

    /**
     * Text that goes out when the request is approved: the approver's own wording if given,
     * otherwise the suggested reply.
     */
    public String chosenReply() {
        if (StringUtils.hasText(replyOverride)) {
            return replyOverride.trim();
        }
        return decision != null ? decision.getProposedReply() : null;
    }
}
