package com.example.autopilot.persistence;

import com.example.autopilot.domain.ApprovalStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.time.Instant;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
@Entity
@Table(
        name = "autopilot_approvals",
        indexes = {
            @Index(name = "idx_approval_conversation", columnList = "conversation_id"),
            @Index(name = "idx_approval_status", columnList = "status, requested_at")
        })
public class ApprovalEntity {

    @Id
    @Column(name = "token", nullable = false, updatable = false, length = 64)
    private String token;

    @Column(name = "conversation_id", nullable = false, length = 128)
    private String conversationId;

    @Column(name = "display_name", length = 255)
    private String displayName;

    @Column(name = "decision", nullable = false, columnDefinition = "text")
    private String decision;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private ApprovalStatus status;

    @Column(name = "requested_at", nullable = false)
    private Instant requestedAt;

    @Column(name = "resolved_at")
    private Instant resolvedAt;

    @Column(name = "reply_override", columnDefinition = "text")
    private String replyOverride;

    @Column(name = "resolution_note", length = 255)
    private String resolutionNote;
}
