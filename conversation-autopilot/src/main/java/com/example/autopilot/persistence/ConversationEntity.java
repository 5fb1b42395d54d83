package com.example.autopilot.persistence;

import com.example.autopilot.domain.ConversationStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import java.time.Instant;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
@Entity
@Table(name = "autopilot_conversations")
public class ConversationEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false, length = 128)
    private String id;

    @Column(name = "display_name", length = 255)
    private String displayName;

    @Column(name = "thread_url", length = 1024)
    private String threadUrl;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 32)
    private ConversationStatus status;

    @Column(name = "open_batch", columnDefinition = "text")
    private String openBatch;

    @Column(name = "pending_approval_token", length = 64)
    private String pendingApprovalToken;

    @Column(name = "quarantine_reason", columnDefinition = "text")
    private String quarantineReason;

    @Column(name = "last_error", columnDefinition = "text")
    private String lastError;

    @Column(name = "next_sequence", nullable = false)
    private long nextSequence = 1;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @Version
    @Column(name = "version")
    private Long version;
}
