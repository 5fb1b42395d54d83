package com.example.autopilot.persistence;

import com.example.autopilot.domain.MessageRole;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.Instant;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
@Entity
@Table(
        name = "autopilot_messages",
        uniqueConstraints = @UniqueConstraint(name = "uk_message_dedup", columnNames = {"conversation_id", "dedup_key"}),
        indexes = @Index(name = "idx_message_sequence", columnList = "conversation_id, sequence"))
public class MessageEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "conversation_id", nullable = false, length = 128)
    private String conversationId;

    @Enumerated(EnumType.STRING)
    @Column(name = "role", nullable = false, length = 16)
    private MessageRole role;

    @Column(name = "text", nullable = false, columnDefinition = "text")
    private String text;

    @Column(name = "dedup_key", nullable = false, length = 128)
    private String dedupKey;

    @Column(name = "sequence", nullable = false)
    private long sequence;

    @Column(name = "sent_at", nullable = false)
    private Instant timestamp;
}
