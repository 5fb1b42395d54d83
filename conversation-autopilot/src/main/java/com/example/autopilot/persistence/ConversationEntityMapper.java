package com.example.autopilot.persistence;

import com.example.autopilot.domain.ApprovalRequest;
import com.example.autopilot.domain.ConversationSnapshot;
import com.example.autopilot.domain.ConversationStatus;
import com.example.autopilot.domain.Decision;
import com.example.autopilot.domain.Message;
import com.example.autopilot.domain.OpenBatchMarker;
import com.example.autopilot.service.exception.StateCorruptionException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

@Slf4j
@Component
@RequiredArgsConstructor
public class ConversationEntityMapper {

    private final ObjectMapper objectMapper;

    public ConversationEntity newConversation(String conversationId, Instant now) {
        ConversationEntity entity = new ConversationEntity();
        entity.setId(conversationId);
        entity.setStatus(ConversationStatus.IDLE);
        entity.setCreatedAt(now);
        entity.setUpdatedAt(now);
        return entity;
    }

    /**
     * Copies the snapshot onto the entity, leaving the sequence counter alone.
     */
    public void applySnapshot(ConversationSnapshot snapshot, ConversationEntity entity) {
        entity.setDisplayName(snapshot.getDisplayName());
        entity.setThreadUrl(snapshot.getThreadUrl());
        entity.setStatus(snapshot.getStatus() != null ? snapshot.getStatus() : ConversationStatus.IDLE);
        entity.setOpenBatch(writeJson(snapshot.getOpenBatch()));
        entity.setPendingApprovalToken(snapshot.getPendingApprovalToken());
        entity.setQuarantineReason(snapshot.getQuarantineReason());
        entity.setLastError(snapshot.getLastError());
        if (snapshot.getCreatedAt() != null && entity.getCreatedAt() == null) {
            entity.setCreatedAt(snapshot.getCreatedAt());
        }
        entity.setUpdatedAt(snapshot.getUpdatedAt());
    }

    /**
     * @throws StateCorruptionException when the open batch marker cannot be read, unless the
     *         conversation is already quarantined
     */
    public ConversationSnapshot toSnapshot(ConversationEntity entity) {
        return ConversationSnapshot.builder()
                .conversationId(entity.getId())
                .displayName(entity.getDisplayName())
                .threadUrl(entity.getThreadUrl())
                .status(entity.getStatus())
                .openBatch(readMarker(entity))
                .pendingApprovalToken(entity.getPendingApprovalToken())
                .quarantineReason(entity.getQuarantineReason())
                .lastError(entity.getLastError())
                .createdAt(entity.getCreatedAt())
                .updatedAt(entity.getUpdatedAt())
                .version(entity.getVersion())
                .build();
    }

    public MessageEntity toEntity(Message message) {
        MessageEntity entity = new MessageEntity();
        entity.setConversationId(message.getConversationId());
        entity.setRole(message.getRole());
        entity.setText(message.getText());
        entity.setDedupKey(message.getDedupKey());
        entity.setSequence(message.getSequence());
        entity.setTimestamp(message.getTimestamp());
        return entity;
    }

    public Message toMessage(MessageEntity entity) {
        return Message.builder()
                .conversationId(entity.getConversationId())
                .role(entity.getRole())
                .text(entity.getText())
                .dedupKey(entity.getDedupKey())
                .sequence(entity.getSequence())
                .timestamp(entity.getTimestamp())
                .build();
    }

    public ApprovalEntity toEntity(ApprovalRequest request) {
        ApprovalEntity entity = new ApprovalEntity();
        entity.setToken(request.getToken());
        entity.setConversationId(request.getConversationId());
        entity.setDisplayName(request.getDisplayName());
        entity.setDecision(writeJson(request.getDecision()));
        entity.setStatus(request.getStatus());
        entity.setRequestedAt(request.getRequestedAt());
        entity.setResolvedAt(request.getResolvedAt());
        entity.setReplyOverride(request.getReplyOverride());
        entity.setResolutionNote(request.getResolutionNote());
        return entity;
    }

    public ApprovalRequest toApproval(ApprovalEntity entity) {
        Decision decision;
        try {
            decision = objectMapper.readValue(entity.getDecision(), Decision.class);
        } catch (JsonProcessingException e) {
            throw new StateCorruptionException(entity.getConversationId(),
                    "unreadable decision for approval " + entity.getToken(), e);
        }
        return ApprovalRequest.builder()
                .token(entity.getToken())
                .conversationId(entity.getConversationId())
                .displayName(entity.getDisplayName())
                .decision(decision)
                .status(entity.getStatus())
                .requestedAt(entity.getRequestedAt())
                .resolvedAt(entity.getResolvedAt())
                .replyOverride(entity.getReplyOverride())
                .resolutionNote(entity.getResolutionNote())
                .build();
    }

    private OpenBatchMarker readMarker(ConversationEntity entity) {
        if (!StringUtils.hasText(entity.getOpenBatch())) {
            return null;
        }
        try {
            return objectMapper.readValue(entity.getOpenBatch(), OpenBatchMarker.class);
        } catch (JsonProcessingException e) {
            if (entity.getStatus() == ConversationStatus.QUARANTINED) {
                log.debug("Ignoring unreadable open batch of quarantined conversation {}", entity.getId());
                return null;
            }
            throw new StateCorruptionException(entity.getId(), "unreadable open batch marker", e);
        }
    }

    private String writeJson(Object value) {
        if (value == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize value", e);
        }
    }
}
