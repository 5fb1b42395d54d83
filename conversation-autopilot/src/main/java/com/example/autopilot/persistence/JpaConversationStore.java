package com.example.autopilot.persistence;

import com.example.autopilot.domain.ConversationSnapshot;
import com.example.autopilot.domain.ConversationStatus;
import com.example.autopilot.domain.Message;
import com.example.autopilot.service.ConversationStore;
import com.example.autopilot.service.exception.ConversationStoreException;
import com.example.autopilot.service.exception.StateCorruptionException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Profile;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.util.StringUtils;

/**
 * Relational conversation store. Every call runs in its own transaction so the caller sees either
 * the whole write or none of it; database failures surface as {@link ConversationStoreException}.
 */
@Slf4j
@Repository
@Profile("!redis-conversation-store")
@RequiredArgsConstructor
public class JpaConversationStore implements ConversationStore {

    private final ConversationJpaRepository conversationJpaRepository;
    private final MessageJpaRepository messageJpaRepository;
    private final ConversationEntityMapper mapper;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    @Override
    public boolean append(String conversationId, Message message) {
        try {
            return inTransaction("append", conversationId, () -> {
                if (messageJpaRepository.existsByConversationIdAndDedupKey(conversationId, message.getDedupKey())) {
                    return false;
                }
                ConversationEntity conversation = conversationJpaRepository.findById(conversationId)
                        .orElseGet(() -> mapper.newConversation(conversationId, clock.instant()));
                long sequence = conversation.getNextSequence();
                conversation.setNextSequence(sequence + 1);
                conversationJpaRepository.save(conversation);

                message.setConversationId(conversationId);
                message.setSequence(sequence);
                messageJpaRepository.saveAndFlush(mapper.toEntity(message));
                return true;
            });
        } catch (DataIntegrityViolationException ex) {
            if (contains(conversationId, message.getDedupKey())) {
                log.debug("Message {} of conversation {} was stored concurrently", message.getDedupKey(), conversationId);
                return false;
            }
            throw ConversationStoreException.rejected(
                    "Message %s of conversation %s was rejected by the database".formatted(message.getDedupKey(), conversationId), ex);
        }
    }

    @Override
    public List<Message> history(String conversationId) {
        return inTransaction("history", conversationId, () ->
                messageJpaRepository.findByConversationIdOrderBySequenceAsc(conversationId).stream()
                        .map(mapper::toMessage)
                        .toList());
    }

    @Override
    public List<Message> history(String conversationId, int limit) {
        if (limit <= 0) {
            return Collections.emptyList();
        }
        List<Message> newestFirst = inTransaction("history", conversationId, () ->
                messageJpaRepository.findByConversationIdOrderBySequenceDesc(conversationId, PageRequest.of(0, limit))
                        .stream()
                        .map(mapper::toMessage)
                        .toList());
        List<Message> ordered = new ArrayList<>(newestFirst);
        Collections.reverse(ordered);
        return ordered;
    }

    @Override
    public boolean contains(String conversationId, String dedupKey) {
        if (!StringUtils.hasText(dedupKey)) {
            return false;
        }
        return inTransaction("lookup", conversationId, () ->
                messageJpaRepository.existsByConversationIdAndDedupKey(conversationId, dedupKey));
    }

    @Override
    public Optional<ConversationSnapshot> loadState(String conversationId) {
        Optional<ConversationSnapshot> snapshot = inTransaction("state load", conversationId, () ->
                conversationJpaRepository.findById(conversationId).map(mapper::toSnapshot));
        snapshot.filter(state -> state.getStatus() != ConversationStatus.QUARANTINED)
                .map(ConversationSnapshot::invariantViolations)
                .filter(violations -> !violations.isEmpty())
                .ifPresent(violations -> {
                    throw new StateCorruptionException(conversationId, violations);
                });
        return snapshot;
    }

    @Override
    public void saveState(String conversationId, ConversationSnapshot snapshot) {
        inTransaction("state save", conversationId, () -> {
            ConversationEntity entity = conversationJpaRepository.findById(conversationId)
                    .orElseGet(() -> mapper.newConversation(conversationId, clock.instant()));
            mapper.applySnapshot(snapshot, entity);
            if (entity.getUpdatedAt() == null) {
                entity.setUpdatedAt(clock.instant());
            }
            ConversationEntity saved = conversationJpaRepository.save(entity);
            snapshot.setVersion(saved.getVersion());
            return null;
        });
    }

    @Override
    public List<String> knownConversations() {
        return inTransaction("scan", "*", conversationJpaRepository::findAllIds);
    }

    @Override
    public void quarantine(String conversationId, String reason) {
        inTransaction("quarantine", conversationId, () -> {
            ConversationEntity entity = conversationJpaRepository.findById(conversationId)
                    .orElseGet(() -> mapper.newConversation(conversationId, clock.instant()));
            entity.setStatus(ConversationStatus.QUARANTINED);
            entity.setQuarantineReason(reason);
            entity.setUpdatedAt(clock.instant());
            conversationJpaRepository.save(entity);
            return null;
        });
    }

    @Override
    public void reset(String conversationId) {
        inTransaction("reset", conversationId, () -> {
            int removed = messageJpaRepository.deleteByConversationId(conversationId);
            conversationJpaRepository.deleteById(conversationId);
            log.debug("Removed {} messages of conversation {}", removed, conversationId);
            return null;
        });
    }

    private <T> T inTransaction(String operation, String conversationId, Supplier<T> action) {
        try {
            return transactionTemplate.execute(status -> action.get());
        } catch (DataIntegrityViolationException ex) {
            throw ex;
        } catch (DataAccessException | TransactionException ex) {
            throw new ConversationStoreException(
                    "Conversation store %s failed for %s".formatted(operation, conversationId), ex);
        }
    }
}
