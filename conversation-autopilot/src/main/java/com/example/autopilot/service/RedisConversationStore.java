package com.example.autopilot.service;

import com.example.autopilot.domain.ConversationSnapshot;
import com.example.autopilot.domain.ConversationStatus;
import com.example.autopilot.domain.Message;
import com.example.autopilot.service.exception.ConversationStoreException;
import com.example.autopilot.service.exception.StateCorruptionException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;
import java.util.stream.Stream;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Profile;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Repository;

/**
 * Keeps conversation memory in Redis only. Messages live in a list, their dedup keys in a set and
 * the snapshot as a JSON string; each append is a single server-side script.
 */
@Slf4j
@Repository
@Profile("redis-conversation-store")
public class RedisConversationStore implements ConversationStore {

    private static final long UNASSIGNED_SEQUENCE = -1;

    /**
     * Adds the dedup key and, only if it was new, assigns the next sequence, writes it into the
     * serialized message and appends the message. Returns the sequence, or 0 for a duplicate.
     */
    private static final RedisScript<Long> APPEND_SCRIPT = RedisScript.of("""
            if redis.call('SADD', KEYS[1], ARGV[1]) == 0 then
              return 0
            end
            local sequence = redis.call('INCR', KEYS[2])
            local payload = string.gsub(ARGV[2], '"sequence":%-1', '"sequence":' .. sequence, 1)
            redis.call('RPUSH', KEYS[3], payload)
            redis.call('SADD', KEYS[4], ARGV[3])
            return sequence
            """, Long.class);

    private final RedisTemplate<String, Object> redisTemplate;
    private final ObjectMapper objectMapper;
    private final RedisKeyFactory keyFactory;
    private final Clock clock;

    public RedisConversationStore(
            RedisTemplate<String, Object> redisTemplate,
            RedisKeyFactory keyFactory,
            ObjectMapper objectMapper,
            Clock clock) {
        this.redisTemplate = redisTemplate;
        this.keyFactory = keyFactory;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public boolean append(String conversationId, Message message) {
        return guarded("append", conversationId, () -> {
            message.setConversationId(conversationId);
            if (message.getTimestamp() == null) {
                message.setTimestamp(clock.instant());
            }
            message.setSequence(UNASSIGNED_SEQUENCE);
            String payload = writeAsJson(message);
            Long sequence = redisTemplate.execute(APPEND_SCRIPT,
                    List.of(keyFactory.dedupKeysKey(conversationId),
                            keyFactory.sequenceKey(conversationId),
                            keyFactory.messagesKey(conversationId),
                            keyFactory.conversationIndexKey()),
                    message.getDedupKey(), payload, conversationId);
            if (sequence == null || sequence <= 0) {
                message.setSequence(0);
                return false;
            }
            message.setSequence(sequence);
            return true;
        });
    }

    @Override
    public List<Message> history(String conversationId) {
        return readMessages(conversationId, 0);
    }

    @Override
    public List<Message> history(String conversationId, int limit) {
        if (limit <= 0) {
            return Collections.emptyList();
        }
        return readMessages(conversationId, -limit);
    }

    @Override
    public boolean contains(String conversationId, String dedupKey) {
        return guarded("lookup", conversationId, () ->
                Boolean.TRUE.equals(redisTemplate.opsForSet().isMember(keyFactory.dedupKeysKey(conversationId), dedupKey)));
    }

    @Override
    public Optional<ConversationSnapshot> loadState(String conversationId) {
        Object value = guarded("state load", conversationId, () ->
                redisTemplate.opsForValue().get(keyFactory.snapshotKey(conversationId)));
        if (value == null) {
            return Optional.empty();
        }
        ConversationSnapshot snapshot;
        try {
            snapshot = objectMapper.readValue(value.toString(), ConversationSnapshot.class);
        } catch (JsonProcessingException e) {
            throw new StateCorruptionException(conversationId, "unreadable snapshot", e);
        }
        if (snapshot.getStatus() != ConversationStatus.QUARANTINED) {
            List<String> violations = snapshot.invariantViolations();
            if (!violations.isEmpty()) {
                throw new StateCorruptionException(conversationId, violations);
            }
        }
        return Optional.of(snapshot);
    }

    @Override
    public void saveState(String conversationId, ConversationSnapshot snapshot) {
        guarded("state save", conversationId, () -> {
            redisTemplate.opsForValue().set(keyFactory.snapshotKey(conversationId), writeAsJson(snapshot));
            redisTemplate.opsForSet().add(keyFactory.conversationIndexKey(), conversationId);
            return null;
        });
    }

    @Override
    public List<String> knownConversations() {
        Set<Object> members = guarded("scan", "*", () ->
                redisTemplate.opsForSet().members(keyFactory.conversationIndexKey()));
        if (members == null) {
            return List.of();
        }
        return members.stream().map(Object::toString).sorted().toList();
    }

    @Override
    public void quarantine(String conversationId, String reason) {
        ConversationSnapshot snapshot;
        try {
            snapshot = loadState(conversationId)
                    .orElseGet(() -> ConversationSnapshot.fresh(conversationId, clock.instant()));
        } catch (StateCorruptionException ex) {
            log.debug("Replacing unreadable snapshot of conversation {} while quarantining", conversationId);
            snapshot = ConversationSnapshot.fresh(conversationId, clock.instant());
        }
        snapshot.setStatus(ConversationStatus.QUARANTINED);
        snapshot.setQuarantineReason(reason);
        snapshot.setUpdatedAt(clock.instant());
        saveState(conversationId, snapshot);
    }

    @Override
    public void reset(String conversationId) {
        guarded("reset", conversationId, () -> {
            redisTemplate.delete(List.of(
                    keyFactory.snapshotKey(conversationId),
                    keyFactory.messagesKey(conversationId),
                    keyFactory.dedupKeysKey(conversationId),
                    keyFactory.sequenceKey(conversationId)));
            redisTemplate.opsForSet().remove(keyFactory.conversationIndexKey(), conversationId);
            return null;
        });
    }

    private List<Message> readMessages(String conversationId, long start) {
        List<Object> range = guarded("history", conversationId, () ->
                redisTemplate.opsForList().range(keyFactory.messagesKey(conversationId), start, -1));
        if (range == null) {
            return List.of();
        }
        return range.stream()
                .flatMap(value -> readMessage(conversationId, value))
                .toList();
    }

    private Stream<Message> readMessage(String conversationId, Object value) {
        try {
            return Stream.of(objectMapper.readValue(value.toString(), Message.class));
        } catch (JsonProcessingException e) {
            log.warn("Skipping unreadable message in history of conversation {}", conversationId, e);
            return Stream.empty();
        }
    }

    private String writeAsJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize value for Redis", e);
        }
    }

    private <T> T guarded(String operation, String conversationId, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException ex) {
            throw new ConversationStoreException(
                    "Redis %s failed for conversation %s".formatted(operation, conversationId), ex);
        }
    }
}
