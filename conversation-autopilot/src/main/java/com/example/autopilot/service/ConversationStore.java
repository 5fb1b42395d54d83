package com.example.autopilot.service;

import com.example.autopilot.domain.ConversationSnapshot;
import com.example.autopilot.domain.Message;
import java.util.List;
import java.util.Optional;

/**
 * Durable per-conversation memory: an append-only message log plus the last lifecycle snapshot.
 * Implementations surface I/O failures as
 * {@link com.example.autopilot.service.exception.ConversationStoreException}.
 */
public interface ConversationStore {

    /**
     * Stores the message and assigns its sequence number.
     *
     * @return {@code false} when a message with the same dedup key is already stored
     */
    boolean append(String conversationId, Message message);

    List<Message> history(String conversationId);

    /**
     * The most recent {@code limit} messages, oldest first.
     */
    List<Message> history(String conversationId, int limit);

    boolean contains(String conversationId, String dedupKey);

    /**
     * @throws com.example.autopilot.service.exception.StateCorruptionException when the stored
     *         snapshot cannot be trusted
     */
    Optional<ConversationSnapshot> loadState(String conversationId);

    void saveState(String conversationId, ConversationSnapshot snapshot);

    List<String> knownConversations();

    /**
     * Marks the conversation quarantined without touching the rest of its snapshot.
     */
    void quarantine(String conversationId, String reason);

    /**
     * Deletes the conversation's messages and snapshot.
     */
    void reset(String conversationId);
}
