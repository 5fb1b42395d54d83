package com.example.autopilot.service;

import com.example.autopilot.config.AutopilotProperties;
import org.springframework.stereotype.Component;

@Component
public class RedisKeyFactory {

    private final AutopilotProperties properties;

    public RedisKeyFactory(AutopilotProperties properties) {
        this.properties = properties;
    }

    private String prefix() {
        return properties.getRedis().getKeyPrefix();
    }

    public String conversationLockKey(String conversationId) {
        return "%s:conversation:%s:lock".formatted(prefix(), conversationId);
    }

    public String snapshotKey(String conversationId) {
        return "%s:conversation:%s:state".formatted(prefix(), conversationId);
    }

    public String messagesKey(String conversationId) {
        return "%s:conversation:%s:messages".formatted(prefix(), conversationId);
    }

    public String dedupKeysKey(String conversationId) {
        return "%s:conversation:%s:dedup".formatted(prefix(), conversationId);
    }

    public String sequenceKey(String conversationId) {
        return "%s:conversation:%s:seq".formatted(prefix(), conversationId);
    }

    public String conversationIndexKey() {
        return "%s:conversations".formatted(prefix());
    }

    public String listingProfileKey() {
        return "%s:listing:profile".formatted(prefix());
    }
}
