package com.example.autopilot.event;

public interface ConversationEventListener {

    void onConversationEvent(ConversationEvent event);
}
