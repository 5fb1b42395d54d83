package com.example.autopilot.service;

import com.example.autopilot.domain.Decision;
import com.example.autopilot.domain.ListingItem;
import com.example.autopilot.domain.ListingProfile;
import com.example.autopilot.domain.MeetupRecord;
import com.example.autopilot.domain.Message;
import com.example.autopilot.domain.MessageRole;
import com.example.autopilot.domain.OutboundReply;
import com.example.autopilot.event.ConversationEventPublisher;
import com.example.autopilot.event.ConversationEventType;
import com.example.autopilot.service.exception.ReplyDeliveryException;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Sends the reply for a decided batch at most once per batch: a reply whose {@code reply:<batchId>}
 * message is already stored is skipped, otherwise it is delivered and then recorded.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ReplyDispatcher {

    private final OutboundReplySink outboundReplySink;
    private final ConversationStore conversationStore;
    private final TransientRetry transientRetry;
    private final MeetupLogService meetupLogService;
    private final ListingProfileService listingProfileService;
    private final ConversationEventPublisher eventPublisher;
    private final Clock clock;

    /**
     * @return {@code true} if the reply went out now, {@code false} if it had already been sent
     * @throws ReplyDeliveryException when the sink kept failing after retries
     */
    public boolean dispatch(String conversationId, String displayName, Decision decision, String text) {
        String dedupKey = DedupKeys.replyKey(decision.getBatchId());
        if (transientRetry.call("reply lookup", () -> conversationStore.contains(conversationId, dedupKey))) {
            log.info("Reply for batch {} of conversation {} already sent, skipping", decision.getBatchId(), conversationId);
            return false;
        }

        Instant now = clock.instant();
        OutboundReply reply = OutboundReply.builder()
                .conversationId(conversationId)
                .dedupKey(dedupKey)
                .text(text)
                .requestedAt(now)
                .build();
        try {
            transientRetry.run("reply delivery", () -> outboundReplySink.deliver(reply));
        } catch (ReplyDeliveryException ex) {
            eventPublisher.publish(conversationId, ConversationEventType.REPLY_FAILED,
                    Map.of("batchId", decision.getBatchId(), "error", String.valueOf(ex.getMessage())));
            throw ex;
        }

        Message outbound = Message.builder()
                .conversationId(conversationId)
                .role(MessageRole.OUTBOUND)
                .text(text)
                .dedupKey(dedupKey)
                .timestamp(now)
                .build();
        transientRetry.call("reply append", () -> conversationStore.append(conversationId, outbound));
        log.info("Sent reply for batch {} to conversation {}", decision.getBatchId(), conversationId);
        eventPublisher.publish(conversationId, ConversationEventType.REPLY_SENT,
                Map.of("batchId", decision.getBatchId(), "dedupKey", dedupKey));

        if (decision.isMeetupConfirmed() && decision.getMeetupTimeText() != null) {
            logMeetup(conversationId, displayName, decision, now);
        }
        return true;
    }

    private void logMeetup(String conversationId, String displayName, Decision decision, Instant now) {
        try {
            ListingProfile listing = listingProfileService.current();
            MeetupRecord record = meetupLogService.record(MeetupRecord.builder()
                    .conversationId(conversationId)
                    .displayName(displayName)
                    .itemName(listing.activeItem().map(ListingItem::getName).orElse(null))
                    .location(listing.getLocation())
                    .meetupTimeText(decision.getMeetupTimeText())
                    .notes(decision.getOwnerNotes())
                    .loggedAt(now)
                    .build());
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("meetupTime", record.getMeetupTimeText());
            payload.put("displayName", String.valueOf(displayName));
            eventPublisher.publish(conversationId, ConversationEventType.MEETUP_CONFIRMED, payload);
        } catch (RuntimeException ex) {
            log.warn("Failed to log meetup for conversation {}", conversationId, ex);
        }
    }
}
