package com.example.autopilot.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.autopilot.config.AutopilotProperties;
import com.example.autopilot.domain.Classification;
import com.example.autopilot.domain.Decision;
import com.example.autopilot.domain.ListingItem;
import com.example.autopilot.domain.ListingProfile;
import com.example.autopilot.domain.MeetupRecord;
import com.example.autopilot.domain.Message;
import com.example.autopilot.domain.MessageRole;
import com.example.autopilot.domain.OutboundReply;
import com.example.autopilot.domain.SensitivityCategory;
import com.example.autopilot.event.ConversationEventPublisher;
import com.example.autopilot.event.ConversationEventType;
import com.example.autopilot.service.exception.ReplyDeliveryException;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ReplyDispatcherTest {

    private static final Instant NOW = Instant.parse("2026-03-01T18:00:05Z");

    @Mock
    private OutboundReplySink sink;

    @Mock
    private MeetupLogService meetupLogService;

    @Mock
    private ListingProfileService listingProfileService;

    @Mock
    private ConversationEventPublisher eventPublisher;

    @Captor
    private ArgumentCaptor<OutboundReply> replyCaptor;

    @Captor
    private ArgumentCaptor<MeetupRecord> meetupCaptor;

    private InMemoryConversationStore store;
    private ReplyDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        AutopilotProperties properties = new AutopilotProperties();
        properties.getRetry().setInitialBackoff(Duration.ZERO);
        store = new InMemoryConversationStore();
        dispatcher = new ReplyDispatcher(sink, store, new TransientRetry(properties), meetupLogService,
                listingProfileService, eventPublisher, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void deliversAndRecordsReply() {
        boolean sent = dispatcher.dispatch("c1", "Dana", decision("b1", false), "Yes, still available");

        assertThat(sent).isTrue();
        verify(sink).deliver(replyCaptor.capture());
        assertThat(replyCaptor.getValue().getDedupKey()).isEqualTo("reply:b1");
        assertThat(replyCaptor.getValue().getText()).isEqualTo("Yes, still available");
        List<Message> history = store.history("c1");
        assertThat(history).singleElement().satisfies(message -> {
            assertThat(message.getRole()).isEqualTo(MessageRole.OUTBOUND);
            assertThat(message.getDedupKey()).isEqualTo("reply:b1");
        });
        verify(eventPublisher).publish(eq("c1"), eq(ConversationEventType.REPLY_SENT), anyMap());
        verify(meetupLogService, never()).record(any());
    }

    @Test
    void replyForSameBatchIsSentOnlyOnce() {
        dispatcher.dispatch("c1", "Dana", decision("b1", false), "Yes");

        boolean second = dispatcher.dispatch("c1", "Dana", decision("b1", false), "Yes");

        assertThat(second).isFalse();
        verify(sink, times(1)).deliver(any());
    }

    @Test
    void failedDeliveryIsRetriedThenReported() {
        doThrow(new ReplyDeliveryException("broker down", null)).when(sink).deliver(any());

        assertThatThrownBy(() -> dispatcher.dispatch("c1", "Dana", decision("b1", false), "Yes"))
                .isInstanceOf(ReplyDeliveryException.class);

        verify(sink, times(3)).deliver(any());
        assertThat(store.history("c1")).isEmpty();
        verify(eventPublisher).publish(eq("c1"), eq(ConversationEventType.REPLY_FAILED), anyMap());
    }

    @Test
    void confirmedMeetupIsLogged() {
        when(listingProfileService.current()).thenReturn(ListingProfile.builder()
                .items(List.of(ListingItem.builder()
                        .id("cable-1m")
                        .name("USB-C cable")
                        .listedPrice(BigDecimal.valueOf(4))
                        .bottomPrice(BigDecimal.valueOf(3))
                        .build()))
                .activeItemId("cable-1m")
                .location("Brighouse library")
                .build());
        when(meetupLogService.record(any())).thenAnswer(invocation -> invocation.getArgument(0));

        dispatcher.dispatch("c1", "Dana", decision("b1", true), "See you at 5pm");

        verify(meetupLogService).record(meetupCaptor.capture());
        MeetupRecord record = meetupCaptor.getValue();
        assertThat(record.getItemName()).isEqualTo("USB-C cable");
        assertThat(record.getLocation()).isEqualTo("Brighouse library");
        assertThat(record.getMeetupTimeText()).isEqualTo("Tomorrow 5pm");
        assertThat(record.getDisplayName()).isEqualTo("Dana");
        verify(eventPublisher).publish(eq("c1"), eq(ConversationEventType.MEETUP_CONFIRMED), anyMap());
    }

    private Decision decision(String batchId, boolean meetup) {
        return Decision.builder()
                .batchId(batchId)
                .conversationId("c1")
                .classification(meetup ? Classification.NEEDS_APPROVAL : Classification.AUTO)
                .category(meetup ? SensitivityCategory.SCHEDULING : SensitivityCategory.AVAILABILITY)
                .meetupConfirmed(meetup)
                .meetupTimeText(meetup ? "Tomorrow 5pm" : null)
                .build();
    }
}
