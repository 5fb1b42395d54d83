package com.example.autopilot.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.autopilot.domain.Batch;
import com.example.autopilot.domain.BatchCloseReason;
import com.example.autopilot.domain.Classification;
import com.example.autopilot.domain.Decision;
import com.example.autopilot.domain.ListingProfile;
import com.example.autopilot.domain.Message;
import com.example.autopilot.domain.MessageRole;
import com.example.autopilot.domain.SensitivityCategory;
import com.example.autopilot.reasoning.ReasoningClient;
import com.example.autopilot.reasoning.ReasoningRequest;
import com.example.autopilot.reasoning.ReasoningResult;
import com.example.autopilot.service.exception.ReasoningException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class DecisionRouterTest {

    private static final Instant NOW = Instant.parse("2026-03-01T18:00:04Z");

    @Mock
    private ReasoningClient reasoningClient;

    @Captor
    private ArgumentCaptor<ReasoningRequest> requestCaptor;

    private DecisionRouter router;

    @BeforeEach
    void setUp() {
        router = new DecisionRouter(reasoningClient, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void allowlistedCategoryWithReplyIsAnsweredAutomatically() {
        when(reasoningClient.analyze(any())).thenReturn(ReasoningResult.builder()
                .category("availability")
                .requiresApproval(false)
                .replyIfAccepted("  Yes, still available!  ")
                .intentSummary("Asks if available")
                .build());

        Decision decision = router.classify(batch("Is it available?"), context());

        assertThat(decision.getClassification()).isEqualTo(Classification.AUTO);
        assertThat(decision.getCategory()).isEqualTo(SensitivityCategory.AVAILABILITY);
        assertThat(decision.getProposedReply()).isEqualTo("Yes, still available!");
        assertThat(decision.getIntentLabel()).isEqualTo("Asks if available");
        assertThat(decision.getBatchId()).isEqualTo("batch-1");
        assertThat(decision.getDecidedAt()).isEqualTo(NOW);
    }

    @Test
    void wholeBatchIsSentToReasoning() {
        when(reasoningClient.analyze(any())).thenReturn(ReasoningResult.builder()
                .category("price_negotiation")
                .requiresApproval(true)
                .replyIfAccepted("Lowest I can do is $3")
                .build());

        Decision decision = router.classify(batch("Is it available?", "Also is it negotiable?"), context());

        verify(reasoningClient).analyze(requestCaptor.capture());
        assertThat(requestCaptor.getValue().getBatchMessages())
                .containsExactly("Is it available?", "Also is it negotiable?");
        assertThat(requestCaptor.getValue().getDisplayName()).isEqualTo("Dana");
        assertThat(decision.getClassification()).isEqualTo(Classification.NEEDS_APPROVAL);
        assertThat(decision.getCategory()).isEqualTo(SensitivityCategory.PRICING);
        assertThat(decision.getIntentLabel()).isEqualTo("Price negotiation");
        assertThat(decision.getBatchText()).isEqualTo("Is it available?\nAlso is it negotiable?");
    }

    @Test
    void sensitiveCategoryNeedsApprovalEvenWhenModelSaysOtherwise() {
        when(reasoningClient.analyze(any())).thenReturn(ReasoningResult.builder()
                .category("delivery_trade_payment")
                .requiresApproval(false)
                .replyIfAccepted("Sure, I can ship it")
                .build());

        Decision decision = router.classify(batch("Can you ship?"), context());

        assertThat(decision.getClassification()).isEqualTo(Classification.NEEDS_APPROVAL);
        assertThat(decision.getCategory()).isEqualTo(SensitivityCategory.DELIVERY);
    }

    @Test
    void modelRequestingApprovalOverridesAllowlist() {
        when(reasoningClient.analyze(any())).thenReturn(ReasoningResult.builder()
                .category("simple_question")
                .requiresApproval(true)
                .replyIfAccepted("It is 1m long")
                .build());

        assertThat(router.classify(batch("How long?"), context()).getClassification())
                .isEqualTo(Classification.NEEDS_APPROVAL);
    }

    @Test
    void allowlistedCategoryWithoutReplyNeedsApproval() {
        when(reasoningClient.analyze(any())).thenReturn(ReasoningResult.builder()
                .category("availability")
                .requiresApproval(false)
                .replyIfAccepted("   ")
                .build());

        Decision decision = router.classify(batch("Still there?"), context());

        assertThat(decision.getClassification()).isEqualTo(Classification.NEEDS_APPROVAL);
        assertThat(decision.getProposedReply()).isNull();
    }

    @Test
    void confirmedMeetupAlwaysGoesToOwner() {
        when(reasoningClient.analyze(any())).thenReturn(ReasoningResult.builder()
                .category("meetup_confirmation")
                .requiresApproval(false)
                .meetupConfirmed(true)
                .meetupTimeText("Tomorrow 5pm")
                .replyIfAccepted("See you tomorrow at 5pm")
                .build());

        Decision decision = router.classify(batch("Tomorrow 5pm works"), context());

        assertThat(decision.getClassification()).isEqualTo(Classification.NEEDS_APPROVAL);
        assertThat(decision.isMeetupConfirmed()).isTrue();
        assertThat(decision.getMeetupTimeText()).isEqualTo("Tomorrow 5pm");
    }

    @Test
    void reasoningFailureEscalates() {
        when(reasoningClient.analyze(any())).thenThrow(new ReasoningException("All reasoning endpoints failed"));

        Decision decision = router.classify(batch("Hello?"), context());

        assertThat(decision.getClassification()).isEqualTo(Classification.NEEDS_APPROVAL);
        assertThat(decision.getCategory()).isEqualTo(SensitivityCategory.ESCALATION);
        assertThat(decision.getIntentLabel()).isEqualTo(DecisionRouter.REASONING_FAILED_LABEL);
        assertThat(decision.getProposedReply()).isNull();
    }

    @Test
    void unknownCategoryEscalatesButKeepsSuggestedReplies() {
        when(reasoningClient.analyze(any())).thenReturn(ReasoningResult.builder()
                .category("haggling")
                .replyIfAccepted("Maybe")
                .replyIfDeclined("No thanks")
                .build());

        Decision decision = router.classify(batch("Would you take $1?"), context());

        assertThat(decision.getClassification()).isEqualTo(Classification.NEEDS_APPROVAL);
        assertThat(decision.getCategory()).isEqualTo(SensitivityCategory.ESCALATION);
        assertThat(decision.getProposedReply()).isEqualTo("Maybe");
        assertThat(decision.getDeclineSuggestion()).isEqualTo("No thanks");
    }

    private Batch batch(String... texts) {
        List<Message> messages = Arrays.stream(texts)
                .map(text -> Message.builder()
                        .conversationId("c1")
                        .role(MessageRole.INBOUND)
                        .text(text)
                        .dedupKey("k-" + text.hashCode())
                        .build())
                .toList();
        return Batch.builder()
                .id("batch-1")
                .conversationId("c1")
                .messages(messages)
                .openedAt(NOW.minusSeconds(4))
                .lastExtendedAt(NOW.minusSeconds(3))
                .closed(true)
                .closedAt(NOW)
                .closeReason(BatchCloseReason.QUIET_WINDOW)
                .build();
    }

    private ConversationContext context() {
        return ConversationContext.builder()
                .conversationId("c1")
                .displayName("Dana")
                .history(List.of())
                .listing(ListingProfile.builder().items(List.of()).location("Library").build())
                .localTime(ZonedDateTime.ofInstant(NOW, ZoneOffset.UTC))
                .build();
    }
}
