package com.example.autopilot.reasoning;

import com.example.autopilot.domain.ListingItem;
import com.example.autopilot.domain.ListingProfile;
import com.example.autopilot.domain.Message;
import com.example.autopilot.domain.MessageRole;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import org.springframework.stereotype.Component;

/**
 * Renders a {@link ReasoningRequest} as the user prompt of a chat completion.
 */
@Component
public class ReasoningPromptBuilder {

    static final String SYSTEM_PROMPT = "Output STRICT JSON only. No markdown. No extra text.";

    private static final DateTimeFormatter LOCAL_TIME = DateTimeFormatter.ofPattern("EEEE yyyy-MM-dd HH:mm zzz", Locale.ENGLISH);

    public String build(ReasoningRequest request) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("You are a marketplace seller assistant answering ")
                .append(nonBlank(request.getDisplayName(), "a buyer"))
                .append(".\n\n");
        if (request.getLocalTime() != null) {
            prompt.append("CURRENT LOCAL TIME: ").append(LOCAL_TIME.format(request.getLocalTime())).append("\n\n");
        }
        appendListing(prompt, request.getListing());
        prompt.append("CHAT HISTORY (most recent last):\n");
        appendHistory(prompt, request.getHistory());
        prompt.append("\nLATEST BUYER MESSAGES:\n\"\"\"")
                .append(String.join("\n", request.getBatchMessages()))
                .append("\"\"\"\n\n");
        prompt.append("Categorize the latest messages as one of: simple_question, price_negotiation, ")
                .append("delivery_trade_payment, meetup_scheduling, meetup_confirmation, other.\n")
                .append("requires_approval must be true for anything except simple questions. ")
                .append("Never present a meetup as final.\n")
                .append("Answer with one JSON object with the fields category, requires_approval, intent_summary, ")
                .append("reply_if_accepted, reply_if_declined, meetup_confirmed, meetup_time_text, notes_for_owner.\n")
                .append("Set meetup_confirmed true only if the buyer explicitly confirmed a time and the accepted ")
                .append("reply would finalize it.");
        return prompt.toString();
    }

    private void appendListing(StringBuilder prompt, ListingProfile listing) {
        if (listing == null) {
            return;
        }
        listing.activeItem().ifPresent(item -> appendItem(prompt, item));
        prompt.append("PICKUP LOCATION: ").append(nonBlank(listing.getLocation(), "not set")).append('\n');
        prompt.append("SELLER AVAILABILITY NOTE: ").append(nonBlank(listing.getAvailabilityNote(), "none")).append("\n\n");
    }

    private void appendItem(StringBuilder prompt, ListingItem item) {
        prompt.append("ACTIVE ITEM:\n")
                .append("- Name: ").append(item.getName()).append('\n')
                .append("- Listed price: ").append(item.getListedPrice()).append('\n')
                .append("- Lowest acceptable: ").append(item.getBottomPrice()).append('\n');
    }

    private void appendHistory(StringBuilder prompt, List<Message> history) {
        if (history == null || history.isEmpty()) {
            prompt.append("(no earlier messages)\n");
            return;
        }
        for (Message message : history) {
            prompt.append(message.getRole() == MessageRole.INBOUND ? "BUYER: " : "SELLER: ")
                    .append(message.getText())
                    .append('\n');
        }
    }

    private String nonBlank(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }
}
