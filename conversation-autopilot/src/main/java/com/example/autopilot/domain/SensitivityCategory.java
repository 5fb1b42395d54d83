package com.example.autopilot.domain;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Fixed sensitivity vocabulary. Only the first three categories may be answered without a human.
 */
public enum SensitivityCategory {
    AVAILABILITY("Availability question", true),
    PICKUP_LOCATION("Pickup location question", true),
    GENERAL_FAQ("General question", true),
    PRICING("Price negotiation", false),
    SCHEDULING("Meetup scheduling", false),
    DELIVERY("Delivery, trade or payment", false),
    ESCALATION("Needs owner attention", false);

    private static final Map<String, SensitivityCategory> ALIASES = Map.ofEntries(
            Map.entry("simple_question", GENERAL_FAQ),
            Map.entry("price_negotiation", PRICING),
            Map.entry("delivery_trade_payment", DELIVERY),
            Map.entry("meetup_scheduling", SCHEDULING),
            Map.entry("meetup_confirmation", SCHEDULING),
            Map.entry("other", ESCALATION));

    private final String label;
    private final boolean autoAnswerable;

    SensitivityCategory(String label, boolean autoAnswerable) {
        this.label = label;
        this.autoAnswerable = autoAnswerable;
    }

    public String getLabel() {
        return label;
    }

    public boolean isAutoAnswerable() {
        return autoAnswerable;
    }

    public static Optional<SensitivityCategory> fromLabel(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        SensitivityCategory alias = ALIASES.get(normalized);
        if (alias != null) {
            return Optional.of(alias);
        }
        for (SensitivityCategory category : values()) {
            if (category.name().equalsIgnoreCase(normalized)) {
                return Optional.of(category);
            }
        }
        return Optional.empty();
    }
}
