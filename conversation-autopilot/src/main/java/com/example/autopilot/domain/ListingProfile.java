package com.example.autopilot.domain;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Seller-side facts handed to the reasoning collaborator: what is for sale, where pickup happens
 * and when the seller is around.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ListingProfile implements Serializable {

    private List<ListingItem> items;
    private String activeItemId;
    private String location;
    private String availabilityNote;
    private Instant updatedAt;

    public Optional<ListingItem> activeItem() {
        if (items == null || items.isEmpty()) {
            return Optional.empty();
        }
        return items.stream()
                .filter(item -> item.getId() != null && item.getId().equals(activeItemId))
                .findFirst()
                .or(() -> Optional.of(items.get(0)));
    }
}
