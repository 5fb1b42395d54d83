package com.example.autopilot.service;

import com.example.autopilot.config.AutopilotProperties;
import com.example.autopilot.domain.ListingItem;
import com.example.autopilot.domain.ListingProfile;
import com.example.autopilot.service.exception.ServiceException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RBucket;
import org.redisson.api.RedissonClient;
import org.redisson.client.RedisException;
import org.redisson.codec.TypedJsonJacksonCodec;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Seller listing facts. Defaults come from {@code autopilot.listing}; runtime edits live in a Redis
 * bucket until the next {@link #reload()}.
 */
@Slf4j
@Service
public class ListingProfileService {

    private final RedissonClient redissonClient;
    private final RedisKeyFactory keyFactory;
    private final AutopilotProperties properties;
    private final Clock clock;
    private final TypedJsonJacksonCodec profileCodec;

    public ListingProfileService(
            RedissonClient redissonClient,
            RedisKeyFactory keyFactory,
            AutopilotProperties properties,
            Clock clock,
            ObjectMapper objectMapper) {
        this.redissonClient = redissonClient;
        this.keyFactory = keyFactory;
        this.properties = properties;
        this.clock = clock;
        this.profileCodec = new TypedJsonJacksonCodec(ListingProfile.class, objectMapper);
    }

    public ListingProfile current() {
        try {
            ListingProfile stored = bucket().get();
            return stored != null ? stored : defaults();
        } catch (RedisException ex) {
            log.warn("Listing profile unavailable, using configured defaults: {}", ex.getMessage());
            return defaults();
        }
    }

    public ListingProfile updateAvailability(String availabilityNote) {
        ListingProfile updated = current().toBuilder()
                .availabilityNote(StringUtils.hasText(availabilityNote) ? availabilityNote.trim() : null)
                .updatedAt(clock.instant())
                .build();
        bucket().set(updated);
        log.info("Availability note updated");
        return updated;
    }

    public ListingProfile activateItem(String itemId) {
        ListingProfile profile = current();
        boolean known = profile.getItems() != null
                && profile.getItems().stream().anyMatch(item -> item.getId().equals(itemId));
        if (!known) {
            throw new ServiceException(HttpStatus.NOT_FOUND, "Unknown listing item " + itemId, "unknown_item");
        }
        ListingProfile updated = profile.toBuilder()
                .activeItemId(itemId)
                .updatedAt(clock.instant())
                .build();
        bucket().set(updated);
        log.info("Active listing item set to {}", itemId);
        return updated;
    }

    /**
     * Drops runtime edits and goes back to the configured profile.
     */
    public ListingProfile reload() {
        ListingProfile profile = defaults();
        bucket().set(profile);
        log.info("Listing profile reloaded from configuration ({} items)", profile.getItems().size());
        return profile;
    }

    public ZonedDateTime localTime() {
        ZoneId zone;
        try {
            zone = ZoneId.of(properties.getListing().getTimeZone());
        } catch (RuntimeException ex) {
            log.warn("Invalid listing time zone '{}', using UTC", properties.getListing().getTimeZone());
            zone = ZoneId.of("UTC");
        }
        return ZonedDateTime.ofInstant(clock.instant(), zone);
    }

    ListingProfile defaults() {
        AutopilotProperties.Listing listing = properties.getListing();
        List<ListingItem> items = listing.getItems().stream()
                .filter(item -> StringUtils.hasText(item.getId()))
                .map(item -> ListingItem.builder()
                        .id(item.getId())
                        .name(item.getName())
                        .listedPrice(item.getListedPrice())
                        .bottomPrice(item.getBottomPrice())
                        .build())
                .toList();
        return ListingProfile.builder()
                .items(items)
                .activeItemId(listing.getActiveItemId())
                .location(listing.getLocation())
                .availabilityNote(listing.getAvailabilityNote())
                .updatedAt(clock.instant())
                .build();
    }

    private RBucket<ListingProfile> bucket() {
        return redissonClient.getBucket(keyFactory.listingProfileKey(), profileCodec);
    }
}
