package com.example.autopilot.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.autopilot.config.AutopilotProperties;
import com.example.autopilot.domain.ListingItem;
import com.example.autopilot.domain.ListingProfile;
import com.example.autopilot.service.exception.ServiceException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.math.BigDecimal;
import java.time.Clock;
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
import org.redisson.api.RBucket;
import org.redisson.api.RedissonClient;
import org.redisson.client.RedisException;
import org.redisson.client.codec.Codec;

@ExtendWith(MockitoExtension.class)
class ListingProfileServiceTest {

    @Mock
    private RedissonClient redissonClient;

    @Mock
    private RBucket<ListingProfile> bucket;

    @Captor
    private ArgumentCaptor<ListingProfile> profileCaptor;

    private final AutopilotProperties properties = new AutopilotProperties();

    private ListingProfileService service;

    @BeforeEach
    void setUp() {
        AutopilotProperties.Listing.Item cable = new AutopilotProperties.Listing.Item();
        cable.setId("cable-1m");
        cable.setName("Type C cable 1m");
        cable.setListedPrice(new BigDecimal("4"));
        cable.setBottomPrice(new BigDecimal("3"));
        properties.getListing().setItems(List.of(cable));
        properties.getListing().setActiveItemId("cable-1m");
        properties.getListing().setLocation("Library");
        properties.getListing().setTimeZone("America/Vancouver");
        lenient().when(redissonClient.<ListingProfile>getBucket(anyString(), any(Codec.class))).thenReturn(bucket);
        service = new ListingProfileService(redissonClient, new RedisKeyFactory(properties), properties,
                Clock.fixed(Instant.parse("2026-03-01T18:00:00Z"), ZoneOffset.UTC), new ObjectMapper());
    }

    @Test
    void configuredProfileIsUsedUntilEdited() {
        when(bucket.get()).thenReturn(null);

        ListingProfile profile = service.current();

        assertThat(profile.activeItem()).map(ListingItem::getName).contains("Type C cable 1m");
        assertThat(profile.getLocation()).isEqualTo("Library");
    }

    @Test
    void redisOutageFallsBackToConfiguredProfile() {
        when(bucket.get()).thenThrow(new RedisException("connection lost"));

        assertThat(service.current().getItems()).hasSize(1);
    }

    @Test
    void availabilityNoteIsStored() {
        when(bucket.get()).thenReturn(null);

        service.updateAvailability("  Weekends only ");

        verify(bucket).set(profileCaptor.capture());
        assertThat(profileCaptor.getValue().getAvailabilityNote()).isEqualTo("Weekends only");
    }

    @Test
    void unknownItemCannotBeActivated() {
        when(bucket.get()).thenReturn(null);

        assertThatThrownBy(() -> service.activateItem("sofa"))
                .isInstanceOf(ServiceException.class)
                .hasMessageContaining("sofa");
        verify(bucket, never()).set(any());
    }

    @Test
    void localTimeUsesListingZone() {
        assertThat(service.localTime().getHour()).isEqualTo(10);

        properties.getListing().setTimeZone("Mars/Olympus");
        assertThat(service.localTime().getZone().getId()).isEqualTo("UTC");
    }
}
