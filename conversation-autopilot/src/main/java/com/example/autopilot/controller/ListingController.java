package com.example.autopilot.controller;

import com.example.autopilot.domain.ListingProfile;
import com.example.autopilot.dto.ActiveItemRequest;
import com.example.autopilot.dto.AvailabilityRequest;
import com.example.autopilot.service.ListingProfileService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/listing")
@RequiredArgsConstructor
public class ListingController {

    private final ListingProfileService listingProfileService;

    @GetMapping
    public ResponseEntity<ListingProfile> current() {
        return ResponseEntity.ok(listingProfileService.current());
    }

    @PutMapping("/availability")
    public ResponseEntity<ListingProfile> updateAvailability(@Valid @RequestBody AvailabilityRequest request) {
        return ResponseEntity.ok(listingProfileService.updateAvailability(request.getAvailabilityNote()));
    }

    @PutMapping("/active-item")
    public ResponseEntity<ListingProfile> activateItem(@Valid @RequestBody ActiveItemRequest request) {
        return ResponseEntity.ok(listingProfileService.activateItem(request.getItemId()));
    }

    @PostMapping("/reload")
    public ResponseEntity<ListingProfile> reload() {
        return ResponseEntity.ok(listingProfileService.reload());
    }
}
