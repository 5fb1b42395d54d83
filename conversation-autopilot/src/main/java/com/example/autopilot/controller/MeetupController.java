package com.example.autopilot.controller;

import com.example.autopilot.domain.MeetupRecord;
import com.example.autopilot.service.MeetupLogService;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/meetups")
@RequiredArgsConstructor
public class MeetupController {

    private final MeetupLogService meetupLogService;

    @GetMapping
    public ResponseEntity<List<MeetupRecord>> recent(@RequestParam(name = "limit", defaultValue = "50") int limit) {
        return ResponseEntity.ok(meetupLogService.recent(limit));
    }
}
