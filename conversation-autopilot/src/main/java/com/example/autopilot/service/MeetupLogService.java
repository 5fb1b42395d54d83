package com.example.autopilot.service;

import com.example.autopilot.domain.MeetupRecord;
import com.example.autopilot.persistence.MeetupEntity;
import com.example.autopilot.persistence.MeetupJpaRepository;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Slf4j
@Service
@RequiredArgsConstructor
public class MeetupLogService {

    private final MeetupJpaRepository meetupJpaRepository;

    @Transactional
    public MeetupRecord record(MeetupRecord record) {
        MeetupEntity entity = new MeetupEntity();
        entity.setConversationId(record.getConversationId());
        entity.setDisplayName(record.getDisplayName());
        entity.setItemName(record.getItemName());
        entity.setLocation(record.getLocation());
        entity.setMeetupTimeText(record.getMeetupTimeText());
        entity.setNotes(record.getNotes());
        entity.setLoggedAt(record.getLoggedAt());
        MeetupEntity saved = meetupJpaRepository.save(entity);
        log.info("Logged meetup with {} at {} for conversation {}",
                record.getDisplayName(), record.getMeetupTimeText(), record.getConversationId());
        return toRecord(saved);
    }

    @Transactional(readOnly = true)
    public List<MeetupRecord> recent(int limit) {
        return meetupJpaRepository.findAllByOrderByLoggedAtDesc(PageRequest.of(0, Math.max(limit, 1))).stream()
                .map(this::toRecord)
                .toList();
    }

    private MeetupRecord toRecord(MeetupEntity entity) {
        return MeetupRecord.builder()
                .id(entity.getId())
                .conversationId(entity.getConversationId())
                .displayName(entity.getDisplayName())
                .itemName(entity.getItemName())
                .location(entity.getLocation())
                .meetupTimeText(entity.getMeetupTimeText())
                .notes(entity.getNotes())
                .loggedAt(entity.getLoggedAt())
                .build();
    }
}
