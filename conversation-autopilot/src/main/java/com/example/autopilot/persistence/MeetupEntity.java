package com.example.autopilot.persistence;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
@Entity
@Table(name = "autopilot_meetups")
public class MeetupEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "conversation_id", nullable = false, length = 128)
    private String conversationId;

    @Column(name = "display_name", length = 255)
    private String displayName;

    @Column(name = "item_name", length = 255)
    private String itemName;

    @Column(name = "location", length = 255)
    private String location;

    @Column(name = "meetup_time_text", length = 255)
    private String meetupTimeText;

    @Column(name = "notes", columnDefinition = "text")
    private String notes;

    @Column(name = "logged_at", nullable = false)
    private Instant loggedAt;
}
