package com.example.autopilot.persistence;

import java.util.List;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

public interface MeetupJpaRepository extends JpaRepository<MeetupEntity, Long> {

    List<MeetupEntity> findAllByOrderByLoggedAtDesc(Pageable pageable);
}
