package com.example.autopilot.persistence;

import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

public interface ConversationJpaRepository extends JpaRepository<ConversationEntity, String> {

    @Query("select c.id from ConversationEntity c order by c.createdAt")
    List<String> findAllIds();
}
