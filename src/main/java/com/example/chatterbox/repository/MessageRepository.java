package com.example.chatterbox.repository;

import com.example.chatterbox.entity.Message;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Spring Data JPA repository for {@link com.example.chatterbox.entity.Message} entities.
 */
@Repository
public interface MessageRepository extends JpaRepository<Message, Long> {

    /**
     * Returns every message, oldest first. Messages created in the same instant keep insertion order.
     *
     * @return all messages ordered by {@code createdAt} ascending, then {@code id} ascending
     */
    List<Message> findAllByOrderByCreatedAtAscIdAsc();
}
