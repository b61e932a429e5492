package com.autoposter.repository;

import com.autoposter.model.Topic;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface TopicRepository extends JpaRepository<Topic, Long> {
    List<Topic> findByEnabledTrueOrderByIdAsc();
    List<Topic> findAllByOrderByIdAsc();
    boolean existsByNameIgnoreCase(String name);
}
