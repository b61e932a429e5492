package com.autoposter.repository;

import com.autoposter.model.PostRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface PostRecordRepository extends JpaRepository<PostRecord, Long>, JpaSpecificationExecutor<PostRecord> {
    Optional<PostRecord> findFirstByOrderByCreatedAtDescIdDesc();
}
