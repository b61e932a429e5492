package com.autoposter.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Persisted scheduler state. A single row ({@link #SINGLETON_ID}) owned by the posting scheduler.
 */
@Getter
@Setter
@Entity
@Table(name = "schedule_state")
public class ScheduleState {

    public static final long SINGLETON_ID = 1L;

    @Id
    private Long id = SINGLETON_ID;

    @Column(name = "interval_seconds", nullable = false)
    private long intervalSeconds;

    @Column(name = "next_fire_at", nullable = false)
    private OffsetDateTime nextFireAt;

    @Column(nullable = false)
    private boolean enabled;

    @Enumerated(EnumType.STRING)
    @Column(name = "last_cycle_status", length = 16)
    private PostStatus lastCycleStatus;

    @Column(name = "last_cycle_at")
    private OffsetDateTime lastCycleAt;

    /**
     * Ids of the most recently selected topics, oldest first.
     */
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "recent_topic_ids", nullable = false, columnDefinition = "jsonb")
    private List<Long> recentTopicIds = new ArrayList<>();

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt = OffsetDateTime.now();
}
