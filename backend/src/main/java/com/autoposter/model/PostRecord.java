package com.autoposter.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * Durable outcome of one cycle. Written once by the history store and never updated;
 * a re-attempt produces a new record.
 */
@Getter
@Builder
@Immutable
@Entity
@Table(name = "post_record")
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class PostRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "topic_id")
    private Long topicId;

    @Column(name = "topic_name", length = 128)
    private String topicName;

    @Enumerated(EnumType.STRING)
    @Column(name = "category", length = 32)
    private TopicCategory category;

    @Column(name = "body_text", columnDefinition = "TEXT")
    private String bodyText;

    @Builder.Default
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "hashtags", nullable = false, columnDefinition = "jsonb")
    private List<String> hashtags = List.of();

    @Column(name = "image_ref", length = 1024)
    private String imageRef;

    @Column(name = "platform_post_id", length = 128)
    private String platformPostId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private PostStatus status;

    @Enumerated(EnumType.STRING)
    @Column(name = "failure_reason", length = 32)
    private FailureReason failureReason;

    @Enumerated(EnumType.STRING)
    @Column(name = "failure_stage", length = 32)
    private FailureStage failureStage;

    @Column(name = "failure_detail", length = 512)
    private String failureDetail;

    @Enumerated(EnumType.STRING)
    @Column(name = "generation_method", length = 16)
    private GenerationMethod generationMethod;

    @Enumerated(EnumType.STRING)
    @Column(name = "trigger_type", nullable = false, length = 16)
    private CycleTrigger trigger;

    @Column(name = "attempt_count", nullable = false)
    private int attemptCount;

    @Column(name = "created_at", nullable = false)
    private OffsetDateTime createdAt;
}
