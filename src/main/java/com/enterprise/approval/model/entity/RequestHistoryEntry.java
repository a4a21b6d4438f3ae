package com.enterprise.approval.model.entity;

import java.time.LocalDateTime;
import java.util.Map;
import java.util.UUID;

import org.hibernate.annotations.Immutable;

import com.enterprise.approval.model.converter.JsonDocumentConverter;
import com.enterprise.approval.model.enums.HistoryAction;
import com.enterprise.approval.model.enums.Role;

import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * Ledger row. Written once, never updated or deleted. Actor email and role are
 * copied at write time so later changes to the user do not rewrite history.
 */
@Entity
@Immutable
@Table(name = "request_history", indexes = {
        @Index(name = "idx_history_request", columnList = "request_id"),
        @Index(name = "idx_history_actor", columnList = "actor_id"),
        @Index(name = "idx_history_performed_at", columnList = "performed_at")
}, uniqueConstraints = {
        @UniqueConstraint(name = "uk_history_request_sequence", columnNames = { "request_id", "sequence_no" })
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
public class RequestHistoryEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "request_id", nullable = false, updatable = false)
    private UUID requestId;

    @Column(name = "sequence_no", nullable = false, updatable = false)
    private Integer sequence;

    @Column(name = "actor_id", nullable = false, updatable = false, length = 100)
    private String actorId;

    @Column(name = "actor_email", updatable = false, length = 255)
    private String actorEmail;

    @Enumerated(EnumType.STRING)
    @Column(name = "actor_role", updatable = false, length = 20)
    private Role actorRole;

    @Enumerated(EnumType.STRING)
    @Column(name = "action", nullable = false, updatable = false, length = 20)
    private HistoryAction action;

    @Column(name = "step_id", updatable = false, length = 64)
    private String stepId;

    @Column(name = "comment", updatable = false, columnDefinition = "TEXT")
    private String comment;

    @Convert(converter = JsonDocumentConverter.class)
    @Column(name = "metadata", updatable = false, columnDefinition = "TEXT")
    private Map<String, Object> metadata;

    @Column(name = "performed_at", nullable = false, updatable = false)
    private LocalDateTime performedAt;
}
