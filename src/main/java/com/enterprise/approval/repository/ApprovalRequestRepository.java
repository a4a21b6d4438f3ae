package com.enterprise.approval.repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import com.enterprise.approval.model.entity.ApprovalRequest;
import com.enterprise.approval.model.enums.RequestStatus;
import com.enterprise.approval.model.enums.Role;

@Repository
public interface ApprovalRequestRepository extends JpaRepository<ApprovalRequest, UUID> {

        @Query("SELECT r FROM ApprovalRequest r WHERE (:status IS NULL OR r.status = :status) "
                        + "AND (:type IS NULL OR r.type = :type) "
                        + "AND (:createdBy IS NULL OR r.createdBy = :createdBy) "
                        + "ORDER BY r.submittedAt DESC")
        List<ApprovalRequest> search(
                        @Param("status") RequestStatus status,
                        @Param("type") String type,
                        @Param("createdBy") String createdBy);

        List<ApprovalRequest> findByStatusAndSlaDeadlineBetweenOrderBySlaDeadlineAsc(
                        RequestStatus status, LocalDateTime from, LocalDateTime to);

        List<ApprovalRequest> findByStatusAndSlaDeadlineBeforeOrderBySlaDeadlineAsc(
                        RequestStatus status, LocalDateTime before);

        List<ApprovalRequest> findByStatusAndEscalatedToIsNull(RequestStatus status);

        Page<ApprovalRequest> findBySubmittedAtBetween(LocalDateTime from, LocalDateTime to, Pageable pageable);

        /**
         * Applies a state transition only if the row still holds the expected status,
         * step index and version.
         *
         * @return number of rows updated; 0 means another transition committed first
         */
        @Modifying(flushAutomatically = true, clearAutomatically = true)
        @Query("UPDATE ApprovalRequest r SET r.status = :status, r.currentStepIndex = :stepIndex, "
                        + "r.slaHours = :slaHours, r.slaDeadline = :slaDeadline, "
                        + "r.currentStepStartedAt = :stepStartedAt, r.escalatedTo = :escalatedTo, "
                        + "r.delegatedTo = :delegatedTo, r.completedAt = :completedAt, "
                        + "r.updatedAt = :updatedAt, r.version = r.version + 1 "
                        + "WHERE r.id = :id AND r.status = :expectedStatus "
                        + "AND r.currentStepIndex = :expectedStepIndex AND r.version = :expectedVersion")
        int applyTransition(
                        @Param("id") UUID id,
                        @Param("expectedStatus") RequestStatus expectedStatus,
                        @Param("expectedStepIndex") Integer expectedStepIndex,
                        @Param("expectedVersion") Long expectedVersion,
                        @Param("status") RequestStatus status,
                        @Param("stepIndex") Integer stepIndex,
                        @Param("slaHours") Integer slaHours,
                        @Param("slaDeadline") LocalDateTime slaDeadline,
                        @Param("stepStartedAt") LocalDateTime stepStartedAt,
                        @Param("escalatedTo") Role escalatedTo,
                        @Param("delegatedTo") String delegatedTo,
                        @Param("completedAt") LocalDateTime completedAt,
                        @Param("updatedAt") LocalDateTime updatedAt);
}
