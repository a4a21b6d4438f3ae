package com.enterprise.approval.controller;

import java.util.List;

import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.enterprise.approval.config.SlaProperties;
import com.enterprise.approval.dto.response.ApiResponse;
import com.enterprise.approval.dto.response.ApprovalRequestResponse;
import com.enterprise.approval.service.SlaDeadlineTracker;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@RestController
@RequestMapping("/api/v1/sla")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "SLA", description = "Deadline warnings and breaches")
@SecurityRequirement(name = "bearerAuth")
@PreAuthorize("hasAnyRole('MANAGER', 'ADMIN')")
public class SlaController {

    private final SlaDeadlineTracker slaTracker;
    private final SlaProperties slaProperties;

    @GetMapping("/warnings")
    @Operation(summary = "Requests close to their deadline")
    public ResponseEntity<ApiResponse<List<ApprovalRequestResponse>>> getWarnings(
            @Parameter(description = "Look-ahead in hours") @RequestParam(required = false) Integer thresholdHours) {
        int threshold = thresholdHours != null ? thresholdHours : slaProperties.getWarningThresholdHours();
        if (threshold <= 0) {
            throw new IllegalArgumentException("thresholdHours must be positive");
        }
        log.debug("Fetching SLA warnings within {} hours", threshold);
        List<ApprovalRequestResponse> response = slaTracker.getWarnings(threshold).stream()
                .map(ApprovalRequestResponse::from)
                .toList();
        return ResponseEntity.ok(ApiResponse.success(response));
    }

    @GetMapping("/overdue")
    @Operation(summary = "Requests past their deadline")
    public ResponseEntity<ApiResponse<List<ApprovalRequestResponse>>> getOverdue() {
        log.debug("Fetching overdue requests");
        List<ApprovalRequestResponse> response = slaTracker.getOverdue().stream()
                .map(ApprovalRequestResponse::from)
                .toList();
        return ResponseEntity.ok(ApiResponse.success(response));
    }
}
