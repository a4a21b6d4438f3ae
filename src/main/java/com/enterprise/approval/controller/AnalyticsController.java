package com.enterprise.approval.controller;

import java.time.LocalDateTime;
import java.util.List;

import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.enterprise.approval.dto.response.ApiResponse;
import com.enterprise.approval.dto.response.ApprovalRequestResponse;
import com.enterprise.approval.dto.response.HistoryEntryResponse;
import com.enterprise.approval.dto.response.PageResponse;
import com.enterprise.approval.service.AnalyticsReadService;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;

/**
 * Read-only ranged access for reporting.
 */
@RestController
@RequestMapping("/api/v1/analytics")
@RequiredArgsConstructor
@Tag(name = "Analytics", description = "Ranged read access to requests, history and recent activity")
@SecurityRequirement(name = "bearerAuth")
@PreAuthorize("hasRole('ADMIN')")
public class AnalyticsController {

    private final AnalyticsReadService analyticsService;

    @GetMapping("/requests")
    @Operation(summary = "Requests submitted in a range")
    public ResponseEntity<ApiResponse<PageResponse<ApprovalRequestResponse>>> getRequests(
            @Parameter(description = "Start (ISO format)") @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime from,
            @Parameter(description = "End (ISO format)") @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime to,
            @RequestParam(defaultValue = "0") @Min(0) int page,
            @RequestParam(defaultValue = "50") @Min(1) @Max(500) int size) {
        PageResponse<ApprovalRequestResponse> response = PageResponse.from(
                analyticsService.requestsSubmittedBetween(from, to,
                        PageRequest.of(page, size, Sort.by("submittedAt"))),
                ApprovalRequestResponse::from);
        return ResponseEntity.ok(ApiResponse.success(response));
    }

    @GetMapping("/history")
    @Operation(summary = "History entries recorded in a range")
    public ResponseEntity<ApiResponse<PageResponse<HistoryEntryResponse>>> getHistory(
            @Parameter(description = "Start (ISO format)") @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime from,
            @Parameter(description = "End (ISO format)") @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime to,
            @RequestParam(defaultValue = "0") @Min(0) int page,
            @RequestParam(defaultValue = "50") @Min(1) @Max(500) int size) {
        PageResponse<HistoryEntryResponse> response = PageResponse.from(
                analyticsService.historyBetween(from, to, PageRequest.of(page, size, Sort.by("performedAt"))),
                HistoryEntryResponse::from);
        return ResponseEntity.ok(ApiResponse.success(response));
    }

    @GetMapping("/activity")
    @Operation(summary = "Most recent history entries, optionally for one actor")
    public ResponseEntity<ApiResponse<List<HistoryEntryResponse>>> getActivity(
            @Parameter(description = "Actor id filter") @RequestParam(required = false) String actorId,
            @RequestParam(defaultValue = "20") @Min(1) @Max(200) int limit) {
        List<HistoryEntryResponse> response = analyticsService.recentActivity(actorId, limit).stream()
                .map(HistoryEntryResponse::from)
                .toList();
        return ResponseEntity.ok(ApiResponse.success(response));
    }
}
