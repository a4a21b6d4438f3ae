package com.enterprise.approval.controller;

import java.util.UUID;

import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.enterprise.approval.dto.request.CloneWorkflowRequest;
import com.enterprise.approval.dto.request.CreateWorkflowRequest;
import com.enterprise.approval.dto.request.UpdateWorkflowRequest;
import com.enterprise.approval.dto.response.ApiResponse;
import com.enterprise.approval.dto.response.PageResponse;
import com.enterprise.approval.dto.response.WorkflowDefinitionResponse;
import com.enterprise.approval.security.SecurityUtils;
import com.enterprise.approval.service.WorkflowDefinitionService;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * REST API controller for workflow definitions.
 */
@RestController
@RequestMapping("/api/v1/workflows")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Workflows", description = "Versioned approval workflow definitions")
@SecurityRequirement(name = "bearerAuth")
public class WorkflowDefinitionController {

    private final WorkflowDefinitionService workflowService;
    private final SecurityUtils securityUtils;

    @PostMapping
    @Operation(summary = "Create a workflow", description = "Stores a new version of a workflow for its flow key")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<ApiResponse<WorkflowDefinitionResponse>> createWorkflow(
            @Valid @RequestBody CreateWorkflowRequest request) {
        log.info("Creating workflow {} for flow {}", request.getName(), request.getFlowKey());
        WorkflowDefinitionResponse response = WorkflowDefinitionResponse.from(
                workflowService.create(request, securityUtils.requireCurrentActor()));
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(response, "Workflow created successfully"));
    }

    @GetMapping
    @Operation(summary = "List workflows", description = "Lists workflow definitions, optionally filtered by active flag")
    public ResponseEntity<ApiResponse<PageResponse<WorkflowDefinitionResponse>>> listWorkflows(
            @Parameter(description = "Active flag") @RequestParam(required = false) Boolean active,
            @RequestParam(defaultValue = "0") @Min(0) int page,
            @RequestParam(defaultValue = "20") @Min(1) @Max(200) int size) {
        log.debug("Listing workflows (active={})", active);
        PageResponse<WorkflowDefinitionResponse> response = PageResponse.from(
                workflowService.list(active, PageRequest.of(page, size, Sort.by("flowKey", "definitionVersion"))),
                WorkflowDefinitionResponse::from);
        return ResponseEntity.ok(ApiResponse.success(response));
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get workflow by ID")
    public ResponseEntity<ApiResponse<WorkflowDefinitionResponse>> getWorkflow(
            @Parameter(description = "Workflow UUID") @PathVariable UUID id) {
        log.debug("Fetching workflow {}", id);
        return ResponseEntity.ok(ApiResponse.success(WorkflowDefinitionResponse.from(workflowService.findById(id))));
    }

    @GetMapping("/flow/{flowKey}")
    @Operation(summary = "Get active workflow for a flow key", description = "Returns the highest active version")
    public ResponseEntity<ApiResponse<WorkflowDefinitionResponse>> getActiveWorkflow(
            @Parameter(description = "Flow key") @PathVariable String flowKey) {
        log.debug("Fetching active workflow for flow {}", flowKey);
        return ResponseEntity.ok(ApiResponse.success(WorkflowDefinitionResponse.from(workflowService.findActive(flowKey))));
    }

    @PutMapping("/{id}")
    @Operation(summary = "Update workflow metadata", description = "Changes name, description or active flag")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<ApiResponse<WorkflowDefinitionResponse>> updateWorkflow(
            @Parameter(description = "Workflow UUID") @PathVariable UUID id,
            @Valid @RequestBody UpdateWorkflowRequest request) {
        WorkflowDefinitionResponse response = WorkflowDefinitionResponse.from(
                workflowService.update(id, request, securityUtils.requireCurrentActor()));
        return ResponseEntity.ok(ApiResponse.success(response, "Workflow updated successfully"));
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "Deactivate workflow", description = "Stops new requests from using this definition")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<ApiResponse<WorkflowDefinitionResponse>> deactivateWorkflow(
            @Parameter(description = "Workflow UUID") @PathVariable UUID id) {
        WorkflowDefinitionResponse response = WorkflowDefinitionResponse.from(
                workflowService.deactivate(id, securityUtils.requireCurrentActor()));
        return ResponseEntity.ok(ApiResponse.success(response, "Workflow deactivated successfully"));
    }

    @PostMapping("/{id}/clone")
    @Operation(summary = "Clone workflow", description = "Copies the steps into a new workflow under another flow key")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<ApiResponse<WorkflowDefinitionResponse>> cloneWorkflow(
            @Parameter(description = "Workflow UUID") @PathVariable UUID id,
            @Valid @RequestBody CloneWorkflowRequest request) {
        log.info("Cloning workflow {} into flow {}", id, request.getFlowKey());
        WorkflowDefinitionResponse response = WorkflowDefinitionResponse.from(
                workflowService.clone(id, request.getFlowKey(), request.getName(), securityUtils.requireCurrentActor()));
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(response, "Workflow cloned successfully"));
    }
}
