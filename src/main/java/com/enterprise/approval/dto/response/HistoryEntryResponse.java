package com.enterprise.approval.dto.response;

import java.time.LocalDateTime;
import java.util.Map;
import java.util.UUID;

import com.enterprise.approval.model.entity.RequestHistoryEntry;
import com.enterprise.approval.model.enums.HistoryAction;
import com.enterprise.approval.model.enums.Role;
import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class HistoryEntryResponse {

    private UUID id;
    private UUID requestId;
    private Integer sequence;
    private String actorId;
    private String actorEmail;
    private Role actorRole;
    private HistoryAction action;
    private String stepId;
    private String comment;
    private Map<String, Object> metadata;
    private LocalDateTime performedAt;

    public static HistoryEntryResponse from(RequestHistoryEntry entry) {
        return HistoryEntryResponse.builder()
                .id(entry.getId())
                .requestId(entry.getRequestId())
                .sequence(entry.getSequence())
                .actorId(entry.getActorId())
                .actorEmail(entry.getActorEmail())
                .actorRole(entry.getActorRole())
                .action(entry.getAction())
                .stepId(entry.getStepId())
                .comment(entry.getComment())
                .metadata(entry.getMetadata())
                .performedAt(entry.getPerformedAt())
                .build();
    }
}
