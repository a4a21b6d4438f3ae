package com.enterprise.approval.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

import com.enterprise.approval.model.enums.ApprovalAction;
import com.enterprise.approval.model.enums.Role;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * One stage of a workflow. Stored as part of a definition and copied verbatim
 * into the steps snapshot of every request created from it.
 *
 * @param stepId          identifier of the step within its workflow
 * @param role            role expected to act on the step
 * @param actions         actions allowed while the step is current
 * @param slaHours        time budget of the step, in hours
 * @param required        whether the step is copied into new requests
 * @param order           optional display order, positive when present
 * @param escalationRole  optional role the step escalates to
 * @param escalationHours optional hours after step start at which escalation is due
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record StepDefinition(
        String stepId,
        Role role,
        Set<ApprovalAction> actions,
        Integer slaHours,
        Boolean required,
        Integer order,
        Role escalationRole,
        Integer escalationHours) {

    public StepDefinition {
        actions = actions == null
                ? Collections.emptySet()
                : Collections.unmodifiableSet(new LinkedHashSet<>(actions));
    }

    public boolean allows(ApprovalAction action) {
        return actions.contains(action);
    }

    public boolean includedInRequests() {
        return !Boolean.FALSE.equals(required);
    }

    public boolean escalates() {
        return escalationRole != null;
    }
}
