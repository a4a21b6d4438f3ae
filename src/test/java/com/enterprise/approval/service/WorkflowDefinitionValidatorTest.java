package com.enterprise.approval.service;

import static com.enterprise.approval.support.Steps.step;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.enterprise.approval.config.ApprovalProperties;
import com.enterprise.approval.exception.WorkflowValidationException;
import com.enterprise.approval.model.StepDefinition;
import com.enterprise.approval.model.enums.ApprovalAction;
import com.enterprise.approval.model.enums.Role;

class WorkflowDefinitionValidatorTest {

    private WorkflowDefinitionValidator validator;

    @BeforeEach
    void setUp() {
        validator = new WorkflowDefinitionValidator(new ApprovalProperties());
    }

    @Test
    void acceptsWellFormedDefinition() {
        List<StepDefinition> steps = List.of(
                step("manager-review", Role.MANAGER, 24),
                new StepDefinition("admin-signoff", Role.ADMIN, Set.of(ApprovalAction.APPROVE), 48, true, 2,
                        null, null));

        assertThatCode(() -> validator.validate("Leave", "leave", steps)).doesNotThrowAnyException();
    }

    @Test
    void reportsEveryViolationAtOnce() {
        List<StepDefinition> steps = new ArrayList<>();
        steps.add(new StepDefinition(null, null, Set.of(), 0, true, 0, Role.EMPLOYEE, -1));

        WorkflowValidationException ex = catchThrowableOfType(
                () -> validator.validate(" ", null, steps), WorkflowValidationException.class);

        assertThat(ex.getErrors()).containsExactly(
                "name is required",
                "flowKey is required",
                "steps[0].stepId is required",
                "steps[0].role is required",
                "steps[0].actions must contain at least one action",
                "steps[0].slaHours must be a positive number",
                "steps[0].order must be a positive number",
                "steps[0].escalationRole must be MANAGER or ADMIN",
                "steps[0].escalationHours must be a positive number");
        assertThat(ex.getErrorCode()).isEqualTo("WORKFLOW_VALIDATION_FAILED");
    }

    @Test
    void rejectsEmptyStepList() {
        WorkflowValidationException ex = catchThrowableOfType(
                () -> validator.validate("Leave", "leave", List.of()), WorkflowValidationException.class);

        assertThat(ex.getErrors()).containsExactly("at least one step is required");
    }

    @Test
    void rejectsDuplicateStepIds() {
        List<StepDefinition> steps = List.of(step("review", Role.MANAGER, 8), step("review", Role.ADMIN, 8));

        WorkflowValidationException ex = catchThrowableOfType(
                () -> validator.validate("Expense", "expense", steps), WorkflowValidationException.class);

        assertThat(ex.getErrors()).containsExactly("steps[1].stepId 'review' is duplicated");
    }

    @Test
    void enforcesConfiguredLimits() {
        ApprovalProperties properties = new ApprovalProperties();
        properties.setMaxSteps(1);
        properties.setMaxSlaHours(10);
        WorkflowDefinitionValidator strict = new WorkflowDefinitionValidator(properties);

        WorkflowValidationException ex = catchThrowableOfType(
                () -> strict.validate("Expense", "expense",
                        List.of(step("a", Role.MANAGER, 8), step("b", Role.ADMIN, 11))),
                WorkflowValidationException.class);

        assertThat(ex.getErrors()).containsExactly(
                "a workflow may have at most 1 steps",
                "steps[1].slaHours must not exceed 10");
    }
}
