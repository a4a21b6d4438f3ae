package com.enterprise.approval.model.enums;

/**
 * Actions an approver can take on the current step of a request.
 */
public enum ApprovalAction {
    APPROVE,
    REJECT,
    ESCALATE,
    DELEGATE;

    public HistoryAction toHistoryAction() {
        return switch (this) {
            case APPROVE -> HistoryAction.APPROVE;
            case REJECT -> HistoryAction.REJECT;
            case ESCALATE -> HistoryAction.ESCALATE;
            case DELEGATE -> HistoryAction.DELEGATE;
        };
    }
}
