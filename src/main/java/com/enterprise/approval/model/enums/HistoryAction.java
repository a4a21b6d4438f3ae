package com.enterprise.approval.model.enums;

public enum HistoryAction {
    SUBMIT,
    APPROVE,
    REJECT,
    CANCEL,
    ESCALATE,
    DELEGATE
}
