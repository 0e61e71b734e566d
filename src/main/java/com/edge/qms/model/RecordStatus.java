package com.edge.qms.model;

/**
 * 检验记录状态
 * <p>
 * APPROVED / REJECTED / CLOSED 为终态，终态记录的测量值只能通过更正流程修改
 */
public enum RecordStatus {
    DRAFT,
    SUBMITTED,
    UNDER_REVIEW,
    APPROVED,
    REJECTED,
    CLOSED;

    public boolean isFinalized() {
        return this == APPROVED || this == REJECTED || this == CLOSED;
    }

    public boolean isPendingApproval() {
        return this == SUBMITTED || this == UNDER_REVIEW;
    }
}
