package com.helpdesk.session.model;

/**
 * 工单 ID。同一工单同一时刻最多对应一个远程会话。
 */
public record WorkItemId(String value) {

    public WorkItemId {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("workItemId must not be blank");
        }
    }

    public static WorkItemId of(String value) {
        return new WorkItemId(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
