package com.helpdesk.remoteservice.application;

/**
 * 一次输入请求的处理结果
 */
public enum InputOutcome {
    APPLIED,
    NOT_AUTHORIZED,
    SESSION_NOT_FOUND,
    FAILED;

    public boolean isApplied() {
        return this == APPLIED;
    }
}
