package com.helpdesk.remoteservice.common;

/**
 * 调用方持有 JWT 但不具备员工角色
 */
public class StaffRequiredException extends RuntimeException {

    public StaffRequiredException(String message) {
        super(message);
    }
}
