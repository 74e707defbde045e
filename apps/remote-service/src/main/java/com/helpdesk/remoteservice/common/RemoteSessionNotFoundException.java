package com.helpdesk.remoteservice.common;

/**
 * 会话不存在、已过期或已关闭
 */
public class RemoteSessionNotFoundException extends RuntimeException {

    public RemoteSessionNotFoundException(String message) {
        super(message);
    }
}
