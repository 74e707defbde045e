package com.helpdesk.remoteservice.desktop;

/**
 * 本机没有可用的图形环境（headless、无显示器、缺少权限）
 */
public class DesktopUnavailableException extends RuntimeException {

    public DesktopUnavailableException(String message) {
        super(message);
    }

    public DesktopUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
