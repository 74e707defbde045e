package com.helpdesk.remoteservice.input;

/**
 * 本机屏幕坐标
 */
public record PointerPosition(int x, int y) {
}
