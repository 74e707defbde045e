package com.helpdesk.remoteservice.input;

/**
 * 本机屏幕像素尺寸
 */
public record ScreenSize(int width, int height) {
}
