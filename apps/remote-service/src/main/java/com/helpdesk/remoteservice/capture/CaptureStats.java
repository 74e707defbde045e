package com.helpdesk.remoteservice.capture;

/**
 * 捕获循环状态
 *
 * @param halted 因图形环境不可用而停止，需要重新添加观看者才会再次尝试
 */
public record CaptureStats(boolean running, int clients, int fps, int quality, boolean halted) {
}
