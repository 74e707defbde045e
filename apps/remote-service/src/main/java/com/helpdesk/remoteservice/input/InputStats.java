package com.helpdesk.remoteservice.input;

/**
 * 输入子系统状态。图形环境不可用时屏幕尺寸为 0，pointer 为 null。
 */
public record InputStats(int screenWidth, int screenHeight, int authorizedConnections, PointerPosition pointer) {
}
