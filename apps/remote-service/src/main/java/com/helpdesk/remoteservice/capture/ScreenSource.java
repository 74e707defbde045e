package com.helpdesk.remoteservice.capture;

import com.helpdesk.remoteservice.desktop.DesktopUnavailableException;

import java.awt.image.BufferedImage;

/**
 * 屏幕图像来源
 */
public interface ScreenSource {

    /**
     * 抓取整块主屏幕。
     *
     * @throws DesktopUnavailableException 没有可用的图形环境（headless、无权限）
     */
    BufferedImage capture();
}
