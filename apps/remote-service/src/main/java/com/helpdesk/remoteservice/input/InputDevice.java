package com.helpdesk.remoteservice.input;

import com.helpdesk.remoteservice.desktop.DesktopUnavailableException;

import java.util.List;

/**
 * 本机输入设备。坐标均为本机屏幕像素坐标，按键名为 {@link KeyNames} 归一化后的名称。
 *
 * 所有方法在没有图形环境时抛出 {@link DesktopUnavailableException}；
 * 无法识别的按键名抛出 IllegalArgumentException。
 */
public interface InputDevice {

    ScreenSize screenSize();

    PointerPosition pointerPosition();

    void moveTo(int x, int y);

    void click(int x, int y, PointerButton button);

    void doubleClick(int x, int y, PointerButton button);

    void buttonDown(int x, int y, PointerButton button);

    void buttonUp(int x, int y, PointerButton button);

    /**
     * @param amount 正数向上滚动，负数向下
     */
    void scroll(int x, int y, int amount);

    void keyPress(String key);

    void keyDown(String key);

    void keyUp(String key);

    /**
     * 按顺序按下全部按键，再逆序抬起
     */
    void hotkey(List<String> keys);

    void typeText(String text);
}
