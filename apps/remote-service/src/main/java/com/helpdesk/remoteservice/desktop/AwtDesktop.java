package com.helpdesk.remoteservice.desktop;

import com.helpdesk.remoteservice.capture.ScreenSource;
import com.helpdesk.remoteservice.input.InputDevice;
import com.helpdesk.remoteservice.input.PointerButton;
import com.helpdesk.remoteservice.input.PointerPosition;
import com.helpdesk.remoteservice.input.ScreenSize;
import lombok.extern.slf4j.Slf4j;

import java.awt.AWTException;
import java.awt.Dimension;
import java.awt.GraphicsEnvironment;
import java.awt.MouseInfo;
import java.awt.Point;
import java.awt.PointerInfo;
import java.awt.Rectangle;
import java.awt.Robot;
import java.awt.Toolkit;
import java.awt.event.InputEvent;
import java.awt.event.KeyEvent;
import java.awt.image.BufferedImage;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 基于 java.awt.Robot 的本机桌面：既是屏幕来源，也是输入设备。
 *
 * Robot 在首次使用时创建；headless 环境下所有操作抛出 {@link DesktopUnavailableException}。
 */
@Slf4j
public class AwtDesktop implements ScreenSource, InputDevice {

    private static final Map<String, Integer> KEY_CODES = new HashMap<>();

    static {
        KEY_CODES.put("enter", KeyEvent.VK_ENTER);
        KEY_CODES.put("backspace", KeyEvent.VK_BACK_SPACE);
        KEY_CODES.put("delete", KeyEvent.VK_DELETE);
        KEY_CODES.put("tab", KeyEvent.VK_TAB);
        KEY_CODES.put("esc", KeyEvent.VK_ESCAPE);
        KEY_CODES.put("escape", KeyEvent.VK_ESCAPE);
        KEY_CODES.put("space", KeyEvent.VK_SPACE);
        KEY_CODES.put("up", KeyEvent.VK_UP);
        KEY_CODES.put("down", KeyEvent.VK_DOWN);
        KEY_CODES.put("left", KeyEvent.VK_LEFT);
        KEY_CODES.put("right", KeyEvent.VK_RIGHT);
        KEY_CODES.put("home", KeyEvent.VK_HOME);
        KEY_CODES.put("end", KeyEvent.VK_END);
        KEY_CODES.put("pageup", KeyEvent.VK_PAGE_UP);
        KEY_CODES.put("pagedown", KeyEvent.VK_PAGE_DOWN);
        KEY_CODES.put("insert", KeyEvent.VK_INSERT);
        KEY_CODES.put("ctrl", KeyEvent.VK_CONTROL);
        KEY_CODES.put("alt", KeyEvent.VK_ALT);
        KEY_CODES.put("shift", KeyEvent.VK_SHIFT);
        KEY_CODES.put("capslock", KeyEvent.VK_CAPS_LOCK);
        KEY_CODES.put("printscreen", KeyEvent.VK_PRINTSCREEN);
        boolean mac = System.getProperty("os.name", "").toLowerCase(Locale.ROOT).contains("mac");
        KEY_CODES.put("win", mac ? KeyEvent.VK_META : KeyEvent.VK_WINDOWS);
        int[] functionKeys = {
                KeyEvent.VK_F1, KeyEvent.VK_F2, KeyEvent.VK_F3, KeyEvent.VK_F4,
                KeyEvent.VK_F5, KeyEvent.VK_F6, KeyEvent.VK_F7, KeyEvent.VK_F8,
                KeyEvent.VK_F9, KeyEvent.VK_F10, KeyEvent.VK_F11, KeyEvent.VK_F12
        };
        for (int i = 0; i < functionKeys.length; i++) {
            KEY_CODES.put("f" + (i + 1), functionKeys[i]);
        }
    }

    private final Duration typeInterval;
    private final Duration autoDelay;
    private volatile Robot robot;

    public AwtDesktop(Duration typeInterval, Duration autoDelay) {
        this.typeInterval = typeInterval;
        this.autoDelay = autoDelay;
    }

    /* =========================
     * ScreenSource
     * ========================= */

    @Override
    public BufferedImage capture() {
        Dimension size = screenDimension();
        return robot().createScreenCapture(new Rectangle(size));
    }

    /* =========================
     * InputDevice
     * ========================= */

    @Override
    public ScreenSize screenSize() {
        Dimension size = screenDimension();
        return new ScreenSize(size.width, size.height);
    }

    @Override
    public PointerPosition pointerPosition() {
        requireDisplay();
        PointerInfo info = MouseInfo.getPointerInfo();
        if (info == null) {
            throw new DesktopUnavailableException("pointer position is not available");
        }
        Point p = info.getLocation();
        return new PointerPosition(p.x, p.y);
    }

    @Override
    public void moveTo(int x, int y) {
        robot().mouseMove(x, y);
    }

    @Override
    public void click(int x, int y, PointerButton button) {
        Robot r = robot();
        int mask = buttonMask(button);
        r.mouseMove(x, y);
        r.mousePress(mask);
        r.mouseRelease(mask);
    }

    @Override
    public void doubleClick(int x, int y, PointerButton button) {
        click(x, y, button);
        click(x, y, button);
    }

    @Override
    public void buttonDown(int x, int y, PointerButton button) {
        Robot r = robot();
        r.mouseMove(x, y);
        r.mousePress(buttonMask(button));
    }

    @Override
    public void buttonUp(int x, int y, PointerButton button) {
        Robot r = robot();
        r.mouseMove(x, y);
        r.mouseRelease(buttonMask(button));
    }

    @Override
    public void scroll(int x, int y, int amount) {
        Robot r = robot();
        r.mouseMove(x, y);
        // Robot 的滚轮正数表示向下
        r.mouseWheel(-amount);
    }

    @Override
    public void keyPress(String key) {
        Robot r = robot();
        KeyStroke stroke = strokeFor(key);
        stroke.press(r);
        stroke.release(r);
    }

    @Override
    public void keyDown(String key) {
        strokeFor(key).press(robot());
    }

    @Override
    public void keyUp(String key) {
        strokeFor(key).release(robot());
    }

    @Override
    public void hotkey(List<String> keys) {
        Robot r = robot();
        List<Integer> codes = new ArrayList<>(keys.size());
        for (String key : keys) {
            codes.add(keyCode(key));
        }
        int pressed = 0;
        try {
            for (int code : codes) {
                r.keyPress(code);
                pressed++;
            }
        } finally {
            for (int i = pressed - 1; i >= 0; i--) {
                r.keyRelease(codes.get(i));
            }
        }
    }

    @Override
    public void typeText(String text) {
        Robot r = robot();
        int delay = (int) Math.min(typeInterval.toMillis(), 60_000L);
        text.codePoints().forEach(cp -> {
            KeyStroke stroke = strokeFor(new String(Character.toChars(cp)));
            stroke.press(r);
            stroke.release(r);
            if (delay > 0) {
                r.delay(delay);
            }
        });
    }

    /* =========================
     * 内部工具
     * ========================= */

    private Robot robot() {
        Robot current = robot;
        if (current != null) {
            return current;
        }
        synchronized (this) {
            if (robot == null) {
                requireDisplay();
                try {
                    Robot created = new Robot();
                    created.setAutoDelay((int) Math.min(autoDelay.toMillis(), 60_000L));
                    robot = created;
                    log.info("java.awt.Robot 已初始化");
                } catch (AWTException | SecurityException e) {
                    throw new DesktopUnavailableException("无法创建 java.awt.Robot: " + e.getMessage(), e);
                }
            }
            return robot;
        }
    }

    private static void requireDisplay() {
        if (GraphicsEnvironment.isHeadless()) {
            throw new DesktopUnavailableException("graphics environment is headless");
        }
    }

    private static Dimension screenDimension() {
        requireDisplay();
        return Toolkit.getDefaultToolkit().getScreenSize();
    }

    private static int buttonMask(PointerButton button) {
        switch (button) {
            case RIGHT:
                return InputEvent.BUTTON3_DOWN_MASK;
            case MIDDLE:
                return InputEvent.BUTTON2_DOWN_MASK;
            default:
                return InputEvent.BUTTON1_DOWN_MASK;
        }
    }

    static int keyCode(String key) {
        Integer named = KEY_CODES.get(key.toLowerCase(Locale.ROOT));
        if (named != null) {
            return named;
        }
        if (key.length() == 1) {
            int code = KeyEvent.getExtendedKeyCodeForChar(Character.toLowerCase(key.charAt(0)));
            if (code != KeyEvent.VK_UNDEFINED) {
                return code;
            }
        }
        throw new IllegalArgumentException("unknown key: " + key);
    }

    /**
     * 大写字母需要附带 Shift
     */
    static KeyStroke strokeFor(String key) {
        boolean shift = key.length() == 1 && Character.isUpperCase(key.charAt(0));
        return new KeyStroke(keyCode(key), shift);
    }

    record KeyStroke(int code, boolean shift) {

        void press(Robot r) {
            if (shift) {
                r.keyPress(KeyEvent.VK_SHIFT);
            }
            r.keyPress(code);
        }

        void release(Robot r) {
            r.keyRelease(code);
            if (shift) {
                r.keyRelease(KeyEvent.VK_SHIFT);
            }
        }
    }
}
