package com.helpdesk.remoteservice.input;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 输入授权与注入。
 *
 * 职责：
 * - 维护“允许注入输入”的连接集合（仅员工连接在接入成功后被授权）。
 * - 把远端画面坐标换算到本机屏幕坐标并夹紧到屏幕范围内。
 * - 串行化所有设备动作：同一时刻只有一个动作在操作鼠标键盘。
 *
 * 所有动作先检查授权，未授权直接返回 false 且不触碰设备；
 * 设备异常同样返回 false，并不影响后续动作。
 */
@Slf4j
public class InputAuthorizer {

    /** 文本日志截断长度 */
    private static final int TEXT_LOG_LIMIT = 50;

    private final InputDevice device;
    private final Set<String> authorized = ConcurrentHashMap.newKeySet();
    /** 全局输入锁：保证动作之间不交错 */
    private final ReentrantLock inputLock = new ReentrantLock();
    /** 最近一次下发到设备的指针位置 */
    private volatile PointerPosition lastPointer;

    public InputAuthorizer(InputDevice device) {
        this.device = device;
    }

    /* =========================
     * 授权
     * ========================= */

    public void authorize(String connectionId) {
        if (StringUtils.isBlank(connectionId)) {
            throw new IllegalArgumentException("connectionId must not be blank");
        }
        if (authorized.add(connectionId)) {
            log.info("授权输入控制: connection={}", connectionId);
        }
    }

    /**
     * 撤销授权；连接不存在时为 no-op
     */
    public void revoke(String connectionId) {
        if (connectionId != null && authorized.remove(connectionId)) {
            log.info("撤销输入控制: connection={}", connectionId);
        }
    }

    public boolean isAuthorized(String connectionId) {
        return connectionId != null && authorized.contains(connectionId);
    }

    public int authorizedCount() {
        return authorized.size();
    }

    /* =========================
     * 指针
     * ========================= */

    public boolean pointerMove(String connectionId, double x, double y, double sourceWidth, double sourceHeight) {
        if (!isAuthorized(connectionId)) {
            return rejected("pointer.move", connectionId);
        }
        return dispatch("pointer.move", () -> {
            PointerPosition p = remap(x, y, sourceWidth, sourceHeight);
            device.moveTo(p.x(), p.y());
            lastPointer = p;
        });
    }

    public boolean pointerClick(String connectionId, double x, double y, double sourceWidth, double sourceHeight,
                                PointerButton button, ClickKind kind) {
        if (!isAuthorized(connectionId)) {
            return rejected("pointer.click", connectionId);
        }
        if (button == null || kind == null) {
            return false;
        }
        return dispatch("pointer.click", () -> {
            PointerPosition p = remap(x, y, sourceWidth, sourceHeight);
            switch (kind) {
                case SINGLE:
                    device.click(p.x(), p.y(), button);
                    break;
                case DOUBLE:
                    device.doubleClick(p.x(), p.y(), button);
                    break;
                case DOWN:
                    device.buttonDown(p.x(), p.y(), button);
                    break;
                case UP:
                    device.buttonUp(p.x(), p.y(), button);
                    break;
                default:
                    throw new IllegalArgumentException("unsupported click kind: " + kind);
            }
            lastPointer = p;
        });
    }

    /**
     * @param delta 正数向上滚动，负数向下
     */
    public boolean pointerScroll(String connectionId, double x, double y, double sourceWidth, double sourceHeight,
                                 int delta) {
        if (!isAuthorized(connectionId)) {
            return rejected("pointer.scroll", connectionId);
        }
        return dispatch("pointer.scroll", () -> {
            PointerPosition p = remap(x, y, sourceWidth, sourceHeight);
            device.scroll(p.x(), p.y(), delta);
            lastPointer = p;
        });
    }

    /* =========================
     * 键盘
     * ========================= */

    public boolean keyAction(String connectionId, String key, KeyAction action) {
        if (!isAuthorized(connectionId)) {
            return rejected("key", connectionId);
        }
        if (StringUtils.isEmpty(key) || action == null) {
            return false;
        }
        String name = KeyNames.normalize(key);
        return dispatch("key", () -> {
            switch (action) {
                case PRESS:
                    device.keyPress(name);
                    break;
                case DOWN:
                    device.keyDown(name);
                    break;
                case UP:
                    device.keyUp(name);
                    break;
                default:
                    throw new IllegalArgumentException("unsupported key action: " + action);
            }
        });
    }

    public boolean keyCombination(String connectionId, List<String> keys) {
        if (!isAuthorized(connectionId)) {
            return rejected("key.combo", connectionId);
        }
        if (keys == null || keys.isEmpty()) {
            return false;
        }
        List<String> names = new ArrayList<>(keys.size());
        for (String key : keys) {
            if (StringUtils.isEmpty(key)) {
                return false;
            }
            names.add(KeyNames.normalizeComboKey(key));
        }
        log.debug("组合键: connection={}, keys={}", connectionId, names);
        return dispatch("key.combo", () -> device.hotkey(names));
    }

    public boolean textInput(String connectionId, String text) {
        if (!isAuthorized(connectionId)) {
            return rejected("text", connectionId);
        }
        if (text == null) {
            return false;
        }
        if (text.isEmpty()) {
            return true;
        }
        log.debug("文本输入: connection={}, text={}", connectionId, abbreviate(text));
        return dispatch("text", () -> device.typeText(text));
    }

    /* =========================
     * 状态
     * ========================= */

    public PointerPosition lastPointer() {
        return lastPointer;
    }

    public InputStats stats() {
        int width = 0;
        int height = 0;
        PointerPosition pointer = null;
        try {
            ScreenSize size = device.screenSize();
            width = size.width();
            height = size.height();
            pointer = device.pointerPosition();
        } catch (RuntimeException e) {
            log.debug("读取本机屏幕信息失败: {}", e.getMessage());
            pointer = lastPointer;
        }
        return new InputStats(width, height, authorized.size(), pointer);
    }

    /* =========================
     * 坐标换算
     * ========================= */

    /**
     * 远端坐标 → 本机坐标：按比例缩放后四舍五入，再夹紧到 [0, 本机尺寸-1]
     */
    PointerPosition remap(double x, double y, double sourceWidth, double sourceHeight) {
        if (!(sourceWidth > 0) || !(sourceHeight > 0)
                || Double.isInfinite(sourceWidth) || Double.isInfinite(sourceHeight)) {
            throw new IllegalArgumentException(
                    "source dimensions must be positive: " + sourceWidth + "x" + sourceHeight);
        }
        if (!Double.isFinite(x) || !Double.isFinite(y)) {
            throw new IllegalArgumentException("coordinates must be finite: " + x + "," + y);
        }
        ScreenSize local = device.screenSize();
        return new PointerPosition(
                scale(x, sourceWidth, local.width()),
                scale(y, sourceHeight, local.height()));
    }

    static int scale(double value, double sourceDim, int localDim) {
        long scaled = Math.round(value / sourceDim * localDim);
        return (int) Math.max(0, Math.min(scaled, localDim - 1L));
    }

    /* =========================
     * 内部工具
     * ========================= */

    private boolean dispatch(String action, Runnable op) {
        inputLock.lock();
        try {
            op.run();
            return true;
        } catch (RuntimeException e) {
            log.warn("输入注入失败: action={}, reason={}", action, e.getMessage());
            return false;
        } finally {
            inputLock.unlock();
        }
    }

    private static boolean rejected(String action, String connectionId) {
        log.debug("未授权的输入被拒绝: action={}, connection={}", action, connectionId);
        return false;
    }

    static String abbreviate(String text) {
        return StringUtils.abbreviate(text, TEXT_LOG_LIMIT + 3);
    }
}
