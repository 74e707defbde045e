package com.helpdesk.remoteservice.input;

import java.util.Locale;
import java.util.Optional;

/**
 * 按键动作：PRESS = 按下并抬起
 */
public enum KeyAction {
    PRESS, DOWN, UP;

    /**
     * 空值按 PRESS 处理
     */
    public static Optional<KeyAction> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.of(PRESS);
        }
        switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "press":
                return Optional.of(PRESS);
            case "down":
                return Optional.of(DOWN);
            case "up":
                return Optional.of(UP);
            default:
                return Optional.empty();
        }
    }
}
