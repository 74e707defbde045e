package com.helpdesk.remoteservice.input;

import java.util.Locale;
import java.util.Optional;

/**
 * 点击方式：单击、双击、按下、抬起（按下/抬起用于拖拽）
 */
public enum ClickKind {
    SINGLE, DOUBLE, DOWN, UP;

    /**
     * 空值按单击处理
     */
    public static Optional<ClickKind> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.of(SINGLE);
        }
        switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "single":
            case "click":
                return Optional.of(SINGLE);
            case "double":
                return Optional.of(DOUBLE);
            case "down":
                return Optional.of(DOWN);
            case "up":
                return Optional.of(UP);
            default:
                return Optional.empty();
        }
    }
}
