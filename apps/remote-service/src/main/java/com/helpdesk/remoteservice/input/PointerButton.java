package com.helpdesk.remoteservice.input;

import java.util.Locale;
import java.util.Optional;

public enum PointerButton {
    LEFT, RIGHT, MIDDLE;

    /**
     * 空值按左键处理
     */
    public static Optional<PointerButton> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.of(LEFT);
        }
        switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "left":
                return Optional.of(LEFT);
            case "right":
                return Optional.of(RIGHT);
            case "middle":
                return Optional.of(MIDDLE);
            default:
                return Optional.empty();
        }
    }
}
