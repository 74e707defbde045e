package com.helpdesk.remoteservice.input;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * 浏览器 KeyboardEvent.key 名称到本机按键名的映射。
 *
 * 本机按键名是小写字符串（enter、esc、pageup、f5、a …），
 * 由 {@link InputDevice} 实现再翻译为具体的键码。
 */
public final class KeyNames {

    private static final Map<String, String> BROWSER_KEYS = new HashMap<>();
    private static final Map<String, String> MODIFIERS = new HashMap<>();

    static {
        BROWSER_KEYS.put("Enter", "enter");
        BROWSER_KEYS.put("Backspace", "backspace");
        BROWSER_KEYS.put("Delete", "delete");
        BROWSER_KEYS.put("Tab", "tab");
        BROWSER_KEYS.put("Escape", "esc");
        BROWSER_KEYS.put("Space", "space");
        BROWSER_KEYS.put(" ", "space");
        BROWSER_KEYS.put("ArrowUp", "up");
        BROWSER_KEYS.put("ArrowDown", "down");
        BROWSER_KEYS.put("ArrowLeft", "left");
        BROWSER_KEYS.put("ArrowRight", "right");
        BROWSER_KEYS.put("Home", "home");
        BROWSER_KEYS.put("End", "end");
        BROWSER_KEYS.put("PageUp", "pageup");
        BROWSER_KEYS.put("PageDown", "pagedown");
        BROWSER_KEYS.put("Insert", "insert");
        for (int i = 1; i <= 12; i++) {
            BROWSER_KEYS.put("F" + i, "f" + i);
        }

        MODIFIERS.put("ctrl", "ctrl");
        MODIFIERS.put("control", "ctrl");
        MODIFIERS.put("alt", "alt");
        MODIFIERS.put("option", "alt");
        MODIFIERS.put("shift", "shift");
        MODIFIERS.put("win", "win");
        MODIFIERS.put("cmd", "win");
        MODIFIERS.put("meta", "win");
        MODIFIERS.put("super", "win");
    }

    private KeyNames() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * 单键名称：先查表，未命中时一律转小写透传（Shift 由浏览器单独发送）
     */
    public static String normalize(String key) {
        String mapped = BROWSER_KEYS.get(key);
        if (mapped != null) {
            return mapped;
        }
        return key.toLowerCase(Locale.ROOT);
    }

    /**
     * 组合键中的一项：统一修饰键别名（cmd/meta → win），其余同 {@link #normalize(String)}
     */
    public static String normalizeComboKey(String key) {
        String modifier = MODIFIERS.get(key.toLowerCase(Locale.ROOT));
        if (modifier != null) {
            return modifier;
        }
        return normalize(key);
    }

    public static boolean isModifier(String normalized) {
        return MODIFIERS.containsValue(normalized);
    }
}
