package com.helpdesk.session;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.util.Base64;

/**
 * 会话 ID 与接入令牌生成。
 *
 * 会话 ID 144 位、令牌 256 位随机数，URL-safe Base64 编码（无填充）。
 */
public final class SecureTokens {

    static final int SESSION_ID_BYTES = 18;
    static final int TOKEN_BYTES = 32;

    private static final SecureRandom RANDOM = new SecureRandom();
    private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();

    private SecureTokens() {
        throw new UnsupportedOperationException("Utility class");
    }

    public static String newSessionId() {
        return randomString(SESSION_ID_BYTES);
    }

    public static String newToken() {
        return randomString(TOKEN_BYTES);
    }

    /**
     * 常量时间比较，避免通过响应耗时猜测令牌
     */
    public static boolean matches(String expected, String presented) {
        if (expected == null || presented == null) {
            return false;
        }
        return MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.UTF_8),
                presented.getBytes(StandardCharsets.UTF_8));
    }

    private static String randomString(int bytes) {
        byte[] buf = new byte[bytes];
        RANDOM.nextBytes(buf);
        return ENCODER.encodeToString(buf);
    }
}
