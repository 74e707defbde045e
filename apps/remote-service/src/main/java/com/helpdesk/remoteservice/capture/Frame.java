package com.helpdesk.remoteservice.capture;

import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;
import java.util.Base64;

/**
 * 一帧已编码的屏幕图像。
 *
 * @param image      编码后的图像字节（默认 JPEG）
 * @param width      编码后宽度（可能小于原始屏幕宽度）
 * @param height     编码后高度
 * @param capturedAt 捕获时间
 */
public record Frame(byte[] image, int width, int height, Instant capturedAt) {

    public Frame {
        image = image.clone();
    }

    @Override
    public byte[] image() {
        return image.clone();
    }

    public int size() {
        return image.length;
    }

    public String base64() {
        return Base64.getEncoder().encodeToString(image);
    }

    /** 按图像内容比较 */
    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Frame other)) {
            return false;
        }
        return width == other.width
                && height == other.height
                && Arrays.equals(image, other.image)
                && Objects.equals(capturedAt, other.capturedAt);
    }

    @Override
    public int hashCode() {
        int result = Arrays.hashCode(image);
        result = 31 * result + width;
        result = 31 * result + height;
        result = 31 * result + Objects.hashCode(capturedAt);
        return result;
    }

    @Override
    public String toString() {
        return "Frame[" + width + "x" + height + ", " + image.length + " bytes, capturedAt=" + capturedAt + "]";
    }
}
