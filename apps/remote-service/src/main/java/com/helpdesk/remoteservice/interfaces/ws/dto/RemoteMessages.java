package com.helpdesk.remoteservice.interfaces.ws.dto;

import com.helpdesk.session.model.SessionSnapshot;
import lombok.Data;

import java.util.List;

/**
 * 远程协助 WebSocket 消息对象定义（DTO）
 * ----------------------------------------
 *   1. 前端 -> 后端：/app/remote.* 指令（*Cmd）
 *   2. 后端 -> 前端：/user/queue/remote.* 回复载荷
 *
 * 坐标字段 x/y 基于客户端画面尺寸 screenWidth/screenHeight，由服务端换算到本机屏幕。
 */
public class RemoteMessages {

    /**
     * 接入会话
     *   - role ：user / operator（兼容 it_staff）
     *   - token：创建会话时签发给该角色的令牌
     */
    @Data
    public static class JoinCmd {
        private String sessionId;
        private String token;
        private String role;
    }

    /** 激活 / 拉帧等只带会话 ID 的指令 */
    @Data
    public static class SessionCmd {
        private String sessionId;
    }

    @Data
    public static class PointerMoveCmd {
        private double x;
        private double y;
        private double screenWidth;
        private double screenHeight;
    }

    /**
     * 点击
     *   - button   ：left / right / middle，默认 left
     *   - clickType：single / double / down / up，默认 single
     */
    @Data
    public static class PointerClickCmd {
        private double x;
        private double y;
        private double screenWidth;
        private double screenHeight;
        private String button;
        private String clickType;
    }

    /** 滚轮：delta 正数向上 */
    @Data
    public static class PointerScrollCmd {
        private double x;
        private double y;
        private double screenWidth;
        private double screenHeight;
        private int delta;
    }

    /**
     * 单键
     *   - key   ：浏览器 KeyboardEvent.key（Enter、ArrowUp、a …）
     *   - action：press / down / up，默认 press
     */
    @Data
    public static class KeyCmd {
        private String key;
        private String action;
    }

    /** 组合键，如 ["ctrl", "c"] */
    @Data
    public static class KeyComboCmd {
        private List<String> keys;
    }

    @Data
    public static class TextCmd {
        private String text;
    }

    /** 接入成功回复 */
    public record Joined(String role, SessionSnapshot session) {
    }

    /** 屏幕帧回复：image 为 Base64 编码的 JPEG */
    public record FramePayload(String image, int width, int height, long timestamp) {
    }
}
