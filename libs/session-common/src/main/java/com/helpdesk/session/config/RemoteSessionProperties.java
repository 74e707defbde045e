package com.helpdesk.session.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * 远程会话配置（前缀 remote.session）
 */
@ConfigurationProperties(prefix = "remote.session")
public class RemoteSessionProperties {

    /** 会话存活时间，从创建时起算，不随活动续期 */
    private Duration ttl = Duration.ofHours(2);

    /** 过期会话清理间隔 */
    private Duration sweepInterval = Duration.ofMinutes(5);

    /** 单个会话令牌校验失败上限，达到后关闭会话；0 表示不限制 */
    private int maxAuthFailures = 5;

    /** 员工方接入时是否要求连接携带员工 JWT */
    private boolean requireStaffForOperator = true;

    /** 员工 JWT 需要具备的 realm 角色；为空则任何有效 JWT 都可以 */
    private String staffRole = "";

    public Duration getTtl() {
        return ttl;
    }

    public void setTtl(Duration ttl) {
        this.ttl = ttl;
    }

    public Duration getSweepInterval() {
        return sweepInterval;
    }

    public void setSweepInterval(Duration sweepInterval) {
        this.sweepInterval = sweepInterval;
    }

    public int getMaxAuthFailures() {
        return maxAuthFailures;
    }

    public void setMaxAuthFailures(int maxAuthFailures) {
        this.maxAuthFailures = maxAuthFailures;
    }

    public boolean isRequireStaffForOperator() {
        return requireStaffForOperator;
    }

    public void setRequireStaffForOperator(boolean requireStaffForOperator) {
        this.requireStaffForOperator = requireStaffForOperator;
    }

    public String getStaffRole() {
        return staffRole;
    }

    public void setStaffRole(String staffRole) {
        this.staffRole = staffRole;
    }
}
