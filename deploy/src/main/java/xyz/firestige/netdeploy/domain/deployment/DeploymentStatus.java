package xyz.firestige.netdeploy.domain.deployment;

/**
 * 单台设备在部署阶段的终态
 */
public enum DeploymentStatus {
    APPLIED("已下发"),
    FAILED("失败"),
    SKIPPED("跳过");

    private final String description;

    DeploymentStatus(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
