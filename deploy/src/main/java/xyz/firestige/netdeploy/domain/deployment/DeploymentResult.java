package xyz.firestige.netdeploy.domain.deployment;

import xyz.firestige.netdeploy.domain.config.BackupHandle;
import xyz.firestige.netdeploy.domain.diff.ConfigDiff;
import xyz.firestige.netdeploy.domain.shared.exception.FailureInfo;

import java.time.Instant;
import java.util.Optional;

/**
 * 部署结果：每台设备每个部署阶段一份，汇总进流水线报告。
 * <p>
 * 可选字段：
 * - failureInfo：FAILED 时的错误类型与阶段；SKIPPED 时可能记录跳过原因
 * - diff：dry-run 或下发前计算的差异
 * - backup / backupAt：下发前写入的备份
 * - applyAttemptAt：开始下发的时间，保证严格晚于 backupAt
 */
public final class DeploymentResult {

    private final String device;
    private final DeploymentStatus status;
    private final FailureInfo failureInfo;
    private final String skipReason;
    private final ConfigDiff diff;
    private final BackupHandle backup;
    private final Instant applyAttemptAt;

    private DeploymentResult(String device, DeploymentStatus status, FailureInfo failureInfo, String skipReason,
                             ConfigDiff diff, BackupHandle backup, Instant applyAttemptAt) {
        this.device = device;
        this.status = status;
        this.failureInfo = failureInfo;
        this.skipReason = skipReason;
        this.diff = diff;
        this.backup = backup;
        this.applyAttemptAt = applyAttemptAt;
    }

    public static DeploymentResult applied(String device, ConfigDiff diff, BackupHandle backup, Instant applyAttemptAt) {
        return new DeploymentResult(device, DeploymentStatus.APPLIED, null, null, diff, backup, applyAttemptAt);
    }

    public static DeploymentResult failed(String device, FailureInfo failureInfo) {
        return new DeploymentResult(device, DeploymentStatus.FAILED, failureInfo, null, null, null, null);
    }

    public static DeploymentResult failed(String device, FailureInfo failureInfo, ConfigDiff diff,
                                          BackupHandle backup, Instant applyAttemptAt) {
        return new DeploymentResult(device, DeploymentStatus.FAILED, failureInfo, null, diff, backup, applyAttemptAt);
    }

    /**
     * dry-run 结果：带差异，设备未被修改
     */
    public static DeploymentResult preview(String device, ConfigDiff diff, BackupHandle backup) {
        return new DeploymentResult(device, DeploymentStatus.SKIPPED, null, "dry-run", diff, backup, null);
    }

    public static DeploymentResult skipped(String device, String reason) {
        return new DeploymentResult(device, DeploymentStatus.SKIPPED, null, reason, null, null, null);
    }

    public static DeploymentResult skipped(String device, FailureInfo cause) {
        return new DeploymentResult(device, DeploymentStatus.SKIPPED, cause, cause.getErrorMessage(), null, null, null);
    }

    public String getDevice() {
        return device;
    }

    public DeploymentStatus getStatus() {
        return status;
    }

    public Optional<FailureInfo> getFailureInfo() {
        return Optional.ofNullable(failureInfo);
    }

    public Optional<String> getSkipReason() {
        return Optional.ofNullable(skipReason);
    }

    public Optional<ConfigDiff> getDiff() {
        return Optional.ofNullable(diff);
    }

    public Optional<BackupHandle> getBackup() {
        return Optional.ofNullable(backup);
    }

    public Optional<Instant> getBackupAt() {
        return getBackup().map(BackupHandle::capturedAt);
    }

    public Optional<Instant> getApplyAttemptAt() {
        return Optional.ofNullable(applyAttemptAt);
    }

    public boolean isFailed() {
        return status == DeploymentStatus.FAILED;
    }

    @Override
    public String toString() {
        return "DeploymentResult{" +
                "device='" + device + '\'' +
                ", status=" + status +
                (failureInfo != null ? ", error=" + failureInfo.getErrorType() : "") +
                (skipReason != null ? ", skipReason='" + skipReason + '\'' : "") +
                '}';
    }
}
