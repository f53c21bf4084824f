package xyz.firestige.netdeploy.domain.shared.exception;

import java.time.Instant;
import java.util.Objects;

/**
 * 失败信息封装类
 * <p>
 * 设备级错误在结果对象上以值的形式出现，报告中据此给出阶段与错误类型。
 */
public class FailureInfo {

    /**
     * 错误码（默认与 ErrorType 名称一致）
     */
    private final String errorCode;

    private final String errorMessage;

    private final ErrorType errorType;

    /**
     * 失败位置（阶段或步骤名称）
     */
    private final String failedAt;

    private final Instant timestamp;

    /**
     * 是否值得重试：会话类错误通常可以重试，模板与备份错误需要人工介入
     */
    private final boolean retryable;

    public FailureInfo(String errorCode, String errorMessage, ErrorType errorType,
                       String failedAt, boolean retryable, Instant timestamp) {
        this.errorCode = errorCode;
        this.errorMessage = errorMessage;
        this.errorType = Objects.requireNonNull(errorType, "errorType");
        this.failedAt = failedAt;
        this.retryable = retryable;
        this.timestamp = timestamp != null ? timestamp : Instant.now();
    }

    public static FailureInfo of(ErrorType errorType, String errorMessage) {
        return of(errorType, errorMessage, null);
    }

    public static FailureInfo of(ErrorType errorType, String errorMessage, String failedAt) {
        return new FailureInfo(errorType.name(), errorMessage, errorType, failedAt,
                isRetryable(errorType), Instant.now());
    }

    public static FailureInfo fromException(NetDeployException e, String failedAt) {
        return of(e.getErrorType(), e.getMessage(), failedAt);
    }

    public static FailureInfo fromException(Exception e, ErrorType errorType, String failedAt) {
        if (e instanceof NetDeployException nde) {
            return fromException(nde, failedAt);
        }
        String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        return of(errorType, message, failedAt);
    }

    private static boolean isRetryable(ErrorType type) {
        return type == ErrorType.SESSION_ERROR;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public ErrorType getErrorType() {
        return errorType;
    }

    public String getFailedAt() {
        return failedAt;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public boolean isRetryable() {
        return retryable;
    }

    @Override
    public String toString() {
        return "FailureInfo{" +
                "errorCode='" + errorCode + '\'' +
                ", errorMessage='" + errorMessage + '\'' +
                ", errorType=" + errorType +
                ", failedAt='" + failedAt + '\'' +
                ", timestamp=" + timestamp +
                ", retryable=" + retryable +
                '}';
    }
}
