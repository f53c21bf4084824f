package xyz.firestige.netdeploy.domain.shared.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 基础异常类，所有部署相关异常的基类
 */
public class NetDeployException extends RuntimeException {

    private final ErrorType errorType;

    /**
     * 上下文信息（设备名、路径等），用于日志与报告
     */
    private final Map<String, Object> context = new LinkedHashMap<>();

    public NetDeployException(ErrorType errorType, String message) {
        super(message);
        this.errorType = errorType;
    }

    public NetDeployException(ErrorType errorType, String message, Throwable cause) {
        super(message, cause);
        this.errorType = errorType;
    }

    public ErrorType getErrorType() {
        return errorType;
    }

    public NetDeployException addContext(String key, Object value) {
        context.put(key, value);
        return this;
    }

    public Map<String, Object> getContext() {
        return Collections.unmodifiableMap(context);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" +
                "errorType=" + errorType +
                ", message='" + getMessage() + '\'' +
                ", context=" + context +
                '}';
    }
}
