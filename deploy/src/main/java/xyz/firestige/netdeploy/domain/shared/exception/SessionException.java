package xyz.firestige.netdeploy.domain.shared.exception;

/**
 * 会话建立失败、执行异常或超时
 */
public class SessionException extends NetDeployException {

    public SessionException(String message) {
        super(ErrorType.SESSION_ERROR, message);
    }

    public SessionException(String message, Throwable cause) {
        super(ErrorType.SESSION_ERROR, message, cause);
    }
}
