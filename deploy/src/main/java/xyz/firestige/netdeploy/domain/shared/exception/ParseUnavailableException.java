package xyz.firestige.netdeploy.domain.shared.exception;

/**
 * 设备不支持该校验类别的状态解析，校验结果记为 SKIP
 */
public class ParseUnavailableException extends NetDeployException {

    public ParseUnavailableException(String message) {
        super(ErrorType.PARSE_UNAVAILABLE, message);
    }

    public ParseUnavailableException(String message, Throwable cause) {
        super(ErrorType.PARSE_UNAVAILABLE, message, cause);
    }
}
