package xyz.firestige.netdeploy.domain.shared.exception;

/**
 * 意图文档或运行配置不合法
 */
public class ConfigurationException extends NetDeployException {

    public ConfigurationException(String message) {
        super(ErrorType.CONFIGURATION_ERROR, message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(ErrorType.CONFIGURATION_ERROR, message, cause);
    }
}
