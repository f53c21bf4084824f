package xyz.firestige.netdeploy.domain.shared.exception;

/**
 * 模板缺失或渲染失败，仅影响单个设备的生成
 */
public class TemplateRenderException extends NetDeployException {

    public TemplateRenderException(String message) {
        super(ErrorType.TEMPLATE_ERROR, message);
    }

    public TemplateRenderException(String message, Throwable cause) {
        super(ErrorType.TEMPLATE_ERROR, message, cause);
    }
}
