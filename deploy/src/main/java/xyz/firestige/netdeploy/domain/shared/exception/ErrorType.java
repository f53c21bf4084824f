package xyz.firestige.netdeploy.domain.shared.exception;

/**
 * 错误类型枚举
 * <p>
 * 每一类错误对应一个明确的处置策略（跳过 / 失败 / 中止），调用方据此做出决定，而不是静默继续。
 */
public enum ErrorType {

    /**
     * 设备在意图库中不存在：跳过，不致命
     */
    INTENT_NOT_FOUND("意图不存在"),

    /**
     * 模板缺失或渲染表达式无法解析：仅跳过该设备
     */
    TEMPLATE_ERROR("模板错误"),

    /**
     * 备份写入失败：不得继续下发
     */
    BACKUP_FAILURE("备份失败"),

    /**
     * 设备拒绝下发的配置：标记失败并停止后续设备
     */
    APPLY_REJECTED("下发被拒绝"),

    /**
     * 连接失败或超时：仅当前阶段该设备失败
     */
    SESSION_ERROR("会话错误"),

    /**
     * 校验类别在设备上不存在：跳过，不算失败
     */
    PARSE_UNAVAILABLE("解析不可用"),

    /**
     * 分层依赖矛盾
     */
    CYCLIC_DEPENDENCY("循环依赖"),

    /**
     * 意图文档或运行配置错误
     */
    CONFIGURATION_ERROR("配置错误");

    private final String description;

    ErrorType(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
