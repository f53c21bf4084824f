package xyz.firestige.netdeploy.domain.validation;

/**
 * SKIP：相关特性在设备上未配置；FAIL：特性存在但未收敛，或会话出错
 */
public enum ValidationStatus {
    PASS,
    FAIL,
    SKIP
}
