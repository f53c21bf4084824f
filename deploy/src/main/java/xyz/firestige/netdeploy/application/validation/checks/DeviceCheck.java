package xyz.firestige.netdeploy.application.validation.checks;

import xyz.firestige.netdeploy.domain.intent.DeviceIntent;
import xyz.firestige.netdeploy.domain.validation.CheckCategory;
import xyz.firestige.netdeploy.domain.validation.ValidationPhase;
import xyz.firestige.netdeploy.domain.validation.ValidationResult;

/**
 * 只读的设备健康检查。实现自行把"未配置"映射为 SKIP、"未收敛"映射为 FAIL。
 */
public interface DeviceCheck {

    String getName();

    CheckCategory getCategory();

    ValidationResult run(DeviceIntent device, ValidationPhase phase);
}
