package xyz.firestige.netdeploy.infrastructure.parser;

import xyz.firestige.netdeploy.domain.intent.DeviceIntent;
import xyz.firestige.netdeploy.domain.validation.CheckCategory;

import java.util.Optional;

/**
 * 设备输出解析器，仅供校验使用。
 * <p>
 * 返回 empty 表示该特性在设备上未配置；无法解析该类别时抛出 ParseUnavailableException。
 * 两者都映射为 SKIP。
 */
public interface OutputParser {

    Optional<ProtocolState> parse(DeviceIntent device, CheckCategory category);
}
