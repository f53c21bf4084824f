package xyz.firestige.netdeploy.infrastructure.store;

import xyz.firestige.netdeploy.domain.shared.exception.ConfigurationException;

import java.util.regex.Pattern;

/**
 * 设备名会成为文件名或 Redis key 的一部分，只允许安全字符
 */
final class DeviceNames {

    private static final Pattern SAFE = Pattern.compile("[A-Za-z0-9][A-Za-z0-9._-]*");

    private DeviceNames() {
    }

    static String requireSafe(String device) {
        if (device == null || !SAFE.matcher(device).matches() || device.contains("..")) {
            throw new ConfigurationException("Unsafe device name for config store: " + device);
        }
        return device;
    }
}
