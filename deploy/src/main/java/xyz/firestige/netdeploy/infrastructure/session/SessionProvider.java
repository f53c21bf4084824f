package xyz.firestige.netdeploy.infrastructure.session;

import xyz.firestige.netdeploy.domain.intent.DeviceIntent;

/**
 * 设备会话提供者（传输、认证、命令执行都在实现里）
 */
public interface SessionProvider {

    /**
     * @throws xyz.firestige.netdeploy.domain.shared.exception.SessionException 无法建立会话
     */
    DeviceSession connect(DeviceIntent device);
}
