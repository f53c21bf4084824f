package xyz.firestige.netdeploy.domain.config;

import xyz.firestige.netdeploy.domain.intent.DeviceIntent;

/**
 * 配置渲染器
 * <p>
 * 纯函数：无 I/O，不与设备交互。同一份意图必须得到逐字节相同的文本。
 */
public interface ConfigRenderer {

    /**
     * @throws xyz.firestige.netdeploy.domain.shared.exception.TemplateRenderException 模板不存在或无法渲染
     */
    String render(DeviceIntent intent);
}
