package xyz.firestige.netdeploy.domain.intent;

import xyz.firestige.netdeploy.domain.shared.exception.IntentNotFoundException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 意图库：一次运行内只读的期望状态集合。
 * <p>
 * 职责：
 * 1. 按设备名提供 DeviceIntent（保持文档中的声明顺序）
 * 2. 提供全网参数与 VRF 定义，供渲染上下文合并
 * <p>
 * 进程启动时构建一次，按引用注入到各组件，任何组件都不读取全局状态。
 */
public final class IntentRepository {

    private final Map<String, DeviceIntent> devices;
    private final EnterpriseSettings enterprise;
    private final Map<String, VrfDefinition> vrfs;

    public IntentRepository(Map<String, DeviceIntent> devices,
                            EnterpriseSettings enterprise,
                            Map<String, VrfDefinition> vrfs) {
        this.devices = Collections.unmodifiableMap(new LinkedHashMap<>(devices));
        this.enterprise = enterprise != null ? enterprise : EnterpriseSettings.empty();
        this.vrfs = Collections.unmodifiableMap(new LinkedHashMap<>(vrfs));
    }

    /**
     * 全部设备意图，迭代顺序与意图文档中的声明顺序一致
     */
    public Map<String, DeviceIntent> load() {
        return devices;
    }

    /**
     * @throws IntentNotFoundException 设备未声明；调用方应当跳过该设备
     */
    public DeviceIntent get(String name) {
        DeviceIntent intent = devices.get(name);
        if (intent == null) {
            throw new IntentNotFoundException(name);
        }
        return intent;
    }

    public Optional<DeviceIntent> find(String name) {
        return Optional.ofNullable(devices.get(name));
    }

    public List<String> names() {
        return List.copyOf(devices.keySet());
    }

    public EnterpriseSettings enterprise() {
        return enterprise;
    }

    public Optional<VrfDefinition> vrf(String name) {
        return Optional.ofNullable(vrfs.get(name));
    }

    public Map<String, VrfDefinition> vrfs() {
        return vrfs;
    }

    public int size() {
        return devices.size();
    }
}
