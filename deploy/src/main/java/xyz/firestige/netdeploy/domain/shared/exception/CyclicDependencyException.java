package xyz.firestige.netdeploy.domain.shared.exception;

import java.util.List;

/**
 * 设备间依赖关系矛盾：存在环，或依赖了更高层级的设备
 */
public class CyclicDependencyException extends NetDeployException {

    private final List<String> devices;

    public CyclicDependencyException(String message, List<String> devices) {
        super(ErrorType.CYCLIC_DEPENDENCY, message);
        this.devices = List.copyOf(devices);
        addContext("devices", this.devices);
    }

    public List<String> getDevices() {
        return devices;
    }
}
