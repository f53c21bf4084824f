package xyz.firestige.netdeploy.domain.shared.exception;

/**
 * 意图库中找不到设备
 * <p>
 * 部分设备集合是正常运行模式，调用方应将其视为跳过。
 */
public class IntentNotFoundException extends NetDeployException {

    private final String device;

    public IntentNotFoundException(String device) {
        super(ErrorType.INTENT_NOT_FOUND, "No intent declared for device: " + device);
        this.device = device;
        addContext("device", device);
    }

    public String getDevice() {
        return device;
    }
}
