package xyz.firestige.netdeploy.cli;

import xyz.firestige.netdeploy.domain.intent.DeviceIntent;
import xyz.firestige.netdeploy.domain.intent.IntentRepository;

import java.util.List;

/**
 * --device 选项解析：不指定时为意图库中的全部设备
 */
final class DeviceSelection {

    private DeviceSelection() {
    }

    static List<String> names(IntentRepository intents, List<String> requested) {
        return requested == null || requested.isEmpty() ? intents.names() : List.copyOf(requested);
    }

    /**
     * @throws xyz.firestige.netdeploy.domain.shared.exception.IntentNotFoundException 指定了不存在的设备
     */
    static List<DeviceIntent> intents(IntentRepository intents, List<String> requested) {
        return names(intents, requested).stream().map(intents::get).toList();
    }
}
