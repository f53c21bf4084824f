package xyz.firestige.netdeploy.application.validation.checks;

import xyz.firestige.netdeploy.domain.intent.DeviceIntent;
import xyz.firestige.netdeploy.domain.validation.CheckCategory;
import xyz.firestige.netdeploy.domain.validation.ValidationPhase;
import xyz.firestige.netdeploy.domain.validation.ValidationResult;
import xyz.firestige.netdeploy.infrastructure.execution.DeviceOperationGuard;
import xyz.firestige.netdeploy.infrastructure.parser.OutputParser;
import xyz.firestige.netdeploy.infrastructure.parser.ProtocolState;

import java.util.List;

/**
 * 意图中的 VRF 必须全部存在。设备上一个 VRF 都没有视为未配置（SKIP）。
 */
public class VrfPresenceCheck extends ParsedStateCheck {

    public VrfPresenceCheck(OutputParser parser, DeviceOperationGuard guard) {
        super(parser, guard);
    }

    @Override
    public String getName() {
        return "vrf-presence";
    }

    @Override
    public CheckCategory getCategory() {
        return CheckCategory.VRF;
    }

    @Override
    protected boolean appliesTo(DeviceIntent device) {
        return !device.getVrfs().isEmpty();
    }

    @Override
    protected ValidationResult evaluate(DeviceIntent device, ProtocolState state, ValidationPhase phase) {
        if (state.isEmpty()) {
            return skip(device, phase, "no VRFs configured on device");
        }
        List<String> missing = device.getVrfs().stream()
                .filter(vrf -> state.find(vrf).isEmpty())
                .toList();
        if (!missing.isEmpty()) {
            return fail(device, phase, "VRFs missing: " + String.join(", ", missing));
        }
        return pass(device, phase, device.getVrfs().size() + " VRFs present");
    }
}
