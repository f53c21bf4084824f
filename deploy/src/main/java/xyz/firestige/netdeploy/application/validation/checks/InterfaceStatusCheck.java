package xyz.firestige.netdeploy.application.validation.checks;

import xyz.firestige.netdeploy.domain.intent.DeviceIntent;
import xyz.firestige.netdeploy.domain.intent.InterfaceIntent;
import xyz.firestige.netdeploy.domain.validation.CheckCategory;
import xyz.firestige.netdeploy.domain.validation.ValidationPhase;
import xyz.firestige.netdeploy.domain.validation.ValidationResult;
import xyz.firestige.netdeploy.infrastructure.execution.DeviceOperationGuard;
import xyz.firestige.netdeploy.infrastructure.parser.OutputParser;
import xyz.firestige.netdeploy.infrastructure.parser.ProtocolEntry;
import xyz.firestige.netdeploy.infrastructure.parser.ProtocolState;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * 意图中带地址的接口必须是 up/up
 */
public class InterfaceStatusCheck extends ParsedStateCheck {

    public InterfaceStatusCheck(OutputParser parser, DeviceOperationGuard guard) {
        super(parser, guard);
    }

    @Override
    public String getName() {
        return "interfaces";
    }

    @Override
    public CheckCategory getCategory() {
        return CheckCategory.INTERFACES;
    }

    @Override
    protected boolean appliesTo(DeviceIntent device) {
        return device.getInterfaces().stream().anyMatch(InterfaceIntent::hasAddress);
    }

    @Override
    protected ValidationResult evaluate(DeviceIntent device, ProtocolState state, ValidationPhase phase) {
        List<String> problems = new ArrayList<>();
        int checked = 0;
        for (InterfaceIntent iface : device.getInterfaces()) {
            if (!iface.hasAddress()) {
                continue;
            }
            checked++;
            String status = state.find(iface.name()).map(ProtocolEntry::state).orElse(null);
            if (status == null) {
                problems.add(iface.name() + " missing");
            } else if (!isUpUp(status)) {
                problems.add(iface.name() + " " + status);
            }
        }
        if (!problems.isEmpty()) {
            return fail(device, phase, "interfaces not up/up: " + String.join(", ", problems));
        }
        return pass(device, phase, checked + " interfaces up/up");
    }

    private static boolean isUpUp(String status) {
        String s = status.strip().toLowerCase(Locale.ROOT);
        return s.equals("up/up") || s.equals("up");
    }
}
