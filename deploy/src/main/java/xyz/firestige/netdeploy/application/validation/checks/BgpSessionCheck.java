package xyz.firestige.netdeploy.application.validation.checks;

import xyz.firestige.netdeploy.domain.intent.BgpNeighborIntent;
import xyz.firestige.netdeploy.domain.intent.DeviceIntent;
import xyz.firestige.netdeploy.domain.validation.CheckCategory;
import xyz.firestige.netdeploy.domain.validation.ValidationPhase;
import xyz.firestige.netdeploy.domain.validation.ValidationResult;
import xyz.firestige.netdeploy.infrastructure.execution.DeviceOperationGuard;
import xyz.firestige.netdeploy.infrastructure.parser.OutputParser;
import xyz.firestige.netdeploy.infrastructure.parser.ProtocolEntry;
import xyz.firestige.netdeploy.infrastructure.parser.ProtocolState;

import java.util.ArrayList;
import java.util.List;

/**
 * 意图中声明的每个 BGP 邻居都必须是 Established
 */
public class BgpSessionCheck extends ParsedStateCheck {

    public BgpSessionCheck(OutputParser parser, DeviceOperationGuard guard) {
        super(parser, guard);
    }

    @Override
    public String getName() {
        return "bgp-sessions";
    }

    @Override
    public CheckCategory getCategory() {
        return CheckCategory.BGP;
    }

    @Override
    protected boolean appliesTo(DeviceIntent device) {
        return device.hasBgp() && !device.getBgpNeighbors().isEmpty();
    }

    @Override
    protected ValidationResult evaluate(DeviceIntent device, ProtocolState state, ValidationPhase phase) {
        List<String> problems = new ArrayList<>();
        for (BgpNeighborIntent peer : device.getBgpNeighbors()) {
            String status = state.find(peer.ip()).map(ProtocolEntry::state).orElse(null);
            if (status == null) {
                problems.add(peer.ip() + " absent");
            } else if (!status.strip().equalsIgnoreCase("Established")) {
                problems.add(peer.ip() + " " + status);
            }
        }
        if (!problems.isEmpty()) {
            return fail(device, phase, "BGP sessions not established: " + String.join(", ", problems));
        }
        return pass(device, phase, device.getBgpNeighbors().size() + " BGP sessions Established");
    }
}
