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
 * LDP 邻居必须处于 Oper 状态
 */
public class LdpNeighborCheck extends ParsedStateCheck {

    public LdpNeighborCheck(OutputParser parser, DeviceOperationGuard guard) {
        super(parser, guard);
    }

    @Override
    public String getName() {
        return "ldp-neighbors";
    }

    @Override
    public CheckCategory getCategory() {
        return CheckCategory.MPLS_LDP;
    }

    @Override
    protected ValidationResult evaluate(DeviceIntent device, ProtocolState state, ValidationPhase phase) {
        if (state.isEmpty()) {
            return skip(device, phase, "no LDP neighbors");
        }
        List<String> down = state.entries().stream()
                .filter(e -> !e.state().strip().equalsIgnoreCase("Oper"))
                .map(e -> e.name() + " " + e.state())
                .toList();
        if (!down.isEmpty()) {
            return fail(device, phase, "LDP neighbors not operational: " + String.join(", ", down));
        }
        return pass(device, phase, state.entries().size() + " LDP neighbors operational");
    }
}
