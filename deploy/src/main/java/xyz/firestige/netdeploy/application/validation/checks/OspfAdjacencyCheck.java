package xyz.firestige.netdeploy.application.validation.checks;

import xyz.firestige.netdeploy.domain.intent.DeviceIntent;
import xyz.firestige.netdeploy.domain.validation.CheckCategory;
import xyz.firestige.netdeploy.domain.validation.ValidationPhase;
import xyz.firestige.netdeploy.domain.validation.ValidationResult;
import xyz.firestige.netdeploy.infrastructure.execution.DeviceOperationGuard;
import xyz.firestige.netdeploy.infrastructure.parser.OutputParser;
import xyz.firestige.netdeploy.infrastructure.parser.ProtocolEntry;
import xyz.firestige.netdeploy.infrastructure.parser.ProtocolState;

import java.util.List;
import java.util.Locale;

/**
 * 所有 OSPF 邻居必须处于 FULL
 */
public class OspfAdjacencyCheck extends ParsedStateCheck {

    public OspfAdjacencyCheck(OutputParser parser, DeviceOperationGuard guard) {
        super(parser, guard);
    }

    @Override
    public String getName() {
        return "ospf-adjacency";
    }

    @Override
    public CheckCategory getCategory() {
        return CheckCategory.OSPF;
    }

    @Override
    protected ValidationResult evaluate(DeviceIntent device, ProtocolState state, ValidationPhase phase) {
        if (state.isEmpty()) {
            return skip(device, phase, "no OSPF neighbors");
        }
        List<String> notFull = state.entries().stream()
                .filter(e -> !e.state().toUpperCase(Locale.ROOT).startsWith("FULL"))
                .map(e -> e.name() + " " + e.state())
                .toList();
        if (!notFull.isEmpty()) {
            return fail(device, phase, "OSPF neighbors not FULL: " + String.join(", ", notFull));
        }
        return pass(device, phase, state.entries().size() + " OSPF neighbors FULL: "
                + String.join(", ", state.entries().stream().map(ProtocolEntry::name).toList()));
    }
}
