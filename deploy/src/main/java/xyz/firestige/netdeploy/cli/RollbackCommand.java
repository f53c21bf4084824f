package xyz.firestige.netdeploy.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;
import xyz.firestige.netdeploy.application.rollback.RollbackService;
import xyz.firestige.netdeploy.domain.deployment.DeploymentResult;
import xyz.firestige.netdeploy.domain.deployment.DeploymentStatus;
import xyz.firestige.netdeploy.domain.intent.IntentRepository;

import java.io.PrintWriter;
import java.util.List;
import java.util.concurrent.Callable;

@Command(name = "rollback", mixinStandardHelpOptions = true,
        description = "Restore the most recent backup of each device, in reverse deployment order")
public class RollbackCommand implements Callable<Integer> {

    @Spec
    CommandSpec spec;

    @Parameters(paramLabel = "DEVICE", arity = "1..*", description = "Devices to roll back")
    List<String> devices;

    private final IntentRepository intents;
    private final RollbackService rollbackService;

    public RollbackCommand(IntentRepository intents, RollbackService rollbackService) {
        this.intents = intents;
        this.rollbackService = rollbackService;
    }

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        List<DeploymentResult> results = rollbackService.rollback(DeviceSelection.intents(intents, devices));
        for (DeploymentResult r : results) {
            out.printf("%-12s %-8s %s%n", r.getDevice(), r.getStatus(),
                    r.getFailureInfo().map(Object::toString).or(r::getSkipReason).orElse(""));
        }
        out.flush();
        return results.stream().allMatch(r -> r.getStatus() == DeploymentStatus.APPLIED) ? 0 : 1;
    }
}
