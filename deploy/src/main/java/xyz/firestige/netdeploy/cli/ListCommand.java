package xyz.firestige.netdeploy.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;
import xyz.firestige.netdeploy.application.plan.DeploymentPlanner;
import xyz.firestige.netdeploy.domain.deployment.DeploymentPlan;
import xyz.firestige.netdeploy.domain.intent.DeviceIntent;
import xyz.firestige.netdeploy.domain.intent.IntentRepository;

import java.io.PrintWriter;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(name = "list", mixinStandardHelpOptions = true,
        description = "List devices in deployment order, grouped by tier")
public class ListCommand implements Callable<Integer> {

    @Spec
    CommandSpec spec;

    private final IntentRepository intents;
    private final DeploymentPlanner planner;

    public ListCommand(IntentRepository intents, DeploymentPlanner planner) {
        this.intents = intents;
        this.planner = planner;
    }

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        DeploymentPlan plan = planner.plan(intents.load().values());
        for (Map.Entry<Integer, List<DeviceIntent>> tier : plan.tiers().entrySet()) {
            out.printf("tier %d%n", tier.getKey());
            for (DeviceIntent d : tier.getValue()) {
                out.printf("  %-12s %-12s %-16s template=%s%s%n", d.getName(), d.getRole(), d.getMgmtIp(),
                        d.getTemplate(), d.getDependsOn().isEmpty() ? "" : " depends_on=" + d.getDependsOn());
            }
        }
        out.flush();
        return 0;
    }
}
