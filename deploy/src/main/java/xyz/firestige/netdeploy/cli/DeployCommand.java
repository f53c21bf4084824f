package xyz.firestige.netdeploy.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;
import xyz.firestige.netdeploy.application.orchestration.PipelineOrchestrator;
import xyz.firestige.netdeploy.application.orchestration.PipelineRequest;
import xyz.firestige.netdeploy.domain.pipeline.DeviceReport;
import xyz.firestige.netdeploy.domain.pipeline.PipelineReport;
import xyz.firestige.netdeploy.infrastructure.gate.ConfirmationGate;

import java.io.PrintWriter;
import java.util.List;
import java.util.concurrent.Callable;

@Command(name = "deploy", mixinStandardHelpOptions = true,
        description = "Run the full pipeline: generate, pre-validate, preview, deploy, post-validate, report")
public class DeployCommand implements Callable<Integer> {

    @Spec
    CommandSpec spec;

    @Option(names = {"-d", "--device"}, description = "Restrict the run to this device (repeatable)")
    List<String> devices;

    @Option(names = "--dry-run", description = "Back up and diff only, never apply")
    boolean dryRun;

    @Option(names = {"-y", "--yes"}, description = "Approve both confirmation gates without prompting")
    boolean yes;

    private final PipelineOrchestrator orchestrator;

    public DeployCommand(PipelineOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @Override
    public Integer call() {
        PipelineOrchestrator pipeline = yes ? orchestrator.withGate(ConfirmationGate.autoApprove()) : orchestrator;
        PipelineReport report = pipeline.run(new PipelineRequest(devices, dryRun));
        print(spec.commandLine().getOut(), report);
        return report.isSuccess() ? 0 : 1;
    }

    static void print(PrintWriter out, PipelineReport report) {
        out.printf("%-12s %-10s %-10s %-9s %s%n", "DEVICE", "GENERATE", "DIFF", "DEPLOY", "DETAIL");
        for (DeviceReport d : report.devices()) {
            String detail = d.errorType() != null
                    ? d.errorPhase() + "/" + d.errorType() + ": " + d.errorMessage()
                    : d.skipReason() != null ? d.skipReason() : "";
            long postFail = d.postValidation().stream().filter(r -> r.isFailure()).count();
            if (postFail > 0) {
                detail = (detail.isEmpty() ? "" : detail + "; ") + postFail + " post-validation failures";
            }
            out.printf("%-12s %-10s %-10s %-9s %s%n", d.device(), d.generation(),
                    d.diff() != null ? d.diff() : "-", d.deployment() != null ? d.deployment() : "-", detail);
        }
        out.println(report.summary());
        if (!report.isSuccess()) {
            out.println("Rollback is never automatic; use 'netdeploy rollback DEVICE' to restore the last backup.");
        }
        out.flush();
    }
}
