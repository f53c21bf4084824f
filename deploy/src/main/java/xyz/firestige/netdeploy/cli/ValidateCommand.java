package xyz.firestige.netdeploy.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;
import xyz.firestige.netdeploy.application.validation.ValidationRunner;
import xyz.firestige.netdeploy.domain.intent.IntentRepository;
import xyz.firestige.netdeploy.domain.validation.ValidationPhase;
import xyz.firestige.netdeploy.domain.validation.ValidationResult;

import java.io.PrintWriter;
import java.util.List;
import java.util.concurrent.Callable;

@Command(name = "validate", mixinStandardHelpOptions = true,
        description = "Run read-only health checks against the devices")
public class ValidateCommand implements Callable<Integer> {

    @Spec
    CommandSpec spec;

    @Option(names = "--phase", defaultValue = "POST", description = "Check set to run: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})")
    ValidationPhase phase;

    @Option(names = {"-d", "--device"}, description = "Device to check (repeatable, default: all)")
    List<String> devices;

    private final IntentRepository intents;
    private final ValidationRunner validationRunner;

    public ValidateCommand(IntentRepository intents, ValidationRunner validationRunner) {
        this.intents = intents;
        this.validationRunner = validationRunner;
    }

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        List<ValidationResult> results = validationRunner.runChecks(DeviceSelection.intents(intents, devices), phase);
        for (ValidationResult r : results) {
            out.printf("%-12s %-16s %-4s %s%n", r.device(), r.checkName(), r.status(), r.detail());
        }
        out.flush();
        return results.stream().anyMatch(ValidationResult::isFailure) ? 1 : 0;
    }
}
