package xyz.firestige.netdeploy.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;
import xyz.firestige.netdeploy.application.backup.BackupOutcome;
import xyz.firestige.netdeploy.application.backup.BackupService;
import xyz.firestige.netdeploy.domain.intent.IntentRepository;

import java.io.PrintWriter;
import java.util.List;
import java.util.concurrent.Callable;

@Command(name = "backup", mixinStandardHelpOptions = true,
        description = "Capture and store the running configuration of each device")
public class BackupCommand implements Callable<Integer> {

    @Spec
    CommandSpec spec;

    @Option(names = {"-d", "--device"}, description = "Device to back up (repeatable, default: all)")
    List<String> devices;

    private final IntentRepository intents;
    private final BackupService backupService;

    public BackupCommand(IntentRepository intents, BackupService backupService) {
        this.intents = intents;
        this.backupService = backupService;
    }

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        List<BackupOutcome> outcomes = backupService.backupAll(DeviceSelection.intents(intents, devices));
        for (BackupOutcome outcome : outcomes) {
            if (outcome.isFailed()) {
                out.printf("%-12s FAILED %s%n", outcome.device(), outcome.failureInfo());
            } else {
                out.printf("%-12s %s -> %s%n", outcome.device(), outcome.handle().capturedAt(), outcome.handle().location());
            }
        }
        out.flush();
        return outcomes.stream().anyMatch(BackupOutcome::isFailed) ? 1 : 0;
    }
}
