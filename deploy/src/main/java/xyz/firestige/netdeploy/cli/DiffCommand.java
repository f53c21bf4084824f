package xyz.firestige.netdeploy.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;
import xyz.firestige.netdeploy.application.generation.ConfigGenerationService;
import xyz.firestige.netdeploy.application.generation.GenerationOutcome;
import xyz.firestige.netdeploy.application.preview.DiffPreview;
import xyz.firestige.netdeploy.application.preview.DiffPreviewService;
import xyz.firestige.netdeploy.domain.config.GeneratedConfig;
import xyz.firestige.netdeploy.domain.diff.ConfigDiff;
import xyz.firestige.netdeploy.domain.intent.IntentRepository;

import java.io.PrintWriter;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;

@Command(name = "diff", mixinStandardHelpOptions = true,
        description = "Show what would change on each device (read-only)")
public class DiffCommand implements Callable<Integer> {

    @Spec
    CommandSpec spec;

    @Option(names = {"-d", "--device"}, description = "Device to diff (repeatable, default: all)")
    List<String> devices;

    private final IntentRepository intents;
    private final ConfigGenerationService generationService;
    private final DiffPreviewService previewService;

    public DiffCommand(IntentRepository intents, ConfigGenerationService generationService,
                       DiffPreviewService previewService) {
        this.intents = intents;
        this.generationService = generationService;
        this.previewService = previewService;
    }

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        List<GenerationOutcome> outcomes = generationService.generate(DeviceSelection.names(intents, devices));
        List<GeneratedConfig> configs = outcomes.stream()
                .map(GenerationOutcome::getConfig)
                .flatMap(Optional::stream)
                .toList();
        int failures = outcomes.size() - configs.size();
        for (DiffPreview preview : previewService.preview(configs)) {
            if (preview.isFailed()) {
                failures++;
                out.printf("=== %s: capture failed: %s%n", preview.device(), preview.failureInfo().getErrorMessage());
                continue;
            }
            ConfigDiff diff = preview.diff();
            out.printf("=== %s (%s)%n", preview.device(), diff.isEmpty() ? "in sync" : diff.summary());
            diff.getLinesToRemove().forEach(line -> out.println("- " + line));
            diff.getLinesToAdd().forEach(line -> out.println("+ " + line));
        }
        out.flush();
        return failures == 0 ? 0 : 1;
    }
}
