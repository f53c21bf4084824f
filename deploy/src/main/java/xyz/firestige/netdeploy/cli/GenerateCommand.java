package xyz.firestige.netdeploy.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;
import xyz.firestige.netdeploy.application.generation.ConfigGenerationService;
import xyz.firestige.netdeploy.application.generation.GenerationOutcome;
import xyz.firestige.netdeploy.domain.intent.IntentRepository;

import java.io.PrintWriter;
import java.util.List;
import java.util.concurrent.Callable;

@Command(name = "generate", mixinStandardHelpOptions = true,
        description = "Render configuration from intent and save it to the config store")
public class GenerateCommand implements Callable<Integer> {

    @Spec
    CommandSpec spec;

    @Option(names = {"-d", "--device"}, description = "Device to generate (repeatable, default: all)")
    List<String> devices;

    private final IntentRepository intents;
    private final ConfigGenerationService generationService;

    public GenerateCommand(IntentRepository intents, ConfigGenerationService generationService) {
        this.intents = intents;
        this.generationService = generationService;
    }

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        List<GenerationOutcome> outcomes = generationService.generate(DeviceSelection.names(intents, devices));
        int skipped = 0;
        for (GenerationOutcome outcome : outcomes) {
            if (outcome.isGenerated()) {
                out.printf("%-12s generated%n", outcome.getDevice());
            } else {
                skipped++;
                out.printf("%-12s SKIPPED %s%n", outcome.getDevice(), outcome.getFailureInfo().map(Object::toString).orElse(""));
            }
        }
        out.flush();
        return skipped == 0 ? 0 : 1;
    }
}
