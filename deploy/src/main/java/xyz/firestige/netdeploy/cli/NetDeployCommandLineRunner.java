package xyz.firestige.netdeploy.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import picocli.CommandLine;
import xyz.firestige.netdeploy.domain.shared.exception.NetDeployException;

/**
 * Spring 启动完成后执行命令行，退出码交给 SpringApplication.exit
 */
public class NetDeployCommandLineRunner implements CommandLineRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(NetDeployCommandLineRunner.class);

    private final CommandLine.IFactory factory;
    private int exitCode;

    public NetDeployCommandLineRunner(CommandLine.IFactory factory) {
        this.factory = factory;
    }

    @Override
    public void run(String... args) {
        CommandLine commandLine = new CommandLine(NetDeployCommand.class, factory)
                .setCaseInsensitiveEnumValuesAllowed(true)
                .setExecutionExceptionHandler((ex, cmd, parseResult) -> {
                    if (ex instanceof NetDeployException nde) {
                        log.error("{} failed: {} - {}", cmd.getCommandName(), nde.getErrorType(), nde.getMessage());
                        cmd.getErr().println(nde.getErrorType() + ": " + nde.getMessage());
                        return 1;
                    }
                    throw ex;
                });
        exitCode = commandLine.execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
