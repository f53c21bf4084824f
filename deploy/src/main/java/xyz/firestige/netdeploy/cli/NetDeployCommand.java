package xyz.firestige.netdeploy.cli;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * netdeploy 根命令；不带子命令时打印用法
 */
@Command(name = "netdeploy",
        mixinStandardHelpOptions = true,
        version = "netdeploy 1.0.0",
        description = "Reconcile network device configuration against intent and deploy it in stages",
        subcommands = {
                ListCommand.class,
                GenerateCommand.class,
                DiffCommand.class,
                DeployCommand.class,
                BackupCommand.class,
                RollbackCommand.class,
                ValidateCommand.class,
                CommandLine.HelpCommand.class
        })
public class NetDeployCommand implements Runnable {

    @Spec
    CommandSpec spec;

    @Override
    public void run() {
        spec.commandLine().usage(spec.commandLine().getOut());
    }
}
