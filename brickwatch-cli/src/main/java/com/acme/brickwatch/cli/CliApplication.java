package com.acme.brickwatch.cli;

import com.acme.brickwatch.cli.commands.BrickCommands;
import com.acme.brickwatch.cli.commands.ConfigureCommand;
import picocli.CommandLine;
import picocli.CommandLine.Command;

@Command(
        name = "brickwatch",
        description = "Brick Watch CLI - manage and trigger bricks on a Brick Watch server",
        mixinStandardHelpOptions = true,
        version = "1.0.0",
        subcommands = {
                ConfigureCommand.class,
                BrickCommands.Create.class,
                BrickCommands.Get.class,
                BrickCommands.ListBricks.class,
                BrickCommands.Update.class,
                BrickCommands.Trigger.class,
                BrickCommands.Pause.class,
                BrickCommands.Unpause.class,
                BrickCommands.Delete.class
        }
)
public class CliApplication implements Runnable {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new CliApplication()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public void run() {
        // When run without subcommand, show help
        CommandLine.usage(this, System.out);
    }
}
