package com.skillbench.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for Skillbench.
 */
@Command(
        name = "skillbench",
        mixinStandardHelpOptions = true,
        version = "Skillbench 0.1.0",
        description = "Evaluates skill prompts against fixed baselines and iterates on them",
        subcommands = {
                RunCommand.class,
                IterateCommand.class,
                StatusCommand.class,
                ReportCommand.class,
                ExportCommand.class,
                ServeCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class SkillbenchCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}
