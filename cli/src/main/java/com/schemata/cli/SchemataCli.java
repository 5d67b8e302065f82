package com.schemata.cli;

import picocli.CommandLine;
import picocli.CommandLine.Command;

@Command(
        name = "schemata",
        description = "Read a database catalog as models and apply schema changes",
        mixinStandardHelpOptions = true,
        version = "0.1.0",
        subcommands = {
                ModelsCommand.class,
                MigrateCommand.class
        }
)
public class SchemataCli implements Runnable {

    @Override
    public void run() {
        CommandLine.usage(this, System.out);
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new SchemataCli()).execute(args);
        System.exit(exitCode);
    }
}
