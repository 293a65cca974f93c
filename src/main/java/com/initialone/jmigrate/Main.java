package com.initialone.jmigrate;

import com.initialone.jmigrate.commands.MigrateCmd;
import picocli.CommandLine;

@CommandLine.Command(
        name = "jmigrate",
        version = "0.1.0",
        mixinStandardHelpOptions = true,
        usageHelpAutoWidth = true,
        sortOptions = false,
        description = {
                "Migrate renamed identifiers across a source tree. Typical flow:",
                "  migrate --migration=7to8 src out   (review diffs)  →  migrate --migration=7to8 src -i",
                "",
                "Built-in migrations: 7to8",
                "Props: -Djmigrate.color=false"
        },
        subcommands = {
                MigrateCmd.class
        }
)
public class Main implements Runnable {
    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    public void run() { spec.commandLine().getOut().println("Use a subcommand. Try --help."); }

    public static CommandLine commandLine() {
        return new CommandLine(new Main())
                .setExecutionExceptionHandler((ex, cmd, parseResult) -> {
                    cmd.getErr().println(ex.getMessage());
                    cmd.getErr().flush();
                    return cmd.getCommandSpec().exitCodeOnExecutionException();
                });
    }

    public static void main(String[] args) {
        if (args.length == 0) args = new String[]{"--help"};
        int code = commandLine().execute(args);
        System.exit(code);
    }
}
