package com.hartwig.miniwt;

import java.util.concurrent.Callable;

import com.hartwig.miniwt.cli.AnalyzeCommand;
import com.hartwig.miniwt.cli.ConvertCommand;
import com.hartwig.miniwt.cli.ConvertDirCommand;
import com.hartwig.miniwt.cli.ValidateCommand;

import picocli.CommandLine;

@CommandLine.Command(name = "miniwt",
                     mixinStandardHelpOptions = true,
                     description = "Translates workflow definitions between WDL and CWL",
                     subcommands = { ConvertCommand.class, ConvertDirCommand.class, ValidateCommand.class, AnalyzeCommand.class })
public class MiniWtMain implements Callable<Integer> {
    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getErr());
        return 1;
    }

    public static void main(String[] args) {
        System.exit(new CommandLine(new MiniWtMain()).execute(args));
    }
}
