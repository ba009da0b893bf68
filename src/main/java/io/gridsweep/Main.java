package io.gridsweep;

import io.gridsweep.cli.GridSweepCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new GridSweepCommand()).execute(args);
        System.exit(code);
    }
}
