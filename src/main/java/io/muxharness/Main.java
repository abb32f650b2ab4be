package io.muxharness;

import io.muxharness.cli.MuxHarnessCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new MuxHarnessCommand()).execute(args);
        System.exit(code);
    }
}
