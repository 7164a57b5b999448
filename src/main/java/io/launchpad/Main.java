package io.launchpad;

import io.launchpad.cli.LaunchPadCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new LaunchPadCommand()).execute(args);
        System.exit(code);
    }
}
