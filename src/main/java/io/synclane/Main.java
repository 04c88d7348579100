package io.synclane;

import io.synclane.cli.SyncLaneCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new SyncLaneCommand()).execute(args);
        System.exit(code);
    }
}
