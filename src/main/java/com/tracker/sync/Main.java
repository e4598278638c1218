package com.tracker.sync;

import com.tracker.sync.cli.SyncCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new SyncCommand()).execute(args);
        System.exit(code);
    }
}
