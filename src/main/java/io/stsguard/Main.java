package io.stsguard;

import io.stsguard.cli.StsGuardCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new StsGuardCommand()).execute(args);
        System.exit(code);
    }
}
