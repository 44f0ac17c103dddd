package io.esquorum;

import io.esquorum.cli.EsQuorumCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new EsQuorumCommand()).execute(args);
        System.exit(code);
    }
}
