package io.mnemoshard;

import io.mnemoshard.cli.MnemoShardCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new MnemoShardCommand()).execute(args);
        System.exit(code);
    }
}
