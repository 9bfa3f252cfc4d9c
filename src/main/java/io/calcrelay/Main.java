package io.calcrelay;

import io.calcrelay.cli.CalcRelayCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new CalcRelayCommand()).execute(args);
        System.exit(code);
    }
}
