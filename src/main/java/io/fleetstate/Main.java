package io.fleetstate;

import io.fleetstate.cli.FleetStateCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new FleetStateCommand()).execute(args);
        System.exit(code);
    }
}
