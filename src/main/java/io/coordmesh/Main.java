package io.coordmesh;

import io.coordmesh.cli.CoordMeshCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new CoordMeshCommand()).execute(args);
        System.exit(code);
    }
}
