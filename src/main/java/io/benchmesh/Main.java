package io.benchmesh;

import io.benchmesh.cli.BenchMeshCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new BenchMeshCommand()).execute(args);
        System.exit(code);
    }
}
