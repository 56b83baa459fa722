package io.workgraph;

import io.workgraph.cli.WorkGraphCommand;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = WorkGraphCommand.newCommandLine().execute(args);
        System.exit(code);
    }
}
