package io.taskmaster;

import io.taskmaster.cli.TaskMasterCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new TaskMasterCommand()).execute(args);
        System.exit(code);
    }
}
