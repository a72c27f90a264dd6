package dev.runplan;

import dev.runplan.cli.RunPlanCli;

public class Main {
    public static void main(String[] args) {
        int exitCode = RunPlanCli.newCommandLine().execute(args);
        System.exit(exitCode);
    }
}
