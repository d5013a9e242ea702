package io.auditforge;

import io.auditforge.cli.AuditForgeCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new AuditForgeCommand()).execute(args);
        System.exit(code);
    }
}
