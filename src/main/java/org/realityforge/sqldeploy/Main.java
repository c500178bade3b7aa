package org.realityforge.sqldeploy;

import org.realityforge.sqldeploy.cli.SqlDeployCommand;

public final class Main {
    private Main() {}

    public static void main(final String[] args) {
        System.exit(run(args));
    }

    public static int run(final String[] args) {
        return SqlDeployCommand.execute(args);
    }
}
