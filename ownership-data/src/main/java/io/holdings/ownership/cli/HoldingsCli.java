package io.holdings.ownership.cli;

import picocli.CommandLine;

/**
 * Command-line entry point: {@code holdings ingest|query|resolve|list}.
 */
@CommandLine.Command(name = "holdings", mixinStandardHelpOptions = true,
        description = "Build and query a local store of TDCC shareholding distributions",
        subcommands = {IngestCommand.class, QueryCommand.class, ResolveCommand.class, ListCommand.class})
public final class HoldingsCli implements Runnable {
    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    public static void main(String[] args) {
        int code = new CommandLine(new HoldingsCli()).execute(args);
        System.exit(code);
    }

    @Override
    public void run() {
        spec.commandLine().usage(spec.commandLine().getOut());
    }
}
