package io.holdings.ownership.cli;

import com.google.inject.Guice;
import io.holdings.config.IngestionConfig;
import io.holdings.ownership.ingestor.OwnershipModule;
import io.holdings.ownership.model.SecurityId;
import io.holdings.ownership.resolve.DateResolver;
import io.holdings.ownership.resolve.ResolutionException;
import io.holdings.ownership.resolve.ResolveDirection;
import picocli.CommandLine;

import java.time.LocalDate;
import java.util.concurrent.Callable;

/** Show which stored date a target date maps to. */
@CommandLine.Command(name = "resolve", mixinStandardHelpOptions = true,
        description = "Resolve a date to the closest stored snapshot date")
public final class ResolveCommand implements Callable<Integer> {
    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @CommandLine.Mixin
    StoreOption storeOption = new StoreOption();

    @CommandLine.Option(names = {"-s", "--security"}, required = true, description = "Security id")
    String security;

    @CommandLine.Option(names = {"-d", "--date"}, required = true, description = "Target date (yyyy-MM-dd)")
    LocalDate date;

    @CommandLine.Option(names = "--direction", description = "nearest, on-or-before or on-or-after", defaultValue = "nearest")
    String direction;

    @CommandLine.Option(names = "--max-days", description = "Reject matches further away than this many days")
    Long maxDays;

    @Override
    public Integer call() throws Exception {
        ResolveDirection dir;
        try {
            dir = ResolveDirection.parse(direction);
        } catch (IllegalArgumentException e) {
            spec.commandLine().getErr().println("Unknown direction '" + direction + "'");
            return 2;
        }
        IngestionConfig config = storeOption.apply(IngestionConfig.fromEnv());
        DateResolver resolver = Guice.createInjector(new OwnershipModule(config)).getInstance(DateResolver.class);
        try {
            LocalDate found = resolver.resolve(SecurityId.of(security), date, dir, maxDays == null ? Long.MAX_VALUE : maxDays);
            spec.commandLine().getOut().println(found);
            return 0;
        } catch (ResolutionException e) {
            spec.commandLine().getErr().println(e.getMessage());
            return 1;
        }
    }
}
