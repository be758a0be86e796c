package io.holdings.ownership.cli;

import com.google.inject.Guice;
import io.holdings.config.IngestionConfig;
import io.holdings.ownership.ingestor.OwnershipModule;
import io.holdings.ownership.model.SecurityId;
import io.holdings.ownership.store.SnapshotStore;
import io.holdings.ownership.store.StoreIoException;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.time.LocalDate;
import java.util.List;
import java.util.concurrent.Callable;

/** Print what the store holds: one line per security with its date count and range. */
@CommandLine.Command(name = "list", mixinStandardHelpOptions = true,
        description = "List stored securities with their snapshot counts and date ranges")
public final class ListCommand implements Callable<Integer> {
    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @CommandLine.Mixin
    StoreOption storeOption = new StoreOption();

    @Override
    public Integer call() {
        IngestionConfig config = storeOption.apply(IngestionConfig.fromEnv());
        SnapshotStore store = Guice.createInjector(new OwnershipModule(config)).getInstance(SnapshotStore.class);
        PrintWriter out = spec.commandLine().getOut();
        try {
            List<SecurityId> securities = store.listSecurities();
            for (SecurityId security : securities) {
                List<LocalDate> dates = store.listDates(security);
                if (dates.isEmpty()) continue;
                out.printf("%s\t%d\t%s\t%s%n", security.value(), dates.size(), dates.get(0), dates.get(dates.size() - 1));
            }
            out.flush();
            return securities.isEmpty() ? 1 : 0;
        } catch (StoreIoException e) {
            spec.commandLine().getErr().println(e.getMessage());
            return 1;
        }
    }
}
