package io.holdings.ownership.cli;

import com.google.inject.Guice;
import io.holdings.config.IngestionConfig;
import io.holdings.ownership.ingestor.OwnershipModule;
import io.holdings.ownership.model.SecurityId;
import io.holdings.ownership.resolve.NoDataAvailableException;
import io.holdings.ownership.series.OwnershipSeries;
import io.holdings.ownership.series.OwnershipSeriesReader;
import io.holdings.ownership.series.SeriesCsvWriter;
import picocli.CommandLine;

import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.concurrent.Callable;

/** Print or save one table (holders, shares or percent) of a stored series. Never goes online. */
@CommandLine.Command(name = "query", mixinStandardHelpOptions = true,
        description = "Write a stored ownership series as CSV")
public final class QueryCommand implements Callable<Integer> {
    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @CommandLine.Mixin
    StoreOption storeOption = new StoreOption();

    @CommandLine.Option(names = {"-s", "--security"}, required = true, description = "Security id, e.g. 2330")
    String security;

    @CommandLine.Option(names = "--start", required = true, description = "Start date (yyyy-MM-dd)")
    LocalDate start;

    @CommandLine.Option(names = "--end", required = true, description = "End date (yyyy-MM-dd)")
    LocalDate end;

    @CommandLine.Option(names = "--table", description = "holders, shares or percent", defaultValue = "holders")
    String table;

    @CommandLine.Option(names = {"-o", "--out"}, description = "CSV file; stdout when absent")
    Path out;

    @Override
    public Integer call() throws Exception {
        if (start.isAfter(end)) {
            spec.commandLine().getErr().println("Start date must be on/before end date");
            return 2;
        }
        OwnershipSeries.Table t;
        try {
            t = OwnershipSeries.Table.parse(table);
        } catch (IllegalArgumentException e) {
            spec.commandLine().getErr().println("Unknown table '" + table + "', expected holders, shares or percent");
            return 2;
        }
        IngestionConfig config = storeOption.apply(IngestionConfig.fromEnv());
        OwnershipSeriesReader reader = Guice.createInjector(new OwnershipModule(config)).getInstance(OwnershipSeriesReader.class);
        OwnershipSeries series;
        try {
            series = reader.read(SecurityId.of(security), start, end);
        } catch (NoDataAvailableException e) {
            spec.commandLine().getErr().println(e.getMessage());
            return 1;
        }
        for (String w : series.warnings()) spec.commandLine().getErr().println("WARNING: " + w);
        if (out == null) {
            SeriesCsvWriter.write(series, t, spec.commandLine().getOut());
        } else {
            if (out.getParent() != null) Files.createDirectories(out.getParent());
            try (Writer w = Files.newBufferedWriter(out, StandardCharsets.UTF_8)) {
                SeriesCsvWriter.write(series, t, w);
            }
            spec.commandLine().getOut().println("Wrote " + series.snapshots().size() + " rows to " + out);
        }
        return 0;
    }
}
