package io.holdings.ownership.cli;

import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Slf4jReporter;
import com.google.inject.Guice;
import com.google.inject.Injector;
import io.holdings.config.IngestionConfig;
import io.holdings.http.TlsPolicy;
import io.holdings.ownership.ingestor.OwnershipModule;
import io.holdings.ownership.model.SecurityId;
import io.holdings.ownership.schedule.IngestionReport;
import io.holdings.ownership.schedule.IngestionRequest;
import io.holdings.ownership.schedule.IngestionScheduler;
import io.holdings.ownership.schedule.PublicationCalendar;
import io.holdings.ownership.universe.StaticUniverseProvider;
import io.holdings.ownership.universe.UniverseProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Fetch every missing weekly snapshot for the chosen securities into the local store.
 */
@CommandLine.Command(name = "ingest", mixinStandardHelpOptions = true,
        description = "Fetch missing ownership snapshots into the local store")
public final class IngestCommand implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(IngestCommand.class);
    private static final Duration SHUTDOWN_REPORT_GRACE = Duration.ofSeconds(60);

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @CommandLine.Mixin
    StoreOption storeOption = new StoreOption();

    @CommandLine.Option(names = {"-s", "--security"}, split = ",", description = "Securities (comma-separated or repeat option); default: the MoneyDJ listing")
    List<String> securities = new ArrayList<>();

    @CommandLine.Option(names = "--start", description = "First date (yyyy-MM-dd); default: --weeks before --end")
    LocalDate start;

    @CommandLine.Option(names = "--end", description = "Last date (yyyy-MM-dd); default today")
    LocalDate end;

    @CommandLine.Option(names = "--weeks", description = "Window length in weeks when --start is absent", defaultValue = "52")
    int weeks;

    @CommandLine.Option(names = "--calendar", description = "daily, weekdays or weekly:<DAY>", defaultValue = "weekly:FRIDAY")
    String calendar;

    @CommandLine.Option(names = "--force", description = "Fetch again even if stored or known empty")
    boolean force;

    @CommandLine.Option(names = "--max-securities", description = "Only the first N securities (0 = all)", defaultValue = "0")
    int maxSecurities;

    @CommandLine.Option(names = "--deadline", description = "Run deadline (ISO-8601 duration, e.g. PT2H)")
    Duration deadline;

    @CommandLine.Option(names = "--insecure", description = "Disable TLS certificate verification (test endpoints only)")
    boolean insecure;

    @Override
    public Integer call() throws Exception {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        PublicationCalendar cal;
        IngestionConfig config;
        try {
            cal = PublicationCalendar.parse(calendar);
            config = storeOption.apply(IngestionConfig.fromEnv());
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            return 2;
        }
        if (deadline != null) config = config.withRunDeadline(deadline);
        if (insecure) config = config.withTlsPolicy(TlsPolicy.disabled());
        LocalDate to = end == null ? LocalDate.now() : end;
        LocalDate from = start == null ? to.minusWeeks(Math.max(1, weeks)) : start;
        if (from.isAfter(to)) {
            err.println("Start date must be on/before end date");
            return 2;
        }

        Injector injector = Guice.createInjector(new OwnershipModule(config));
        UniverseProvider universe;
        try {
            universe = securities.isEmpty()
                    ? injector.getInstance(UniverseProvider.class)
                    : StaticUniverseProvider.of(securities.toArray(new String[0]));
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            return 2;
        }
        List<SecurityId> ids = new ArrayList<>(universe.listEligibleSecurities());
        if (maxSecurities > 0 && ids.size() > maxSecurities) ids = new ArrayList<>(ids.subList(0, maxSecurities));

        IngestionScheduler scheduler = injector.getInstance(IngestionScheduler.class);
        CountDownLatch reported = new CountDownLatch(1);
        Thread hook = new Thread(cancelAndAwaitReport(scheduler, reported, SHUTDOWN_REPORT_GRACE), "ingest-cancel");
        Runtime.getRuntime().addShutdownHook(hook);
        try {
            return runAndReport(scheduler, new IngestionRequest(ids, from, to, cal, force),
                    injector.getInstance(MetricRegistry.class), out, reported);
        } finally {
            removeHook(hook);
        }
    }

    /**
     * Run, then print the summary and the metrics report. {@code reported} is released once both
     * are out, or when the run fails.
     */
    static int runAndReport(IngestionScheduler scheduler, IngestionRequest request, MetricRegistry registry,
                            PrintWriter out, CountDownLatch reported) {
        try {
            IngestionReport report = scheduler.run(request);
            printSummary(out, report);
            Slf4jReporter.forRegistry(registry)
                    .outputTo(LoggerFactory.getLogger("io.holdings.metrics"))
                    .convertDurationsTo(TimeUnit.MILLISECONDS)
                    .build()
                    .report();
            return report.hasFailures() ? 1 : 0;
        } finally {
            reported.countDown();
        }
    }

    /**
     * Shutdown hook body: cancel the run and hold the JVM open until the summary is printed, at
     * most {@code grace}.
     */
    static Runnable cancelAndAwaitReport(IngestionScheduler scheduler, CountDownLatch reported, Duration grace) {
        return () -> {
            scheduler.cancel();
            try {
                if (!reported.await(grace.toMillis(), TimeUnit.MILLISECONDS)) {
                    log.warn("Summary not printed within {} of cancellation, exiting without it", grace);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        };
    }

    static void printSummary(PrintWriter out, IngestionReport report) {
        out.println("Per-security summary:");
        for (Map.Entry<SecurityId, IngestionReport.SecurityReport> e : report.securities().entrySet()) {
            IngestionReport.SecurityReport r = e.getValue();
            out.println("  " + e.getKey() + ": fetched=" + r.fetched().size() + " noData=" + r.noData().size()
                    + " failed=" + r.failed().size() + " skippedExisting=" + r.skippedExisting()
                    + " skippedKnownEmpty=" + r.skippedKnownEmpty());
            r.failed().forEach((d, f) -> out.println("    " + d + " " + f.reason() + (f.detail() == null ? "" : ": " + f.detail())));
        }
        out.println(report);
        out.flush();
    }

    private static void removeHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            // JVM already shutting down; the hook runs anyway
            log.debug("Shutdown in progress, hook left registered");
        }
    }
}
