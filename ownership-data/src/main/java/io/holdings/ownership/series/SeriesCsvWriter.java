package io.holdings.ownership.series;

import io.holdings.ownership.model.OwnershipSnapshot;

import java.io.IOException;
import java.io.Writer;
import java.util.Locale;

/** Writes one table of a series as CSV: a {@code date} column, then one column per bracket. */
public final class SeriesCsvWriter {
    private SeriesCsvWriter() {}

    public static void write(OwnershipSeries series, OwnershipSeries.Table table, Writer out) throws IOException {
        StringBuilder header = new StringBuilder("date");
        for (String id : series.bracketIds()) header.append(',').append(quote(id));
        out.write(header.append('\n').toString());
        for (OwnershipSnapshot s : series.snapshots()) {
            StringBuilder row = new StringBuilder(s.date().toString());
            for (String id : series.bracketIds()) {
                row.append(',');
                Number v = series.value(table, s, id);
                if (v == null) continue;
                row.append(v instanceof Double d ? String.format(Locale.ROOT, "%.4f", d) : v.toString());
            }
            out.write(row.append('\n').toString());
        }
        out.flush();
    }

    static String quote(String s) {
        if (s.indexOf(',') < 0 && s.indexOf('"') < 0 && s.indexOf('\n') < 0) return s;
        return '"' + s.replace("\"", "\"\"") + '"';
    }
}
