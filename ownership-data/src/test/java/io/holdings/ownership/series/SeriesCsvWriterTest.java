package io.holdings.ownership.series;

import io.holdings.ownership.model.Bracket;
import io.holdings.ownership.model.OwnershipSnapshot;
import io.holdings.ownership.model.SecurityId;
import io.holdings.ownership.resolve.ResolvedWindow;
import io.holdings.ownership.testing.Snapshots;
import org.junit.jupiter.api.Test;

import java.io.StringWriter;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SeriesCsvWriterTest {
    private static final LocalDate D1 = LocalDate.of(2024, 1, 5);
    private static final LocalDate D2 = LocalDate.of(2024, 1, 12);

    private static OwnershipSeries series() {
        OwnershipSnapshot a = Snapshots.snapshot("2330", D1);
        OwnershipSnapshot b = new OwnershipSnapshot(SecurityId.of("2330"), D2, 10, List.of(new Bracket("1-999", 4, 10)));
        return new OwnershipSeries(SecurityId.of("2330"), new ResolvedWindow(D1, D2, false, false, List.of(D1, D2)),
                List.of("1-999", "1,000-5,000", "1,000,001以上"), List.of(a, b), List.of());
    }

    @Test
    void writes_holders_with_quoted_headers_and_empty_missing_cells() throws Exception {
        StringWriter out = new StringWriter();
        SeriesCsvWriter.write(series(), OwnershipSeries.Table.HOLDERS, out);
        assertEquals("date,1-999,\"1,000-5,000\",\"1,000,001以上\"\n"
                + "2024-01-05,1001,301,5\n"
                + "2024-01-12,4,,\n", out.toString());
    }

    @Test
    void percent_uses_four_decimals() throws Exception {
        StringWriter out = new StringWriter();
        SeriesCsvWriter.write(series(), OwnershipSeries.Table.PERCENT, out);
        String[] lines = out.toString().split("\n");
        assertEquals("2024-01-05,2.0408,6.1224,91.8367", lines[1]);
        assertEquals("2024-01-12,100.0000,,", lines[2]);
    }

    @Test
    void quotes_embedded_quotes() {
        assertEquals("\"a\"\"b\"", SeriesCsvWriter.quote("a\"b"));
        assertEquals("plain", SeriesCsvWriter.quote("plain"));
    }
}
