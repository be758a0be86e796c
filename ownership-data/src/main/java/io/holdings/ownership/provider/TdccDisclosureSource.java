package io.holdings.ownership.provider;

import io.holdings.ownership.fetch.DisclosureSource;
import io.holdings.ownership.fetch.FetchException;
import io.holdings.ownership.fetch.NoDataException;
import io.holdings.ownership.fetch.PermanentFetchException;
import io.holdings.ownership.fetch.TransientFetchException;
import io.holdings.ownership.model.Bracket;
import io.holdings.ownership.model.OwnershipSnapshot;
import io.holdings.ownership.model.SecurityId;
import io.holdings.ownership.model.StoreKey;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * TDCC shareholding-distribution query page. Posts the query form for one security and date
 * and reads the tier table out of the returned HTML.
 *
 * <p>The table has one numbered row per holding tier, an adjustment row ({@value #ADJUSTMENT_LABEL})
 * that is skipped, and a total row ({@value #TOTAL_LABEL}) that supplies the total share count.
 */
public class TdccDisclosureSource implements DisclosureSource {
    private static final Logger log = LoggerFactory.getLogger(TdccDisclosureSource.class);

    static final String TOTAL_LABEL = "合計";
    static final String ADJUSTMENT_LABEL = "差異數調整";
    private static final List<String> NO_DATA_MARKERS = List.of("查無此資料", "查無資料");
    private static final List<String> UNKNOWN_SECURITY_MARKERS = List.of("無此證券代號", "證券代號錯誤");
    private static final DateTimeFormatter FORM_DATE = DateTimeFormatter.BASIC_ISO_DATE;

    private final HttpClient http;
    private final URI endpoint;
    private final Duration requestTimeout;

    public TdccDisclosureSource(HttpClient http, URI endpoint, Duration requestTimeout) {
        this.http = http;
        this.endpoint = endpoint;
        this.requestTimeout = requestTimeout;
    }

    @Override
    public String name() { return "tdcc"; }

    @Override
    public OwnershipSnapshot fetch(SecurityId security, LocalDate date) throws FetchException, InterruptedException {
        StoreKey key = new StoreKey(security, date);
        Map<String, String> form = new LinkedHashMap<>();
        form.put("scaDate", FORM_DATE.format(date));
        form.put("sqlMethod", "StockNo");
        form.put("stockNo", security.value());
        form.put("REQ_OPR", "SELECT");
        HttpRequest req = HttpRequest.newBuilder(endpoint)
                .timeout(requestTimeout)
                .header("User-Agent", "Mozilla/5.0 (holdings-pipelines)")
                .header("Accept", "text/html")
                .header("Content-Type", "application/x-www-form-urlencoded")
                .POST(HttpRequest.BodyPublishers.ofString(encode(form), StandardCharsets.UTF_8))
                .build();
        HttpResponse<String> resp;
        try {
            resp = http.send(req, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (HttpTimeoutException e) {
            throw new TransientFetchException(key, "timed out after " + requestTimeout, e);
        } catch (IOException e) {
            throw new TransientFetchException(key, "I/O error: " + e.getMessage(), e);
        }
        int status = resp.statusCode();
        if (isTransientStatus(status)) throw new TransientFetchException(key, "HTTP " + status);
        if (status < 200 || status >= 300) throw new PermanentFetchException(key, "HTTP " + status);
        return parse(key, resp.body());
    }

    static boolean isTransientStatus(int status) {
        return status == 408 || status == 425 || status == 429 || status >= 500;
    }

    /** Turn a result page into a snapshot, classifying pages that carry no table. */
    static OwnershipSnapshot parse(StoreKey key, String html) throws FetchException {
        Document doc = Jsoup.parse(html == null ? "" : html);
        String text = doc.text();
        for (String marker : UNKNOWN_SECURITY_MARKERS) {
            if (text.contains(marker)) throw new PermanentFetchException(key, "source does not know this security");
        }
        for (String marker : NO_DATA_MARKERS) {
            if (text.contains(marker)) throw new NoDataException(key, "source reports no data (" + marker + ")");
        }
        Element table = findResultTable(doc);
        if (table == null) throw new TransientFetchException(key, "result table missing from response");

        List<Bracket> brackets = new ArrayList<>();
        long total = -1;
        for (Element row : table.select("tr")) {
            Elements cells = row.select("td");
            if (cells.size() < 4) continue;
            String label = cells.get(1).text().trim();
            if (label.contains(ADJUSTMENT_LABEL)) continue;
            if (label.contains(TOTAL_LABEL) || cells.get(0).text().contains(TOTAL_LABEL)) {
                total = number(key, cells.get(3).text());
                continue;
            }
            if (!cells.get(0).text().trim().matches("\\d+")) continue;
            try {
                brackets.add(new Bracket(label, number(key, cells.get(2).text()), number(key, cells.get(3).text())));
            } catch (IllegalArgumentException e) {
                throw new PermanentFetchException(key, "bad tier row '" + label + "': " + e.getMessage(), e);
            }
        }
        if (brackets.isEmpty()) throw new NoDataException(key, "table has no tier rows");

        long tierShares = 0;
        for (Bracket b : brackets) tierShares += b.shareCount();
        if (total < tierShares) {
            // missing total row, or a negative adjustment row
            if (total >= 0) log.debug("{} total {} below tier sum {}, using tier sum", key, total, tierShares);
            total = tierShares;
        }
        try {
            return new OwnershipSnapshot(key.security(), key.date(), total, brackets);
        } catch (IllegalArgumentException e) {
            throw new PermanentFetchException(key, "inconsistent table: " + e.getMessage(), e);
        }
    }

    private static Element findResultTable(Document doc) {
        for (Element table : doc.select("table")) {
            String header = table.text();
            if (header.contains("人數") && (header.contains("股數") || header.contains("單位數"))) return table;
        }
        return null;
    }

    private static long number(StoreKey key, String raw) throws PermanentFetchException {
        String s = raw.replace(",", "").replace("\u00a0", "").replace(" ", "").trim();
        try {
            return Long.parseLong(s);
        } catch (NumberFormatException e) {
            throw new PermanentFetchException(key, "not a number: '" + raw + "'", e);
        }
    }

    private static String encode(Map<String, String> form) {
        return form.entrySet().stream()
                .map(e -> URLEncoder.encode(e.getKey(), StandardCharsets.UTF_8) + "="
                        + URLEncoder.encode(e.getValue(), StandardCharsets.UTF_8))
                .collect(Collectors.joining("&"));
    }
}
