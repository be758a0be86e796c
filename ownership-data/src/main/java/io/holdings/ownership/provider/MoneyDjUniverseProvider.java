package io.holdings.ownership.provider;

import io.holdings.ownership.model.SecurityId;
import io.holdings.ownership.universe.SecurityFilter;
import io.holdings.ownership.universe.UniverseProvider;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Listed-company table published by MoneyDJ. The page is Big5 encoded; the charset is taken from
 * the page's own meta tag. Rows look like {@code <td>2330</td><td>台積電</td>} or carry code and name
 * in one cell ({@code 2330 台積電}).
 */
public class MoneyDjUniverseProvider implements UniverseProvider {
    private static final Logger log = LoggerFactory.getLogger(MoneyDjUniverseProvider.class);
    private static final Pattern CODE_AND_NAME = Pattern.compile("(\\d{4,6})(?:\\s+(.*))?");

    private final HttpClient http;
    private final URI url;
    private final Duration timeout;
    private final SecurityFilter filter;

    public MoneyDjUniverseProvider(HttpClient http, URI url, Duration timeout, SecurityFilter filter) {
        this.http = http;
        this.url = url;
        this.timeout = timeout;
        this.filter = filter;
    }

    @Override
    public Set<SecurityId> listEligibleSecurities() throws IOException, InterruptedException {
        HttpRequest req = HttpRequest.newBuilder(url)
                .timeout(timeout)
                .header("User-Agent", "Mozilla/5.0 (holdings-pipelines)")
                .GET()
                .build();
        HttpResponse<byte[]> resp = http.send(req, HttpResponse.BodyHandlers.ofByteArray());
        if (resp.statusCode() != 200) {
            throw new IOException("Universe fetch failed: HTTP " + resp.statusCode() + " from " + url);
        }
        Document doc = Jsoup.parse(new ByteArrayInputStream(resp.body()), null, url.toString());
        Set<SecurityId> out = parse(doc, filter);
        log.info("Universe: {} eligible securities from {}", out.size(), url);
        return out;
    }

    static Set<SecurityId> parse(Document doc, SecurityFilter filter) {
        Set<SecurityId> out = new LinkedHashSet<>();
        for (Element row : doc.select("tr")) {
            Elements cells = row.select("td");
            if (cells.isEmpty()) continue;
            String code;
            String name;
            String first = cells.get(0).text().trim();
            if (cells.size() >= 2 && first.matches("\\d+")) {
                code = first;
                name = cells.get(1).text().trim();
            } else {
                Matcher m = CODE_AND_NAME.matcher(first);
                if (!m.matches()) continue;
                code = m.group(1);
                name = m.group(2) == null ? "" : m.group(2);
            }
            if (filter.accepts(code, name)) out.add(SecurityId.of(code));
        }
        return Collections.unmodifiableSet(out);
    }
}
