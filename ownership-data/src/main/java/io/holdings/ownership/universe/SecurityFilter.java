package io.holdings.ownership.universe;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Keeps ordinary listed shares: four-digit codes whose names carry none of the non-equity
 * keywords (ETFs, bonds, warrants, funds and the like).
 */
public class SecurityFilter {
    public static final List<String> DEFAULT_EXCLUDE_KEYWORDS = List.of(
            "ETF", "ETN", "債", "權證", "認購", "認售", "購", "售", "REIT", "基金", "期貨", "指數", "受益", "正2", "反1");

    private static final Pattern CODE = Pattern.compile("\\d{4}");

    private final List<String> excludeKeywords;

    public SecurityFilter() { this(DEFAULT_EXCLUDE_KEYWORDS); }

    public SecurityFilter(List<String> excludeKeywords) {
        this.excludeKeywords = excludeKeywords.stream().map(k -> k.toUpperCase(Locale.ROOT)).toList();
    }

    public boolean accepts(String code, String name) {
        if (code == null || !CODE.matcher(code.trim()).matches()) return false;
        String n = name == null ? "" : name.toUpperCase(Locale.ROOT);
        for (String k : excludeKeywords) {
            if (n.contains(k)) return false;
        }
        return true;
    }
}
