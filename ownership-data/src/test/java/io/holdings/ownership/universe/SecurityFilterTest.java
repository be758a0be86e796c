package io.holdings.ownership.universe;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SecurityFilterTest {
    private final SecurityFilter filter = new SecurityFilter();

    @Test
    void accepts_four_digit_ordinary_shares() {
        assertTrue(filter.accepts("2330", "台積電"));
        assertTrue(filter.accepts(" 1301 ", "台塑"));
        assertTrue(filter.accepts("2317", null));
    }

    @Test
    void rejects_other_codes_and_excluded_names() {
        assertFalse(filter.accepts("00632R", "元大台灣50反1"));
        assertFalse(filter.accepts("030001", "台積電群益58購01"));
        assertFalse(filter.accepts("0050", "元大台灣50 etf"));
        assertFalse(filter.accepts("1234", "某某公司債"));
        assertFalse(filter.accepts(null, "台積電"));
    }

    @Test
    void keyword_list_is_configurable() {
        SecurityFilter custom = new SecurityFilter(List.of("kY"));
        assertFalse(custom.accepts("1234", "Something-KY"));
        assertTrue(custom.accepts("0050", "元大台灣50 ETF"));
    }
}
