package io.holdings.ownership.schedule;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.Predicate;

/**
 * Which days in a window are expected to carry a disclosure. Candidates are plain dates, the same
 * granularity the store is keyed by.
 */
public final class PublicationCalendar {
    private final String name;
    private final Predicate<LocalDate> isPublicationDay;

    private PublicationCalendar(String name, Predicate<LocalDate> isPublicationDay) {
        this.name = name;
        this.isPublicationDay = isPublicationDay;
    }

    public static PublicationCalendar daily() {
        return new PublicationCalendar("daily", d -> true);
    }

    public static PublicationCalendar weekdays() {
        return new PublicationCalendar("weekdays", PublicationCalendar::isWeekday);
    }

    /** Every {@code anchor} day, e.g. the weekly TDCC snapshot taken on Fridays. */
    public static PublicationCalendar weekly(DayOfWeek anchor) {
        return new PublicationCalendar("weekly:" + anchor, d -> d.getDayOfWeek() == anchor);
    }

    /** {@code daily}, {@code weekdays} or {@code weekly:<DAY>} (day name, case-insensitive). */
    public static PublicationCalendar parse(String spec) {
        String s = spec == null ? "" : spec.trim().toLowerCase(Locale.ROOT);
        if (s.equals("daily")) return daily();
        if (s.equals("weekdays")) return weekdays();
        if (s.startsWith("weekly:")) {
            String day = s.substring("weekly:".length()).trim().toUpperCase(Locale.ROOT);
            try {
                return weekly(DayOfWeek.valueOf(day));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Unknown day in calendar '" + spec + "'", e);
            }
        }
        throw new IllegalArgumentException("Unknown calendar '" + spec + "', expected daily, weekdays or weekly:<DAY>");
    }

    public boolean isPublicationDay(LocalDate d) { return isPublicationDay.test(d); }

    /** Publication days in {@code [start, endInclusive]}, ascending. Empty when start is after end. */
    public List<LocalDate> candidates(LocalDate start, LocalDate endInclusive) {
        List<LocalDate> out = new ArrayList<>();
        for (LocalDate d = start; !d.isAfter(endInclusive); d = d.plusDays(1)) {
            if (isPublicationDay.test(d)) out.add(d);
        }
        return out;
    }

    static boolean isWeekday(LocalDate d) {
        DayOfWeek dow = d.getDayOfWeek();
        return dow != DayOfWeek.SATURDAY && dow != DayOfWeek.SUNDAY;
    }

    @Override
    public String toString() { return name; }
}
