package com.trading.pipeline.calendar;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;

/** Monday to Friday, minus an optional set of holidays. */
public final class WeekdayCalendar implements TradingCalendar {
    private final Set<LocalDate> holidays;

    public WeekdayCalendar() {
        this(Set.of());
    }

    public WeekdayCalendar(Collection<LocalDate> holidays) {
        this.holidays = Set.copyOf(holidays);
    }

    @Override
    public boolean isSession(LocalDate date) {
        DayOfWeek dow = date.getDayOfWeek();
        return dow != DayOfWeek.SATURDAY && dow != DayOfWeek.SUNDAY && !holidays.contains(date);
    }

    @Override
    public List<LocalDate> sessions(LocalDate start, LocalDate end) {
        List<LocalDate> out = new ArrayList<>();
        for (LocalDate d = start; !d.isAfter(end); d = d.plusDays(1))
            if (isSession(d))
                out.add(d);
        return out;
    }

    @Override
    public LocalDate sessionsBefore(LocalDate date, int count) {
        if (count < 0)
            throw new IllegalArgumentException("count must be >= 0, got " + count);
        LocalDate d = date;
        if (count == 0) {
            while (!isSession(d))
                d = d.plusDays(1);
            return d;
        }
        int seen = 0;
        while (seen < count) {
            d = d.minusDays(1);
            if (isSession(d))
                seen++;
        }
        return d;
    }
}
