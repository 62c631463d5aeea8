package com.trading.pipeline.calendar;

import java.time.LocalDate;
import java.util.List;

/**
 * Business-day calendar used to line up every array in a run.
 */
public interface TradingCalendar {

    boolean isSession(LocalDate date);

    /** Sessions in {@code [start, end]}, ascending. Empty if there are none. */
    List<LocalDate> sessions(LocalDate start, LocalDate end);

    /**
     * The session {@code count} sessions before {@code date}. {@code date} itself
     * need not be a session; counting starts from the last session strictly
     * before it, so {@code sessionsBefore(d, 1)} is the previous session.
     * {@code count == 0} returns the first session on or after {@code date}.
     */
    LocalDate sessionsBefore(LocalDate date, int count);
}
