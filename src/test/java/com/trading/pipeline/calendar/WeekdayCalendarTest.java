package com.trading.pipeline.calendar;

import org.junit.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.Set;

import static org.junit.Assert.*;

public class WeekdayCalendarTest {
    // 2024-01-01 is a Monday
    private static final LocalDate MON = LocalDate.of(2024, 1, 1);
    private final WeekdayCalendar calendar = new WeekdayCalendar();

    @Test
    public void testSessionsSkipWeekends() {
        List<LocalDate> s = calendar.sessions(MON, MON.plusDays(13));
        assertEquals(10, s.size());
        assertEquals(MON, s.get(0));
        assertEquals(MON.plusDays(11), s.get(9));
    }

    @Test
    public void testEmptyRange() {
        assertTrue(calendar.sessions(MON.plusDays(5), MON.plusDays(6)).isEmpty());
        assertTrue(calendar.sessions(MON.plusDays(1), MON).isEmpty());
    }

    @Test
    public void testSessionsBefore() {
        // Monday counted back one is the previous Friday
        assertEquals(MON.minusDays(3), calendar.sessionsBefore(MON, 1));
        assertEquals(MON.plusDays(2), calendar.sessionsBefore(MON.plusDays(7), 3));
        // from a Saturday, the previous session is Friday
        assertEquals(MON.plusDays(4), calendar.sessionsBefore(MON.plusDays(5), 1));
    }

    @Test
    public void testSessionsBeforeZeroRollsForward() {
        assertEquals(MON, calendar.sessionsBefore(MON, 0));
        assertEquals(MON.plusDays(7), calendar.sessionsBefore(MON.plusDays(5), 0));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNegativeCount() {
        calendar.sessionsBefore(MON, -1);
    }

    @Test
    public void testHolidays() {
        WeekdayCalendar withHoliday = new WeekdayCalendar(Set.of(MON));
        assertFalse(withHoliday.isSession(MON));
        assertEquals(4, withHoliday.sessions(MON, MON.plusDays(6)).size());
        assertEquals(MON.minusDays(3), withHoliday.sessionsBefore(MON.plusDays(1), 1));
    }
}
