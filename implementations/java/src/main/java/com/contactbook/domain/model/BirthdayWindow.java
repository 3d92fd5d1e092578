package com.contactbook.domain.model;

import java.time.LocalDate;
import java.time.MonthDay;
import java.time.temporal.ChronoUnit;
import java.util.Comparator;

/**
 * Closed window of calendar days {@code [start, start + days]} compared by month and
 * day only, so birthdays in any year match.
 *
 * <p>Month-days are encoded as {@code month * 100 + day} (Dec 28 = 1228, Jan 3 = 103).
 * When the window crosses the year end the key range wraps: a key matches if it is
 * {@code >= startKey} or {@code <= endKey}. A window of 365 days or more covers
 * every month-day. Feb 29 birthdays count on Feb 28 in non-leap years.
 */
public final class BirthdayWindow {

    private static final int FULL_YEAR_DAYS = 365;

    public static final int LEAP_DAY_KEY = 229;

    private static final LocalDate LEAP_DAY = LocalDate.of(2000, 2, 29);

    private final LocalDate start;
    private final LocalDate end;
    private final int days;

    private BirthdayWindow(LocalDate start, int days) {
        this.start = start;
        this.days = days;
        this.end = start.plusDays(days);
    }

    /**
     * @param today first day of the window (inclusive)
     * @param days window length; the last day {@code today + days} is inclusive
     */
    public static BirthdayWindow starting(LocalDate today, int days) {
        if (today == null) {
            throw new IllegalArgumentException("Window start is required");
        }
        if (days < 0) {
            throw new IllegalArgumentException("Window length must not be negative: " + days);
        }
        return new BirthdayWindow(today, days);
    }

    public static int monthDayKey(LocalDate date) {
        return date.getMonthValue() * 100 + date.getDayOfMonth();
    }

    public LocalDate getEnd() {
        return end;
    }

    public int startKey() {
        return monthDayKey(start);
    }

    public int endKey() {
        return monthDayKey(end);
    }

    public boolean coversWholeYear() {
        return days >= FULL_YEAR_DAYS;
    }

    public boolean wraps() {
        return !coversWholeYear() && endKey() < startKey();
    }

    /**
     * Whether a Feb 29 birthday is observed inside this window. In a non-leap year it
     * falls on Feb 28, which the month-day key range alone does not match.
     */
    public boolean observesLeapDay() {
        return coversWholeYear() || daysUntil(LEAP_DAY) <= days;
    }

    /**
     * Days from the window start to the next occurrence of the birthday's month-day.
     * Feb 29 falls on Feb 28 in non-leap years.
     */
    public long daysUntil(LocalDate birthday) {
        MonthDay monthDay = MonthDay.from(birthday);
        LocalDate next = monthDay.atYear(start.getYear());
        if (next.isBefore(start)) {
            next = monthDay.atYear(start.getYear() + 1);
        }
        return ChronoUnit.DAYS.between(start, next);
    }

    /**
     * Orders contacts by their position inside this window.
     */
    public Comparator<Contact> order() {
        return Comparator.<Contact>comparingLong(contact -> daysUntil(contact.getBirthday()))
            .thenComparing(Contact::getId, Comparator.nullsLast(Comparator.naturalOrder()));
    }

    @Override
    public String toString() {
        return "BirthdayWindow[" + start + ".." + end + "]";
    }
}
