package com.flagship.member_ledger.lastschrift;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.MonthDay;

/**
 * Collection date of a direct debit: a fixed number of days after issuing, moved off
 * TARGET2 holidays and weekends.
 *
 * TARGET2 is closed on Good Friday, Easter Monday, 1 January, 1 May and on 25 and
 * 26 December. The shifts are applied in that order, with a weekend check before and
 * after the fixed holidays, so a holiday shift can never end on a weekend. The Easter
 * check runs again after the first weekend check, since the Easter weekend itself
 * shifts onto Easter Monday.
 */
public final class PaymentDateCalculator {

    private static final MonthDay NEW_YEAR = MonthDay.of(1, 1);
    private static final MonthDay LABOUR_DAY = MonthDay.of(5, 1);
    private static final MonthDay CHRISTMAS = MonthDay.of(12, 25);
    private static final MonthDay BOXING_DAY = MonthDay.of(12, 26);

    private PaymentDateCalculator() {
    }

    public static LocalDate paymentDate(LocalDate issuedOn, int offsetDays) {
        LocalDate date = issuedOn.plusDays(offsetDays);

        date = skipEaster(date);
        date = skipEaster(skipWeekend(date));

        MonthDay day = MonthDay.from(date);
        if (day.equals(NEW_YEAR) || day.equals(LABOUR_DAY) || day.equals(BOXING_DAY)) {
            date = date.plusDays(1);
        } else if (day.equals(CHRISTMAS)) {
            date = date.plusDays(2);
        }
        return skipWeekend(date);
    }

    public static boolean isBusinessDay(LocalDate date) {
        if (date.getDayOfWeek() == DayOfWeek.SATURDAY || date.getDayOfWeek() == DayOfWeek.SUNDAY) {
            return false;
        }
        LocalDate easter = easterSunday(date.getYear());
        if (date.equals(easter.minusDays(2)) || date.equals(easter.plusDays(1))) {
            return false;
        }
        MonthDay day = MonthDay.from(date);
        return !(day.equals(NEW_YEAR) || day.equals(LABOUR_DAY) || day.equals(CHRISTMAS) || day.equals(BOXING_DAY));
    }

    /**
     * Western Easter Sunday (anonymous Gregorian algorithm).
     */
    public static LocalDate easterSunday(int year) {
        int a = year % 19;
        int b = year / 100;
        int c = year % 100;
        int d = b / 4;
        int e = b % 4;
        int f = (b + 8) / 25;
        int g = (b - f + 1) / 3;
        int h = (19 * a + b - d - g + 15) % 30;
        int i = c / 4;
        int k = c % 4;
        int l = (32 + 2 * e + 2 * i - h - k) % 7;
        int m = (a + 11 * h + 22 * l) / 451;
        int month = (h + l - 7 * m + 114) / 31;
        int day = (h + l - 7 * m + 114) % 31 + 1;
        return LocalDate.of(year, month, day);
    }

    private static LocalDate skipEaster(LocalDate date) {
        LocalDate easter = easterSunday(date.getYear());
        if (date.equals(easter.minusDays(2)) || date.equals(easter.plusDays(1))) {
            return easter.plusDays(2);
        }
        return date;
    }

    private static LocalDate skipWeekend(LocalDate date) {
        if (date.getDayOfWeek() == DayOfWeek.SATURDAY) {
            return date.plusDays(2);
        }
        if (date.getDayOfWeek() == DayOfWeek.SUNDAY) {
            return date.plusDays(1);
        }
        return date;
    }
}
