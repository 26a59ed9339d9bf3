package at.sv.lightsout;

import java.time.DayOfWeek;
import java.util.Collection;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;

/**
 * Parses weekday sets, either given as day names and ranges ("Mo-Fr, Su") or as indices where 0 is Monday and 6 is
 * Sunday.
 */
public final class WeekdayParser {

    private WeekdayParser() {
    }

    public static EnumSet<DayOfWeek> parse(String value) {
        EnumSet<DayOfWeek> dayOfWeeks = EnumSet.noneOf(DayOfWeek.class);
        if (value.isBlank()) {
            return dayOfWeeks;
        }
        for (String day : value.split(",")) {
            if (day.contains("-")) {
                String[] rangeStartAndEnd = getAndAssertDayRange(day);
                DayOfWeek rangeStart = parseDay(rangeStartAndEnd[0]);
                DayOfWeek rangeEnd = parseDay(rangeStartAndEnd[1]);
                if (rangeStart.compareTo(rangeEnd) > 0) {
                    dayOfWeeks.addAll(EnumSet.range(rangeStart, DayOfWeek.SUNDAY));
                    dayOfWeeks.addAll(EnumSet.range(DayOfWeek.MONDAY, rangeEnd));
                } else {
                    dayOfWeeks.addAll(EnumSet.range(rangeStart, rangeEnd));
                }
            } else {
                dayOfWeeks.add(parseDay(day));
            }
        }
        return dayOfWeeks;
    }

    public static EnumSet<DayOfWeek> fromIndices(Collection<Integer> indices) {
        EnumSet<DayOfWeek> dayOfWeeks = EnumSet.noneOf(DayOfWeek.class);
        for (Integer index : indices) {
            dayOfWeeks.add(fromIndex(index));
        }
        return dayOfWeeks;
    }

    public static DayOfWeek fromIndex(int index) {
        if (index < 0 || index > 6) {
            throw new InvalidPropertyValue("Invalid weekday index '" + index + "'. Expected 0 (Monday) to 6 (Sunday).");
        }
        return DayOfWeek.of(index + 1);
    }

    public static int toIndex(DayOfWeek day) {
        return day.getValue() - 1;
    }

    public static Set<Integer> toIndices(Set<DayOfWeek> days) {
        Set<Integer> indices = new TreeSet<>();
        days.forEach(day -> indices.add(toIndex(day)));
        return indices;
    }

    private static String[] getAndAssertDayRange(String day) {
        String[] rangeStartAndEnd = day.split("-");
        if (rangeStartAndEnd.length != 2) {
            throw new InvalidPropertyValue("Invalid day range definition '" + day + "'. Please make sure to separate " +
                                           "the days with a single dash ('-').");
        }
        return rangeStartAndEnd;
    }

    private static DayOfWeek parseDay(String day) {
        return switch (day.trim().toLowerCase(Locale.ENGLISH)) {
            case "mo", "mon", "monday" -> DayOfWeek.MONDAY;
            case "tu", "tue", "tuesday" -> DayOfWeek.TUESDAY;
            case "we", "wed", "wednesday" -> DayOfWeek.WEDNESDAY;
            case "th", "thu", "thursday" -> DayOfWeek.THURSDAY;
            case "fr", "fri", "friday" -> DayOfWeek.FRIDAY;
            case "sa", "sat", "saturday" -> DayOfWeek.SATURDAY;
            case "su", "sun", "sunday" -> DayOfWeek.SUNDAY;
            default -> throw new InvalidPropertyValue("Unknown day parameter '" + day + "'. Please check your " +
                                                      "spelling. Supported values (case insensitive): " +
                                                      "[Mo|Mon, Tu|Tue, We|Wed, Th|Thu, Fr|Fri, Sa|Sat, Su|Sun]");
        };
    }
}
