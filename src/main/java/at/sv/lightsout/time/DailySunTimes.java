package at.sv.lightsout.time;

import java.time.LocalDate;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;

public record DailySunTimes(LocalDate date, ZonedDateTime sunrise, ZonedDateTime sunset) {

    private static final DateTimeFormatter TIME_FORMATTER = DateTimeFormatter.ofPattern("HH:mm");

    @Override
    public String toString() {
        return date + ": sunrise " + TIME_FORMATTER.format(sunrise) + ", sunset " + TIME_FORMATTER.format(sunset);
    }
}
