package at.sv.lightsout.time;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.core.Is.is;

class SunTimesProviderTest {

    private static final ZoneId VIENNA = ZoneId.of("Europe/Vienna");

    private ZonedDateTime newYear;
    private SunTimesProviderImpl provider;

    private static void assertLocalTime(ZonedDateTime actual, int hour, int minute, int second) {
        assertThat("Sun time of " + actual.toLocalDate(), actual.toLocalTime(), is(LocalTime.of(hour, minute, second)));
    }

    @BeforeEach
    void setUp() {
        newYear = ZonedDateTime.of(2021, 1, 1, 0, 0, 0, 0, VIENNA);
        provider = new SunTimesProviderImpl(48.20, 16.39, 165);
    }

    @Test
    void sunriseAndSunset_vienna_newYear_andOneMonthLater() {
        assertLocalTime(provider.getSunrise(newYear), 7, 42, 13);
        assertLocalTime(provider.getSunset(newYear), 16, 14, 29);

        ZonedDateTime january31 = newYear.plusDays(30);

        assertLocalTime(provider.getSunrise(january31), 7, 21, 13);
        assertLocalTime(provider.getSunset(january31), 16, 55, 24);
    }

    @Test
    void sunset_sameForEveryTimeOfDay() {
        ZonedDateTime evening = newYear.with(LocalTime.of(21, 30));

        assertThat(provider.getSunset(evening), is(provider.getSunset(newYear)));
    }

    @Test
    void sunTimes_keepZoneAndDateOfInput() {
        DailySunTimes sunTimes = provider.getSunTimes(newYear.plusDays(1));

        assertThat(sunTimes.date(), is(LocalDate.of(2021, 1, 2)));
        assertThat(sunTimes.sunrise().getZone(), is(VIENNA));
        assertThat(sunTimes.sunset().toLocalDate(), is(LocalDate.of(2021, 1, 2)));
    }

    @Test
    void sunTimes_toString() {
        assertThat(provider.getSunTimes(newYear).toString(), is("2021-01-01: sunrise 07:42, sunset 16:14"));
    }

    @Test
    void polarDay_sunset_nextSunsetAfterMidnightSun() {
        provider = new SunTimesProviderImpl(78.614803, 15.895517, 0); // Svalbard

        ZonedDateTime sunset = provider.getSunset(newYear.withMonth(5));

        assertThat(sunset, is(newYear.with(LocalDateTime.of(2021, 8, 26, 0, 24, 23))));
    }
}
