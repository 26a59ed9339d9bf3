package at.sv.lightsout.time;

import java.time.ZonedDateTime;

public interface SunTimesProvider {

    /**
     * @param dateTime the date to compute the sunrise for. The time of day is ignored, the zone of the given date time
     *                 is used for the result.
     */
    ZonedDateTime getSunrise(ZonedDateTime dateTime);

    ZonedDateTime getSunset(ZonedDateTime dateTime);

    default DailySunTimes getSunTimes(ZonedDateTime dateTime) {
        return new DailySunTimes(dateTime.toLocalDate(), getSunrise(dateTime), getSunset(dateTime));
    }
}
