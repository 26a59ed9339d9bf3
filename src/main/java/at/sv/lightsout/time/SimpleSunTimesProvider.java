package at.sv.lightsout.time;

import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;

/**
 * Approximates sunrise and sunset with the simplified NOAA solar position algorithm, using the official zenith of
 * 90.833° for the upper limb of the sun including refraction. Accurate to a few minutes outside polar regions. At
 * latitudes where the sun does not rise or set on the given date, the hour angle is clamped and the result is the
 * time of closest approach to the horizon.
 */
public final class SimpleSunTimesProvider implements SunTimesProvider {

    public static final double STOCKHOLM_LATITUDE = 59.3293;
    public static final double STOCKHOLM_LONGITUDE = 18.0686;

    private static final double ZENITH = 90.833;

    private final double lat;
    private final double lng;

    public SimpleSunTimesProvider() {
        this(STOCKHOLM_LATITUDE, STOCKHOLM_LONGITUDE);
    }

    public SimpleSunTimesProvider(double lat, double lng) {
        this.lat = lat;
        this.lng = lng;
    }

    @Override
    public ZonedDateTime getSunrise(ZonedDateTime dateTime) {
        return toLocalDateTime(dateTime, computeUtcHour(dateTime.getDayOfYear(), true));
    }

    @Override
    public ZonedDateTime getSunset(ZonedDateTime dateTime) {
        return toLocalDateTime(dateTime, computeUtcHour(dateTime.getDayOfYear(), false));
    }

    private double computeUtcHour(int dayOfYear, boolean rising) {
        double lngHour = lng / 15;
        double t = dayOfYear + ((rising ? 6 : 18) - lngHour) / 24;

        double meanAnomaly = 0.9856 * t - 3.289;
        double trueLongitude = normalize(meanAnomaly
                                         + 1.916 * Math.sin(Math.toRadians(meanAnomaly))
                                         + 0.020 * Math.sin(Math.toRadians(2 * meanAnomaly))
                                         + 282.634, 360);

        double rightAscension = normalize(Math.toDegrees(Math.atan(0.91764 * Math.tan(Math.toRadians(trueLongitude)))),
                360);
        double longitudeQuadrant = Math.floor(trueLongitude / 90) * 90;
        double ascensionQuadrant = Math.floor(rightAscension / 90) * 90;
        rightAscension = (rightAscension + longitudeQuadrant - ascensionQuadrant) / 15;

        double sinDeclination = 0.39782 * Math.sin(Math.toRadians(trueLongitude));
        double cosDeclination = Math.cos(Math.asin(sinDeclination));

        double cosHourAngle = (Math.cos(Math.toRadians(ZENITH)) - sinDeclination * Math.sin(Math.toRadians(lat)))
                              / (cosDeclination * Math.cos(Math.toRadians(lat)));
        cosHourAngle = Math.max(-1, Math.min(1, cosHourAngle));

        double hourAngle = Math.toDegrees(Math.acos(cosHourAngle));
        if (rising) {
            hourAngle = 360 - hourAngle;
        }
        hourAngle = hourAngle / 15;

        double localMeanTime = hourAngle + rightAscension - 0.06571 * t - 6.622;
        return normalize(localMeanTime - lngHour, 24);
    }

    private static double normalize(double value, double range) {
        double result = value % range;
        return result < 0 ? result + range : result;
    }

    private static ZonedDateTime toLocalDateTime(ZonedDateTime dateTime, double utcHour) {
        LocalDate date = dateTime.toLocalDate();
        long seconds = Math.round(utcHour * 3600);
        ZonedDateTime result = date.atStartOfDay(ZoneOffset.UTC)
                                   .plusSeconds(seconds)
                                   .withZoneSameInstant(dateTime.getZone())
                                   .truncatedTo(ChronoUnit.SECONDS);
        // the utc hour is only known modulo 24, keep the result on the requested local date
        if (result.toLocalDate().isAfter(date)) {
            return result.minusDays(1);
        }
        if (result.toLocalDate().isBefore(date)) {
            return result.plusDays(1);
        }
        return result;
    }
}
