package at.sv.lightsout.time;

import org.shredzone.commons.suncalc.SunTimes;

import java.time.LocalTime;
import java.time.ZonedDateTime;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Precise sun times backed by commons-suncalc, taking the elevation of the observer into account.
 */
public final class SunTimesProviderImpl implements SunTimesProvider {

    private final double lat;
    private final double lng;
    private final double elevation;

    private final Map<String, SunTimes> cache;

    public SunTimesProviderImpl(double lat, double lng, double elevation) {
        this.lat = lat;
        this.lng = lng;
        this.elevation = elevation;
        cache = new ConcurrentHashMap<>();
    }

    @Override
    public ZonedDateTime getSunrise(ZonedDateTime dateTime) {
        return sunTimesFor(dateTime).getRise();
    }

    @Override
    public ZonedDateTime getSunset(ZonedDateTime dateTime) {
        return sunTimesFor(dateTime).getSet();
    }

    private SunTimes sunTimesFor(ZonedDateTime dateTime) {
        return cache.computeIfAbsent(generateKey(dateTime), key -> SunTimes.compute()
                                                                          .at(lat, lng)
                                                                          .elevation(elevation)
                                                                          .on(dateTime.with(LocalTime.MIDNIGHT))
                                                                          .execute());
    }

    private static String generateKey(ZonedDateTime dateTime) {
        return dateTime.toLocalDate() + "-" + dateTime.getZone();
    }
}
