package org.sunside.trajectory.temporal;

import lombok.experimental.UtilityClass;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sunside.core.geo.GeoPoint;
import org.sunside.trajectory.ZoneResolutionException;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.util.Objects;
import java.util.Optional;

/**
 * Converts naive wall-clock times into UTC instants using explicit zone ids.
 *
 * <p>Offsets come from the zone rules for the given date, so daylight-saving time is
 * honored. A wall time inside a spring-forward gap is shifted later by the gap length;
 * a wall time inside a fall-back overlap takes the earlier offset.</p>
 */
@UtilityClass
public class LocalTimeNormalizer {
    public static final String UTC_ZONE_ID = "UTC";
    public static final String LOCAL_TIME_PATTERN = "yyyy-MM-dd HH:mm";

    private static final Logger log = LoggerFactory.getLogger(LocalTimeNormalizer.class);

    private static final DateTimeFormatter SPACE_SEPARATED_FORMAT = new DateTimeFormatterBuilder()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .appendLiteral(' ')
            .append(DateTimeFormatter.ISO_LOCAL_TIME)
            .toFormatter();

    /**
     * Interprets {@code localDateTime} as wall-clock time in {@code zoneId}.
     *
     * @param localDateTime naive wall-clock time.
     * @param zoneId IANA zone id or fixed offset id, for example {@code America/New_York}.
     * @return equivalent UTC instant.
     * @throws ZoneResolutionException when the zone id is blank or unknown.
     */
    public static Instant toUtc(LocalDateTime localDateTime, String zoneId) {
        Objects.requireNonNull(localDateTime, "localDateTime");
        return localDateTime.atZone(parseZoneId(zoneId)).toInstant();
    }

    /**
     * Resolves the zone at the reference point and converts the wall time to UTC.
     *
     * @param localTime wall time and reference point.
     * @param resolver zone resolver for the reference point.
     * @param fallbackZoneId zone used when the resolver returns empty.
     * @return equivalent UTC instant.
     */
    public static Instant toUtc(AnchoredLocalTime localTime, TimeZoneResolver resolver, String fallbackZoneId) {
        Objects.requireNonNull(localTime, "localTime");
        String zoneId = resolveZoneId(localTime.referencePoint(), resolver, fallbackZoneId);
        return toUtc(localTime.localDateTime(), zoneId);
    }

    /**
     * Asks {@code resolver} for the zone at {@code point}, substituting {@code fallbackZoneId}
     * when none is known.
     *
     * @throws ZoneResolutionException when the resolver itself fails.
     */
    public static String resolveZoneId(GeoPoint point, TimeZoneResolver resolver, String fallbackZoneId) {
        Objects.requireNonNull(point, "point");
        Objects.requireNonNull(resolver, "resolver");
        Objects.requireNonNull(fallbackZoneId, "fallbackZoneId");
        Optional<String> resolved;
        try {
            resolved = resolver.zoneFor(point);
        } catch (RuntimeException ex) {
            throw new ZoneResolutionException(
                    ZoneResolutionException.REASON_ZONE_RESOLUTION_FAILED,
                    "zone lookup failed for " + point,
                    ex
            );
        }
        if (resolved == null || resolved.isEmpty() || resolved.get().isBlank()) {
            log.warn("No time zone resolved for {}; falling back to {}", point, fallbackZoneId);
            return fallbackZoneId;
        }
        return resolved.get().trim();
    }

    /**
     * Parses wall-clock text in {@code yyyy-MM-dd HH:mm} form; ISO {@code yyyy-MM-ddTHH:mm[:ss]}
     * is accepted as well.
     *
     * @throws IllegalArgumentException when the text matches neither form.
     */
    public static LocalDateTime parseLocal(String text) {
        Objects.requireNonNull(text, "text");
        String trimmed = text.trim();
        // Exactly one separator: ISO 'T' or a single space.
        DateTimeFormatter format = trimmed.indexOf('T') >= 0
                ? DateTimeFormatter.ISO_LOCAL_DATE_TIME
                : SPACE_SEPARATED_FORMAT;
        try {
            return LocalDateTime.parse(trimmed, format);
        } catch (DateTimeParseException ex) {
            throw new IllegalArgumentException(
                    "invalid local time '" + text + "', expected " + LOCAL_TIME_PATTERN,
                    ex
            );
        }
    }

    /**
     * Parses a zone id string using strict {@link ZoneId} rules.
     *
     * @throws ZoneResolutionException when the id is blank or unknown.
     */
    public static ZoneId parseZoneId(String zoneId) {
        if (zoneId == null || zoneId.isBlank()) {
            throw new ZoneResolutionException(
                    ZoneResolutionException.REASON_INVALID_ZONE_ID,
                    "zone id is required"
            );
        }
        String normalized = zoneId.trim();
        try {
            return ZoneId.of(normalized);
        } catch (DateTimeException ex) {
            throw new ZoneResolutionException(
                    ZoneResolutionException.REASON_INVALID_ZONE_ID,
                    "unknown zone id: " + normalized,
                    ex
            );
        }
    }
}
