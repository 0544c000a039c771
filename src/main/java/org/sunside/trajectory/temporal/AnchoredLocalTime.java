package org.sunside.trajectory.temporal;

import lombok.NonNull;
import lombok.Value;
import lombok.experimental.Accessors;
import org.sunside.core.geo.GeoPoint;

import java.time.LocalDateTime;

/**
 * Wall-clock time without a zone, paired with the location used to resolve its zone.
 */
@Value
@Accessors(fluent = true)
public class AnchoredLocalTime {
    @NonNull
    LocalDateTime localDateTime;
    @NonNull
    GeoPoint referencePoint;
}
