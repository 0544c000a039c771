package org.sunside.exposure;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sunside.core.geo.GeoPoint;
import org.sunside.trajectory.TrajectoryException;
import org.sunside.trajectory.core.Trajectory;
import org.sunside.trajectory.core.TrajectoryBuilder;
import org.sunside.trajectory.core.TrajectoryRequest;
import org.sunside.trajectory.solar.SolarPositionProvider;
import org.sunside.trajectory.temporal.LocalTimeNormalizer;
import org.sunside.trajectory.temporal.TimeZoneResolver;

import java.util.Objects;

/**
 * Sun-exposure facade for one travel segment.
 *
 * <p>Resolves each endpoint's zone from its coordinate, substituting the configured
 * fallback zone when the resolver knows none, then builds the trajectory and summarizes
 * daylight per side. Zone resolver failures surface as
 * {@link org.sunside.trajectory.ZoneResolutionException}; all other failures are those of
 * {@link TrajectoryBuilder}.</p>
 */
public final class SunExposureService {
    private static final Logger log = LoggerFactory.getLogger(SunExposureService.class);

    private final TrajectoryBuilder trajectoryBuilder;
    private final TimeZoneResolver timeZoneResolver;
    private final SolarPositionProvider solarPositionProvider;

    /**
     * Creates the facade.
     *
     * @param trajectoryBuilder trajectory engine.
     * @param timeZoneResolver coordinate-to-zone capability.
     * @param solarPositionProvider solar position capability.
     */
    public SunExposureService(
            TrajectoryBuilder trajectoryBuilder,
            TimeZoneResolver timeZoneResolver,
            SolarPositionProvider solarPositionProvider
    ) {
        this.trajectoryBuilder = Objects.requireNonNull(trajectoryBuilder, "trajectoryBuilder");
        this.timeZoneResolver = Objects.requireNonNull(timeZoneResolver, "timeZoneResolver");
        this.solarPositionProvider = Objects.requireNonNull(solarPositionProvider, "solarPositionProvider");
    }

    /**
     * Computes the sun-exposure report for one segment.
     *
     * @param request segment request.
     * @return trajectory, applied zone ids, and summary.
     * @throws TrajectoryException when a required field is missing or any stage fails.
     */
    public SunExposureReport compute(FlightSegmentRequest request) {
        if (request == null) {
            throw new TrajectoryException(TrajectoryException.REASON_REQUEST_FIELD_REQUIRED, "request must be provided");
        }
        if (request.getDeparture() == null || request.getArrival() == null) {
            throw new TrajectoryException(
                    TrajectoryException.REASON_REQUEST_FIELD_REQUIRED,
                    "departure and arrival coordinates must be provided"
            );
        }

        String departureZoneId = resolveZone(request.getDeparture());
        String arrivalZoneId = resolveZone(request.getArrival());

        TrajectoryRequest trajectoryRequest = TrajectoryRequest.builder()
                .departurePoint(request.getDeparture())
                .arrivalPoint(request.getArrival())
                .departureLocalTime(request.getDepartureLocalTime())
                .arrivalLocalTime(request.getArrivalLocalTime())
                .departureZoneId(departureZoneId)
                .arrivalZoneId(arrivalZoneId)
                .steps(request.getSteps())
                .build();
        Trajectory trajectory = trajectoryBuilder.build(trajectoryRequest, solarPositionProvider);

        return SunExposureReport.builder()
                .trajectory(trajectory)
                .departureZoneId(departureZoneId)
                .arrivalZoneId(arrivalZoneId)
                .summary(SunExposureSummary.of(trajectory))
                .build();
    }

    private String resolveZone(GeoPoint point) {
        String zoneId = LocalTimeNormalizer.resolveZoneId(
                point,
                timeZoneResolver,
                trajectoryBuilder.config().getFallbackZoneId()
        );
        log.debug("Resolved zone {} for {}", zoneId, point);
        return zoneId;
    }
}
