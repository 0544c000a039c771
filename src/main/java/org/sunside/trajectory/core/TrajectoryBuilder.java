package org.sunside.trajectory.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sunside.core.geo.GeoPoint;
import org.sunside.trajectory.InsufficientSamplesException;
import org.sunside.trajectory.InvalidIntervalException;
import org.sunside.trajectory.SolarProviderException;
import org.sunside.trajectory.TrajectoryException;
import org.sunside.trajectory.geometry.BearingCalculator;
import org.sunside.trajectory.geometry.GreatCircleInterpolator;
import org.sunside.trajectory.geometry.SphericalMath;
import org.sunside.trajectory.solar.SolarPosition;
import org.sunside.trajectory.solar.SolarPositionProvider;
import org.sunside.trajectory.solar.SunSideClassifier;
import org.sunside.trajectory.temporal.LocalTimeNormalizer;
import org.sunside.trajectory.temporal.TemporalSampler;

import java.time.Instant;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Main trajectory entry point.
 *
 * <p>Builds one sun-annotated great-circle trajectory per call. Execution flow:</p>
 * <ul>
 * <li>Normalize departure and arrival wall-clock times to UTC with each endpoint's own zone.</li>
 * <li>Interpolate {@code steps + 1} points along the minor great-circle arc.</li>
 * <li>Spread timestamps uniformly between the two UTC instants.</li>
 * <li>Derive each sample's heading from its predecessor (index 0 uses the due-east convention).</li>
 * <li>Look up the sun position per sample and classify the sun side.</li>
 * </ul>
 *
 * <p>The builder holds no per-call state, so one instance may serve concurrent calls.
 * A trajectory is returned only when every sample succeeds; the first failure aborts the
 * whole call. When an {@link Executor} is supplied, solar lookups fan out across it and are
 * reassembled in index order.</p>
 */
public final class TrajectoryBuilder {
    private static final Logger log = LoggerFactory.getLogger(TrajectoryBuilder.class);

    private final TrajectoryRuntimeConfig config;
    private final GreatCircleInterpolator interpolator;
    private final Executor solarExecutor;

    /**
     * Creates a sequential builder with default configuration.
     */
    public TrajectoryBuilder() {
        this(TrajectoryRuntimeConfig.defaults(), null);
    }

    /**
     * Creates a sequential builder.
     *
     * @param config runtime configuration.
     */
    public TrajectoryBuilder(TrajectoryRuntimeConfig config) {
        this(config, null);
    }

    /**
     * Creates a builder.
     *
     * @param config runtime configuration.
     * @param solarExecutor optional executor for parallel solar lookups; {@code null} runs them
     * on the calling thread.
     */
    public TrajectoryBuilder(TrajectoryRuntimeConfig config, Executor solarExecutor) {
        this.config = Objects.requireNonNull(config, "config");
        if (config.getDefaultSteps() < 1) {
            throw new IllegalArgumentException("defaultSteps must be >= 1, got " + config.getDefaultSteps());
        }
        this.interpolator = new GreatCircleInterpolator(
                config.getCoincidentToleranceRadians(),
                config.getAntipodalToleranceRadians()
        );
        this.solarExecutor = solarExecutor;
    }

    /**
     * Builds a trajectory from a request.
     *
     * @param request segment request.
     * @param solarProvider solar position capability.
     * @return fully populated trajectory.
     * @throws TrajectoryException when a required field is missing or any stage fails.
     */
    public Trajectory build(TrajectoryRequest request, SolarPositionProvider solarProvider) {
        if (request == null) {
            throw new TrajectoryException(TrajectoryException.REASON_REQUEST_FIELD_REQUIRED, "request must be provided");
        }
        int steps = request.getSteps() == null ? config.getDefaultSteps() : request.getSteps();
        return build(
                requireField(request.getDeparturePoint(), "departurePoint"),
                requireField(request.getArrivalPoint(), "arrivalPoint"),
                requireField(request.getDepartureLocalTime(), "departureLocalTime"),
                requireField(request.getArrivalLocalTime(), "arrivalLocalTime"),
                requireField(request.getDepartureZoneId(), "departureZoneId"),
                requireField(request.getArrivalZoneId(), "arrivalZoneId"),
                steps,
                solarProvider
        );
    }

    /**
     * Builds a trajectory from local wall-clock times.
     *
     * @param departure route origin.
     * @param arrival route destination.
     * @param departureLocal departure wall-clock time at the origin.
     * @param arrivalLocal arrival wall-clock time at the destination.
     * @param departureZoneId zone id of the origin.
     * @param arrivalZoneId zone id of the destination.
     * @param steps number of segments, at least 1.
     * @param solarProvider solar position capability.
     * @return trajectory with {@code steps + 1} samples.
     */
    public Trajectory build(
            GeoPoint departure,
            GeoPoint arrival,
            LocalDateTime departureLocal,
            LocalDateTime arrivalLocal,
            String departureZoneId,
            String arrivalZoneId,
            int steps,
            SolarPositionProvider solarProvider
    ) {
        Instant departureTime = LocalTimeNormalizer.toUtc(departureLocal, departureZoneId);
        Instant arrivalTime = LocalTimeNormalizer.toUtc(arrivalLocal, arrivalZoneId);
        return build(departure, arrival, departureTime, arrivalTime, steps, solarProvider);
    }

    /**
     * Builds a trajectory from UTC instants.
     *
     * @param departure route origin.
     * @param arrival route destination.
     * @param departureTime departure instant.
     * @param arrivalTime arrival instant, not before {@code departureTime}.
     * @param steps number of segments, at least 1.
     * @param solarProvider solar position capability.
     * @return trajectory with {@code steps + 1} samples.
     * @throws InsufficientSamplesException when {@code steps < 1}.
     * @throws org.sunside.trajectory.AmbiguousRouteException when the endpoints are antipodal.
     * @throws InvalidIntervalException when arrival precedes departure.
     * @throws SolarProviderException when any solar lookup fails.
     */
    public Trajectory build(
            GeoPoint departure,
            GeoPoint arrival,
            Instant departureTime,
            Instant arrivalTime,
            int steps,
            SolarPositionProvider solarProvider
    ) {
        Objects.requireNonNull(solarProvider, "solarProvider");
        log.debug("Building trajectory {} -> {} ({} -> {}), steps={}",
                departure, arrival, departureTime, arrivalTime, steps);

        List<GeoPoint> points = interpolator.interpolate(departure, arrival, steps);
        List<Instant> times = TemporalSampler.sampleTimes(departureTime, arrivalTime, points.size());
        List<SolarPosition> positions = lookupSolarPositions(points, times, solarProvider);

        List<TrajectorySample> samples = new ArrayList<>(points.size());
        for (int i = 0; i < points.size(); i++) {
            GeoPoint point = points.get(i);
            double heading = BearingCalculator.headingAt(i, i == 0 ? null : points.get(i - 1), point);
            SolarPosition position = positions.get(i);
            double azimuth = SphericalMath.normalizeDegrees(position.azimuthDeg());
            samples.add(TrajectorySample.builder()
                    .index(i)
                    .point(point)
                    .timestamp(times.get(i))
                    .headingDeg(heading)
                    .solarAltitudeDeg(position.altitudeDeg())
                    .solarAzimuthDeg(azimuth)
                    .sunSide(SunSideClassifier.classify(heading, azimuth))
                    .build());
        }

        Trajectory trajectory = new Trajectory(departure, arrival, departureTime, arrivalTime, samples);
        log.debug("Built trajectory with {} samples", trajectory.size());
        return trajectory;
    }

    /**
     * Returns the bound runtime configuration.
     */
    public TrajectoryRuntimeConfig config() {
        return config;
    }

    private List<SolarPosition> lookupSolarPositions(
            List<GeoPoint> points,
            List<Instant> times,
            SolarPositionProvider solarProvider
    ) {
        int size = points.size();
        List<SolarPosition> positions = new ArrayList<>(size);
        if (solarExecutor == null) {
            for (int i = 0; i < size; i++) {
                positions.add(lookupSolarPosition(i, points.get(i), times.get(i), solarProvider));
            }
            return positions;
        }

        List<CompletableFuture<SolarPosition>> futures = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            int index = i;
            futures.add(CompletableFuture.supplyAsync(
                    () -> lookupSolarPosition(index, points.get(index), times.get(index), solarProvider),
                    solarExecutor
            ));
        }
        for (CompletableFuture<SolarPosition> future : futures) {
            try {
                positions.add(future.join());
            } catch (CompletionException ex) {
                futures.forEach(pending -> pending.cancel(false));
                throw unwrapSolarFailure(ex);
            }
        }
        return positions;
    }

    /**
     * Calls the provider for one sample and validates the result.
     *
     * <p>A {@link SolarProviderException} from the provider propagates unchanged; any other
     * runtime failure is wrapped so callers always see the solar-failure type.</p>
     */
    private static SolarPosition lookupSolarPosition(
            int index,
            GeoPoint point,
            Instant instant,
            SolarPositionProvider solarProvider
    ) {
        SolarPosition position;
        try {
            position = solarProvider.position(point, instant);
        } catch (SolarProviderException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            throw new SolarProviderException(
                    SolarProviderException.REASON_PROVIDER_FAILED,
                    "solar lookup failed for sample " + index + " at " + point + ", " + instant,
                    ex
            );
        }
        if (position == null
                || !Double.isFinite(position.altitudeDeg())
                || !Double.isFinite(position.azimuthDeg())) {
            throw new SolarProviderException(
                    SolarProviderException.REASON_INVALID_POSITION,
                    "solar provider returned unusable position " + position + " for sample " + index
            );
        }
        return position;
    }

    private static RuntimeException unwrapSolarFailure(CompletionException ex) {
        Throwable cause = ex.getCause();
        if (cause instanceof RuntimeException) {
            return (RuntimeException) cause;
        }
        if (cause instanceof Error) {
            throw (Error) cause;
        }
        return new SolarProviderException(
                SolarProviderException.REASON_PROVIDER_FAILED,
                "parallel solar lookup failed",
                cause == null ? ex : cause
        );
    }

    private static <T> T requireField(T value, String fieldName) {
        if (value == null) {
            throw new TrajectoryException(
                    TrajectoryException.REASON_REQUEST_FIELD_REQUIRED,
                    fieldName + " must be provided"
            );
        }
        return value;
    }
}
