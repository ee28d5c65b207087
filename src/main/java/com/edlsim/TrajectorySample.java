package com.edlsim;

import org.hipparchus.geometry.euclidean.threed.Vector3D;

import java.util.Objects;

/**
 * One instant of vehicle state. Immutable.
 *
 * {@code altitude}, {@code velocityMagnitude} and {@code distanceToTarget} are
 * caches of {@code position}/{@code velocity}; use {@link #derive} so they are
 * computed from the vectors rather than set independently.
 */
public final class TrajectorySample {

    private final double time;               // s since entry interface
    private final Vector3D position;          // m, body-centred
    private final Vector3D velocity;          // m/s
    private final double altitude;           // m
    private final double velocityMagnitude;  // m/s
    private final double distanceToTarget;   // m
    private final double bankAngle;          // deg

    public TrajectorySample(double time, Vector3D position, Vector3D velocity,
                            double altitude, double velocityMagnitude,
                            double distanceToTarget, double bankAngle) {
        this.time = time;
        this.position = Objects.requireNonNull(position, "position");
        this.velocity = Objects.requireNonNull(velocity, "velocity");
        this.altitude = altitude;
        this.velocityMagnitude = velocityMagnitude;
        this.distanceToTarget = distanceToTarget;
        this.bankAngle = bankAngle;
    }

    /** Build a sample with all scalar caches computed from {@code position}/{@code velocity}. */
    public static TrajectorySample derive(double time, Vector3D position, Vector3D velocity, double bankAngle,
                                          double bodyRadius, Vector3D landingTarget) {
        return new TrajectorySample(time, position, velocity,
                position.getNorm() - bodyRadius,
                velocity.getNorm(),
                position.distance(landingTarget),
                bankAngle);
    }

    public TrajectorySample withPositionAndVelocity(Vector3D newPosition, Vector3D newVelocity,
                                                    double bodyRadius, Vector3D landingTarget) {
        return derive(time, newPosition, newVelocity, bankAngle, bodyRadius, landingTarget);
    }

    public double getTime()              { return time; }
    public Vector3D getPosition()         { return position; }
    public Vector3D getVelocity()         { return velocity; }
    public double getAltitude()          { return altitude; }
    public double getVelocityMagnitude() { return velocityMagnitude; }
    public double getDistanceToTarget()  { return distanceToTarget; }
    public double getBankAngle()         { return bankAngle; }

    @Override
    public String toString() {
        return "TrajectorySample{" +
                "t=" + time +
                ", alt=" + altitude +
                ", v=" + velocityMagnitude +
                ", dist=" + distanceToTarget +
                ", bank=" + bankAngle +
                "}";
    }
}
