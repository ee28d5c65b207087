package com.edlsim;

import com.edlsim.util.Frames;
import org.hipparchus.geometry.euclidean.threed.Vector3D;

/**
 * Entry-interface conditions in planet-relative spherical form.
 * Angles in degrees; heading measured from East toward North, flight-path
 * angle negative when descending.
 */
public final class EntryState {

    private final double altitude;         // m
    private final double speed;            // m/s
    private final double flightPathAngle;  // deg
    private final double heading;          // deg
    private final double latitude;         // deg
    private final double longitude;        // deg

    public EntryState(double altitude, double speed, double flightPathAngle,
                      double heading, double latitude, double longitude) {
        if (!Double.isFinite(altitude) || !Double.isFinite(speed) || speed < 0.0) {
            throw new IllegalArgumentException("Entry altitude and speed must be finite, speed non-negative: alt="
                    + altitude + " v=" + speed);
        }
        this.altitude = altitude;
        this.speed = speed;
        this.flightPathAngle = flightPathAngle;
        this.heading = heading;
        this.latitude = latitude;
        this.longitude = longitude;
    }

    /** MSL-like entry: 125 km, 6083.6 m/s, −15.5° flight path. */
    public static EntryState mars2020() {
        return new EntryState(124_999.0, 6083.6, -15.5, 30.0, -15.5, 126.0);
    }

    public Vector3D position(double bodyRadius) {
        return Frames.sphericalToCartesian(bodyRadius + altitude, Math.toRadians(longitude), Math.toRadians(latitude));
    }

    public Vector3D velocity() {
        return Frames.velocityFromFlightPath(speed, Math.toRadians(flightPathAngle), Math.toRadians(heading),
                Math.toRadians(longitude), Math.toRadians(latitude));
    }

    public double getAltitude()        { return altitude; }
    public double getSpeed()           { return speed; }
    public double getFlightPathAngle() { return flightPathAngle; }
    public double getHeading()         { return heading; }
    public double getLatitude()        { return latitude; }
    public double getLongitude()       { return longitude; }

    @Override
    public String toString() {
        return "EntryState{alt=" + altitude + ", v=" + speed + ", gamma=" + flightPathAngle
                + ", heading=" + heading + ", lat=" + latitude + ", lon=" + longitude + "}";
    }
}
