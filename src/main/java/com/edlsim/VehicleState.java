package com.edlsim;

/**
 * Scalar vehicle state evaluated by mission-phase predicates. Immutable.
 */
public final class VehicleState {

    private final double time;             // s
    private final double altitude;         // m
    private final double velocity;         // m/s
    private final double density;          // kg/m³
    private final double dynamicPressure;  // Pa
    private final double mach;
    private final double heatingRate;      // W/cm²
    private final double gLoad;            // Earth g

    public VehicleState(double time, double altitude, double velocity, double density,
                        double dynamicPressure, double mach, double heatingRate, double gLoad) {
        this.time = time;
        this.altitude = altitude;
        this.velocity = velocity;
        this.density = density;
        this.dynamicPressure = dynamicPressure;
        this.mach = mach;
        this.heatingRate = heatingRate;
        this.gLoad = gLoad;
    }

    /** Kinematics only; aerothermal fields zero. */
    public static VehicleState of(double time, double altitude, double velocity) {
        return new VehicleState(time, altitude, velocity, 0.0, 0.0, 0.0, 0.0, 0.0);
    }

    public double getTime()            { return time; }
    public double getAltitude()        { return altitude; }
    public double getVelocity()        { return velocity; }
    public double getDensity()         { return density; }
    public double getDynamicPressure() { return dynamicPressure; }
    public double getMach()            { return mach; }
    public double getHeatingRate()     { return heatingRate; }
    public double getGLoad()           { return gLoad; }

    @Override
    public String toString() {
        return String.format(java.util.Locale.ROOT,
                "VehicleState{t=%.2f, alt=%.1f, v=%.1f, M=%.2f, q=%.1f, heat=%.1f, g=%.2f}",
                time, altitude, velocity, mach, dynamicPressure, heatingRate, gLoad);
    }
}
