package com.edlsim.util;

import com.edlsim.EntryConfig;

import java.util.Objects;

/**
 * Exponential-density atmosphere with a three-layer temperature profile.
 *
 * <pre>
 *   ρ(h) = ρ0 · exp(−h / H)        p(h) = p0 · exp(−h / H)        (h below ceiling)
 *   ρ = p = 0, T = background       (h at or above ceiling)
 *   a(h) = sqrt(γ · R · max(Tmin, T(h)))
 * </pre>
 *
 * Temperature is piecewise linear: cooling to the tropopause, warming to the
 * stratopause, cooling above. Each layer starts from the previous layer's end
 * value. Negative altitudes evaluate as the surface.
 */
public final class AtmosphereModel {

    private final double ceiling;
    private final double scaleHeight;
    private final double rho0;
    private final double p0;
    private final double t0;
    private final double h1, h2;
    private final double lapse1, lapse2, lapse3;
    private final double gamma, rSpecific, tMin, tBackground;

    public AtmosphereModel(EntryConfig config) {
        Objects.requireNonNull(config, "config must not be null");
        this.ceiling = config.getAtmosphereCeiling();
        this.scaleHeight = config.getScaleHeight();
        this.rho0 = config.getSurfaceDensity();
        this.p0 = config.getSurfacePressure();
        this.t0 = config.getSurfaceTemperature();
        this.h1 = config.getTropopauseAltitude();
        this.h2 = config.getStratopauseAltitude();
        this.lapse1 = config.getTroposphereLapseRate();
        this.lapse2 = config.getStratosphereLapseRate();
        this.lapse3 = config.getMesosphereLapseRate();
        this.gamma = config.getHeatCapacityRatio();
        this.rSpecific = config.getGasConstant();
        this.tMin = config.getMinTemperature();
        this.tBackground = config.getBackgroundTemperature();
    }

    public boolean isAboveCeiling(double altitude) { return altitude >= ceiling; }

    /** Density (kg/m³). */
    public double density(double altitude) {
        if (isAboveCeiling(altitude)) return 0.0;
        return rho0 * Math.exp(-Math.max(0.0, altitude) / scaleHeight);
    }

    /** Pressure (Pa). */
    public double pressure(double altitude) {
        if (isAboveCeiling(altitude)) return 0.0;
        return p0 * Math.exp(-Math.max(0.0, altitude) / scaleHeight);
    }

    /** Temperature (K). */
    public double temperature(double altitude) {
        if (isAboveCeiling(altitude)) return tBackground;
        final double h = Math.max(0.0, altitude);
        if (h < h1) {
            return t0 - lapse1 * h;
        }
        final double tTropopause = t0 - lapse1 * h1;
        if (h < h2) {
            return tTropopause + lapse2 * (h - h1);
        }
        final double tStratopause = tTropopause + lapse2 * (h2 - h1);
        return tStratopause - lapse3 * (h - h2);
    }

    /** Speed of sound (m/s), temperature floored at Tmin. */
    public double soundSpeed(double altitude) {
        return Math.sqrt(gamma * rSpecific * Math.max(tMin, temperature(altitude)));
    }

    /** Mach number for a speed (m/s) at altitude; 0 for non-finite input. */
    public double machNumber(double speed, double altitude) {
        final double a = soundSpeed(altitude);
        if (!Double.isFinite(speed) || !(a > 1e-9)) return 0.0;
        return speed / a;
    }

    /** ½ ρ v² (Pa). */
    public double dynamicPressure(double speed, double altitude) {
        return 0.5 * density(altitude) * speed * speed;
    }
}
