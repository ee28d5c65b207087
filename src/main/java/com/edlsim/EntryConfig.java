package com.edlsim;

import com.edlsim.util.Frames;
import org.hipparchus.geometry.euclidean.threed.Vector3D;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Properties;

/**
 * Physical and vehicle configuration for an entry simulation.
 * <p>
 *   Defaults describe a Mars entry with an MSL-class capsule. Engine components
 *   take a {@link #copy()} at construction, so changing a setter afterwards does
 *   not affect a running session.
 * </p>
 * <p>
 *   Every value can be overridden from a properties source using the
 *   {@code edlsim.} prefix and the bean property name, e.g.
 *   {@code edlsim.vehicleMass=1025}. Unknown keys are ignored.
 * </p>
 */
public class EntryConfig {

    private static final Logger LOG = LoggerFactory.getLogger(EntryConfig.class);

    /** Classpath resource read by {@link #load()}. */
    public static final String DEFAULT_RESOURCE = "edl-sim.properties";
    public static final String KEY_PREFIX = "edlsim.";

    // ── Body & atmosphere ───────────────────────────────────────────────────
    private double bodyRadius;              // m
    private double atmosphereCeiling;       // m above surface
    private double scaleHeight;             // m
    private double surfaceDensity;          // kg/m³
    private double surfacePressure;         // Pa
    private double surfaceTemperature;      // K
    private double tropopauseAltitude;      // m
    private double stratopauseAltitude;     // m
    private double troposphereLapseRate;    // K/m, cooling
    private double stratosphereLapseRate;   // K/m, warming
    private double mesosphereLapseRate;     // K/m, cooling
    private double gasConstant;             // J/(kg·K)
    private double heatCapacityRatio;
    private double minTemperature;          // K, floor for sound speed
    private double backgroundTemperature;   // K, above the ceiling
    private double gravitationalParameter;  // m³/s²

    // ── Vehicle ────────────────────────────────────────────────────────────
    private double vehicleMass;             // kg
    private double referenceArea;           // m², drag coefficient folded in
    private double liftToDragRatio;
    private double noseRadius;              // m
    private double heatingCoefficient;      // Sutton–Graves k, SI

    // ── Integration & presentation ─────────────────────────────────────────
    private double timeStep;                // s
    private double scaleFactor;             // scene units per meter
    private double velocityLookahead;       // s
    private Vector3D fallbackDirection;
    private double deflectionFinalPercent;

    // ── Landing target ─────────────────────────────────────────────────────
    private double landingLatitudeDeg;
    private double landingLongitudeDeg;

    // ── Mission limits ─────────────────────────────────────────────────────
    private double heatShieldLimit;             // W/cm²
    private double parachuteMaxMach;
    private double parachuteMaxDynamicPressure; // Pa
    private double touchdownMaxSpeed;           // m/s
    private double maxGLoad;

    /** Mars / MSL defaults. */
    public EntryConfig() {
        this.bodyRadius = 3_389_500.0;
        this.atmosphereCeiling = 0.1 * bodyRadius;
        this.scaleHeight = 11_100.0;
        this.surfaceDensity = 0.020;
        this.surfacePressure = 610.0;
        this.surfaceTemperature = 210.0;
        this.tropopauseAltitude = 11_000.0;
        this.stratopauseAltitude = 50_000.0;
        this.troposphereLapseRate = 0.0065;
        this.stratosphereLapseRate = 0.001;
        this.mesosphereLapseRate = 0.002;
        this.gasConstant = 192.0;
        this.heatCapacityRatio = 1.3;
        this.minTemperature = 150.0;
        this.backgroundTemperature = 2.7;
        this.gravitationalParameter = 4.2828e13;

        this.vehicleMass = 899.0;
        this.referenceArea = 15.9;
        this.liftToDragRatio = 0.13;
        this.noseRadius = 1.125;
        this.heatingCoefficient = 1.9027e-4;

        this.timeStep = 0.1;
        this.scaleFactor = 1e-5;
        this.velocityLookahead = 0.01;
        this.fallbackDirection = new Vector3D(0.0, -1.0, 0.0);
        this.deflectionFinalPercent = 0.1;

        this.landingLatitudeDeg = -4.5895;
        this.landingLongitudeDeg = 137.4417;

        this.heatShieldLimit = 250.0;
        this.parachuteMaxMach = 2.2;
        this.parachuteMaxDynamicPressure = 850.0;
        this.touchdownMaxSpeed = 10.0;
        this.maxGLoad = 20.0;
    }

    public static EntryConfig marsDefaults() { return new EntryConfig(); }

    public EntryConfig copy() {
        final EntryConfig c = new EntryConfig();
        c.bodyRadius = bodyRadius;
        c.atmosphereCeiling = atmosphereCeiling;
        c.scaleHeight = scaleHeight;
        c.surfaceDensity = surfaceDensity;
        c.surfacePressure = surfacePressure;
        c.surfaceTemperature = surfaceTemperature;
        c.tropopauseAltitude = tropopauseAltitude;
        c.stratopauseAltitude = stratopauseAltitude;
        c.troposphereLapseRate = troposphereLapseRate;
        c.stratosphereLapseRate = stratosphereLapseRate;
        c.mesosphereLapseRate = mesosphereLapseRate;
        c.gasConstant = gasConstant;
        c.heatCapacityRatio = heatCapacityRatio;
        c.minTemperature = minTemperature;
        c.backgroundTemperature = backgroundTemperature;
        c.gravitationalParameter = gravitationalParameter;
        c.vehicleMass = vehicleMass;
        c.referenceArea = referenceArea;
        c.liftToDragRatio = liftToDragRatio;
        c.noseRadius = noseRadius;
        c.heatingCoefficient = heatingCoefficient;
        c.timeStep = timeStep;
        c.scaleFactor = scaleFactor;
        c.velocityLookahead = velocityLookahead;
        c.fallbackDirection = fallbackDirection;
        c.deflectionFinalPercent = deflectionFinalPercent;
        c.landingLatitudeDeg = landingLatitudeDeg;
        c.landingLongitudeDeg = landingLongitudeDeg;
        c.heatShieldLimit = heatShieldLimit;
        c.parachuteMaxMach = parachuteMaxMach;
        c.parachuteMaxDynamicPressure = parachuteMaxDynamicPressure;
        c.touchdownMaxSpeed = touchdownMaxSpeed;
        c.maxGLoad = maxGLoad;
        return c;
    }

    // =====================================================================
    // Loading
    // =====================================================================

    /** Defaults overlaid with {@value #DEFAULT_RESOURCE} from the classpath, when present. */
    public static EntryConfig load() {
        final EntryConfig cfg = new EntryConfig();
        try (InputStream in = EntryConfig.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                LOG.debug("No {} on classpath; using Mars defaults", DEFAULT_RESOURCE);
                return cfg;
            }
            final Properties p = new Properties();
            p.load(new InputStreamReader(in, StandardCharsets.UTF_8));
            cfg.apply(p);
            LOG.info("Loaded entry configuration from classpath:{}", DEFAULT_RESOURCE);
        } catch (IOException e) {
            throw new IllegalArgumentException("Cannot read " + DEFAULT_RESOURCE, e);
        }
        cfg.validate();
        return cfg;
    }

    /** Defaults overlaid with the given properties file. */
    public static EntryConfig load(Path file) {
        Objects.requireNonNull(file, "config path must not be null");
        final Properties p = new Properties();
        try (Reader r = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            p.load(r);
        } catch (IOException e) {
            LOG.error("Failed to read entry configuration {}: {}", file, e.toString());
            throw new IllegalArgumentException("Cannot load entry configuration: " + file, e);
        }
        final EntryConfig cfg = fromProperties(p);
        LOG.info("Loaded entry configuration from {}", file);
        return cfg;
    }

    public static EntryConfig fromProperties(Properties p) {
        Objects.requireNonNull(p, "properties must not be null");
        final EntryConfig cfg = new EntryConfig();
        cfg.apply(p);
        cfg.validate();
        return cfg;
    }

    private void apply(Properties p) {
        bodyRadius             = num(p, "bodyRadius", bodyRadius);
        // ceiling follows a changed radius unless set explicitly
        atmosphereCeiling      = num(p, "atmosphereCeiling", p.containsKey(KEY_PREFIX + "bodyRadius") ? 0.1 * bodyRadius : atmosphereCeiling);
        scaleHeight            = num(p, "scaleHeight", scaleHeight);
        surfaceDensity         = num(p, "surfaceDensity", surfaceDensity);
        surfacePressure        = num(p, "surfacePressure", surfacePressure);
        surfaceTemperature     = num(p, "surfaceTemperature", surfaceTemperature);
        tropopauseAltitude     = num(p, "tropopauseAltitude", tropopauseAltitude);
        stratopauseAltitude    = num(p, "stratopauseAltitude", stratopauseAltitude);
        troposphereLapseRate   = num(p, "troposphereLapseRate", troposphereLapseRate);
        stratosphereLapseRate  = num(p, "stratosphereLapseRate", stratosphereLapseRate);
        mesosphereLapseRate    = num(p, "mesosphereLapseRate", mesosphereLapseRate);
        gasConstant            = num(p, "gasConstant", gasConstant);
        heatCapacityRatio      = num(p, "heatCapacityRatio", heatCapacityRatio);
        minTemperature         = num(p, "minTemperature", minTemperature);
        backgroundTemperature  = num(p, "backgroundTemperature", backgroundTemperature);
        gravitationalParameter = num(p, "gravitationalParameter", gravitationalParameter);
        vehicleMass            = num(p, "vehicleMass", vehicleMass);
        referenceArea          = num(p, "referenceArea", referenceArea);
        liftToDragRatio        = num(p, "liftToDragRatio", liftToDragRatio);
        noseRadius             = num(p, "noseRadius", noseRadius);
        heatingCoefficient     = num(p, "heatingCoefficient", heatingCoefficient);
        timeStep               = num(p, "timeStep", timeStep);
        scaleFactor            = num(p, "scaleFactor", scaleFactor);
        velocityLookahead      = num(p, "velocityLookahead", velocityLookahead);
        deflectionFinalPercent = num(p, "deflectionFinalPercent", deflectionFinalPercent);
        landingLatitudeDeg     = num(p, "landingLatitudeDeg", landingLatitudeDeg);
        landingLongitudeDeg    = num(p, "landingLongitudeDeg", landingLongitudeDeg);
        heatShieldLimit        = num(p, "heatShieldLimit", heatShieldLimit);
        parachuteMaxMach       = num(p, "parachuteMaxMach", parachuteMaxMach);
        parachuteMaxDynamicPressure = num(p, "parachuteMaxDynamicPressure", parachuteMaxDynamicPressure);
        touchdownMaxSpeed      = num(p, "touchdownMaxSpeed", touchdownMaxSpeed);
        maxGLoad               = num(p, "maxGLoad", maxGLoad);
        fallbackDirection      = vec(p, "fallbackDirection", fallbackDirection);
    }

    private static double num(Properties p, String name, double def) {
        final String s = p.getProperty(KEY_PREFIX + name);
        if (s == null || s.isBlank()) return def;
        try {
            return Double.parseDouble(s.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Failed to parse '" + KEY_PREFIX + name + "': '" + s + "'", e);
        }
    }

    private static Vector3D vec(Properties p, String name, Vector3D def) {
        final String s = p.getProperty(KEY_PREFIX + name);
        if (s == null || s.isBlank()) return def;
        final String[] parts = s.split(",");
        if (parts.length != 3) {
            throw new IllegalArgumentException("'" + KEY_PREFIX + name + "' needs three comma-separated values: '" + s + "'");
        }
        try {
            return new Vector3D(Double.parseDouble(parts[0].trim()),
                               Double.parseDouble(parts[1].trim()),
                               Double.parseDouble(parts[2].trim()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Failed to parse '" + KEY_PREFIX + name + "': '" + s + "'", e);
        }
    }

    /**
     * @throws IllegalArgumentException if a value would make the physics undefined
     */
    public EntryConfig validate() {
        requirePositive("bodyRadius", bodyRadius);
        requirePositive("atmosphereCeiling", atmosphereCeiling);
        requirePositive("scaleHeight", scaleHeight);
        requireNonNegative("surfaceDensity", surfaceDensity);
        requireNonNegative("surfacePressure", surfacePressure);
        requirePositive("surfaceTemperature", surfaceTemperature);
        requirePositive("gasConstant", gasConstant);
        requirePositive("heatCapacityRatio", heatCapacityRatio);
        requirePositive("minTemperature", minTemperature);
        requireNonNegative("gravitationalParameter", gravitationalParameter);
        requirePositive("vehicleMass", vehicleMass);
        requirePositive("referenceArea", referenceArea);
        requireNonNegative("liftToDragRatio", liftToDragRatio);
        requirePositive("noseRadius", noseRadius);
        requirePositive("timeStep", timeStep);
        requirePositive("scaleFactor", scaleFactor);
        requirePositive("velocityLookahead", velocityLookahead);
        if (!(stratopauseAltitude > tropopauseAltitude)) {
            throw new IllegalArgumentException("stratopauseAltitude must exceed tropopauseAltitude: "
                    + stratopauseAltitude + " <= " + tropopauseAltitude);
        }
        Objects.requireNonNull(fallbackDirection, "fallbackDirection must not be null");
        if (Frames.isNearZero(fallbackDirection, Frames.DEGENERATE_EPS) || !Frames.isFinite(fallbackDirection)) {
            throw new IllegalArgumentException("fallbackDirection must be a finite non-zero vector: " + fallbackDirection);
        }
        return this;
    }

    private static void requirePositive(String name, double v) {
        if (!Double.isFinite(v) || v <= 0.0) {
            throw new IllegalArgumentException(name + " must be positive and finite, got " + v);
        }
    }

    private static void requireNonNegative(String name, double v) {
        if (!Double.isFinite(v) || v < 0.0) {
            throw new IllegalArgumentException(name + " must be non-negative and finite, got " + v);
        }
    }

    // =====================================================================
    // Derived values
    // =====================================================================

    /** g at the surface, μ / R². */
    public double getSurfaceGravity() { return gravitationalParameter / (bodyRadius * bodyRadius); }

    /** Landing target as a surface point in the body frame. */
    public Vector3D getLandingTarget() {
        return Frames.sphericalToCartesian(bodyRadius,
                Math.toRadians(landingLongitudeDeg), Math.toRadians(landingLatitudeDeg));
    }

    // =====================================================================
    // Getters & setters
    // =====================================================================
    public double getBodyRadius()                    { return bodyRadius; }
    public void   setBodyRadius(double v)            { this.bodyRadius = v; }

    public double getAtmosphereCeiling()             { return atmosphereCeiling; }
    public void   setAtmosphereCeiling(double v)     { this.atmosphereCeiling = v; }

    public double getScaleHeight()                   { return scaleHeight; }
    public void   setScaleHeight(double v)           { this.scaleHeight = v; }

    public double getSurfaceDensity()                { return surfaceDensity; }
    public void   setSurfaceDensity(double v)        { this.surfaceDensity = v; }

    public double getSurfacePressure()               { return surfacePressure; }
    public void   setSurfacePressure(double v)       { this.surfacePressure = v; }

    public double getSurfaceTemperature()            { return surfaceTemperature; }
    public void   setSurfaceTemperature(double v)    { this.surfaceTemperature = v; }

    public double getTropopauseAltitude()            { return tropopauseAltitude; }
    public void   setTropopauseAltitude(double v)    { this.tropopauseAltitude = v; }

    public double getStratopauseAltitude()           { return stratopauseAltitude; }
    public void   setStratopauseAltitude(double v)   { this.stratopauseAltitude = v; }

    public double getTroposphereLapseRate()          { return troposphereLapseRate; }
    public void   setTroposphereLapseRate(double v)  { this.troposphereLapseRate = v; }

    public double getStratosphereLapseRate()         { return stratosphereLapseRate; }
    public void   setStratosphereLapseRate(double v) { this.stratosphereLapseRate = v; }

    public double getMesosphereLapseRate()           { return mesosphereLapseRate; }
    public void   setMesosphereLapseRate(double v)   { this.mesosphereLapseRate = v; }

    public double getGasConstant()                   { return gasConstant; }
    public void   setGasConstant(double v)           { this.gasConstant = v; }

    public double getHeatCapacityRatio()             { return heatCapacityRatio; }
    public void   setHeatCapacityRatio(double v)     { this.heatCapacityRatio = v; }

    public double getMinTemperature()                { return minTemperature; }
    public void   setMinTemperature(double v)        { this.minTemperature = v; }

    public double getBackgroundTemperature()         { return backgroundTemperature; }
    public void   setBackgroundTemperature(double v) { this.backgroundTemperature = v; }

    public double getGravitationalParameter()        { return gravitationalParameter; }
    public void   setGravitationalParameter(double v){ this.gravitationalParameter = v; }

    public double getVehicleMass()                   { return vehicleMass; }
    public void   setVehicleMass(double v)           { this.vehicleMass = v; }

    public double getReferenceArea()                 { return referenceArea; }
    public void   setReferenceArea(double v)         { this.referenceArea = v; }

    public double getLiftToDragRatio()               { return liftToDragRatio; }
    public void   setLiftToDragRatio(double v)       { this.liftToDragRatio = v; }

    public double getNoseRadius()                    { return noseRadius; }
    public void   setNoseRadius(double v)            { this.noseRadius = v; }

    public double getHeatingCoefficient()            { return heatingCoefficient; }
    public void   setHeatingCoefficient(double v)    { this.heatingCoefficient = v; }

    public double getTimeStep()                      { return timeStep; }
    public void   setTimeStep(double v)              { this.timeStep = v; }

    public double getScaleFactor()                   { return scaleFactor; }
    public void   setScaleFactor(double v)           { this.scaleFactor = v; }

    public double getVelocityLookahead()             { return velocityLookahead; }
    public void   setVelocityLookahead(double v)     { this.velocityLookahead = v; }

    public Vector3D getFallbackDirection()            { return fallbackDirection; }
    public void    setFallbackDirection(Vector3D v)   { this.fallbackDirection = v; }

    public double getDeflectionFinalPercent()        { return deflectionFinalPercent; }
    public void   setDeflectionFinalPercent(double v){ this.deflectionFinalPercent = v; }

    public double getLandingLatitudeDeg()            { return landingLatitudeDeg; }
    public void   setLandingLatitudeDeg(double v)    { this.landingLatitudeDeg = v; }

    public double getLandingLongitudeDeg()           { return landingLongitudeDeg; }
    public void   setLandingLongitudeDeg(double v)   { this.landingLongitudeDeg = v; }

    public double getHeatShieldLimit()               { return heatShieldLimit; }
    public void   setHeatShieldLimit(double v)       { this.heatShieldLimit = v; }

    public double getParachuteMaxMach()              { return parachuteMaxMach; }
    public void   setParachuteMaxMach(double v)      { this.parachuteMaxMach = v; }

    public double getParachuteMaxDynamicPressure()   { return parachuteMaxDynamicPressure; }
    public void   setParachuteMaxDynamicPressure(double v) { this.parachuteMaxDynamicPressure = v; }

    public double getTouchdownMaxSpeed()             { return touchdownMaxSpeed; }
    public void   setTouchdownMaxSpeed(double v)     { this.touchdownMaxSpeed = v; }

    public double getMaxGLoad()                      { return maxGLoad; }
    public void   setMaxGLoad(double v)              { this.maxGLoad = v; }

    @Override
    public String toString() {
        return "EntryConfig{" +
                "bodyRadius=" + bodyRadius +
                ", atmosphereCeiling=" + atmosphereCeiling +
                ", scaleHeight=" + scaleHeight +
                ", surfaceDensity=" + surfaceDensity +
                ", surfacePressure=" + surfacePressure +
                ", surfaceTemperature=" + surfaceTemperature +
                ", gravitationalParameter=" + gravitationalParameter +
                ", vehicleMass=" + vehicleMass +
                ", referenceArea=" + referenceArea +
                ", liftToDragRatio=" + liftToDragRatio +
                ", noseRadius=" + noseRadius +
                ", timeStep=" + timeStep +
                ", scaleFactor=" + scaleFactor +
                ", velocityLookahead=" + velocityLookahead +
                ", fallbackDirection=" + fallbackDirection +
                ", deflectionFinalPercent=" + deflectionFinalPercent +
                ", landingLatitudeDeg=" + landingLatitudeDeg +
                ", landingLongitudeDeg=" + landingLongitudeDeg +
                ", heatShieldLimit=" + heatShieldLimit +
                ", parachuteMaxMach=" + parachuteMaxMach +
                ", parachuteMaxDynamicPressure=" + parachuteMaxDynamicPressure +
                ", touchdownMaxSpeed=" + touchdownMaxSpeed +
                ", maxGLoad=" + maxGLoad +
                "}";
    }
}
