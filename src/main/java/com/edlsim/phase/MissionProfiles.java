package com.edlsim.phase;

import com.edlsim.EntryConfig;

import java.util.List;
import java.util.Objects;

/**
 * Built-in mission phase tables.
 */
public final class MissionProfiles {

    public static final String ENTRY_INTERFACE   = "Entry Interface";
    public static final String GUIDANCE_START    = "Guidance Start";
    public static final String HEADING_ALIGNMENT = "Heading Alignment";
    public static final String BEGIN_SUFR        = "Begin SUFR";
    public static final String PARACHUTE_DEPLOY  = "Parachute Deploy";

    /** Parachute deploy time (s) and altitude (m) of the reference Mars 2020 entry. */
    public static final double PARACHUTE_TIME = 240.0;
    public static final double PARACHUTE_ALTITUDE = 13_462.9;

    private MissionProfiles() {} // utility class

    /**
     * Mars 2020 guided entry, entry interface to parachute deploy. Failure limits
     * (heating, g-load, parachute Mach and dynamic pressure, touchdown speed) come
     * from {@code config}.
     * <p>
     * Parachute deployment is an event of the last phase, not the end of the
     * mission. Success is a touchdown at or below the touchdown speed; a faster
     * touchdown fails the landing legs.
     * </p>
     */
    public static MissionProfile mars2020(EntryConfig config) {
        Objects.requireNonNull(config, "config must not be null");
        final double heatLimit = config.getHeatShieldLimit();
        final double gLimit = config.getMaxGLoad();
        final double chuteMach = config.getParachuteMaxMach();
        final double chuteQ = config.getParachuteMaxDynamicPressure();
        final double touchdownSpeed = config.getTouchdownMaxSpeed();
        final double ceiling = config.getAtmosphereCeiling();

        final StatePredicate heatShield = StatePredicate.of("heat shield failure",
                s -> s.getHeatingRate() > heatLimit);
        final StatePredicate overload = StatePredicate.of("structural overload",
                s -> s.getGLoad() > gLimit);
        final StatePredicate chuteInLimits = StatePredicate.of("parachute deploy conditions",
                s -> s.getMach() <= chuteMach && s.getDynamicPressure() <= chuteQ);
        final StatePredicate chuteFailure = StatePredicate.of("parachute failure",
                s -> s.getMach() > chuteMach || s.getDynamicPressure() > chuteQ);
        final StatePredicate landingLegFailure = StatePredicate.of("landing leg failure",
                s -> s.getAltitude() <= 0.0 && s.getVelocity() > touchdownSpeed);
        final StatePredicate descending = StatePredicate.of("below entry interface",
                s -> s.getAltitude() < ceiling);

        final List<PhaseDefinition> phases = List.of(
                PhaseDefinition.builder(ENTRY_INTERFACE)
                        .description("The spacecraft enters the Martian atmosphere, drastically slowing it down while also heating it up.")
                        .entryTime(0.0)
                        .event(StatePredicate.of("atmospheric interface", s -> s.getDensity() > 0.0))
                        .criticalFailure(heatShield)
                        .criticalFailure(overload)
                        .build(),
                PhaseDefinition.builder(GUIDANCE_START)
                        .description("Backshell thrusters adjust the angle and direction of lift to correct for density pockets.")
                        .entryTime(26.0)
                        .startCondition(descending)
                        .event(StatePredicate.always("guided entry"))
                        .criticalFailure(heatShield)
                        .criticalFailure(overload)
                        .build(),
                PhaseDefinition.builder(HEADING_ALIGNMENT)
                        .description("The guided entry algorithm corrects any remaining cross-range error.")
                        .entryTime(87.0)
                        .startCondition(descending)
                        .event(StatePredicate.of("peak heating", s -> s.getAltitude() <= 60_000.0))
                        .criticalFailure(heatShield)
                        .criticalFailure(overload)
                        .build(),
                PhaseDefinition.builder(BEGIN_SUFR)
                        .description("Straighten Up and Fly Right: balance masses ejected and angle of attack set to zero.")
                        .entryTime(174.0)
                        .startCondition(descending)
                        .event(StatePredicate.of("peak deceleration", s -> s.getAltitude() <= 25_000.0))
                        .criticalFailure(overload)
                        .build(),
                PhaseDefinition.builder(PARACHUTE_DEPLOY)
                        .description("The parachute opens on a range trigger, at the optimum time to hit a smaller target area.")
                        .entryTime(PARACHUTE_TIME)
                        .entryAltitude(PARACHUTE_ALTITUDE)
                        .startCondition(chuteInLimits)
                        .event(StatePredicate.always("parachute deployment"))
                        .criticalFailure(chuteFailure)
                        .criticalFailure(landingLegFailure)
                        .build());

        final StatePredicate touchdown = StatePredicate.of("touchdown",
                s -> s.getAltitude() <= 0.0 && s.getVelocity() <= touchdownSpeed);
        return new MissionProfile("Mars 2020", phases, touchdown);
    }

    /**
     * Three-phase table keyed only on time and altitude thresholds, with no
     * success condition.
     */
    public static MissionProfile coarse() {
        return new MissionProfile("Coarse EDL", List.of(
                PhaseDefinition.builder("EntryInterface").entryTime(0.0).build(),
                PhaseDefinition.builder("PeakHeating").entryAltitude(60_000.0).build(),
                PhaseDefinition.builder("ParachuteDeploy").entryTime(260.65).build()),
                null);
    }
}
