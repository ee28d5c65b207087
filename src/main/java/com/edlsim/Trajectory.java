package com.edlsim;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Immutable, time-ordered sequence of {@link TrajectorySample}s.
 * <p>
 * Sample times are strictly increasing. Edits ({@link #splice}) return a new
 * instance that shares the untouched prefix with the receiver.
 * </p>
 */
public final class Trajectory {

    private static final Trajectory EMPTY = new Trajectory(Collections.emptyList(), false);

    private final List<TrajectorySample> samples;

    public Trajectory(List<TrajectorySample> samples) {
        this(new ArrayList<>(Objects.requireNonNull(samples, "samples must not be null")), true);
    }

    private Trajectory(List<TrajectorySample> owned, boolean check) {
        if (check) checkOrdering(owned, 0);
        this.samples = Collections.unmodifiableList(owned);
    }

    public static Trajectory empty() { return EMPTY; }

    private static void checkOrdering(List<TrajectorySample> list, int from) {
        for (int i = Math.max(1, from); i < list.size(); i++) {
            final TrajectorySample prev = Objects.requireNonNull(list.get(i - 1), "sample " + (i - 1));
            final TrajectorySample cur  = Objects.requireNonNull(list.get(i), "sample " + i);
            if (!(cur.getTime() > prev.getTime())) {
                throw new IllegalArgumentException("Sample times must strictly increase: t[" + (i - 1) + "]="
                        + prev.getTime() + " t[" + i + "]=" + cur.getTime());
            }
        }
        if (list.size() == 1) Objects.requireNonNull(list.get(0), "sample 0");
    }

    public int size()                      { return samples.size(); }
    public boolean isEmpty()               { return samples.isEmpty(); }
    public TrajectorySample get(int index) { return samples.get(index); }
    public List<TrajectorySample> samples(){ return samples; }

    public TrajectorySample first() { requireNotEmpty(); return samples.get(0); }
    public TrajectorySample last()  { requireNotEmpty(); return samples.get(samples.size() - 1); }

    public double startTime() { return first().getTime(); }
    public double endTime()   { return last().getTime(); }

    public double duration() { return isEmpty() ? 0.0 : endTime() - startTime(); }

    /**
     * Last index whose time is {@code <= time}; -1 if {@code time} precedes the
     * first sample (or the trajectory is empty).
     */
    public int indexAtOrBefore(double time) {
        int lo = 0, hi = samples.size() - 1, ans = -1;
        while (lo <= hi) {
            final int mid = (lo + hi) >>> 1;
            if (samples.get(mid).getTime() <= time) {
                ans = mid;
                lo = mid + 1;
            } else {
                hi = mid - 1;
            }
        }
        return ans;
    }

    /** Samples {@code 0..cutIndex} inclusive. */
    public List<TrajectorySample> past(int cutIndex) {
        final int end = Math.max(0, Math.min(samples.size(), cutIndex + 1));
        return samples.subList(0, end);
    }

    /** Samples after {@code cutIndex}. */
    public List<TrajectorySample> future(int cutIndex) {
        final int start = Math.max(0, Math.min(samples.size(), cutIndex + 1));
        return samples.subList(start, samples.size());
    }

    /** True when at least one sample carries a non-zero velocity vector. */
    public boolean hasExplicitVelocity() {
        for (TrajectorySample s : samples) {
            if (s.getVelocity().getNormSq() > 0.0) return true;
        }
        return false;
    }

    /**
     * New trajectory with samples {@code 0..cutIndex} kept (same instances) and
     * everything after replaced by {@code newFuture}.
     *
     * @throws IllegalArgumentException if the result would not be strictly time-ordered
     */
    public Trajectory splice(int cutIndex, List<TrajectorySample> newFuture) {
        Objects.requireNonNull(newFuture, "newFuture must not be null");
        if (cutIndex < -1 || cutIndex >= samples.size()) {
            throw new IllegalArgumentException("cutIndex out of range: " + cutIndex + " (size " + samples.size() + ")");
        }
        final List<TrajectorySample> out = new ArrayList<>(cutIndex + 1 + newFuture.size());
        out.addAll(samples.subList(0, cutIndex + 1));
        out.addAll(newFuture);
        checkOrdering(out, cutIndex + 1);
        return new Trajectory(out, false);
    }

    private void requireNotEmpty() {
        if (samples.isEmpty()) throw new IllegalStateException("Trajectory is empty");
    }

    @Override
    public String toString() {
        if (samples.isEmpty()) return "Trajectory{empty}";
        return "Trajectory{n=" + samples.size() + ", t=[" + startTime() + ", " + endTime() + "]}";
    }
}
