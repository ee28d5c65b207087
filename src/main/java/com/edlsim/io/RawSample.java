package com.edlsim.io;

/**
 * One loaded trajectory row: time (s) and body-centred position (m).
 */
public final class RawSample {

    public final double time;
    public final double x, y, z;

    public RawSample(double time, double x, double y, double z) {
        this.time = time;
        this.x = x;
        this.y = y;
        this.z = z;
    }

    public boolean isFinite() {
        return Double.isFinite(time) && Double.isFinite(x) && Double.isFinite(y) && Double.isFinite(z);
    }

    @Override
    public String toString() { return "RawSample{t=" + time + ", " + x + ", " + y + ", " + z + "}"; }
}
