// Bounds.java
// Axis-aligned box (minX, minY, maxX, maxY). In geographic use X is longitude and Y latitude.

package limited.theta.rastermap;

import org.locationtech.jts.geom.Envelope;

public final class Bounds
{
    public final double minX, minY, maxX, maxY;

    public Bounds(double minX, double minY, double maxX, double maxY)
    {
        this.minX = minX;
        this.minY = minY;
        this.maxX = maxX;
        this.maxY = maxY;
    }

    public static Bounds fromEnvelope(Envelope env)
    {
        return new Bounds(env.getMinX(), env.getMinY(), env.getMaxX(), env.getMaxY());
    }

    public Envelope toEnvelope()
    {
        return new Envelope(minX, maxX, minY, maxY);
    }

    public double getWidth()  { return maxX - minX; }
    public double getHeight() { return maxY - minY; }
    public double getCenterX() { return (minX + maxX) / 2.0; }
    public double getCenterY() { return (minY + maxY) / 2.0; }

    public boolean isEmpty()
    {
        return !(maxX > minX) || !(maxY > minY);
    }

    // minimal box covering this one and the other
    public Bounds union(Bounds other)
    {
        return new Bounds(Math.min(minX, other.minX), Math.min(minY, other.minY),
                          Math.max(maxX, other.maxX), Math.max(maxY, other.maxY));
    }

    /** Overlap of the two boxes, or null when they share no area. */
    public Bounds intersection(Bounds other)
    {
        Bounds b = new Bounds(Math.max(minX, other.minX), Math.max(minY, other.minY),
                              Math.min(maxX, other.maxX), Math.min(maxY, other.maxY));
        return b.isEmpty() ? null : b;
    }

    /**
     * Grow each axis by factor * extent / 2 on both sides, so a factor of 0.3
     * makes the box 30% wider and 30% taller.
     */
    public Bounds padded(double factor)
    {
        double padX = getWidth() * factor / 2.0;
        double padY = getHeight() * factor / 2.0;
        return new Bounds(minX - padX, minY - padY, maxX + padX, maxY + padY);
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o) return true;
        if (!(o instanceof Bounds)) return false;
        Bounds b = (Bounds) o;
        return Double.compare(minX, b.minX) == 0 && Double.compare(minY, b.minY) == 0
            && Double.compare(maxX, b.maxX) == 0 && Double.compare(maxY, b.maxY) == 0;
    }

    @Override
    public int hashCode()
    {
        int h = Double.hashCode(minX);
        h = 31 * h + Double.hashCode(minY);
        h = 31 * h + Double.hashCode(maxX);
        return 31 * h + Double.hashCode(maxY);
    }

    @Override
    public String toString()
    {
        return String.format("minX=%.6f, minY=%.6f, maxX=%.6f, maxY=%.6f", minX, minY, maxX, maxY);
    }
}
