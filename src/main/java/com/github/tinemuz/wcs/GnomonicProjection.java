/*
 * MIT License
 *
 * Copyright (c) 2025 tinemuz
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */
package com.github.tinemuz.wcs;

/**
 * Gnomonic (tangent plane, TAN) projection.
 *
 * <p>Computed directly from right ascension and declination relative to the
 * tangent point instead of through a {@link SphericalRotation}; the direct
 * formula loses less precision close to the tangent point, which is where
 * astrometric fits live. {@link #getWcs()} still describes an equivalent
 * {@code RA---TAN}/{@code DEC--TAN} keyword pair.</p>
 */
public final class GnomonicProjection implements Projection {
    private final double scale;
    private final double ra0; // radians
    private final double dec0; // radians
    private final double sinDec0;
    private final double cosDec0;

    /**
     * @param scale plane units per radian at the tangent point, 180/pi for degrees
     * @param ra0   right ascension of the tangent point (degrees)
     * @param dec0  declination of the tangent point (degrees)
     */
    public GnomonicProjection(double scale, double ra0, double dec0) {
        this.scale = scale;
        this.ra0 = Math.toRadians(ra0);
        this.dec0 = Math.toRadians(dec0);
        this.sinDec0 = Math.sin(this.dec0);
        this.cosDec0 = Math.cos(this.dec0);
    }

    public double getScale() {
        return scale;
    }

    @Override
    public String projCode() {
        return "TAN";
    }

    @Override
    public String identifier() {
        return "Gnomonic";
    }

    @Override
    public String name() {
        return "Gnomonic";
    }

    @Override
    public double phi0() {
        return 0.0;
    }

    @Override
    public double theta0() {
        return 90.0;
    }

    @Override
    public WCSKeywords getWcs() {
        return WCSKeywords.of("TAN", Math.toDegrees(ra0), Math.toDegrees(dec0));
    }

    /** Null for points more than 90 degrees from the tangent point. */
    @Override
    public Point direct(Point p) {
        double ra = Math.toRadians(p.x());
        double dec = Math.toRadians(p.y());
        double sinDec = Math.sin(dec);
        double cosDec = Math.cos(dec);
        double cosRa = Math.cos(ra - ra0);

        double cosDist = sinDec0 * sinDec + cosDec0 * cosDec * cosRa;
        double dist = Math.acos(Math.min(1.0, Math.max(-1.0, cosDist)));
        if (!(dist <= Math.PI / 2)) return null;

        double a = cosDec * cosRa;
        double f = scale / (sinDec0 * sinDec + a * cosDec0);
        return AbstractProjection.finiteOrNull(
                new Point(f * cosDec * Math.sin(ra - ra0), f * (cosDec0 * sinDec - a * sinDec0)));
    }

    @Override
    public Point inverse(Point p) {
        double x = -p.x() / scale;
        double y = -p.y() / scale;
        double d = Math.atan(Math.sqrt(x * x + y * y));
        double b = Math.atan2(-x, y);
        double sinD = Math.sin(d);
        double cosD = Math.cos(d);
        double cosB = Math.cos(b);
        double xx = sinDec0 * sinD * cosB + cosDec0 * cosD;
        double yy = sinD * Math.sin(b);
        double ra = ra0 + Math.atan2(yy, xx);
        double dec = Math.asin(sinDec0 * cosD - cosDec0 * sinD * cosB);
        return AbstractProjection.finiteOrNull(new Point(Math.toDegrees(ra), Math.toDegrees(dec)));
    }

    /** Drawn when both ends project and lie within 45 plane units of each other. */
    @Override
    public boolean checkBrokenLine(Point cp1, Point cp2) {
        if (cp1 == null || cp2 == null) return false;
        Point gp1 = direct(cp1);
        if (gp1 == null) return false;
        Point gp2 = direct(cp2);
        if (gp2 == null) return false;
        double dx = gp1.x() - gp2.x();
        double dy = gp1.y() - gp2.y();
        return dx * dx + dy * dy < 45.0 * 45.0;
    }

    @Override
    public String toString() {
        return "Gnomonic[TAN, crval=(" + Math.toDegrees(ra0) + ", " + Math.toDegrees(dec0)
                + "), scale=" + scale + "]";
    }
}
