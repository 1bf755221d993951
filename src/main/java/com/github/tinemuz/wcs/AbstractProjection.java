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

import com.github.tinemuz.wcs.WcsConfigurationException.Reason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base for projections defined in a native spherical frame.
 *
 * <p>{@link #direct} rotates celestial coordinates into the native frame with a
 * {@link SphericalRotation} and then applies {@link #project}; {@link #inverse}
 * runs {@link #unproject} and rotates back. Subclasses supply the native/plane
 * pair and their fiducial point.</p>
 *
 * <p>An instance must be initialised exactly once, with
 * {@link #initFromRefpoint} or {@link #initFromWcs}, before it is queried.
 * After that it does not change.</p>
 */
public abstract class AbstractProjection implements Projection {
    private static final Logger log = LoggerFactory.getLogger(AbstractProjection.class);

    private final String projCode;
    private final String identifier;
    private final String name;

    protected double phi0;
    protected double theta0;
    protected double ra0; // radians
    protected double dec0; // radians
    protected SphericalRotation sph;
    protected WCSKeywords wcs;

    protected AbstractProjection(
            String projCode, String identifier, String name, double phi0, double theta0) {
        this.projCode = projCode;
        this.identifier = identifier;
        this.name = name;
        this.phi0 = phi0;
        this.theta0 = theta0;
    }

    /**
     * Map native spherical coordinates {@code (phi, theta)} to the plane.
     *
     * @return the plane point, or null outside the projection's native domain
     */
    public abstract Point project(Point np);

    /**
     * Map a plane point to native spherical coordinates {@code (phi, theta)}.
     *
     * @return the native point, or null outside the projection's boundary
     */
    public abstract Point unproject(Point p);

    /** Initialise with the default native longitude of the celestial pole. */
    public AbstractProjection initFromRefpoint(double lng0, double lat0) {
        return initFromRefpoint(lng0, lat0, null);
    }

    /**
     * Initialise from a reference point placed at the fiducial point.
     *
     * @param lng0 celestial longitude of the reference point (degrees)
     * @param lat0 celestial latitude of the reference point (degrees)
     * @param phip native longitude of the celestial pole, or null for the default
     * @return this projection
     * @throws WcsConfigurationException if no rotation matches the inputs
     * @throws IllegalStateException if the projection is already initialised
     */
    public AbstractProjection initFromRefpoint(double lng0, double lat0, Double phip) {
        checkNotInitialised();
        WCSKeywords.Builder b = WCSKeywords.builder().projection(projCode).crval(lng0, lat0);
        if (theta0 != 0.0) b.pv1_2(theta0);
        double lonpole = phip != null ? phip : defaultLonpole(lat0, phi0, theta0);
        SphericalRotation rotation = new SphericalRotation(lng0, lat0, phi0, theta0, lonpole, null);
        this.wcs = b.build();
        this.ra0 = Math.toRadians(lng0);
        this.dec0 = Math.toRadians(lat0);
        this.sph = rotation;
        return this;
    }

    /**
     * Initialise from WCS keywords. PV1_1 and PV1_2 override the fiducial
     * point; LONPOLE and LATPOLE are honoured when present. Nothing changes
     * if the keywords are rejected.
     *
     * @return this projection
     * @throws WcsConfigurationException if |PV1_2| exceeds 90 degrees or no
     *         rotation matches the keywords
     * @throws IllegalStateException if the projection is already initialised
     */
    public AbstractProjection initFromWcs(WCSKeywords wcs) {
        checkNotInitialised();
        double p0 = wcs.pv1_1() != null ? wcs.pv1_1() : phi0;
        double t0 = theta0;
        if (wcs.pv1_2() != null) {
            t0 = wcs.pv1_2();
            if (Math.abs(t0) > 90.0) {
                if (Math.abs(t0) > 90.0 + SphericalRotation.TOLERANCE) {
                    log.error("PV1_2 (theta0) of {} is out of range", t0);
                    throw new WcsConfigurationException(
                            Reason.THETA0_OUT_OF_RANGE, "Invalid WCS coordinates: theta0 > 90", t0);
                }
                log.warn("PV1_2 (theta0) of {} clamped to {}", t0, t0 > 0 ? 90 : -90);
                t0 = t0 > 0.0 ? 90.0 : -90.0;
            }
        }
        double phip = wcs.lonpole() != null ? wcs.lonpole() : defaultLonpole(wcs.crval2(), p0, t0);
        SphericalRotation rotation =
                new SphericalRotation(wcs.crval1(), wcs.crval2(), p0, t0, phip, wcs.latpole());
        this.phi0 = p0;
        this.theta0 = t0;
        this.wcs = wcs;
        this.ra0 = Math.toRadians(wcs.crval1());
        this.dec0 = Math.toRadians(wcs.crval2());
        this.sph = rotation;
        return this;
    }

    private void checkNotInitialised() {
        if (sph != null) {
            log.error("{} projection is already initialised", identifier);
            throw new IllegalStateException(identifier + " projection is already initialised");
        }
    }

    /** Default LONPOLE: 180 when the reference latitude is below theta0, else 0, offset by phi0. */
    private static double defaultLonpole(double lat0, double phi0, double theta0) {
        double phip = (lat0 < theta0 ? 180.0 : 0.0) + phi0;
        if (phip < -180.0) phip += 360.0;
        else if (phip > 180.0) phip -= 360.0;
        return phip;
    }

    @Override
    public Point direct(Point p) {
        Point np = rotation().celestialToNative(p);
        if (!np.isFinite()) return null;
        return finiteOrNull(project(np));
    }

    @Override
    public Point inverse(Point p) {
        Point np = unproject(p);
        if (np == null || !np.isFinite()) return null;
        return finiteOrNull(rotation().nativeToCelestial(np));
    }

    @Override
    public boolean checkBrokenLine(Point cp1, Point cp2) {
        if (cp1 == null || cp2 == null) return false;
        Point np1 = rotation().celestialToNative(cp1);
        Point np2 = rotation().celestialToNative(cp2);
        return DegreeMath.distanceFast(np1, np2) < 150.0;
    }

    /**
     * Seam test for projections whose native frame is cut along phi = 180:
     * true when the segment does not wrap round the cut.
     */
    protected boolean withinSeam(Point cp1, Point cp2) {
        if (cp1 == null || cp2 == null) return false;
        Point np1 = rotation().celestialToNative(cp1);
        Point np2 = rotation().celestialToNative(cp2);
        return Math.abs(np1.x() - np2.x()) < 180.0;
    }

    @Override
    public WCSKeywords getWcs() {
        return wcs;
    }

    /** The rotation fixed at initialisation. */
    public SphericalRotation getRotation() {
        return sph;
    }

    protected SphericalRotation rotation() {
        if (sph == null) {
            throw new IllegalStateException(identifier + " projection has not been initialised");
        }
        return sph;
    }

    static Point finiteOrNull(Point p) {
        return p != null && p.isFinite() ? p : null;
    }

    @Override
    public String projCode() {
        return projCode;
    }

    @Override
    public String identifier() {
        return identifier;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public double phi0() {
        return phi0;
    }

    @Override
    public double theta0() {
        return theta0;
    }

    @Override
    public String toString() {
        return identifier + "[" + projCode + ", crval=(" + Math.toDegrees(ra0) + ", "
                + Math.toDegrees(dec0) + ")]";
    }
}
