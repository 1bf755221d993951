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

import static com.github.tinemuz.wcs.DegreeMath.acos;
import static com.github.tinemuz.wcs.DegreeMath.adjust360;
import static com.github.tinemuz.wcs.DegreeMath.asin;
import static com.github.tinemuz.wcs.DegreeMath.atan2;
import static com.github.tinemuz.wcs.DegreeMath.cos;
import static com.github.tinemuz.wcs.DegreeMath.sin;

import com.github.tinemuz.wcs.WcsConfigurationException.Reason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rotation between the native spherical frame of a projection and the
 * celestial frame (WCS Paper II, section 2.3).
 *
 * <p>The constructor solves for the celestial coordinates of the native pole
 * {@code (alphaP, 90 - deltaP)} from the reference point, the fiducial point and
 * the native longitude of the celestial pole. The branch structure and the
 * 1e-5 tolerances follow the WCSLIB closed-form solution; near-degenerate
 * keyword sets rely on them, so they are kept as published.</p>
 *
 * <p>Instances are immutable and safe to share between threads.</p>
 */
public final class SphericalRotation {
    private static final Logger log = LoggerFactory.getLogger(SphericalRotation.class);

    static final double TOLERANCE = 1e-5;

    private final double latpole;
    private final double alphaP;
    private final double deltaP;
    private final double phiP;
    private final double cosdeltaP;
    private final double sindeltaP;

    /**
     * Solve the rotation.
     *
     * @param lng0    celestial longitude of the fiducial point (CRVAL1, degrees)
     * @param lat0    celestial latitude of the fiducial point (CRVAL2, degrees)
     * @param phi0    native longitude of the fiducial point (degrees)
     * @param theta0  native latitude of the fiducial point (degrees)
     * @param phip    native longitude of the celestial pole (LONPOLE, degrees)
     * @param latpole hint selecting between the two pole latitudes (LATPOLE),
     *                null for the default of 90
     * @throws WcsConfigurationException if no rotation satisfies the inputs
     */
    public SphericalRotation(
            double lng0, double lat0, double phi0, double theta0, double phip, Double latpole) {
        int latpreq = 0;
        double lngp;
        double latp = latpole == null ? 90.0 : latpole;

        if (theta0 == 90.0) {
            // Fiducial point at the native pole
            lngp = lng0;
            latp = lat0;
        } else {
            double slat0 = sin(lat0);
            double clat0 = cos(lat0);
            double sthe0 = sin(theta0);
            double cthe0 = cos(theta0);

            double sphip;
            double cphip;
            double u = 0.0;
            double v = 0.0;
            if (phip == phi0) {
                sphip = 0.0;
                cphip = 1.0;
                u = theta0;
                v = 90.0 - lat0;
            } else {
                sphip = sin(phip - phi0);
                cphip = cos(phip - phi0);

                double x = cthe0 * cphip;
                double y = sthe0;
                double z = Math.sqrt(x * x + y * y);
                if (z == 0.0) {
                    // |phip - phi0| = 90 and theta0 = 0 require lat0 = 0
                    if (slat0 != 0.0) {
                        throw unreachable(lng0, lat0, phi0, theta0, phip);
                    }
                    // latp determined by LATPOLE alone
                    latpreq = 2;
                    if (latp > 90.0) latp = 90.0;
                    else if (latp < -90.0) latp = -90.0;
                } else {
                    double slz = slat0 / z;
                    if (Math.abs(slz) > 1.0) {
                        if ((Math.abs(slz) - 1.0) < TOLERANCE) {
                            slz = slz > 0.0 ? 1.0 : -1.0;
                        } else {
                            throw unreachable(lng0, lat0, phi0, theta0, phip);
                        }
                    }
                    u = atan2(y, x);
                    v = acos(slz);
                }
            }

            if (latpreq == 0) {
                double latp1 = u + v;
                if (latp1 > 180.0) latp1 -= 360.0;
                else if (latp1 < -180.0) latp1 += 360.0;

                double latp2 = u - v;
                if (latp2 > 180.0) latp2 -= 360.0;
                else if (latp2 < -180.0) latp2 += 360.0;

                if (Math.abs(latp1) < 90.0 + TOLERANCE && Math.abs(latp2) < 90.0 + TOLERANCE) {
                    latpreq = 1;
                    log.debug("Two pole latitudes {} and {}; LATPOLE {} selects", latp1, latp2, latp);
                }

                if (Math.abs(latp - latp1) < Math.abs(latp - latp2)) {
                    latp = Math.abs(latp1) < 90.0 + TOLERANCE ? latp1 : latp2;
                } else {
                    latp = Math.abs(latp2) < 90.0 + TOLERANCE ? latp2 : latp1;
                }

                // Rounding errors
                if (Math.abs(latp) < 90.0 + TOLERANCE) {
                    if (latp > 90.0) latp = 90.0;
                    else if (latp < -90.0) latp = -90.0;
                }
            }

            double z = cos(latp) * clat0;
            if (Math.abs(z) < TOLERANCE) {
                if (Math.abs(clat0) < TOLERANCE) {
                    // Celestial pole at the fiducial point
                    lngp = lng0;
                } else if (latp > 0.0) {
                    // Celestial north pole at the native pole
                    lngp = lng0 + phip - phi0 - 180.0;
                } else {
                    // Celestial south pole at the native pole
                    lngp = lng0 - phip + phi0;
                }
            } else {
                double x = (sthe0 - sin(latp) * slat0) / z;
                double y = sphip * cthe0 / clat0;
                if (x == 0.0 && y == 0.0) {
                    log.error("Degenerate rotation for CRVAL ({}, {}), phi0 {}, theta0 {}, phip {}",
                            lng0, lat0, phi0, theta0, phip);
                    throw new WcsConfigurationException(
                            Reason.DEGENERATE_ROTATION,
                            "Invalid WCS coordinates: internal error",
                            lng0, lat0, phi0, theta0, phip);
                }
                lngp = lng0 - atan2(y, x);
            }

            // Same sign as the longitude of the fiducial point
            if (lng0 >= 0.0) {
                if (lngp < 0.0) lngp += 360.0;
                else if (lngp > 360.0) lngp -= 360.0;
            } else {
                if (lngp > 0.0) lngp -= 360.0;
                else if (lngp < -360.0) lngp += 360.0;
            }
        }

        this.latpole = latp;
        this.alphaP = lngp;
        this.deltaP = 90.0 - latp;
        this.phiP = phip;
        this.cosdeltaP = cos(deltaP);
        this.sindeltaP = sin(deltaP);
    }

    private static WcsConfigurationException unreachable(
            double lng0, double lat0, double phi0, double theta0, double phip) {
        log.error("Latitude {} unreachable for phip {}, phi0 {}, theta0 {}", lat0, phip, phi0, theta0);
        return new WcsConfigurationException(
                Reason.LATITUDE_UNREACHABLE,
                "Invalid WCS coordinates: |lat0| exceeds the bound for phip, phi0 and theta0",
                lat0, phip, phi0, theta0, lng0);
    }

    /** Celestial latitude of the native pole (degrees). */
    public double latpole() {
        return latpole;
    }

    /** Celestial longitude of the native pole (degrees). */
    public double alphaP() {
        return alphaP;
    }

    /** Celestial colatitude of the native pole (degrees). */
    public double deltaP() {
        return deltaP;
    }

    /** Native longitude of the celestial pole (degrees). */
    public double phiP() {
        return phiP;
    }

    /**
     * Rotate native spherical coordinates {@code (phi, theta)} to celestial
     * {@code (ra, dec)}. The longitude is returned with the sign of alphaP,
     * within (-360, 360).
     */
    public Point nativeToCelestial(Point np) {
        double lng;
        double lat;
        if (sindeltaP == 0.0) {
            if (deltaP == 0.0) {
                lng = np.x() + adjust360(alphaP + 180.0 - phiP, 0.0, 360.0);
                lat = np.y();
            } else {
                lng = adjust360(alphaP + phiP, 0.0, 360.0) - np.x();
                lat = -np.y();
            }
        } else {
            double sinthe = sin(np.y());
            double costhe = cos(np.y());
            double costhe3 = costhe * cosdeltaP;

            double dphi = np.x() - phiP;
            double cosphi = cos(dphi);

            // Celestial longitude
            double x = sinthe * sindeltaP - costhe3 * cosphi;
            if (Math.abs(x) < TOLERANCE) {
                x = -cos(np.y() + deltaP) + costhe3 * (1.0 - cosphi);
            }
            double y = -costhe * sin(dphi);
            double dlng;
            if (Math.abs(x) > TOLERANCE || Math.abs(y) > TOLERANCE) {
                dlng = atan2(y, x);
            } else {
                // Change of origin of longitude
                dlng = deltaP < 90.0 ? dphi + 180.0 : -dphi;
            }
            lng = alphaP + dlng;

            // Celestial latitude
            if (dphi % 180.0 == 0.0) {
                lat = np.y() + cosphi * deltaP;
                if (lat > 90.0) lat = 180.0 - lat;
                if (lat < -90.0) lat = -180.0 - lat;
            } else {
                double z = sinthe * cosdeltaP + costhe * sindeltaP * cosphi;
                if (Math.abs(z) > 0.99) {
                    lat = acos(Math.sqrt(x * x + y * y));
                    if (lat * z < 0.0) lat = -lat;
                } else {
                    lat = asin(z);
                }
            }
        }

        if (alphaP >= 0.0) {
            if (lng < 0.0) lng += 360.0;
        } else {
            if (lng > 0.0) lng -= 360.0;
        }
        return new Point(adjust360(lng, -360.0, 360.0), lat);
    }

    /**
     * Rotate celestial {@code (ra, dec)} to native spherical coordinates
     * {@code (phi, theta)}. The native longitude is returned in [-180, 180).
     */
    public Point celestialToNative(Point cp) {
        double phi;
        double theta;
        if (sindeltaP == 0.0) {
            if (deltaP == 0.0) {
                double dphi = adjust360(phiP - 180.0 - alphaP, 0.0, 360.0);
                phi = adjust360(cp.x() + dphi, -180.0, 180.0);
                theta = cp.y();
            } else {
                double dphi = adjust360(phiP + alphaP, 0.0, 360.0);
                phi = adjust360(dphi - cp.x(), -180.0, 180.0);
                theta = -cp.y();
            }
        } else {
            double sinlat = sin(cp.y());
            double coslat = cos(cp.y());
            double coslat3 = coslat * cosdeltaP;

            double dlng = cp.x() - alphaP;
            double coslng = cos(dlng);

            // Native longitude
            double x = sinlat * sindeltaP - coslat3 * coslng;
            if (Math.abs(x) < TOLERANCE) {
                x = -cos(cp.y() + deltaP) + coslat3 * (1.0 - coslng);
            }
            double y = -coslat * sin(dlng);
            double dphi;
            if (x != 0.0 || y != 0.0) {
                dphi = atan2(y, x);
            } else {
                dphi = deltaP < 90.0 ? dlng - 180.0 : -dlng;
            }
            phi = adjust360(phiP + dphi, -180.0, 180.0);

            // Native latitude
            if (dlng % 180.0 == 0.0) {
                theta = cp.y() + coslng * deltaP;
                if (theta > 90.0) theta = 180.0 - theta;
                if (theta < -90.0) theta = -180.0 - theta;
            } else {
                double z = sinlat * cosdeltaP + coslat * sindeltaP * coslng;
                if (Math.abs(z) > 0.99) {
                    theta = acos(Math.sqrt(x * x + y * y));
                    if (theta * z < 0.0) theta = -theta;
                } else {
                    theta = asin(z);
                }
            }
        }
        return new Point(phi, theta);
    }
}
