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
import static com.github.tinemuz.wcs.DegreeMath.asin;
import static com.github.tinemuz.wcs.DegreeMath.atan2;
import static com.github.tinemuz.wcs.DegreeMath.cos;
import static com.github.tinemuz.wcs.DegreeMath.sin;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Orthographic projection (SIN) without slant: the visible native hemisphere
 * seen from infinity. Slant variants (non-zero PV2_1/PV2_2) are not supported.
 */
public final class OrthographicProjection extends AbstractProjection {
    private static final Logger log = LoggerFactory.getLogger(OrthographicProjection.class);

    private final double r0 = DegreeMath.DEG;
    private final double x0 = 0.0;
    private final double y0 = 0.0;

    public OrthographicProjection() {
        super("SIN", "Orthographic", "Orthographic", 0.0, 90.0);
    }

    /**
     * @throws UnsupportedOperationException if the keywords describe a slant
     *         orthographic projection
     */
    @Override
    public AbstractProjection initFromWcs(WCSKeywords wcs) {
        if (isNonZero(wcs.pv2_1()) || isNonZero(wcs.pv2_2())) {
            log.error("Slant orthographic projection requested (PV2_1={}, PV2_2={})",
                    wcs.pv2_1(), wcs.pv2_2());
            throw new UnsupportedOperationException("Unsupported Slant Orthographic projection");
        }
        return super.initFromWcs(wcs);
    }

    private static boolean isNonZero(Double v) {
        return v != null && v != 0.0;
    }

    /** Null on the far hemisphere (theta below 0). */
    @Override
    public Point project(Point np) {
        if (np.y() < 0.0 || np.y() > 180.0) return null;
        double t = (90.0 - Math.abs(np.y())) * DegreeMath.RAD;
        // cos(theta) ~ t close to the pole, avoiding cancellation
        double costhe = t < 1e-5 ? t : cos(np.y());
        double r = r0 * costhe;
        return new Point(r * sin(np.x()) - x0, -r * cos(np.x()) - y0);
    }

    /** Null outside the unit circle (r squared above 1). */
    @Override
    public Point unproject(Point p) {
        double x = (p.x() + x0) / r0;
        double y = (p.y() + y0) / r0;
        double r2 = x * x + y * y;
        if (r2 > 1.0) return null;
        double phi = r2 != 0.0 ? atan2(x, -y) : 0.0;
        double theta = r2 < 0.5 ? acos(Math.sqrt(r2)) : asin(Math.sqrt(1.0 - r2));
        return new Point(phi, theta);
    }
}
