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

import static com.github.tinemuz.wcs.DegreeMath.atan;
import static com.github.tinemuz.wcs.DegreeMath.tan;

/** Mercator projection (MER). The native poles have no image. */
public final class MercatorProjection extends AbstractProjection {
    private final double r0 = DegreeMath.DEG;
    private final double x0 = 0.0;
    private final double y0 = 0.0;

    public MercatorProjection() {
        super("MER", "Mercator", "Mercator", 0.0, 0.0);
    }

    @Override
    public Point project(Point np) {
        if (Math.abs(np.y()) >= 90.0) return null;
        return new Point(np.x() - x0, r0 * Math.log(tan((np.y() + 90.0) / 2.0)) - y0);
    }

    @Override
    public Point unproject(Point p) {
        double theta = 2.0 * atan(Math.exp((p.y() + y0) / r0)) - 90.0;
        return new Point(p.x() + x0, theta);
    }

    /** Broken across the phi = 180 seam or when an end sits on a native pole. */
    @Override
    public boolean checkBrokenLine(Point cp1, Point cp2) {
        if (!withinSeam(cp1, cp2)) return false;
        double t1 = rotation().celestialToNative(cp1).y();
        double t2 = rotation().celestialToNative(cp2).y();
        return Math.abs(t1) < 90.0 && Math.abs(t2) < 90.0;
    }
}
