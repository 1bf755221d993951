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

import static com.github.tinemuz.wcs.DegreeMath.asin;
import static com.github.tinemuz.wcs.DegreeMath.atan2;
import static com.github.tinemuz.wcs.DegreeMath.cos;
import static com.github.tinemuz.wcs.DegreeMath.sin;

/** Hammer-Aitoff equal area projection (AIT). The whole sphere fits in a 2:1 ellipse. */
public final class HammerAitoffProjection extends AbstractProjection {
    private static final double Z_MIN = 1.0 / Math.sqrt(2.0);

    public HammerAitoffProjection() {
        super("AIT", "HammerAitoff", "Hammer-Aitoff", 0.0, 0.0);
    }

    @Override
    public Point project(Point np) {
        double cosTheta = cos(np.y());
        double gamma = DegreeMath.DEG * Math.sqrt(2.0 / (1.0 + cosTheta * cos(np.x() / 2.0)));
        return new Point(2.0 * gamma * cosTheta * sin(np.x() / 2.0), gamma * sin(np.y()));
    }

    /** Null outside the boundary ellipse. */
    @Override
    public Point unproject(Point p) {
        double x = Math.PI * p.x() / 720.0;
        double y = Math.PI * p.y() / 360.0;
        double z = Math.sqrt(1.0 - x * x - y * y);
        if (!(z >= Z_MIN)) return null;
        return new Point(2.0 * atan2(2.0 * z * x, 2.0 * z * z - 1.0), asin(DegreeMath.RAD * p.y() * z));
    }

    @Override
    public boolean checkBrokenLine(Point cp1, Point cp2) {
        return withinSeam(cp1, cp2);
    }
}
