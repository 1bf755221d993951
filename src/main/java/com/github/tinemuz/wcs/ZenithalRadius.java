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
import static com.github.tinemuz.wcs.DegreeMath.atan;
import static com.github.tinemuz.wcs.DegreeMath.atan2;
import static com.github.tinemuz.wcs.DegreeMath.cos;
import static com.github.tinemuz.wcs.DegreeMath.sin;
import static com.github.tinemuz.wcs.DegreeMath.tan;

/**
 * Radial law of a zenithal projection, R(theta) and its inverse.
 *
 * <p>Zenithal projections place the native pole at the plane origin and map a
 * native point to {@code (R sin(phi), -R cos(phi))}; only R differs between
 * them, so the projections hold one of these constants instead of sharing a
 * base class.</p>
 */
enum ZenithalRadius {
    /** R = (360/pi) sin((90 - theta)/2). */
    EQUAL_AREA {
        @Override
        double radius(double theta) {
            return 360.0 / Math.PI * sin((90.0 - theta) / 2.0);
        }

        @Override
        double theta(double r) {
            return 90.0 - 2.0 * asin(Math.PI / 360.0 * r);
        }
    },
    /** R = (360/pi) tan((90 - theta)/2). */
    STEREOGRAPHIC {
        @Override
        double radius(double theta) {
            return 360.0 / Math.PI * tan((90.0 - theta) / 2.0);
        }

        @Override
        double theta(double r) {
            return 90.0 - 2.0 * atan(Math.PI / 360.0 * r);
        }
    };

    abstract double radius(double theta);

    /** Native latitude for plane radius {@code r}; NaN outside the projection. */
    abstract double theta(double r);

    Point project(Point np) {
        double r = radius(np.y());
        return new Point(r * sin(np.x()), -r * cos(np.x()));
    }

    Point unproject(Point p) {
        double r = Math.sqrt(p.x() * p.x() + p.y() * p.y());
        double theta = theta(r);
        if (Double.isNaN(theta)) return null;
        return new Point(atan2(p.x(), -p.y()), theta);
    }
}
