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
 * Trigonometry in degrees.
 *
 * <p>Sine and cosine return exact results at multiples of 90 degrees and the
 * tangent at multiples of 45 degrees, so that degenerate rotations and
 * reference points on the axes are detected by plain equality tests.</p>
 */
final class DegreeMath {
    static final double DEG = 180.0 / Math.PI;
    static final double RAD = Math.PI / 180.0;

    private DegreeMath() {}

    static double sin(double deg) {
        if (deg % 90.0 == 0.0) {
            switch (quadrant(deg)) {
                case 1: return deg > 0.0 ? 1.0 : -1.0;
                case 3: return deg > 0.0 ? -1.0 : 1.0;
                default: return 0.0;
            }
        }
        return Math.sin(deg * RAD);
    }

    static double cos(double deg) {
        if (deg % 90.0 == 0.0) {
            switch (quadrant(deg)) {
                case 0: return 1.0;
                case 2: return -1.0;
                default: return 0.0;
            }
        }
        return Math.cos(deg * RAD);
    }

    static double tan(double deg) {
        double resid = deg % 360.0;
        if (resid == 0.0 || Math.abs(resid) == 180.0) return 0.0;
        if (resid == 45.0 || resid == 225.0 || resid == -135.0 || resid == -315.0) return 1.0;
        if (resid == 135.0 || resid == 315.0 || resid == -45.0 || resid == -225.0) return -1.0;
        return Math.tan(deg * RAD);
    }

    static double asin(double v) {
        return Math.asin(v) * DEG;
    }

    static double acos(double v) {
        return Math.acos(v) * DEG;
    }

    static double atan(double v) {
        return Math.atan(v) * DEG;
    }

    static double atan2(double y, double x) {
        return Math.atan2(y, x) * DEG;
    }

    /** Wrap {@code x} into {@code [min, max)} by whole turns. */
    static double adjust360(double x, double min, double max) {
        if (!Double.isFinite(x)) return x;
        while (x >= max) x -= 360.0;
        while (x < min) x += 360.0;
        return x;
    }

    /**
     * Angular distance in degrees between two spherical points given as
     * (longitude, latitude) degrees, by the spherical law of cosines. Less
     * accurate than the haversine form for tiny separations but cheap enough
     * for graticule checks.
     */
    static double distanceFast(Point p1, Point p2) {
        double cosX = cos(Math.abs(p1.x() - p2.x()));
        double k = sin(p1.y()) * sin(p2.y()) + cos(p1.y()) * cos(p2.y()) * cosX;
        return acos(Math.max(-1.0, Math.min(1.0, k)));
    }

    private static int quadrant(double deg) {
        return (int) (Math.abs(Math.floor(deg / 90.0 + 0.5)) % 4);
    }
}
