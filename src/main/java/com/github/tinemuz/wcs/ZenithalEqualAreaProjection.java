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

/** Zenithal equal area projection (ZEA). */
public final class ZenithalEqualAreaProjection extends AbstractProjection {
    private final ZenithalRadius radius = ZenithalRadius.EQUAL_AREA;

    public ZenithalEqualAreaProjection() {
        super("ZEA", "ZenithalEqualArea", "Zenithal Equal Area", 0.0, 90.0);
    }

    @Override
    public Point project(Point np) {
        return radius.project(np);
    }

    /** Null beyond the antipode of the native pole (R > 360/pi). */
    @Override
    public Point unproject(Point p) {
        return radius.unproject(p);
    }

    /**
     * The whole native sphere is mapped, but segments get stretched towards the
     * antipode; the allowed longitude span shrinks with the mean native latitude.
     */
    @Override
    public boolean checkBrokenLine(Point cp1, Point cp2) {
        if (cp1 == null || cp2 == null) return false;
        Point np1 = rotation().celestialToNative(cp1);
        Point np2 = rotation().celestialToNative(cp2);
        double y = (np1.y() + np2.y()) / 2.0;
        double dx = np1.x() - np2.x();
        double dist = Math.min(Math.abs(dx - 360.0) % 360.0, Math.abs(dx + 360.0) % 360.0);
        return dist < DegreeMath.sin(45.0 + y / 2.0) * 180.0;
    }
}
