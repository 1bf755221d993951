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

/** Stereographic projection (STG). Conformal; defined everywhere but the antipode. */
public final class StereographicProjection extends AbstractProjection {
    private final ZenithalRadius radius = ZenithalRadius.STEREOGRAPHIC;

    public StereographicProjection() {
        super("STG", "Stereographic", "Stereographic", 0.0, 90.0);
    }

    @Override
    public Point project(Point np) {
        return radius.project(np);
    }

    @Override
    public Point unproject(Point p) {
        return radius.unproject(p);
    }

    /** No discontinuity: every segment is drawn. */
    @Override
    public boolean checkBrokenLine(Point cp1, Point cp2) {
        return true;
    }
}
