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
 * A map projection between celestial coordinates and a projection plane.
 *
 * <p>All angles are degrees. {@link #direct} and {@link #inverse} return
 * {@code null} rather than throwing when a point lies outside the projection's
 * domain (hidden hemisphere, outside the boundary ellipse and so on), so that
 * plotting and gridding loops can skip such points cheaply.</p>
 *
 * <p>Implementations are immutable once initialised and may be queried
 * concurrently.</p>
 */
public interface Projection {

    /** Three letter FITS projection code, e.g. {@code TAN}. */
    String projCode();

    /** Stable identifier, e.g. {@code Gnomonic}. */
    String identifier();

    /** Human readable name. */
    String name();

    /** Native longitude of the fiducial point (degrees). */
    double phi0();

    /** Native latitude of the fiducial point (degrees). */
    double theta0();

    /**
     * Project a celestial point {@code (ra, dec)} onto the plane.
     *
     * @return the plane point, or null if the point cannot be projected
     */
    Point direct(Point celestial);

    /**
     * Map a plane point back to celestial {@code (ra, dec)}.
     *
     * @return the celestial point, or null if the plane point is outside the
     *         projection's boundary
     */
    Point inverse(Point plane);

    /**
     * Decide whether the graticule segment between two celestial points can be
     * drawn as one continuous line.
     *
     * @return true to draw the segment, false when it crosses a discontinuity
     *         of the projection or either end is missing
     */
    boolean checkBrokenLine(Point cp1, Point cp2);

    /** The WCS keywords describing this projection. */
    WCSKeywords getWcs();
}
