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

import java.util.Arrays;

/**
 * Raised once, while a projection is being built, when the WCS keywords or the
 * projection configuration cannot describe a valid projection.
 *
 * <p>Per-point domain failures are not reported this way; {@code direct} and
 * {@code inverse} return {@code null} for those.</p>
 */
public class WcsConfigurationException extends IllegalArgumentException {
    private static final long serialVersionUID = 1L;

    /** Machine readable cause of the failure. */
    public enum Reason {
        /** |theta0| (PV1_2) exceeds 90 degrees beyond tolerance. */
        THETA0_OUT_OF_RANGE,
        /** |lat0| cannot be reached for the given phip, phi0 and theta0. */
        LATITUDE_UNREACHABLE,
        /** Both atan2 arguments vanished while solving for the pole longitude. */
        DEGENERATE_ROTATION,
        /** Projection code or legacy id not recognised. */
        UNKNOWN_PROJECTION,
        /** Malformed configuration value. */
        INVALID_CONFIGURATION
    }

    private final Reason reason;
    private final double[] values;

    public WcsConfigurationException(Reason reason, String message, double... values) {
        super(message);
        this.reason = reason;
        this.values = values.clone();
    }

    public WcsConfigurationException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
        this.values = new double[0];
    }

    public Reason getReason() {
        return reason;
    }

    /** The numeric inputs that were rejected, in the order documented by the thrower. */
    public double[] getValues() {
        return values.clone();
    }

    @Override
    public String toString() {
        return super.toString() + " [" + reason + (values.length > 0 ? " " + Arrays.toString(values) : "") + "]";
    }
}
