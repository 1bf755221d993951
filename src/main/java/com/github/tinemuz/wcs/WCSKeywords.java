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

import java.util.Locale;

/**
 * The subset of FITS WCS keywords a projection reads and writes.
 *
 * <p>Optional keywords are {@code null} when absent. {@code ctype1}/{@code ctype2}
 * keep the FITS quoting, e.g. {@code 'RA---TAN'}.</p>
 *
 * @param ctype1  CTYPE1, axis type and projection code of the longitude axis
 * @param ctype2  CTYPE2, axis type and projection code of the latitude axis
 * @param crval1  CRVAL1, celestial longitude of the reference point (degrees)
 * @param crval2  CRVAL2, celestial latitude of the reference point (degrees)
 * @param pv1_1   PV1_1, native longitude of the fiducial point (phi0), or null
 * @param pv1_2   PV1_2, native latitude of the fiducial point (theta0), or null
 * @param lonpole LONPOLE, native longitude of the celestial pole (phip), or null
 * @param latpole LATPOLE, celestial latitude of the native pole hint, or null (90)
 * @param pv2_1   PV2_1, first SIN slant parameter, or null
 * @param pv2_2   PV2_2, second SIN slant parameter, or null
 */
@SuppressWarnings("squid:S116")
public record WCSKeywords(
        String ctype1,
        String ctype2,
        double crval1,
        double crval2,
        Double pv1_1,
        Double pv1_2,
        Double lonpole,
        Double latpole,
        Double pv2_1,
        Double pv2_2) {

    /** Keywords for a projection code and reference point, all optional keywords absent. */
    public static WCSKeywords of(String projCode, double crval1, double crval2) {
        return builder().projection(projCode).crval(crval1, crval2).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** A builder pre-filled with this record's values. */
    public Builder toBuilder() {
        Builder b = new Builder();
        b.ctype1 = ctype1;
        b.ctype2 = ctype2;
        b.crval1 = crval1;
        b.crval2 = crval2;
        b.pv1_1 = pv1_1;
        b.pv1_2 = pv1_2;
        b.lonpole = lonpole;
        b.latpole = latpole;
        b.pv2_1 = pv2_1;
        b.pv2_2 = pv2_2;
        return b;
    }

    /**
     * The three letter projection code carried by CTYPE1, e.g. {@code TAN} for
     * {@code 'RA---TAN'} or {@code 'RA---TAN-SIP'}, or null when CTYPE1 is
     * absent or too short to carry one. The code occupies characters 6 to 8.
     */
    public String projectionCode() {
        if (ctype1 == null) return null;
        String s = ctype1.replace("'", "").trim();
        if (s.length() < 8) return null;
        String code = s.substring(5, 8).replace('-', ' ').trim();
        return code.isEmpty() ? null : code.toUpperCase(Locale.ROOT);
    }

    /** Mutable builder for {@link WCSKeywords}. */
    @SuppressWarnings("squid:S116")
    public static final class Builder {
        private String ctype1;
        private String ctype2;
        private double crval1;
        private double crval2;
        private Double pv1_1;
        private Double pv1_2;
        private Double lonpole;
        private Double latpole;
        private Double pv2_1;
        private Double pv2_2;

        private Builder() {}

        /** Sets CTYPE1/CTYPE2 to {@code 'RA---code'} and {@code 'DEC--code'}. */
        public Builder projection(String projCode) {
            this.ctype1 = "'RA---" + projCode + "'";
            this.ctype2 = "'DEC--" + projCode + "'";
            return this;
        }

        public Builder ctype(String ctype1, String ctype2) {
            this.ctype1 = ctype1;
            this.ctype2 = ctype2;
            return this;
        }

        public Builder crval(double crval1, double crval2) {
            this.crval1 = crval1;
            this.crval2 = crval2;
            return this;
        }

        public Builder pv1_1(Double phi0) {
            this.pv1_1 = phi0;
            return this;
        }

        public Builder pv1_2(Double theta0) {
            this.pv1_2 = theta0;
            return this;
        }

        public Builder lonpole(Double lonpole) {
            this.lonpole = lonpole;
            return this;
        }

        public Builder latpole(Double latpole) {
            this.latpole = latpole;
            return this;
        }

        public Builder slant(Double pv2_1, Double pv2_2) {
            this.pv2_1 = pv2_1;
            this.pv2_2 = pv2_2;
            return this;
        }

        public WCSKeywords build() {
            return new WCSKeywords(
                    ctype1, ctype2, crval1, crval2, pv1_1, pv1_2, lonpole, latpole, pv2_1, pv2_2);
        }
    }
}
