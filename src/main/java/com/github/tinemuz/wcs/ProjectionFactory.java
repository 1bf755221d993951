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

import com.github.tinemuz.wcs.WcsConfigurationException.Reason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds projections from host settings or from WCS keywords.
 */
public final class ProjectionFactory {
    private static final Logger log = LoggerFactory.getLogger(ProjectionFactory.class);

    private ProjectionFactory() {}

    /**
     * Build the configured projection centred on the configured origin, or on
     * {@code (ra, dec)} when the settings do not name an explicit origin.
     *
     * @param config projection settings
     * @param ra     fallback origin right ascension (degrees), usually the image centre
     * @param dec    fallback origin declination (degrees)
     * @return an initialised projection
     * @throws WcsConfigurationException if no rotation matches the origin
     */
    public static Projection create(ProjectionConfig config, double ra, double dec) {
        Point origin = config.origin(ra, dec);
        Projection projection = switch (config.projection()) {
            case TAN -> new GnomonicProjection(DegreeMath.DEG, origin.x(), origin.y());
            case STG -> new StereographicProjection().initFromRefpoint(origin.x(), origin.y());
            case CAR -> new PlateCarreeProjection().initFromRefpoint(origin.x(), origin.y());
            case MER -> new MercatorProjection().initFromRefpoint(origin.x(), origin.y());
            case AIT -> new HammerAitoffProjection().initFromRefpoint(origin.x(), origin.y());
            case ZEA -> new ZenithalEqualAreaProjection().initFromRefpoint(origin.x(), origin.y());
            case SIN -> new OrthographicProjection().initFromRefpoint(origin.x(), origin.y());
        };
        log.debug("Created {} projection at ({}, {})", projection.identifier(), origin.x(), origin.y());
        return projection;
    }

    /**
     * Build the projection described by WCS keywords, as read from an image
     * header. The projection is taken from the code in CTYPE1.
     *
     * @throws WcsConfigurationException if the code is unknown or the keywords
     *         are inconsistent
     * @throws UnsupportedOperationException for slant orthographic keywords
     */
    public static Projection fromWcs(WCSKeywords wcs) {
        String code = wcs.projectionCode();
        if (code == null) {
            log.error("No projection code in CTYPE1 {}", wcs.ctype1());
            throw new WcsConfigurationException(
                    Reason.UNKNOWN_PROJECTION, "Invalid projection code: CTYPE1=" + wcs.ctype1());
        }
        Projection projection = switch (ProjectionCode.fromFitsCode(code)) {
            case TAN -> new GnomonicProjection(DegreeMath.DEG, wcs.crval1(), wcs.crval2());
            case STG -> new StereographicProjection().initFromWcs(wcs);
            case CAR -> new PlateCarreeProjection().initFromWcs(wcs);
            case MER -> new MercatorProjection().initFromWcs(wcs);
            case AIT -> new HammerAitoffProjection().initFromWcs(wcs);
            case ZEA -> new ZenithalEqualAreaProjection().initFromWcs(wcs);
            case SIN -> new OrthographicProjection().initFromWcs(wcs);
        };
        log.debug("Created {} projection from WCS keywords", projection.identifier());
        return projection;
    }
}
