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
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.Properties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Projection settings as stored by the host application.
 *
 * <p>Property keys: {@code projection} (code or legacy id),
 * {@code projectionOriginMode} (0 uses the coordinates passed to the factory,
 * 1 uses the explicit origin), {@code projectionOriginRA} and
 * {@code projectionOriginDec} (degrees).</p>
 *
 * @param projection the projection to build
 * @param originMode where the projection origin comes from
 * @param originRa   explicit origin right ascension (degrees)
 * @param originDec  explicit origin declination (degrees)
 */
public record ProjectionConfig(
        ProjectionCode projection, OriginMode originMode, double originRa, double originDec) {
    private static final Logger log = LoggerFactory.getLogger(ProjectionConfig.class);

    /** Classpath resource read by {@link #loadDefault()}. */
    public static final String DEFAULT_RESOURCE = "projection.properties";

    public static final String KEY_PROJECTION = "projection";
    public static final String KEY_ORIGIN_MODE = "projectionOriginMode";
    public static final String KEY_ORIGIN_RA = "projectionOriginRA";
    public static final String KEY_ORIGIN_DEC = "projectionOriginDec";

    /** Origin of the projection. */
    public enum OriginMode {
        /** Use the coordinates supplied with the request, typically the image centre. */
        SUPPLIED,
        /** Use {@code originRa}/{@code originDec}. */
        EXPLICIT;

        /** Legacy numeric mode: 1 is explicit, anything else uses the supplied point. */
        public static OriginMode fromId(int id) {
            return id == 1 ? EXPLICIT : SUPPLIED;
        }
    }

    public ProjectionConfig {
        if (projection == null) {
            log.error("Projection settings name no projection");
            throw new WcsConfigurationException(Reason.INVALID_CONFIGURATION, "projection is required");
        }
        if (!Double.isFinite(originRa) || !Double.isFinite(originDec)) {
            log.error("Projection origin ({}, {}) is not finite", originRa, originDec);
            throw new WcsConfigurationException(
                    Reason.INVALID_CONFIGURATION, "Projection origin must be finite", originRa, originDec);
        }
        if (originMode == null) originMode = OriginMode.SUPPLIED;
    }

    /** Settings that centre the projection on the supplied coordinates. */
    public static ProjectionConfig of(ProjectionCode projection) {
        return new ProjectionConfig(projection, OriginMode.SUPPLIED, 0.0, 0.0);
    }

    /** Settings with an explicit origin. */
    public static ProjectionConfig withOrigin(ProjectionCode projection, double ra, double dec) {
        return new ProjectionConfig(projection, OriginMode.EXPLICIT, ra, dec);
    }

    /**
     * Read settings from properties. Missing origin keys default to 0; a
     * missing projection defaults to TAN.
     *
     * @throws WcsConfigurationException if a value is malformed
     */
    public static ProjectionConfig fromProperties(Properties props) {
        ProjectionCode code = ProjectionCode.resolve(props.getProperty(KEY_PROJECTION, "TAN"));
        int mode = integer(props, KEY_ORIGIN_MODE);
        return new ProjectionConfig(
                code, OriginMode.fromId(mode), number(props, KEY_ORIGIN_RA), number(props, KEY_ORIGIN_DEC));
    }

    /** Load {@link #DEFAULT_RESOURCE} from the classpath. */
    public static ProjectionConfig loadDefault() {
        return loadFromResource(DEFAULT_RESOURCE);
    }

    /**
     * Load settings from a properties resource on the classpath.
     *
     * @throws IllegalStateException if the resource is missing or unreadable
     */
    public static ProjectionConfig loadFromResource(String resource) {
        InputStream in = ProjectionConfig.class.getClassLoader().getResourceAsStream(resource);
        if (in == null) {
            log.error("Projection settings '{}' not found on classpath", resource);
            throw new IllegalStateException(
                    "Projection settings '" + resource + "' not found on classpath");
        }
        try (Reader r = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            Properties props = new Properties();
            props.load(r);
            ProjectionConfig config = fromProperties(props);
            log.debug("Loaded projection settings from '{}': {}", resource, config);
            return config;
        } catch (IOException e) {
            log.error("Failed to read projection settings '{}'", resource, e);
            throw new IllegalStateException("Failed to read projection settings '" + resource + "'", e);
        }
    }

    /**
     * The origin to use for a request centred on {@code (ra, dec)}.
     */
    public Point origin(double ra, double dec) {
        return originMode == OriginMode.EXPLICIT ? new Point(originRa, originDec) : new Point(ra, dec);
    }

    private static double number(Properties props, String key) {
        String v = props.getProperty(key);
        if (v == null || v.isBlank()) return 0.0;
        double d;
        try {
            d = Double.parseDouble(v.trim());
        } catch (NumberFormatException e) {
            log.error("Invalid value for {}: {}", key, v);
            throw new WcsConfigurationException(
                    Reason.INVALID_CONFIGURATION, "Invalid value for " + key + ": " + v, e);
        }
        if (!Double.isFinite(d)) {
            log.error("Value for {} is not finite: {}", key, v);
            throw new WcsConfigurationException(
                    Reason.INVALID_CONFIGURATION, "Invalid value for " + key + ": " + v, d);
        }
        return d;
    }

    private static int integer(Properties props, String key) {
        String v = props.getProperty(key);
        if (v == null || v.isBlank()) return 0;
        try {
            return Integer.parseInt(v.trim());
        } catch (NumberFormatException e) {
            log.error("Invalid value for {}: {}", key, v);
            throw new WcsConfigurationException(
                    Reason.INVALID_CONFIGURATION, "Invalid value for " + key + ": " + v, e);
        }
    }
}
