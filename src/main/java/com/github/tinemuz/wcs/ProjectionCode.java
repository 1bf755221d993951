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
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The supported projections, by FITS code.
 *
 * <p>Older configurations store a numeric id instead of the code; {@link #resolve}
 * and {@link #fromId} translate both forms.</p>
 */
public enum ProjectionCode {
    TAN(0),
    STG(1),
    CAR(2),
    MER(3),
    AIT(4),
    ZEA(5),
    SIN(6);

    private static final Logger log = LoggerFactory.getLogger(ProjectionCode.class);

    private final int legacyId;

    ProjectionCode(int legacyId) {
        this.legacyId = legacyId;
    }

    /** Numeric id used by older configurations. */
    public int legacyId() {
        return legacyId;
    }

    /**
     * @throws WcsConfigurationException with {@link Reason#UNKNOWN_PROJECTION}
     *         for ids outside 0..6
     */
    public static ProjectionCode fromId(int id) {
        for (ProjectionCode code : values()) {
            if (code.legacyId == id) return code;
        }
        log.error("Unknown projection id {}", id);
        throw new WcsConfigurationException(
                Reason.UNKNOWN_PROJECTION, "Invalid projection code: " + id, id);
    }

    /**
     * Resolve a configuration value holding either a code ({@code "TAN"},
     * case-insensitive) or a legacy numeric id ({@code "0"}).
     *
     * @throws WcsConfigurationException with {@link Reason#UNKNOWN_PROJECTION}
     *         for anything else
     */
    public static ProjectionCode resolve(String value) {
        if (value == null) {
            log.error("Missing projection code");
            throw new WcsConfigurationException(Reason.UNKNOWN_PROJECTION, "Invalid projection code: null");
        }
        String v = value.trim();
        if (!v.isEmpty() && v.chars().allMatch(Character::isDigit)) {
            try {
                return fromId(Integer.parseInt(v));
            } catch (NumberFormatException e) {
                log.error("Projection id {} out of range", value);
                throw new WcsConfigurationException(
                        Reason.UNKNOWN_PROJECTION, "Invalid projection code: " + value, e);
            }
        }
        return byName(v.toUpperCase(Locale.ROOT), value);
    }

    /**
     * Resolve a FITS projection code as found in CTYPE, by name only. Legacy
     * numeric ids are not accepted here.
     *
     * @throws WcsConfigurationException with {@link Reason#UNKNOWN_PROJECTION}
     *         if the code is not supported
     */
    public static ProjectionCode fromFitsCode(String code) {
        if (code == null) {
            log.error("Missing projection code");
            throw new WcsConfigurationException(Reason.UNKNOWN_PROJECTION, "Invalid projection code: null");
        }
        return byName(code, code);
    }

    private static ProjectionCode byName(String name, String value) {
        for (ProjectionCode code : values()) {
            if (code.name().equals(name)) return code;
        }
        log.error("Unknown projection code '{}'", value);
        throw new WcsConfigurationException(Reason.UNKNOWN_PROJECTION, "Invalid projection code: " + value);
    }
}
