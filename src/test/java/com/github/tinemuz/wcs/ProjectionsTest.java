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

import static org.junit.jupiter.api.Assertions.*;

import com.github.tinemuz.wcs.WcsConfigurationException.Reason;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Tests for the seven projections: round trips through the plane, the
 * per-projection formulas and domain guards, and the broken line checks.
 */
class ProjectionsTest {

    private static final double TOLERANCE = 1e-9; // degrees
    private static final double R0 = 180.0 / Math.PI;

    private static final double RA0 = 120.0;
    private static final double DEC0 = 35.0;

    // All within 45 degrees of (RA0, DEC0): clear of seams, poles and hidden hemispheres
    private static final Point[] SKY = {
        new Point(100.0, 20.0),
        new Point(135.0, 50.0),
        new Point(150.0, 30.0),
        new Point(110.0, 60.0),
        new Point(125.0, 10.0),
        new Point(90.0, 40.0),
        new Point(121.0, 35.5)
    };

    @Nested
    @DisplayName("Round trips")
    class RoundTripTests {

        @Test
        @DisplayName("inverse(direct(p)) returns p for every projection")
        void everyProjection() {
            for (ProjectionCode code : ProjectionCode.values()) {
                Projection projection = ProjectionFactory.create(ProjectionConfig.of(code), RA0, DEC0);
                for (Point p : SKY) {
                    Point plane = projection.direct(p);
                    assertNotNull(plane, code + " direct " + p);
                    assertSameSky(p, projection.inverse(plane), code + " round trip " + p);
                }
            }
        }

        @Test
        @DisplayName("Reference point projects to the plane origin")
        void referencePointAtOrigin() {
            for (ProjectionCode code : ProjectionCode.values()) {
                Projection projection = ProjectionFactory.create(ProjectionConfig.of(code), RA0, DEC0);
                Point plane = projection.direct(new Point(RA0, DEC0));
                assertNotNull(plane, code.name());
                assertEquals(0.0, plane.x(), TOLERANCE, code + " x");
                assertEquals(0.0, plane.y(), TOLERANCE, code + " y");
            }
        }

        @Test
        @DisplayName("Projections built from WCS keywords match those built from a reference point")
        void wcsMatchesRefpoint() {
            for (ProjectionCode code : ProjectionCode.values()) {
                Projection fromRef = ProjectionFactory.create(ProjectionConfig.of(code), RA0, DEC0);
                Projection fromWcs = ProjectionFactory.fromWcs(fromRef.getWcs());
                for (Point p : SKY) {
                    Point a = fromRef.direct(p);
                    Point b = fromWcs.direct(p);
                    assertEquals(a.x(), b.x(), TOLERANCE, code + " x " + p);
                    assertEquals(a.y(), b.y(), TOLERANCE, code + " y " + p);
                }
            }
        }
    }

    @Nested
    @DisplayName("Initialisation")
    class InitTests {

        @Test
        @DisplayName("initFromRefpoint writes the WCS keywords")
        void refpointKeywords() {
            WCSKeywords zea = new ZenithalEqualAreaProjection().initFromRefpoint(RA0, DEC0).getWcs();
            assertEquals("'RA---ZEA'", zea.ctype1());
            assertEquals("'DEC--ZEA'", zea.ctype2());
            assertEquals(RA0, zea.crval1());
            assertEquals(DEC0, zea.crval2());
            assertEquals(90.0, zea.pv1_2());

            WCSKeywords car = new PlateCarreeProjection().initFromRefpoint(RA0, DEC0).getWcs();
            assertEquals("'RA---CAR'", car.ctype1());
            assertNull(car.pv1_2(), "theta0 of 0 is not written");
        }

        @Test
        @DisplayName("theta0 beyond 90 degrees is rejected")
        void theta0OutOfRange() {
            WCSKeywords wcs = WCSKeywords.builder().projection("CAR").crval(10, 20).pv1_2(95.0).build();

            WcsConfigurationException e = assertThrows(
                    WcsConfigurationException.class, () -> new PlateCarreeProjection().initFromWcs(wcs));
            assertEquals(Reason.THETA0_OUT_OF_RANGE, e.getReason());
            assertEquals(95.0, e.getValues()[0]);
        }

        @Test
        @DisplayName("theta0 within tolerance of 90 degrees is clamped")
        void theta0Clamped() {
            WCSKeywords wcs =
                    WCSKeywords.builder().projection("ZEA").crval(10, 20).pv1_2(90.000001).build();
            AbstractProjection zea = new ZenithalEqualAreaProjection().initFromWcs(wcs);

            assertEquals(90.0, zea.theta0());
            assertEquals(10.0, zea.getRotation().alphaP());
            assertEquals(70.0, zea.getRotation().deltaP());
        }

        @Test
        @DisplayName("PV1_1 and LONPOLE override the defaults")
        void keywordOverrides() {
            WCSKeywords wcs = WCSKeywords.builder()
                    .projection("STG")
                    .crval(10, 20)
                    .pv1_1(0.0)
                    .lonpole(170.0)
                    .build();
            AbstractProjection stg = new StereographicProjection().initFromWcs(wcs);

            assertEquals(170.0, stg.getRotation().phiP());
            assertSame(wcs, stg.getWcs());
        }

        @Test
        @DisplayName("Querying before initialisation fails")
        void notInitialised() {
            assertThrows(IllegalStateException.class, () -> new MercatorProjection().direct(new Point(1, 2)));
        }

        @Test
        @DisplayName("A projection is initialised only once")
        void initialisedOnce() {
            AbstractProjection zea = new ZenithalEqualAreaProjection().initFromRefpoint(RA0, DEC0);
            WCSKeywords other = WCSKeywords.of("ZEA", 10, 20);

            assertThrows(IllegalStateException.class, () -> zea.initFromRefpoint(10, 20));
            assertThrows(IllegalStateException.class, () -> zea.initFromWcs(other));
            assertEquals(RA0, zea.getWcs().crval1());
        }

        @Test
        @DisplayName("A failed initialisation leaves the fiducial point untouched")
        void failedInitKeepsState() {
            ZenithalEqualAreaProjection zea = new ZenithalEqualAreaProjection();
            WCSKeywords unreachable = WCSKeywords.builder()
                    .projection("ZEA").crval(10, 40).pv1_1(0.0).pv1_2(0.0).lonpole(60.0).build();

            assertThrows(WcsConfigurationException.class, () -> zea.initFromWcs(unreachable));
            assertEquals(0.0, zea.phi0());
            assertEquals(90.0, zea.theta0());
            assertNull(zea.getRotation());

            zea.initFromRefpoint(RA0, DEC0);
            Point sky = new Point(RA0 + 5.0, DEC0 - 5.0);
            assertSameSky(sky, zea.inverse(zea.direct(sky)), "round trip after failed init");
        }
    }

    @Nested
    @DisplayName("Zenithal projections")
    class ZenithalTests {

        @Test
        @DisplayName("ZEA radius law")
        void zenithalEqualArea() {
            ZenithalEqualAreaProjection zea = new ZenithalEqualAreaProjection();

            Point south = zea.project(new Point(0.0, -90.0));
            assertEquals(0.0, south.x(), TOLERANCE);
            assertEquals(-360.0 / Math.PI, south.y(), TOLERANCE);

            Point east = zea.project(new Point(90.0, 0.0));
            assertEquals(360.0 / Math.PI * Math.sin(Math.PI / 4), east.x(), TOLERANCE);
            assertEquals(0.0, east.y(), TOLERANCE);
        }

        @Test
        @DisplayName("ZEA unproject is null beyond the antipode radius")
        void zenithalEqualAreaDomain() {
            assertNull(new ZenithalEqualAreaProjection().unproject(new Point(0.0, 120.0)));
        }

        @Test
        @DisplayName("STG radius law")
        void stereographic() {
            StereographicProjection stg = new StereographicProjection();

            Point equator = stg.project(new Point(180.0, 0.0));
            assertEquals(0.0, equator.x(), TOLERANCE);
            assertEquals(360.0 / Math.PI, equator.y(), TOLERANCE);

            Point np = stg.unproject(equator);
            assertEquals(180.0, np.x(), TOLERANCE);
            assertEquals(0.0, np.y(), TOLERANCE);
        }

        @Test
        @DisplayName("STG never breaks a line; ZEA breaks across the antipode")
        void brokenLines() {
            StereographicProjection stg = new StereographicProjection();
            assertTrue(stg.checkBrokenLine(new Point(0, 0), new Point(180, 0)));

            AbstractProjection zea = new ZenithalEqualAreaProjection().initFromRefpoint(0.0, 0.0);
            assertTrue(zea.checkBrokenLine(new Point(10, 5), new Point(12, 6)));
            assertFalse(zea.checkBrokenLine(new Point(180, 1), new Point(180, -1)));
            assertFalse(zea.checkBrokenLine(null, new Point(180, -1)));
        }
    }

    @Nested
    @DisplayName("Orthographic")
    class OrthographicTests {

        @Test
        @DisplayName("Native pole projects to the origin")
        void poleAtOrigin() {
            Point p = new OrthographicProjection().project(new Point(0.0, 90.0));
            assertEquals(0.0, p.x(), TOLERANCE);
            assertEquals(0.0, p.y(), TOLERANCE);
        }

        @Test
        @DisplayName("Hidden hemisphere and points outside the disc are null")
        void domain() {
            OrthographicProjection sin = new OrthographicProjection();
            assertNull(sin.project(new Point(30.0, -10.0)));
            assertNull(sin.unproject(new Point(60.0, 0.0)));

            Point np = sin.unproject(new Point(0.0, -R0));
            assertEquals(0.0, np.y(), TOLERANCE, "The rim of the disc is the native equator");
        }

        @Test
        @DisplayName("Direct is null on the far side of the sky")
        void farSide() {
            Projection sin = ProjectionFactory.create(ProjectionConfig.of(ProjectionCode.SIN), RA0, DEC0);
            assertNull(sin.direct(new Point(RA0 + 180.0, -DEC0)));
        }

        @Test
        @DisplayName("Slant orthographic keywords are unsupported")
        void slant() {
            WCSKeywords slant = WCSKeywords.builder().projection("SIN").crval(10, 20).slant(0.1, 0.0).build();
            assertThrows(UnsupportedOperationException.class, () -> new OrthographicProjection().initFromWcs(slant));

            WCSKeywords plain = WCSKeywords.builder().projection("SIN").crval(10, 20).slant(0.0, 0.0).build();
            assertNotNull(new OrthographicProjection().initFromWcs(plain).direct(new Point(12, 22)));
        }
    }

    @Nested
    @DisplayName("Cylindrical projections")
    class CylindricalTests {

        @Test
        @DisplayName("Plate carree is the identity on native coordinates")
        void plateCarreeIdentity() {
            PlateCarreeProjection car = new PlateCarreeProjection();
            assertEquals(new Point(30.0, 45.0), car.project(new Point(30.0, 45.0)));
            assertEquals(new Point(30.0, 45.0), car.unproject(new Point(30.0, 45.0)));
        }

        @Test
        @DisplayName("Plate carree centred on (0, 0) maps the sky onto itself")
        void plateCarreeAtOrigin() {
            AbstractProjection car = new PlateCarreeProjection().initFromRefpoint(0.0, 0.0);

            Point p = car.direct(new Point(30.0, 45.0));
            assertEquals(30.0, p.x(), TOLERANCE);
            assertEquals(45.0, p.y(), TOLERANCE);

            Point wrapped = car.direct(new Point(200.0, 10.0));
            assertEquals(-160.0, wrapped.x(), TOLERANCE);
        }

        @Test
        @DisplayName("Mercator maps the origin to the origin")
        void mercatorOrigin() {
            Point p = new MercatorProjection().project(new Point(0.0, 0.0));
            assertEquals(0.0, p.x(), TOLERANCE);
            assertEquals(0.0, p.y(), TOLERANCE);
        }

        @Test
        @DisplayName("Mercator stretches latitude")
        void mercatorLatitude() {
            MercatorProjection mer = new MercatorProjection();
            Point p = mer.project(new Point(10.0, 45.0));
            assertEquals(10.0, p.x(), TOLERANCE);
            assertEquals(R0 * Math.log(Math.tan(Math.toRadians(67.5))), p.y(), TOLERANCE);
            assertEquals(45.0, mer.unproject(p).y(), TOLERANCE);
        }

        @Test
        @DisplayName("Mercator has no image for either native pole")
        void mercatorPole() {
            MercatorProjection mer = new MercatorProjection();
            mer.initFromRefpoint(0.0, 0.0);
            assertNull(mer.direct(new Point(0.0, -90.0)));
            assertNull(mer.direct(new Point(0.0, 90.0)));
            assertNull(mer.project(new Point(30.0, 90.0)));
            assertNull(mer.project(new Point(30.0, -90.0)));
            assertNotNull(mer.project(new Point(30.0, 89.0)));
        }

        @Test
        @DisplayName("Hammer-Aitoff origin and boundary")
        void hammerAitoff() {
            HammerAitoffProjection ait = new HammerAitoffProjection();

            Point origin = ait.project(new Point(0.0, 0.0));
            assertEquals(0.0, origin.x(), TOLERANCE);
            assertEquals(0.0, origin.y(), TOLERANCE);

            Point edge = ait.project(new Point(180.0, 0.0));
            assertEquals(2.0 * Math.sqrt(2.0) * R0, edge.x(), 1e-9);

            assertNull(ait.unproject(new Point(720.0 / Math.PI * 0.8, 0.0)), "X^2 + Y^2 = 0.64");
            assertNull(ait.unproject(new Point(0.0, 360.0 / Math.PI * 0.75)), "X^2 + Y^2 = 0.5625");
            assertNull(ait.unproject(new Point(1000.0, 1000.0)), "Far outside the ellipse");
            assertNotNull(ait.unproject(new Point(720.0 / Math.PI * 0.5, 360.0 / Math.PI * 0.4)));
        }

        @Test
        @DisplayName("Lines crossing the phi = 180 seam are broken")
        void seams() {
            Projection[] projections = {
                new PlateCarreeProjection().initFromRefpoint(0.0, 0.0),
                new MercatorProjection().initFromRefpoint(0.0, 0.0),
                new HammerAitoffProjection().initFromRefpoint(0.0, 0.0)
            };
            for (Projection projection : projections) {
                String id = projection.identifier();
                assertTrue(projection.checkBrokenLine(new Point(10, 0), new Point(20, 10)), id);
                assertFalse(projection.checkBrokenLine(new Point(179, 0), new Point(181, 0)), id);
                assertFalse(projection.checkBrokenLine(new Point(10, 0), null), id);
            }
            assertFalse(projections[1].checkBrokenLine(new Point(0, 90), new Point(0, 80)), "Mercator pole");
        }

        @Test
        @DisplayName("Orthographic breaks long native segments")
        void orthographicDistance() {
            Projection sin = new OrthographicProjection().initFromRefpoint(0.0, 0.0);
            assertTrue(sin.checkBrokenLine(new Point(10, 0), new Point(30, 10)));
            assertFalse(sin.checkBrokenLine(new Point(10, 0), new Point(170, 0)));
        }
    }

    @Nested
    @DisplayName("Gnomonic")
    class GnomonicTests {

        private final GnomonicProjection tan = new GnomonicProjection(R0, RA0, DEC0);

        @Test
        @DisplayName("Tangent point maps to the origin")
        void tangentPoint() {
            Point p = tan.direct(new Point(RA0, DEC0));
            assertEquals(0.0, p.x(), TOLERANCE);
            assertEquals(0.0, p.y(), TOLERANCE);
        }

        @Test
        @DisplayName("East is +x and north is +y")
        void orientation() {
            assertTrue(tan.direct(new Point(RA0 + 1.0, DEC0)).x() > 0.0);
            assertTrue(tan.direct(new Point(RA0, DEC0 + 1.0)).y() > 0.0);
            assertEquals(R0 * Math.tan(Math.toRadians(1.0)), tan.direct(new Point(RA0, DEC0 + 1.0)).y(), 1e-9);
        }

        @Test
        @DisplayName("More than 90 degrees from the tangent point is null")
        void hiddenHemisphere() {
            assertNull(tan.direct(new Point(RA0 + 180.0, -DEC0)));
            assertNull(tan.direct(new Point(RA0 + 100.0, 0.0)));
        }

        @Test
        @DisplayName("WCS keywords describe the tangent point")
        void keywords() {
            WCSKeywords wcs = tan.getWcs();
            assertEquals("'RA---TAN'", wcs.ctype1());
            assertEquals("'DEC--TAN'", wcs.ctype2());
            assertEquals(RA0, wcs.crval1(), 1e-12);
            assertEquals(DEC0, wcs.crval2(), 1e-12);
            assertEquals("TAN", wcs.projectionCode());
        }

        @Test
        @DisplayName("Broken lines: both ends must project and stay close")
        void brokenLines() {
            assertTrue(tan.checkBrokenLine(new Point(RA0, DEC0), new Point(RA0 + 5, DEC0 + 5)));
            assertFalse(tan.checkBrokenLine(new Point(RA0, DEC0), new Point(RA0 + 180, -DEC0)));
            assertFalse(tan.checkBrokenLine(new Point(RA0, DEC0 - 50), new Point(RA0, DEC0 + 50)));
            assertFalse(tan.checkBrokenLine(null, new Point(RA0, DEC0)));
        }
    }

    @Nested
    @DisplayName("Thread Safety Tests")
    class ThreadSafetyTests {

        @Test
        @DisplayName("Concurrent queries on one instance agree")
        void concurrentAccess() throws InterruptedException {
            Projection projection = ProjectionFactory.create(ProjectionConfig.of(ProjectionCode.AIT), RA0, DEC0);
            Point expected = projection.direct(SKY[0]);
            final int threadCount = 8;
            final boolean[] ok = new boolean[threadCount];
            Thread[] threads = new Thread[threadCount];

            for (int i = 0; i < threadCount; i++) {
                final int threadId = i;
                threads[i] = new Thread(() -> {
                    boolean same = true;
                    for (int j = 0; j < 1000; j++) {
                        same &= expected.equals(projection.direct(SKY[0]));
                    }
                    ok[threadId] = same;
                });
                threads[i].start();
            }
            for (Thread thread : threads) {
                thread.join();
            }
            for (boolean b : ok) {
                assertTrue(b, "Every thread saw the same result");
            }
        }
    }

    // Helper methods

    private static void assertSameSky(Point expected, Point actual, String message) {
        assertNotNull(actual, message + " should not be null");
        double dra = ((actual.x() - expected.x()) % 360.0 + 540.0) % 360.0 - 180.0;
        assertEquals(0.0, dra, TOLERANCE, message + " RA");
        assertEquals(expected.y(), actual.y(), TOLERANCE, message + " Dec");
    }
}
