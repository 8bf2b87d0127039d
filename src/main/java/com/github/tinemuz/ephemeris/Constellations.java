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

package com.github.tinemuz.ephemeris;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finds the constellation that contains a point on the sky.
 *
 * <p>The IAU boundaries run along lines of constant right ascension and
 * declination of the B1875 equator, so a J2000 direction is first precessed to
 * that epoch and then looked up in a table of boundary rectangles.</p>
 *
 * <p>The table is read from the classpath resource
 * <code>constellations.txt</code> on first use, together with the J2000 to
 * B1875 rotation; call {@link #preload()} to do this eagerly.</p>
 */
public final class Constellations {
    private static final Logger log = LoggerFactory.getLogger(Constellations.class);
    private static final String RESOURCE = "constellations.txt";

    /** B1875.0 (JD 2405889.25855) in days of TT since J2000. */
    static final double B1875_TT = -45655.74145;

    private static final String[][] SYMBOLS = {
        {"And", "Andromeda"}, {"Ant", "Antlia"}, {"Aps", "Apus"},
        {"Aqr", "Aquarius"}, {"Aql", "Aquila"}, {"Ara", "Ara"},
        {"Ari", "Aries"}, {"Aur", "Auriga"}, {"Boo", "Bootes"},
        {"Cae", "Caelum"}, {"Cam", "Camelopardalis"}, {"Cnc", "Cancer"},
        {"CVn", "Canes Venatici"}, {"CMa", "Canis Major"}, {"CMi", "Canis Minor"},
        {"Cap", "Capricornus"}, {"Car", "Carina"}, {"Cas", "Cassiopeia"},
        {"Cen", "Centaurus"}, {"Cep", "Cepheus"}, {"Cet", "Cetus"},
        {"Cha", "Chamaeleon"}, {"Cir", "Circinus"}, {"Col", "Columba"},
        {"Com", "Coma Berenices"}, {"CrA", "Corona Australis"}, {"CrB", "Corona Borealis"},
        {"Crv", "Corvus"}, {"Crt", "Crater"}, {"Cru", "Crux"},
        {"Cyg", "Cygnus"}, {"Del", "Delphinus"}, {"Dor", "Dorado"},
        {"Dra", "Draco"}, {"Equ", "Equuleus"}, {"Eri", "Eridanus"},
        {"For", "Fornax"}, {"Gem", "Gemini"}, {"Gru", "Grus"},
        {"Her", "Hercules"}, {"Hor", "Horologium"}, {"Hya", "Hydra"},
        {"Hyi", "Hydrus"}, {"Ind", "Indus"}, {"Lac", "Lacerta"},
        {"Leo", "Leo"}, {"LMi", "Leo Minor"}, {"Lep", "Lepus"},
        {"Lib", "Libra"}, {"Lup", "Lupus"}, {"Lyn", "Lynx"},
        {"Lyr", "Lyra"}, {"Men", "Mensa"}, {"Mic", "Microscopium"},
        {"Mon", "Monoceros"}, {"Mus", "Musca"}, {"Nor", "Norma"},
        {"Oct", "Octans"}, {"Oph", "Ophiuchus"}, {"Ori", "Orion"},
        {"Pav", "Pavo"}, {"Peg", "Pegasus"}, {"Per", "Perseus"},
        {"Phe", "Phoenix"}, {"Pic", "Pictor"}, {"Psc", "Pisces"},
        {"PsA", "Piscis Austrinus"}, {"Pup", "Puppis"}, {"Pyx", "Pyxis"},
        {"Ret", "Reticulum"}, {"Sge", "Sagitta"}, {"Sgr", "Sagittarius"},
        {"Sco", "Scorpius"}, {"Scl", "Sculptor"}, {"Sct", "Scutum"},
        {"Ser", "Serpens"}, {"Sex", "Sextans"}, {"Tau", "Taurus"},
        {"Tel", "Telescopium"}, {"Tri", "Triangulum"}, {"TrA", "Triangulum Australe"},
        {"Tuc", "Tucana"}, {"UMa", "Ursa Major"}, {"UMi", "Ursa Minor"},
        {"Vel", "Vela"}, {"Vir", "Virgo"}, {"Vol", "Volans"},
        {"Vul", "Vulpecula"}
    };

    private static final Map<String, String> NAMES = new HashMap<>();

    static {
        for (String[] s : SYMBOLS) {
            NAMES.put(s[0], s[1]);
        }
    }

    private static volatile boolean loaded = false;
    private static RotationMatrix toB1875;
    private static Boundary[] bounds;

    private Constellations() {}

    /**
     * Build the B1875 rotation and load the boundary table.
     *
     * @throws IllegalStateException if the resource is missing or malformed
     */
    public static void preload() {
        ensureLoaded();
    }

    /**
     * The constellation containing a J2000 direction.
     *
     * @param ra right ascension in sidereal hours; any finite value, reduced to [0, 24)
     * @param dec declination in degrees, [-90, +90]
     * @throws IllegalArgumentException if {@code dec} is out of range or either
     *         coordinate is not finite
     */
    public static ConstellationInfo constellation(double ra, double dec) {
        if (!Double.isFinite(ra)) {
            throw new IllegalArgumentException("Right ascension must be finite: " + ra);
        }
        if (!(dec >= -90.0 && dec <= +90.0)) {
            throw new IllegalArgumentException("Declination out of range [-90, +90]: " + dec);
        }
        ensureLoaded();

        ra %= 24.0;
        if (ra < 0.0) ra += 24.0;

        // Any fixed instant works for the vectors; only their direction is used.
        AstroTime epoch = AstroTime.fromTerrestrial(B1875_TT);
        AstroVector j2000 = new Spherical(dec, 15.0 * ra, 1.0).toVector(epoch);
        Spherical b1875 = Spherical.fromVector(toB1875.rotate(j2000));
        double ra1875 = b1875.lon / 15.0;
        double dec1875 = b1875.lat;

        for (Boundary b : bounds) {
            if (dec1875 >= b.decLow && b.raLow <= ra1875 && ra1875 < b.raHigh) {
                return new ConstellationInfo(b.symbol, NAMES.get(b.symbol), ra1875, dec1875);
            }
        }
        throw new IllegalStateException("No constellation contains RA " + ra1875 + " Dec " + dec1875 + " (B1875)");
    }

    private static synchronized void ensureLoaded() {
        if (loaded) return;
        toB1875 = EarthOrientation.precession(B1875_TT, EarthOrientation.Direction.FROM_J2000);
        bounds = loadBoundsFromResource();
        loaded = true;
    }

    private static Boundary[] loadBoundsFromResource() {
        InputStream in = Constellations.class.getClassLoader().getResourceAsStream(RESOURCE);
        if (in == null) {
            log.error("Constellation boundary file '{}' not found on classpath", RESOURCE);
            throw new IllegalStateException("Constellation boundary file '" + RESOURCE + "' not found on classpath");
        }
        List<Boundary> rows = new ArrayList<>();
        try (BufferedReader br = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            String line;
            int lineNumber = 0;
            double previousDec = Double.POSITIVE_INFINITY;
            while ((line = br.readLine()) != null) {
                lineNumber++;
                line = line.trim();
                if (line.isEmpty() || line.startsWith("#")) continue;
                String[] toks = line.split("\\s+");
                if (toks.length != 4) {
                    throw new IllegalStateException("Expected 4 columns at line " + lineNumber);
                }
                Boundary b = new Boundary(
                        Double.parseDouble(toks[0]),
                        Double.parseDouble(toks[1]),
                        Double.parseDouble(toks[2]),
                        toks[3]);
                if (!NAMES.containsKey(b.symbol)) {
                    throw new IllegalStateException("Unknown constellation '" + b.symbol + "' at line " + lineNumber);
                }
                if (!(b.raLow >= 0.0 && b.raLow < b.raHigh && b.raHigh <= 24.0)) {
                    throw new IllegalStateException("Invalid right ascension range at line " + lineNumber);
                }
                if (b.decLow > previousDec) {
                    throw new IllegalStateException("Boundaries out of declination order at line " + lineNumber);
                }
                previousDec = b.decLow;
                rows.add(b);
            }
        } catch (IOException e) {
            log.error("Failed to read constellation boundary file", e);
            throw new IllegalStateException("Failed to read constellation boundary file", e);
        } catch (RuntimeException e) {
            log.error("Failed to parse constellation boundary file", e);
            throw new IllegalStateException("Failed to parse constellation boundary file", e);
        }

        Boundary last = rows.isEmpty() ? null : rows.get(rows.size() - 1);
        if (last == null || last.decLow != -90.0 || last.raLow != 0.0 || last.raHigh != 24.0) {
            log.error("Constellation boundary file does not close at the south celestial pole");
            throw new IllegalStateException("Constellation boundary file does not close at the south celestial pole");
        }
        log.debug("Loaded {} constellation boundaries", rows.size());
        return rows.toArray(new Boundary[0]);
    }

    private static final class Boundary {
        final double raLow;
        final double raHigh;
        final double decLow;
        final String symbol;

        Boundary(double raLow, double raHigh, double decLow, String symbol) {
            this.raLow = raLow;
            this.raHigh = raHigh;
            this.decLow = decLow;
            this.symbol = symbol;
        }
    }

    /** A constellation and the B1875 coordinates used to find it. */
    public static final class ConstellationInfo {
        /** Three-letter IAU abbreviation, e.g. "UMa". */
        public final String symbol;
        /** Full Latin name, e.g. "Ursa Major". */
        public final String name;
        /** Right ascension of the B1875 mean equator, hours [0, 24). */
        public final double ra1875;
        /** Declination of the B1875 mean equator, degrees. */
        public final double dec1875;

        ConstellationInfo(String symbol, String name, double ra1875, double dec1875) {
            this.symbol = symbol;
            this.name = name;
            this.ra1875 = ra1875;
            this.dec1875 = dec1875;
        }

        @Override
        public String toString() {
            return symbol + " (" + name + ")";
        }
    }
}
