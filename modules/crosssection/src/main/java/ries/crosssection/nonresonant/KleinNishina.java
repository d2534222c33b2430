// ******************************************************************************
//
// Title:       RIES.
// Description: RIES - Resonances Integrated over Energy and Space.
// Copyright:   Copyright (c) RIES Developers 2026.
//
// This file is part of RIES.
//
// RIES is free software; you can redistribute it and/or modify it
// under the terms of the GNU General Public License version 3 as published by
// the Free Software Foundation.
//
// RIES is distributed in the hope that it will be useful, but WITHOUT
// ANY WARRANTY; without even the implied warranty of MERCHANTABILITY or FITNESS
// FOR A PARTICULAR PURPOSE. See the GNU General Public License for more
// details.
//
// You should have received a copy of the GNU General Public License along with
// RIES; if not, write to the Free Software Foundation, Inc., 59 Temple
// Place, Suite 330, Boston, MA 02111-1307 USA
//
// Linking this library statically or dynamically with other modules is making a
// combined work based on this library. Thus, the terms and conditions of the
// GNU General Public License cover the whole combination.
//
// As a special exception, the copyright holders of this library give you
// permission to link this library with independent modules to produce an
// executable, regardless of the license terms of these independent modules, and
// to copy and distribute the resulting executable under terms of your choice,
// provided that you also meet, for each linked independent module, the terms
// and conditions of the license of that module. An independent module is a
// module which is not derived from or based on this library. If you modify this
// library, you may extend this exception to your version of the library, but
// you are not obligated to do so. If you do not wish to do so, delete this
// exception statement from your version.
//
// ******************************************************************************
package ries.crosssection.nonresonant;

import static java.lang.String.format;
import static org.apache.commons.math3.util.FastMath.PI;
import static org.apache.commons.math3.util.FastMath.acos;
import static org.apache.commons.math3.util.FastMath.cos;
import static org.apache.commons.math3.util.FastMath.log1p;
import static org.apache.commons.math3.util.FastMath.max;
import static org.apache.commons.math3.util.FastMath.min;
import static org.apache.commons.math3.util.FastMath.sin;
import static ries.utilities.Constants.ELECTRON_MASS_MEV;
import static ries.utilities.Constants.ELECTRON_RADIUS;

/**
 * Compton scattering of photons off the Z electrons of an atom, which are treated as free and at
 * rest (O. Klein and Y. Nishina, Z. Phys. 52 (1929) 853).
 *
 * <p>The value of this cross section is the total cross section. With x = E / (m_e c^2) and the
 * classical electron radius r_e,
 *
 * <pre>
 *   sigma(E) = Z pi r_e^2 / x^3 { 2x [2 + x (1 + x) (8 + x)] / (1 + 2x)^2 + [(x - 2) x - 2] ln(1 + 2x) }.
 * </pre>
 *
 * <p>Energies are in MeV, angles in radians and cross sections in fm^2.
 *
 * @since 1.0
 */
public class KleinNishina extends NonresonantCrossSection {

  /** Below this value of x, the total cross section is evaluated by its Taylor expansion. */
  private static final double SERIES_THRESHOLD = 1.0e-3;

  private final int z;
  private final double zRe2;

  /**
   * Constructor for KleinNishina.
   *
   * @param z number of electrons.
   */
  public KleinNishina(int z) {
    if (z < 1) {
      throw new IllegalArgumentException(format(" At least one electron is required (%d).", z));
    }
    this.z = z;
    zRe2 = z * ELECTRON_RADIUS * ELECTRON_RADIUS;
  }

  /** Constructor for the cross section of a single electron. */
  public KleinNishina() {
    this(1);
  }

  /**
   * Total cross section.
   *
   * @param energy photon energy.
   * @return the cross section.
   */
  @Override
  public double value(double energy) {
    checkEnergy(energy);
    double x = energy / ELECTRON_MASS_MEV;
    if (x < SERIES_THRESHOLD) {
      // Thomson limit; the closed form cancels catastrophically here.
      return 8.0 / 3.0 * PI * zRe2
          * (1.0 + x * (-2.0 + x * (26.0 / 5.0 + x * (-133.0 / 10.0 + x * 1144.0 / 35.0))));
    }
    double onePlus2x = 1.0 + 2.0 * x;
    return PI * zRe2 / (x * x * x)
        * (2.0 * x * (2.0 + x * (1.0 + x) * (8.0 + x)) / (onePlus2x * onePlus2x)
        + ((x - 2.0) * x - 2.0) * log1p(2.0 * x));
  }

  /**
   * Energy of a photon that is scattered backwards, the lowest possible energy after Compton
   * scattering.
   *
   * @param energy photon energy.
   * @return the scattered photon energy at theta = pi.
   */
  public double comptonEdge(double energy) {
    return energy / (1.0 + 2.0 * energy / ELECTRON_MASS_MEV);
  }

  /**
   * Ratio of the scattered and the incident photon energy.
   *
   * @param energy photon energy.
   * @param theta polar scattering angle.
   * @return E' / E.
   */
  public double scatteredEnergyRatio(double energy, double theta) {
    return 1.0 / (1.0 + energy / ELECTRON_MASS_MEV * (1.0 - cos(theta)));
  }

  /**
   * Scattering angle for a given scattered photon energy.
   *
   * @param energy photon energy.
   * @param scatteredEnergy scattered photon energy, between the Compton edge and the energy.
   * @return the polar scattering angle in [0, pi].
   */
  public double theta(double energy, double scatteredEnergy) {
    double cosTheta = 1.0 - (energy / scatteredEnergy - 1.0) * ELECTRON_MASS_MEV / energy;
    // Rounding at the Compton edge.
    return acos(max(-1.0, min(1.0, cosTheta)));
  }

  /**
   * Differential cross section for a linearly polarized photon.
   *
   * @param energy photon energy.
   * @param theta polar scattering angle.
   * @param phi azimuthal angle relative to the polarization plane.
   * @return d sigma / d Omega in fm^2 / sr.
   */
  public double polarizedDifferential(double energy, double theta, double phi) {
    double ratio = scatteredEnergyRatio(energy, theta);
    double sinTheta = sin(theta);
    double cosPhi = cos(phi);
    return 0.5 * zRe2 * ratio * ratio * (ratio + 1.0 / ratio - 2.0 * sinTheta * sinTheta * cosPhi * cosPhi);
  }

  /**
   * Differential cross section for an unpolarized photon, the average of the polarized cross
   * section over the azimuthal angle.
   *
   * @param energy photon energy.
   * @param theta polar scattering angle.
   * @return d sigma / d Omega in fm^2 / sr.
   */
  public double unpolarizedDifferential(double energy, double theta) {
    double ratio = scatteredEnergyRatio(energy, theta);
    double sinTheta = sin(theta);
    return 0.5 * zRe2 * ratio * ratio * (ratio + 1.0 / ratio - sinTheta * sinTheta);
  }

  /**
   * Cross section per polar angle.
   *
   * @param energy photon energy.
   * @param theta polar scattering angle.
   * @return d sigma / d theta in fm^2.
   */
  public double differentialTheta(double energy, double theta) {
    return 2.0 * PI * unpolarizedDifferential(energy, theta) * sin(theta);
  }

  /**
   * Cross section per scattered photon energy.
   *
   * @param energy photon energy.
   * @param scatteredEnergy scattered photon energy.
   * @return d sigma / d E' in fm^2 / MeV.
   */
  public double differentialEnergy(double energy, double scatteredEnergy) {
    return 2.0 * PI * unpolarizedDifferential(energy, theta(energy, scatteredEnergy))
        * ELECTRON_MASS_MEV / (scatteredEnergy * scatteredEnergy);
  }

  /**
   * Cross section per scattered photon energy and azimuthal angle for a linearly polarized photon.
   *
   * @param energy photon energy.
   * @param scatteredEnergy scattered photon energy.
   * @param phi azimuthal angle relative to the polarization plane.
   * @return d sigma / (d E' d phi) in fm^2 / MeV.
   */
  public double differentialEnergyPhi(double energy, double scatteredEnergy, double phi) {
    return polarizedDifferential(energy, theta(energy, scatteredEnergy), phi)
        * ELECTRON_MASS_MEV / (scatteredEnergy * scatteredEnergy);
  }

  public int getZ() {
    return z;
  }

  private static void checkEnergy(double energy) {
    if (!(energy > 0.0)) {
      throw new IllegalArgumentException(format(" Photon energies must be positive (%g).", energy));
    }
  }
}
