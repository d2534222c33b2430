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
package ries.crosssection.resonance;

import static java.lang.String.format;
import static org.apache.commons.math3.util.FastMath.sqrt;
import static ries.utilities.Constants.ATOMIC_MASS_UNIT_MEV;
import static ries.utilities.Constants.BOLTZMANN_EV;
import static ries.utilities.Constants.EV_TO_MEV;

/**
 * Maxwell-Boltzmann velocity distribution of the nuclei in a target.
 *
 * <p>The thermal motion of the nuclei broadens a resonance at E_r to a normal distribution with
 * the Doppler width Delta = E_r sqrt(2 k_B T / (m c^2)), where T is the effective temperature.
 *
 * @since 1.0
 */
public class MaxwellBoltzmann {

  private final double amu;
  private final double effectiveTemperature;

  /**
   * Constructor for MaxwellBoltzmann.
   *
   * @param amu mass of the nucleus in atomic mass units.
   * @param effectiveTemperature effective temperature in K.
   */
  public MaxwellBoltzmann(double amu, double effectiveTemperature) {
    if (!(amu > 0.0)) {
      throw new IllegalArgumentException(format(" The mass of the nucleus must be positive (%g).", amu));
    }
    if (!(effectiveTemperature >= 0.0)) {
      throw new IllegalArgumentException(format(" The effective temperature must not be negative (%g).", effectiveTemperature));
    }
    this.amu = amu;
    this.effectiveTemperature = effectiveTemperature;
  }

  /**
   * Doppler width of a resonance.
   *
   * @param resonanceEnergy resonance energy in MeV.
   * @return the Doppler width in MeV.
   */
  public double getDopplerWidth(double resonanceEnergy) {
    return resonanceEnergy * sqrt(2.0 * BOLTZMANN_EV * EV_TO_MEV * effectiveTemperature / (amu * ATOMIC_MASS_UNIT_MEV));
  }

  /**
   * Effective temperature that corresponds to a given Doppler width.
   *
   * @param dopplerWidth Doppler width in MeV.
   * @param amu mass of the nucleus in atomic mass units.
   * @param resonanceEnergy resonance energy in MeV.
   * @return the effective temperature in K.
   */
  public static double effectiveTemperature(double dopplerWidth, double amu, double resonanceEnergy) {
    double ratio = dopplerWidth / resonanceEnergy;
    return amu * ATOMIC_MASS_UNIT_MEV * ratio * ratio / (2.0 * BOLTZMANN_EV * EV_TO_MEV);
  }

  public double getAmu() {
    return amu;
  }

  public double getEffectiveTemperature() {
    return effectiveTemperature;
  }
}
