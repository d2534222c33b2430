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

import static org.apache.commons.math3.util.FastMath.sqrt;

import ries.crosssection.constituents.ExcitedState;
import ries.crosssection.constituents.State;
import ries.numerics.distribution.VoigtProfile;

/**
 * Resonance whose shape is the Voigt profile, the convolution of the natural line shape with the
 * Doppler broadening.
 *
 * <p>The normal component has the standard deviation Delta / sqrt(2) and the Cauchy component the
 * half width Gamma / 2. Quantiles are obtained from the pseudo-Voigt approximation of the CDF, see
 * {@link VoigtProfile}.
 *
 * @since 1.0
 */
public class Voigt extends Resonance {

  private final double dopplerWidth;

  public Voigt(State initialState, ExcitedState intermediateState, double amu, double effectiveTemperature) {
    this(initialState, intermediateState, amu, effectiveTemperature, null, new NoRecoil());
  }

  /**
   * Constructor for Voigt.
   *
   * @param initialState the initial state.
   * @param intermediateState the excited state.
   * @param amu mass of the nucleus in atomic mass units.
   * @param effectiveTemperature effective temperature in K.
   * @param finalState the final state of the decay, or null.
   * @param recoilCorrection correction of the resonance energy.
   */
  public Voigt(State initialState, ExcitedState intermediateState, double amu, double effectiveTemperature,
      State finalState, RecoilCorrection recoilCorrection) {
    super(initialState, intermediateState, finalState, recoilCorrection,
        energy -> new VoigtProfile(energy,
            new MaxwellBoltzmann(amu, effectiveTemperature).getDopplerWidth(energy) / sqrt(2.0),
            0.5 * intermediateState.getWidth()));
    dopplerWidth = new MaxwellBoltzmann(amu, effectiveTemperature).getDopplerWidth(getResonanceEnergy());
  }

  public double getDopplerWidth() {
    return dopplerWidth;
  }
}
