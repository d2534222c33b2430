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

import static ries.numerics.distribution.PseudoVoigtProfile.SQRT_LN2;

import ries.crosssection.constituents.ExcitedState;
import ries.crosssection.constituents.State;
import ries.numerics.distribution.PseudoVoigtProfile;

/**
 * Resonance whose shape is the pseudo-Voigt approximation of the convolution of the natural line
 * shape and the Doppler broadening.
 *
 * <p>The Gaussian FWHM is 2 sqrt(ln 2) Delta, with the Doppler width Delta, and the Lorentzian FWHM
 * is the total width of the intermediate state.
 *
 * @since 1.0
 */
public class PseudoVoigt extends Resonance {

  private final double dopplerWidth;
  private final PseudoVoigtProfile profile;

  /**
   * Constructor for PseudoVoigt.
   *
   * @param initialState the initial state.
   * @param intermediateState the excited state.
   * @param amu mass of the nucleus in atomic mass units.
   * @param effectiveTemperature effective temperature in K.
   */
  public PseudoVoigt(State initialState, ExcitedState intermediateState, double amu, double effectiveTemperature) {
    this(initialState, intermediateState, amu, effectiveTemperature, null, new NoRecoil());
  }

  /**
   * Constructor for PseudoVoigt.
   *
   * @param initialState the initial state.
   * @param intermediateState the excited state.
   * @param amu mass of the nucleus in atomic mass units.
   * @param effectiveTemperature effective temperature in K.
   * @param finalState the final state of the decay, or null.
   * @param recoilCorrection correction of the resonance energy.
   */
  public PseudoVoigt(State initialState, ExcitedState intermediateState, double amu, double effectiveTemperature,
      State finalState, RecoilCorrection recoilCorrection) {
    super(initialState, intermediateState, finalState, recoilCorrection,
        energy -> PseudoVoigtProfile.fromWidths(energy,
            2.0 * SQRT_LN2 * new MaxwellBoltzmann(amu, effectiveTemperature).getDopplerWidth(energy),
            intermediateState.getWidth()));
    dopplerWidth = new MaxwellBoltzmann(amu, effectiveTemperature).getDopplerWidth(getResonanceEnergy());
    profile = (PseudoVoigtProfile) getDistribution();
  }

  public double getDopplerWidth() {
    return dopplerWidth;
  }

  /**
   * Weight of the Cauchy distribution.
   *
   * @return eta.
   */
  public double getEta() {
    return profile.getEta();
  }

  /**
   * Combined full width at half maximum.
   *
   * @return Gamma in MeV.
   */
  public double getFwhm() {
    return profile.getFwhm();
  }
}
