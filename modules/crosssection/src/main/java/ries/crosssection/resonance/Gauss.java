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
import ries.numerics.distribution.Normal;

/**
 * Doppler-broadened resonance whose natural width is negligible.
 *
 * <p>The shape is a normal distribution with the standard deviation Delta / sqrt(2), where Delta is
 * the Doppler width of a {@link MaxwellBoltzmann} distribution at the effective temperature.
 *
 * @since 1.0
 */
public class Gauss extends Resonance {

  private final double amu;
  private final double effectiveTemperature;
  private final double dopplerWidth;

  /**
   * Constructor for Gauss.
   *
   * @param initialState the initial state.
   * @param intermediateState the excited state.
   * @param amu mass of the nucleus in atomic mass units.
   * @param effectiveTemperature effective temperature in K.
   */
  public Gauss(State initialState, ExcitedState intermediateState, double amu, double effectiveTemperature) {
    this(initialState, intermediateState, amu, effectiveTemperature, null, new NoRecoil());
  }

  /**
   * Constructor for Gauss.
   *
   * @param initialState the initial state.
   * @param intermediateState the excited state.
   * @param amu mass of the nucleus in atomic mass units.
   * @param effectiveTemperature effective temperature in K.
   * @param finalState the final state of the decay, or null.
   * @param recoilCorrection correction of the resonance energy.
   */
  public Gauss(State initialState, ExcitedState intermediateState, double amu, double effectiveTemperature,
      State finalState, RecoilCorrection recoilCorrection) {
    super(initialState, intermediateState, finalState, recoilCorrection,
        energy -> new Normal(energy, new MaxwellBoltzmann(amu, effectiveTemperature).getDopplerWidth(energy) / sqrt(2.0)));
    this.amu = amu;
    this.effectiveTemperature = effectiveTemperature;
    dopplerWidth = new MaxwellBoltzmann(amu, effectiveTemperature).getDopplerWidth(getResonanceEnergy());
  }

  public double getAmu() {
    return amu;
  }

  public double getEffectiveTemperature() {
    return effectiveTemperature;
  }

  /**
   * Doppler width of the resonance.
   *
   * @return Delta in MeV.
   */
  public double getDopplerWidth() {
    return dopplerWidth;
  }
}
