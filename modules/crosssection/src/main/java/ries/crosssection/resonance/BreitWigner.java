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

import ries.crosssection.constituents.ExcitedState;
import ries.crosssection.constituents.State;
import ries.numerics.distribution.Cauchy;

/**
 * Resonance with the natural line shape of G. Breit and E. Wigner, Phys. Rev. 49 (1936) 519: a
 * Cauchy distribution centered at the resonance energy whose half width at half maximum is half of
 * the total width of the intermediate state.
 *
 * @since 1.0
 */
public class BreitWigner extends Resonance {

  public BreitWigner(State initialState, ExcitedState intermediateState) {
    this(initialState, intermediateState, null, new NoRecoil());
  }

  public BreitWigner(State initialState, ExcitedState intermediateState, State finalState) {
    this(initialState, intermediateState, finalState, new NoRecoil());
  }

  /**
   * Constructor for BreitWigner.
   *
   * @param initialState the initial state.
   * @param intermediateState the excited state.
   * @param finalState the final state of the decay, or null.
   * @param recoilCorrection correction of the resonance energy.
   */
  public BreitWigner(State initialState, ExcitedState intermediateState, State finalState,
      RecoilCorrection recoilCorrection) {
    super(initialState, intermediateState, finalState, recoilCorrection,
        energy -> new Cauchy(energy, 0.5 * intermediateState.getWidth()));
  }
}
