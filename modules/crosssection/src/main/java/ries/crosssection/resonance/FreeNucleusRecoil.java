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
import static ries.utilities.Constants.ATOMIC_MASS_UNIT_MEV;

/**
 * Recoil correction for a free nucleus at rest.
 *
 * <p>From the conservation of energy and momentum, the resonance energy of a nucleus with mass m
 * is E_r = dE (1 + dE / (2 m c^2)), where dE is the energy difference of the two states. In a
 * solid, the recoil may be absorbed by the lattice instead.
 *
 * @since 1.0
 */
public class FreeNucleusRecoil implements RecoilCorrection {

  private final double amu;
  private final double twiceRestEnergy;

  /**
   * Constructor for FreeNucleusRecoil.
   *
   * @param amu mass of the nucleus in atomic mass units.
   */
  public FreeNucleusRecoil(double amu) {
    if (!(amu > 0.0)) {
      throw new IllegalArgumentException(format(" The mass of the nucleus must be positive (%g).", amu));
    }
    this.amu = amu;
    twiceRestEnergy = 2.0 * amu * ATOMIC_MASS_UNIT_MEV;
  }

  /** {@inheritDoc} */
  @Override
  public double resonanceEnergy(double energyDifference) {
    return energyDifference * (1.0 + energyDifference / twiceRestEnergy);
  }

  public double getAmu() {
    return amu;
  }
}
