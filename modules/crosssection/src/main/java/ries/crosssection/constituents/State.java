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
package ries.crosssection.constituents;

import static java.lang.String.format;

/**
 * A nuclear state, characterized by its total angular momentum J, its parity and its excitation
 * energy.
 *
 * <p>The angular momentum is stored as 2J, which is an integer for both even and odd nuclei.
 *
 * @since 1.0
 */
public abstract class State {

  private final String identifier;
  private final int twoJ;
  private final int parity;
  private final double excitationEnergy;

  /**
   * Constructor for State.
   *
   * @param identifier unique label of the state within its nucleus, for example "3/2^-_1".
   * @param twoJ two times the total angular momentum quantum number.
   * @param parity +1 or -1.
   * @param excitationEnergy excitation energy in MeV.
   */
  protected State(String identifier, int twoJ, int parity, double excitationEnergy) {
    if (identifier == null || identifier.isEmpty()) {
      throw new IllegalArgumentException(" A state requires a non-empty identifier.");
    }
    if (twoJ < 0) {
      throw new IllegalArgumentException(format(" State %s: 2J must not be negative (%d).", identifier, twoJ));
    }
    if (parity != 1 && parity != -1) {
      throw new IllegalArgumentException(format(" State %s: parity must be +1 or -1 (%d).", identifier, parity));
    }
    if (!(excitationEnergy >= 0.0) || Double.isInfinite(excitationEnergy)) {
      throw new IllegalArgumentException(format(" State %s: invalid excitation energy %g.", identifier, excitationEnergy));
    }
    this.identifier = identifier;
    this.twoJ = twoJ;
    this.parity = parity;
    this.excitationEnergy = excitationEnergy;
  }

  public String getIdentifier() {
    return identifier;
  }

  public int getTwoJ() {
    return twoJ;
  }

  public int getParity() {
    return parity;
  }

  /**
   * Excitation energy with respect to the ground state.
   *
   * @return the excitation energy in MeV.
   */
  public double getExcitationEnergy() {
    return excitationEnergy;
  }

  /** {@inheritDoc} */
  @Override
  public String toString() {
    return format(" %s (2J = %d, parity %+d, %.6f MeV)", identifier, twoJ, parity, excitationEnergy);
  }
}
