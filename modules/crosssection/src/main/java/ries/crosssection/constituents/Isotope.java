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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * An isotope with its mass and its known nuclear states.
 *
 * @since 1.0
 */
public class Isotope {

  private final String identifier;
  private final double amu;
  private final GroundState groundState;
  private final Map<String, ExcitedState> excitedStates;

  /**
   * Constructor for Isotope.
   *
   * @param identifier mass number and element symbol, for example "208Pb".
   * @param amu mass of the isotope in atomic mass units.
   * @param groundState the ground state.
   * @param excitedStates the excited states; their identifiers must be unique.
   */
  public Isotope(String identifier, double amu, GroundState groundState, List<ExcitedState> excitedStates) {
    if (!(amu > 0.0) || Double.isInfinite(amu)) {
      throw new IllegalArgumentException(format(" Isotope %s: invalid mass %g.", identifier, amu));
    }
    Map<String, ExcitedState> states = new LinkedHashMap<>();
    for (ExcitedState state : excitedStates) {
      if (states.put(state.getIdentifier(), state) != null
          || (groundState != null && groundState.getIdentifier().equals(state.getIdentifier()))) {
        throw new IllegalArgumentException(
            format(" Isotope %s: duplicate state identifier %s.", identifier, state.getIdentifier()));
      }
    }
    this.identifier = identifier;
    this.amu = amu;
    this.groundState = groundState;
    this.excitedStates = Collections.unmodifiableMap(states);
  }

  /**
   * Constructor for an Isotope without level information.
   *
   * @param identifier mass number and element symbol.
   * @param amu mass of the isotope in atomic mass units.
   */
  public Isotope(String identifier, double amu) {
    this(identifier, amu, null, List.of());
  }

  public String getIdentifier() {
    return identifier;
  }

  /**
   * Isotopic mass.
   *
   * @return the mass in atomic mass units.
   */
  public double getAmu() {
    return amu;
  }

  /**
   * The ground state, if level information is available.
   *
   * @return the ground state or null.
   */
  public GroundState getGroundState() {
    return groundState;
  }

  /**
   * Excited states in the order of construction.
   *
   * @return an unmodifiable map from state identifiers to states.
   */
  public Map<String, ExcitedState> getExcitedStates() {
    return excitedStates;
  }

  /**
   * Look up an excited state.
   *
   * @param stateIdentifier identifier of the state.
   * @return the state.
   * @throws IllegalArgumentException if the isotope has no such state.
   */
  public ExcitedState getExcitedState(String stateIdentifier) {
    ExcitedState state = excitedStates.get(stateIdentifier);
    if (state == null) {
      throw new IllegalArgumentException(format(" Isotope %s has no excited state %s.", identifier, stateIdentifier));
    }
    return state;
  }

  /** {@inheritDoc} */
  @Override
  public String toString() {
    return format(" %s (%.9f u, %d excited states)", identifier, amu, excitedStates.size());
  }
}
