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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.logging.Logger;
import ries.crosssection.CrossSection;
import ries.crosssection.constituents.ExcitedState;
import ries.crosssection.constituents.GroundState;
import ries.crosssection.constituents.Isotope;
import ries.numerics.math.Grids;

/**
 * Photoabsorption cross section of an isotope in its ground state: the sum of the resonances of all
 * excited states with a nonzero partial width to the ground state.
 *
 * @since 1.0
 */
public class IsotopeCrossSection extends CrossSection {

  private static final Logger logger = Logger.getLogger(IsotopeCrossSection.class.getName());

  private final Isotope isotope;
  private final Map<String, Resonance> resonances;

  /**
   * Constructor for IsotopeCrossSection.
   *
   * @param isotope the isotope.
   * @param resonanceFactory creates one resonance per excited state.
   */
  public IsotopeCrossSection(Isotope isotope, ResonanceFactory resonanceFactory) {
    this.isotope = isotope;
    Map<String, Resonance> map = new LinkedHashMap<>();
    GroundState groundState = isotope.getGroundState();
    if (groundState == null) {
      logger.fine(format(" Isotope %s has no level information.", isotope.getIdentifier()));
    } else {
      for (ExcitedState state : isotope.getExcitedStates().values()) {
        if (state.decaysTo(groundState.getIdentifier()) && state.getPartialWidth(groundState.getIdentifier()) > 0.0) {
          map.put(state.getIdentifier(), resonanceFactory.create(groundState, state));
        }
      }
    }
    resonances = Collections.unmodifiableMap(map);
  }

  /** {@inheritDoc} */
  @Override
  public double value(double energy) {
    double value = 0.0;
    for (Resonance resonance : resonances.values()) {
      value += resonance.value(energy);
    }
    return value;
  }

  /** {@inheritDoc} */
  @Override
  public double[] value(double[] energies) {
    double[] values = new double[energies.length];
    for (Resonance resonance : resonances.values()) {
      double[] term = resonance.value(energies);
      for (int i = 0; i < energies.length; i++) {
        values[i] += term[i];
      }
    }
    return values;
  }

  /**
   * {@inheritDoc}
   *
   * <p>The union of the probability grids of all resonances. Without resonances, the equidistant
   * energy grid is returned.
   */
  @Override
  public double[] equidistantProbabilityGrid(double lowerLimit, double upperLimit, int nPoints) {
    if (resonances.isEmpty()) {
      return equidistantEnergyGrid(lowerLimit, upperLimit, nPoints);
    }
    double[][] grids = new double[resonances.size()][];
    int i = 0;
    for (Resonance resonance : resonances.values()) {
      grids[i++] = resonance.equidistantProbabilityGrid(lowerLimit, upperLimit, nPoints);
    }
    return Grids.union(grids);
  }

  public Isotope getIsotope() {
    return isotope;
  }

  /**
   * Resonances keyed by the identifier of the excited state, in the order of the isotope's states.
   *
   * @return an unmodifiable map.
   */
  public Map<String, Resonance> getResonances() {
    return resonances;
  }
}
