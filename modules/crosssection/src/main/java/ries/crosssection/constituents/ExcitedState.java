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
import java.util.Map;

/**
 * An excited nuclear state that decays to other states of the same nucleus.
 *
 * <p>The partial widths are keyed by the identifier of the final state of each decay. The total
 * width is their sum.
 *
 * @since 1.0
 */
public class ExcitedState extends State {

  private final Map<String, Double> partialWidths;
  private final double width;

  /**
   * Constructor for ExcitedState.
   *
   * @param identifier unique label of the state.
   * @param twoJ two times the total angular momentum quantum number.
   * @param parity +1 or -1.
   * @param excitationEnergy excitation energy in MeV.
   * @param partialWidths partial decay widths in MeV, keyed by the identifier of the final state.
   */
  public ExcitedState(String identifier, int twoJ, int parity, double excitationEnergy,
      Map<String, Double> partialWidths) {
    super(identifier, twoJ, parity, excitationEnergy);
    double sum = 0.0;
    for (Map.Entry<String, Double> entry : partialWidths.entrySet()) {
      Double partialWidth = entry.getValue();
      if (partialWidth == null || !(partialWidth >= 0.0) || partialWidth.isInfinite()) {
        throw new IllegalArgumentException(
            format(" State %s: invalid partial width %s to %s.", identifier, partialWidth, entry.getKey()));
      }
      sum += partialWidth;
    }
    this.partialWidths = Collections.unmodifiableMap(new LinkedHashMap<>(partialWidths));
    width = sum;
  }

  /**
   * Partial widths of all decays.
   *
   * @return an unmodifiable map from final-state identifiers to widths in MeV.
   */
  public Map<String, Double> getPartialWidths() {
    return partialWidths;
  }

  /**
   * Check whether this state decays to another state.
   *
   * @param identifier identifier of the final state.
   * @return true if a partial width to the final state is known.
   */
  public boolean decaysTo(String identifier) {
    return partialWidths.containsKey(identifier);
  }

  /**
   * Partial width of the decay to another state.
   *
   * @param identifier identifier of the final state.
   * @return the partial width in MeV.
   * @throws IllegalArgumentException if the state does not decay to the given state.
   */
  public double getPartialWidth(String identifier) {
    Double partialWidth = partialWidths.get(identifier);
    if (partialWidth == null) {
      throw new IllegalArgumentException(
          format(" State %s has no partial width to state %s.", getIdentifier(), identifier));
    }
    return partialWidth;
  }

  /**
   * Total width, the sum of all partial widths.
   *
   * @return the width in MeV.
   */
  public double getWidth() {
    return width;
  }
}
