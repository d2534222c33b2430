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
package ries.crosssection;

import static java.lang.String.format;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import ries.numerics.math.Grids;

/**
 * Linear combination of cross sections with constant coefficients.
 *
 * <p>A weighted sum never contains another weighted sum: the terms of nested sums are copied
 * into the new sum, with their coefficients multiplied by the outer coefficient.
 *
 * @since 1.0
 */
public class CrossSectionWeightedSum extends CrossSection {

  private final List<CrossSection> crossSections;
  private final List<Double> scaleFactors;

  /**
   * Constructor for CrossSectionWeightedSum.
   *
   * @param crossSections the terms of the sum.
   * @param scaleFactors one coefficient per term.
   * @throws IllegalArgumentException if the two lists have different lengths.
   */
  public CrossSectionWeightedSum(List<? extends CrossSection> crossSections, List<Double> scaleFactors) {
    if (crossSections.size() != scaleFactors.size()) {
      throw new IllegalArgumentException(format(" %d cross sections, but %d scale factors.",
          crossSections.size(), scaleFactors.size()));
    }
    List<CrossSection> terms = new ArrayList<>(crossSections.size());
    List<Double> factors = new ArrayList<>(crossSections.size());
    for (int i = 0; i < crossSections.size(); i++) {
      appendTerms(crossSections.get(i), scaleFactors.get(i), terms, factors);
    }
    this.crossSections = Collections.unmodifiableList(terms);
    this.scaleFactors = Collections.unmodifiableList(factors);
  }

  /**
   * Constructor for a CrossSectionWeightedSum with unit coefficients.
   *
   * @param crossSections the terms of the sum.
   */
  public CrossSectionWeightedSum(List<? extends CrossSection> crossSections) {
    this(crossSections, Collections.nCopies(crossSections.size(), 1.0));
  }

  /**
   * Append a term to a list of terms, expanding weighted sums.
   */
  static void appendTerms(CrossSection crossSection, double scaleFactor, List<CrossSection> terms,
      List<Double> factors) {
    if (crossSection instanceof CrossSectionWeightedSum sum) {
      for (int i = 0; i < sum.crossSections.size(); i++) {
        terms.add(sum.crossSections.get(i));
        factors.add(scaleFactor * sum.scaleFactors.get(i));
      }
    } else {
      terms.add(crossSection);
      factors.add(scaleFactor);
    }
  }

  /** {@inheritDoc} */
  @Override
  public double value(double energy) {
    double value = 0.0;
    for (int i = 0; i < crossSections.size(); i++) {
      value += scaleFactors.get(i) * crossSections.get(i).value(energy);
    }
    return value;
  }

  /** {@inheritDoc} */
  @Override
  public double[] value(double[] energies) {
    double[] values = new double[energies.length];
    for (int i = 0; i < crossSections.size(); i++) {
      double scaleFactor = scaleFactors.get(i);
      double[] term = crossSections.get(i).value(energies);
      for (int j = 0; j < energies.length; j++) {
        values[j] += scaleFactor * term[j];
      }
    }
    return values;
  }

  /**
   * {@inheritDoc}
   *
   * <p>Every term provides its own grid with nPoints points, and the result is the sorted union of
   * these grids. An empty sum returns the equidistant energy grid.
   */
  @Override
  public double[] equidistantProbabilityGrid(double lowerLimit, double upperLimit, int nPoints) {
    if (crossSections.isEmpty()) {
      return equidistantEnergyGrid(lowerLimit, upperLimit, nPoints);
    }
    double[][] grids = new double[crossSections.size()][];
    for (int i = 0; i < crossSections.size(); i++) {
      grids[i] = crossSections.get(i).equidistantProbabilityGrid(lowerLimit, upperLimit, nPoints);
    }
    return Grids.union(grids);
  }

  /**
   * Terms of the sum.
   *
   * @return an unmodifiable list.
   */
  public List<CrossSection> getCrossSections() {
    return crossSections;
  }

  /**
   * Coefficients of the terms, in the order of {@link #getCrossSections()}.
   *
   * @return an unmodifiable list.
   */
  public List<Double> getScaleFactors() {
    return scaleFactors;
  }

  public int size() {
    return crossSections.size();
  }
}
