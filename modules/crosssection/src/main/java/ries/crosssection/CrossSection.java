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

import java.util.ArrayList;
import java.util.List;
import org.apache.commons.math3.analysis.UnivariateFunction;
import ries.numerics.math.Grids;

/**
 * Energy-dependent cross section of a reaction, per target particle.
 *
 * <p>Cross sections of mutually exclusive reactions can be added, and a cross section can be
 * scaled by a constant. Both operations return a {@link CrossSectionWeightedSum}, so that the
 * operands themselves are never modified. Energies are in MeV and cross sections in fm^2.
 *
 * @since 1.0
 */
public abstract class CrossSection implements UnivariateFunction {

  /**
   * Evaluate the cross section.
   *
   * @param energy kinetic energy of the incident particle.
   * @return the cross section at the given energy.
   */
  @Override
  public abstract double value(double energy);

  /**
   * Evaluate the cross section at many energies.
   *
   * @param energies kinetic energies of the incident particle.
   * @return the cross sections at the given energies.
   */
  public double[] value(double[] energies) {
    double[] values = new double[energies.length];
    for (int i = 0; i < energies.length; i++) {
      values[i] = value(energies[i]);
    }
    return values;
  }

  /**
   * Sum of this cross section and another one.
   *
   * @param other the cross section to add.
   * @return a new weighted sum; nested sums are flattened.
   */
  public CrossSectionWeightedSum add(CrossSection other) {
    List<CrossSection> crossSections = new ArrayList<>();
    List<Double> scaleFactors = new ArrayList<>();
    CrossSectionWeightedSum.appendTerms(this, 1.0, crossSections, scaleFactors);
    CrossSectionWeightedSum.appendTerms(other, 1.0, crossSections, scaleFactors);
    return new CrossSectionWeightedSum(crossSections, scaleFactors);
  }

  /**
   * Sum of this cross section and a constant.
   *
   * @param constant the constant, which is wrapped in a {@link ConstantCrossSection}.
   * @return a new weighted sum.
   */
  public CrossSectionWeightedSum add(double constant) {
    return add(new ConstantCrossSection(constant));
  }

  /**
   * Multiply this cross section by a scalar.
   *
   * @param scaleFactor the scalar.
   * @return a new weighted sum.
   */
  public CrossSectionWeightedSum multiply(double scaleFactor) {
    List<CrossSection> crossSections = new ArrayList<>();
    List<Double> scaleFactors = new ArrayList<>();
    CrossSectionWeightedSum.appendTerms(this, scaleFactor, crossSections, scaleFactors);
    return new CrossSectionWeightedSum(crossSections, scaleFactors);
  }

  /**
   * Sum of several cross sections. The summation starts from an empty weighted sum, which
   * evaluates to zero.
   *
   * @param crossSections the terms.
   * @return the weighted sum of all terms.
   */
  public static CrossSectionWeightedSum sum(Iterable<? extends CrossSection> crossSections) {
    CrossSectionWeightedSum sum = new CrossSectionWeightedSum(List.of(), List.of());
    for (CrossSection crossSection : crossSections) {
      sum = sum.add(crossSection);
    }
    return sum;
  }

  /**
   * Equidistant grid in the given energy range.
   *
   * @param lowerLimit first energy of the grid.
   * @param upperLimit last energy of the grid.
   * @param nPoints number of grid points, i.e. number of intervals plus 1.
   * @return the grid.
   */
  public double[] equidistantEnergyGrid(double lowerLimit, double upperLimit, int nPoints) {
    return Grids.linspace(lowerLimit, upperLimit, nPoints);
  }

  /**
   * Grid in the given energy range whose intervals all contain the same fraction of the
   * energy-integrated cross section.
   *
   * <p>Only cross sections with a finite energy integral can provide such a grid.
   *
   * @param lowerLimit first energy of the grid.
   * @param upperLimit last energy of the grid.
   * @param nPoints number of grid points, i.e. number of intervals plus 1.
   * @return the grid.
   * @throws UnsupportedOperationException if the cross section does not know its integral.
   */
  public double[] equidistantProbabilityGrid(double lowerLimit, double upperLimit, int nPoints) {
    throw new UnsupportedOperationException(
        getClass().getName() + " does not provide an equidistant probability grid.");
  }
}
