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

import java.util.Arrays;

/**
 * A cross section that does not depend on the energy, for example a nonresonant background.
 *
 * <p>The integral of a constant over all energies is infinite, so its probability grid is the
 * equidistant energy grid.
 *
 * @since 1.0
 */
public class ConstantCrossSection extends CrossSection {

  private final double constant;

  /**
   * Constructor for ConstantCrossSection.
   *
   * @param constant the cross section in fm^2.
   */
  public ConstantCrossSection(double constant) {
    this.constant = constant;
  }

  /** {@inheritDoc} */
  @Override
  public double value(double energy) {
    return constant;
  }

  /** {@inheritDoc} */
  @Override
  public double[] value(double[] energies) {
    double[] values = new double[energies.length];
    Arrays.fill(values, constant);
    return values;
  }

  /** {@inheritDoc} */
  @Override
  public double[] equidistantProbabilityGrid(double lowerLimit, double upperLimit, int nPoints) {
    return equidistantEnergyGrid(lowerLimit, upperLimit, nPoints);
  }

  public double getConstant() {
    return constant;
  }
}
