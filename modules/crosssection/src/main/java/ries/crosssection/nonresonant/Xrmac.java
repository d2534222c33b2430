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
package ries.crosssection.nonresonant;

import static java.lang.String.format;
import static org.apache.commons.math3.util.FastMath.log10;
import static org.apache.commons.math3.util.FastMath.pow;
import static ries.utilities.Constants.ATOMIC_MASS_UNIT_KG;
import static ries.utilities.Constants.CM_TO_FM;
import static ries.utilities.Constants.KG_TO_GRAMS;

import java.util.function.DoubleUnaryOperator;
import org.apache.commons.math3.util.MathArrays;
import org.apache.commons.math3.util.MathArrays.OrderDirection;

/**
 * Nonresonant attenuation cross section from tabulated x-ray mass attenuation coefficients
 * (XRMAC), for example those of J.H. Hubbell and S.M. Seltzer (NIST Standard Reference Database
 * 126).
 *
 * <p>The base-10 logarithms of the coefficients are interpolated linearly in the base-10 logarithm
 * of the energy. Outside of the table, the first or the last coefficient is returned.
 *
 * <p>Absorption edges are listed twice at the same energy. The coefficient below an edge is
 * interpolated towards the first entry, and the coefficient at and above the edge starts from the
 * second entry.
 *
 * @since 1.0
 */
public class Xrmac extends NonresonantCrossSection {

  private final double[] energies;
  private final double[] coefficients;
  private final double[] logEnergies;
  private final double[] logCoefficients;

  /**
   * Constructor for Xrmac without unit conversion.
   *
   * @param energies energies of the table, in increasing order.
   * @param coefficients attenuation coefficients at these energies.
   */
  public Xrmac(double[] energies, double[] coefficients) {
    this(energies, coefficients, DoubleUnaryOperator.identity(), DoubleUnaryOperator.identity());
  }

  /**
   * Constructor for Xrmac.
   *
   * @param energies energies of the table, in increasing order.
   * @param coefficients attenuation coefficients at these energies.
   * @param energyConversion converts the tabulated energies to MeV.
   * @param coefficientConversion converts the tabulated coefficients to cross sections.
   */
  public Xrmac(double[] energies, double[] coefficients, DoubleUnaryOperator energyConversion,
      DoubleUnaryOperator coefficientConversion) {
    if (energies.length != coefficients.length) {
      throw new IllegalArgumentException(format(" %d energies, but %d coefficients.", energies.length, coefficients.length));
    }
    if (energies.length < 2) {
      throw new IllegalArgumentException(format(" At least 2 table entries are required (%d).", energies.length));
    }
    this.energies = new double[energies.length];
    this.coefficients = new double[energies.length];
    logEnergies = new double[energies.length];
    logCoefficients = new double[energies.length];
    for (int i = 0; i < energies.length; i++) {
      this.energies[i] = energyConversion.applyAsDouble(energies[i]);
      this.coefficients[i] = coefficientConversion.applyAsDouble(coefficients[i]);
      if (!(this.energies[i] > 0.0) || !(this.coefficients[i] > 0.0)) {
        throw new IllegalArgumentException(format(" Table entry %d (%g, %g) is not positive.",
            i, this.energies[i], this.coefficients[i]));
      }
      logEnergies[i] = log10(this.energies[i]);
      logCoefficients[i] = log10(this.coefficients[i]);
    }
    // Throws NonMonotonicSequenceException for decreasing energies; repeated energies are edges.
    MathArrays.checkOrder(logEnergies, OrderDirection.INCREASING, false);
  }

  /**
   * Conversion of a mass attenuation coefficient in cm^2 / g to a cross section in fm^2 per atom.
   *
   * @param amu mass of the atom in atomic mass units.
   * @return the conversion function.
   */
  public static DoubleUnaryOperator massAttenuationToCrossSection(double amu) {
    double factor = CM_TO_FM * CM_TO_FM * amu * ATOMIC_MASS_UNIT_KG * KG_TO_GRAMS;
    return coefficient -> coefficient * factor;
  }

  /** {@inheritDoc} */
  @Override
  public double value(double energy) {
    if (energy <= energies[0]) {
      return coefficients[0];
    }
    int last = energies.length - 1;
    if (energy >= energies[last]) {
      return coefficients[last];
    }
    double x = log10(energy);
    // Last entry with logEnergies[i] <= x, so that logEnergies[i + 1] > x.
    int lo = 0;
    int hi = last;
    while (hi - lo > 1) {
      int mid = (lo + hi) >>> 1;
      if (logEnergies[mid] <= x) {
        lo = mid;
      } else {
        hi = mid;
      }
    }
    double t = (x - logEnergies[lo]) / (logEnergies[lo + 1] - logEnergies[lo]);
    return pow(10.0, logCoefficients[lo] + t * (logCoefficients[lo + 1] - logCoefficients[lo]));
  }

  /**
   * Tabulated energies after conversion.
   *
   * @return a copy of the energies.
   */
  public double[] getEnergies() {
    return energies.clone();
  }

  /**
   * Tabulated cross sections after conversion.
   *
   * @return a copy of the coefficients.
   */
  public double[] getCoefficients() {
    return coefficients.clone();
  }
}
