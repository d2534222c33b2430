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
package ries.numerics.distribution;

/**
 * A continuous probability distribution over the real line, characterized by its probability
 * density function (PDF), cumulative distribution function (CDF) and percent point function (PPF,
 * the inverse of the CDF).
 *
 * <p>The array methods evaluate many points in one call. Implementations that can share work
 * between the points override them.
 *
 * @since 1.0
 */
public interface ProbabilityDistribution {

  /**
   * Probability density function.
   *
   * @param x the point of evaluation.
   * @return the density at x.
   */
  double pdf(double x);

  /**
   * Cumulative distribution function.
   *
   * @param x the point of evaluation.
   * @return the probability of a value less than or equal to x.
   */
  double cdf(double x);

  /**
   * Percent point function.
   *
   * @param quantile a probability in [0, 1].
   * @return the value x with cdf(x) = quantile.
   * @throws IllegalArgumentException if the quantile is outside of [0, 1].
   */
  double ppf(double quantile);

  /**
   * Probability density function for an array of points.
   *
   * @param x the points of evaluation.
   * @return the densities.
   */
  default double[] pdf(double[] x) {
    double[] values = new double[x.length];
    for (int i = 0; i < x.length; i++) {
      values[i] = pdf(x[i]);
    }
    return values;
  }

  /**
   * Cumulative distribution function for an array of points.
   *
   * @param x the points of evaluation.
   * @return the cumulative probabilities.
   */
  default double[] cdf(double[] x) {
    double[] values = new double[x.length];
    for (int i = 0; i < x.length; i++) {
      values[i] = cdf(x[i]);
    }
    return values;
  }

  /**
   * Percent point function for an array of quantiles.
   *
   * @param quantiles probabilities in [0, 1].
   * @return the corresponding values.
   */
  default double[] ppf(double[] quantiles) {
    double[] values = new double[quantiles.length];
    for (int i = 0; i < quantiles.length; i++) {
      values[i] = ppf(quantiles[i]);
    }
    return values;
  }

  /**
   * Check that a quantile is a probability.
   *
   * @param quantile the value to check.
   * @throws IllegalArgumentException if the quantile is NaN or outside of [0, 1].
   */
  static void checkQuantile(double quantile) {
    if (!(quantile >= 0.0 && quantile <= 1.0)) {
      throw new IllegalArgumentException(
          String.format(" Quantile %g is not in the interval [0, 1].", quantile));
    }
  }
}
