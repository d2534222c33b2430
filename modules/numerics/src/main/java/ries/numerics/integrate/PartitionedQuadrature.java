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
package ries.numerics.integrate;

import static org.apache.commons.math3.util.FastMath.sqrt;

import org.apache.commons.math3.analysis.MultivariateFunction;
import org.apache.commons.math3.analysis.UnivariateFunction;
import ries.numerics.math.Grids;

/**
 * Adaptive quadrature on each interval of a given partition.
 *
 * <p>A single adaptive integration over a wide range can miss a peak that is much narrower than the
 * spacing of its first nodes. If the partition is dense where the integrand is large (for example,
 * an equidistant-probability grid of a resonance), every part of the peak is seen by at least one
 * subinterval. The integrals of the subintervals are summed, and their error estimates are added in
 * quadrature.
 *
 * @since 1.0
 */
public class PartitionedQuadrature {

  private final GaussKronrod quadrature;

  /** Constructor for PartitionedQuadrature with the tolerances of the RIES properties. */
  public PartitionedQuadrature() {
    this(new GaussKronrod());
  }

  /**
   * Constructor for PartitionedQuadrature.
   *
   * @param quadrature the rule applied to each subinterval.
   */
  public PartitionedQuadrature(GaussKronrod quadrature) {
    this.quadrature = quadrature;
  }

  /**
   * Integrate a function over the range of a partition.
   *
   * @param function the integrand.
   * @param x partition, in non-decreasing order.
   * @return the integral from x[0] to x[n-1] and its estimated error.
   */
  public IntegralEstimate integrate(UnivariateFunction function, double[] x) {
    Grids.checkPartition(x);
    double value = 0.0;
    double variance = 0.0;
    for (int i = 0; i < x.length - 1; i++) {
      IntegralEstimate estimate = quadrature.integrate(function, x[i], x[i + 1]);
      value += estimate.value();
      variance += estimate.error() * estimate.error();
    }
    return new IntegralEstimate(value, sqrt(variance));
  }

  /**
   * Integrate a function of several variables. The first variable is integrated over the range of
   * the partition, the others over fixed limits.
   *
   * @param function the integrand f(x, y_1, ..., y_m).
   * @param x partition of the first variable, in non-decreasing order.
   * @param limits the {lower, upper} limits of the variables y_1 ... y_m.
   * @return the integral and its estimated error.
   */
  public IntegralEstimate integrate(MultivariateFunction function, double[] x, double[][] limits) {
    Grids.checkPartition(x);
    double[][] ranges = new double[limits.length + 1][];
    System.arraycopy(limits, 0, ranges, 1, limits.length);
    double value = 0.0;
    double variance = 0.0;
    for (int i = 0; i < x.length - 1; i++) {
      ranges[0] = new double[] {x[i], x[i + 1]};
      IntegralEstimate estimate = quadrature.integrate(function, ranges);
      value += estimate.value();
      variance += estimate.error() * estimate.error();
    }
    return new IntegralEstimate(value, sqrt(variance));
  }

  public GaussKronrod getQuadrature() {
    return quadrature;
  }
}
