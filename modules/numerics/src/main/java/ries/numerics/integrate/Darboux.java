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

import static java.lang.String.format;
import static org.apache.commons.math3.util.FastMath.abs;
import static org.apache.commons.math3.util.FastMath.max;
import static org.apache.commons.math3.util.FastMath.min;

import org.apache.commons.math3.analysis.UnivariateFunction;
import ries.numerics.math.Grids;

/**
 * Darboux sums of a function sampled on a partition.
 *
 * <p>For each pair of neighboring points, the smaller and the larger of the two function values are
 * multiplied by the width of the interval. The sum of the smaller products (the lower sum) is
 * returned as the estimate of the integral, and the difference between the upper and the lower sum
 * as its error. For a function that is monotonic between neighboring points, the integral lies
 * between the two sums. No further evaluations are made, which makes the method useful for
 * expensive functions on fine grids.
 *
 * @since 1.0
 */
public class Darboux {

  /** Private constructor prevents instantiation. */
  private Darboux() {
  }

  /**
   * Lower and upper Darboux sums.
   *
   * @param fx Function values at the points x.
   * @param x Partition, in non-decreasing order.
   * @return an array {lower sum, upper sum}.
   */
  public static double[] sums(double[] fx, double[] x) {
    if (fx.length != x.length) {
      throw new IllegalArgumentException(
          format(" Number of function values (%d) and points (%d) differ.", fx.length, x.length));
    }
    Grids.checkPartition(x);
    double lower = 0.0;
    double upper = 0.0;
    for (int i = 0; i < x.length - 1; i++) {
      double width = x[i + 1] - x[i];
      lower += min(fx[i], fx[i + 1]) * width;
      upper += max(fx[i], fx[i + 1]) * width;
    }
    return new double[] {lower, upper};
  }

  /**
   * Darboux approximation of an integral from sampled function values.
   *
   * @param fx Function values at the points x.
   * @param x Partition, in non-decreasing order.
   * @return the lower sum and the absolute difference between upper and lower sum.
   */
  public static IntegralEstimate integrate(double[] fx, double[] x) {
    double[] sums = sums(fx, x);
    return new IntegralEstimate(sums[0], abs(sums[1] - sums[0]));
  }

  /**
   * Darboux approximation of an integral.
   *
   * @param function Function to sample at the points x.
   * @param x Partition, in non-decreasing order.
   * @return the lower sum and the absolute difference between upper and lower sum.
   */
  public static IntegralEstimate integrate(UnivariateFunction function, double[] x) {
    double[] fx = new double[x.length];
    for (int i = 0; i < x.length; i++) {
      fx[i] = function.value(x[i]);
    }
    return integrate(fx, x);
  }
}
