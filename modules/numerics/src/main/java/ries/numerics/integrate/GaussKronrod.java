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
import static org.apache.commons.math3.util.FastMath.pow;

import java.util.PriorityQueue;
import java.util.logging.Logger;
import org.apache.commons.configuration2.CompositeConfiguration;
import org.apache.commons.math3.analysis.MultivariateFunction;
import org.apache.commons.math3.analysis.UnivariateFunction;
import ries.utilities.RiesProperties;

/**
 * Globally adaptive quadrature with the 21-point Gauss-Kronrod rule.
 *
 * <p>The interval with the largest error estimate is bisected until the total error satisfies the
 * absolute or the relative tolerance, or until the maximum number of subintervals is reached. The
 * error estimate of each subinterval follows QUADPACK (R. Piessens et al., QUADPACK, Springer 1983):
 * the difference between the 10-point Gauss and the 21-point Kronrod result, scaled by an estimate
 * of the smoothness of the integrand.
 *
 * <p>Like any adaptive rule, it only sees the function at its nodes: a peak much narrower than the
 * distance between neighboring nodes can be missed entirely. See {@link PartitionedQuadrature}.
 *
 * @since 1.0
 */
public class GaussKronrod {

  private static final Logger logger = Logger.getLogger(GaussKronrod.class.getName());

  /** Default absolute tolerance. */
  public static final double DEFAULT_ABSOLUTE_ACCURACY = 1.49e-8;
  /** Default relative tolerance. */
  public static final double DEFAULT_RELATIVE_ACCURACY = 1.49e-8;
  /** Default maximum number of subintervals. */
  public static final int DEFAULT_MAX_INTERVALS = 50;

  /** Kronrod abscissae; odd indices are the Gauss abscissae. */
  private static final double[] XGK = {
      0.995657163025808080735527280689003, 0.973906528517171720077964012084452,
      0.930157491355708226001207180059508, 0.865063366688984510732096688423493,
      0.780817726586416897063717578345042, 0.679409568299024406234327365114874,
      0.562757134668604683339000099272694, 0.433395394129247190799265943165784,
      0.294392862701460198131126603103866, 0.148874338981631210884826001129720,
      0.000000000000000000000000000000000};
  /** Kronrod weights. */
  private static final double[] WGK = {
      0.011694638867371874278064396062192, 0.032558162307964727478818972459390,
      0.054755896574351996031381300244580, 0.075039674810919952767043140916190,
      0.093125454583697605535065465083366, 0.109387158802297641899210590325805,
      0.123491976262065851077208980111803, 0.134709217311473325928054001771707,
      0.142775938577060080797094273138717, 0.147739104901338491374841515972068,
      0.149445554002916905664936468389821};
  /** Gauss weights. */
  private static final double[] WG = {
      0.066671344308688137593568809893332, 0.149451349150580593145776339657697,
      0.219086362515982043995534934228163, 0.269266719309996355091226921569469,
      0.295524224714752870173892994651338};
  private static final double EPSILON = Math.ulp(1.0);

  private final double absoluteAccuracy;
  private final double relativeAccuracy;
  private final int maxIntervals;

  /** Constructor for GaussKronrod with the tolerances of the RIES properties. */
  public GaussKronrod() {
    this(RiesProperties.getProperties());
  }

  /**
   * Constructor for GaussKronrod.
   *
   * @param properties source of quadrature-absolute-accuracy, quadrature-relative-accuracy and
   *     quadrature-max-intervals.
   */
  public GaussKronrod(CompositeConfiguration properties) {
    this(properties.getDouble("quadrature-absolute-accuracy", DEFAULT_ABSOLUTE_ACCURACY),
        properties.getDouble("quadrature-relative-accuracy", DEFAULT_RELATIVE_ACCURACY),
        properties.getInt("quadrature-max-intervals", DEFAULT_MAX_INTERVALS));
  }

  /**
   * Constructor for GaussKronrod.
   *
   * @param absoluteAccuracy absolute tolerance.
   * @param relativeAccuracy relative tolerance.
   * @param maxIntervals maximum number of subintervals.
   */
  public GaussKronrod(double absoluteAccuracy, double relativeAccuracy, int maxIntervals) {
    if (absoluteAccuracy < 0.0 || relativeAccuracy < 0.0 || maxIntervals < 1) {
      throw new IllegalArgumentException(format(
          " Invalid quadrature settings (absolute %g, relative %g, intervals %d).",
          absoluteAccuracy, relativeAccuracy, maxIntervals));
    }
    this.absoluteAccuracy = absoluteAccuracy;
    this.relativeAccuracy = relativeAccuracy;
    this.maxIntervals = maxIntervals;
  }

  /**
   * Integrate a function over [a, b].
   *
   * @param function the integrand.
   * @param a lower limit.
   * @param b upper limit.
   * @return the integral and its estimated absolute error.
   */
  public IntegralEstimate integrate(UnivariateFunction function, double a, double b) {
    if (a == b) {
      return new IntegralEstimate(0.0, 0.0);
    }
    if (a > b) {
      IntegralEstimate reversed = integrate(function, b, a);
      return new IntegralEstimate(-reversed.value(), reversed.error());
    }

    PriorityQueue<Segment> segments = new PriorityQueue<>((s1, s2) -> Double.compare(s2.error, s1.error));
    Segment first = rule(function, a, b);
    segments.add(first);
    double value = first.value;
    double error = first.error;

    while (error > max(absoluteAccuracy, relativeAccuracy * abs(value)) && segments.size() < maxIntervals) {
      Segment worst = segments.peek();
      double mid = 0.5 * (worst.a + worst.b);
      if (mid <= worst.a || mid >= worst.b) {
        // The interval cannot be split further in double precision.
        break;
      }
      segments.poll();
      Segment left = rule(function, worst.a, mid);
      Segment right = rule(function, mid, worst.b);
      segments.add(left);
      segments.add(right);
      value = 0.0;
      error = 0.0;
      for (Segment segment : segments) {
        value += segment.value;
        error += segment.error;
      }
    }

    IntegralEstimate estimate = new IntegralEstimate(value, error);
    if (!estimate.isConverged(absoluteAccuracy, relativeAccuracy)) {
      logger.warning(format(" Integral over [%g, %g] did not reach the requested accuracy with %d subintervals"
          + " (estimate %g, error %g).", a, b, segments.size(), value, error));
    }
    return estimate;
  }

  /**
   * Integrate a function of several variables over a rectangular domain by nested one-dimensional
   * quadrature. The first variable is integrated innermost.
   *
   * @param function the integrand; it receives a point with one coordinate per range.
   * @param ranges the {lower, upper} limits of each variable.
   * @return the integral and the error estimate of the outermost integration.
   */
  public IntegralEstimate integrate(MultivariateFunction function, double[][] ranges) {
    if (ranges.length == 0) {
      throw new IllegalArgumentException(" At least one integration range is required.");
    }
    for (double[] range : ranges) {
      if (range.length != 2) {
        throw new IllegalArgumentException(format(" Integration ranges need 2 limits (%d).", range.length));
      }
    }
    double[] point = new double[ranges.length];
    return integrate(function, ranges, point, ranges.length - 1);
  }

  private IntegralEstimate integrate(MultivariateFunction function, double[][] ranges, double[] point, int dimension) {
    double[] range = ranges[dimension];
    if (dimension == 0) {
      return integrate(x -> {
        point[0] = x;
        return function.value(point);
      }, range[0], range[1]);
    }
    return integrate(x -> {
      point[dimension] = x;
      return integrate(function, ranges, point, dimension - 1).value();
    }, range[0], range[1]);
  }

  public double getAbsoluteAccuracy() {
    return absoluteAccuracy;
  }

  public double getRelativeAccuracy() {
    return relativeAccuracy;
  }

  public int getMaxIntervals() {
    return maxIntervals;
  }

  /** Apply the 21-point Kronrod rule and its embedded 10-point Gauss rule to [a, b]. */
  private static Segment rule(UnivariateFunction function, double a, double b) {
    double center = 0.5 * (a + b);
    double halfLength = 0.5 * (b - a);
    double[] fv1 = new double[10];
    double[] fv2 = new double[10];

    double fc = function.value(center);
    double resultGauss = 0.0;
    double resultKronrod = WGK[10] * fc;
    double resultAbs = abs(resultKronrod);
    for (int j = 0; j < 10; j++) {
      double abscissa = halfLength * XGK[j];
      double f1 = function.value(center - abscissa);
      double f2 = function.value(center + abscissa);
      fv1[j] = f1;
      fv2[j] = f2;
      double sum = f1 + f2;
      resultKronrod += WGK[j] * sum;
      resultAbs += WGK[j] * (abs(f1) + abs(f2));
      if (j % 2 == 1) {
        resultGauss += WG[j / 2] * sum;
      }
    }

    double mean = 0.5 * resultKronrod;
    double resultAsc = WGK[10] * abs(fc - mean);
    for (int j = 0; j < 10; j++) {
      resultAsc += WGK[j] * (abs(fv1[j] - mean) + abs(fv2[j] - mean));
    }

    double value = resultKronrod * halfLength;
    resultAbs *= halfLength;
    resultAsc *= halfLength;
    double error = abs((resultKronrod - resultGauss) * halfLength);
    if (resultAsc != 0.0 && error != 0.0) {
      error = resultAsc * min(1.0, pow(200.0 * error / resultAsc, 1.5));
    }
    if (resultAbs > Double.MIN_NORMAL / (50.0 * EPSILON)) {
      error = max(50.0 * EPSILON * resultAbs, error);
    }
    return new Segment(a, b, value, error);
  }

  /** A subinterval with its integral and error estimate. */
  private record Segment(double a, double b, double value, double error) {
  }
}
