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

import static java.lang.String.format;
import static org.apache.commons.math3.util.FastMath.log;
import static org.apache.commons.math3.util.FastMath.max;
import static org.apache.commons.math3.util.FastMath.min;
import static org.apache.commons.math3.util.FastMath.pow;
import static org.apache.commons.math3.util.FastMath.sqrt;

import java.util.logging.Logger;
import org.apache.commons.configuration2.CompositeConfiguration;
import org.apache.commons.math3.analysis.differentiation.DerivativeStructure;
import org.apache.commons.math3.analysis.differentiation.UnivariateDifferentiableFunction;
import org.apache.commons.math3.analysis.solvers.NewtonRaphsonSolver;
import org.apache.commons.math3.exception.TooManyEvaluationsException;
import ries.utilities.RiesProperties;

/**
 * Pseudo-Voigt profile: the linear combination (1 - eta) Normal + eta Cauchy of a normal and a
 * Cauchy distribution with the same center and the same full width at half maximum (FWHM).
 *
 * <p>The mixing parameter eta and the combined FWHM of an approximate Voigt profile are obtained
 * from the Gaussian and Lorentzian widths with the empirical polynomials of P. Thompson, D.E. Cox
 * and J.B. Hastings, J. Appl. Cryst. 20 (1987) 79, see {@link #fromWidths(double, double, double)}.
 *
 * <p>The percent point function has no closed form. It is found by Newton-Raphson iteration of
 * cdf(x) - q = 0, starting at the center. If any of the requested quantiles fails to converge, all
 * of them are replaced by the weighted average (1 - eta) ppf_Normal + eta ppf_Cauchy, and a warning
 * is logged.
 *
 * @since 1.0
 */
public class PseudoVoigtProfile implements ProbabilityDistribution {

  private static final Logger logger = Logger.getLogger(PseudoVoigtProfile.class.getName());

  /** Constant <code>SQRT_LN2 = sqrt(log(2.0))</code> */
  public static final double SQRT_LN2 = sqrt(log(2.0));
  /** Default iteration cap of the quantile solver. */
  public static final int DEFAULT_MAX_EVALUATIONS = 100;
  /** Default accuracy of the quantile solver, relative to the FWHM. */
  public static final double DEFAULT_RELATIVE_ACCURACY = 1.0e-8;

  /** Center of the profile. */
  protected final double location;
  /** Weight of the Cauchy distribution. */
  protected final double eta;
  /** Combined full width at half maximum. */
  protected final double fwhm;
  private final Normal normal;
  private final Cauchy cauchy;
  private final int maxEvaluations;
  private final double absoluteAccuracy;

  /**
   * Constructor for PseudoVoigtProfile with the solver settings of the RIES properties
   * (ppf-max-evaluations and ppf-relative-accuracy).
   *
   * @param location center of the profile.
   * @param eta weight of the Cauchy distribution, in [0, 1].
   * @param fwhm full width at half maximum of both components.
   */
  public PseudoVoigtProfile(double location, double eta, double fwhm) {
    this(location, eta, fwhm, RiesProperties.getProperties());
  }

  /**
   * Constructor for PseudoVoigtProfile.
   *
   * @param location center of the profile.
   * @param eta weight of the Cauchy distribution, in [0, 1].
   * @param fwhm full width at half maximum of both components.
   * @param properties source of the solver settings.
   */
  public PseudoVoigtProfile(double location, double eta, double fwhm, CompositeConfiguration properties) {
    this(location, eta, fwhm,
        properties.getInt("ppf-max-evaluations", DEFAULT_MAX_EVALUATIONS),
        properties.getDouble("ppf-relative-accuracy", DEFAULT_RELATIVE_ACCURACY));
  }

  /**
   * Constructor for PseudoVoigtProfile.
   *
   * @param location center of the profile.
   * @param eta weight of the Cauchy distribution, in [0, 1].
   * @param fwhm full width at half maximum of both components.
   * @param maxEvaluations iteration cap of the quantile solver.
   * @param relativeAccuracy accuracy of the quantile solver, relative to the FWHM.
   */
  public PseudoVoigtProfile(double location, double eta, double fwhm, int maxEvaluations,
      double relativeAccuracy) {
    if (!(eta >= 0.0 && eta <= 1.0)) {
      throw new IllegalArgumentException(format(" The pseudo-Voigt mixing parameter %g is not in [0, 1].", eta));
    }
    if (!(fwhm > 0.0) || Double.isInfinite(fwhm)) {
      throw new IllegalArgumentException(format(" The pseudo-Voigt FWHM must be positive and finite (%g).", fwhm));
    }
    if (!(relativeAccuracy > 0.0)) {
      throw new IllegalArgumentException(format(" The solver accuracy must be positive (%g).", relativeAccuracy));
    }
    if (maxEvaluations < 1) {
      throw new IllegalArgumentException(format(" At least one evaluation is required (%d).", maxEvaluations));
    }
    this.location = location;
    this.eta = eta;
    this.fwhm = fwhm;
    this.maxEvaluations = maxEvaluations;
    normal = new Normal(location, fwhm / (2.0 * sqrt(2.0) * SQRT_LN2));
    cauchy = new Cauchy(location, 0.5 * fwhm);
    absoluteAccuracy = relativeAccuracy * fwhm;
  }

  /**
   * Pseudo-Voigt approximation of the Voigt profile with the given component widths.
   *
   * @param location center of the profile.
   * @param gaussianFwhm FWHM of the normal distribution.
   * @param lorentzianFwhm FWHM of the Cauchy distribution.
   * @return the approximating pseudo-Voigt profile.
   */
  public static PseudoVoigtProfile fromWidths(double location, double gaussianFwhm, double lorentzianFwhm) {
    double gamma = combinedFwhm(gaussianFwhm, lorentzianFwhm);
    return new PseudoVoigtProfile(location, mixingParameter(lorentzianFwhm, gamma), gamma);
  }

  /**
   * Combined FWHM of a Voigt profile.
   *
   * @param gaussianFwhm FWHM of the normal distribution.
   * @param lorentzianFwhm FWHM of the Cauchy distribution.
   * @return the FWHM of the profile.
   */
  public static double combinedFwhm(double gaussianFwhm, double lorentzianFwhm) {
    double g = gaussianFwhm;
    double l = lorentzianFwhm;
    double g2 = g * g;
    double l2 = l * l;
    return pow(g2 * g2 * g
        + 2.69269 * g2 * g2 * l
        + 2.42843 * g2 * g * l2
        + 4.47163 * g2 * l2 * l
        + 0.07842 * g * l2 * l2
        + l2 * l2 * l, 0.2);
  }

  /**
   * Weight of the Cauchy distribution in a pseudo-Voigt profile.
   *
   * @param lorentzianFwhm FWHM of the Cauchy distribution.
   * @param combinedFwhm combined FWHM of the profile.
   * @return the mixing parameter eta.
   */
  public static double mixingParameter(double lorentzianFwhm, double combinedFwhm) {
    double ratio = lorentzianFwhm / combinedFwhm;
    double eta = 1.36603 * ratio - 0.47719 * ratio * ratio + 0.11116 * ratio * ratio * ratio;
    // The polynomial is 1 at ratio = 1, up to rounding.
    return min(1.0, max(0.0, eta));
  }

  /** {@inheritDoc} */
  @Override
  public double pdf(double x) {
    return (1.0 - eta) * normal.pdf(x) + eta * cauchy.pdf(x);
  }

  /** {@inheritDoc} */
  @Override
  public double cdf(double x) {
    return (1.0 - eta) * normal.cdf(x) + eta * cauchy.cdf(x);
  }

  /** {@inheritDoc} */
  @Override
  public double ppf(double quantile) {
    return ppf(new double[] {quantile})[0];
  }

  /**
   * {@inheritDoc}
   *
   * <p>If the Newton-Raphson iteration fails for any quantile, the approximation of {@link
   * #approximatePpf(double)} is returned for all of them.
   */
  @Override
  public double[] ppf(double[] quantiles) {
    double[] values = new double[quantiles.length];
    for (int i = 0; i < quantiles.length; i++) {
      double q = quantiles[i];
      ProbabilityDistribution.checkQuantile(q);
      if (q == 0.0) {
        values[i] = Double.NEGATIVE_INFINITY;
      } else if (q == 1.0) {
        values[i] = Double.POSITIVE_INFINITY;
      } else {
        try {
          values[i] = solve(q);
        } catch (TooManyEvaluationsException | ArithmeticException e) {
          logger.warning(format(" Inversion of the CDF did not converge for quantile %.6g (%s).\n"
              + " Falling back to the weighted average of the normal and Cauchy quantiles.", q, e.getMessage()));
          double[] approximation = new double[quantiles.length];
          for (int j = 0; j < quantiles.length; j++) {
            approximation[j] = approximatePpf(quantiles[j]);
          }
          return approximation;
        }
      }
    }
    return values;
  }

  /**
   * Weighted average of the percent point functions of the two components.
   *
   * @param quantile a probability in [0, 1].
   * @return (1 - eta) ppf_Normal(quantile) + eta ppf_Cauchy(quantile).
   */
  public double approximatePpf(double quantile) {
    ProbabilityDistribution.checkQuantile(quantile);
    // A component with zero weight may have an infinite quantile.
    double value = 0.0;
    if (eta < 1.0) {
      value += (1.0 - eta) * normal.ppf(quantile);
    }
    if (eta > 0.0) {
      value += eta * cauchy.ppf(quantile);
    }
    return value;
  }

  /**
   * Derivative of the CDF used by the quantile solver.
   *
   * @param x the point of evaluation.
   * @return the derivative.
   */
  protected double cdfDerivative(double x) {
    return pdf(x);
  }

  private double solve(double quantile) {
    UnivariateDifferentiableFunction objective = new UnivariateDifferentiableFunction() {
      @Override
      public double value(double x) {
        return cdf(x) - quantile;
      }

      @Override
      public DerivativeStructure value(DerivativeStructure t) {
        double x = t.getValue();
        return t.compose(cdf(x) - quantile, cdfDerivative(x));
      }
    };
    // Solvers keep evaluation state, so each inversion uses its own instance.
    NewtonRaphsonSolver solver = new NewtonRaphsonSolver(absoluteAccuracy);
    double root = solver.solve(maxEvaluations, objective, -Double.MAX_VALUE, Double.MAX_VALUE, location);
    if (Double.isNaN(root) || Double.isInfinite(root)) {
      throw new ArithmeticException(format("non-finite root %g", root));
    }
    return root;
  }

  public double getLocation() {
    return location;
  }

  public double getEta() {
    return eta;
  }

  public double getFwhm() {
    return fwhm;
  }

  public int getMaxEvaluations() {
    return maxEvaluations;
  }
}
