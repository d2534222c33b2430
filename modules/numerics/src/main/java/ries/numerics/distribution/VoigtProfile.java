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
import static org.apache.commons.math3.util.FastMath.sqrt;

import org.apache.commons.configuration2.CompositeConfiguration;
import ries.numerics.special.Faddeeva;
import ries.utilities.RiesProperties;

/**
 * Voigt profile: the convolution of a normal distribution and a Cauchy distribution.
 *
 * <p>The density is evaluated exactly with the Faddeeva function. The cumulative distribution
 * function of the Voigt profile has no closed form, so the CDF of the approximating pseudo-Voigt
 * profile is used instead. Its inverse is found by Newton-Raphson iteration with the exact Voigt
 * density as derivative, and falls back to the weighted average of the normal and Cauchy quantiles
 * like the pseudo-Voigt profile does.
 *
 * @since 1.0
 */
public class VoigtProfile extends PseudoVoigtProfile {

  /** Constant <code>GAUSSIAN_FWHM_PER_SIGMA = 2.0 * sqrt(2.0) * SQRT_LN2</code> */
  public static final double GAUSSIAN_FWHM_PER_SIGMA = 2.0 * sqrt(2.0) * SQRT_LN2;

  private final double sigma;
  private final double gamma;
  private final Cauchy lorentzian;

  /**
   * Constructor for VoigtProfile with the solver settings of the RIES properties.
   *
   * @param location center of the profile.
   * @param sigma standard deviation of the normal distribution.
   * @param gamma half width at half maximum of the Cauchy distribution.
   */
  public VoigtProfile(double location, double sigma, double gamma) {
    this(location, sigma, gamma, RiesProperties.getProperties());
  }

  /**
   * Constructor for VoigtProfile.
   *
   * @param location center of the profile.
   * @param sigma standard deviation of the normal distribution.
   * @param gamma half width at half maximum of the Cauchy distribution.
   * @param properties source of the solver settings.
   */
  public VoigtProfile(double location, double sigma, double gamma, CompositeConfiguration properties) {
    super(location,
        mixingParameter(2.0 * gamma, combinedFwhm(GAUSSIAN_FWHM_PER_SIGMA * sigma, 2.0 * gamma)),
        combinedFwhm(GAUSSIAN_FWHM_PER_SIGMA * sigma, 2.0 * gamma),
        properties);
    if (!(sigma >= 0.0) || !(gamma >= 0.0)) {
      throw new IllegalArgumentException(format(" Voigt widths must not be negative (sigma %g, gamma %g).", sigma, gamma));
    }
    this.sigma = sigma;
    this.gamma = gamma;
    lorentzian = sigma == 0.0 ? new Cauchy(location, gamma) : null;
  }

  /** {@inheritDoc} */
  @Override
  public double pdf(double x) {
    if (lorentzian != null) {
      return lorentzian.pdf(x);
    }
    return Faddeeva.voigt(x - location, sigma, gamma);
  }

  public double getSigma() {
    return sigma;
  }

  public double getGamma() {
    return gamma;
  }
}
