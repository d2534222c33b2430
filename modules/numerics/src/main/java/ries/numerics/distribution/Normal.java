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

import org.apache.commons.math3.distribution.NormalDistribution;

/**
 * Normal (Gauss) distribution, the line shape of a resonance that is dominated by Doppler broadening.
 *
 * @since 1.0
 */
public class Normal implements ProbabilityDistribution {

  private final NormalDistribution distribution;

  /**
   * Constructor for Normal.
   *
   * @param location mean of the distribution.
   * @param scale standard deviation.
   */
  public Normal(double location, double scale) {
    // No random generator is needed, since the distribution is never sampled.
    distribution = new NormalDistribution(null, location, scale);
  }

  /** {@inheritDoc} */
  @Override
  public double pdf(double x) {
    return distribution.density(x);
  }

  /** {@inheritDoc} */
  @Override
  public double cdf(double x) {
    return distribution.cumulativeProbability(x);
  }

  /** {@inheritDoc} */
  @Override
  public double ppf(double quantile) {
    ProbabilityDistribution.checkQuantile(quantile);
    return distribution.inverseCumulativeProbability(quantile);
  }

  public double getLocation() {
    return distribution.getMean();
  }

  public double getScale() {
    return distribution.getStandardDeviation();
  }
}
