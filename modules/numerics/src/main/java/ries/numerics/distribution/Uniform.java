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

/**
 * Uniform distribution on the interval [location, location + scale].
 *
 * <p>The density inside the interval is exactly 1 / scale.
 *
 * @since 1.0
 */
public class Uniform implements ProbabilityDistribution {

  private final double location;
  private final double scale;
  private final double density;

  /**
   * Constructor for Uniform.
   *
   * @param location lower end of the support.
   * @param scale length of the support.
   */
  public Uniform(double location, double scale) {
    if (!(scale > 0.0) || Double.isInfinite(scale)) {
      throw new IllegalArgumentException(format(" The scale of a uniform distribution must be positive and finite (%g).", scale));
    }
    this.location = location;
    this.scale = scale;
    density = 1.0 / scale;
  }

  /** {@inheritDoc} */
  @Override
  public double pdf(double x) {
    if (x < location || x > location + scale) {
      return 0.0;
    }
    return density;
  }

  /** {@inheritDoc} */
  @Override
  public double cdf(double x) {
    if (x <= location) {
      return 0.0;
    }
    if (x >= location + scale) {
      return 1.0;
    }
    return (x - location) / scale;
  }

  /** {@inheritDoc} */
  @Override
  public double ppf(double quantile) {
    ProbabilityDistribution.checkQuantile(quantile);
    return location + quantile * scale;
  }

  public double getLocation() {
    return location;
  }

  public double getScale() {
    return scale;
  }
}
