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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import org.junit.Test;
import ries.numerics.integrate.GaussKronrod;
import ries.utilities.LogRecordCollector;
import ries.utilities.RiesProperties;
import ries.utilities.RiesTest;

/** Test the pseudo-Voigt and Voigt profiles, including the fallback of their quantile function. */
public class PseudoVoigtProfileTest extends RiesTest {

  @Test
  public void testMixture() {
    PseudoVoigtProfile profile = new PseudoVoigtProfile(1.0, 0.3, 2.0);
    Normal normal = new Normal(1.0, 2.0 / (2.0 * Math.sqrt(2.0 * Math.log(2.0))));
    Cauchy cauchy = new Cauchy(1.0, 1.0);
    for (double x : new double[] {-3.0, 0.0, 1.0, 1.5, 10.0}) {
      assertEquals(0.7 * normal.pdf(x) + 0.3 * cauchy.pdf(x), profile.pdf(x), 1.0e-15);
      assertEquals(0.7 * normal.cdf(x) + 0.3 * cauchy.cdf(x), profile.cdf(x), 1.0e-15);
    }
    // Both components share the full width at half maximum.
    double half = 0.5 * profile.pdf(1.0);
    assertEquals(half, profile.pdf(2.0), 1.0e-12);
    assertEquals(half, profile.pdf(0.0), 1.0e-12);
  }

  @Test
  public void testQuantileInversion() {
    PseudoVoigtProfile profile = new PseudoVoigtProfile(1.0e6, 0.4, 100.0);
    try (LogRecordCollector collector = collectWarnings(PseudoVoigtProfile.class)) {
      assertEquals(1.0e6, profile.ppf(0.5), 1.0e-6);
      double[] quantiles = {0.001, 0.025, 0.3, 0.5, 0.9, 0.999};
      double[] x = profile.ppf(quantiles);
      for (int i = 0; i < x.length; i++) {
        assertEquals(quantiles[i], profile.cdf(x[i]), 1.0e-10);
      }
      assertEquals(0, collector.size());
    }
    assertEquals(Double.NEGATIVE_INFINITY, profile.ppf(0.0), 0.0);
    assertEquals(Double.POSITIVE_INFINITY, profile.ppf(1.0), 0.0);
  }

  @Test
  public void testFallback() {
    // Three iterations are not enough to reach the far tail from the center.
    PseudoVoigtProfile profile = new PseudoVoigtProfile(0.0, 0.5, 2.0, 3, 1.0e-8);
    Normal normal = new Normal(0.0, 2.0 / (2.0 * Math.sqrt(2.0 * Math.log(2.0))));
    Cauchy cauchy = new Cauchy(0.0, 1.0);
    double small = 1.0e-7;
    try (LogRecordCollector collector = collectWarnings(PseudoVoigtProfile.class)) {
      double[] x = profile.ppf(new double[] {0.5, small});
      assertTrue(collector.size() > 0);
      // The fallback applies to all quantiles of the call.
      assertEquals(0.5 * normal.ppf(small) + 0.5 * cauchy.ppf(small), x[1], 1.0e-6);
      assertEquals(0.0, x[0], 1.0e-12);
      assertTrue(x[1] > cauchy.ppf(small));
      assertTrue(x[1] < normal.ppf(small));
    }
  }

  @Test
  public void testThompsonLimits() {
    // Pure Lorentzian and pure Gaussian line shapes.
    assertEquals(1.0, PseudoVoigtProfile.fromWidths(0.0, 0.0, 1.0).getEta(), 1.0e-12);
    assertEquals(1.0, PseudoVoigtProfile.combinedFwhm(0.0, 1.0), 1.0e-12);
    assertEquals(0.0, PseudoVoigtProfile.fromWidths(0.0, 1.0, 0.0).getEta(), 0.0);
    assertEquals(1.0, PseudoVoigtProfile.combinedFwhm(1.0, 0.0), 1.0e-12);
    // Equal widths.
    double gamma = PseudoVoigtProfile.combinedFwhm(1.0, 1.0);
    double expected = Math.pow(1.0 + 2.69269 + 2.42843 + 4.47163 + 0.07842 + 1.0, 0.2);
    assertEquals(expected, gamma, 1.0e-12);
  }

  @Test
  public void testVoigtProfile() {
    double sigma = 1.0;
    double gamma = 0.5;
    VoigtProfile voigt = new VoigtProfile(3.0, sigma, gamma);
    assertEquals(0.0016374553876309743, voigt.pdf(13.0), 1.0e-14);

    // The quantiles invert the pseudo-Voigt CDF.
    try (LogRecordCollector collector = collectWarnings(PseudoVoigtProfile.class)) {
      double[] quantiles = {0.05, 0.25, 0.5, 0.75, 0.95};
      double[] x = voigt.ppf(quantiles);
      for (int i = 0; i < x.length; i++) {
        assertEquals(quantiles[i], voigt.cdf(x[i]), 1.0e-9);
      }
      assertEquals(0, collector.size());
    }

    // Without Doppler broadening, the Voigt profile is a Cauchy distribution.
    VoigtProfile lorentzian = new VoigtProfile(3.0, 0.0, gamma);
    Cauchy cauchy = new Cauchy(3.0, gamma);
    assertEquals(cauchy.pdf(3.7), lorentzian.pdf(3.7), 1.0e-15);
  }

  @Test
  public void testSharedSolverSettings() {
    PseudoVoigtProfile first = new PseudoVoigtProfile(1.0, 0.5, 1.0e-3);
    System.setProperty("ppf-max-evaluations", Integer.toString(first.getMaxEvaluations() + 4));
    PseudoVoigtProfile second = new VoigtProfile(2.0, 1.0e-3, 1.0e-3);
    assertEquals(first.getMaxEvaluations(), second.getMaxEvaluations());
    GaussKronrod quadrature = new GaussKronrod();
    assertEquals(RiesProperties.getProperties().getInt("quadrature-max-intervals", 0), quadrature.getMaxIntervals());
  }

  @Test
  public void testUniform() {
    Uniform uniform = new Uniform(4.44498 - 0.5, 1.0);
    assertEquals(1.0, uniform.pdf(4.44498), 0.0);
    assertEquals(0.0, uniform.pdf(5.0), 0.0);
    assertEquals(0.25, uniform.cdf(4.19498), 1.0e-12);
    assertEquals(4.69498, uniform.ppf(0.75), 1.0e-12);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testQuantileRange() {
    new Cauchy(0.0, 1.0).ppf(1.5);
  }
}
