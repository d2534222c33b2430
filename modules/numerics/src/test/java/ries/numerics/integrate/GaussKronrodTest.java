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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import org.junit.Test;
import ries.utilities.LogRecordCollector;
import ries.utilities.RiesTest;

/** Test the adaptive Gauss-Kronrod quadrature. */
public class GaussKronrodTest extends RiesTest {

  @Test
  public void testPolynomial() {
    GaussKronrod quadrature = new GaussKronrod();
    IntegralEstimate integral = quadrature.integrate(x -> x * x * x - 2.0 * x, -1.0, 3.0);
    // [x^4 / 4 - x^2] from -1 to 3.
    assertEquals(20.0 - 8.0, integral.value(), 1.0e-12);
    assertTrue(integral.error() < 1.0e-8);
  }

  @Test
  public void testReversedLimits() {
    GaussKronrod quadrature = new GaussKronrod();
    assertEquals(-2.0, quadrature.integrate(Math::sin, Math.PI, 0.0).value(), 1.0e-12);
    assertEquals(0.0, quadrature.integrate(Math::sin, 1.0, 1.0).value(), 0.0);
  }

  @Test
  public void testAdaptivity() {
    // Integrable singularity of the derivative at 0.
    GaussKronrod quadrature = new GaussKronrod(1.0e-10, 1.0e-10, 200);
    IntegralEstimate integral = quadrature.integrate(Math::sqrt, 0.0, 1.0);
    assertEquals(2.0 / 3.0, integral.value(), 1.0e-9);
  }

  @Test
  public void testSubdivisionLimit() {
    GaussKronrod quadrature = new GaussKronrod(0.0, 0.0, 2);
    try (LogRecordCollector collector = collectWarnings(GaussKronrod.class)) {
      quadrature.integrate(x -> Math.sin(100.0 * x), 0.0, 10.0);
      assertTrue(collector.size() > 0);
    }
  }

  @Test
  public void testMultivariate() {
    GaussKronrod quadrature = new GaussKronrod();
    // Volume of the unit cube weighted by x + y + z.
    IntegralEstimate integral = quadrature.integrate(p -> p[0] + p[1] + p[2],
        new double[][] {{0.0, 1.0}, {0.0, 1.0}, {0.0, 1.0}});
    assertEquals(1.5, integral.value(), 1.0e-12);
  }
}
