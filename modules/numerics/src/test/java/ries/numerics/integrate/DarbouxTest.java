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

import java.util.Arrays;
import java.util.Collection;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;
import ries.numerics.math.Grids;
import ries.utilities.RiesTest;

/** Test the Darboux lower and upper sums. */
@RunWith(Parameterized.class)
public class DarbouxTest extends RiesTest {

  private final int nPoints;

  public DarbouxTest(int nPoints) {
    this.nPoints = nPoints;
  }

  @Parameters
  public static Collection<Object[]> data() {
    return Arrays.asList(new Object[][] {{2}, {10}, {100}, {1000}});
  }

  @Test
  public void testConstant() {
    double[] x = Grids.linspace(0.0, 1.0, nPoints);
    IntegralEstimate integral = Darboux.integrate(e -> 1.0, x);
    assertEquals(1.0, integral.value(), 1.0e-12);
    assertEquals(0.0, integral.error(), 1.0e-12);

    double[] fx = new double[nPoints];
    Arrays.fill(fx, 1.0);
    assertEquals(1.0, Darboux.integrate(fx, x).value(), 1.0e-12);
  }

  @Test
  public void testStaggered() {
    // f = 1 at even and 0 at odd indices.
    double[] x = new double[nPoints];
    double[] fx = new double[nPoints];
    for (int i = 0; i < nPoints; i++) {
      x[i] = i;
      fx[i] = i % 2 == 0 ? 1.0 : 0.0;
    }
    double[] sums = Darboux.sums(fx, x);
    assertEquals(0.0, sums[0], 0.0);
    assertEquals(nPoints - 1.0, sums[1], 0.0);
    IntegralEstimate integral = Darboux.integrate(fx, x);
    assertEquals(0.0, integral.value(), 0.0);
    assertEquals(nPoints - 1.0, integral.error(), 0.0);
  }

  @Test
  public void testMonotonicBrackets() {
    // The integral of x^2 over [0, 1] lies between the sums of a monotonic function.
    double[] x = Grids.linspace(0.0, 1.0, nPoints);
    double[] sums = Darboux.sums(Arrays.stream(x).map(e -> e * e).toArray(), x);
    assertEquals(true, sums[0] <= 1.0 / 3.0 && 1.0 / 3.0 <= sums[1]);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testLengthMismatch() {
    Darboux.sums(new double[nPoints + 1], Grids.linspace(0.0, 1.0, nPoints));
  }
}
