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
package ries.numerics.math;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;

import org.junit.Test;
import ries.utilities.RiesTest;

/** Test grid construction. */
public class GridsTest extends RiesTest {

  @Test
  public void testLinspace() {
    assertArrayEquals(new double[] {0.0, 0.5, 1.0}, Grids.linspace(0.0, 1.0, 3), 1.0e-15);
    double[] grid = Grids.linspace(4.19498, 4.69498, 101);
    assertEquals(4.19498, grid[0], 0.0);
    assertEquals(4.69498, grid[100], 0.0);
    assertEquals(4.44498, grid[50], 1.0e-12);
  }

  @Test
  public void testUnion() {
    double[] union = Grids.union(new double[] {0.0, 0.5, 1.0}, new double[] {0.25, 0.5, 2.0}, new double[] {});
    assertArrayEquals(new double[] {0.0, 0.25, 0.5, 1.0, 2.0}, union, 0.0);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testTooFewPoints() {
    Grids.linspace(0.0, 1.0, 1);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testUnsortedPartition() {
    Grids.checkPartition(new double[] {0.0, 2.0, 1.0});
  }
}
