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

import static java.lang.String.format;

import java.util.Arrays;

/**
 * Construction of the energy grids that partition integration ranges.
 *
 * @since 1.0
 */
public class Grids {

  /** Private constructor prevents instantiation. */
  private Grids() {
  }

  /**
   * Generates a set of equidistant points.
   *
   * @param lb Beginning value, inclusive.
   * @param ub Ending value, inclusive.
   * @param nPoints Total number of points (at least 2).
   * @return the points; the first equals lb and the last equals ub exactly.
   */
  public static double[] linspace(double lb, double ub, int nPoints) {
    if (nPoints < 2) {
      throw new IllegalArgumentException(format(" A grid requires at least 2 points (%d).", nPoints));
    }
    double[] points = new double[nPoints];
    double sep = (ub - lb) / (nPoints - 1);
    for (int i = 0; i < nPoints; i++) {
      points[i] = lb + i * sep;
    }
    points[nPoints - 1] = ub;
    return points;
  }

  /**
   * Sorted union of several grids. Points that appear in more than one grid are kept once.
   *
   * @param grids the grids to merge.
   * @return a new, strictly increasing array.
   */
  public static double[] union(double[]... grids) {
    int size = 0;
    for (double[] grid : grids) {
      size += grid.length;
    }
    double[] all = new double[size];
    int offset = 0;
    for (double[] grid : grids) {
      System.arraycopy(grid, 0, all, offset, grid.length);
      offset += grid.length;
    }
    return Arrays.stream(all).sorted().distinct().toArray();
  }

  /**
   * Check that a partition is non-decreasing and contains at least two points.
   *
   * @param x the partition.
   * @throws IllegalArgumentException if the partition is too short or unsorted.
   */
  public static void checkPartition(double[] x) {
    if (x.length < 2) {
      throw new IllegalArgumentException(format(" A partition requires at least 2 points (%d).", x.length));
    }
    for (int i = 1; i < x.length; i++) {
      if (!(x[i] >= x[i - 1])) {
        throw new IllegalArgumentException(format(" Partition is not sorted at index %d (%g < %g).", i, x[i], x[i - 1]));
      }
    }
  }
}
