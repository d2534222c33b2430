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
package ries.crosssection.resonance;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.Test;
import ries.crosssection.Boron;
import ries.crosssection.CrossSection;
import ries.numerics.math.Grids;
import ries.utilities.RiesTest;

/** Test the photoabsorption cross sections of boron isotopes and natural boron. */
public class IsotopeCrossSectionTest extends RiesTest {

  @Test
  public void testResonances() {
    IsotopeCrossSection b11 = new IsotopeCrossSection(Boron.B11, BreitWigner::new);
    assertEquals(9, b11.getResonances().size());
    assertEquals("1/2^-_1", b11.getResonances().keySet().iterator().next());
    // The only excited state of 10B has no width to the ground state.
    IsotopeCrossSection b10 = new IsotopeCrossSection(Boron.B10, BreitWigner::new);
    assertTrue(b10.getResonances().isEmpty());
    assertEquals(0.0, b10.value(0.718380), 0.0);
    assertArrayEquals(new double[] {0.0, 0.5, 1.0}, b10.equidistantProbabilityGrid(0.0, 1.0, 3), 0.0);

    CrossSection sum = CrossSection.sum(b11.getResonances().values());
    for (Resonance resonance : b11.getResonances().values()) {
      double[] energies = resonance.equidistantProbabilityGrid(0.9, 10);
      double[] expected = sum.value(energies);
      double[] actual = b11.value(energies);
      for (int i = 0; i < energies.length; i++) {
        assertEquals(expected[i], actual[i], 1.0e-12 * expected[i]);
        assertEquals(actual[i], b11.value(energies[i]), 1.0e-12 * actual[i]);
      }
    }
  }

  @Test
  public void testProbabilityGrid() {
    IsotopeCrossSection b11 = new IsotopeCrossSection(Boron.B11, BreitWigner::new);
    List<double[]> grids = new ArrayList<>();
    for (Resonance resonance : b11.getResonances().values()) {
      grids.add(resonance.equidistantProbabilityGrid(4.0, 5.5, 5));
    }
    double[] expected = Grids.union(grids.toArray(new double[0][]));
    assertArrayEquals(expected, b11.equidistantProbabilityGrid(4.0, 5.5, 5), 0.0);
  }

  @Test
  public void testElement() {
    double temperature = DebyeModel.effectiveTemperature(293.0, DebyeModel.DEFAULT_DEBYE_TEMPERATURE);
    Map<Integer, ResonanceFactory> factories = Map.of(
        10, (initial, intermediate) -> new Voigt(initial, intermediate, Boron.B10.getAmu(), temperature),
        11, (initial, intermediate) -> new Voigt(initial, intermediate, Boron.B11.getAmu(), temperature));
    ElementCrossSection boron = new ElementCrossSection(Boron.NATURAL_BORON, factories);
    IsotopeCrossSection b11 = boron.getIsotopeCrossSections().get(11);
    assertEquals(2, boron.getIsotopeCrossSections().size());
    for (Resonance resonance : b11.getResonances().values()) {
      double[] energies = resonance.equidistantProbabilityGrid(0.9, 10);
      double[] single = resonance.value(energies);
      double[] total = boron.value(energies);
      for (int i = 0; i < energies.length; i++) {
        assertEquals(0.801 * b11.value(energies[i]), total[i], 1.0e-12 * total[i]);
        assertEquals(0.801 * single[i], total[i], 1.0e-3 * total[i]);
      }
    }
    double[] grid = boron.equidistantProbabilityGrid(4.0, 5.5, 5);
    assertEquals(4.0, grid[0], 0.0);
    assertEquals(5.5, grid[grid.length - 1], 0.0);
  }

  @Test
  public void testSameFactory() {
    ElementCrossSection boron = new ElementCrossSection(Boron.NATURAL_BORON, BreitWigner::new);
    double energy = 4.44498;
    assertEquals(0.801 * new IsotopeCrossSection(Boron.B11, BreitWigner::new).value(energy), boron.value(energy),
        1.0e-12 * boron.value(energy));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testMissingFactory() {
    new ElementCrossSection(Boron.NATURAL_BORON, Map.of(11, BreitWigner::new));
  }
}
