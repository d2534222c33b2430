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
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static ries.utilities.Constants.ATOMIC_MASS_UNIT_MEV;
import static ries.utilities.Constants.HBAR_C;

import java.lang.reflect.Modifier;
import java.util.Map;
import org.junit.Test;
import ries.crosssection.Boron;
import ries.crosssection.constituents.ExcitedState;
import ries.crosssection.constituents.GroundState;
import ries.numerics.distribution.VoigtProfile;
import ries.utilities.LogRecordCollector;
import ries.utilities.RiesTest;

/** Test the derived quantities, grids and coverage intervals of a resonance. */
public class ResonanceTest extends RiesTest {

  private static final GroundState groundState = Boron.B11.getGroundState();

  @Test
  public void testExcitation() {
    Resonance resonance = new Resonance(groundState, Boron.B11.getExcitedState("5/2^-_1"));
    double expected = Math.PI * Math.PI * HBAR_C * HBAR_C / (4.44498 * 4.44498) * 1.5 * 0.55e-6;
    assertEquals(expected, resonance.getEnergyIntegratedCrossSection(), 1.0e-12 * expected);
    // The default shape is a uniform distribution with a width of 1 MeV.
    assertEquals(resonance.getEnergyIntegratedCrossSection(), resonance.value(4.44498), 0.0);
    assertEquals(resonance.getEnergyIntegratedCrossSection(), resonance.value(0.0, false), 0.0);
    assertEquals(4.44498, resonance.getResonanceEnergy(), 0.0);
    assertEquals(1.0, resonance.getFinalStateBranchingRatio(), 0.0);
    assertEquals(1.5, resonance.getStatisticalFactor(), 0.0);
    assertNull(resonance.getFinalState());

    double[] expectedGrid = {4.44498 - 0.25, 4.44498, 4.44498 + 0.25};
    assertArrayEquals(expectedGrid, resonance.equidistantEnergyGrid(0.5, 3), 1.0e-5 * 4.44498);
    assertArrayEquals(expectedGrid, resonance.equidistantEnergyGrid(4.44498 - 0.25, 4.44498 + 0.25, 3), 1.0e-5 * 4.44498);
    assertArrayEquals(expectedGrid, resonance.equidistantProbabilityGrid(0.5, 3), 1.0e-5 * 4.44498);
    assertArrayEquals(expectedGrid, resonance.equidistantProbabilityGrid(4.44498 - 0.25, 4.44498 + 0.25, 3), 1.0e-5 * 4.44498);
  }

  @Test
  public void testFinalState() {
    ExcitedState intermediate = Boron.B11.getExcitedState("3/2^-_2");
    Resonance resonance = new Resonance(groundState, intermediate, Boron.B11.getExcitedState("1/2^-_1"));
    assertEquals(5.02030, resonance.getResonanceEnergy(), 0.0);
    assertEquals(0.144, resonance.getFinalStateBranchingRatio(), 1.0e-12);
    assertEquals(1.0, resonance.getStatisticalFactor(), 0.0);
    double expected = Math.PI * Math.PI * HBAR_C * HBAR_C / (5.02030 * 5.02030) * (3.0 + 1.0) / (3.0 + 1.0)
        * 0.856 * 1.97e-6 * 0.144;
    assertEquals(expected, resonance.getEnergyIntegratedCrossSection(), 1.0e-12 * expected);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testFinalStateWithoutDecay() {
    new Resonance(groundState, Boron.B11.getExcitedState("3/2^-_2"), Boron.B11.getExcitedState("5/2^-_1"));
  }

  @Test
  public void testFreeNucleusRecoil() {
    ExcitedState state = Boron.B11.getExcitedState("5/2^-_1");
    Resonance resonance = new Resonance(groundState, state, null, new FreeNucleusRecoil(11.009305166));
    double energyDifference = state.getExcitationEnergy() - groundState.getExcitationEnergy();
    assertEquals(energyDifference * (1.0 + energyDifference / (2.0 * 11.009305166 * ATOMIC_MASS_UNIT_MEV)),
        resonance.getResonanceEnergy(), 0.0);
    assertTrue(resonance.getResonanceEnergy() > energyDifference);
    assertEquals(energyDifference, new NoRecoil().resonanceEnergy(energyDifference), 0.0);
  }

  @Test
  public void testUnphysicalCoverage() {
    // A broad state, whose Cauchy distribution reaches far into negative energies.
    ExcitedState broad = new ExcitedState("1/2^+_1", 1, 1, 1.0, Map.of("3/2^-_1", 2.0));
    BreitWigner resonance = new BreitWigner(groundState, broad);
    try (LogRecordCollector collector = collectWarnings(Resonance.class)) {
      double[] interval = resonance.coverageInterval(0.9);
      assertTrue(interval[0] < 0.0);
      assertEquals(1, collector.size());
      assertTrue(collector.contains(String.format("%.9f", 2.0 * Math.atan(1.0) / Math.PI)));
    }
    try (LogRecordCollector collector = collectWarnings(Resonance.class)) {
      double[] interval = resonance.coverageInterval(1.0);
      assertEquals(Double.POSITIVE_INFINITY, interval[1], 0.0);
      assertEquals(1, collector.size());
    }
    try (LogRecordCollector collector = collectWarnings(Resonance.class)) {
      resonance.coverageInterval(0.1);
      assertEquals(0, collector.size());
    }
  }

  @Test(expected = IllegalArgumentException.class)
  public void testInvalidCoverage() {
    new Resonance(groundState, Boron.B11.getExcitedState("5/2^-_1")).coverageInterval(1.5);
  }

  @Test
  public void testVectorizedEvaluation() {
    BreitWigner resonance = new BreitWigner(groundState, Boron.B11.getExcitedState("5/2^-_1"));
    double[] offsets = {-1.0e-6, 0.0, 2.0e-6};
    double[] values = resonance.value(offsets, false);
    for (int i = 0; i < offsets.length; i++) {
      assertEquals(resonance.value(offsets[i], false), values[i], 0.0);
    }
    // The Cauchy distribution peaks at 1 / (pi gamma).
    double peak = resonance.getEnergyIntegratedCrossSection() * 2.0 / (Math.PI * 0.55e-6);
    assertEquals(peak, values[1], 1.0e-12 * peak);
  }

  @Test
  public void testShapeFixedAtConstruction() throws NoSuchFieldException {
    ExcitedState state = Boron.B11.getExcitedState("5/2^-_1");
    Voigt voigt = new Voigt(groundState, state, Boron.B11.getAmu(), 300.0);
    VoigtProfile profile = (VoigtProfile) voigt.getDistribution();
    assertEquals(voigt.getResonanceEnergy(), profile.getLocation(), 0.0);
    assertEquals(voigt.getDopplerWidth() / Math.sqrt(2.0), profile.getSigma(), 0.0);
    assertEquals(0.5 * state.getWidth(), profile.getGamma(), 0.0);
    assertSame(profile, voigt.getDistribution());
    int modifiers = Resonance.class.getDeclaredField("distribution").getModifiers();
    assertTrue(Modifier.isFinal(modifiers));
  }
}
