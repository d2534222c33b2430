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

import static org.junit.Assert.assertEquals;
import static ries.utilities.Constants.ATOMIC_MASS_UNIT_MEV;
import static ries.utilities.Constants.BOLTZMANN_EV;

import org.junit.Test;
import ries.crosssection.Boron;
import ries.utilities.RiesTest;

/** Test the Doppler width of a Maxwell-Boltzmann distribution and its inverse. */
public class DopplerWidthTest extends RiesTest {

  @Test
  public void testDopplerWidth() {
    // A mass for which 2 k_B T / (m c^2) = 1 at T = 1 K.
    double amu = 2.0 * BOLTZMANN_EV * 1.0e-6 / ATOMIC_MASS_UNIT_MEV;
    MaxwellBoltzmann maxwellBoltzmann = new MaxwellBoltzmann(amu, 1.0);
    assertEquals(2.0, maxwellBoltzmann.getDopplerWidth(2.0), 1.0e-12);
    assertEquals(0.25, MaxwellBoltzmann.effectiveTemperature(maxwellBoltzmann.getDopplerWidth(1.0), amu, 2.0), 1.0e-12);
  }

  @Test
  public void testGaussWidth() {
    Gauss gauss = new Gauss(Boron.B11.getGroundState(), Boron.B11.getExcitedState("5/2^-_1"), 11.009305166, 300.0);
    double expected = new MaxwellBoltzmann(11.009305166, 300.0).getDopplerWidth(4.44498);
    assertEquals(expected, gauss.getDopplerWidth(), 0.0);
    assertEquals(300.0, MaxwellBoltzmann.effectiveTemperature(expected, 11.009305166, 4.44498), 1.0e-9);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNegativeTemperature() {
    new MaxwellBoltzmann(1.0, -1.0);
  }
}
