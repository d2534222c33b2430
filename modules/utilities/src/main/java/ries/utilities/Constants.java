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
package ries.utilities;

/**
 * Library class containing the physical constants used to evaluate nuclear cross sections.
 *
 * <p>Values are the CODATA 2018 recommendations. Energies are given in MeV and lengths in fm, which
 * are the natural units of resonance cross sections.
 *
 * @since 1.0
 */
public class Constants {

  /**
   * Reduced Planck constant times the speed of light in MeV*fm. <code>HBAR_C=197.3269804</code>
   */
  public static final double HBAR_C = 197.3269804;
  /**
   * Atomic mass constant energy equivalent in MeV. <code>ATOMIC_MASS_UNIT_MEV=931.49410242</code>
   */
  public static final double ATOMIC_MASS_UNIT_MEV = 931.49410242;
  /** Atomic mass constant in kg. <code>ATOMIC_MASS_UNIT_KG=1.66053906660e-27</code> */
  public static final double ATOMIC_MASS_UNIT_KG = 1.66053906660e-27;
  /** Boltzmann's constant in eV/K. <code>BOLTZMANN_EV=8.617333262e-5</code> */
  public static final double BOLTZMANN_EV = 8.617333262e-5;
  /** Constant <code>EV_TO_MEV=1.0e-6</code> */
  public static final double EV_TO_MEV = 1.0e-6;
  /** Fine-structure constant. <code>FINE_STRUCTURE=7.2973525693e-3</code> */
  public static final double FINE_STRUCTURE = 7.2973525693e-3;
  /** Electron mass energy equivalent in MeV. <code>ELECTRON_MASS_MEV=0.51099895000</code> */
  public static final double ELECTRON_MASS_MEV = 0.51099895000;
  /**
   * Classical electron radius in fm. <code>ELECTRON_RADIUS = FINE_STRUCTURE * HBAR_C /
   * ELECTRON_MASS_MEV</code>
   */
  public static final double ELECTRON_RADIUS = FINE_STRUCTURE * HBAR_C / ELECTRON_MASS_MEV;
  /** Constant <code>CM_TO_FM=1.0e13</code> */
  public static final double CM_TO_FM = 1.0e13;
  /** Constant <code>KG_TO_GRAMS=1000</code> */
  public static final double KG_TO_GRAMS = 1000;

  // Library class: make the default constructor private to ensure it's never constructed.
  private Constants() {}
}
