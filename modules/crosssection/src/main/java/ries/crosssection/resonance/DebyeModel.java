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

import static java.lang.String.format;
import static org.apache.commons.math3.util.FastMath.expm1;

import ries.numerics.integrate.GaussKronrod;

/**
 * Effective temperature of the nuclei in a Debye solid.
 *
 * <p>In a harmonic solid with a Debye frequency spectrum, the nuclei move with a Maxwell-Boltzmann
 * velocity distribution at the effective temperature (W.E. Lamb, Phys. Rev. 55 (1939) 190)
 *
 * <pre>
 *   T_eff = 3 T (T / T_D)^3 Integral_0^(T_D / T) t^3 (1 / (e^t - 1) + 1 / 2) dt,
 * </pre>
 *
 * <p>which approaches 3/8 T_D for T &lt;&lt; T_D and T for T &gt;&gt; T_D.
 *
 * @since 1.0
 */
public class DebyeModel {

  /** Debye temperature used when no value is known for a material, in K. */
  public static final double DEFAULT_DEBYE_TEMPERATURE = 500.0;

  /** Private constructor prevents instantiation. */
  private DebyeModel() {
  }

  /**
   * Effective temperature with the quadrature settings of the RIES properties.
   *
   * @param temperature thermodynamic temperature in K.
   * @param debyeTemperature Debye temperature in K.
   * @return the effective temperature in K.
   * @throws ArithmeticException if the thermodynamic temperature is 0.
   */
  public static double effectiveTemperature(double temperature, double debyeTemperature) {
    return effectiveTemperature(temperature, debyeTemperature, new GaussKronrod());
  }

  /**
   * Effective temperature.
   *
   * @param temperature thermodynamic temperature in K.
   * @param debyeTemperature Debye temperature in K.
   * @param quadrature integration rule.
   * @return the effective temperature in K.
   * @throws ArithmeticException if the thermodynamic temperature is 0.
   */
  public static double effectiveTemperature(double temperature, double debyeTemperature, GaussKronrod quadrature) {
    if (temperature == 0.0) {
      throw new ArithmeticException(" The effective temperature of a Debye solid is undefined at T = 0 K.");
    }
    if (!(temperature > 0.0) || !(debyeTemperature > 0.0)) {
      throw new IllegalArgumentException(format(" Temperatures must be positive (T %g, T_D %g).", temperature, debyeTemperature));
    }
    double ratio = temperature / debyeTemperature;
    double integral = quadrature.integrate(DebyeModel::integrand, 0.0, debyeTemperature / temperature).value();
    return 3.0 * ratio * ratio * ratio * temperature * integral;
  }

  private static double integrand(double t) {
    if (t == 0.0) {
      return 0.0;
    }
    double t3 = t * t * t;
    return t3 / expm1(t) + 0.5 * t3;
  }
}
