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
package ries.crosssection.constituents;

import static java.lang.String.format;
import static org.apache.commons.math3.util.FastMath.abs;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.logging.Logger;

/**
 * A chemical element, given by its isotopes and their abundances.
 *
 * @since 1.0
 */
public class Element {

  private static final Logger logger = Logger.getLogger(Element.class.getName());

  /** Tolerance for the sum of the abundances. */
  public static final double ABUNDANCE_TOLERANCE = 1.0e-3;

  private final int z;
  private final String symbol;
  private final Map<Integer, Isotope> isotopes;
  private final Map<Integer, Double> abundances;
  private final OptionalDouble density;

  /**
   * Constructor for Element.
   *
   * @param z proton number.
   * @param symbol element symbol.
   * @param isotopes isotopes keyed by mass number.
   * @param abundances abundances (fractions) keyed by mass number.
   * @param density density in g/cm^3.
   */
  public Element(int z, String symbol, Map<Integer, Isotope> isotopes, Map<Integer, Double> abundances,
      double density) {
    this(z, symbol, isotopes, abundances, OptionalDouble.of(density));
  }

  /**
   * Constructor for an Element with unknown density.
   *
   * @param z proton number.
   * @param symbol element symbol.
   * @param isotopes isotopes keyed by mass number.
   * @param abundances abundances (fractions) keyed by mass number.
   */
  public Element(int z, String symbol, Map<Integer, Isotope> isotopes, Map<Integer, Double> abundances) {
    this(z, symbol, isotopes, abundances, OptionalDouble.empty());
  }

  private Element(int z, String symbol, Map<Integer, Isotope> isotopes, Map<Integer, Double> abundances,
      OptionalDouble density) {
    if (z < 0) {
      throw new IllegalArgumentException(format(" Invalid proton number %d.", z));
    }
    double sum = 0.0;
    for (Map.Entry<Integer, Double> entry : abundances.entrySet()) {
      if (!isotopes.containsKey(entry.getKey())) {
        throw new IllegalArgumentException(format(" Element %s: abundance given for unknown isotope A = %d.", symbol, entry.getKey()));
      }
      Double abundance = entry.getValue();
      if (abundance == null || !(abundance >= 0.0 && abundance <= 1.0)) {
        throw new IllegalArgumentException(format(" Element %s: invalid abundance %s of A = %d.", symbol, abundance, entry.getKey()));
      }
      sum += abundance;
    }
    if (!abundances.isEmpty() && abs(sum - 1.0) > ABUNDANCE_TOLERANCE) {
      logger.warning(format(" Abundances of element %s sum to %.6f instead of 1.", symbol, sum));
    }
    if (density.isPresent() && !(density.getAsDouble() > 0.0)) {
      throw new IllegalArgumentException(format(" Element %s: invalid density %g.", symbol, density.getAsDouble()));
    }
    this.z = z;
    this.symbol = symbol;
    this.isotopes = Collections.unmodifiableMap(new LinkedHashMap<>(isotopes));
    this.abundances = Collections.unmodifiableMap(new LinkedHashMap<>(abundances));
    this.density = density;
  }

  /**
   * Effective mass of the element: the abundance-weighted sum of the isotopic masses.
   *
   * @return the mass in atomic mass units.
   */
  public double amu() {
    double amu = 0.0;
    for (Map.Entry<Integer, Isotope> entry : isotopes.entrySet()) {
      Double abundance = abundances.get(entry.getKey());
      if (abundance != null) {
        amu += entry.getValue().getAmu() * abundance;
      }
    }
    return amu;
  }

  public int getZ() {
    return z;
  }

  public String getSymbol() {
    return symbol;
  }

  public Map<Integer, Isotope> getIsotopes() {
    return isotopes;
  }

  public Map<Integer, Double> getAbundances() {
    return abundances;
  }

  /**
   * Abundance of an isotope.
   *
   * @param massNumber mass number of the isotope.
   * @return the abundance, or 0 if none is given.
   */
  public double getAbundance(int massNumber) {
    return abundances.getOrDefault(massNumber, 0.0);
  }

  /**
   * Density of the element in its natural state, if known.
   *
   * @return the density in g/cm^3.
   */
  public OptionalDouble getDensity() {
    return density;
  }
}
