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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import ries.crosssection.CrossSection;
import ries.crosssection.CrossSectionWeightedSum;
import ries.crosssection.constituents.Element;
import ries.crosssection.constituents.Isotope;

/**
 * Photoabsorption cross section of a natural element: the sum of the isotope cross sections,
 * weighted by the isotopic abundances.
 *
 * @since 1.0
 */
public class ElementCrossSection extends CrossSection {

  private final Element element;
  private final Map<Integer, IsotopeCrossSection> isotopeCrossSections;
  private final CrossSectionWeightedSum sum;

  /**
   * Constructor for ElementCrossSection.
   *
   * @param element the element.
   * @param resonanceFactories one resonance factory per mass number of the element's isotopes.
   * @throws IllegalArgumentException if a factory is missing.
   */
  public ElementCrossSection(Element element, Map<Integer, ResonanceFactory> resonanceFactories) {
    this.element = element;
    Map<Integer, IsotopeCrossSection> map = new LinkedHashMap<>();
    List<CrossSection> terms = new ArrayList<>();
    List<Double> abundances = new ArrayList<>();
    for (Map.Entry<Integer, Isotope> entry : element.getIsotopes().entrySet()) {
      ResonanceFactory factory = resonanceFactories.get(entry.getKey());
      if (factory == null) {
        throw new IllegalArgumentException(format(" No resonance factory for isotope %s.", entry.getValue().getIdentifier()));
      }
      IsotopeCrossSection isotopeCrossSection = new IsotopeCrossSection(entry.getValue(), factory);
      map.put(entry.getKey(), isotopeCrossSection);
      terms.add(isotopeCrossSection);
      abundances.add(element.getAbundance(entry.getKey()));
    }
    isotopeCrossSections = Collections.unmodifiableMap(map);
    sum = new CrossSectionWeightedSum(terms, abundances);
  }

  /**
   * Constructor for ElementCrossSection with the same kind of resonance for all isotopes.
   *
   * @param element the element.
   * @param resonanceFactory the resonance factory.
   */
  public ElementCrossSection(Element element, ResonanceFactory resonanceFactory) {
    this(element, sameFactory(element, resonanceFactory));
  }

  private static Map<Integer, ResonanceFactory> sameFactory(Element element, ResonanceFactory resonanceFactory) {
    Map<Integer, ResonanceFactory> factories = new LinkedHashMap<>();
    for (Integer massNumber : element.getIsotopes().keySet()) {
      factories.put(massNumber, resonanceFactory);
    }
    return factories;
  }

  /** {@inheritDoc} */
  @Override
  public double value(double energy) {
    return sum.value(energy);
  }

  /** {@inheritDoc} */
  @Override
  public double[] value(double[] energies) {
    return sum.value(energies);
  }

  /** {@inheritDoc} */
  @Override
  public double[] equidistantProbabilityGrid(double lowerLimit, double upperLimit, int nPoints) {
    return sum.equidistantProbabilityGrid(lowerLimit, upperLimit, nPoints);
  }

  public Element getElement() {
    return element;
  }

  /**
   * Cross sections of the isotopes, keyed by mass number.
   *
   * @return an unmodifiable map.
   */
  public Map<Integer, IsotopeCrossSection> getIsotopeCrossSections() {
    return isotopeCrossSections;
  }
}
