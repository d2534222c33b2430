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
import static org.apache.commons.math3.util.FastMath.PI;
import static org.apache.commons.math3.util.FastMath.max;
import static org.apache.commons.math3.util.FastMath.min;
import static ries.utilities.Constants.HBAR_C;

import java.util.function.DoubleFunction;
import java.util.logging.Logger;
import ries.crosssection.CrossSection;
import ries.crosssection.constituents.ExcitedState;
import ries.crosssection.constituents.State;
import ries.numerics.distribution.ProbabilityDistribution;
import ries.numerics.distribution.Uniform;
import ries.numerics.math.Grids;

/**
 * Cross section of an isolated resonance whose shape is a continuous probability distribution.
 *
 * <p>The resonance excites a nucleus from an initial state 0 to an intermediate state 2, optionally
 * followed by a decay to a final state 1. The energy-integrated cross section is
 *
 * <pre>
 *   I = (pi hbar c / E_r)^2 (2 J_2 + 1) / (2 J_0 + 1) Gamma_20 [Gamma_21 / Gamma_2],
 * </pre>
 *
 * <p>where the branching ratio in brackets is omitted without a final state, and the cross section
 * is I times the probability density of the shape at the given energy. Resonances of different
 * states are treated as isolated, i.e. interference is neglected.
 *
 * <p>The shape of this base class is a uniform distribution of width 1 MeV centered at the
 * resonance energy. Subclasses pass their shape to the protected constructor.
 *
 * @since 1.0
 */
public class Resonance extends CrossSection {

  private static final Logger logger = Logger.getLogger(Resonance.class.getName());

  /** Constant <code>ENERGY_INTEGRATED_CROSS_SECTION_CONSTANT = (PI * HBAR_C)^2</code> in MeV^2 fm^2. */
  public static final double ENERGY_INTEGRATED_CROSS_SECTION_CONSTANT = (PI * HBAR_C) * (PI * HBAR_C);

  private final State initialState;
  private final ExcitedState intermediateState;
  private final State finalState;
  private final double resonanceEnergy;
  private final double statisticalFactor;
  private final double finalStateBranchingRatio;
  private final double energyIntegratedCrossSection;
  private final ProbabilityDistribution distribution;

  /**
   * Constructor for an excitation Resonance without recoil.
   *
   * @param initialState the initial state.
   * @param intermediateState the excited state.
   */
  public Resonance(State initialState, ExcitedState intermediateState) {
    this(initialState, intermediateState, null, new NoRecoil());
  }

  /**
   * Constructor for Resonance without recoil.
   *
   * @param initialState the initial state.
   * @param intermediateState the excited state.
   * @param finalState the final state of the decay, or null for the total excitation cross section.
   */
  public Resonance(State initialState, ExcitedState intermediateState, State finalState) {
    this(initialState, intermediateState, finalState, new NoRecoil());
  }

  /**
   * Constructor for Resonance.
   *
   * @param initialState the initial state.
   * @param intermediateState the excited state.
   * @param finalState the final state of the decay, or null for the total excitation cross section.
   * @param recoilCorrection correction of the resonance energy.
   * @throws IllegalArgumentException if the intermediate state does not decay to the initial or the
   *     final state.
   */
  public Resonance(State initialState, ExcitedState intermediateState, State finalState,
      RecoilCorrection recoilCorrection) {
    this(initialState, intermediateState, finalState, recoilCorrection,
        energy -> new Uniform(energy - 0.5, 1.0));
  }

  /**
   * Constructor for Resonance with a given shape.
   *
   * @param initialState the initial state.
   * @param intermediateState the excited state.
   * @param finalState the final state of the decay, or null for the total excitation cross section.
   * @param recoilCorrection correction of the resonance energy.
   * @param shape creates the normalized shape from the resonance energy.
   * @throws IllegalArgumentException if the intermediate state does not decay to the initial or the
   *     final state.
   */
  protected Resonance(State initialState, ExcitedState intermediateState, State finalState,
      RecoilCorrection recoilCorrection, DoubleFunction<ProbabilityDistribution> shape) {
    this.initialState = initialState;
    this.intermediateState = intermediateState;
    this.finalState = finalState;
    resonanceEnergy = recoilCorrection.resonanceEnergy(
        intermediateState.getExcitationEnergy() - initialState.getExcitationEnergy());
    statisticalFactor = (intermediateState.getTwoJ() + 1.0) / (initialState.getTwoJ() + 1.0);
    finalStateBranchingRatio = finalState == null ? 1.0
        : intermediateState.getPartialWidth(finalState.getIdentifier()) / intermediateState.getWidth();
    energyIntegratedCrossSection = ENERGY_INTEGRATED_CROSS_SECTION_CONSTANT / (resonanceEnergy * resonanceEnergy)
        * statisticalFactor
        * intermediateState.getPartialWidth(initialState.getIdentifier())
        * finalStateBranchingRatio;
    distribution = shape.apply(resonanceEnergy);
  }

  /** {@inheritDoc} */
  @Override
  public double value(double energy) {
    return energyIntegratedCrossSection * distribution.pdf(energy);
  }

  /**
   * Evaluate the cross section.
   *
   * @param energy the energy.
   * @param absoluteEnergy false if the energy is given relative to the resonance energy.
   * @return the cross section in fm^2.
   */
  public double value(double energy, boolean absoluteEnergy) {
    return value(absoluteEnergy ? energy : energy + resonanceEnergy);
  }

  /** {@inheritDoc} */
  @Override
  public double[] value(double[] energies) {
    double[] values = distribution.pdf(energies);
    for (int i = 0; i < values.length; i++) {
      values[i] *= energyIntegratedCrossSection;
    }
    return values;
  }

  /**
   * Evaluate the cross section at many energies.
   *
   * @param energies the energies.
   * @param absoluteEnergy false if the energies are given relative to the resonance energy.
   * @return the cross sections in fm^2.
   */
  public double[] value(double[] energies, boolean absoluteEnergy) {
    if (absoluteEnergy) {
      return value(energies);
    }
    double[] shifted = new double[energies.length];
    for (int i = 0; i < energies.length; i++) {
      shifted[i] = energies[i] + resonanceEnergy;
    }
    return value(shifted);
  }

  /**
   * Smallest symmetric interval around the median that contains the given fraction of the
   * energy-integrated cross section.
   *
   * <p>Shapes with infinite support may return a negative lower limit or an infinite upper limit.
   * This is logged as a warning, together with the largest coverage that is possible at
   * non-negative energies. The interval is returned unchanged, so callers that need physical
   * energies must clamp it.
   *
   * @param coverage a fraction in [0, 1].
   * @return the {lower, upper} limits of the interval.
   */
  public double[] coverageInterval(double coverage) {
    if (!(coverage >= 0.0 && coverage <= 1.0)) {
      throw new IllegalArgumentException(format(" Coverage %g is not in the interval [0, 1].", coverage));
    }
    double[] interval = distribution.ppf(new double[] {0.5 * (1.0 - coverage), 0.5 * (1.0 + coverage)});
    if (interval[0] < 0.0 || Double.isInfinite(interval[1])) {
      double maximumCoverage = max(0.0, 1.0 - 2.0 * distribution.cdf(0.0));
      logger.warning(format(" Coverage interval [%g, %g] of the resonance at %.6f MeV contains unphysical energies.\n"
              + " The maximum coverage at non-negative energies is %.9f.",
          interval[0], interval[1], resonanceEnergy, maximumCoverage));
    }
    return interval;
  }

  /**
   * Equidistant grid in the coverage interval.
   *
   * @param coverage a fraction in [0, 1].
   * @param nPoints number of grid points.
   * @return the grid.
   * @see #coverageInterval(double)
   */
  public double[] equidistantEnergyGrid(double coverage, int nPoints) {
    double[] limits = coverageInterval(coverage);
    return equidistantEnergyGrid(limits[0], limits[1], nPoints);
  }

  /**
   * {@inheritDoc}
   *
   * <p>The grid points are the quantiles of n equidistant probabilities between cdf(lowerLimit)
   * and cdf(upperLimit). Far from the resonance, the CDF may round to 0 or 1, so the first and last
   * points are set to the limits, and all other points are kept inside them.
   */
  @Override
  public double[] equidistantProbabilityGrid(double lowerLimit, double upperLimit, int nPoints) {
    double[] limits = distribution.cdf(new double[] {lowerLimit, upperLimit});
    double[] grid = distribution.ppf(Grids.linspace(limits[0], limits[1], nPoints));
    for (int i = 1; i < nPoints - 1; i++) {
      grid[i] = min(upperLimit, max(lowerLimit, grid[i]));
    }
    grid[0] = lowerLimit;
    grid[nPoints - 1] = upperLimit;
    return grid;
  }

  /**
   * Grid with equal probabilities per interval in the coverage interval.
   *
   * @param coverage a fraction in [0, 1].
   * @param nPoints number of grid points.
   * @return the grid.
   * @see #coverageInterval(double)
   */
  public double[] equidistantProbabilityGrid(double coverage, int nPoints) {
    if (!(coverage >= 0.0 && coverage <= 1.0)) {
      throw new IllegalArgumentException(format(" Coverage %g is not in the interval [0, 1].", coverage));
    }
    return distribution.ppf(Grids.linspace(0.5 * (1.0 - coverage), 0.5 * (1.0 + coverage), nPoints));
  }

  public State getInitialState() {
    return initialState;
  }

  public ExcitedState getIntermediateState() {
    return intermediateState;
  }

  /**
   * Final state of the decay.
   *
   * @return the final state, or null for the total excitation cross section.
   */
  public State getFinalState() {
    return finalState;
  }

  /**
   * Recoil-corrected energy difference of the initial and the intermediate state.
   *
   * @return the resonance energy in MeV.
   */
  public double getResonanceEnergy() {
    return resonanceEnergy;
  }

  /**
   * Ratio of the multiplicities of the intermediate and the initial state.
   *
   * @return (2 J_2 + 1) / (2 J_0 + 1).
   */
  public double getStatisticalFactor() {
    return statisticalFactor;
  }

  /**
   * Fraction of the decays of the intermediate state that populate the final state.
   *
   * @return the branching ratio, or 1 without a final state.
   */
  public double getFinalStateBranchingRatio() {
    return finalStateBranchingRatio;
  }

  /**
   * Integral of the cross section over all energies.
   *
   * @return the energy-integrated cross section in MeV fm^2.
   */
  public double getEnergyIntegratedCrossSection() {
    return energyIntegratedCrossSection;
  }

  /**
   * Normalized shape of the resonance.
   *
   * @return the probability distribution.
   */
  public ProbabilityDistribution getDistribution() {
    return distribution;
  }
}
