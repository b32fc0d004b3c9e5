/*************************************************************************
*                                                                        *
*  This file is part of the 20n/act project.                             *
*  20n/act enables DNA prediction for synthetic biology/bioengineering.  *
*  Copyright (C) 2017 20n Labs, Inc.                                     *
*                                                                        *
*  Please direct all queries to act@20n.com.                             *
*                                                                        *
*  This program is free software: you can redistribute it and/or modify  *
*  it under the terms of the GNU General Public License as published by  *
*  the Free Software Foundation, either version 3 of the License, or     *
*  (at your option) any later version.                                   *
*                                                                        *
*  This program is distributed in the hope that it will be useful,       *
*  but WITHOUT ANY WARRANTY; without even the implied warranty of        *
*  MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the         *
*  GNU General Public License for more details.                          *
*                                                                        *
*  You should have received a copy of the GNU General Public License     *
*  along with this program.  If not, see <http://www.gnu.org/licenses/>. *
*                                                                        *
*************************************************************************/

package com.twentyn.rubypressure.calibration;

import com.twentyn.rubypressure.uncertainty.UncertainValue;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Finds the R1 position a {@link PressureModel} maps to a given pressure.
 *
 * The search walks by a fixed step towards the target, halving the step whenever it steps over it, until the
 * pressure is within a tolerance of the target.  The model has to increase with the position; a non-positive slope
 * at the start, or a residual that grows although the target has not been crossed, ends the search with an
 * {@link InversionNonconvergentException}.
 *
 * The uncertainty of the result is obtained by linearizing the model around the solution, so both the target
 * pressure's and the calibration constants' errors end up in the returned position.
 */
public class PressureInverter {
  private static final Logger LOGGER = LogManager.getFormatterLogger(PressureInverter.class);

  public static final double DEFAULT_INITIAL_STEP = 1.0;
  public static final int DEFAULT_MAX_ITERATIONS = 100;
  public static final double DEFAULT_TOLERANCE = 1e-4;

  private static final double SLOPE_PROBE = 1e-3;

  private final PressureModel model;
  private final double initialStep;
  private final int maxIterations;
  private final double tolerance;

  public PressureInverter(PressureModel model) {
    this(model, DEFAULT_INITIAL_STEP, DEFAULT_MAX_ITERATIONS, DEFAULT_TOLERANCE);
  }

  public PressureInverter(PressureModel model, double initialStep, int maxIterations, double tolerance) {
    this.model = model;
    this.initialStep = initialStep;
    this.maxIterations = maxIterations;
    this.tolerance = tolerance;
  }

  private double nominalPressure(double position, UncertainValue temperature) {
    return model.translate(UncertainValue.exact(position), temperature).getNominal();
  }

  /**
   * Starts the search at the model's zero-pressure position.
   */
  public UncertainValue invert(UncertainValue pressure, UncertainValue temperature)
      throws InversionNonconvergentException {
    return invert(pressure, temperature, model.referencePosition(temperature).getNominal());
  }

  public UncertainValue invert(UncertainValue pressure, UncertainValue temperature, double start)
      throws InversionNonconvergentException {
    double target = pressure.getNominal();
    double startSlope = (nominalPressure(start + SLOPE_PROBE, temperature) -
        nominalPressure(start - SLOPE_PROBE, temperature)) / (2.0 * SLOPE_PROBE);
    if (!(startSlope > 0.0)) {
      throw new InversionNonconvergentException(model.getName(), String.format(
          "Pressure does not increase with position at %.4f nm (slope %s)", start, startSlope));
    }

    double position = start;
    double step = initialStep;
    double previousResidual = Double.NaN;
    for (int iteration = 0; iteration < maxIterations; iteration++) {
      double residual = target - nominalPressure(position, temperature);
      LOGGER.debug("Inversion step %d: position %.6f nm, residual %.6g GPa, step %.3g", iteration, position, residual,
          step);
      if (Math.abs(residual) < tolerance) {
        LOGGER.debug("Inversion converged after %d steps at %.6f nm", iteration, position);
        return linearize(pressure, temperature, position);
      }

      if (!Double.isNaN(previousResidual)) {
        boolean crossed = Math.signum(residual) != Math.signum(previousResidual);
        if (crossed) {
          step *= 0.5;
        } else if (Math.abs(residual) > Math.abs(previousResidual)) {
          throw new InversionNonconvergentException(model.getName(), String.format(
              "Residual grew from %.6g to %.6g GPa without crossing the target at %.4f nm",
              previousResidual, residual, position));
        }
      }
      position += residual > 0.0 ? step : -step;
      previousResidual = residual;
    }
    throw new InversionNonconvergentException(model.getName(), String.format(
        "No position within %.2g GPa of %.4f GPa after %d steps", tolerance, target, maxIterations));
  }

  /**
   * position = x0 + (target - p(x0)) / p'(x0), evaluated with uncertainties.
   */
  private UncertainValue linearize(UncertainValue pressure, UncertainValue temperature, double solution) {
    UncertainValue probe = UncertainValue.of(solution, 1.0);
    double slope = model.translate(probe, temperature).derivative(probe);
    UncertainValue atSolution = model.translate(UncertainValue.exact(solution), temperature);
    return pressure.minus(atSolution).dividedBy(slope).plus(solution);
  }
}
