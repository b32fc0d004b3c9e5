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

package com.twentyn.rubypressure.fitting;

import com.twentyn.rubypressure.spectrum.CurveModel;
import com.twentyn.rubypressure.spectrum.PolynomialShape;
import com.twentyn.rubypressure.spectrum.Spectrum;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * Fits a polynomial continuum underneath the ruby lines by iterated weighted least squares.
 *
 * Each cycle fits the polynomial to the focused samples with the sigmas given by the residuals of the previous
 * cycle's curve; the loop stops once the relative improvement of the mean squared error drops below a tolerance or
 * after a fixed number of cycles.  A cycle that would raise the error is discarded and ends the loop.
 */
public class BackgroundEstimator {
  private static final Logger LOGGER = LogManager.getFormatterLogger(BackgroundEstimator.class);

  public static final String STAGE = "background fitting";
  public static final int DEFAULT_DEGREE = 1;

  private static final int DEFAULT_MAX_ITERATIONS = 50;
  private static final double DEFAULT_RELATIVE_TOLERANCE = 1e-10;

  private final FocusPolicy policy;
  private final PolynomialShape shape;
  private final int maxIterations;
  private final double relativeTolerance;
  private final CurveFitter fitter;

  public BackgroundEstimator(FocusPolicy policy) {
    this(policy, DEFAULT_DEGREE);
  }

  public BackgroundEstimator(FocusPolicy policy, int degree) {
    this(policy, degree, DEFAULT_MAX_ITERATIONS, DEFAULT_RELATIVE_TOLERANCE);
  }

  public BackgroundEstimator(FocusPolicy policy, int degree, int maxIterations, double relativeTolerance) {
    this.policy = policy;
    this.shape = new PolynomialShape(degree);
    this.maxIterations = maxIterations;
    this.relativeTolerance = relativeTolerance;
    this.fitter = new CurveFitter(STAGE, policy.getName());
  }

  public FocusPolicy getPolicy() {
    return policy;
  }

  public PolynomialShape getShape() {
    return shape;
  }

  /**
   * A straight line through the first and last sample, padded with zero higher-order terms; a constant starts at
   * the mean of the two.
   */
  CurveModel seed(Spectrum spectrum) {
    double[] parameters = new double[shape.getParameterCount()];
    int last = spectrum.size() - 1;
    double x0 = spectrum.getX(0), y0 = spectrum.getY(0);
    double x1 = spectrum.getX(last), y1 = spectrum.getY(last);
    if (parameters.length == 1) {
      parameters[0] = (y0 + y1) / 2.0;
    } else {
      double slope = x1 == x0 ? 0.0 : (y1 - y0) / (x1 - x0);
      parameters[0] = y0 - slope * x0;
      parameters[1] = slope;
    }
    return new CurveModel(shape, parameters);
  }

  public BackgroundFit estimate(Spectrum spectrum) throws InsufficientDataException, FitConvergenceException {
    if (spectrum.isEmpty()) {
      throw new InsufficientDataException(STAGE, policy.getName(), shape.getParameterCount() + 1, 0);
    }

    Spectrum current = policy.apply(spectrum.withCurve(seed(spectrum)));
    double previousError = current.meanSquaredError();
    List<Double> errors = new ArrayList<>();
    errors.add(previousError);
    LOGGER.debug("Seeded %s background: %s, mse %.6g", policy.getName(), current.getCurve(), previousError);

    int iterations = 0;
    while (iterations < maxIterations) {
      Spectrum focused = current.focused();
      CurveModel fitted = fitter.fit(current.getCurve(), focused.getX(), focused.getY(), focused.residualWeights());
      Spectrum candidate = current.withCurve(fitted);
      double error = candidate.meanSquaredError();
      if (error > previousError) {
        LOGGER.debug("Background cycle %d would raise mse from %.6g to %.6g, keeping previous curve",
            iterations + 1, previousError, error);
        break;
      }

      current = candidate;
      errors.add(error);
      iterations++;
      LOGGER.debug("Background cycle %d: mse %.6g", iterations, error);

      if (error == 0.0 || previousError / error - 1.0 < relativeTolerance) {
        break;
      }
      previousError = error;
    }
    if (iterations == maxIterations) {
      LOGGER.warn("Background fit stopped after the maximum of %d cycles", maxIterations);
    }
    LOGGER.info("Background (%s, %s) settled after %d cycles: %s",
        policy.getName(), shape.getName(), iterations, current.getCurve());

    CurveModel background = current.getCurve();
    double[] x = spectrum.getX();
    double[] y = spectrum.getY();
    double[] signal = new double[x.length];
    for (int i = 0; i < x.length; i++) {
      signal[i] = y[i] - background.evaluate(x[i]);
    }
    return new BackgroundFit(background, current, new Spectrum(x, signal), errors, iterations);
  }
}
