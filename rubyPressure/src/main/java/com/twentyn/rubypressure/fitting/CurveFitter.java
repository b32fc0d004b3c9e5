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
import com.twentyn.rubypressure.spectrum.CurveShape;
import org.apache.commons.math3.analysis.MultivariateMatrixFunction;
import org.apache.commons.math3.analysis.MultivariateVectorFunction;
import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresBuilder;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresOptimizer;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresProblem;
import org.apache.commons.math3.fitting.leastsquares.LevenbergMarquardtOptimizer;
import org.apache.commons.math3.linear.DiagonalMatrix;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.SingularValueDecomposition;
import org.apache.commons.math3.util.FastMath;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Weighted nonlinear least squares of a {@link CurveModel} against (x, y) samples with per-sample standard deviations,
 * solved by Levenberg-Marquardt.
 *
 * The returned model carries the parameter covariance scaled by the reduced chi-square of the fit, i.e. the sigmas
 * are taken as relative rather than absolute errors.  The covariance is the truncated pseudo-inverse of the normal
 * matrix; a parameter whose variance still comes out non-finite fails the fit.
 */
public class CurveFitter {
  private static final Logger LOGGER = LogManager.getFormatterLogger(CurveFitter.class);

  public static final int DEFAULT_MAX_EVALUATIONS = 10000;
  public static final int DEFAULT_MAX_ITERATIONS = 1000;

  private final String stage;
  private final String strategy;
  private final int maxEvaluations;
  private final int maxIterations;

  /**
   * @param stage pipeline stage reported in exceptions, e.g. "background fitting"
   * @param strategy name of the active strategy reported in exceptions
   */
  public CurveFitter(String stage, String strategy) {
    this(stage, strategy, DEFAULT_MAX_EVALUATIONS, DEFAULT_MAX_ITERATIONS);
  }

  public CurveFitter(String stage, String strategy, int maxEvaluations, int maxIterations) {
    this.stage = stage;
    this.strategy = strategy;
    this.maxEvaluations = maxEvaluations;
    this.maxIterations = maxIterations;
  }

  /**
   * Fits start's parameters to the samples.
   * @param sigmas per-sample standard deviations; the residual weights are 1 / sigma^2
   * @return a model of the same shape with fitted parameters and their covariance
   */
  public CurveModel fit(CurveModel start, double[] x, double[] y, double[] sigmas)
      throws InsufficientDataException, FitConvergenceException {
    final CurveShape shape = start.getShape();
    final int n = x.length;
    final int p = start.getParameterCount();
    if (n < p + 1) {
      throw new InsufficientDataException(stage, strategy, p + 1, n);
    }

    double[] weights = new double[n];
    double maxWeight = 0.0;
    for (int i = 0; i < n; i++) {
      if (!(sigmas[i] > 0.0) || Double.isInfinite(sigmas[i])) {
        throw new IllegalArgumentException(String.format("Sigma of sample %d is not a positive number: %s", i, sigmas[i]));
      }
      weights[i] = 1.0 / (sigmas[i] * sigmas[i]);
      maxWeight = Math.max(maxWeight, weights[i]);
    }
    // Only relative weights matter; keep them near unity for the optimizer's tolerances.
    for (int i = 0; i < n; i++) {
      weights[i] /= maxWeight;
    }

    MultivariateVectorFunction values = parameters -> {
      double[] result = new double[n];
      for (int i = 0; i < n; i++) {
        result[i] = shape.value(x[i], parameters);
      }
      return result;
    };
    MultivariateMatrixFunction jacobian = parameters -> {
      double[][] result = new double[n][];
      for (int i = 0; i < n; i++) {
        result[i] = shape.gradient(x[i], parameters);
      }
      return result;
    };

    LeastSquaresProblem problem = new LeastSquaresBuilder()
        .maxEvaluations(maxEvaluations)
        .maxIterations(maxIterations)
        .start(start.getParameters())
        .target(y)
        .weight(new DiagonalMatrix(weights))
        .model(values, jacobian)
        .build();

    LeastSquaresOptimizer.Optimum optimum;
    try {
      optimum = new LevenbergMarquardtOptimizer().optimize(problem);
    } catch (MathIllegalStateException | MathIllegalArgumentException e) {
      throw new FitConvergenceException(stage, strategy,
          String.format("Least-squares fit of %s did not converge: %s", shape.getName(), e.getMessage()), e);
    }

    double[] fitted = optimum.getPoint().toArray();
    for (double parameter : fitted) {
      if (Double.isNaN(parameter) || Double.isInfinite(parameter)) {
        throw new FitConvergenceException(stage, strategy,
            String.format("Least-squares fit of %s produced non-finite parameters", shape.getName()));
      }
    }

    double cost = optimum.getCost();
    double reducedChiSquare = cost * cost / (n - p);
    double[][] covariance = covariance(optimum.getJacobian(), reducedChiSquare);
    for (int i = 0; i < p; i++) {
      double variance = covariance[i][i];
      if (Double.isNaN(variance) || Double.isInfinite(variance)) {
        throw new FitConvergenceException(stage, strategy, String.format(
            "Covariance of parameter %s of %s is undefined", shape.getParameterNames().get(i), shape.getName()));
      }
    }

    LOGGER.debug("Fitted %s to %d samples in %d iterations (%d evaluations), cost %.6g",
        shape.getName(), n, optimum.getIterations(), optimum.getEvaluations(), cost);
    return start.withFit(fitted, covariance);
  }

  /**
   * scale * (J^T J)^+ from the SVD J = U S V^T of the weighted Jacobian, as V S^-2 V^T.  Singular values below
   * max(n, p) ulps of the largest are dropped, so a parameter the data does not constrain gets no variance from that
   * direction instead of an arbitrarily large or negative one.  The diagonal is a sum of squares and never negative.
   */
  static double[][] covariance(RealMatrix weightedJacobian, double scale) {
    SingularValueDecomposition svd = new SingularValueDecomposition(weightedJacobian);
    double[] singularValues = svd.getSingularValues();
    RealMatrix v = svd.getV();
    int p = weightedJacobian.getColumnDimension();
    double threshold = FastMath.ulp(1.0) * FastMath.max(weightedJacobian.getRowDimension(), p) *
        (singularValues.length == 0 ? 0.0 : singularValues[0]);

    double[][] covariance = new double[p][p];
    for (int k = 0; k < singularValues.length; k++) {
      if (!(singularValues[k] > threshold)) {
        continue;
      }
      double factor = scale / (singularValues[k] * singularValues[k]);
      for (int i = 0; i < p; i++) {
        for (int j = 0; j < p; j++) {
          covariance[i][j] += v.getEntry(i, k) * v.getEntry(j, k) * factor;
        }
      }
    }
    return covariance;
  }
}
