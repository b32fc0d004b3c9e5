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

package com.twentyn.rubypressure.spectrum;

import com.twentyn.rubypressure.uncertainty.UncertainValue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * A curve shape together with concrete parameter values and their standard errors.  Before a fit the errors are
 * zero; after a fit they come from the diagonal of the fit's covariance matrix, and the full covariance is kept so
 * that parameters read through {@link #getParameter(int)} stay correlated with each other.
 *
 * Immutable: fitting produces a new CurveModel through {@link #withFit(double[], double[][])}.
 */
public final class CurveModel {
  public static final CurveModel ZERO = new CurveModel(CurveShape.ZERO, new double[0]);

  private final CurveShape shape;
  private final double[] parameters;
  private final double[] standardErrors;
  private final double[][] covariance;
  private final List<UncertainValue> uncertainParameters;

  public CurveModel(CurveShape shape, double[] parameters) {
    this(shape, parameters, null);
  }

  private CurveModel(CurveShape shape, double[] parameters, double[][] covariance) {
    if (parameters.length != shape.getParameterCount()) {
      throw new ArityException(shape.getName(), shape.getParameterCount(), parameters.length);
    }
    this.shape = shape;
    this.parameters = Arrays.copyOf(parameters, parameters.length);
    this.standardErrors = new double[parameters.length];
    if (covariance == null) {
      this.covariance = null;
      List<UncertainValue> exact = new ArrayList<>(parameters.length);
      for (double parameter : parameters) {
        exact.add(UncertainValue.exact(parameter));
      }
      this.uncertainParameters = Collections.unmodifiableList(exact);
    } else {
      this.covariance = new double[covariance.length][];
      for (int i = 0; i < covariance.length; i++) {
        this.covariance[i] = Arrays.copyOf(covariance[i], covariance[i].length);
        this.standardErrors[i] = Math.sqrt(Math.max(0.0, covariance[i][i]));
      }
      this.uncertainParameters = Collections.unmodifiableList(UncertainValue.correlated(this.parameters, covariance));
    }
  }

  /**
   * Returns the same shape with new parameter values and no uncertainty, e.g. a starting point for a fit.
   */
  public CurveModel withParameters(double[] newParameters) {
    return new CurveModel(shape, newParameters, null);
  }

  /**
   * Returns the same shape with fitted parameter values and their covariance matrix.
   */
  public CurveModel withFit(double[] fittedParameters, double[][] parameterCovariance) {
    if (parameterCovariance.length != fittedParameters.length) {
      throw new ArityException(shape.getName(), fittedParameters.length, parameterCovariance.length);
    }
    return new CurveModel(shape, fittedParameters, parameterCovariance);
  }

  public CurveShape getShape() {
    return shape;
  }

  public String getName() {
    return shape.getName();
  }

  public int getParameterCount() {
    return parameters.length;
  }

  public double[] getParameters() {
    return Arrays.copyOf(parameters, parameters.length);
  }

  public double[] getStandardErrors() {
    return Arrays.copyOf(standardErrors, standardErrors.length);
  }

  public boolean hasCovariance() {
    return covariance != null;
  }

  public UncertainValue getParameter(int index) {
    return uncertainParameters.get(index);
  }

  public double evaluate(double x) {
    return shape.value(x, parameters);
  }

  /**
   * Evaluates the curve at x with the given parameters in place of the stored ones.
   * @throws ArityException if the number of overrides does not match the shape's parameter count
   */
  public double evaluate(double x, double... overrides) {
    if (overrides.length != parameters.length) {
      throw new ArityException(shape.getName(), parameters.length, overrides.length);
    }
    return shape.value(x, overrides);
  }

  public double[] evaluate(double[] xs) {
    double[] ys = new double[xs.length];
    for (int i = 0; i < xs.length; i++) {
      ys[i] = shape.value(xs[i], parameters);
    }
    return ys;
  }

  @Override
  public String toString() {
    StringBuilder builder = new StringBuilder(shape.getName()).append('(');
    List<String> names = shape.getParameterNames();
    for (int i = 0; i < parameters.length; i++) {
      if (i > 0) {
        builder.append(", ");
      }
      builder.append(names.get(i)).append('=').append(parameters[i]);
      if (standardErrors[i] > 0.0) {
        builder.append("+/-").append(standardErrors[i]);
      }
    }
    return builder.append(')').toString();
  }
}
