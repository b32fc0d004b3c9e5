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

import org.apache.commons.math3.util.FastMath;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Base for curve shapes whose gradient is evaluated by central finite differences.  Shapes with a cheap analytic
 * gradient override {@link #gradient(double, double[])}.
 */
public abstract class AbstractCurveShape implements CurveShape {
  private static final double RELATIVE_STEP = 1e-6;
  private static final double MINIMUM_STEP = 1e-9;

  private final String name;
  private final List<String> parameterNames;

  protected AbstractCurveShape(String name, String... parameterNames) {
    this.name = name;
    this.parameterNames = Collections.unmodifiableList(Arrays.asList(parameterNames));
  }

  @Override
  public String getName() {
    return name;
  }

  @Override
  public List<String> getParameterNames() {
    return parameterNames;
  }

  @Override
  public double[] gradient(double x, double[] parameters) {
    double[] gradient = new double[parameters.length];
    double[] shifted = Arrays.copyOf(parameters, parameters.length);
    for (int i = 0; i < parameters.length; i++) {
      double step = FastMath.max(MINIMUM_STEP, RELATIVE_STEP * FastMath.abs(parameters[i]));
      shifted[i] = parameters[i] + step;
      double above = value(x, shifted);
      shifted[i] = parameters[i] - step;
      double below = value(x, shifted);
      shifted[i] = parameters[i];
      gradient[i] = (above - below) / (2.0 * step);
    }
    return gradient;
  }

  static double gaussian(double x, double amplitude, double center, double sigma) {
    double d = x - center;
    return amplitude * FastMath.exp(-d * d / (2.0 * sigma * sigma));
  }

  static double lorentzian(double x, double amplitude, double center, double gamma) {
    double d = x - center;
    return amplitude * gamma * gamma / (d * d + gamma * gamma);
  }

  /**
   * Adds the analytic gradient of one Gaussian lobe (amplitude, center, sigma) into gradient[offset..offset+2].
   */
  static void addGaussianGradient(double[] gradient, int offset, double x,
                                  double amplitude, double center, double sigma) {
    double d = x - center;
    double s2 = sigma * sigma;
    double e = FastMath.exp(-d * d / (2.0 * s2));
    gradient[offset] += e;
    gradient[offset + 1] += amplitude * e * d / s2;
    gradient[offset + 2] += amplitude * e * d * d / (s2 * sigma);
  }

  @Override
  public String toString() {
    return name;
  }
}
