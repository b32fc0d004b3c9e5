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

/**
 * y = a0 + a1 x + a2 x^2 + ... ; used for spectral backgrounds.
 */
public class PolynomialShape extends AbstractCurveShape {
  private final int degree;

  public PolynomialShape(int degree) {
    super(nameFor(degree), coefficientNames(degree));
    this.degree = degree;
  }

  private static String nameFor(int degree) {
    switch (degree) {
      case 0:
        return "Constant";
      case 1:
        return "Linear";
      case 2:
        return "Quadratic";
      case 3:
        return "Cubic";
      default:
        return String.format("Polynomial(%d)", degree);
    }
  }

  private static String[] coefficientNames(int degree) {
    if (degree < 0) {
      throw new IllegalArgumentException(String.format("Polynomial degree must be non-negative, got %d", degree));
    }
    String[] names = new String[degree + 1];
    for (int i = 0; i <= degree; i++) {
      names[i] = "a" + i;
    }
    return names;
  }

  public int getDegree() {
    return degree;
  }

  @Override
  public double value(double x, double[] parameters) {
    // Horner's scheme
    double value = 0.0;
    for (int i = parameters.length - 1; i >= 0; i--) {
      value = value * x + parameters[i];
    }
    return value;
  }

  @Override
  public double[] gradient(double x, double[] parameters) {
    double[] gradient = new double[parameters.length];
    double power = 1.0;
    for (int i = 0; i < parameters.length; i++) {
      gradient[i] = power;
      power *= x;
    }
    return gradient;
  }
}
