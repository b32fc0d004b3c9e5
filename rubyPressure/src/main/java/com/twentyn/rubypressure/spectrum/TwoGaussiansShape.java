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
 * Sum of two Gaussian lobes, parameters (a1, mu1, si1, a2, mu2, si2).
 */
public class TwoGaussiansShape extends AbstractCurveShape {

  public TwoGaussiansShape() {
    super("Two Gaussians", "a1", "mu1", "si1", "a2", "mu2", "si2");
  }

  @Override
  public double value(double x, double[] p) {
    return gaussian(x, p[0], p[1], p[2]) + gaussian(x, p[3], p[4], p[5]);
  }

  @Override
  public double[] gradient(double x, double[] p) {
    double[] gradient = new double[6];
    addGaussianGradient(gradient, 0, x, p[0], p[1], p[2]);
    addGaussianGradient(gradient, 3, x, p[3], p[4], p[5]);
    return gradient;
  }
}
