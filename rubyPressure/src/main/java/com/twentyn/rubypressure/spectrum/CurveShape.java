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

import java.util.Collections;
import java.util.List;

/**
 * A parametrized family of scalar functions y = f(x; p0, p1, ...), e.g. a polynomial background or a sum of
 * Gaussian lobes.  Implementations are stateless; the parameter values live in a {@link CurveModel}.
 */
public interface CurveShape {

  /**
   * The function that is identically zero and takes no parameters.
   */
  CurveShape ZERO = new CurveShape() {
    @Override
    public String getName() {
      return "Zero";
    }

    @Override
    public List<String> getParameterNames() {
      return Collections.emptyList();
    }

    @Override
    public double value(double x, double[] parameters) {
      return 0.0;
    }

    @Override
    public double[] gradient(double x, double[] parameters) {
      return new double[0];
    }
  };

  String getName();

  List<String> getParameterNames();

  default int getParameterCount() {
    return getParameterNames().size();
  }

  double value(double x, double[] parameters);

  /**
   * Partial derivatives of the value with respect to each parameter, in parameter order.
   */
  double[] gradient(double x, double[] parameters);
}
