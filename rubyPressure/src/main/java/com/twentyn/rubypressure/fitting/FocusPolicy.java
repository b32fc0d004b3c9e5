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

import com.twentyn.rubypressure.spectrum.Spectrum;
import com.twentyn.rubypressure.spectrum.WeightingPolicy;

import java.util.ArrayList;
import java.util.List;

/**
 * Which samples a background fit looks at, and how their residuals are weighted.
 */
public enum FocusPolicy {
  /**
   * The whole domain with Huber weighting; the emission lines end up as large-residual outliers.
   */
  LINEAR_HUBER("Linear Huber") {
    @Override
    public Spectrum apply(Spectrum spectrum) {
      return spectrum.focusOnWhole().withWeighting(WeightingPolicy.HUBER);
    }
  },
  /**
   * Only both edges of the domain with equal weights, which keeps the emission lines out of the fit altogether.
   */
  LINEAR_SATELITE("Linear Satelite") {
    @Override
    public Spectrum apply(Spectrum spectrum) {
      return spectrum.focusOnEdges(EDGE_FRACTION).withWeighting(WeightingPolicy.EQUAL);
    }
  };

  public static final double EDGE_FRACTION = 0.1;

  private final String name;

  FocusPolicy(String name) {
    this.name = name;
  }

  public String getName() {
    return name;
  }

  public abstract Spectrum apply(Spectrum spectrum);

  public static FocusPolicy fromName(String name) {
    List<String> names = new ArrayList<>();
    for (FocusPolicy policy : values()) {
      if (policy.name.equalsIgnoreCase(name)) {
        return policy;
      }
      names.add(policy.name);
    }
    throw new IllegalArgumentException(String.format(
        "Unknown backfitting strategy '%s', expected one of %s", name, names));
  }
}
