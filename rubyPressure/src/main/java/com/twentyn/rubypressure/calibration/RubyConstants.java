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

/**
 * Ambient-condition reference values for ruby fluorescence.
 */
public final class RubyConstants {
  /** Ambient pressure, GPa. */
  public static final UncertainValue P_0 = UncertainValue.of(0.0, 0.1);
  /** R1 line position at ambient pressure and temperature, nm. */
  public static final UncertainValue R1_0 = UncertainValue.of(694.24, 0.01);
  /** R2 line position at ambient pressure and temperature, nm. */
  public static final UncertainValue R2_0 = UncertainValue.of(692.75, 0.01);
  /** Ambient temperature, K. */
  public static final UncertainValue T_0 = UncertainValue.of(298.15, 0.1);

  private RubyConstants() {
  }
}
