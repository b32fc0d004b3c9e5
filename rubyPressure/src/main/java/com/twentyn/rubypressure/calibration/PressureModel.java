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
 * Maps an R1 position at a given temperature to a pressure.  Implementations must be strictly increasing in the
 * position over the physically meaningful range; {@link PressureInverter} relies on it.
 */
public interface PressureModel {

  String getName();

  /**
   * @param position R1 position in nm, already corrected by any calibration offset
   * @param temperature sample temperature in K
   * @return pressure in GPa
   */
  UncertainValue translate(UncertainValue position, UncertainValue temperature);

  /**
   * The R1 position that translates to zero pressure at the given temperature.
   */
  UncertainValue referencePosition(UncertainValue temperature);
}
