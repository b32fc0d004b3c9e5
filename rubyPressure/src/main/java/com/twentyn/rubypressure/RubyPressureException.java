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

package com.twentyn.rubypressure;

/**
 * Base class for every recoverable failure of the pressure pipeline.  Carries the pipeline stage that failed
 * (background fitting, peak fitting, inversion, ...) and the name of the strategy that was active, so that callers
 * can decide on a fallback (e.g. retry the peak fit with a different shape) or report the failure to the user.
 */
public class RubyPressureException extends Exception {
  private final String stage;
  private final String strategy;

  public RubyPressureException(String stage, String strategy, String message) {
    super(formatMessage(stage, strategy, message));
    this.stage = stage;
    this.strategy = strategy;
  }

  public RubyPressureException(String stage, String strategy, String message, Throwable cause) {
    super(formatMessage(stage, strategy, message), cause);
    this.stage = stage;
    this.strategy = strategy;
  }

  private static String formatMessage(String stage, String strategy, String message) {
    return String.format("[%s / %s] %s", stage, strategy, message);
  }

  public String getStage() {
    return stage;
  }

  public String getStrategy() {
    return strategy;
  }
}
