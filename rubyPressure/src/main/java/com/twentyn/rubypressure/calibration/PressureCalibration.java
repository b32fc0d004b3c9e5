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

import java.util.ArrayList;
import java.util.List;

/**
 * Published empirical relations between the R1 line position and pressure.  Positions are in nm, temperatures in
 * kelvin and pressures in GPa.  The published uncertainties of the constants are carried as independent error
 * sources, so they show up in every pressure computed with them.
 */
public enum PressureCalibration {
  MAO("Mao", 1986, "https://doi.org/10.1029/JB091iB05p04673") {
    @Override
    public UncertainValue pressure(UncertainValue r1, UncertainValue temperature) {
      return powerLaw(r1, RubyConstants.R1_0, POWER_LAW_A, MAO_B);
    }
  },
  LIU("Liu", 2013, "https://doi.org/10.1088/1674-1056/22/5/056201") {
    @Override
    public UncertainValue pressure(UncertainValue r1, UncertainValue temperature) {
      return powerLaw(r1, RubyConstants.R1_0, POWER_LAW_A, LIU_B);
    }
  },
  JACOBSEN("Jacobsen", 2008, "https://doi.org/10.2138/am.2008.2988") {
    @Override
    public UncertainValue pressure(UncertainValue r1, UncertainValue temperature) {
      return powerLaw(r1, RubyConstants.R1_0, POWER_LAW_A, JACOBSEN_B);
    }
  },
  PIERMARINI("Piermarini", 1975, "https://doi.org/10.1063/1.321957") {
    @Override
    public UncertainValue pressure(UncertainValue r1, UncertainValue temperature) {
      return PIERMARINI_SLOPE.times(r1.minus(RubyConstants.R1_0));
    }
  },
  RUBY2020("Ruby2020", 2020, "https://doi.org/10.1080/08957959.2020.1791107") {
    @Override
    public UncertainValue pressure(UncertainValue r1, UncertainValue temperature) {
      UncertainValue relative = r1.minus(RUBY2020_R1_0).dividedBy(RUBY2020_R1_0);
      return RUBY2020_A.times(relative).times(RUBY2020_B.times(relative).plus(1.0));
    }

    @Override
    public UncertainValue referencePosition(UncertainValue temperature) {
      return RUBY2020_R1_0;
    }
  },
  WEI("Wei", 2011, "https://doi.org/10.1063/1.3624618") {
    @Override
    public UncertainValue pressure(UncertainValue r1, UncertainValue temperature) {
      UncertainValue dt = temperature.minus(WEI_TEMPERATURE);
      UncertainValue a = WEI_A300.plus(WEI_A1.times(dt));
      UncertainValue b = WEI_B300.plus(WEI_B1.times(dt)).plus(WEI_B2.times(dt.pow(2.0)));
      return a.dividedBy(b).times(r1.dividedBy(referencePosition(temperature)).pow(b).minus(1.0));
    }

    @Override
    public UncertainValue referencePosition(UncertainValue temperature) {
      return WEI_LAMBDA300.plus(WEI_LAMBDA1.times(temperature.minus(WEI_TEMPERATURE)));
    }

    @Override
    public boolean isTemperatureDependent() {
      return true;
    }
  };

  private static final double POWER_LAW_A = 1904.0;
  private static final double MAO_B = 7.665;
  private static final double LIU_B = 9.827;
  private static final UncertainValue JACOBSEN_B = UncertainValue.of(10.32, 0.07);

  private static final UncertainValue PIERMARINI_SLOPE = UncertainValue.of(2.740, 0.016);

  private static final UncertainValue RUBY2020_R1_0 = UncertainValue.of(694.25, 0.01);
  private static final UncertainValue RUBY2020_A = UncertainValue.of(1870.0, 10.0);
  private static final UncertainValue RUBY2020_B = UncertainValue.of(5.63, 0.03);

  private static final double WEI_TEMPERATURE = 298.0;
  private static final UncertainValue WEI_A300 = UncertainValue.of(1915.0, 0.9);
  private static final UncertainValue WEI_A1 = UncertainValue.of(0.622, 0.007);
  private static final UncertainValue WEI_B300 = UncertainValue.of(9.28, 0.02);
  private static final UncertainValue WEI_B1 = UncertainValue.of(-0.024, 0.003);
  private static final UncertainValue WEI_B2 = UncertainValue.of(-8.2e-7, 0.02e-7);
  private static final UncertainValue WEI_LAMBDA300 = UncertainValue.exact(694.2);
  private static final UncertainValue WEI_LAMBDA1 = UncertainValue.of(0.0063, 0.0002);

  private final String name;
  private final int year;
  private final String reference;

  PressureCalibration(String name, int year, String reference) {
    this.name = name;
    this.year = year;
    this.reference = reference;
  }

  public String getName() {
    return name;
  }

  public int getYear() {
    return year;
  }

  /**
   * DOI link of the publication.
   */
  public String getReference() {
    return reference;
  }

  /**
   * Pressure for a temperature-corrected R1 position.  Only temperature-dependent calibrations use the temperature.
   */
  public abstract UncertainValue pressure(UncertainValue r1, UncertainValue temperature);

  /**
   * The R1 position at which this calibration gives zero pressure.
   */
  public UncertainValue referencePosition(UncertainValue temperature) {
    return RubyConstants.R1_0;
  }

  /**
   * True if the calibration models the temperature dependence of R1 itself, in which case no separate temperature
   * correction must be applied.
   */
  public boolean isTemperatureDependent() {
    return false;
  }

  /**
   * (a / b) ((r1 / r1Ref)^b - 1)
   */
  static UncertainValue powerLaw(UncertainValue r1, UncertainValue r1Ref, double a, double b) {
    return powerLaw(r1, r1Ref, a, UncertainValue.exact(b));
  }

  static UncertainValue powerLaw(UncertainValue r1, UncertainValue r1Ref, double a, UncertainValue b) {
    return b.reciprocal().times(a).times(r1.dividedBy(r1Ref).pow(b).minus(1.0));
  }

  public static PressureCalibration fromName(String name) {
    List<String> names = new ArrayList<>();
    for (PressureCalibration calibration : values()) {
      if (calibration.name.equalsIgnoreCase(name)) {
        return calibration;
      }
      names.add(calibration.name);
    }
    throw new IllegalArgumentException(String.format(
        "Unknown translating strategy '%s', expected one of %s", name, names));
  }
}
