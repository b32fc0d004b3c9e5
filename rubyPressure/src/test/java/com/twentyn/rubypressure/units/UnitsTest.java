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

package com.twentyn.rubypressure.units;

import com.twentyn.rubypressure.uncertainty.UncertainValue;
import org.junit.Test;

import static org.junit.Assert.assertEquals;

public class UnitsTest {

  @Test
  public void testTemperatures() throws Exception {
    assertEquals(298.15, TemperatureUnit.CELSIUS.toKelvin(UncertainValue.exact(25.0)).getNominal(), 1e-9);
    assertEquals(273.15, TemperatureUnit.FAHRENHEIT.toKelvin(UncertainValue.exact(32.0)).getNominal(), 1e-9);
    assertEquals(373.15, TemperatureUnit.FAHRENHEIT.toKelvin(UncertainValue.exact(212.0)).getNominal(), 1e-9);
    assertEquals(-40.0, TemperatureUnit.FAHRENHEIT.fromKelvin(
        TemperatureUnit.CELSIUS.toKelvin(UncertainValue.exact(-40.0))).getNominal(), 1e-9);
    assertEquals("Fahrenheit degrees are smaller", 5.0 / 9.0,
        TemperatureUnit.FAHRENHEIT.toKelvin(UncertainValue.of(100.0, 1.0)).getStdDev(), 1e-12);
  }

  @Test
  public void testPressures() throws Exception {
    assertEquals(2.5, PressureUnit.KBAR.toGigapascal(UncertainValue.exact(25.0)).getNominal(), 1e-12);
    assertEquals(25.0, PressureUnit.KBAR.fromGigapascal(UncertainValue.exact(2.5)).getNominal(), 1e-12);
    assertEquals(3.0, PressureUnit.GPA.fromGigapascal(UncertainValue.exact(3.0)).getNominal(), 0.0);
  }

  @Test
  public void testWavelengths() throws Exception {
    assertEquals(694.444444, WavelengthUnit.WAVENUMBER.toNanometer(UncertainValue.exact(14400.0)).getNominal(), 1e-6);
    assertEquals(14400.0, WavelengthUnit.WAVENUMBER.fromNanometer(
        UncertainValue.exact(1e7 / 14400.0)).getNominal(), 1e-6);
    assertEquals(694.2, WavelengthUnit.NANOMETER.toNanometer(UncertainValue.exact(694.2)).getNominal(), 0.0);
  }

  @Test
  public void testSymbols() throws Exception {
    assertEquals(TemperatureUnit.CELSIUS, TemperatureUnit.fromSymbol("C"));
    assertEquals(TemperatureUnit.KELVIN, TemperatureUnit.fromSymbol("kelvin"));
    assertEquals(PressureUnit.KBAR, PressureUnit.fromSymbol("kbar"));
    assertEquals(WavelengthUnit.WAVENUMBER, WavelengthUnit.fromSymbol("cm-1"));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testUnknownSymbol() throws Exception {
    PressureUnit.fromSymbol("psi");
  }
}
