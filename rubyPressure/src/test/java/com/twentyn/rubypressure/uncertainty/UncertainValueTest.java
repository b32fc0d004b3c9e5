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

package com.twentyn.rubypressure.uncertainty;

import org.junit.Test;

import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class UncertainValueTest {
  private static final double TOLERANCE = 1e-12;

  @Test
  public void testSelfDifferenceIsExact() throws Exception {
    UncertainValue x = UncertainValue.of(694.24, 0.01);
    UncertainValue zero = x.minus(x);
    assertEquals("Nominal of x - x", 0.0, zero.getNominal(), TOLERANCE);
    assertEquals("Error of x - x cancels", 0.0, zero.getStdDev(), TOLERANCE);
    assertEquals("x / x is exactly one", 0.0, x.dividedBy(x).getStdDev(), TOLERANCE);
  }

  @Test
  public void testIndependentErrorsAddInQuadrature() throws Exception {
    UncertainValue a = UncertainValue.of(1.0, 0.3);
    UncertainValue b = UncertainValue.of(2.0, 0.4);
    assertEquals("Sum", 0.5, a.plus(b).getStdDev(), TOLERANCE);
    assertEquals("Difference", 0.5, a.minus(b).getStdDev(), TOLERANCE);
    assertEquals("Product", Math.sqrt(0.6 * 0.6 + 0.4 * 0.4), a.times(b).getStdDev(), TOLERANCE);
    assertEquals("Independent values do not correlate", 0.0, a.correlation(b), TOLERANCE);
  }

  @Test
  public void testSharedSourcesCorrelate() throws Exception {
    UncertainValue x = UncertainValue.of(3.0, 0.1);
    UncertainValue y = UncertainValue.of(5.0, 0.2);
    UncertainValue sum = x.plus(y);
    assertEquals("cov(x, x + y) = var(x)", 0.01, x.covariance(sum), TOLERANCE);
    assertEquals("Fully correlated with a multiple of itself", 1.0, x.correlation(x.times(7.0)), TOLERANCE);
    assertEquals("Fully anti-correlated with its negation", -1.0, x.correlation(x.negate()), TOLERANCE);
  }

  @Test
  public void testElementaryFunctions() throws Exception {
    UncertainValue x = UncertainValue.of(2.0, 0.01);
    assertEquals("d(x^3)/dx = 3 x^2", 12.0, x.pow(3.0).derivative(x), 1e-9);
    assertEquals("d(exp x)/dx = exp x", Math.exp(2.0), x.exp().derivative(x), 1e-9);
    assertEquals("d(log x)/dx = 1 / x", 0.5, x.log().derivative(x), 1e-12);
    assertEquals("d(1 / x)/dx = -1 / x^2", -0.25, x.reciprocal().derivative(x), 1e-12);

    UncertainValue b = UncertainValue.of(3.0, 0.1);
    UncertainValue power = x.pow(b);
    assertEquals("x^b nominal", 8.0, power.getNominal(), 1e-12);
    assertEquals("d(x^b)/db = x^b ln x", 8.0 * Math.log(2.0), power.derivative(b), 1e-9);
    assertEquals("An exact exponent adds no error", 3.0 * 4.0 * 0.01,
        x.pow(UncertainValue.exact(3.0)).getStdDev(), 1e-12);
  }

  @Test
  public void testCorrelatedValuesReproduceCovariance() throws Exception {
    double[][] covariance = {{4.0, 1.0, 0.0}, {1.0, 9.0, -2.0}, {0.0, -2.0, 1.0}};
    List<UncertainValue> values = UncertainValue.correlated(new double[]{1.0, 2.0, 3.0}, covariance);
    for (int i = 0; i < 3; i++) {
      assertEquals("Nominal", i + 1.0, values.get(i).getNominal(), TOLERANCE);
      for (int j = 0; j < 3; j++) {
        assertEquals(String.format("Covariance (%d, %d)", i, j),
            covariance[i][j], values.get(i).covariance(values.get(j)), 1e-9);
      }
    }
  }

  @Test
  public void testParse() throws Exception {
    UncertainValue parsed = UncertainValue.parse(" 694.5+/-0.02 ");
    assertEquals("Nominal", 694.5, parsed.getNominal(), TOLERANCE);
    assertEquals("Error", 0.02, parsed.getStdDev(), TOLERANCE);
    assertEquals("Plus-minus sign", 0.1, UncertainValue.parse("300±0.1").getStdDev(), TOLERANCE);
    assertTrue("A bare number is exact", UncertainValue.parse("-1.5").isExact());
    assertEquals("Negative nominal", -1.5, UncertainValue.parse("-1.5+/-1").getNominal(), TOLERANCE);
  }

  @Test(expected = NumberFormatException.class)
  public void testParseRejectsGarbage() throws Exception {
    UncertainValue.parse("about seven");
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNegativeStdDevIsRejected() throws Exception {
    UncertainValue.of(1.0, -0.1);
  }

  @Test
  public void testToString() throws Exception {
    assertEquals("1.5+/-0.25", UncertainValue.of(1.5, 0.25).toString());
  }
}
