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

import com.twentyn.rubypressure.uncertainty.UncertainValue;
import org.junit.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class CurveModelTest {

  private static double[] numericGradient(CurveShape shape, double x, double[] parameters) {
    double[] gradient = new double[parameters.length];
    for (int i = 0; i < parameters.length; i++) {
      double[] above = Arrays.copyOf(parameters, parameters.length);
      double[] below = Arrays.copyOf(parameters, parameters.length);
      above[i] += 1e-6;
      below[i] -= 1e-6;
      gradient[i] = (shape.value(x, above) - shape.value(x, below)) / 2e-6;
    }
    return gradient;
  }

  @Test
  public void testPolynomialEvaluation() throws Exception {
    CurveModel quadratic = new CurveModel(new PolynomialShape(2), new double[]{1.0, -2.0, 0.5});
    assertEquals("Name follows the degree", "Quadratic", quadratic.getName());
    assertEquals("1 - 2x + 0.5x^2 at 4", 1.0, quadratic.evaluate(4.0), 1e-12);
    assertEquals("Overridden parameters", 3.0, quadratic.evaluate(2.0, 1.0, 1.0, 0.0), 1e-12);
    assertArrayEquals("Vectorized evaluation", new double[]{1.0, -0.5, -1.0},
        quadratic.evaluate(new double[]{0.0, 1.0, 2.0}), 1e-12);
  }

  @Test(expected = ArityException.class)
  public void testWrongOverrideCountFails() throws Exception {
    new CurveModel(new TwoGaussiansShape(), new double[]{1.0, 694.2, 0.3, 0.6, 692.8, 0.3}).evaluate(694.0, 1.0, 2.0);
  }

  @Test(expected = ArityException.class)
  public void testWrongParameterCountFails() throws Exception {
    new CurveModel(new CamelShape(), new double[]{1.0, 694.2, 0.3});
  }

  @Test
  public void testZeroModel() throws Exception {
    assertEquals("Zero everywhere", 0.0, CurveModel.ZERO.evaluate(694.0), 0.0);
    assertEquals("No parameters", 0, CurveModel.ZERO.getParameterCount());
  }

  @Test
  public void testGradientsMatchFiniteDifferences() throws Exception {
    List<CurveShape> shapes = Arrays.asList(
        new PolynomialShape(3), new TwoGaussiansShape(), new TwoPseudoVoigtsShape(), new CamelShape());
    List<double[]> parameters = Arrays.asList(
        new double[]{0.1, -0.2, 0.03, -0.004},
        new double[]{1.0, 694.2, 0.35, 0.6, 692.8, 0.3},
        new double[]{1.0, 694.2, 0.6, 0.4, 0.6, 692.8, 0.5, 0.7},
        new double[]{1.0, 694.2, 0.35, 0.6, 692.8, 0.35, 0.1, 1.0});
    for (int s = 0; s < shapes.size(); s++) {
      CurveShape shape = shapes.get(s);
      for (double x : new double[]{692.5, 693.5, 694.4}) {
        double[] p = parameters.get(s);
        if (shape instanceof PolynomialShape) {
          x -= 692.0;
        }
        assertArrayEquals(String.format("Gradient of %s at %.1f", shape.getName(), x),
            numericGradient(shape, x, p), shape.gradient(x, p), 1e-3);
      }
    }
  }

  @Test
  public void testCamelMiddleLobeSitsBetweenTheLines() throws Exception {
    CamelShape camel = new CamelShape();
    double[] onlyMiddle = {0.0, 694.0, 0.3, 0.0, 692.0, 0.3, 2.0, 0.5};
    assertEquals("Middle lobe peaks halfway between the centers", 2.0, camel.value(693.0, onlyMiddle), 1e-12);
  }

  @Test
  public void testCamelMiddleLobeKeepsAMinimumWidth() throws Exception {
    CamelShape camel = new CamelShape();
    double[] collapsed = {0.0, 694.0, 0.3, 0.0, 692.0, 0.3, 2.0, 0.0};
    double halfWidthAway = 693.0 + CamelShape.MIN_MIDDLE_WIDTH;
    assertEquals("Width floor applies", 2.0 * Math.exp(-0.5), camel.value(halfWidthAway, collapsed), 1e-9);
    for (double value : camel.gradient(693.0, collapsed)) {
      assertFalse("Finite gradient at zero width", Double.isNaN(value) || Double.isInfinite(value));
    }
    assertArrayEquals("Analytic gradient near zero width", numericGradient(camel, 693.02, collapsed),
        camel.gradient(693.02, collapsed), 1e-3);
  }

  @Test
  public void testFitCarriesCorrelatedParameters() throws Exception {
    CurveModel line = new CurveModel(new PolynomialShape(1), new double[]{1.0, 2.0});
    assertFalse("No covariance before a fit", line.hasCovariance());
    assertTrue("Parameters are exact before a fit", line.getParameter(0).isExact());

    double[][] covariance = {{0.04, -0.01}, {-0.01, 0.09}};
    CurveModel fitted = line.withFit(new double[]{1.5, 2.5}, covariance);
    assertTrue("Covariance after a fit", fitted.hasCovariance());
    assertArrayEquals("Standard errors from the diagonal", new double[]{0.2, 0.3}, fitted.getStandardErrors(), 1e-12);
    UncertainValue intercept = fitted.getParameter(0), slope = fitted.getParameter(1);
    assertEquals("Fitted value", 1.5, intercept.getNominal(), 0.0);
    assertEquals("Parameters keep their covariance", -0.01, intercept.covariance(slope), 1e-12);
    assertEquals("The original model is unchanged", 1.0, line.getParameters()[0], 0.0);
  }
}
