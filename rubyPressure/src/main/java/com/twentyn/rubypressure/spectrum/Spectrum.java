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

import com.twentyn.rubypressure.subset.IntervalSet;
import org.apache.commons.lang3.tuple.Pair;
import org.apache.commons.math3.util.FastMath;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * A measured spectrum: (x, y) samples, the curve currently modelling them, the focus region selecting which samples
 * take part in the next fit, and the policy used to weight residuals.
 *
 * Spectra are immutable; every stage of the pipeline derives a new Spectrum through the with* and focusOn* methods.
 * No ordering of x is enforced, callers may sort beforehand.
 */
public final class Spectrum {
  // Huber tolerance as a fraction of the largest absolute residual.
  static final double HUBER_TOLERANCE_FRACTION = 0.01;

  private final double[] x;
  private final double[] y;
  private final CurveModel curve;
  private final IntervalSet focus;
  private final WeightingPolicy weighting;

  public Spectrum(double[] x, double[] y) {
    this(x, y, CurveModel.ZERO, null, WeightingPolicy.EQUAL);
  }

  /**
   * @param focus the samples to fit against; null focuses on the whole domain
   */
  public Spectrum(double[] x, double[] y, CurveModel curve, IntervalSet focus, WeightingPolicy weighting) {
    if (x.length != y.length) {
      throw new IllegalArgumentException(String.format(
          "x and y must have equal lengths, got %d and %d", x.length, y.length));
    }
    this.x = Arrays.copyOf(x, x.length);
    this.y = Arrays.copyOf(y, y.length);
    this.curve = curve;
    this.focus = focus == null ? domainOf(this.x) : focus;
    this.weighting = weighting;
  }

  private static IntervalSet domainOf(double[] x) {
    if (x.length == 0) {
      return IntervalSet.empty();
    }
    double min = Double.POSITIVE_INFINITY, max = Double.NEGATIVE_INFINITY;
    for (double value : x) {
      min = FastMath.min(min, value);
      max = FastMath.max(max, value);
    }
    return IntervalSet.of(min, max);
  }

  public int size() {
    return x.length;
  }

  public boolean isEmpty() {
    return x.length == 0;
  }

  public double[] getX() {
    return Arrays.copyOf(x, x.length);
  }

  public double[] getY() {
    return Arrays.copyOf(y, y.length);
  }

  public double getX(int i) {
    return x[i];
  }

  public double getY(int i) {
    return y[i];
  }

  public CurveModel getCurve() {
    return curve;
  }

  public IntervalSet getFocus() {
    return focus;
  }

  public WeightingPolicy getWeighting() {
    return weighting;
  }

  public IntervalSet domain() {
    return domainOf(x);
  }

  public double minX() {
    return domain().getIntervals().get(0).getLower();
  }

  public double maxX() {
    return domain().getIntervals().get(0).getUpper();
  }

  public double maxY() {
    double max = Double.NEGATIVE_INFINITY;
    for (double value : y) {
      max = FastMath.max(max, value);
    }
    return max;
  }

  public Spectrum withCurve(CurveModel newCurve) {
    return new Spectrum(x, y, newCurve, focus, weighting);
  }

  public Spectrum withFocus(IntervalSet newFocus) {
    return new Spectrum(x, y, curve, newFocus, weighting);
  }

  public Spectrum withWeighting(WeightingPolicy newWeighting) {
    return new Spectrum(x, y, curve, focus, newWeighting);
  }

  public Spectrum withY(double[] newY) {
    return new Spectrum(x, newY, curve, focus, weighting);
  }

  /**
   * Restricts the spectrum to the samples whose x lies in region; the result is focused on that region.
   */
  public Spectrum within(IntervalSet region) {
    List<Integer> kept = new ArrayList<>();
    for (int i = 0; i < x.length; i++) {
      if (region.contains(x[i])) {
        kept.add(i);
      }
    }
    double[] keptX = new double[kept.size()], keptY = new double[kept.size()];
    for (int i = 0; i < kept.size(); i++) {
      keptX[i] = x[kept.get(i)];
      keptY[i] = y[kept.get(i)];
    }
    return new Spectrum(keptX, keptY, curve, region, weighting);
  }

  public Spectrum focused() {
    return within(focus);
  }

  public Spectrum focusOnWhole() {
    return withFocus(domain());
  }

  /**
   * Focuses on both ends of the domain, each a given fraction of the x-range wide.
   */
  public Spectrum focusOnEdges(double fraction) {
    double min = minX(), max = maxX();
    double width = fraction * (max - min);
    return withFocus(IntervalSet.of(min, min + width).union(IntervalSet.of(max - width, max)));
  }

  /**
   * Focuses on windows of the given full width centered on each point, clipped to the domain.
   */
  public Spectrum focusOnPoints(double[] points, double width) {
    List<Pair<Double, Double>> windows = new ArrayList<>(points.length);
    for (double point : points) {
      windows.add(Pair.of(point - width / 2.0, point + width / 2.0));
    }
    return withFocus(IntervalSet.of(windows).intersect(domain()));
  }

  public double[] curveValues() {
    return curve.evaluate(x);
  }

  public double[] residuals() {
    double[] residuals = new double[x.length];
    for (int i = 0; i < x.length; i++) {
      residuals[i] = y[i] - curve.evaluate(x[i]);
    }
    return residuals;
  }

  /**
   * Per-sample residual weights in the sense of standard deviations: a larger weight means a larger assumed error
   * and therefore less influence on a fit.  EQUAL gives ones; HUBER keeps t^2 for residuals below the tolerance t and
   * grows as t (2|d| - t) above it, t being a fraction of the largest absolute residual.
   */
  public double[] residualWeights() {
    double[] weights = new double[x.length];
    if (weighting == WeightingPolicy.EQUAL) {
      Arrays.fill(weights, 1.0);
      return weights;
    }

    double[] residuals = residuals();
    double maxResidual = 0.0;
    for (double residual : residuals) {
      maxResidual = FastMath.max(maxResidual, FastMath.abs(residual));
    }
    double tolerance = HUBER_TOLERANCE_FRACTION * maxResidual;
    if (tolerance == 0.0) {
      // A perfect fit leaves nothing to down-weight.
      Arrays.fill(weights, 1.0);
      return weights;
    }
    for (int i = 0; i < residuals.length; i++) {
      double d = FastMath.abs(residuals[i]);
      weights[i] = d < tolerance ? tolerance * tolerance : tolerance * (2.0 * d - tolerance);
    }
    return weights;
  }

  /**
   * Mean of the squared weighted residuals over the focused samples.
   */
  public double meanSquaredError() {
    Spectrum focused = focused();
    if (focused.isEmpty()) {
      return Double.NaN;
    }
    double[] residuals = focused.residuals();
    double[] weights = focused.residualWeights();
    double sum = 0.0;
    for (int i = 0; i < residuals.length; i++) {
      double weighted = residuals[i] / weights[i];
      sum += weighted * weighted;
    }
    return sum / residuals.length;
  }

  @Override
  public String toString() {
    return String.format("Spectrum{%d samples, curve=%s, focus=%s, weighting=%s}",
        x.length, curve.getName(), focus, weighting.getName());
  }
}
