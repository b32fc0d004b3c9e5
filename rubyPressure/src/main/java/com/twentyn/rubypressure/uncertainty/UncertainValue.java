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

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.EigenDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.util.FastMath;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * A number with a one-sigma standard error, propagated through arithmetic by first-order (linear) error propagation.
 *
 * Every value is a linear combination of independent error sources: {@link #of(double, double)} creates a new
 * source, and arithmetic combines the partial derivatives with respect to each source by the chain rule.  Because
 * the sources are tracked, quantities that share a source are correlated, so for instance
 * <pre>x.minus(x)</pre> is exactly 0 +/- 0, and a peak position minus its own calibration offset does not count the
 * offset's error twice.
 *
 * Instances are immutable and may be shared freely.
 */
public final class UncertainValue implements Comparable<UncertainValue> {

  /**
   * An independent error source.  Identity is what matters: two sources with equal sigma are still independent.
   */
  private static final class ErrorSource {
    private final double stdDev;

    private ErrorSource(double stdDev) {
      this.stdDev = stdDev;
    }
  }

  public static final UncertainValue ZERO = exact(0.0);

  private static final String[] PLUS_MINUS = {"+/-", "±"};

  private final double nominal;
  private final Map<ErrorSource, Double> derivatives;

  private UncertainValue(double nominal, Map<ErrorSource, Double> derivatives) {
    this.nominal = nominal;
    this.derivatives = derivatives;
  }

  /**
   * Creates an independent uncertain quantity.  This is the single conversion point from plain numbers into
   * uncertain ones; nothing converts implicitly.
   */
  public static UncertainValue of(double nominal, double stdDev) {
    if (stdDev < 0.0 || Double.isNaN(stdDev)) {
      throw new IllegalArgumentException(String.format("Standard deviation must be non-negative, got %s", stdDev));
    }
    if (stdDev == 0.0) {
      return exact(nominal);
    }
    Map<ErrorSource, Double> derivatives = new IdentityHashMap<>(1);
    derivatives.put(new ErrorSource(stdDev), 1.0);
    return new UncertainValue(nominal, Collections.unmodifiableMap(derivatives));
  }

  public static UncertainValue exact(double nominal) {
    return new UncertainValue(nominal, Collections.emptyMap());
  }

  /**
   * Reads "nominal", "nominal+/-stdDev" or "nominal±stdDev", the first being exact.
   * @throws NumberFormatException if the text is none of these
   */
  public static UncertainValue parse(String text) {
    String trimmed = text.trim();
    for (String separator : PLUS_MINUS) {
      int at = trimmed.indexOf(separator);
      if (at > 0) {
        return of(Double.parseDouble(trimmed.substring(0, at).trim()),
            Double.parseDouble(trimmed.substring(at + separator.length()).trim()));
      }
    }
    return exact(Double.parseDouble(trimmed));
  }

  /**
   * Creates jointly distributed values from a covariance matrix, e.g. the parameters of a least-squares fit.  The
   * matrix is diagonalized and each eigenvector becomes one independent source, so covariance(i, j) of the returned
   * values reproduces the matrix.  Slightly negative eigenvalues caused by round-off are clipped to zero.
   */
  public static List<UncertainValue> correlated(double[] nominals, double[][] covariance) {
    int n = nominals.length;
    if (covariance.length != n) {
      throw new IllegalArgumentException(String.format(
          "Covariance matrix has %d rows, expected %d", covariance.length, n));
    }
    RealMatrix matrix = new Array2DRowRealMatrix(covariance);
    EigenDecomposition decomposition = new EigenDecomposition(matrix);
    double[] eigenvalues = decomposition.getRealEigenvalues();

    List<Map<ErrorSource, Double>> derivatives = new ArrayList<>(n);
    for (int i = 0; i < n; i++) {
      derivatives.add(new IdentityHashMap<>(n));
    }
    for (int k = 0; k < eigenvalues.length; k++) {
      if (eigenvalues[k] <= 0.0) {
        continue;
      }
      ErrorSource source = new ErrorSource(FastMath.sqrt(eigenvalues[k]));
      double[] eigenvector = decomposition.getEigenvector(k).toArray();
      for (int i = 0; i < n; i++) {
        if (eigenvector[i] != 0.0) {
          derivatives.get(i).put(source, eigenvector[i]);
        }
      }
    }

    List<UncertainValue> values = new ArrayList<>(n);
    for (int i = 0; i < n; i++) {
      values.add(new UncertainValue(nominals[i], Collections.unmodifiableMap(derivatives.get(i))));
    }
    return values;
  }

  public double getNominal() {
    return nominal;
  }

  public double getVariance() {
    double variance = 0.0;
    for (Map.Entry<ErrorSource, Double> entry : derivatives.entrySet()) {
      double contribution = entry.getValue() * entry.getKey().stdDev;
      variance += contribution * contribution;
    }
    return variance;
  }

  public double getStdDev() {
    return FastMath.sqrt(getVariance());
  }

  public double covariance(UncertainValue other) {
    double covariance = 0.0;
    for (Map.Entry<ErrorSource, Double> entry : derivatives.entrySet()) {
      Double theirs = other.derivatives.get(entry.getKey());
      if (theirs != null) {
        double sigma = entry.getKey().stdDev;
        covariance += entry.getValue() * theirs * sigma * sigma;
      }
    }
    return covariance;
  }

  public double correlation(UncertainValue other) {
    double denominator = getStdDev() * other.getStdDev();
    return denominator == 0.0 ? 0.0 : covariance(other) / denominator;
  }

  /**
   * Partial derivative of this value with respect to an independent variable created by {@link #of}.
   */
  public double derivative(UncertainValue independent) {
    if (independent.derivatives.size() != 1) {
      throw new IllegalArgumentException("Derivatives can only be taken with respect to an independent variable");
    }
    Map.Entry<ErrorSource, Double> variable = independent.derivatives.entrySet().iterator().next();
    Double ours = derivatives.get(variable.getKey());
    return ours == null ? 0.0 : ours / variable.getValue();
  }

  /* Every operation below reduces to: result = f(this, other), d(result) = dfdThis * d(this) + dfdOther * d(other). */
  private static UncertainValue combine(double nominal, UncertainValue a, double dfda, UncertainValue b, double dfdb) {
    Map<ErrorSource, Double> derivatives = new IdentityHashMap<>(a.derivatives.size() + b.derivatives.size());
    if (dfda != 0.0) {
      for (Map.Entry<ErrorSource, Double> entry : a.derivatives.entrySet()) {
        derivatives.merge(entry.getKey(), dfda * entry.getValue(), Double::sum);
      }
    }
    if (dfdb != 0.0) {
      for (Map.Entry<ErrorSource, Double> entry : b.derivatives.entrySet()) {
        derivatives.merge(entry.getKey(), dfdb * entry.getValue(), Double::sum);
      }
    }
    return new UncertainValue(nominal, Collections.unmodifiableMap(derivatives));
  }

  private UncertainValue scaled(double nominal, double dfdThis) {
    return combine(nominal, this, dfdThis, ZERO, 0.0);
  }

  public UncertainValue plus(UncertainValue other) {
    return combine(nominal + other.nominal, this, 1.0, other, 1.0);
  }

  public UncertainValue plus(double other) {
    return new UncertainValue(nominal + other, derivatives);
  }

  public UncertainValue minus(UncertainValue other) {
    return combine(nominal - other.nominal, this, 1.0, other, -1.0);
  }

  public UncertainValue minus(double other) {
    return new UncertainValue(nominal - other, derivatives);
  }

  public UncertainValue negate() {
    return scaled(-nominal, -1.0);
  }

  public UncertainValue times(UncertainValue other) {
    return combine(nominal * other.nominal, this, other.nominal, other, nominal);
  }

  public UncertainValue times(double other) {
    return scaled(nominal * other, other);
  }

  public UncertainValue dividedBy(UncertainValue other) {
    double quotient = nominal / other.nominal;
    return combine(quotient, this, 1.0 / other.nominal, other, -quotient / other.nominal);
  }

  public UncertainValue dividedBy(double other) {
    return scaled(nominal / other, 1.0 / other);
  }

  public UncertainValue reciprocal() {
    return scaled(1.0 / nominal, -1.0 / (nominal * nominal));
  }

  public UncertainValue pow(double exponent) {
    double value = FastMath.pow(nominal, exponent);
    double derivative = exponent == 0.0 ? 0.0 : exponent * FastMath.pow(nominal, exponent - 1.0);
    return scaled(value, derivative);
  }

  public UncertainValue pow(UncertainValue exponent) {
    double value = FastMath.pow(nominal, exponent.nominal);
    double dBase = exponent.nominal == 0.0 ? 0.0 : exponent.nominal * FastMath.pow(nominal, exponent.nominal - 1.0);
    // d(a^b)/db = a^b ln(a); only defined for a positive base, and irrelevant when the exponent is exact.
    double dExponent = exponent.derivatives.isEmpty() ? 0.0 : value * FastMath.log(nominal);
    return combine(value, this, dBase, exponent, dExponent);
  }

  public UncertainValue exp() {
    double value = FastMath.exp(nominal);
    return scaled(value, value);
  }

  public UncertainValue log() {
    return scaled(FastMath.log(nominal), 1.0 / nominal);
  }

  public boolean isExact() {
    return derivatives.isEmpty();
  }

  /**
   * Orders by nominal value only.
   */
  @Override
  public int compareTo(UncertainValue other) {
    return Double.compare(nominal, other.nominal);
  }

  @Override
  public String toString() {
    return String.format("%s+/-%s", nominal, getStdDev());
  }
}
