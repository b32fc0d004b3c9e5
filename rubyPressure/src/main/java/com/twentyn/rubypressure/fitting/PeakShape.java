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

import com.twentyn.rubypressure.spectrum.CamelShape;
import com.twentyn.rubypressure.spectrum.CurveShape;
import com.twentyn.rubypressure.spectrum.Spectrum;
import com.twentyn.rubypressure.spectrum.TwoGaussiansShape;
import com.twentyn.rubypressure.spectrum.TwoPseudoVoigtsShape;
import com.twentyn.rubypressure.subset.IntervalSet;
import org.apache.commons.math3.util.FastMath;

import java.util.ArrayList;
import java.util.List;

/**
 * The line-shape models a ruby doublet can be fitted with.  Each knows its curve shape, how wide a window around
 * each line it needs, where in its parameter vector the center and height of R1 and R2 are, and how to start a fit
 * from rough line positions.
 */
public enum PeakShape {
  GAUSSIAN("Gaussian", new TwoGaussiansShape(), 0.5, 1, 0, 4, 3) {
    @Override
    public double[] initialParameters(double r1x, double r1y, double r2x, double r2y) {
      return new double[]{r1y, r1x, 0.3, r2y, r2x, 0.3};
    }
  },
  PSEUDOVOIGT("Pseudovoigt", new TwoPseudoVoigtsShape(), 1.0, 1, 0, 5, 4) {
    @Override
    public double[] initialParameters(double r1x, double r1y, double r2x, double r2y) {
      return new double[]{r1y, r1x, 0.6, 0.5, r2y, r2x, 0.6, 0.5};
    }
  },
  CAMEL("Camel", new CamelShape(), 1.0, 1, 0, 4, 3) {
    @Override
    public double[] initialParameters(double r1x, double r1y, double r2x, double r2y) {
      return new double[]{r1y, r1x, 0.35, r2y, r2x, 0.35, r1y / 10.0, 0.35};
    }

    /**
     * One window from half a window below the lower line to half a window above the upper one, so the valley the
     * middle lobe sits in is always part of the fit.
     */
    @Override
    public Spectrum focus(Spectrum spectrum, double r1x, double r2x) {
      double half = getWindow() / 2.0;
      return spectrum.withFocus(
          IntervalSet.of(FastMath.min(r1x, r2x) - half, FastMath.max(r1x, r2x) + half).intersect(spectrum.domain()));
    }
  };

  private final String name;
  private final CurveShape shape;
  private final double window;
  private final int r1Position;
  private final int r1Height;
  private final int r2Position;
  private final int r2Height;

  PeakShape(String name, CurveShape shape, double window,
            int r1Position, int r1Height, int r2Position, int r2Height) {
    this.name = name;
    this.shape = shape;
    this.window = window;
    this.r1Position = r1Position;
    this.r1Height = r1Height;
    this.r2Position = r2Position;
    this.r2Height = r2Height;
  }

  public String getName() {
    return name;
  }

  public CurveShape getShape() {
    return shape;
  }

  /**
   * Full width of the fit window around each line, in nm.
   */
  public double getWindow() {
    return window;
  }

  public int getR1PositionIndex() {
    return r1Position;
  }

  public int getR1HeightIndex() {
    return r1Height;
  }

  public int getR2PositionIndex() {
    return r2Position;
  }

  public int getR2HeightIndex() {
    return r2Height;
  }

  public abstract double[] initialParameters(double r1x, double r1y, double r2x, double r2y);

  /**
   * Focuses spectrum on the samples this shape is fitted to, given rough line positions.  By default a window of
   * {@link #getWindow()} nm centered on each line.
   */
  public Spectrum focus(Spectrum spectrum, double r1x, double r2x) {
    return spectrum.focusOnPoints(new double[]{r1x, r2x}, window);
  }

  public static PeakShape fromName(String name) {
    List<String> names = new ArrayList<>();
    for (PeakShape shape : values()) {
      if (shape.name.equalsIgnoreCase(name)) {
        return shape;
      }
      names.add(shape.name);
    }
    throw new IllegalArgumentException(String.format(
        "Unknown peakfitting strategy '%s', expected one of %s", name, names));
  }
}
