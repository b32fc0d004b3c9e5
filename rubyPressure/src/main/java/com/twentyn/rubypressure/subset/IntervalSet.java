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

package com.twentyn.rubypressure.subset;

import org.apache.commons.lang3.tuple.Pair;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * A union of closed intervals on the real line, used to describe regions of a spectrum: the samples a fit should
 * focus on, the edges used to sample a background, the windows around peaks.
 *
 * The stored intervals are always merged: sorted, non-overlapping and non-touching, so two sets are equal exactly
 * when they cover the same points.  Sets are never modified in place; every operation returns a new IntervalSet.
 *
 * Sets are treated as closed.  {@link #complement()} returns the closure of the set-theoretic complement, so the
 * boundary points of a set are shared with its complement; intersection and difference, which are derived from the
 * complement by De Morgan's law, inherit this closure semantics (e.g. [0, 1] and [1, 2] have an empty intersection).
 */
public final class IntervalSet {
  private static final IntervalSet EMPTY = new IntervalSet(Collections.emptyList());
  private static final IntervalSet ALL =
      new IntervalSet(Collections.singletonList(new Interval(Double.NEGATIVE_INFINITY, Double.POSITIVE_INFINITY)));

  private final List<Interval> intervals;

  private IntervalSet(List<Interval> mergedIntervals) {
    this.intervals = Collections.unmodifiableList(mergedIntervals);
  }

  public static IntervalSet empty() {
    return EMPTY;
  }

  public static IntervalSet all() {
    return ALL;
  }

  public static IntervalSet of(double lower, double upper) {
    return new IntervalSet(Collections.singletonList(new Interval(lower, upper)));
  }

  /**
   * Builds the union of the given (lower, upper) pairs.
   * @throws InvalidBoundsException if any pair has lower > upper
   */
  public static IntervalSet of(List<Pair<Double, Double>> bounds) {
    List<Interval> intervals = new ArrayList<>(bounds.size());
    for (Pair<Double, Double> bound : bounds) {
      intervals.add(new Interval(bound.getLeft(), bound.getRight()));
    }
    return fromIntervals(intervals);
  }

  public static IntervalSet fromIntervals(Collection<Interval> intervals) {
    return new IntervalSet(merge(intervals));
  }

  private enum BoundaryType {
    // Declaration order matters: at equal coordinates an opening sorts before a closing, so touching intervals merge.
    OPENING,
    CLOSING
  }

  private static final Comparator<Pair<Double, BoundaryType>> BOUNDARY_ORDER =
      Comparator.<Pair<Double, BoundaryType>>comparingDouble(Pair::getLeft).thenComparing(Pair::getRight);

  /**
   * Sweeps the sorted interval boundaries keeping count of how many intervals are open; an output interval starts
   * when the depth leaves zero and ends when it returns to zero.
   */
  private static List<Interval> merge(Collection<Interval> intervals) {
    List<Pair<Double, BoundaryType>> boundaries = new ArrayList<>(intervals.size() * 2);
    for (Interval interval : intervals) {
      boundaries.add(Pair.of(interval.getLower(), BoundaryType.OPENING));
      boundaries.add(Pair.of(interval.getUpper(), BoundaryType.CLOSING));
    }
    boundaries.sort(BOUNDARY_ORDER);

    List<Interval> merged = new ArrayList<>();
    int depth = 0;
    double left = 0.0;
    for (Pair<Double, BoundaryType> boundary : boundaries) {
      if (boundary.getRight() == BoundaryType.OPENING) {
        if (depth == 0) {
          left = boundary.getLeft();
        }
        depth++;
      } else {
        depth--;
        if (depth == 0) {
          merged.add(new Interval(left, boundary.getLeft()));
        }
      }
    }
    return merged;
  }

  public List<Interval> getIntervals() {
    return intervals;
  }

  public boolean isEmpty() {
    return intervals.isEmpty();
  }

  public boolean contains(double x) {
    for (Interval interval : intervals) {
      if (interval.contains(x)) {
        return true;
      }
    }
    return false;
  }

  /**
   * Subset test: true iff every interval of other lies within one interval of this set.
   */
  public boolean contains(IntervalSet other) {
    for (Interval theirs : other.intervals) {
      boolean covered = false;
      for (Interval ours : intervals) {
        if (ours.contains(theirs)) {
          covered = true;
          break;
        }
      }
      if (!covered) {
        return false;
      }
    }
    return true;
  }

  public boolean isSubsetOf(IntervalSet other) {
    return other.contains(this);
  }

  public boolean isProperSubsetOf(IntervalSet other) {
    return other.contains(this) && !this.equals(other);
  }

  public boolean isSupersetOf(IntervalSet other) {
    return this.contains(other);
  }

  public boolean isProperSupersetOf(IntervalSet other) {
    return this.contains(other) && !this.equals(other);
  }

  /**
   * Flips every boundary: gaps become intervals and intervals become gaps, extending to +/- infinity at both ends.
   */
  public IntervalSet complement() {
    List<Double> limits = new ArrayList<>(intervals.size() * 2 + 2);
    limits.add(Double.NEGATIVE_INFINITY);
    for (Interval interval : intervals) {
      limits.add(interval.getLower());
      limits.add(interval.getUpper());
    }
    limits.add(Double.POSITIVE_INFINITY);

    List<Interval> gaps = new ArrayList<>(intervals.size() + 1);
    for (int i = 0; i < limits.size(); i += 2) {
      double lower = limits.get(i), upper = limits.get(i + 1);
      if (lower < upper) {
        gaps.add(new Interval(lower, upper));
      }
    }
    return fromIntervals(gaps);
  }

  public IntervalSet union(IntervalSet other) {
    List<Interval> all = new ArrayList<>(intervals);
    all.addAll(other.intervals);
    return fromIntervals(all);
  }

  public IntervalSet intersect(IntervalSet other) {
    return this.complement().union(other.complement()).complement();
  }

  public IntervalSet difference(IntervalSet other) {
    return this.intersect(other.complement());
  }

  public IntervalSet symmetricDifference(IntervalSet other) {
    return this.difference(other).union(other.difference(this));
  }

  public static IntervalSet union(IntervalSet a, IntervalSet b) {
    return a.union(b);
  }

  public static IntervalSet intersect(IntervalSet a, IntervalSet b) {
    return a.intersect(b);
  }

  public static IntervalSet difference(IntervalSet a, IntervalSet b) {
    return a.difference(b);
  }

  public static IntervalSet symmetricDifference(IntervalSet a, IntervalSet b) {
    return a.symmetricDifference(b);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    return intervals.equals(((IntervalSet) o).intervals);
  }

  @Override
  public int hashCode() {
    return intervals.hashCode();
  }

  @Override
  public String toString() {
    if (intervals.isEmpty()) {
      return "[]";
    }
    StringBuilder builder = new StringBuilder();
    for (Interval interval : intervals) {
      if (builder.length() > 0) {
        builder.append(" + ");
      }
      builder.append(interval);
    }
    return builder.toString();
  }
}
