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
import org.junit.Test;

import java.util.Arrays;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class IntervalSetTest {

  private static IntervalSet set(double... bounds) {
    IntervalSet result = IntervalSet.empty();
    for (int i = 0; i < bounds.length; i += 2) {
      result = result.union(IntervalSet.of(bounds[i], bounds[i + 1]));
    }
    return result;
  }

  @Test
  public void testTouchingIntervalsMerge() throws Exception {
    IntervalSet merged = IntervalSet.of(Arrays.asList(Pair.of(0.0, 1.0), Pair.of(1.0, 2.0), Pair.of(2.0, 3.0)));
    assertEquals("Touching intervals merge into one", IntervalSet.of(0.0, 3.0), merged);
    assertEquals("Merged set holds a single interval", 1, merged.getIntervals().size());
  }

  @Test
  public void testEqualityIgnoresInputOrder() throws Exception {
    assertEquals("Order of construction does not matter",
        IntervalSet.of(Arrays.asList(Pair.of(2.0, 3.0), Pair.of(0.0, 1.0))),
        IntervalSet.of(Arrays.asList(Pair.of(0.0, 1.0), Pair.of(2.0, 3.0))));
    assertEquals("Nested intervals collapse", IntervalSet.of(0.0, 5.0), set(0.0, 5.0, 1.0, 2.0));
  }

  @Test(expected = InvalidBoundsException.class)
  public void testInvertedBoundsAreRejected() throws Exception {
    IntervalSet.of(Arrays.asList(Pair.of(0.0, 1.0), Pair.of(3.0, 2.0)));
  }

  @Test
  public void testUnionIsCommutativeAndAssociative() throws Exception {
    IntervalSet a = set(0.0, 1.0, 4.0, 5.0);
    IntervalSet b = set(0.5, 2.0);
    IntervalSet c = set(1.5, 4.5, 7.0, 8.0);
    assertEquals("a + b == b + a", a.union(b), b.union(a));
    assertEquals("(a + b) + c == a + (b + c)", a.union(b).union(c), a.union(b.union(c)));
    assertEquals("Union covers everything", set(0.0, 5.0, 7.0, 8.0), IntervalSet.union(a.union(b), c));
  }

  @Test
  public void testSetIsSubsetOfUnion() throws Exception {
    IntervalSet a = set(0.0, 1.0, 4.0, 5.0);
    IntervalSet b = set(2.0, 3.0);
    assertTrue("a <= a + b", a.isSubsetOf(a.union(b)));
    assertTrue("a < a + b", a.isProperSubsetOf(a.union(b)));
    assertTrue("a + b >= b", a.union(b).isSupersetOf(b));
    assertFalse("a is not a proper subset of itself", a.isProperSubsetOf(a));
    assertFalse("a + b is not a subset of a", a.union(b).isSubsetOf(a));
  }

  @Test
  public void testIntersectionWithComplementIsEmpty() throws Exception {
    for (IntervalSet a : Arrays.asList(set(0.0, 1.0), set(-3.0, -1.0, 2.0, 7.5), IntervalSet.all(), IntervalSet.empty())) {
      assertTrue(String.format("%s * -%s is empty", a, a), a.intersect(a.complement()).isEmpty());
    }
  }

  @Test
  public void testComplementOfUnboundedAndEmptySets() throws Exception {
    assertEquals("Complement of the empty set is the whole line", IntervalSet.all(), IntervalSet.empty().complement());
    assertTrue("Complement of the whole line is empty", IntervalSet.all().complement().isEmpty());
    assertEquals("Complement flips each boundary",
        set(Double.NEGATIVE_INFINITY, 0.0, 1.0, 2.0, 3.0, Double.POSITIVE_INFINITY), set(0.0, 1.0, 2.0, 3.0).complement());
  }

  @Test
  public void testSetAlgebra() throws Exception {
    assertEquals("Intersection", set(1.0, 2.0), IntervalSet.intersect(set(0.0, 2.0), set(1.0, 3.0)));
    assertEquals("Difference", set(0.0, 1.0, 2.0, 3.0), IntervalSet.difference(set(0.0, 3.0), set(1.0, 2.0)));
    assertEquals("Symmetric difference", set(0.0, 1.0, 2.0, 3.0),
        IntervalSet.symmetricDifference(set(0.0, 2.0), set(1.0, 3.0)));
    assertTrue("Disjoint sets do not intersect", set(0.0, 1.0).intersect(set(2.0, 3.0)).isEmpty());
  }

  @Test
  public void testContainsIsInclusive() throws Exception {
    IntervalSet a = set(0.0, 1.0, 2.0, 3.0);
    assertTrue("Lower bound is contained", a.contains(0.0));
    assertTrue("Upper bound is contained", a.contains(3.0));
    assertFalse("Gap is not contained", a.contains(1.5));
    assertTrue("Subset test", a.contains(set(0.2, 0.8, 2.5, 3.0)));
    assertFalse("Subset test spanning the gap", a.contains(set(0.5, 2.5)));
  }

  @Test
  public void testZeroWidthAndUnboundedIntervals() throws Exception {
    IntervalSet point = IntervalSet.of(1.0, 1.0);
    assertTrue("A point contains itself", point.contains(1.0));
    assertFalse("A point contains nothing else", point.contains(1.0 + 1e-12));
    assertTrue("The whole line contains large values", IntervalSet.all().contains(1e300));
    assertTrue("A point lies within the whole line", point.isSubsetOf(IntervalSet.all()));
  }

  @Test
  public void testToString() throws Exception {
    assertEquals("[0.0, 1.0] + [2.0, 3.0]", set(0.0, 1.0, 2.0, 3.0).toString());
    assertEquals("[]", IntervalSet.empty().toString());
  }
}
