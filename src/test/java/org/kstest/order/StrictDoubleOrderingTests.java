/*
 * Licensed to Elasticsearch under one or more contributor
 * license agreements. See the NOTICE file distributed with
 * this work for additional information regarding copyright
 * ownership. Elasticsearch licenses this file to you under
 * the Apache License, Version 2.0 (the "License"); you may
 * not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

package org.kstest.order;

import com.google.common.collect.Ordering;
import org.kstest.IncomparableValueException;
import org.kstest.KsTestCase;
import org.junit.Test;

import java.util.Arrays;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.greaterThan;
import static org.hamcrest.Matchers.lessThan;
import static org.junit.Assert.fail;

public class StrictDoubleOrderingTests extends KsTestCase {

    private final Ordering<Double> ordering = TotalOrders.strictDoubles();

    @Test
    public void testNumericOrder() {
        assertThat(ordering.compare(1.0, 2.0), lessThan(0));
        assertThat(ordering.compare(2.0, 1.0), greaterThan(0));
        assertThat(ordering.compare(1.5, 1.5), equalTo(0));
        assertThat(ordering.compare(Double.NEGATIVE_INFINITY, -Double.MAX_VALUE), lessThan(0));
        assertThat(ordering.compare(Double.POSITIVE_INFINITY, Double.MAX_VALUE), greaterThan(0));
    }

    @Test
    public void testZerosAreEqual() {
        assertThat(ordering.compare(-0.0, 0.0), equalTo(0));
        assertThat(StrictDoubleOrdering.compare(0.0, -0.0), equalTo(0));
    }

    @Test
    public void testNaNIsIncomparable() {
        double value = randomDouble();
        try {
            ordering.compare(Double.NaN, value);
            fail("expected IncomparableValueException");
        } catch (IncomparableValueException e) {
            // expected
        }
        try {
            ordering.compare(value, Double.NaN);
            fail("expected IncomparableValueException");
        } catch (IncomparableValueException e) {
            // expected
        }
        try {
            ordering.compare(Double.NaN, Double.NaN);
            fail("expected IncomparableValueException");
        } catch (IncomparableValueException e) {
            // expected
        }
    }

    @Test
    public void testSort() {
        assertThat(ordering.sortedCopy(Arrays.asList(3.0, -1.0, 2.5, 0.0)), equalTo(Arrays.asList(-1.0, 0.0, 2.5, 3.0)));
        try {
            ordering.sortedCopy(Arrays.asList(3.0, Double.NaN, 1.0));
            fail("expected IncomparableValueException");
        } catch (IncomparableValueException e) {
            // expected
        }
    }

    @Test
    public void testNatural() {
        Ordering<String> natural = TotalOrders.natural();
        assertThat(natural.compare("a", "b"), lessThan(0));
        assertThat(natural.max("a", "c", "b"), equalTo("c"));
    }
}
