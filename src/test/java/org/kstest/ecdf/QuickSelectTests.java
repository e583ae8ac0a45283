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

package org.kstest.ecdf;

import com.carrotsearch.randomizedtesting.annotations.Repeat;
import com.google.common.collect.Ordering;
import org.kstest.KsTestCase;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;

public class QuickSelectTests extends KsTestCase {

    private static final Ordering<Integer> NATURAL = Ordering.natural();

    private static void assertSelectsEveryRank(Integer[] data) {
        Integer[] sorted = data.clone();
        Arrays.sort(sorted);
        for (int rank = 1; rank <= data.length; rank++) {
            Integer selected = QuickSelect.select(copyOf(data), rank, NATURAL);
            assertThat("rank " + rank + " of " + Arrays.toString(data), selected, equalTo(sorted[rank - 1]));
        }
    }

    private static List<Integer> copyOf(Integer[] data) {
        return new ArrayList<Integer>(Arrays.asList(data));
    }

    @Test
    public void testOrderedEven() {
        assertSelectsEveryRank(new Integer[] { 1, 2, 3, 4, 5, 6, 7, 8, 9, 10 });
    }

    @Test
    public void testOrderedOdd() {
        assertSelectsEveryRank(new Integer[] { 1, 2, 3, 4, 5, 6, 7, 8, 9 });
    }

    @Test
    public void testUnorderedEven() {
        assertSelectsEveryRank(new Integer[] { 9, 8, 10, 7, 6, 5, 1, 2, 3, 4 });
    }

    @Test
    public void testUnorderedOdd() {
        assertSelectsEveryRank(new Integer[] { 9, 8, 7, 6, 5, 1, 2, 3, 4 });
    }

    @Test
    public void testSingleValue() {
        assertThat(QuickSelect.select(copyOf(new Integer[] { 42 }), 1, NATURAL), equalTo(42));
    }

    @Test
    public void testDuplicates() {
        assertSelectsEveryRank(new Integer[] { 5, 5 });
        assertSelectsEveryRank(new Integer[] { 3, 3, 3, 3, 3, 3 });
        assertSelectsEveryRank(new Integer[] { 2, 7, 2, 7, 2, 7, 1, 9 });
        assertSelectsEveryRank(new Integer[] { 4, 1, 4, 4, 0, 4, 8, 4, 4 });
    }

    @Test
    public void testReverseOrder() {
        Integer[] data = { 4, 9, 1, 7, 3 };
        assertThat(QuickSelect.select(copyOf(data), 1, NATURAL.reverse()), equalTo(9));
        assertThat(QuickSelect.select(copyOf(data), 5, NATURAL.reverse()), equalTo(1));
    }

    @Test
    @Repeat(iterations = 20)
    public void testRandomData() {
        int length = randomIntBetween(1, 200);
        int bound = randomBoolean() ? randomIntBetween(0, 5) : Integer.MAX_VALUE / 2;
        Integer[] data = new Integer[length];
        for (int i = 0; i < length; i++) {
            data[i] = randomIntBetween(-bound, bound);
        }
        assertSelectsEveryRank(data);
    }

    @Test
    public void testReordersInPlace() {
        List<Integer> values = copyOf(new Integer[] { 5, 4, 3, 2, 1 });
        assertThat(QuickSelect.select(values, 3, NATURAL), equalTo(3));
        Collections.sort(values);
        assertThat(values, equalTo(Arrays.asList(1, 2, 3, 4, 5)));
    }
}
