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

import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * Selects the element of a given rank without sorting the whole list.
 * <p>
 * The pivot is always the first element of the current window. Each round runs two
 * partitions: the first moves every element strictly less than the pivot to the
 * left, the second moves every element equal to the pivot next to them. Runs of
 * duplicates are therefore resolved as a single block, which keeps the selection
 * correct when the requested rank lands inside a run of equal values.
 */
final class QuickSelect {

    private QuickSelect() {
    }

    /**
     * Returns the element of 1-based {@code rank} in {@code samples}. The list is
     * reordered in place; callers that need the original order must pass a copy.
     *
     * @param samples non-empty values to select from
     * @param rank    1-based rank, {@code 1 <= rank <= samples.size()}
     * @param order   total order over the values
     */
    static <T> T select(List<T> samples, int rank, Comparator<? super T> order) {
        assert !samples.isEmpty();
        assert 0 < rank && rank <= samples.size();

        int low = 0;
        int high = samples.size();

        while (true) {
            assert low < high;
            final T pivot = samples.get(low);

            if (low >= high - 1) {
                return pivot;
            }

            // everything left of bottom is less than the pivot
            int bottom = low;
            int top = high - 1;
            while (bottom < top) {
                while (bottom < top && order.compare(samples.get(bottom), pivot) < 0) {
                    bottom++;
                }
                while (bottom < top && order.compare(samples.get(top), pivot) >= 0) {
                    top--;
                }
                if (bottom < top) {
                    Collections.swap(samples, bottom, top);
                }
            }

            if (rank <= bottom) {
                high = bottom;
                continue;
            }

            low = bottom;

            // the window only holds values >= pivot now, gather the ones equal to it
            bottom = low;
            top = high - 1;
            while (bottom < top) {
                while (bottom < top && order.compare(samples.get(bottom), pivot) == 0) {
                    bottom++;
                }
                while (bottom < top && order.compare(samples.get(top), pivot) != 0) {
                    top--;
                }
                if (bottom < top) {
                    Collections.swap(samples, bottom, top);
                }
            }

            if (rank <= bottom) {
                return pivot;
            }

            low = bottom;
        }
    }
}
