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

import com.google.common.primitives.Doubles;
import com.google.common.primitives.Longs;
import org.apache.lucene.util.Accountable;
import org.apache.lucene.util.RamUsageEstimator;
import org.kstest.order.TotalOrders;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Empirical cumulative distribution function of a sample.
 * <p>
 * Construction sorts a private copy of the sample, which costs O(n log n) and may
 * be prohibitive for very large samples. The cost is amortized over the queries:
 * {@link #value} is a binary search and the rank based queries are direct lookups.
 * For a handful of queries over a sample that is used once, {@link OrderStatistics}
 * avoids the sort.
 * <p>
 * Instances are immutable and may be shared between threads.
 */
public final class Ecdf<T> implements Accountable {

    private static final long BASE_RAM_BYTES_USED = RamUsageEstimator.shallowSizeOfInstance(Ecdf.class);
    private static final long LIST_RAM_BYTES_USED = RamUsageEstimator.shallowSizeOfInstance(ArrayList.class);

    private final List<T> samples;
    private final int length;
    private final Comparator<? super T> order;

    /**
     * @param samples non-empty sample, left untouched
     * @param order   total order over the sample values
     */
    public Ecdf(List<? extends T> samples, Comparator<? super T> order) {
        checkNotNull(samples, "samples must not be null");
        this.order = checkNotNull(order, "order must not be null");
        this.length = samples.size();
        NearestRank.checkNotEmpty(length);

        // sorted copy for binary searching
        this.samples = new ArrayList<T>(samples);
        Collections.sort(this.samples, order);
        if (length == 1) {
            checkComparable(this.samples.get(0), order);
        }
    }

    public static <T extends Comparable<? super T>> Ecdf<T> of(List<? extends T> samples) {
        return new Ecdf<T>(samples, TotalOrders.<T>natural());
    }

    public static Ecdf<Long> ofLongs(long... samples) {
        return of(Longs.asList(samples));
    }

    /**
     * Ecdf over doubles ordered by {@link TotalOrders#strictDoubles()}; fails on {@code NaN}.
     */
    public static Ecdf<Double> ofDoubles(double... samples) {
        return new Ecdf<Double>(Doubles.asList(samples), TotalOrders.strictDoubles());
    }

    /**
     * Fraction of the sample that is less than or equal to {@code t}.
     */
    public double value(T t) {
        int index = Collections.binarySearch(samples, t, order);
        final int numSamplesLeqT;
        if (index >= 0) {
            // binary search lands on an arbitrary one of several equal samples,
            // walk up to the last of them
            while (index + 1 < length && order.compare(samples.get(index + 1), t) == 0) {
                index++;
            }
            numSamplesLeqT = index + 1;
        } else {
            // insertion point, every sample left of it is less than t
            numSamplesLeqT = -index - 1;
        }
        return (double) numSamplesLeqT / length;
    }

    /**
     * Nearest-rank percentile, {@code percentile} in [1, 100].
     */
    public T percentile(int percentile) {
        return samples.get(NearestRank.ofPercentile(percentile, length) - 1);
    }

    /**
     * Nearest-rank permille, {@code permille} in [1, 1000].
     */
    public T permille(int permille) {
        return samples.get(NearestRank.ofPermille(permille, length) - 1);
    }

    /**
     * Element of 1-based {@code rank}, in [1, {@link #length()}].
     */
    public T rank(int rank) {
        return samples.get(NearestRank.checkRank(rank, length) - 1);
    }

    public T min() {
        return samples.get(0);
    }

    public T max() {
        return samples.get(length - 1);
    }

    public int length() {
        return length;
    }

    /**
     * Heap held by this instance and its sorted copy, not counting the sample values.
     */
    @Override
    public long ramBytesUsed() {
        return BASE_RAM_BYTES_USED + LIST_RAM_BYTES_USED
                + RamUsageEstimator.alignObjectSize(RamUsageEstimator.NUM_BYTES_ARRAY_HEADER + (long) RamUsageEstimator.NUM_BYTES_OBJECT_REF * length);
    }

    /**
     * Sorting never compares a lone value, so run it past {@code order} once. Orders
     * that reject some values, such as {@link TotalOrders#strictDoubles()}, see every
     * sample this way.
     */
    static <T> void checkComparable(T value, Comparator<? super T> order) {
        order.compare(value, value);
    }

    @Override
    public String toString() {
        return "Ecdf[length=" + length + ", min=" + min() + ", max=" + max() + "]";
    }
}
