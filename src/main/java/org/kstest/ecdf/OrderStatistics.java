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

import org.kstest.order.TotalOrders;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * One-shot order statistics over an unsorted sample.
 * <p>
 * Nothing is cached between calls: {@link #ecdf} is a single linear scan and the
 * rank queries run a {@link QuickSelect} over a private copy, so each call costs
 * O(n) on average. When many queries hit the same sample, building an {@link Ecdf}
 * once and querying it is cheaper.
 */
public final class OrderStatistics {

    private OrderStatistics() {
    }

    public static <T extends Comparable<? super T>> double ecdf(List<? extends T> samples, T t) {
        return ecdf(samples, t, TotalOrders.<T>natural());
    }

    /**
     * Fraction of {@code samples} that are less than or equal to {@code t}.
     */
    public static <T> double ecdf(List<? extends T> samples, T t, Comparator<? super T> order) {
        checkNotNull(samples, "samples must not be null");
        checkNotNull(order, "order must not be null");
        NearestRank.checkNotEmpty(samples.size());

        int numSamplesLeqT = 0;
        for (T sample : samples) {
            if (order.compare(sample, t) <= 0) {
                numSamplesLeqT++;
            }
        }
        return (double) numSamplesLeqT / samples.size();
    }

    public static <T extends Comparable<? super T>> T percentile(List<? extends T> samples, int percentile) {
        return percentile(samples, percentile, TotalOrders.<T>natural());
    }

    /**
     * Nearest-rank percentile of {@code samples}, {@code percentile} in [1, 100].
     */
    public static <T> T percentile(List<? extends T> samples, int percentile, Comparator<? super T> order) {
        checkNotNull(samples, "samples must not be null");
        int rank = NearestRank.ofPercentile(percentile, samples.size());
        return select(samples, rank, order);
    }

    public static <T extends Comparable<? super T>> T permille(List<? extends T> samples, int permille) {
        return permille(samples, permille, TotalOrders.<T>natural());
    }

    /**
     * Nearest-rank permille of {@code samples}, {@code permille} in [1, 1000].
     */
    public static <T> T permille(List<? extends T> samples, int permille, Comparator<? super T> order) {
        checkNotNull(samples, "samples must not be null");
        int rank = NearestRank.ofPermille(permille, samples.size());
        return select(samples, rank, order);
    }

    public static <T extends Comparable<? super T>> T rank(List<? extends T> samples, int rank) {
        return rank(samples, rank, TotalOrders.<T>natural());
    }

    /**
     * Element of 1-based {@code rank} in {@code samples}, rank 1 being the minimum.
     */
    public static <T> T rank(List<? extends T> samples, int rank, Comparator<? super T> order) {
        checkNotNull(samples, "samples must not be null");
        NearestRank.checkRank(rank, samples.size());
        return select(samples, rank, order);
    }

    private static <T> T select(List<? extends T> samples, int rank, Comparator<? super T> order) {
        checkNotNull(order, "order must not be null");
        List<T> copy = new ArrayList<T>(samples);
        if (copy.size() == 1) {
            Ecdf.checkComparable(copy.get(0), order);
        }
        return QuickSelect.select(copy, rank, order);
    }
}
