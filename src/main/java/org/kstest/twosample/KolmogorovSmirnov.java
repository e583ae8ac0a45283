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

package org.kstest.twosample;

import com.google.common.primitives.Doubles;
import com.google.common.primitives.Longs;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.kstest.DomainViolationException;
import org.kstest.EmptySampleException;
import org.kstest.SampleTooSmallException;
import org.kstest.UnsupportedConfidenceException;
import org.kstest.order.TotalOrders;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Two sample Kolmogorov-Smirnov test.
 * <p>
 * The test statistic is the largest absolute difference between the empirical
 * distribution functions of the two samples. It is compared against the large sample
 * approximation of the critical value, which is only implemented for a confidence
 * of 0.95 and samples of more than {@link #MIN_SAMPLE_LENGTH} values.
 */
public final class KolmogorovSmirnov {

    private static final Logger logger = LogManager.getLogger(KolmogorovSmirnov.class);

    /**
     * Samples must be strictly longer than this.
     */
    public static final int MIN_SAMPLE_LENGTH = 12;

    private KolmogorovSmirnov() {
    }

    public static <T extends Comparable<? super T>> TestResult test(List<? extends T> xs, List<? extends T> ys, double confidence) {
        return test(xs, ys, confidence, TotalOrders.<T>natural());
    }

    public static TestResult test(long[] xs, long[] ys, double confidence) {
        checkNotNull(xs, "xs must not be null");
        checkNotNull(ys, "ys must not be null");
        return test(Longs.asList(xs), Longs.asList(ys), confidence);
    }

    /**
     * Runs the test over doubles ordered by {@link TotalOrders#strictDoubles()}, so a
     * {@code NaN} in either sample fails the test with
     * {@link org.kstest.IncomparableValueException}.
     */
    public static TestResult testDoubles(double[] xs, double[] ys, double confidence) {
        checkNotNull(xs, "xs must not be null");
        checkNotNull(ys, "ys must not be null");
        return test(Doubles.asList(xs), Doubles.asList(ys), confidence, TotalOrders.strictDoubles());
    }

    /**
     * Tests whether {@code xs} and {@code ys} come from the same distribution.
     *
     * @param xs         first sample, more than {@link #MIN_SAMPLE_LENGTH} values
     * @param ys         second sample, more than {@link #MIN_SAMPLE_LENGTH} values
     * @param confidence confidence level, only 0.95 is supported
     * @param order      total order over the sample values
     */
    public static <T> TestResult test(List<? extends T> xs, List<? extends T> ys, double confidence, Comparator<? super T> order) {
        checkNotNull(xs, "xs must not be null");
        checkNotNull(ys, "ys must not be null");
        checkNotNull(order, "order must not be null");
        if (xs.isEmpty() || ys.isEmpty()) {
            throw new EmptySampleException("both samples must contain values, got [" + xs.size() + "] and [" + ys.size() + "]");
        }
        checkConfidenceRange(confidence);
        checkSampleLength(xs.size());
        checkSampleLength(ys.size());
        Confidence table = Confidence.resolve(confidence);

        double statistic = calculateStatistic(xs, ys, order);
        double criticalValue = table.criticalValue(xs.size(), ys.size());
        boolean rejected = statistic > criticalValue;

        if (logger.isDebugEnabled()) {
            logger.debug("n1 [{}], n2 [{}]: statistic [{}], critical value [{}], rejected [{}]",
                    xs.size(), ys.size(), statistic, criticalValue, rejected);
        }
        return new TestResult(rejected, statistic, criticalValue, confidence);
    }

    /**
     * Critical value of the test statistic for samples of sizes {@code n1} and
     * {@code n2} at the given confidence.
     */
    public static double calculateCriticalValue(int n1, int n2, double confidence) {
        if (n1 <= 0 || n2 <= 0) {
            throw new DomainViolationException("sample sizes must be positive, got [" + n1 + "] and [" + n2 + "]");
        }
        checkConfidenceRange(confidence);
        checkSampleLength(n1);
        checkSampleLength(n2);
        return Confidence.resolve(confidence).criticalValue(n1, n2);
    }

    /**
     * Computes the statistic with a single sweep over sorted copies of both samples.
     * <p>
     * The sweep visits each distinct value once, in increasing order, and keeps the
     * ECDF of both samples at that value. Once either sample is exhausted its ECDF is
     * one and the other only grows towards one, so the difference cannot increase
     * any further and the sweep stops.
     */
    static <T> double calculateStatistic(List<? extends T> xs, List<? extends T> ys, Comparator<? super T> order) {
        final int n = xs.size();
        final int m = ys.size();
        assert n > 0 && m > 0;

        final List<T> xsSorted = sortedCopy(xs, order);
        final List<T> ysSorted = sortedCopy(ys, order);

        // i and j index the first values of xs and ys not yet swept
        int i = 0;
        int j = 0;
        // ECDF of xs and ys at the last swept value
        double ecdfXs = 0.0;
        double ecdfYs = 0.0;
        double statistic = 0.0;

        while (i < n && j < m) {
            final T x = xsSorted.get(i);
            while (i + 1 < n && order.compare(x, xsSorted.get(i + 1)) == 0) {
                i++;
            }
            final T y = ysSorted.get(j);
            while (j + 1 < m && order.compare(y, ysSorted.get(j + 1)) == 0) {
                j++;
            }

            // step to the smaller of the two values, or both when equal
            final int cmp = order.compare(x, y);
            if (cmp <= 0) {
                ecdfXs = (double) (i + 1) / n;
                i++;
            }
            if (cmp >= 0) {
                ecdfYs = (double) (j + 1) / m;
                j++;
            }

            final double diff = Math.abs(ecdfXs - ecdfYs);
            if (diff > statistic) {
                statistic = diff;
            }
        }

        if (logger.isTraceEnabled()) {
            logger.trace("sweep stopped at [{}/{}] and [{}/{}] with statistic [{}]", i, n, j, m, statistic);
        }
        return statistic;
    }

    private static <T> List<T> sortedCopy(List<? extends T> samples, Comparator<? super T> order) {
        List<T> copy = new ArrayList<T>(samples);
        Collections.sort(copy, order);
        return copy;
    }

    private static void checkConfidenceRange(double confidence) {
        if (!(0.0 < confidence && confidence < 1.0)) {
            throw new UnsupportedConfidenceException("confidence must be in (0, 1) but was [" + confidence + "]", confidence);
        }
    }

    private static void checkSampleLength(int length) {
        if (length <= MIN_SAMPLE_LENGTH) {
            throw new SampleTooSmallException("samples must hold more than [" + MIN_SAMPLE_LENGTH + "] values but one holds [" + length + "]", length);
        }
    }
}
