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

import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;

/**
 * Outcome of a two sample Kolmogorov-Smirnov test.
 */
public final class TestResult {

    private final boolean rejected;
    private final double statistic;
    private final double criticalValue;
    private final double confidence;

    public TestResult(boolean rejected, double statistic, double criticalValue, double confidence) {
        this.rejected = rejected;
        this.statistic = statistic;
        this.criticalValue = criticalValue;
        this.confidence = confidence;
    }

    /**
     * @return true if the samples are judged to come from different distributions
     */
    public boolean isRejected() {
        return rejected;
    }

    /**
     * @return largest absolute difference between the two empirical distribution functions
     */
    public double getStatistic() {
        return statistic;
    }

    public double getCriticalValue() {
        return criticalValue;
    }

    public double getConfidence() {
        return confidence;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        TestResult that = (TestResult) o;
        return rejected == that.rejected
                && Double.compare(that.statistic, statistic) == 0
                && Double.compare(that.criticalValue, criticalValue) == 0
                && Double.compare(that.confidence, confidence) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(rejected, statistic, criticalValue, confidence);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("rejected", rejected)
                .add("statistic", statistic)
                .add("criticalValue", criticalValue)
                .add("confidence", confidence)
                .toString();
    }
}
