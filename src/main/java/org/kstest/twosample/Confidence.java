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

import org.kstest.UnsupportedConfidenceException;

/**
 * Confidence levels with a known critical value approximation for the two sample
 * Kolmogorov-Smirnov test.
 * <p>
 * Each level carries the coefficient {@code c} of the large sample approximation
 * {@code c * sqrt((n1 + n2) / (n1 * n2))}, valid for samples larger than
 * {@link KolmogorovSmirnov#MIN_SAMPLE_LENGTH}.
 */
public enum Confidence {

    P95(0.95, 1.36);

    private final double level;
    private final double coefficient;

    Confidence(double level, double coefficient) {
        this.level = level;
        this.coefficient = coefficient;
    }

    public double level() {
        return level;
    }

    public double coefficient() {
        return coefficient;
    }

    /**
     * Critical value for samples of sizes {@code n1} and {@code n2}. Sizes are not
     * validated here, see {@link KolmogorovSmirnov#calculateCriticalValue}.
     */
    public double criticalValue(int n1, int n2) {
        double factor = ((double) n1 + n2) / ((double) n1 * n2);
        return coefficient * Math.sqrt(factor);
    }

    /**
     * Resolves the table entry for a confidence level.
     *
     * @throws UnsupportedConfidenceException if no entry matches {@code confidence} exactly
     */
    public static Confidence resolve(double confidence) {
        for (Confidence candidate : values()) {
            if (candidate.level == confidence) {
                return candidate;
            }
        }
        throw new UnsupportedConfidenceException("no critical value table for confidence [" + confidence + "]", confidence);
    }
}
