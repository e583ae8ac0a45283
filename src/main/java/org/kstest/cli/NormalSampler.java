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

package org.kstest.cli;

import org.kstest.DomainViolationException;

import java.util.Random;

/**
 * Draws Normal deviates with a given mean and variance.
 */
public class NormalSampler {

    private final Random rand;
    private final double mean;
    private final double stdDev;

    public NormalSampler(double mean, double variance, Random rand) {
        if (!(variance > 0)) {
            throw new DomainViolationException("variance must be positive but was [" + variance + "]");
        }
        this.mean = mean;
        this.stdDev = Math.sqrt(variance);
        this.rand = rand;
    }

    public double next() {
        return mean + stdDev * rand.nextGaussian();
    }
}
