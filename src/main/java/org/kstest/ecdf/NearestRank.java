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

import org.kstest.DomainViolationException;
import org.kstest.EmptySampleException;

/**
 * Maps percentiles and permilles onto 1-based ranks with the nearest-rank method,
 * validating each argument against its domain.
 */
final class NearestRank {

    static final int MAX_PERCENTILE = 100;
    static final int MAX_PERMILLE = 1000;

    private NearestRank() {
    }

    static int ofPercentile(int percentile, int length) {
        if (percentile < 1 || percentile > MAX_PERCENTILE) {
            throw new DomainViolationException("percentile must be in [1, " + MAX_PERCENTILE + "] but was [" + percentile + "]");
        }
        checkNotEmpty(length);
        return proportion(percentile, MAX_PERCENTILE, length);
    }

    static int ofPermille(int permille, int length) {
        if (permille < 1 || permille > MAX_PERMILLE) {
            throw new DomainViolationException("permille must be in [1, " + MAX_PERMILLE + "] but was [" + permille + "]");
        }
        checkNotEmpty(length);
        return proportion(permille, MAX_PERMILLE, length);
    }

    static int checkRank(int rank, int length) {
        checkNotEmpty(length);
        if (rank < 1 || rank > length) {
            throw new DomainViolationException("rank must be in [1, " + length + "] but was [" + rank + "]");
        }
        return rank;
    }

    static void checkNotEmpty(int length) {
        if (length == 0) {
            throw new EmptySampleException("sample must contain at least one value");
        }
    }

    // ceil(part * length / whole), in double arithmetic
    private static int proportion(int part, int whole, int length) {
        return (int) Math.ceil((double) part * length / whole);
    }
}
