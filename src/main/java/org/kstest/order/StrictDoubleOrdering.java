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

import java.io.Serializable;

/**
 * Numeric ordering of doubles that refuses to order {@code NaN}.
 * <p>
 * {@link Double#compare(double, double)} sorts {@code NaN} above positive infinity,
 * which would silently turn a corrupt sample into a valid one. This ordering throws
 * {@link IncomparableValueException} instead, as soon as a comparison involves
 * {@code NaN}. Negative and positive zero compare equal.
 */
public final class StrictDoubleOrdering extends Ordering<Double> implements Serializable {

    static final StrictDoubleOrdering INSTANCE = new StrictDoubleOrdering();

    private static final long serialVersionUID = 0;

    private StrictDoubleOrdering() {
    }

    @Override
    public int compare(Double left, Double right) {
        return compare(left.doubleValue(), right.doubleValue());
    }

    /**
     * Compares two primitive doubles with the same contract as {@link #compare(Double, Double)}.
     */
    public static int compare(double left, double right) {
        if (left < right) {
            return -1;
        }
        if (left > right) {
            return 1;
        }
        if (left == right) {
            return 0;
        }
        throw new IncomparableValueException("values [" + left + "] and [" + right + "] have no defined order");
    }

    private Object readResolve() {
        return INSTANCE;
    }

    @Override
    public String toString() {
        return "TotalOrders.strictDoubles()";
    }
}
