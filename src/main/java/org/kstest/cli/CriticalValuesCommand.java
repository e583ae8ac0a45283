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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.kstest.KsException;
import org.kstest.twosample.KolmogorovSmirnov;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.concurrent.Callable;

/**
 * Prints critical values for one sample size against a range of other sample sizes.
 */
@Command(
    name = "critical-values",
    description = "Prints critical values for samples of size <n1> against sizes 16 through <limit> inclusive."
)
public class CriticalValuesCommand implements Callable<Integer> {

    private static final Logger logger = LogManager.getLogger(CriticalValuesCommand.class);

    static final int FIRST_N2 = 16;

    @Spec
    CommandSpec spec;

    @Parameters(index = "0", paramLabel = "<confidence>", description = "Confidence level, strictly between 0 and 1")
    double confidence;

    @Parameters(index = "1", paramLabel = "<n1>", description = "Size of the first sample")
    int n1;

    @Parameters(index = "2", paramLabel = "<limit>", description = "Largest size of the second sample")
    int limit;

    @Override
    public Integer call() {
        if (n1 <= 0 || limit <= 0) {
            throw new ParameterException(spec.commandLine(), "<n1> and <limit> must be positive integers");
        }
        if (!(0.0 < confidence && confidence < 1.0)) {
            throw new ParameterException(spec.commandLine(), "<confidence> must be strictly between 0 and 1");
        }

        PrintWriter out = spec.commandLine().getOut();
        out.println("n1\tn2\tconfidence\tcritical_value");
        try {
            for (int n2 = FIRST_N2; n2 <= limit; n2++) {
                double criticalValue = KolmogorovSmirnov.calculateCriticalValue(n1, n2, confidence);
                out.println(n1 + "\t" + n2 + "\t" + confidence + "\t" + criticalValue);
            }
        } catch (KsException e) {
            out.flush();
            logger.debug("cannot compute critical values: {}", e.getDetailedMessage());
            spec.commandLine().getErr().println("Error: " + e.getMessage());
            return TestCommand.INVALID;
        }
        out.flush();
        return 0;
    }
}
