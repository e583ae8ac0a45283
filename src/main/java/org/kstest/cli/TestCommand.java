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
import org.kstest.twosample.Confidence;
import org.kstest.twosample.KolmogorovSmirnov;
import org.kstest.twosample.TestResult;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Runs the test on two sample files and prints the decision with its statistic.
 */
@Command(
    name = "test",
    description = "Tests whether two sample files come from the same distribution.",
    exitCodeList = {
        "0: Samples are from the same distribution",
        "1: Samples are from different distributions",
        "2: Invalid input"
    }
)
public class TestCommand implements Callable<Integer> {

    private static final Logger logger = LogManager.getLogger(TestCommand.class);

    static final int SAME = 0;
    static final int DIFFERENT = 1;
    static final int INVALID = 2;

    enum SampleType {
        LONG, DOUBLE
    }

    @Spec
    CommandSpec spec;

    @Option(
        names = {"--type", "-t"},
        description = "Value type of both files: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})",
        defaultValue = "DOUBLE"
    )
    SampleType type;

    @Option(
        names = {"--confidence", "-c"},
        description = "Confidence level (default: ${DEFAULT-VALUE})",
        defaultValue = "0.95"
    )
    double confidence;

    @Parameters(index = "0", description = "First sample file")
    Path first;

    @Parameters(index = "1", description = "Second sample file")
    Path second;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        TestResult result;
        try {
            if (type == SampleType.LONG) {
                result = KolmogorovSmirnov.test(SampleFiles.readLongs(first), SampleFiles.readLongs(second), confidence);
            } else {
                result = KolmogorovSmirnov.testDoubles(SampleFiles.readDoubles(first), SampleFiles.readDoubles(second), confidence);
            }
        } catch (KsException e) {
            logger.debug("test of [{}] against [{}] failed: {}", first, second, e.getDetailedMessage());
            spec.commandLine().getErr().println("Error: " + e.getMessage());
            return INVALID;
        } catch (IOException e) {
            logger.debug("failed to read samples", e);
            spec.commandLine().getErr().println("Error: cannot read samples: " + e.getMessage());
            return INVALID;
        }

        if (result.isRejected()) {
            out.println("Samples are from different distributions.");
        } else {
            out.println("Samples are from the same distributions.");
        }
        out.println("test statistic = " + result.getStatistic());
        out.println("critical value = " + result.getCriticalValue());
        out.println("confidence = " + result.getConfidence());
        out.flush();
        return result.isRejected() ? DIFFERENT : SAME;
    }
}
