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
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.Random;
import java.util.concurrent.Callable;

/**
 * Prints Normal deviates, one per line, for generating test samples.
 */
@Command(
    name = "normal",
    description = "Prints <count> Normal deviates with the given mean and variance."
)
public class NormalCommand implements Callable<Integer> {

    private static final Logger logger = LogManager.getLogger(NormalCommand.class);

    @Spec
    CommandSpec spec;

    @Parameters(index = "0", paramLabel = "<count>", description = "Number of deviates to print")
    int count;

    @Parameters(index = "1", paramLabel = "<mean>", description = "Mean of the distribution")
    double mean;

    @Parameters(index = "2", paramLabel = "<variance>", description = "Variance of the distribution, positive")
    double variance;

    @Option(names = "--seed", description = "Seed for reproducible output")
    Long seed;

    @Override
    public Integer call() {
        if (count <= 0) {
            throw new ParameterException(spec.commandLine(), "<count> must be a positive integer");
        }
        if (!(variance > 0)) {
            throw new ParameterException(spec.commandLine(), "<variance> must be positive");
        }

        Random rand = seed == null ? new Random() : new Random(seed);
        NormalSampler sampler = new NormalSampler(mean, variance, rand);
        logger.debug("drawing [{}] deviates, mean [{}], variance [{}]", count, mean, variance);

        PrintWriter out = spec.commandLine().getOut();
        for (int i = 0; i < count; i++) {
            out.println(sampler.next());
        }
        out.flush();
        return 0;
    }
}
