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

import com.carrotsearch.hppc.DoubleArrayList;
import com.carrotsearch.hppc.LongArrayList;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads samples from headerless single column files, one value per line. Blank
 * lines are skipped.
 */
public final class SampleFiles {

    private static final Logger logger = LogManager.getLogger(SampleFiles.class);

    private SampleFiles() {
    }

    public static long[] readLongs(Path path) throws IOException {
        LongArrayList values = new LongArrayList();
        BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8);
        try {
            String line;
            int lineNumber = 0;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                String value = line.trim();
                if (value.isEmpty()) {
                    continue;
                }
                try {
                    values.add(Long.parseLong(value));
                } catch (NumberFormatException e) {
                    throw new SampleFormatException("[" + path + "] line [" + lineNumber + "]: not an integer [" + value + "]", e);
                }
            }
        } finally {
            reader.close();
        }
        logger.debug("read [{}] integer values from [{}]", values.size(), path);
        return values.toArray();
    }

    public static double[] readDoubles(Path path) throws IOException {
        DoubleArrayList values = new DoubleArrayList();
        BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8);
        try {
            String line;
            int lineNumber = 0;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                String value = line.trim();
                if (value.isEmpty()) {
                    continue;
                }
                try {
                    values.add(Double.parseDouble(value));
                } catch (NumberFormatException e) {
                    throw new SampleFormatException("[" + path + "] line [" + lineNumber + "]: not a floating point number [" + value + "]", e);
                }
            }
        } finally {
            reader.close();
        }
        logger.debug("read [{}] floating point values from [{}]", values.size(), path);
        return values.toArray();
    }
}
