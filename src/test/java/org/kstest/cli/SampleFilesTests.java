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

import org.kstest.KsTestCase;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.equalTo;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class SampleFilesTests extends KsTestCase {

    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    private Path write(String... lines) throws IOException {
        Path path = tmp.newFile().toPath();
        Files.write(path, Arrays.asList(lines), StandardCharsets.UTF_8);
        return path;
    }

    @Test
    public void testReadLongs() throws IOException {
        Path path = write("3", " -7 ", "", "9223372036854775807");
        assertArrayEquals(new long[] { 3, -7, Long.MAX_VALUE }, SampleFiles.readLongs(path));
    }

    @Test
    public void testReadDoubles() throws IOException {
        Path path = write("1.5", "-2e3", "", "Infinity", "NaN");
        double[] values = SampleFiles.readDoubles(path);
        assertThat(values.length, equalTo(4));
        assertThat(values[0], equalTo(1.5));
        assertThat(values[1], equalTo(-2000.0));
        assertThat(values[2], equalTo(Double.POSITIVE_INFINITY));
        assertTrue(Double.isNaN(values[3]));
    }

    @Test
    public void testEmptyFile() throws IOException {
        assertThat(SampleFiles.readLongs(write()).length, equalTo(0));
    }

    @Test
    public void testNotANumber() throws IOException {
        Path path = write("1", "2", "1.5");
        try {
            SampleFiles.readLongs(path);
            fail("expected SampleFormatException");
        } catch (SampleFormatException e) {
            assertThat(e.getMessage(), containsString("line [3]"));
            assertThat(e.getCause().getClass(), equalTo((Object) NumberFormatException.class));
        }
    }
}
