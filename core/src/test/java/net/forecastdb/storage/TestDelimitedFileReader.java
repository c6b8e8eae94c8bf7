// This file is part of ForecastDB.
// Copyright (C) 2026  The ForecastDB Authors.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//   http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package net.forecastdb.storage;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

import java.io.File;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.SortedMap;
import java.util.zip.GZIPOutputStream;

import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;

import net.forecastdb.configuration.UnitTestConfiguration;
import net.forecastdb.exceptions.FeatureNotImplementedException;
import net.forecastdb.exceptions.IllegalDataFormatException;
import net.forecastdb.series.SeriesType;

public class TestDelimitedFileReader {
  static final Instant T0 = Instant.parse("2020-01-01T00:00:00Z");
  static final Instant T1 = Instant.parse("2020-01-01T01:00:00Z");

  @Rule
  public final TemporaryFolder folder = new TemporaryFolder();

  private UnitTestConfiguration config;
  private DelimitedFileReader reader;

  @Before
  public void before() throws Exception {
    config = UnitTestConfiguration.getConfiguration();
    reader = new DelimitedFileReader(config);
  }

  @After
  public void after() throws Exception {
    config.close();
  }

  @Test
  public void ctor() throws Exception {
    assertEquals(",", config.getString(DelimitedFileReader.DELIMITER_KEY));
    assertEquals("DateTime",
        config.getString(DelimitedFileReader.TIMESTAMP_COLUMN_KEY));
    // registering twice is fine
    new DelimitedFileReader(config);

    try {
      new DelimitedFileReader(null);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }

  @Test
  public void readDeterministic() throws Exception {
    final Path file = write("load.csv",
        "DateTime,0,1,2",
        "2020-01-01 01:00:00,4,5,6",
        "",
        "2020-01-01 00:00:00, 1 ,2,3");
    final SortedMap<Instant, double[]> data =
        reader.read(SeriesType.DETERMINISTIC, file, "north");
    assertEquals(2, data.size());
    assertEquals(T0, data.firstKey());
    assertArrayEquals(new double[] { 1, 2, 3 }, data.get(T0), 0.0001);
    assertArrayEquals(new double[] { 4, 5, 6 }, data.get(T1), 0.0001);
  }

  @Test
  public void readSingleTimeSeries() throws Exception {
    final Path file = write("prices.csv",
        "DateTime,north,south",
        "1577836800,1.5,2.5",
        "1577840400,3.5,4.5");
    final SortedMap<Instant, double[]> data =
        reader.read(SeriesType.SINGLE_TIME_SERIES, file, "south");
    assertEquals(2, data.size());
    assertArrayEquals(new double[] { 2.5 }, data.get(T0), 0.0001);
    assertArrayEquals(new double[] { 4.5 }, data.get(T1), 0.0001);

    try {
      reader.read(SeriesType.SINGLE_TIME_SERIES, file, "east");
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    try {
      reader.read(SeriesType.SINGLE_TIME_SERIES, file, null);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    try {
      reader.read(SeriesType.SINGLE_TIME_SERIES, file, "DateTime");
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }

  @Test
  public void readGzipped() throws Exception {
    final File file = folder.newFile("load.csv.gz");
    try (final OutputStream out =
        new GZIPOutputStream(Files.newOutputStream(file.toPath()))) {
      out.write(Joiner.on('\n').join(
          "DateTime,0,1",
          "2020-01-01T00:00:00Z,1,2").getBytes(StandardCharsets.UTF_8));
    }
    final SortedMap<Instant, double[]> data =
        reader.read(SeriesType.DETERMINISTIC, file.toPath(), null);
    assertArrayEquals(new double[] { 1, 2 }, data.get(T0), 0.0001);
  }

  @Test
  public void readTabDelimited() throws Exception {
    try (final UnitTestConfiguration tabs =
        UnitTestConfiguration.getConfiguration(ImmutableMap.of(
            DelimitedFileReader.DELIMITER_KEY, "\t",
            DelimitedFileReader.TIMESTAMP_COLUMN_KEY, "time"))) {
      final DelimitedFileReader reader = new DelimitedFileReader(tabs);
      final Path file = write("load.tsv",
          "time\t0\t1",
          "2020-01-01 00:00:00\t1\t2");
      assertArrayEquals(new double[] { 1, 2 },
          reader.read(SeriesType.DETERMINISTIC, file, null).get(T0), 0.0001);
    }
  }

  @Test
  public void readUncheckedTimestampColumn() throws Exception {
    config.override(DelimitedFileReader.TIMESTAMP_COLUMN_KEY, "");
    final DelimitedFileReader reader = new DelimitedFileReader(config);
    final Path file = write("load.csv",
        "when,0",
        "2020-01-01 00:00:00,1");
    assertEquals(1, reader.read(SeriesType.DETERMINISTIC, file, null).size());
  }

  @Test
  public void readErrors() throws Exception {
    assertReadFails(IllegalDataFormatException.class, write("empty.csv",
        "", " "));
    assertReadFails(IllegalDataFormatException.class, write("header.csv",
        "Time,0,1",
        "2020-01-01 00:00:00,1,2"));
    assertReadFails(IllegalDataFormatException.class, write("value.csv",
        "DateTime,0,1",
        "2020-01-01 00:00:00,1,two"));
    assertReadFails(IllegalDataFormatException.class, write("timestamp.csv",
        "DateTime,0,1",
        "yesterday,1,2"));
    assertReadFails(IllegalDataFormatException.class, write("columns.csv",
        "DateTime,0,1",
        "2020-01-01 00:00:00,1,2,3"));
    assertReadFails(IllegalDataFormatException.class, write("duplicate.csv",
        "DateTime,0,1",
        "2020-01-01 00:00:00,1,2",
        "1577836800,3,4"));
  }

  @Test
  public void readUnsupportedType() throws Exception {
    final Path file = write("load.csv", "DateTime,0");
    try {
      reader.read(SeriesType.PROBABILISTIC, file, null);
      fail("Expected FeatureNotImplementedException");
    } catch (FeatureNotImplementedException e) {
      assertEquals("PROBABILISTIC", e.getData());
    }

    try {
      reader.read(null, file, null);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    try {
      reader.read(SeriesType.DETERMINISTIC, null, null);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }

  @Test(expected = java.nio.file.NoSuchFileException.class)
  public void readMissingFile() throws Exception {
    reader.read(SeriesType.DETERMINISTIC,
        folder.getRoot().toPath().resolve("nothere.csv"), null);
  }

  private void assertReadFails(final Class<? extends Exception> expected,
                               final Path file) throws Exception {
    try {
      reader.read(SeriesType.DETERMINISTIC, file, null);
      fail("Expected " + expected.getSimpleName() + " for " + file);
    } catch (Exception e) {
      if (!expected.isInstance(e)) {
        throw e;
      }
    }
  }

  private Path write(final String name, final String... lines)
      throws Exception {
    final List<String> content = Lists.newArrayList(lines);
    final File file = folder.newFile(name);
    Files.write(file.toPath(), content, StandardCharsets.UTF_8);
    return file.toPath();
  }
}
