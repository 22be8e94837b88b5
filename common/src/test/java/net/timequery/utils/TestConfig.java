// This file is part of OpenTSDB.
// Copyright (C) 2018  The OpenTSDB Authors.
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
package net.timequery.utils;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.FileWriter;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import net.timequery.query.QueryLimits;

public class TestConfig {
  @Rule
  public TemporaryFolder folder = new TemporaryFolder();
  
  @Test
  public void defaults() {
    final Config config = new Config();
    assertEquals(0, config.getInt(Config.MAX_SELECT_SERIES));
    assertEquals(0, config.getInt(Config.MAX_SELECT_BUCKETS));
    assertEquals(0, config.getLong(Config.MAX_SELECT_POINTS));
    assertEquals(4, config.getInt(Config.SCAN_THREADS));
    assertEquals(1024, config.getInt(Config.SCAN_BUFFER_SIZE));
    assertEquals(0, config.getLong(Config.TIMEOUT_MS));
    assertEquals(0, config.getInt(Config.CHUNK_SIZE));
    assertNull(config.configLocation());
    assertFalse(config.hasProperty("no.such.key"));
  }
  
  @Test
  public void overrideAndCopy() {
    final Config config = new Config();
    config.overrideConfig(Config.MAX_SELECT_SERIES, "3");
    config.overrideConfig("some.flag", "yes");
    assertEquals(3, config.getInt(Config.MAX_SELECT_SERIES));
    assertTrue(config.getBoolean("some.flag"));
    
    final Config copy = new Config(config);
    copy.overrideConfig(Config.MAX_SELECT_SERIES, "5");
    assertEquals(5, copy.getInt(Config.MAX_SELECT_SERIES));
    assertEquals(3, config.getInt(Config.MAX_SELECT_SERIES));
    
    try {
      config.getBoolean("no.such.key");
      fail("Expected NullPointerException");
    } catch (NullPointerException e) { }
  }
  
  @Test
  public void loadFile() throws Exception {
    final File file = folder.newFile("query.conf");
    try (final FileWriter writer = new FileWriter(file)) {
      writer.write("query.chunk_size = 100\nquery.scan_threads = 1\n");
    }
    final Config config = new Config(file.getAbsolutePath());
    assertEquals(100, config.getInt(Config.CHUNK_SIZE));
    assertEquals(1, config.getInt(Config.SCAN_THREADS));
    assertEquals(1024, config.getInt(Config.SCAN_BUFFER_SIZE));
    assertEquals(file.getAbsolutePath(), config.configLocation());
    
    try {
      new Config(new File(folder.getRoot(), "missing.conf").getAbsolutePath());
      fail("Expected FileNotFoundException");
    } catch (FileNotFoundException e) { }
  }
  
  @Test
  public void loadResource() throws Exception {
    final Config config = new Config();
    assertTrue(config.loadResource("timequery-test.properties"));
    assertEquals(2, config.getInt(Config.MAX_SELECT_SERIES));
    assertFalse(config.loadResource("no-such-resource.properties"));
  }
  
  @Test
  public void limitsFromConfig() {
    final Config config = new Config();
    config.overrideConfig(Config.MAX_SELECT_SERIES, "3");
    config.overrideConfig(Config.MAX_SELECT_POINTS, "1000");
    config.overrideConfig(Config.CHUNK_SIZE, "10");
    final QueryLimits limits = QueryLimits.fromConfig(config);
    assertEquals(3, limits.maxSelectSeries());
    assertEquals(0, limits.maxSelectBuckets());
    assertEquals(1000, limits.maxSelectPoints());
    assertEquals(4, limits.scanThreads());
    assertEquals(1024, limits.scanBufferSize());
    assertEquals(10, limits.chunkSize());
  }
}
