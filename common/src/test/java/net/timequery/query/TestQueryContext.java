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
package net.timequery.query;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.junit.Test;

import net.timequery.exceptions.LimitExceededException;
import net.timequery.exceptions.QueryCancelledException;

public class TestQueryContext {

  @Test
  public void ctor() {
    final QueryContext context = QueryContext.unlimited();
    assertFalse(context.isCancelled());
    assertEquals(0, context.pointsRead());
    assertEquals(0, context.limits().maxSelectSeries());
    
    try {
      new QueryContext(null);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }
  
  @Test
  public void cancel() {
    final QueryContext context = QueryContext.unlimited();
    context.checkCancelled();
    context.cancel("user abort");
    assertTrue(context.isCancelled());
    try {
      context.checkCancelled();
      fail("Expected QueryCancelledException");
    } catch (QueryCancelledException e) {
      assertEquals("user abort", e.getMessage());
    }
    
    // first reason wins
    context.cancel("again");
    try {
      context.checkCancelled();
      fail("Expected QueryCancelledException");
    } catch (QueryCancelledException e) {
      assertEquals("user abort", e.getMessage());
    }
  }
  
  @Test
  public void deadline() throws Exception {
    final QueryContext context = new QueryContext(QueryLimits.newBuilder()
        .setTimeoutMs(1)
        .build());
    Thread.sleep(20);
    assertTrue(context.isCancelled());
    try {
      context.checkCancelled();
      fail("Expected QueryCancelledException");
    } catch (QueryCancelledException e) {
      assertEquals("query timeout of 1ms exceeded", e.getMessage());
    }
  }
  
  @Test
  public void pointGuard() {
    final QueryContext context = new QueryContext(QueryLimits.newBuilder()
        .setMaxSelectPoints(5)
        .build());
    context.addPointsRead(3);
    context.addPointsRead(2);
    assertEquals(5, context.pointsRead());
    try {
      context.addPointsRead(1);
      fail("Expected LimitExceededException");
    } catch (LimitExceededException e) {
      assertEquals("max-select-point limit exceeed: (6/5)", e.getMessage());
      assertEquals(400, e.getStatusCode());
    }
  }
}
