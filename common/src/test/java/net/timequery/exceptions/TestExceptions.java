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
package net.timequery.exceptions;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

public class TestExceptions {

  @Test
  public void messages() {
    assertEquals("max-select-series limit exceeded: (4/3)", 
        LimitExceededException.guard("max-select-series", 4, 3).getMessage());
    assertEquals(MixedAggregateException.MESSAGE, 
        new MixedAggregateException().getMessage());
    assertEquals(DistinctCombinationException.MESSAGE, 
        new DistinctCombinationException().getMessage());
    assertEquals("mixing aggregate and non-aggregate queries is not supported",
        MixedAggregateException.MESSAGE);
  }
  
  @Test
  public void notFound() {
    assertTrue(NotFoundException.database("db").isHard());
    assertTrue(NotFoundException.retentionPolicy("rp").isHard());
    assertFalse(NotFoundException.measurement("cpu").isHard());
    assertFalse(NotFoundException.field("value").isHard());
    assertEquals("database not found: db", 
        NotFoundException.database("db").getMessage());
    assertEquals(404, NotFoundException.database("db").getStatusCode());
  }
  
  @Test
  public void statusCodes() {
    assertEquals(400, new InvalidArgumentException("bad").getStatusCode());
    assertEquals(400, new TypeMismatchException("bad").getStatusCode());
    final Exception cause = new IllegalStateException("boom");
    final QueryExecutionException e = 
        new QueryExecutionException("internal", 500, cause);
    assertEquals(500, e.getStatusCode());
    assertEquals(cause, e.getCause());
  }
}
