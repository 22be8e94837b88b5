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
package net.timequery.query.processor.expressions;

import static org.junit.Assert.assertEquals;

import java.util.List;

import org.junit.Test;

import com.google.common.collect.ImmutableList;

import net.timequery.query.statement.BinaryExpr;
import net.timequery.query.statement.Call;
import net.timequery.query.statement.Field;
import net.timequery.query.statement.IntegerLiteral;
import net.timequery.query.statement.Operator;
import net.timequery.query.statement.VarRef;

public class TestColumnNamer {
  
  @Test
  public void defaultNames() {
    assertEquals("value", ColumnNamer.defaultName(new VarRef("value")));
    assertEquals("mean", ColumnNamer.defaultName(
        new Call("mean", new VarRef("value"))));
    assertEquals("max_min", ColumnNamer.defaultName(new BinaryExpr(
        Operator.SUB, 
        new Call("max", new VarRef("value")), 
        new Call("min", new VarRef("value")))));
    assertEquals("value", ColumnNamer.defaultName(new BinaryExpr(
        Operator.MUL, new VarRef("value"), new IntegerLiteral(2))));
    assertEquals("", ColumnNamer.defaultName(new IntegerLiteral(2)));
  }
  
  @Test
  public void duplicatesGetSuffixes() {
    final List<String> names = ColumnNamer.columnNames(ImmutableList.of(
        new Field(new Call("sum", new VarRef("a"))),
        new Field(new Call("sum", new VarRef("b"))),
        new Field(new Call("sum", new VarRef("c")))));
    assertEquals(ImmutableList.of("sum", "sum_1", "sum_2"), names);
  }
  
  @Test
  public void aliasesAreReserved() {
    final List<String> names = ColumnNamer.columnNames(ImmutableList.of(
        new Field(new Call("sum", new VarRef("a"))),
        new Field(new Call("mean", new VarRef("b")), "sum")));
    assertEquals(ImmutableList.of("sum_1", "sum"), names);
  }
}
