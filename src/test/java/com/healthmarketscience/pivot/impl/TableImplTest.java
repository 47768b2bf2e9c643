/*
Copyright (c) 2024 James Ahlborn

Licensed under the Apache License, Version 2.0 (the "License");
you may not use this file except in compliance with the License.
You may obtain a copy of the License at

    http://www.apache.org/licenses/LICENSE-2.0

Unless required by applicable law or agreed to in writing, software
distributed under the License is distributed on an "AS IS" BASIS,
WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
See the License for the specific language governing permissions and
limitations under the License.
*/

package com.healthmarketscience.pivot.impl;

import java.math.BigDecimal;
import java.util.Arrays;

import com.healthmarketscience.pivot.Row;
import com.healthmarketscience.pivot.Table;
import com.healthmarketscience.pivot.TableBuilder;
import static com.healthmarketscience.pivot.TestUtil.*;
import static org.junit.jupiter.api.Assertions.*;
import org.junit.jupiter.api.Test;

/**
 * @author James Ahlborn
 */
public class TableImplTest
{

  @Test
  public void testSubtables() throws Exception
  {
    Table table = createTableToPivot(true);

    assertEquals(3, table.getRowCount());
    assertEquals(3, table.getSubtableCount());
    assertEquals(3L, table.stream().filter(Row::hasSubtable).count());

    Row row2 = table.getRows().get(1);
    assertTrue(row2.hasSubtable());
    Table subtable = table.getSubtable(row2);
    assertEquals(2, subtable.getRowCount());
    assertEquals("col 2", subtable.getRows().get(1).getLabel());

    table.setSubtable(row2, null);
    assertFalse(row2.hasSubtable());
    assertNull(table.getSubtable(row2));
    assertEquals(2, table.getSubtableCount());

    // remaining rows still find their subtables
    Row row3 = table.getRows().get(2);
    assertEquals(3, table.getSubtable(row3).getRowCount());

    Table replacement = new TableBuilder().addRow("col 9").toTable();
    table.setSubtable(row3, replacement);
    assertSame(replacement, table.getSubtable(row3));
    assertEquals(2, table.getSubtableCount());
  }

  @Test
  public void testSetRows() throws Exception
  {
    Table table = createTableToPivot(true);
    table.putMetadata("period", "day");

    table.setRows(Arrays.asList(createExpectedRow("row 9", "nb_visits", 1)));

    assertEquals(1, table.getRowCount());
    assertEquals(0, table.getSubtableCount());
    assertEquals(Long.valueOf(1L), table.getRows().get(0).getLong("nb_visits"));
    assertEquals("day", table.getMetadata("period"));

    assertThrows(UnsupportedOperationException.class,
                 () -> table.getRows().clear());
  }

  @Test
  public void testForeignRows() throws Exception
  {
    Table table1 = createTableToPivot(true);
    Table table2 = new TableImpl();

    Row owner = table1.getRows().get(0);
    try {
      table2.addRow(owner);
      fail("IllegalArgumentException should have been thrown");
    } catch(IllegalArgumentException expected) {
      // success
      assertTrue(expected.getMessage().contains("already owns a subtable"));
    }

    table2.addRow(new RowImpl(owner));
    Row copy = table2.getRows().get(0);
    assertFalse(copy.hasSubtable());
    assertEquals(owner, copy);
  }

  @Test
  public void testRowValues() throws Exception
  {
    Row row = createExpectedRow("row 1", "a", 3, "b", null, "c", 2.5d,
                                "d", new BigDecimal("1.10"));

    assertEquals("row 1", row.getLabel());
    assertTrue(row.hasValue("a"));
    assertFalse(row.hasValue("b"));
    assertTrue(row.containsKey("b"));
    assertFalse(row.hasValue("e"));

    assertEquals(Long.valueOf(3L), row.getLong("a"));
    assertNull(row.getLong("b"));
    assertEquals(Double.valueOf(2.5d), row.getDouble("c"));
    assertEquals(new BigDecimal("1.10"), row.getBigDecimal("d"));
    assertEquals(Row.NO_SUBTABLE, row.getSubtableId());

    assertNotEquals(createExpectedRow("row 2", "a", 3, "b", null, "c", 2.5d,
                                      "d", new BigDecimal("1.10")),
                    row);
    assertTrue(row.toString().contains("<absent>"));
  }

  @Test
  public void testCreateRowValidation() throws Exception
  {
    assertThrows(IllegalArgumentException.class,
                 () -> TableBuilder.createRow("row 1", "a"));
    assertThrows(IllegalArgumentException.class,
                 () -> TableBuilder.createRow("row 1", "a", "text"));
    assertThrows(IllegalStateException.class,
                 () -> new TableBuilder().withSubtable(new TableImpl()));
  }
}
