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

package com.healthmarketscience.pivot;

import com.healthmarketscience.pivot.impl.PivoterImpl;
import static com.healthmarketscience.pivot.TestUtil.*;
import static org.junit.jupiter.api.Assertions.*;
import org.junit.jupiter.api.Test;

/**
 * @author James Ahlborn
 */
public class PivotRequestTest
{

  @Test
  public void testDefaults() throws Exception
  {
    PivotRequest request =
      new PivotRequestBuilder(KEYWORDS_REPORT, SEARCH_ENGINE_DIM).toRequest();

    assertEquals(KEYWORDS_REPORT, request.getSourceReportId());
    assertEquals(SEARCH_ENGINE_DIM, request.getPivotDimensionId());
    assertNull(request.getValueColumn());
    assertEquals(PivotRequest.DEFAULT_COLUMN_LIMIT, request.getColumnLimit());
    assertFalse(request.isAllowSegmentFetch());
  }

  @Test
  public void testSystemPropertyDefaults() throws Exception
  {
    System.setProperty(PivotRequest.COLUMN_LIMIT_PROPERTY, " 12 ");
    System.setProperty(PivotRequest.ENABLE_FETCH_BY_SEGMENT_PROPERTY, "TRUE");
    System.setProperty(PivoterBuilder.MAX_CONCURRENT_FETCHES_PROPERTY, "2");
    try {
      PivotRequest request = new PivotRequestBuilder()
        .setSourceReportId(KEYWORDS_REPORT)
        .setPivotDimensionId(CITY_DIM)
        .toRequest();

      assertEquals(12, request.getColumnLimit());
      assertTrue(request.isAllowSegmentFetch());
      assertEquals(2, PivoterBuilder.getDefaultMaxConcurrentFetches());
    } finally {
      System.clearProperty(PivotRequest.COLUMN_LIMIT_PROPERTY);
      System.clearProperty(PivotRequest.ENABLE_FETCH_BY_SEGMENT_PROPERTY);
      System.clearProperty(PivoterBuilder.MAX_CONCURRENT_FETCHES_PROPERTY);
    }

    assertEquals(PivotRequest.DEFAULT_COLUMN_LIMIT,
                 PivotRequest.getDefaultColumnLimit());
    assertFalse(PivotRequest.getDefaultAllowSegmentFetch());
    assertEquals(PivoterBuilder.DEFAULT_MAX_CONCURRENT_FETCHES,
                 PivoterBuilder.getDefaultMaxConcurrentFetches());
  }

  @Test
  public void testPivoterBuilderValidation() throws Exception
  {
    assertThrows(IllegalStateException.class,
                 () -> new PivoterBuilder().toPivoter());
    assertThrows(IllegalStateException.class,
                 () -> new PivoterBuilder(createRegistry())
                 .setOthersLabel("")
                 .toPivoter());
    assertThrows(IllegalStateException.class,
                 () -> new PivoterBuilder(createRegistry())
                 .setMaxConcurrentFetches(0)
                 .toPivoter());

    PivoterImpl pivoter = (PivoterImpl)new PivoterBuilder()
      .setMetadataRegistry(createRegistry())
      .setSegmentSource(null)
      .setOthersLabel("Rest")
      .setMaxConcurrentFetches(3)
      .toPivoter();
    assertEquals("Rest", pivoter.getOthersLabel());
    assertEquals(3, pivoter.getMaxConcurrentFetches());
  }

  @Test
  public void testPrepareRejectsBeforeTouchingRows() throws Exception
  {
    Pivoter pivoter = new PivoterBuilder(createRegistry()).toPivoter();
    Table table = createTableToPivot(true);

    PivotException e = assertThrows(
        PivotException.class,
        () -> pivoter.pivot(new PivotRequestBuilder(KEYWORDS_REPORT, CITY_DIM)
                            .setAllowSegmentFetch(false)
                            .toRequest(), table));
    assertEquals(PivotException.Kind.UNSUPPORTED_PIVOT_DIMENSION_MISMATCH,
                 e.getKind());
    assertEquals(3, table.getSubtableCount());
    assertTrue(table.getRows().get(0).hasValue("nb_visits"));
  }
}
