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

package com.healthmarketscience.pivot.util;

import static org.junit.jupiter.api.Assertions.*;
import org.junit.jupiter.api.Test;

/**
 * @author James Ahlborn
 */
public class SegmentExpressionTest
{

  @Test
  public void testEqualTo() throws Exception
  {
    assertEquals("referrerKeyword==row+1",
                 SegmentExpression.equalTo("referrerKeyword", "row 1"));
    assertEquals("city==S%C3%A3o+Paulo",
                 SegmentExpression.equalTo("city", "São Paulo"));
    assertEquals("pageUrl==http%3A%2F%2Fexample.com%2F%3Fa%3D1%26b%3D2",
                 SegmentExpression.equalTo("pageUrl",
                                           "http://example.com/?a=1&b=2"));
    assertEquals("referrerKeyword==a%3Bb%3D%3Dc",
                 SegmentExpression.equalTo("referrerKeyword", "a;b==c"));
    assertEquals("referrerKeyword==best%2Aprice+%2A%2A",
                 SegmentExpression.equalTo("referrerKeyword", "best*price **"));
    assertEquals("referrerKeyword==a-b_c.d%7Ee",
                 SegmentExpression.equalTo("referrerKeyword", "a-b_c.d~e"));
    assertEquals("referrerKeyword==",
                 SegmentExpression.equalTo("referrerKeyword", null));
  }

  @Test
  public void testAnd() throws Exception
  {
    assertEquals("asegment==value;city==Paris",
                 SegmentExpression.and("asegment==value", "city==Paris"));
    assertEquals("city==Paris", SegmentExpression.and(null, "city==Paris"));
    assertEquals("city==Paris", SegmentExpression.and("  ", "city==Paris"));
    assertEquals("asegment==value",
                 SegmentExpression.and("asegment==value", ""));
    assertEquals("", SegmentExpression.and(null, null));
  }
}
