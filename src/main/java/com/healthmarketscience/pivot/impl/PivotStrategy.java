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

import java.io.IOException;
import java.util.List;

import com.healthmarketscience.pivot.Row;
import com.healthmarketscience.pivot.Table;

/**
 * Source of the pivot cells of a table's rows.
 *
 * @author James Ahlborn
 */
interface PivotStrategy
{
  /**
   * Records the pivot cells of the given rows of the given table in the
   * given matrix, where the matrix row index is the index in the given list.
   */
  public void collect(Table table, List<Row> rows, PivotMatrix matrix)
    throws IOException;
}
