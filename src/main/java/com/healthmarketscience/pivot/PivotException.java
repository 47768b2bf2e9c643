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

/**
 * Exception thrown when a {@link PivotRequest} can not be satisfied, either
 * because it names an unknown report or dimension or because the report can
 * not be pivoted by the requested dimension.  These errors are detected
 * before any row is processed and are never worth retrying.
 *
 * @author James Ahlborn
 */
public class PivotException extends IllegalArgumentException
{
  private static final long serialVersionUID = 20240611L;

  /** the reasons a pivot request may be rejected */
  public enum Kind {
    UNKNOWN_REPORT,
    UNKNOWN_DIMENSION,
    INVALID_DIMENSION,
    UNSUPPORTED_PIVOT_NO_SUBTABLE,
    UNSUPPORTED_PIVOT_DIMENSION_MISMATCH,
    NO_SEGMENT_FOR_DIMENSION,
    NO_REPORT_FOR_DIMENSION;
  }

  private final Kind _kind;

  public PivotException(Kind kind, String msg)
  {
    super(msg);
    _kind = kind;
  }

  public Kind getKind() {
    return _kind;
  }
}
