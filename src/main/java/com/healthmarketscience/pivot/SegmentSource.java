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
 * Read-only access to the segment expression currently applied to the whole
 * request, if any.
 *
 * @author James Ahlborn
 * @usage _intermediate_class_
 */
@FunctionalInterface
public interface SegmentSource
{
  /** source for requests without a segment */
  public static final SegmentSource NONE = () -> null;

  /**
   * @return the active segment expression, {@code null} or empty if none
   */
  public String getSegment();

  /**
   * @return a source which always returns the given segment
   */
  public static SegmentSource of(final String segment) {
    return () -> segment;
  }
}
