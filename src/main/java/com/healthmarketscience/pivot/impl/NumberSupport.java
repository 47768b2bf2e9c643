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
import java.math.BigInteger;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Arithmetic on the loosely typed numeric values found in report rows.
 * Integral values add up to a Long, any floating point value turns the sum
 * into a Double and any BigDecimal/BigInteger value turns it into a
 * BigDecimal.  Absent ({@code null}) values count as zero.
 *
 * @author James Ahlborn
 */
public class NumberSupport
{
  public static final Long ZERO = 0L;

  private NumberSupport() {}

  /**
   * @return the sum of the two values, absent values are treated as zero
   */
  public static Number add(Number val1, Number val2)
  {
    if(val1 == null) {
      return ((val2 != null) ? normalize(val2) : ZERO);
    }
    if(val2 == null) {
      return normalize(val1);
    }

    if(isNonFinite(val1) || isNonFinite(val2)) {
      // NaN and infinity have no decimal form
      return val1.doubleValue() + val2.doubleValue();
    }
    if(isBig(val1) || isBig(val2)) {
      return toBigDecimal(val1).add(toBigDecimal(val2));
    }
    if(isIntegral(val1) && isIntegral(val2)) {
      long l1 = val1.longValue();
      long l2 = val2.longValue();
      long sum = l1 + l2;
      if(((l1 ^ sum) & (l2 ^ sum)) < 0) {
        // overflow
        return BigDecimal.valueOf(l1).add(BigDecimal.valueOf(l2));
      }
      return sum;
    }
    return val1.doubleValue() + val2.doubleValue();
  }

  /**
   * Compares two values numerically, absent values compare as zero.
   */
  public static int compare(Number val1, Number val2)
  {
    if(isNonFinite(val1) || isNonFinite(val2)) {
      return Double.compare(doubleValue(val1), doubleValue(val2));
    }
    if(isBig(val1) || isBig(val2)) {
      return toBigDecimalOrZero(val1).compareTo(toBigDecimalOrZero(val2));
    }
    if(isIntegralOrAbsent(val1) && isIntegralOrAbsent(val2)) {
      return Long.compare(longValue(val1), longValue(val2));
    }
    return Double.compare(doubleValue(val1), doubleValue(val2));
  }

  /**
   * @return the given value as a BigDecimal, {@code null} if absent
   * @throws NumberFormatException if the value is NaN or infinite
   */
  public static BigDecimal toBigDecimal(Number val)
  {
    if(val == null) {
      return null;
    }
    if(val instanceof BigDecimal) {
      return (BigDecimal)val;
    }
    if(val instanceof BigInteger) {
      return new BigDecimal((BigInteger)val);
    }
    if(isIntegral(val)) {
      return BigDecimal.valueOf(val.longValue());
    }
    return BigDecimal.valueOf(val.doubleValue());
  }

  private static Number normalize(Number val)
  {
    if(isBig(val)) {
      return toBigDecimal(val);
    }
    if(isIntegral(val)) {
      return val.longValue();
    }
    return val.doubleValue();
  }

  private static BigDecimal toBigDecimalOrZero(Number val) {
    return ((val != null) ? toBigDecimal(val) : BigDecimal.ZERO);
  }

  private static long longValue(Number val) {
    return ((val != null) ? val.longValue() : 0L);
  }

  private static double doubleValue(Number val) {
    return ((val != null) ? val.doubleValue() : 0d);
  }

  private static boolean isBig(Number val) {
    return ((val instanceof BigDecimal) || (val instanceof BigInteger));
  }

  private static boolean isNonFinite(Number val) {
    return (((val instanceof Double) || (val instanceof Float)) &&
            !Double.isFinite(val.doubleValue()));
  }

    private static boolean isIntegralOrAbsent(Number val) {
    return ((val == null) || isIntegral(val));
  }

  private static boolean isIntegral(Number val) {
    return ((val instanceof Long) || (val instanceof Integer) ||
            (val instanceof Short) || (val instanceof Byte) ||
            (val instanceof AtomicInteger) || (val instanceof AtomicLong));
  }
}
