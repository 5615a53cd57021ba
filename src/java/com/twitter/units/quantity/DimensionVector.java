// =================================================================================================
// Copyright 2011 Twitter, Inc.
// -------------------------------------------------------------------------------------------------
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this work except in compliance with the License.
// You may obtain a copy of the License in the LICENSE file, or at:
//
//  http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
// =================================================================================================

package com.twitter.units.quantity;

import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import com.google.common.base.Joiner;
import com.google.common.collect.Lists;

import com.twitter.units.table.BaseDimension;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * The exponents of a unit over every {@link BaseDimension}, eg: force is
 * {@code MASS^1 LENGTH^1 TIME^-2}.  Vectors depend only on the fundamental units a unit reduces
 * to, never on multiplier prefixes, so {@code km} and {@code m} share a vector.
 *
 * <p>Two vectors are equal iff every exponent matches.  Absolute temperatures and temperature
 * differences are distinct dimensions; {@link #isConvertibleTo(DimensionVector)} is the looser
 * relation that lets a value move between them.
 */
public final class DimensionVector {

  private static final DimensionVector DIMENSIONLESS =
      new DimensionVector(new double[BaseDimension.count()]);

  private final double[] exponents;

  private DimensionVector(double[] exponents) {
    this.exponents = exponents;
    for (int i = 0; i < exponents.length; i++) {
      // Normalizes -0.0 so equal vectors hash alike.
      exponents[i] += 0.0;
    }
  }

  public static DimensionVector dimensionless() {
    return DIMENSIONLESS;
  }

  /**
   * Creates a vector with a single nonzero exponent.
   */
  public static DimensionVector of(BaseDimension dimension, double exponent) {
    checkNotNull(dimension);
    double[] exponents = new double[BaseDimension.count()];
    exponents[dimension.ordinal()] = exponent;
    return new DimensionVector(exponents);
  }

  public static DimensionVector of(BaseDimension dimension) {
    return of(dimension, 1);
  }

  /**
   * Creates a vector from exponents keyed by dimension; absent dimensions have exponent 0.
   */
  public static DimensionVector of(Map<BaseDimension, ? extends Number> exponents) {
    checkNotNull(exponents);
    double[] values = new double[BaseDimension.count()];
    for (Map.Entry<BaseDimension, ? extends Number> entry : exponents.entrySet()) {
      values[checkNotNull(entry.getKey()).ordinal()] = entry.getValue().doubleValue();
    }
    return new DimensionVector(values);
  }

  /**
   * Creates a vector from exponents listed in {@link BaseDimension} order.
   */
  public static DimensionVector of(double... exponents) {
    checkArgument(exponents.length == BaseDimension.count(),
        "Expected %s exponents, got %s", BaseDimension.count(), exponents.length);
    return new DimensionVector(exponents.clone());
  }

  public double get(BaseDimension dimension) {
    return exponents[dimension.ordinal()];
  }

  /**
   * Returns the nonzero exponents keyed by dimension, in dimension order.
   */
  public Map<BaseDimension, Double> asMap() {
    Map<BaseDimension, Double> map = new EnumMap<BaseDimension, Double>(BaseDimension.class);
    for (BaseDimension dimension : BaseDimension.values()) {
      if (get(dimension) != 0) {
        map.put(dimension, get(dimension));
      }
    }
    return map;
  }

  public boolean isDimensionless() {
    for (double exponent : exponents) {
      if (exponent != 0) {
        return false;
      }
    }
    return true;
  }

  /**
   * Returns the dimensions of a product: exponents add.
   */
  public DimensionVector multiply(DimensionVector other) {
    double[] result = exponents.clone();
    for (int i = 0; i < result.length; i++) {
      result[i] += other.exponents[i];
    }
    return new DimensionVector(result);
  }

  /**
   * Returns the dimensions of a quotient: exponents subtract.
   */
  public DimensionVector divide(DimensionVector other) {
    double[] result = exponents.clone();
    for (int i = 0; i < result.length; i++) {
      result[i] -= other.exponents[i];
    }
    return new DimensionVector(result);
  }

  /**
   * Returns the dimensions of a power: exponents scale.
   */
  public DimensionVector power(double power) {
    double[] result = exponents.clone();
    for (int i = 0; i < result.length; i++) {
      result[i] *= power;
    }
    return new DimensionVector(result);
  }

  /**
   * Returns {@code true} if a value with these dimensions can be converted to {@code other}.
   * This holds for equal vectors and for vectors that differ only in how their temperature
   * exponent is split between absolute temperature and temperature difference.
   */
  public boolean isConvertibleTo(DimensionVector other) {
    return folded().equals(other.folded());
  }

  private DimensionVector folded() {
    int temperature = BaseDimension.TEMPERATURE.ordinal();
    int difference = BaseDimension.TEMPERATURE_DIFFERENCE.ordinal();
    if (exponents[difference] == 0) {
      return this;
    }
    double[] result = exponents.clone();
    result[temperature] += result[difference];
    result[difference] = 0;
    return new DimensionVector(result);
  }

  @Override
  public boolean equals(Object o) {
    if (o == this) { return true; }
    if (!(o instanceof DimensionVector)) { return false; }

    return Arrays.equals(exponents, ((DimensionVector) o).exponents);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(exponents);
  }

  @Override
  public String toString() {
    List<String> parts = Lists.newArrayList();
    for (Map.Entry<BaseDimension, Double> entry : asMap().entrySet()) {
      parts.add(entry.getKey() + "^" + UnitAlgebra.formatPower(entry.getValue()));
    }
    return "{" + Joiner.on(", ").join(parts) + "}";
  }
}
