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

import java.util.Map;

import com.google.common.collect.ImmutableMap;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A unit described by named physical quantities raised to exponents, eg:
 * {@code {"Velocity": 1, "Time": 1}} for {@code m s^-1 s}.  Names are looked up in the
 * quantity-name table of the registry's unit table.
 */
public final class QuantityMap {

  /**
   * Thrown when a quantity name is not in the unit table.
   */
  public static class UnknownQuantityNameException extends IllegalArgumentException {
    public UnknownQuantityNameException(String name) {
      super(String.format("'%s' is not a valid quantity name.", name));
    }
  }

  private final ImmutableMap<String, Double> exponents;
  private final Unit unit;

  /**
   * @param registry The registry to resolve units with.
   * @param exponents Quantity names mapped to the exponent each is raised to.
   * @throws UnknownQuantityNameException if a name is not in the unit table
   */
  public QuantityMap(UnitRegistry registry, Map<String, ? extends Number> exponents) {
    checkNotNull(registry);
    checkNotNull(exponents);

    ImmutableMap.Builder<String, Double> copy = ImmutableMap.builder();
    Unit composed = registry.dimensionless();
    for (Map.Entry<String, ? extends Number> entry : exponents.entrySet()) {
      String units = registry.getTable().getQuantityUnits(entry.getKey());
      if (units == null) {
        throw new UnknownQuantityNameException(entry.getKey());
      }
      double exponent = entry.getValue().doubleValue();
      copy.put(entry.getKey(), exponent);
      composed = composed.multiply(registry.unit(units).power(exponent));
    }
    this.exponents = copy.build();
    this.unit = composed;
  }

  public Unit getUnit() {
    return unit;
  }

  public Map<String, Double> getExponents() {
    return exponents;
  }

  @Override
  public String toString() {
    return exponents.toString();
  }
}
