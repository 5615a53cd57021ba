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

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

import org.apache.commons.lang.StringUtils;

import com.twitter.units.table.BaseDimension;
import com.twitter.units.table.FundamentalUnit;
import com.twitter.units.table.UnitTable;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * An assignment of one fundamental unit to every base dimension, used as a conversion target.
 */
public final class UnitSystem {

  /**
   * The predefined system builders start from when no other base is given.
   */
  public static final String DEFAULT_SYSTEM = "SI";

  private static final Joiner TERM_JOINER = Joiner.on(' ');

  /**
   * Thrown for an unknown predefined system, a dimension without a unit or a unit assigned to a
   * dimension of another type.
   */
  public static class InvalidUnitSystemException extends IllegalArgumentException {
    public InvalidUnitSystemException(String message) {
      super(message);
    }
  }

  /**
   * Thrown when a unit system is given a unit that is not a fundamental unit.
   */
  public static class NotFundamentalUnitException extends IllegalArgumentException {
    public NotFundamentalUnitException(String units) {
      super(String.format("'%s' is not a fundamental unit.", units));
    }
  }

  /**
   * Thrown when a unit system is given two units for the same dimension.
   */
  public static class DuplicateDimensionTypeException extends IllegalArgumentException {
    public DuplicateDimensionTypeException(BaseDimension dimension, String first, String second) {
      super(String.format("'%s' and '%s' are both of type %s; a unit system takes one unit "
          + "per dimension.", first, second, dimension));
    }
  }

  private final UnitRegistry registry;
  private final ImmutableMap<BaseDimension, String> baseUnits;

  private UnitSystem(UnitRegistry registry, Map<BaseDimension, String> baseUnits) {
    this.registry = registry;
    this.baseUnits = Maps.immutableEnumMap(baseUnits);
  }

  /**
   * Returns the predefined system called {@code name}.
   *
   * @throws InvalidUnitSystemException if the registry's table has no such system
   */
  public static UnitSystem of(UnitRegistry registry, String name) {
    return builder(registry).basedOn(name).build();
  }

  /**
   * Creates a system from a complete assignment of units; no predefined system fills gaps.
   *
   * @throws InvalidUnitSystemException if a dimension has no unit
   */
  public static UnitSystem of(UnitRegistry registry, Map<BaseDimension, String> baseUnits) {
    return validate(registry, baseUnits);
  }

  public static Builder builder(UnitRegistry registry) {
    return new Builder(registry);
  }

  private static UnitSystem validate(UnitRegistry registry, Map<BaseDimension, String> baseUnits) {
    checkNotNull(registry);
    checkNotNull(baseUnits);
    UnitTable table = registry.getTable();
    for (BaseDimension dimension : BaseDimension.values()) {
      String symbol = baseUnits.get(dimension);
      if (StringUtils.isBlank(symbol)) {
        throw new InvalidUnitSystemException(
            String.format("Unit system has no unit for %s.", dimension));
      }
      FundamentalUnit unit = table.getFundamental(symbol);
      if (unit == null) {
        throw new NotFundamentalUnitException(symbol);
      }
      if (unit.getType() != dimension) {
        throw new InvalidUnitSystemException(String.format(
            "'%s' is of type %s and cannot be the unit for %s.", symbol, unit.getType(),
            dimension));
      }
    }
    return new UnitSystem(registry, baseUnits);
  }

  public String getBaseUnit(BaseDimension dimension) {
    return baseUnits.get(checkNotNull(dimension));
  }

  public Map<BaseDimension, String> getBaseUnits() {
    return baseUnits;
  }

  /**
   * Renders the unit string this system expresses {@code dimensions} in: the unit of each
   * dimension with a nonzero exponent, raised to that exponent, in dimension order.
   */
  public String unitsFor(DimensionVector dimensions) {
    checkNotNull(dimensions);
    List<String> terms = Lists.newArrayList();
    for (BaseDimension dimension : BaseDimension.values()) {
      double exponent = dimensions.get(dimension);
      if (exponent == 0) {
        continue;
      }
      String symbol = baseUnits.get(dimension);
      terms.add(exponent == 1 ? symbol : symbol + "^" + UnitAlgebra.formatPower(exponent));
    }
    return TERM_JOINER.join(terms);
  }

  public Unit unitFor(DimensionVector dimensions) {
    return registry.unit(unitsFor(dimensions));
  }

  /**
   * Returns a copy of this system with {@code units} assigned to {@code dimension}.
   */
  public UnitSystem withBaseUnit(BaseDimension dimension, String units) {
    return builder(registry).copyFrom(this).baseUnit(dimension, units).build();
  }

  @Override
  public boolean equals(Object o) {
    if (o == this) { return true; }
    if (!(o instanceof UnitSystem)) { return false; }
    return baseUnits.equals(((UnitSystem) o).baseUnits);
  }

  @Override
  public int hashCode() {
    return baseUnits.hashCode();
  }

  @Override
  public String toString() {
    return baseUnits.toString();
  }

  /**
   * Builds a unit system from a predefined system, or a copy of another system, with some of its
   * units replaced.  Without either the SI system is the base.
   */
  public static class Builder {
    private final UnitRegistry registry;
    private String basedOn;
    private UnitSystem copyFrom;
    private final Map<BaseDimension, String> overrides =
        new EnumMap<BaseDimension, String>(BaseDimension.class);
    private final List<String> units = Lists.newArrayList();

    private Builder(UnitRegistry registry) {
      this.registry = checkNotNull(registry);
    }

    public Builder basedOn(String name) {
      checkArgument(StringUtils.isNotBlank(name), "Unit system name must not be blank");
      this.basedOn = name;
      return this;
    }

    public Builder copyFrom(UnitSystem copyFrom) {
      this.copyFrom = checkNotNull(copyFrom);
      return this;
    }

    public Builder baseUnit(BaseDimension dimension, String units) {
      overrides.put(checkNotNull(dimension), checkNotNull(units));
      return this;
    }

    public Builder baseUnits(Map<BaseDimension, String> baseUnits) {
      for (Map.Entry<BaseDimension, String> entry : baseUnits.entrySet()) {
        baseUnit(entry.getKey(), entry.getValue());
      }
      return this;
    }

    /**
     * Replaces units by type: each unit takes the slot of its own dimension.
     */
    public Builder units(String... units) {
      for (String unit : units) {
        this.units.add(checkNotNull(unit));
      }
      return this;
    }

    /**
     * @throws ExcessiveParametersException if both a predefined system and a copy are given
     * @throws InvalidUnitSystemException if the predefined system does not exist or a unit does
     *     not fit its dimension
     * @throws NotFundamentalUnitException if a unit is not fundamental
     * @throws DuplicateDimensionTypeException if two listed units share a dimension
     */
    public UnitSystem build() {
      if (basedOn != null && copyFrom != null) {
        throw new ExcessiveParametersException(
            "Unit system accepts either a predefined system or a system to copy, not both.");
      }

      Map<BaseDimension, String> assignment =
          new EnumMap<BaseDimension, String>(BaseDimension.class);
      if (copyFrom != null) {
        assignment.putAll(copyFrom.baseUnits);
      } else {
        String name = basedOn != null ? basedOn : DEFAULT_SYSTEM;
        Map<BaseDimension, String> predefined = registry.getTable().getUnitSystem(name);
        if (predefined == null) {
          throw new InvalidUnitSystemException(
              String.format("'%s' is not a predefined unit system.", name));
        }
        assignment.putAll(predefined);
      }
      assignment.putAll(overrides);

      UnitTable table = registry.getTable();
      Map<BaseDimension, String> byType =
          new EnumMap<BaseDimension, String>(BaseDimension.class);
      for (String symbol : units) {
        FundamentalUnit unit = table.getFundamental(symbol);
        if (unit == null) {
          throw new NotFundamentalUnitException(symbol);
        }
        String previous = byType.put(unit.getType(), symbol);
        if (previous != null) {
          throw new DuplicateDimensionTypeException(unit.getType(), previous, symbol);
        }
      }
      assignment.putAll(byType);

      return validate(registry, assignment);
    }
  }
}
