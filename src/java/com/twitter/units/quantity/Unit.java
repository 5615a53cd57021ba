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

import java.util.Set;

import javax.annotation.Nullable;

import org.apache.commons.lang.builder.EqualsBuilder;
import org.apache.commons.lang.builder.HashCodeBuilder;

import com.twitter.units.parse.UnitTerm;
import com.twitter.units.table.BaseDimension;
import com.twitter.units.table.FundamentalUnit;

/**
 * A resolved unit: its canonical (condensed) name together with everything needed to convert
 * values in it to SI.  Units are immutable and created only by a {@link UnitRegistry}, which
 * caches them by unit string.
 */
public final class Unit {

  /**
   * Prefix that names the difference counterpart of an absolute temperature unit, eg:
   * {@code delta_C} for {@code C}.
   */
  public static final String DIFFERENCE_PREFIX = "delta_";

  private final UnitRegistry registry;
  private final String name;
  private final String siUnits;
  private final double siScale;
  private final double siOffset;
  private final DimensionVector dimensions;
  private final UnitType type;
  @Nullable private final UnitTerm bareFundamental;

  Unit(UnitRegistry registry, String name, SiResolver.Resolution resolution, UnitType type) {
    this.registry = registry;
    this.name = name;
    this.siUnits = resolution.getSiUnits();
    this.siScale = resolution.getScale();
    this.siOffset = resolution.getOffset();
    this.dimensions = resolution.getDimensions();
    this.type = type;
    this.bareFundamental = resolution.getBareFundamental();
  }

  /**
   * Returns the canonical unit string, eg: {@code kg^-1 ft^3}.
   */
  public String getName() {
    return name;
  }

  /**
   * Returns the equivalent unit string over SI representative units.
   */
  public String getSiUnits() {
    return siUnits;
  }

  /**
   * Returns the factor that takes values in this unit to SI, after the offset is applied.
   */
  public double getSiScale() {
    return siScale;
  }

  /**
   * Returns the offset added to values in this unit before scaling to SI.
   */
  public double getSiOffset() {
    return siOffset;
  }

  public DimensionVector getDimensions() {
    return dimensions;
  }

  public UnitType getType() {
    return type;
  }

  public boolean isDimensionless() {
    return dimensions.isDimensionless();
  }

  UnitRegistry getRegistry() {
    return registry;
  }

  /**
   * Returns {@code true} if this unit is a single absolute temperature symbol with no power, like
   * {@code C} or {@code mK}.
   */
  public boolean isAbsoluteTemperature() {
    return isBare(BaseDimension.TEMPERATURE);
  }

  /**
   * Returns {@code true} if this unit is a single temperature difference symbol with no power,
   * like {@code delta_C} or {@code mdelta_K}.
   */
  public boolean isTemperatureDifference() {
    return isBare(BaseDimension.TEMPERATURE_DIFFERENCE);
  }

  private boolean isBare(BaseDimension dimension) {
    return bareFundamental != null
        && registry.getTable().getFundamental(bareFundamental.getBase()).getType() == dimension;
  }

  /**
   * Returns {@code true} if both units are absolute temperatures on the same scale, whatever
   * their prefixes: {@code mK} and {@code K} share a scale, {@code K} and {@code C} do not.
   */
  boolean isSameScale(Unit other) {
    return isAbsoluteTemperature() && other.isAbsoluteTemperature()
        && bareFundamental.getBase().equals(other.bareFundamental.getBase());
  }

  /**
   * Returns the temperature difference unit matching this absolute temperature unit, or
   * {@code null} if this is not an absolute temperature unit or the table has no counterpart.
   * Prefixes carry over, so {@code mK} gives {@code mdelta_K}.
   */
  @Nullable
  public Unit getDifferenceCounterpart() {
    if (!isAbsoluteTemperature()) {
      return null;
    }
    FundamentalUnit counterpart =
        registry.getTable().getFundamental(DIFFERENCE_PREFIX + bareFundamental.getBase());
    if (counterpart == null || counterpart.getType() != BaseDimension.TEMPERATURE_DIFFERENCE) {
      return null;
    }
    return registry.unit(bareFundamental.getMultiplier() + counterpart.getSymbol());
  }

  /**
   * Returns the symbols of every table unit, other than this one, with this unit's dimensions.
   */
  public Set<String> compatibleUnits() {
    return registry.compatibleUnits(this);
  }

  public Unit multiply(Unit other) {
    return registry.unit(UnitAlgebra.multiply(name, other.name));
  }

  public Unit divide(Unit other) {
    return registry.unit(UnitAlgebra.divide(name, other.name));
  }

  public Unit power(double power) {
    return registry.unit(UnitAlgebra.power(name, power));
  }

  @Override
  public boolean equals(Object o) {
    if (o == this) { return true; }
    if (!(o instanceof Unit)) { return false; }

    Unit that = (Unit) o;
    return new EqualsBuilder()
        .append(this.name, that.name)
        .append(this.siScale, that.siScale)
        .append(this.siOffset, that.siOffset)
        .append(this.dimensions, that.dimensions)
        .isEquals();
  }

  @Override
  public int hashCode() {
    return new HashCodeBuilder()
        .append(name)
        .append(siScale)
        .append(siOffset)
        .append(dimensions)
        .toHashCode();
  }

  @Override
  public String toString() {
    return name;
  }
}
