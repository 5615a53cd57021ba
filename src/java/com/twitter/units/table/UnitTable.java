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

package com.twitter.units.table;

import java.util.Collection;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

import javax.annotation.Nullable;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Maps;

import org.apache.commons.lang.StringUtils;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * The read-only data every unit computation is driven by: multiplier prefixes, fundamental units,
 * derived units, predefined unit systems and quantity names.
 *
 * <p>Tables are immutable.  Extension is copy-on-write through {@link #withFundamental} and
 * {@link #withDerived}, which return a new table and refuse to replace an existing symbol.
 *
 * <p>The iteration order of {@link #getMultipliers()} is the order multipliers were added in and
 * is the order in which unit strings try to split a prefix from a symbol.
 */
public final class UnitTable {

  /**
   * Thrown when a symbol is registered that the table already defines.
   */
  public static class UnitAlreadyRegisteredException extends IllegalArgumentException {
    public UnitAlreadyRegisteredException(String symbol) {
      super(String.format("Unable to override '%s', it has already been registered.", symbol));
    }
  }

  private final ImmutableMap<String, MultiplierPrefix> multipliers;
  private final ImmutableMap<String, FundamentalUnit> fundamentalUnits;
  private final ImmutableMap<String, DerivedUnit> derivedUnits;
  private final ImmutableMap<String, ImmutableMap<BaseDimension, String>> unitSystems;
  private final ImmutableMap<String, String> quantityNames;
  private final ImmutableMap<BaseDimension, FundamentalUnit> siRepresentatives;

  private UnitTable(
      ImmutableMap<String, MultiplierPrefix> multipliers,
      ImmutableMap<String, FundamentalUnit> fundamentalUnits,
      ImmutableMap<String, DerivedUnit> derivedUnits,
      ImmutableMap<String, ImmutableMap<BaseDimension, String>> unitSystems,
      ImmutableMap<String, String> quantityNames) {

    this.multipliers = multipliers;
    this.fundamentalUnits = fundamentalUnits;
    this.derivedUnits = derivedUnits;
    this.unitSystems = unitSystems;
    this.quantityNames = quantityNames;
    this.siRepresentatives = findSiRepresentatives(fundamentalUnits.values());

    for (String symbol : derivedUnits.keySet()) {
      if (fundamentalUnits.containsKey(symbol)) {
        throw new UnitConfigurationException(
            String.format("'%s' is defined as both a fundamental and a derived unit.", symbol));
      }
    }
  }

  private static ImmutableMap<BaseDimension, FundamentalUnit> findSiRepresentatives(
      Collection<FundamentalUnit> units) {

    Map<BaseDimension, FundamentalUnit> representatives =
        new EnumMap<BaseDimension, FundamentalUnit>(BaseDimension.class);
    Set<BaseDimension> used = EnumSet.noneOf(BaseDimension.class);
    for (FundamentalUnit unit : units) {
      used.add(unit.getType());
      if (unit.isSiRepresentative() && !representatives.containsKey(unit.getType())) {
        representatives.put(unit.getType(), unit);
      }
    }
    for (BaseDimension type : used) {
      if (!representatives.containsKey(type)) {
        throw new UnitConfigurationException(String.format(
            "No %s unit with an SI factor of 1 and no offset is defined.", type));
      }
    }
    return Maps.immutableEnumMap(representatives);
  }

  /**
   * Returns {@code true} if the symbol is a fundamental or derived unit of this table.  Prefixed
   * forms like {@code km} are not symbols.
   */
  public boolean isUnitSymbol(String symbol) {
    return fundamentalUnits.containsKey(symbol) || derivedUnits.containsKey(symbol);
  }

  @Nullable
  public FundamentalUnit getFundamental(String symbol) {
    return fundamentalUnits.get(symbol);
  }

  @Nullable
  public DerivedUnit getDerived(String symbol) {
    return derivedUnits.get(symbol);
  }

  @Nullable
  public MultiplierPrefix getMultiplier(String symbol) {
    return multipliers.get(symbol);
  }

  /**
   * Returns the multiplier prefixes in the order unit strings try them.
   */
  public Collection<MultiplierPrefix> getMultipliers() {
    return multipliers.values();
  }

  public Collection<FundamentalUnit> getFundamentalUnits() {
    return fundamentalUnits.values();
  }

  public Collection<DerivedUnit> getDerivedUnits() {
    return derivedUnits.values();
  }

  /**
   * Returns every fundamental and derived symbol, fundamentals first, each in table order.
   */
  public Set<String> getSymbols() {
    return ImmutableSet.<String>builder()
        .addAll(fundamentalUnits.keySet())
        .addAll(derivedUnits.keySet())
        .build();
  }

  /**
   * Returns the unit that stands for {@code type} in SI unit strings: the first fundamental unit
   * of that type with a factor of exactly 1 and no offset.
   *
   * @throws UnitConfigurationException if the table defines no unit for the dimension
   */
  public FundamentalUnit getSiRepresentative(BaseDimension type) {
    FundamentalUnit representative = siRepresentatives.get(type);
    if (representative == null) {
      throw new UnitConfigurationException(
          String.format("The unit table defines no %s units.", type));
    }
    return representative;
  }

  /**
   * Returns the base units of a predefined unit system, or {@code null} if there is none by that
   * name.
   */
  @Nullable
  public Map<BaseDimension, String> getUnitSystem(String name) {
    return unitSystems.get(name);
  }

  public Set<String> getUnitSystemNames() {
    return unitSystems.keySet();
  }

  /**
   * Returns the unit string a named quantity is measured in, eg: {@code Velocity -> m s^-1}, or
   * {@code null} if the name is unknown.
   */
  @Nullable
  public String getQuantityUnits(String quantityName) {
    return quantityNames.get(quantityName);
  }

  public Set<String> getQuantityNames() {
    return quantityNames.keySet();
  }

  /**
   * Returns a copy of this table that also defines {@code unit}.
   *
   * @throws UnitAlreadyRegisteredException if the symbol is already defined
   */
  public UnitTable withFundamental(FundamentalUnit unit) {
    checkNotNull(unit);
    checkUnregistered(unit.getSymbol());
    return new UnitTable(multipliers,
        ImmutableMap.<String, FundamentalUnit>builder()
            .putAll(fundamentalUnits)
            .put(unit.getSymbol(), unit)
            .build(),
        derivedUnits, unitSystems, quantityNames);
  }

  /**
   * Returns a copy of this table that also defines {@code unit}.
   *
   * @throws UnitAlreadyRegisteredException if the symbol is already defined
   */
  public UnitTable withDerived(DerivedUnit unit) {
    checkNotNull(unit);
    checkUnregistered(unit.getSymbol());
    return new UnitTable(multipliers, fundamentalUnits,
        ImmutableMap.<String, DerivedUnit>builder()
            .putAll(derivedUnits)
            .put(unit.getSymbol(), unit)
            .build(),
        unitSystems, quantityNames);
  }

  private void checkUnregistered(String symbol) {
    if (isUnitSymbol(symbol)) {
      throw new UnitAlreadyRegisteredException(symbol);
    }
  }

  @Override
  public String toString() {
    return String.format("UnitTable(%d multipliers, %d fundamental, %d derived, systems %s)",
        multipliers.size(), fundamentalUnits.size(), derivedUnits.size(), unitSystems.keySet());
  }

  /**
   * Convenience method to create a builder object.
   *
   * @return New builder.
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Accumulates already-parsed table data.  Duplicate entries are configuration errors.
   */
  public static class Builder {
    private final Map<String, MultiplierPrefix> multipliers = Maps.newLinkedHashMap();
    private final Map<String, FundamentalUnit> fundamentalUnits = Maps.newLinkedHashMap();
    private final Map<String, DerivedUnit> derivedUnits = Maps.newLinkedHashMap();
    private final Map<String, ImmutableMap<BaseDimension, String>> unitSystems =
        Maps.newLinkedHashMap();
    private final Map<String, String> quantityNames = Maps.newLinkedHashMap();

    private Builder() {
    }

    public Builder addMultiplier(MultiplierPrefix multiplier) {
      checkNotNull(multiplier);
      checkFresh(multipliers, multiplier.getSymbol(), "multiplier");
      multipliers.put(multiplier.getSymbol(), multiplier);
      return this;
    }

    public Builder addMultiplier(String symbol, double factor) {
      return addMultiplier(MultiplierPrefix.of(symbol, factor));
    }

    public Builder addFundamental(FundamentalUnit unit) {
      checkNotNull(unit);
      checkFresh(fundamentalUnits, unit.getSymbol(), "fundamental unit");
      fundamentalUnits.put(unit.getSymbol(), unit);
      return this;
    }

    public Builder addDerived(DerivedUnit unit) {
      checkNotNull(unit);
      checkFresh(derivedUnits, unit.getSymbol(), "derived unit");
      derivedUnits.put(unit.getSymbol(), unit);
      return this;
    }

    /**
     * Adds a predefined unit system.  Its contents are validated when a
     * {@code com.twitter.units.quantity.UnitSystem} is created from it.
     */
    public Builder addUnitSystem(String name, Map<BaseDimension, String> baseUnits) {
      checkArgument(!StringUtils.isBlank(name), "A unit system needs a name");
      checkNotNull(baseUnits);
      checkFresh(unitSystems, name, "unit system");
      unitSystems.put(name, Maps.immutableEnumMap(baseUnits));
      return this;
    }

    public Builder addQuantityName(String quantityName, String units) {
      checkArgument(!StringUtils.isBlank(quantityName), "A quantity needs a name");
      checkNotNull(units);
      checkFresh(quantityNames, quantityName, "quantity name");
      quantityNames.put(quantityName, units);
      return this;
    }

    private static void checkFresh(Map<String, ?> entries, String key, String kind) {
      if (entries.containsKey(key)) {
        throw new UnitConfigurationException(
            String.format("Duplicate %s '%s' in unit table.", kind, key));
      }
    }

    /**
     * Builds the table.
     *
     * @throws UnitConfigurationException if the accumulated data is inconsistent
     */
    public UnitTable build() {
      return new UnitTable(
          ImmutableMap.copyOf(multipliers),
          ImmutableMap.copyOf(fundamentalUnits),
          ImmutableMap.copyOf(derivedUnits),
          ImmutableMap.copyOf(unitSystems),
          ImmutableMap.copyOf(quantityNames));
    }
  }
}
