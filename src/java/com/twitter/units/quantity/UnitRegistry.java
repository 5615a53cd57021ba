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

import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Logger;

import javax.annotation.Nullable;

import com.google.common.base.Throwables;
import com.google.common.cache.CacheBuilder;
import com.google.common.cache.CacheLoader;
import com.google.common.cache.LoadingCache;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.util.concurrent.UncheckedExecutionException;

import com.twitter.units.parse.UnknownUnitException;
import com.twitter.units.table.DerivedUnit;
import com.twitter.units.table.FundamentalUnit;
import com.twitter.units.table.UnitConfigurationException;
import com.twitter.units.table.UnitTable;
import com.twitter.units.table.UnitTableLoader;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Resolves unit strings to {@link Unit}s against a {@link UnitTable}, and is the entry point
 * quantities, unit systems and quantity maps are created through.
 *
 * <p>Lookups are lock-free reads of an immutable table snapshot and may run concurrently.
 * Registering a unit replaces the snapshot, together with its cache of resolved units,
 * copy-on-write under the registry's lock; each symbol can be registered at most once.
 */
public class UnitRegistry {

  private static final Logger LOG = Logger.getLogger(UnitRegistry.class.getName());

  private static final int DEFAULT_CACHE_SIZE = 1024;

  /**
   * Thrown when a preferred unit is added while another preferred unit has the same dimensions.
   */
  public static class RequiresUniqueDimensionsException extends IllegalArgumentException {
    public RequiresUniqueDimensionsException(Unit unit, Unit existing) {
      super(String.format("For '%s' to be added '%s' must be removed.",
          unit.getName(), existing.getName()));
    }
  }

  // The table, its resolver and the units resolved against it are swapped together, so a lookup
  // racing a registration can only populate the cache of the snapshot it started on.
  private final class Snapshot {
    final UnitTable table;
    final SiResolver resolver;
    final LoadingCache<String, Unit> cache;

    Snapshot(UnitTable table) {
      this.table = table;
      this.resolver = new SiResolver(table);
      this.cache = CacheBuilder.newBuilder()
          .maximumSize(cacheSize)
          .build(new CacheLoader<String, Unit>() {
            @Override public Unit load(String units) {
              return resolve(Snapshot.this, units);
            }
          });
    }
  }

  private final int cacheSize;
  private volatile Snapshot snapshot;
  private final List<Unit> preferredUnits = new CopyOnWriteArrayList<Unit>();

  /**
   * Creates a registry over {@code table}.
   *
   * @param table The unit table to resolve against.
   * @throws UnitConfigurationException if a derived unit of the table cannot be expanded
   */
  public UnitRegistry(UnitTable table) {
    this(table, DEFAULT_CACHE_SIZE);
  }

  /**
   * Creates a registry over {@code table} that caches at most {@code cacheSize} resolved units.
   */
  public UnitRegistry(UnitTable table, int cacheSize) {
    checkArgument(cacheSize > 0, "cacheSize must be positive");
    this.cacheSize = cacheSize;
    Snapshot initial = new Snapshot(checkNotNull(table));
    for (DerivedUnit derived : table.getDerivedUnits()) {
      validate(initial, derived);
    }
    this.snapshot = initial;
  }

  /**
   * Creates a registry over the unit table bundled with this library.
   */
  public static UnitRegistry createDefault() {
    return new UnitRegistry(UnitTableLoader.loadDefault());
  }

  private static void validate(Snapshot snapshot, DerivedUnit derived) {
    try {
      snapshot.resolver.resolve(derived.getSymbol());
    } catch (UnknownUnitException e) {
      throw new UnitConfigurationException(String.format(
          "Derived unit '%s' references unknown unit '%s'.", derived.getSymbol(), e.getTerm()), e);
    }
  }

  /**
   * Returns the current unit table.
   */
  public UnitTable getTable() {
    return snapshot.table;
  }

  /**
   * Resolves a unit string.
   *
   * @param units A compound unit string such as {@code kg m^-3}; blank means dimensionless.
   * @return The resolved unit.
   * @throws UnknownUnitException if any term is not a known unit
   */
  public Unit unit(String units) {
    checkNotNull(units);
    try {
      return snapshot.cache.getUnchecked(units.trim());
    } catch (UncheckedExecutionException e) {
      Throwables.throwIfUnchecked(e.getCause());
      throw e;
    }
  }

  private Unit resolve(Snapshot current, String units) {
    LOG.fine("Resolving unit string '" + units + "'");
    String name = UnitAlgebra.condense(units);
    SiResolver.Resolution resolution = current.resolver.resolve(units);
    return new Unit(this, name, resolution, UnitAlgebra.typeOf(name, current.table));
  }

  /**
   * Returns a dimensionless unit.
   */
  public Unit dimensionless() {
    return unit("");
  }

  /**
   * Creates a scalar quantity.
   */
  public Quantity quantity(double value, String units) {
    return Quantity.builder(this).value(value).units(units).build();
  }

  /**
   * Returns the predefined unit system called {@code name}.
   *
   * @throws UnitSystem.InvalidUnitSystemException if the table has no such system
   */
  public UnitSystem unitSystem(String name) {
    return UnitSystem.builder(this).basedOn(name).build();
  }

  Set<String> compatibleUnits(Unit unit) {
    ImmutableSet.Builder<String> compatible = ImmutableSet.builder();
    for (String symbol : getTable().getSymbols()) {
      if (!symbol.equals(unit.getName())
          && unit(symbol).getDimensions().equals(unit.getDimensions())) {
        compatible.add(symbol);
      }
    }
    return compatible.build();
  }

  /**
   * Adds a fundamental unit to the table.
   *
   * @param unit The unit to add.
   * @throws UnitTable.UnitAlreadyRegisteredException if the symbol is already defined
   */
  public synchronized void registerFundamental(FundamentalUnit unit) {
    swap(new Snapshot(snapshot.table.withFundamental(unit)));
    LOG.info("Registered fundamental unit " + unit);
  }

  /**
   * Adds a derived unit to the table.  Its composition must resolve against the table.
   *
   * @param unit The unit to add.
   * @throws UnitTable.UnitAlreadyRegisteredException if the symbol is already defined
   * @throws UnitConfigurationException if the composition does not resolve
   */
  public synchronized void registerDerived(DerivedUnit unit) {
    Snapshot next = new Snapshot(snapshot.table.withDerived(unit));
    validate(next, unit);
    swap(next);
    LOG.info("Registered derived unit " + unit);
  }

  // A new symbol can change how a prefixed term splits, so units resolve afresh in the new
  // snapshot.
  private void swap(Snapshot next) {
    snapshot = next;
  }

  /**
   * Adds preferred units.  Quantities built with {@link Quantity#builder(UnitRegistry)} whose
   * dimensions match a preferred unit are converted into it.
   *
   * @throws RequiresUniqueDimensionsException if a preferred unit with the same dimensions exists
   */
  public synchronized void preferUnits(String... units) {
    for (String name : units) {
      Unit unit = unit(name);
      Unit existing = getPreferredUnit(unit.getDimensions());
      if (existing == null) {
        preferredUnits.add(unit);
      } else if (!existing.equals(unit)) {
        throw new RequiresUniqueDimensionsException(unit, existing);
      }
    }
  }

  /**
   * Removes preferred units; units that are not preferred are ignored.
   */
  public synchronized void removePreferredUnits(String... units) {
    for (String name : units) {
      preferredUnits.remove(unit(name));
    }
  }

  public List<Unit> getPreferredUnits() {
    return ImmutableList.copyOf(preferredUnits);
  }

  @Nullable
  Unit getPreferredUnit(DimensionVector dimensions) {
    for (Unit unit : preferredUnits) {
      if (unit.getDimensions().equals(dimensions)) {
        return unit;
      }
    }
    return null;
  }
}
