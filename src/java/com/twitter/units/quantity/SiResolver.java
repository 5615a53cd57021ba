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

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

import javax.annotation.Nullable;

import com.google.common.base.Joiner;
import com.google.common.collect.Lists;

import com.twitter.units.parse.UnitTerm;
import com.twitter.units.parse.UnitTermParser;
import com.twitter.units.parse.UnknownUnitException;
import com.twitter.units.table.BaseDimension;
import com.twitter.units.table.DerivedUnit;
import com.twitter.units.table.FundamentalUnit;
import com.twitter.units.table.MultiplierPrefix;
import com.twitter.units.table.UnitConfigurationException;
import com.twitter.units.table.UnitTable;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Reduces unit strings to SI: the equivalent string over SI representative units, the scale
 * factor to SI and the additive SI offset.  Derived units are expanded recursively.
 *
 * <p>The offset is nonzero only when the whole string is a single bare fundamental symbol with an
 * offset, eg: {@code C}.  Products, quotients and powers of temperatures scale but never shift.
 */
public class SiResolver {

  /**
   * Derived units nested deeper than this are treated as a malformed table.
   */
  static final int MAX_EXPANSION_DEPTH = 32;

  private static final Joiner TERM_JOINER = Joiner.on(' ');

  private final UnitTable table;
  private final UnitTermParser parser;

  public SiResolver(UnitTable table) {
    this.table = checkNotNull(table);
    this.parser = new UnitTermParser(table);
  }

  /**
   * The SI reduction of a unit string.
   */
  public static final class Resolution {
    private final String siUnits;
    private final double scale;
    private final double offset;
    private final DimensionVector dimensions;
    @Nullable private final UnitTerm bareFundamental;

    Resolution(String siUnits, double scale, double offset, DimensionVector dimensions,
        @Nullable UnitTerm bareFundamental) {
      this.siUnits = siUnits;
      this.scale = scale;
      this.offset = offset;
      this.dimensions = dimensions;
      this.bareFundamental = bareFundamental;
    }

    public String getSiUnits() {
      return siUnits;
    }

    public double getScale() {
      return scale;
    }

    public double getOffset() {
      return offset;
    }

    public DimensionVector getDimensions() {
      return dimensions;
    }

    /**
     * Returns the only term of the units if they are a single fundamental symbol, optionally
     * prefixed, with no power written out; {@code null} otherwise.
     */
    @Nullable
    public UnitTerm getBareFundamental() {
      return bareFundamental;
    }

    @Override
    public String toString() {
      return String.format("(%s, %s, %s)", siUnits, scale, offset);
    }
  }

  // Running totals of one resolution.
  private static final class Accumulator {
    final List<String> siTerms = Lists.newArrayList();
    double scale = 1.0;
    DimensionVector dimensions = DimensionVector.dimensionless();
  }

  /**
   * Resolves a unit string.
   *
   * @param units A compound unit string; blank means dimensionless.
   * @return The SI string, scale and offset of the units.
   * @throws UnknownUnitException if a term, or a term of an expanded derived unit, is unknown
   * @throws UnitConfigurationException if derived units expand into themselves
   */
  public Resolution resolve(String units) {
    String trimmed = checkNotNull(units).trim();
    Accumulator accumulator = new Accumulator();
    expand(trimmed, 1.0, accumulator, new ArrayDeque<String>());

    FundamentalUnit bare = table.getFundamental(trimmed);
    double offset = bare == null ? 0.0 : bare.getOffset();

    String siUnits = UnitAlgebra.condense(TERM_JOINER.join(accumulator.siTerms));
    return new Resolution(siUnits, accumulator.scale, offset, accumulator.dimensions,
        bareFundamental(trimmed));
  }

  @Nullable
  private UnitTerm bareFundamental(String units) {
    List<UnitTerm> terms = parser.parseAll(units);
    if (terms.size() != 1) {
      return null;
    }
    UnitTerm term = terms.get(0);
    if (term.hasExplicitPower() || table.getFundamental(term.getBase()) == null) {
      return null;
    }
    return term;
  }

  private void expand(String units, double power, Accumulator accumulator,
      Deque<String> expanding) {

    for (UnitTerm term : parser.parseAll(units)) {
      double termPower = term.getPower() * power;

      if (term.hasMultiplier()) {
        MultiplierPrefix multiplier = table.getMultiplier(term.getMultiplier());
        accumulator.scale *= Math.pow(multiplier.getFactor(), termPower);
      }

      FundamentalUnit fundamental = table.getFundamental(term.getBase());
      if (fundamental != null) {
        BaseDimension type = fundamental.getType();
        if (termPower != 0) {
          String representative = table.getSiRepresentative(type).getSymbol();
          accumulator.siTerms.add(termPower == 1
              ? representative
              : representative + "^" + UnitAlgebra.formatPower(termPower));
        }
        accumulator.scale *= Math.pow(fundamental.getFactor(), termPower);
        accumulator.dimensions =
            accumulator.dimensions.multiply(DimensionVector.of(type, termPower));
        continue;
      }

      DerivedUnit derived = table.getDerived(term.getBase());
      if (expanding.contains(derived.getSymbol())) {
        throw new UnitConfigurationException(String.format(
            "Derived unit '%s' is defined in terms of itself via %s.",
            derived.getSymbol(), expanding));
      }
      if (expanding.size() >= MAX_EXPANSION_DEPTH) {
        throw new UnitConfigurationException(String.format(
            "Derived unit '%s' nests deeper than %d levels.",
            derived.getSymbol(), MAX_EXPANSION_DEPTH));
      }
      accumulator.scale *= Math.pow(derived.getFactor(), termPower);
      expanding.push(derived.getSymbol());
      try {
        expand(derived.getComposition(), termPower, accumulator, expanding);
      } finally {
        expanding.pop();
      }
    }
  }
}
