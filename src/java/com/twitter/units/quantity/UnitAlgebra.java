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
import java.util.Map;

import com.google.common.base.Joiner;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

import com.twitter.units.parse.UnitTerm;
import com.twitter.units.parse.UnitTermParser;
import com.twitter.units.parse.UnitTermParser.SymbolPower;
import com.twitter.units.table.BaseDimension;
import com.twitter.units.table.FundamentalUnit;
import com.twitter.units.table.UnitTable;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * String algebra over compound unit strings.
 *
 * <p>Terms are combined by their symbol as written, prefix included: {@code km m} condenses to
 * itself since folding it to {@code m^2} would lose the kilo.
 */
public final class UnitAlgebra {

  private static final Joiner TERM_JOINER = Joiner.on(' ');

  private UnitAlgebra() {
    // utility
  }

  /**
   * Collects like terms: powers of repeated symbols are summed, terms whose power sums to zero
   * are dropped and the rest are rendered in order of first appearance.
   *
   * <pre>
   *   condense("m m m m")             == "m^4"
   *   condense("kg ft^3 kg^-2")       == "kg^-1 ft^3"
   *   condense("s^2 s^-2")            == ""
   * </pre>
   *
   * @param units A compound unit string.
   * @return The condensed unit string; empty if every term cancels.
   * @throws com.twitter.units.parse.UnknownUnitException if a power is malformed
   */
  public static String condense(String units) {
    Map<String, Double> powers = Maps.newLinkedHashMap();
    for (String token : UnitTermParser.tokenize(units)) {
      SymbolPower term = UnitTermParser.splitPower(token);
      Double sum = powers.get(term.getSymbol());
      powers.put(term.getSymbol(), sum == null ? term.getPower() : sum + term.getPower());
    }
    return render(powers);
  }

  private static String render(Map<String, Double> powers) {
    List<String> terms = Lists.newArrayList();
    for (Map.Entry<String, Double> entry : powers.entrySet()) {
      double power = entry.getValue();
      if (power == 0) {
        continue;
      }
      terms.add(power == 1 ? entry.getKey() : entry.getKey() + "^" + formatPower(power));
    }
    return TERM_JOINER.join(terms);
  }

  /**
   * Renders a power the way unit strings write it: whole numbers without a decimal point.
   */
  public static String formatPower(double power) {
    if (power == Math.rint(power) && !Double.isInfinite(power)
        && Math.abs(power) < Long.MAX_VALUE) {
      return Long.toString((long) power);
    }
    return Double.toString(power);
  }

  /**
   * Returns the condensed unit string of the product of two units.
   */
  public static String multiply(String left, String right) {
    return condense(left + " " + right);
  }

  /**
   * Returns the condensed unit string of the quotient of two units.
   */
  public static String divide(String left, String right) {
    return condense(left + " " + power(right, -1));
  }

  /**
   * Returns the condensed unit string of {@code units} raised to {@code power}.
   */
  public static String power(String units, double power) {
    Map<String, Double> powers = Maps.newLinkedHashMap();
    for (String token : UnitTermParser.tokenize(units)) {
      SymbolPower term = UnitTermParser.splitPower(token);
      Double sum = powers.get(term.getSymbol());
      double scaled = term.getPower() * power;
      powers.put(term.getSymbol(), sum == null ? scaled : sum + scaled);
    }
    return render(powers);
  }

  /**
   * Classifies a unit string.
   *
   * <p>The empty string has no type, a bare fundamental symbol has its dimension's type and a
   * bare derived symbol is derived.  In any other string a term whose symbol, after removing a
   * prefix, is an absolute temperature unit makes the string an absolute temperature when it has
   * no explicit power, and a temperature difference otherwise.  A temperature difference term
   * always makes the string a temperature difference.  Terms are matched by exact symbol, so a
   * symbol that merely ends in a temperature letter does not count.
   *
   * @param units A compound unit string.
   * @param table The table symbols are looked up in.
   * @return The classification.
   * @throws com.twitter.units.parse.UnknownUnitException if a term is not a known unit
   */
  public static UnitType typeOf(String units, UnitTable table) {
    checkNotNull(table);
    String trimmed = checkNotNull(units).trim();
    if (trimmed.isEmpty()) {
      return UnitType.NO_TYPE;
    }
    FundamentalUnit fundamental = table.getFundamental(trimmed);
    if (fundamental != null) {
      return UnitType.of(fundamental.getType());
    }
    if (table.getDerived(trimmed) != null) {
      return UnitType.DERIVED;
    }

    boolean temperature = false;
    boolean difference = false;
    for (UnitTerm term : new UnitTermParser(table).parseAll(trimmed)) {
      FundamentalUnit unit = table.getFundamental(term.getBase());
      if (unit == null) {
        continue;
      }
      if (unit.getType() == BaseDimension.TEMPERATURE_DIFFERENCE) {
        difference = true;
      } else if (unit.getType() == BaseDimension.TEMPERATURE) {
        if (term.hasExplicitPower()) {
          difference = true;
        } else {
          temperature = true;
        }
      }
    }
    if (difference) {
      return UnitType.TEMPERATURE_DIFFERENCE;
    }
    return temperature ? UnitType.TEMPERATURE : UnitType.COMPOSITE;
  }
}
