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

package com.twitter.units.parse;

import java.util.List;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;

import com.twitter.units.table.MultiplierPrefix;
import com.twitter.units.table.UnitTable;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Splits compound unit strings into {@link UnitTerm}s against a {@link UnitTable}.
 *
 * <p>A term is {@code [prefix]symbol[^power]}.  The power may be negative, decimal
 * ({@code ^0.5}) or a ratio ({@code ^1/2}) and defaults to 1.  A term that is exactly a unit
 * symbol never has a prefix, so {@code Pa} is pascal and {@code h} is hour.  Otherwise the table's
 * prefixes are tried in table order and the first one whose remainder is a unit symbol wins:
 * with the default table {@code da} is tried before {@code d}.
 */
public class UnitTermParser {

  private static final char POWER = '^';

  private static final Splitter TERM_SPLITTER =
      Splitter.on(CharMatcher.whitespace()).omitEmptyStrings();

  private final UnitTable table;

  public UnitTermParser(UnitTable table) {
    this.table = checkNotNull(table);
  }

  /**
   * Splits a compound unit string into its whitespace-delimited terms.  Blank strings have no
   * terms.
   */
  public static List<String> tokenize(String units) {
    checkNotNull(units);
    return ImmutableList.copyOf(TERM_SPLITTER.split(units));
  }

  /**
   * Parses every term of a compound unit string.
   *
   * @throws UnknownUnitException if any term is not a known unit
   */
  public List<UnitTerm> parseAll(String units) {
    ImmutableList.Builder<UnitTerm> terms = ImmutableList.builder();
    for (String token : tokenize(units)) {
      terms.add(parse(token));
    }
    return terms.build();
  }

  /**
   * Parses one term, eg: {@code kPa^-2}.
   *
   * @throws UnknownUnitException if the term is not a known unit or its power is malformed
   */
  public UnitTerm parse(String token) {
    checkNotNull(token);
    int caret = token.indexOf(POWER);
    String symbol = caret < 0 ? token : token.substring(0, caret);
    double power = caret < 0 ? 1.0 : parsePower(token, token.substring(caret + 1));

    if (table.isUnitSymbol(symbol)) {
      return new UnitTerm("", symbol, power, caret >= 0);
    }
    for (MultiplierPrefix prefix : table.getMultipliers()) {
      String multiplier = prefix.getSymbol();
      if (symbol.length() > multiplier.length() && symbol.startsWith(multiplier)) {
        String base = symbol.substring(multiplier.length());
        if (table.isUnitSymbol(base)) {
          return new UnitTerm(multiplier, base, power, caret >= 0);
        }
      }
    }
    throw new UnknownUnitException(symbol.isEmpty() ? token : symbol);
  }

  /**
   * Splits a term into its symbol and power without consulting a table.
   *
   * @param token A single term such as {@code km^2}.
   * @return The symbol as written and its power.
   * @throws UnknownUnitException if the power is malformed
   */
  public static SymbolPower splitPower(String token) {
    checkNotNull(token);
    int caret = token.indexOf(POWER);
    if (caret < 0) {
      return new SymbolPower(token, 1.0);
    }
    return new SymbolPower(token.substring(0, caret),
        parsePower(token, token.substring(caret + 1)));
  }

  private static double parsePower(String token, String power) {
    double value;
    try {
      int slash = power.indexOf('/');
      value = slash < 0
          ? Double.parseDouble(power)
          : Double.parseDouble(power.substring(0, slash))
              / Double.parseDouble(power.substring(slash + 1));
    } catch (NumberFormatException e) {
      throw new UnknownUnitException(token, e);
    }
    if (Double.isNaN(value) || Double.isInfinite(value)) {
      throw new UnknownUnitException(token);
    }
    return value;
  }

  /**
   * A unit symbol as written together with its power.
   */
  public static final class SymbolPower {
    private final String symbol;
    private final double power;

    SymbolPower(String symbol, double power) {
      this.symbol = symbol;
      this.power = power;
    }

    public String getSymbol() {
      return symbol;
    }

    public double getPower() {
      return power;
    }
  }
}
