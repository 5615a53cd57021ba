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

import org.apache.commons.lang.StringUtils;
import org.apache.commons.lang.builder.EqualsBuilder;
import org.apache.commons.lang.builder.HashCodeBuilder;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A unit defined as a composition of other units times a factor, eg: {@code N = 1 kg m s^-2}.
 * Compositions may reference other derived units.
 */
public final class DerivedUnit {

  private final String symbol;
  private final String composition;
  private final double factor;

  private DerivedUnit(String symbol, String composition, double factor) {
    checkArgument(!StringUtils.isBlank(symbol), "A derived unit needs a symbol");
    checkArgument(!StringUtils.containsAny(symbol, " ^"),
        "Unit symbol '%s' may not contain whitespace or '^'", symbol);
    checkNotNull(composition);
    checkArgument(factor > 0, "Unit %s must have a positive factor, got %s", symbol, factor);
    this.symbol = symbol;
    this.composition = composition.trim();
    this.factor = factor;
  }

  public static DerivedUnit of(String symbol, String composition, double factor) {
    return new DerivedUnit(symbol, composition, factor);
  }

  public static DerivedUnit of(String symbol, String composition) {
    return of(symbol, composition, 1);
  }

  public String getSymbol() {
    return symbol;
  }

  public String getComposition() {
    return composition;
  }

  public double getFactor() {
    return factor;
  }

  @Override
  public boolean equals(Object o) {
    if (o == this) { return true; }
    if (!(o instanceof DerivedUnit)) { return false; }

    DerivedUnit that = (DerivedUnit) o;
    return new EqualsBuilder()
        .append(this.symbol, that.symbol)
        .append(this.composition, that.composition)
        .append(this.factor, that.factor)
        .isEquals();
  }

  @Override
  public int hashCode() {
    return new HashCodeBuilder()
        .append(symbol)
        .append(composition)
        .append(factor)
        .toHashCode();
  }

  @Override
  public String toString() {
    return String.format("%s = %s %s", symbol, factor, composition);
  }
}
