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
 * A directly defined unit: one base dimension, a factor to the SI representative of that
 * dimension and an additive SI offset.  The offset is nonzero only for absolute temperature scales
 * whose zero is not absolute zero, so that {@code si = (value + offset) * factor}.
 */
public final class FundamentalUnit {

  private final String symbol;
  private final BaseDimension type;
  private final double factor;
  private final double offset;

  private FundamentalUnit(String symbol, BaseDimension type, double factor, double offset) {
    checkArgument(!StringUtils.isBlank(symbol), "A fundamental unit needs a symbol");
    checkArgument(!StringUtils.containsAny(symbol, " ^"),
        "Unit symbol '%s' may not contain whitespace or '^'", symbol);
    checkArgument(factor > 0, "Unit %s must have a positive SI factor, got %s", symbol, factor);
    this.symbol = symbol;
    this.type = checkNotNull(type);
    this.factor = factor;
    this.offset = offset;
  }

  /**
   * Creates a fundamental unit.
   *
   * @param symbol the symbol the unit is written as
   * @param type the base dimension the unit measures
   * @param factor the SI scaling factor
   * @param offset the SI offset
   * @return a new fundamental unit
   */
  public static FundamentalUnit of(String symbol, BaseDimension type, double factor,
      double offset) {
    return new FundamentalUnit(symbol, type, factor, offset);
  }

  public static FundamentalUnit of(String symbol, BaseDimension type, double factor) {
    return of(symbol, type, factor, 0);
  }

  public String getSymbol() {
    return symbol;
  }

  public BaseDimension getType() {
    return type;
  }

  public double getFactor() {
    return factor;
  }

  public double getOffset() {
    return offset;
  }

  /**
   * Returns {@code true} if this unit can stand for its whole dimension in SI strings, that is, it
   * converts to SI with no scaling and no offset.
   */
  public boolean isSiRepresentative() {
    return factor == 1.0 && offset == 0.0;
  }

  @Override
  public boolean equals(Object o) {
    if (o == this) { return true; }
    if (!(o instanceof FundamentalUnit)) { return false; }

    FundamentalUnit that = (FundamentalUnit) o;
    return new EqualsBuilder()
        .append(this.symbol, that.symbol)
        .append(this.type, that.type)
        .append(this.factor, that.factor)
        .append(this.offset, that.offset)
        .isEquals();
  }

  @Override
  public int hashCode() {
    return new HashCodeBuilder()
        .append(symbol)
        .append(type)
        .append(factor)
        .append(offset)
        .toHashCode();
  }

  @Override
  public String toString() {
    return String.format("%s(%s, factor=%s, offset=%s)", symbol, type, factor, offset);
  }
}
