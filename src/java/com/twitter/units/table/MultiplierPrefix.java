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

import com.google.common.base.Preconditions;

import org.apache.commons.lang.builder.EqualsBuilder;
import org.apache.commons.lang.builder.HashCodeBuilder;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * A scale-modifying prefix that may precede most unit symbols, eg: {@code k} for 1000.
 */
public final class MultiplierPrefix {

  private final String symbol;
  private final double factor;

  private MultiplierPrefix(String symbol, double factor) {
    this.symbol = Preconditions.checkNotNull(symbol);
    checkArgument(!symbol.isEmpty(), "A multiplier prefix needs a symbol");
    checkArgument(factor > 0, "Multiplier %s must scale by a positive factor, got %s",
        symbol, factor);
    this.factor = factor;
  }

  public static MultiplierPrefix of(String symbol, double factor) {
    return new MultiplierPrefix(symbol, factor);
  }

  public String getSymbol() {
    return symbol;
  }

  public double getFactor() {
    return factor;
  }

  @Override
  public boolean equals(Object o) {
    if (o == this) { return true; }
    if (!(o instanceof MultiplierPrefix)) { return false; }

    MultiplierPrefix that = (MultiplierPrefix) o;
    return new EqualsBuilder()
        .append(this.symbol, that.symbol)
        .append(this.factor, that.factor)
        .isEquals();
  }

  @Override
  public int hashCode() {
    return new HashCodeBuilder()
        .append(symbol)
        .append(factor)
        .toHashCode();
  }

  @Override
  public String toString() {
    return String.format("%s=%s", symbol, factor);
  }
}
