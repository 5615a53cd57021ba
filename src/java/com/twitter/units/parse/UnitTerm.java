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

import org.apache.commons.lang.builder.EqualsBuilder;
import org.apache.commons.lang.builder.HashCodeBuilder;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * One parsed term of a compound unit string: an optional multiplier prefix, a unit symbol and the
 * power the term is raised to.  {@code kPa^-2} parses to ({@code k}, {@code Pa}, -2).
 */
public final class UnitTerm {

  private final String multiplier;
  private final String base;
  private final double power;
  private final boolean explicitPower;

  UnitTerm(String multiplier, String base, double power, boolean explicitPower) {
    this.multiplier = checkNotNull(multiplier);
    this.base = checkNotNull(base);
    this.power = power;
    this.explicitPower = explicitPower;
  }

  /**
   * Returns the multiplier prefix symbol, or the empty string if the term has none.
   */
  public String getMultiplier() {
    return multiplier;
  }

  public boolean hasMultiplier() {
    return !multiplier.isEmpty();
  }

  /**
   * Returns the fundamental or derived unit symbol.
   */
  public String getBase() {
    return base;
  }

  public double getPower() {
    return power;
  }

  /**
   * Returns {@code true} if the power was written out with {@code ^}, even as {@code ^1}.
   */
  public boolean hasExplicitPower() {
    return explicitPower;
  }

  /**
   * Returns the symbol as written, prefix included and power excluded.
   */
  public String getSymbol() {
    return multiplier + base;
  }

  @Override
  public boolean equals(Object o) {
    if (o == this) { return true; }
    if (!(o instanceof UnitTerm)) { return false; }

    UnitTerm that = (UnitTerm) o;
    return new EqualsBuilder()
        .append(this.multiplier, that.multiplier)
        .append(this.base, that.base)
        .append(this.power, that.power)
        .append(this.explicitPower, that.explicitPower)
        .isEquals();
  }

  @Override
  public int hashCode() {
    return new HashCodeBuilder()
        .append(multiplier)
        .append(base)
        .append(power)
        .append(explicitPower)
        .toHashCode();
  }

  @Override
  public String toString() {
    return String.format("(%s, %s, %s)", multiplier, base, power);
  }
}
