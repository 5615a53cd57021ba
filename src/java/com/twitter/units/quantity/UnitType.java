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

import com.twitter.units.table.BaseDimension;

/**
 * Classifies a unit string.  A bare fundamental symbol takes the type of its base dimension, a
 * bare derived symbol is {@link #DERIVED}, and compound strings are {@link #COMPOSITE} unless they
 * carry a temperature term, in which case they are {@link #TEMPERATURE} or
 * {@link #TEMPERATURE_DIFFERENCE}.
 */
public enum UnitType {
  NO_TYPE("No Type"),
  COMPOSITE("Composite"),
  DERIVED("Derived"),
  MASS("Mass"),
  LENGTH("Length"),
  TIME("Time"),
  TEMPERATURE("Temperature"),
  TEMPERATURE_DIFFERENCE("Temperature Difference"),
  ANGLE("Angle"),
  CHEMICAL_AMOUNT("Chemical Amount"),
  LIGHT("Light"),
  CURRENT("Current"),
  SOLID_ANGLE("Solid Angle");

  private final String display;

  private UnitType(String display) {
    this.display = display;
  }

  /**
   * Returns the type of a bare fundamental unit measuring {@code dimension}.
   */
  public static UnitType of(BaseDimension dimension) {
    return valueOf(dimension.name());
  }

  @Override
  public String toString() {
    return display;
  }
}
