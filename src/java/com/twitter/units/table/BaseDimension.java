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

/**
 * The orthogonal physical dimensions that every unit is ultimately expressed in.  The declaration
 * order is significant: it is the order of exponents in a
 * {@link com.twitter.units.quantity.DimensionVector} and the order in which unit systems render
 * compound units.
 */
public enum BaseDimension {
  MASS,
  LENGTH,
  TIME,
  TEMPERATURE,
  TEMPERATURE_DIFFERENCE,
  ANGLE,
  CHEMICAL_AMOUNT,
  LIGHT,
  CURRENT,
  SOLID_ANGLE;

  /**
   * Returns the number of base dimensions.
   */
  public static int count() {
    return values().length;
  }
}
