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

import org.junit.Test;

import com.twitter.units.parse.UnknownUnitException;
import com.twitter.units.table.DerivedUnit;
import com.twitter.units.table.UnitTable;
import com.twitter.units.table.UnitTableLoader;

import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;

public class UnitAlgebraTest {

  private static final UnitTable TABLE = UnitTableLoader.loadDefault();

  @Test
  public void testCondense() {
    assertThat(UnitAlgebra.condense("m m m m"), is("m^4"));
    assertThat(UnitAlgebra.condense("kg ft^3 kg^-2"), is("kg^-1 ft^3"));
    assertThat(UnitAlgebra.condense("s^2 s^-2"), is(""));
    assertThat(UnitAlgebra.condense("m^0.5 m^0.5"), is("m"));
    assertThat(UnitAlgebra.condense("m^1.5"), is("m^1.5"));
    assertThat(UnitAlgebra.condense("  N   m "), is("N m"));
    assertThat(UnitAlgebra.condense(""), is(""));
  }

  @Test
  public void testCondenseKeepsPrefixedSymbolsApart() {
    assertThat(UnitAlgebra.condense("km m"), is("km m"));
    assertThat(UnitAlgebra.condense("km km^-1"), is(""));
  }

  @Test
  public void testCondenseIsIdempotent() {
    String[] inputs = {"m m m m", "kg ft^3 kg^-2", "kg m s^-2 s", "J kg^-1 delta_K^-1", "m^1/2"};
    for (String input : inputs) {
      String once = UnitAlgebra.condense(input);
      assertThat(UnitAlgebra.condense(once), is(once));
    }
  }

  @Test
  public void testFormatPower() {
    assertThat(UnitAlgebra.formatPower(2), is("2"));
    assertThat(UnitAlgebra.formatPower(-1), is("-1"));
    assertThat(UnitAlgebra.formatPower(0.5), is("0.5"));
  }

  @Test
  public void testProductQuotientPower() {
    assertThat(UnitAlgebra.multiply("kg m", "m^-1"), is("kg"));
    assertThat(UnitAlgebra.multiply("", "s"), is("s"));
    assertThat(UnitAlgebra.divide("m", "s^2"), is("m s^-2"));
    assertThat(UnitAlgebra.divide("m s^-1", "m s^-1"), is(""));
    assertThat(UnitAlgebra.power("kg m^-3", 2), is("kg^2 m^-6"));
    assertThat(UnitAlgebra.power("m", 0.5), is("m^0.5"));
    assertThat(UnitAlgebra.power("m s", 0), is(""));
  }

  @Test(expected = UnknownUnitException.class)
  public void testCondenseRejectsMalformedPower() {
    UnitAlgebra.condense("m^x");
  }

  @Test
  public void testTypeOfBareSymbols() {
    assertThat(UnitAlgebra.typeOf("", TABLE), is(UnitType.NO_TYPE));
    assertThat(UnitAlgebra.typeOf("kg", TABLE), is(UnitType.MASS));
    assertThat(UnitAlgebra.typeOf("sr", TABLE), is(UnitType.SOLID_ANGLE));
    assertThat(UnitAlgebra.typeOf("K", TABLE), is(UnitType.TEMPERATURE));
    assertThat(UnitAlgebra.typeOf("delta_F", TABLE), is(UnitType.TEMPERATURE_DIFFERENCE));
    assertThat(UnitAlgebra.typeOf("N", TABLE), is(UnitType.DERIVED));
  }

  @Test
  public void testTypeOfCompounds() {
    assertThat(UnitAlgebra.typeOf("kg m", TABLE), is(UnitType.COMPOSITE));
    assertThat(UnitAlgebra.typeOf("km", TABLE), is(UnitType.COMPOSITE));
    assertThat(UnitAlgebra.typeOf("mK", TABLE), is(UnitType.TEMPERATURE));
    assertThat(UnitAlgebra.typeOf("kg C", TABLE), is(UnitType.TEMPERATURE));
    assertThat(UnitAlgebra.typeOf("J kg^-1 K^-1", TABLE), is(UnitType.TEMPERATURE_DIFFERENCE));
    assertThat(UnitAlgebra.typeOf("K^2", TABLE), is(UnitType.TEMPERATURE_DIFFERENCE));
    assertThat(UnitAlgebra.typeOf("W m^-2 delta_K^-1", TABLE),
        is(UnitType.TEMPERATURE_DIFFERENCE));
  }

  @Test
  public void testTypeOfMatchesExactSymbols() {
    UnitTable table = TABLE.withDerived(DerivedUnit.of("VAC", "V"));
    assertThat(UnitAlgebra.typeOf("VAC A", table), is(UnitType.COMPOSITE));
    assertThat(UnitAlgebra.typeOf("VAC", table), is(UnitType.DERIVED));
  }

  @Test(expected = UnknownUnitException.class)
  public void testTypeOfUnknown() {
    UnitAlgebra.typeOf("kg parsec", TABLE);
  }
}
