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

import java.util.EnumMap;
import java.util.Map;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;

import org.junit.Test;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.notNullValue;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.assertTrue;

public class UnitTableTest {

  private static UnitTable.Builder minimal() {
    return UnitTable.builder()
        .addMultiplier("k", 1000)
        .addMultiplier("da", 10)
        .addMultiplier("d", 0.1)
        .addFundamental(FundamentalUnit.of("kg", BaseDimension.MASS, 1))
        .addFundamental(FundamentalUnit.of("m", BaseDimension.LENGTH, 1))
        .addFundamental(FundamentalUnit.of("s", BaseDimension.TIME, 1))
        .addDerived(DerivedUnit.of("N", "kg m s^-2"));
  }

  @Test
  public void testLookups() {
    UnitTable table = minimal().build();

    assertTrue(table.isUnitSymbol("kg"));
    assertTrue(table.isUnitSymbol("N"));
    assertFalse("prefixed forms are not symbols", table.isUnitSymbol("km"));

    assertThat(table.getFundamental("m").getType(), is(BaseDimension.LENGTH));
    assertThat(table.getFundamental("N"), nullValue());
    assertThat(table.getDerived("N").getComposition(), is("kg m s^-2"));
    assertThat(table.getMultiplier("k").getFactor(), is(1000.0));
    assertThat(table.getMultiplier("x"), nullValue());
  }

  @Test
  public void testMultipliersKeepDeclarationOrder() {
    UnitTable table = minimal().build();
    ImmutableList.Builder<String> symbols = ImmutableList.builder();
    for (MultiplierPrefix prefix : table.getMultipliers()) {
      symbols.add(prefix.getSymbol());
    }
    assertThat(symbols.build(), is(ImmutableList.of("k", "da", "d")));
  }

  @Test
  public void testSymbolsListFundamentalsFirst() {
    assertThat(ImmutableList.copyOf(minimal().build().getSymbols()),
        is(ImmutableList.of("kg", "m", "s", "N")));
  }

  @Test
  public void testSiRepresentativeIsFirstUnitWithUnitFactor() {
    UnitTable table = UnitTable.builder()
        .addFundamental(FundamentalUnit.of("g", BaseDimension.MASS, 0.001))
        .addFundamental(FundamentalUnit.of("kg", BaseDimension.MASS, 1))
        .addFundamental(FundamentalUnit.of("kilo", BaseDimension.MASS, 1))
        .build();
    assertThat(table.getSiRepresentative(BaseDimension.MASS).getSymbol(), is("kg"));
  }

  @Test(expected = UnitConfigurationException.class)
  public void testMissingSiRepresentative() {
    UnitTable.builder()
        .addFundamental(FundamentalUnit.of("C", BaseDimension.TEMPERATURE, 1, 273.15))
        .build();
  }

  @Test(expected = UnitConfigurationException.class)
  public void testSiRepresentativeOfUnusedDimension() {
    minimal().build().getSiRepresentative(BaseDimension.LIGHT);
  }

  @Test(expected = UnitConfigurationException.class)
  public void testSymbolBothFundamentalAndDerived() {
    minimal().addDerived(DerivedUnit.of("m", "kg")).build();
  }

  @Test(expected = UnitConfigurationException.class)
  public void testDuplicateFundamental() {
    minimal().addFundamental(FundamentalUnit.of("kg", BaseDimension.MASS, 1));
  }

  @Test(expected = UnitConfigurationException.class)
  public void testDuplicateMultiplier() {
    minimal().addMultiplier("k", 1000);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testBlankSymbolRejected() {
    FundamentalUnit.of(" ", BaseDimension.MASS, 1);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testSymbolWithPowerRejected() {
    DerivedUnit.of("m^2", "m m");
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNonPositiveFactorRejected() {
    FundamentalUnit.of("x", BaseDimension.MASS, 0);
  }

  @Test
  public void testWithFundamentalCopiesTable() {
    UnitTable table = minimal().build();
    UnitTable extended = table.withFundamental(FundamentalUnit.of("ft", BaseDimension.LENGTH,
        0.3048));

    assertTrue(extended.isUnitSymbol("ft"));
    assertFalse("the original table is unchanged", table.isUnitSymbol("ft"));
    assertThat(Iterables.size(extended.getFundamentalUnits()), is(4));
  }

  @Test(expected = UnitTable.UnitAlreadyRegisteredException.class)
  public void testWithDerivedRefusesExistingSymbol() {
    minimal().build().withDerived(DerivedUnit.of("kg", "N s^2 m^-1"));
  }

  @Test
  public void testUnitSystemsAndQuantityNames() {
    Map<BaseDimension, String> mks = new EnumMap<BaseDimension, String>(BaseDimension.class);
    mks.put(BaseDimension.MASS, "kg");
    mks.put(BaseDimension.LENGTH, "m");
    UnitTable table = minimal()
        .addUnitSystem("MKS", mks)
        .addQuantityName("Force", "N")
        .build();

    assertThat(table.getUnitSystem("MKS"), notNullValue());
    assertThat(table.getUnitSystem("MKS").get(BaseDimension.LENGTH), is("m"));
    assertThat(table.getUnitSystem("CGS"), nullValue());
    assertThat(table.getQuantityUnits("Force"), is("N"));
    assertThat(table.getQuantityUnits("Velocity"), nullValue());
  }
}
