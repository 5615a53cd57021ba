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

import java.io.StringReader;

import org.junit.Test;

import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.assertTrue;

public class UnitTableLoaderTest {

  private static UnitTable load(String json) {
    return UnitTableLoader.load(new StringReader(json.replace('\'', '"')));
  }

  @Test
  public void testLoadDefault() {
    UnitTable table = UnitTableLoader.loadDefault();

    assertThat(table.getFundamental("C").getOffset(), is(273.15));
    assertThat(table.getFundamental("delta_C").getType(),
        is(BaseDimension.TEMPERATURE_DIFFERENCE));
    assertThat(table.getDerived("h").getFactor(), is(3600.0));
    assertThat(table.getQuantityUnits("Velocity"), is("m s^-1"));
    assertThat(table.getUnitSystem("BT").get(BaseDimension.MASS), is("slug"));
    assertTrue(table.getUnitSystemNames().contains("CGS"));
    for (BaseDimension dimension : BaseDimension.values()) {
      assertTrue(table.getSiRepresentative(dimension).isSiRepresentative());
    }
  }

  @Test
  public void testDefaultMultipliersTryDecaBeforeDeci() {
    int deca = -1;
    int deci = -1;
    int index = 0;
    for (MultiplierPrefix prefix : UnitTableLoader.loadDefault().getMultipliers()) {
      if (prefix.getSymbol().equals("da")) {
        deca = index;
      } else if (prefix.getSymbol().equals("d")) {
        deci = index;
      }
      index++;
    }
    assertTrue(deca >= 0 && deca < deci);
  }

  @Test
  public void testLoadCustomTable() {
    UnitTable table = load("{"
        + "'multipliers': {'k': 1000},"
        + "'fundamentalUnits': {"
        + "  'm': {'type': 'LENGTH', 'factor': 1},"
        + "  'mi': {'type': 'LENGTH', 'factor': 1609.344}},"
        + "'derivedUnits': {'ha': {'composition': 'm^2', 'factor': 10000}},"
        + "'quantityNames': {'Area': 'ha'}"
        + "}");

    assertThat(table.getFundamental("mi").getFactor(), is(1609.344));
    assertThat(table.getFundamental("mi").getOffset(), is(0.0));
    assertThat(table.getDerived("ha").getComposition(), is("m^2"));
    assertThat(table.getQuantityUnits("Area"), is("ha"));
  }

  @Test
  public void testResourceRoundTrip() {
    UnitTable table = UnitTableLoader.loadResource(UnitTableLoader.DEFAULT_TABLE_RESOURCE);
    assertThat(table.getSymbols(), is(UnitTableLoader.loadDefault().getSymbols()));
  }

  @Test
  public void testLoadResource() {
    UnitTable table = UnitTableLoader.loadResource("com/twitter/units/table/nautical-units.json");
    assertThat(table.getFundamental("nmi").getFactor(), is(1852.0));
    assertThat(table.getDerived("kn").getComposition(), is("nmi h^-1"));
    assertThat(table.getQuantityUnits("Velocity"), is("kn"));
    assertTrue(table.getUnitSystemNames().isEmpty());
  }

  @Test(expected = UnitConfigurationException.class)
  public void testMissingResource() {
    UnitTableLoader.loadResource("com/twitter/units/table/missing.json");
  }

  @Test(expected = UnitConfigurationException.class)
  public void testMalformedJson() {
    load("{'fundamentalUnits': [");
  }

  @Test(expected = UnitConfigurationException.class)
  public void testEmptyDocument() {
    load("");
  }

  @Test(expected = UnitConfigurationException.class)
  public void testUnknownDimension() {
    load("{'fundamentalUnits': {'m': {'type': 'DISTANCE', 'factor': 1}}}");
  }

  @Test(expected = UnitConfigurationException.class)
  public void testMissingFactor() {
    load("{'fundamentalUnits': {'m': {'type': 'LENGTH'}}}");
  }

  @Test(expected = UnitConfigurationException.class)
  public void testInvalidEntryIsWrapped() {
    load("{'fundamentalUnits': {'m': {'type': 'LENGTH', 'factor': -1}}}");
  }
}
