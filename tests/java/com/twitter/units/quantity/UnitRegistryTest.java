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

import java.util.List;

import com.google.common.collect.ImmutableList;

import org.junit.Before;
import org.junit.Test;

import com.twitter.units.parse.UnknownUnitException;
import com.twitter.units.table.BaseDimension;
import com.twitter.units.table.DerivedUnit;
import com.twitter.units.table.FundamentalUnit;
import com.twitter.units.table.UnitConfigurationException;
import com.twitter.units.table.UnitTable;
import com.twitter.units.table.UnitTableLoader;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.not;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.CoreMatchers.sameInstance;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class UnitRegistryTest {

  private UnitRegistry registry;

  @Before
  public void setUp() {
    registry = UnitRegistry.createDefault();
  }

  @Test
  public void testUnit() {
    Unit unit = registry.unit("kg m s^-2 s^2 s^-2");
    assertThat(unit.getName(), is("kg m s^-2"));
    assertThat(unit.getSiUnits(), is("kg m s^-2"));
    assertThat(unit.getSiScale(), is(1.0));
    assertThat(unit.getSiOffset(), is(0.0));
    assertThat(unit.getType(), is(UnitType.COMPOSITE));
    assertThat(unit.getDimensions(), is(registry.unit("N").getDimensions()));
  }

  @Test
  public void testUnitsAreCached() {
    assertThat(registry.unit("kg m^-3"), sameInstance(registry.unit(" kg m^-3 ")));
  }

  @Test
  public void testDimensionless() {
    Unit unit = registry.dimensionless();
    assertTrue(unit.isDimensionless());
    assertThat(unit.getName(), is(""));
    assertThat(unit.getType(), is(UnitType.NO_TYPE));
    assertTrue(registry.unit("m m^-1").isDimensionless());
  }

  @Test(expected = UnknownUnitException.class)
  public void testUnknownUnit() {
    registry.unit("kg furlong");
  }

  @Test
  public void testTemperatureCounterparts() {
    Unit celsius = registry.unit("C");
    assertTrue(celsius.isAbsoluteTemperature());
    assertFalse(celsius.isTemperatureDifference());
    assertThat(celsius.getDifferenceCounterpart().getName(), is("delta_C"));

    Unit difference = registry.unit("delta_C");
    assertTrue(difference.isTemperatureDifference());
    assertThat(difference.getDifferenceCounterpart(), nullValue());

    assertFalse("compound units are not bare temperatures",
        registry.unit("C m").isAbsoluteTemperature());
    assertFalse(registry.unit("K^1").isAbsoluteTemperature());

    Unit millikelvin = registry.unit("mK");
    assertTrue(millikelvin.isAbsoluteTemperature());
    assertThat(millikelvin.getDifferenceCounterpart().getName(), is("mdelta_K"));
    assertTrue(registry.unit("mdelta_K").isTemperatureDifference());
  }

  @Test
  public void testCompatibleUnits() {
    assertTrue(registry.unit("J").compatibleUnits().contains("BTU"));
    assertTrue(registry.unit("J").compatibleUnits().contains("cal"));
    assertFalse(registry.unit("J").compatibleUnits().contains("J"));
    assertFalse(registry.unit("J").compatibleUnits().contains("W"));
    assertTrue(registry.unit("Pa").compatibleUnits().contains("psi"));
    assertTrue(registry.unit("K").compatibleUnits().contains("F"));
    assertFalse("differences are a different dimension",
        registry.unit("K").compatibleUnits().contains("delta_K"));
  }

  @Test
  public void testRegisterFundamental() {
    try {
      registry.unit("furlong");
      fail("expected furlong to be unknown");
    } catch (UnknownUnitException e) {
      // expected
    }

    registry.registerFundamental(FundamentalUnit.of("furlong", BaseDimension.LENGTH, 201.168));
    Unit furlong = registry.unit("furlong");
    assertThat(furlong.getSiUnits(), is("m"));
    assertEquals(201168.0, registry.unit("kfurlong").getSiScale(), 1e-6);
  }

  @Test
  public void testRegistrationInvalidatesCachedSplits() {
    UnitTable table = UnitTable.builder()
        .addMultiplier("da", 10)
        .addMultiplier("d", 0.1)
        .addFundamental(FundamentalUnit.of("m", BaseDimension.LENGTH, 1))
        .addFundamental(FundamentalUnit.of("s", BaseDimension.TIME, 1))
        .build();
    UnitRegistry custom = new UnitRegistry(table);
    assertThat(custom.unit("dam").getSiScale(), is(10.0));

    custom.registerFundamental(FundamentalUnit.of("dam", BaseDimension.TIME, 60));
    assertThat(custom.unit("dam").getSiUnits(), is("s"));
    assertThat(custom.unit("dam").getSiScale(), is(60.0));
  }

  @Test
  public void testRegistrationStartsAFreshCache() {
    Unit before = registry.unit("kg m^-3");
    registry.registerFundamental(FundamentalUnit.of("furlong", BaseDimension.LENGTH, 201.168));
    Unit after = registry.unit("kg m^-3");

    assertThat(after, not(sameInstance(before)));
    assertThat(after, is(before));
    assertThat(registry.unit("kg m^-3"), sameInstance(after));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testCacheSizeMustBePositive() {
    new UnitRegistry(UnitTableLoader.loadDefault(), 0);
  }

  @Test
  public void testRegisterDerived() {
    registry.registerDerived(DerivedUnit.of("knot", "m s^-1", 0.514444));
    Unit knot = registry.unit("knot");
    assertThat(knot.getSiUnits(), is("m s^-1"));
    assertThat(knot.getType(), is(UnitType.DERIVED));
    assertTrue(registry.getTable().isUnitSymbol("knot"));
  }

  @Test(expected = UnitTable.UnitAlreadyRegisteredException.class)
  public void testRegisterExisting() {
    registry.registerFundamental(FundamentalUnit.of("kg", BaseDimension.MASS, 1));
  }

  @Test
  public void testRegisterDerivedWithUnknownComposition() {
    try {
      registry.registerDerived(DerivedUnit.of("widget", "kg gizmo"));
      fail("expected a configuration error");
    } catch (UnitConfigurationException e) {
      // expected
    }
    assertFalse("failed registrations leave the table unchanged",
        registry.getTable().isUnitSymbol("widget"));
  }

  @Test(expected = UnitConfigurationException.class)
  public void testTableWithCycleRejected() {
    new UnitRegistry(UnitTable.builder()
        .addFundamental(FundamentalUnit.of("m", BaseDimension.LENGTH, 1))
        .addDerived(DerivedUnit.of("a", "b"))
        .addDerived(DerivedUnit.of("b", "a m"))
        .build());
  }

  @Test(expected = UnitConfigurationException.class)
  public void testTableWithUnknownReferenceRejected() {
    new UnitRegistry(UnitTable.builder()
        .addFundamental(FundamentalUnit.of("m", BaseDimension.LENGTH, 1))
        .addDerived(DerivedUnit.of("a", "parsec"))
        .build());
  }

  @Test
  public void testPreferredUnits() {
    registry.preferUnits("km", "h");
    assertThat(registry.getPreferredUnits().size(), is(2));

    Quantity distance = registry.quantity(1500, "m");
    assertThat(distance.getUnit().getName(), is("km"));
    assertEquals(1.5, distance.getValue(), 1e-12);

    registry.preferUnits("km");
    assertThat("re-adding a preferred unit is a no-op",
        registry.getPreferredUnits().size(), is(2));

    registry.removePreferredUnits("km", "kg");
    assertThat(registry.getPreferredUnits(),
        is((List<Unit>) ImmutableList.of(registry.unit("h"))));
    assertThat(registry.quantity(1500, "m").getUnit().getName(), is("m"));
  }

  @Test(expected = UnitRegistry.RequiresUniqueDimensionsException.class)
  public void testPreferredUnitsNeedUniqueDimensions() {
    registry.preferUnits("km");
    registry.preferUnits("ft");
  }

  @Test
  public void testUnitSystemLookup() {
    assertThat(registry.unitSystem("CGS").getBaseUnit(BaseDimension.LENGTH), is("cm"));
  }

  @Test
  public void testRegistrationsAreNotShared() {
    UnitTable table = UnitTableLoader.loadDefault();
    UnitRegistry first = new UnitRegistry(table);
    first.registerFundamental(FundamentalUnit.of("furlong", BaseDimension.LENGTH, 201.168));
    assertFalse("registries do not share registrations",
        new UnitRegistry(table).getTable().isUnitSymbol("furlong"));
  }

  @Test
  public void testCustomTable() {
    UnitRegistry nautical = new UnitRegistry(
        UnitTableLoader.loadResource("com/twitter/units/table/nautical-units.json"));
    Quantity speed = nautical.quantity(10, "kn").to("m s^-1");
    assertEquals(10 * 1852 / 3600.0, speed.getValue(), 1e-9);
    assertEquals(1852000, nautical.unit("knmi").getSiScale(), 1e-6);
  }
}
