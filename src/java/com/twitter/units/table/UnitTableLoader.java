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

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.net.URL;
import java.util.EnumMap;
import java.util.Map;
import java.util.logging.Logger;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Charsets;
import com.google.common.io.Resources;
import com.google.gson.Gson;
import com.google.gson.JsonParseException;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Reads unit table data from JSON.  The document carries five optional sections:
 * <pre>
 * {
 *   "multipliers": { "k": 1000, ... },
 *   "fundamentalUnits": { "C": { "type": "TEMPERATURE", "factor": 1, "offset": 273.15 }, ... },
 *   "derivedUnits": { "N": { "composition": "kg m s^-2", "factor": 1 }, ... },
 *   "unitSystems": { "SI": { "MASS": "kg", ... }, ... },
 *   "quantityNames": { "Velocity": "m s^-1", ... }
 * }
 * </pre>
 * Section entries keep their document order, which fixes the order multiplier prefixes are tried
 * in.
 */
public final class UnitTableLoader {

  private static final Logger LOG = Logger.getLogger(UnitTableLoader.class.getName());

  @VisibleForTesting
  static final String DEFAULT_TABLE_RESOURCE = "com/twitter/units/table/units.json";

  private static final Gson GSON = new Gson();

  private UnitTableLoader() {
    // utility
  }

  // Gson targets.
  private static class TableData {
    Map<String, Double> multipliers;
    Map<String, FundamentalData> fundamentalUnits;
    Map<String, DerivedData> derivedUnits;
    Map<String, Map<String, String>> unitSystems;
    Map<String, String> quantityNames;
  }

  private static class FundamentalData {
    String type;
    Double factor;
    double offset;
  }

  private static class DerivedData {
    String composition;
    Double factor;
  }

  /**
   * Loads the unit table bundled with this library.
   *
   * @return The default unit table.
   * @throws UnitConfigurationException if the bundled table cannot be read or is malformed.
   */
  public static UnitTable loadDefault() {
    return loadResource(DEFAULT_TABLE_RESOURCE);
  }

  /**
   * Loads a unit table from a classpath resource.
   *
   * @param resourcePath Path of the JSON resource.
   * @return The unit table.
   * @throws UnitConfigurationException if the resource cannot be read or is malformed.
   */
  public static UnitTable loadResource(String resourcePath) {
    checkNotNull(resourcePath);
    LOG.info("Loading unit table from " + resourcePath);

    URL url;
    try {
      url = Resources.getResource(resourcePath);
    } catch (IllegalArgumentException e) {
      throw new UnitConfigurationException("No unit table resource at " + resourcePath, e);
    }

    String json;
    try {
      json = Resources.toString(url, Charsets.UTF_8);
    } catch (IOException e) {
      throw new UnitConfigurationException("Failed to read unit table " + resourcePath, e);
    }
    return load(new StringReader(json));
  }

  /**
   * Loads a unit table from JSON text.  The reader is not closed.
   *
   * @param reader Source of the JSON document.
   * @return The unit table.
   * @throws UnitConfigurationException if the document is malformed.
   */
  public static UnitTable load(Reader reader) {
    checkNotNull(reader);

    TableData data;
    try {
      data = GSON.fromJson(reader, TableData.class);
    } catch (JsonParseException e) {
      throw new UnitConfigurationException("Unit table is not valid JSON: " + e.getMessage(), e);
    }
    if (data == null) {
      throw new UnitConfigurationException("Unit table document is empty.");
    }

    UnitTable table = toTable(data);
    LOG.info("Loaded " + table);
    return table;
  }

  private static UnitTable toTable(TableData data) {
    UnitTable.Builder builder = UnitTable.builder();
    try {
      if (data.multipliers != null) {
        for (Map.Entry<String, Double> entry : data.multipliers.entrySet()) {
          builder.addMultiplier(entry.getKey(), required(entry.getValue(), entry.getKey()));
        }
      }
      if (data.fundamentalUnits != null) {
        for (Map.Entry<String, FundamentalData> entry : data.fundamentalUnits.entrySet()) {
          String symbol = entry.getKey();
          FundamentalData unit = required(entry.getValue(), symbol);
          builder.addFundamental(FundamentalUnit.of(symbol,
              dimension(required(unit.type, symbol + ".type")),
              required(unit.factor, symbol + ".factor"),
              unit.offset));
        }
      }
      if (data.derivedUnits != null) {
        for (Map.Entry<String, DerivedData> entry : data.derivedUnits.entrySet()) {
          String symbol = entry.getKey();
          DerivedData unit = required(entry.getValue(), symbol);
          builder.addDerived(DerivedUnit.of(symbol,
              required(unit.composition, symbol + ".composition"),
              required(unit.factor, symbol + ".factor")));
        }
      }
      if (data.unitSystems != null) {
        for (Map.Entry<String, Map<String, String>> entry : data.unitSystems.entrySet()) {
          Map<BaseDimension, String> baseUnits =
              new EnumMap<BaseDimension, String>(BaseDimension.class);
          for (Map.Entry<String, String> slot
              : required(entry.getValue(), entry.getKey()).entrySet()) {
            baseUnits.put(dimension(slot.getKey()), required(slot.getValue(), slot.getKey()));
          }
          builder.addUnitSystem(entry.getKey(), baseUnits);
        }
      }
      if (data.quantityNames != null) {
        for (Map.Entry<String, String> entry : data.quantityNames.entrySet()) {
          builder.addQuantityName(entry.getKey(), required(entry.getValue(), entry.getKey()));
        }
      }
      return builder.build();
    } catch (UnitConfigurationException e) {
      throw e;
    } catch (IllegalArgumentException e) {
      throw new UnitConfigurationException("Invalid unit table entry: " + e.getMessage(), e);
    }
  }

  private static BaseDimension dimension(String name) {
    try {
      return BaseDimension.valueOf(name);
    } catch (IllegalArgumentException e) {
      throw new UnitConfigurationException("Unknown base dimension '" + name + "'", e);
    }
  }

  private static <T> T required(T value, String key) {
    if (value == null) {
      throw new UnitConfigurationException("Missing value for '" + key + "' in unit table.");
    }
    return value;
  }
}
