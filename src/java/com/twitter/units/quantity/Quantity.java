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

import java.util.Arrays;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

import com.google.common.collect.ImmutableMap;

import com.twitter.units.table.BaseDimension;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

/**
 * A numeric value, scalar or fixed-length array, bound to a resolved {@link Unit}.  Quantities are
 * immutable; every operation returns a new quantity.
 *
 * <p>Temperatures are handled according to whether the unit is an absolute reading ({@code K},
 * {@code C}, ...) or a difference ({@code delta_K}, {@code delta_C}, ...):
 * <ul>
 *   <li>An absolute temperature below absolute zero becomes the matching difference unit when the
 *       quantity is created, so {@code -1 K} is {@code -1 delta_K}.
 *   <li>Subtracting two readings on the same scale gives a difference; adding a difference to a
 *       reading gives a reading.  Readings on different scales must be converted before they are
 *       combined.
 *   <li>Products, quotients and powers never apply offsets.
 *   <li>Converting to or from a difference unit scales without offsetting.
 * </ul>
 */
public final class Quantity implements Comparable<Quantity> {

  private static final Logger LOG = Logger.getLogger(Quantity.class.getName());

  private static final DimensionVector ANGLE = DimensionVector.of(BaseDimension.ANGLE);
  private static final DimensionVector SOLID_ANGLE = DimensionVector.of(BaseDimension.SOLID_ANGLE);

  /**
   * Thrown when a quantity that is not dimensionless, an angle or a solid angle is used as a
   * plain number.
   */
  public static class InvalidFloatCoercionException extends IllegalStateException {
    public InvalidFloatCoercionException(Quantity quantity) {
      super(String.format("Only dimensionless quantities and angles can be used as a number, "
          + "not %s.", quantity));
    }
  }

  private enum Operation {
    ADD, SUBTRACT, MULTIPLY, DIVIDE;

    double apply(double left, double right) {
      switch (this) {
        case ADD: return left + right;
        case SUBTRACT: return left - right;
        case MULTIPLY: return left * right;
        case DIVIDE: return left / right;
        default: throw new AssertionError(this);
      }
    }
  }

  private final double[] values;
  private final boolean scalar;
  private final Unit unit;

  private Quantity(double[] values, boolean scalar, Unit unit) {
    this.values = values;
    this.scalar = scalar;
    this.unit = unit;
  }

  /**
   * Creates a quantity, moving absolute temperatures below absolute zero to their difference
   * unit.  Takes ownership of {@code values}.
   */
  private static Quantity create(double[] values, boolean scalar, Unit unit) {
    checkNotNull(unit);
    if (unit.isAbsoluteTemperature() && belowAbsoluteZero(values, unit)) {
      Unit difference = unit.getDifferenceCounterpart();
      if (difference != null) {
        unit = difference;
      }
    }
    return new Quantity(values, scalar, unit);
  }

  private static boolean belowAbsoluteZero(double[] values, Unit unit) {
    for (double value : values) {
      if (value + unit.getSiOffset() < 0) {
        return true;
      }
    }
    return false;
  }

  /**
   * Creates a scalar quantity.
   */
  public static Quantity of(double value, Unit unit) {
    return create(new double[] {value}, true, unit);
  }

  /**
   * Creates an array quantity.
   */
  public static Quantity of(double[] values, Unit unit) {
    checkNotNull(values);
    checkArgument(values.length > 0, "An array quantity needs at least one value");
    return create(values.clone(), false, unit);
  }

  public boolean isScalar() {
    return scalar;
  }

  /**
   * Returns the value of a scalar quantity in its own unit.
   *
   * @throws IllegalStateException if this is an array quantity
   */
  public double getValue() {
    checkState(scalar, "Array quantity %s has no single value", this);
    return values[0];
  }

  /**
   * Returns a copy of the values in this quantity's own unit; scalars give a single element.
   */
  public double[] getValues() {
    return values.clone();
  }

  public Unit getUnit() {
    return unit;
  }

  /**
   * Returns the value of a scalar quantity in SI units.
   *
   * @throws IllegalStateException if this is an array quantity
   */
  public double getSiValue() {
    checkState(scalar, "Array quantity %s has no single value", this);
    return toSi(values[0]);
  }

  public double[] getSiValues() {
    double[] si = new double[values.length];
    for (int i = 0; i < values.length; i++) {
      si[i] = toSi(values[i]);
    }
    return si;
  }

  private double toSi(double value) {
    return (value + unit.getSiOffset()) * unit.getSiScale();
  }

  public String getSiUnits() {
    return unit.getSiUnits();
  }

  public DimensionVector getDimensions() {
    return unit.getDimensions();
  }

  public boolean isDimensionless() {
    return unit.isDimensionless();
  }

  public UnitType getType() {
    return unit.getType();
  }

  /**
   * Returns the symbols of every table unit, other than this quantity's, it can be converted to.
   */
  public Set<String> compatibleUnits() {
    return unit.compatibleUnits();
  }

  /**
   * Converts this quantity to {@code units}.
   *
   * @see #to(Unit)
   */
  public Quantity to(String units) {
    return to(unit.getRegistry().unit(units));
  }

  /**
   * Converts this quantity to {@code target}.  A temperature difference converted to an
   * absolute temperature unit lands in that unit's difference counterpart, so
   * {@code 1 delta_K} converts to {@code 1 delta_C} when asked for {@code C}.
   *
   * @param target The unit to convert to.
   * @return An equivalent quantity in {@code target}.
   * @throws IncompatibleDimensionsException if the dimensions do not match
   */
  public Quantity to(Unit target) {
    checkNotNull(target);
    if (!getDimensions().isConvertibleTo(target.getDimensions())) {
      throw new IncompatibleDimensionsException(unit, target);
    }
    if (getType() == UnitType.TEMPERATURE_DIFFERENCE && target.isAbsoluteTemperature()) {
      Unit difference = target.getDifferenceCounterpart();
      if (difference != null) {
        target = difference;
      }
    }
    return create(valuesIn(target), scalar, target);
  }

  /**
   * Converts this quantity into the base units of {@code system}.  The target is the product of
   * the system's unit for each dimension raised to this quantity's exponent for it.
   *
   * @param system The unit system to convert into.
   * @return An equivalent quantity expressed in the system's units.
   */
  public Quantity convert(UnitSystem system) {
    checkNotNull(system);
    return to(system.unitFor(getDimensions()));
  }

  // Values of this quantity expressed in target; differences convert by scale alone.
  private double[] valuesIn(Unit target) {
    double[] converted = values.clone();
    if (unit.equals(target)) {
      return converted;
    }
    boolean scaleOnly = getType() == UnitType.TEMPERATURE_DIFFERENCE
        || target.getType() == UnitType.TEMPERATURE_DIFFERENCE;
    for (int i = 0; i < converted.length; i++) {
      converted[i] = scaleOnly
          ? converted[i] * unit.getSiScale() / target.getSiScale()
          : toSi(converted[i]) / target.getSiScale() - target.getSiOffset();
    }
    return converted;
  }

  /**
   * Adds {@code other} to this quantity.  Two absolute temperatures on the same scale add to an
   * absolute temperature in this quantity's unit, so {@code 1 K + 2 K} is {@code 3 K}; an absolute
   * temperature and a temperature difference add to the absolute unit in either order.
   *
   * @throws IncompatibleDimensionsException if the dimensions differ or the operands are absolute
   *     temperatures on different scales
   */
  public Quantity plus(Quantity other) {
    return sum(other, Operation.ADD);
  }

  /**
   * Adds a plain number, which only dimensionless quantities accept.
   */
  public Quantity plus(double number) {
    return plus(of(number, unit.getRegistry().dimensionless()));
  }

  /**
   * Subtracts {@code other} from this quantity.  Two absolute temperatures on the same scale
   * subtract to their temperature difference unit; an absolute temperature and a temperature
   * difference subtract to the absolute unit in either order.
   *
   * @throws IncompatibleDimensionsException if the dimensions differ or the operands are absolute
   *     temperatures on different scales
   */
  public Quantity minus(Quantity other) {
    return sum(other, Operation.SUBTRACT);
  }

  public Quantity minus(double number) {
    return minus(of(number, unit.getRegistry().dimensionless()));
  }

  private Quantity sum(Quantity other, Operation operation) {
    checkNotNull(other);
    Unit result = sumUnit(unit, other.unit, operation);
    return create(combine(valuesIn(result), scalar, other.valuesIn(result), other.scalar,
        operation), scalar && other.scalar, result);
  }

  /**
   * Picks the unit of a sum or difference.  Same-scale readings subtract to a difference;
   * a reading and a difference combine to the reading's unit; otherwise the left unit wins if
   * the dimensions match.
   */
  private static Unit sumUnit(Unit left, Unit right, Operation operation) {
    if (left.isAbsoluteTemperature() && right.isAbsoluteTemperature()) {
      if (!left.isSameScale(right)) {
        throw new IncompatibleDimensionsException(left, right);
      }
      if (operation == Operation.SUBTRACT) {
        Unit difference = left.getDifferenceCounterpart();
        if (difference != null) {
          return difference;
        }
      }
      return left;
    }
    if (left.getName().equals(right.getName())) {
      return left;
    }
    if (left.isAbsoluteTemperature() && right.isTemperatureDifference()) {
      return left;
    }
    if (left.isTemperatureDifference() && right.isAbsoluteTemperature()) {
      return right;
    }
    if (left.getDimensions().equals(right.getDimensions())) {
      return left;
    }
    throw new IncompatibleDimensionsException(left, right);
  }

  public Quantity times(Quantity other) {
    checkNotNull(other);
    return create(combine(values, scalar, other.values, other.scalar, Operation.MULTIPLY),
        scalar && other.scalar, unit.multiply(other.unit));
  }

  public Quantity times(Unit other) {
    return times(of(1, other));
  }

  public Quantity times(double number) {
    return create(combine(values, scalar, new double[] {number}, true, Operation.MULTIPLY),
        scalar, unit);
  }

  public Quantity dividedBy(Quantity other) {
    checkNotNull(other);
    return create(combine(values, scalar, other.values, other.scalar, Operation.DIVIDE),
        scalar && other.scalar, unit.divide(other.unit));
  }

  public Quantity dividedBy(Unit other) {
    return dividedBy(of(1, other));
  }

  public Quantity dividedBy(double number) {
    return create(combine(values, scalar, new double[] {number}, true, Operation.DIVIDE),
        scalar, unit);
  }

  /**
   * Raises the value and the unit to {@code power}.
   */
  public Quantity pow(double power) {
    double[] raised = new double[values.length];
    for (int i = 0; i < values.length; i++) {
      raised[i] = Math.pow(values[i], power);
    }
    return create(raised, scalar, unit.power(power));
  }

  public Quantity negate() {
    double[] negated = new double[values.length];
    for (int i = 0; i < values.length; i++) {
      negated[i] = -values[i];
    }
    return create(negated, scalar, unit);
  }

  private static double[] combine(double[] left, boolean leftScalar, double[] right,
      boolean rightScalar, Operation operation) {

    int length = leftScalar ? right.length : left.length;
    if (!leftScalar && !rightScalar) {
      checkArgument(left.length == right.length,
          "Cannot combine arrays of length %s and %s", left.length, right.length);
    }
    double[] result = new double[length];
    for (int i = 0; i < length; i++) {
      result[i] = operation.apply(left[leftScalar ? 0 : i], right[rightScalar ? 0 : i]);
    }
    return result;
  }

  /**
   * Returns the SI value of a dimensionless, angle or solid angle scalar.
   *
   * @throws InvalidFloatCoercionException for any other dimensions
   */
  public double doubleValue() {
    DimensionVector dimensions = getDimensions();
    if (dimensions.isDimensionless() || dimensions.equals(ANGLE)
        || dimensions.equals(SOLID_ANGLE)) {
      return getSiValue();
    }
    throw new InvalidFloatCoercionException(this);
  }

  private void checkComparable(Quantity other) {
    checkNotNull(other);
    if (!getDimensions().equals(other.getDimensions())) {
      throw new IncompatibleDimensionsException(unit, other.unit);
    }
  }

  private void checkComparable(double number) {
    if (!isDimensionless()) {
      throw new IncompatibleDimensionsException(unit, "the number " + number);
    }
  }

  /**
   * Orders scalar quantities by SI value.
   *
   * @throws IncompatibleDimensionsException if the dimensions differ
   * @throws IllegalStateException if either quantity is an array
   */
  @Override
  public int compareTo(Quantity other) {
    checkComparable(other);
    return Double.compare(getSiValue(), other.getSiValue());
  }

  /**
   * Orders a dimensionless scalar against a plain number.
   *
   * @throws IncompatibleDimensionsException if this quantity is not dimensionless
   */
  public int compareTo(double number) {
    checkComparable(number);
    return Double.compare(getSiValue(), number);
  }

  public boolean isLessThan(Quantity other) {
    checkComparable(other);
    return getSiValue() < other.getSiValue();
  }

  public boolean isLessThan(double number) {
    checkComparable(number);
    return getSiValue() < number;
  }

  public boolean isLessThanOrEqualTo(Quantity other) {
    checkComparable(other);
    return getSiValue() <= other.getSiValue();
  }

  public boolean isLessThanOrEqualTo(double number) {
    checkComparable(number);
    return getSiValue() <= number;
  }

  public boolean isGreaterThan(Quantity other) {
    checkComparable(other);
    return getSiValue() > other.getSiValue();
  }

  public boolean isGreaterThan(double number) {
    checkComparable(number);
    return getSiValue() > number;
  }

  public boolean isGreaterThanOrEqualTo(Quantity other) {
    checkComparable(other);
    return getSiValue() >= other.getSiValue();
  }

  public boolean isGreaterThanOrEqualTo(double number) {
    checkComparable(number);
    return getSiValue() >= number;
  }

  /**
   * Returns {@code true} if both quantities hold the same SI values.  Arrays compare element-wise
   * and must have the same length.
   *
   * @throws IncompatibleDimensionsException if the dimensions differ
   */
  public boolean isEqualTo(Quantity other) {
    checkComparable(other);
    return sameValues(getSiValues(), other.getSiValues());
  }

  /**
   * Returns {@code true} if this dimensionless scalar's SI value equals {@code number}.
   *
   * @throws IncompatibleDimensionsException if this quantity is not dimensionless
   */
  public boolean isEqualTo(double number) {
    checkComparable(number);
    return scalar && getSiValue() == number;
  }

  public boolean isNotEqualTo(Quantity other) {
    return !isEqualTo(other);
  }

  public boolean isNotEqualTo(double number) {
    return !isEqualTo(number);
  }

  private static boolean sameValues(double[] left, double[] right) {
    if (left.length != right.length) {
      return false;
    }
    for (int i = 0; i < left.length; i++) {
      if (left[i] != right[i]) {
        return false;
      }
    }
    return true;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof Quantity)) {
      return false;
    }

    Quantity other = (Quantity) obj;
    return scalar == other.scalar
        && getDimensions().equals(other.getDimensions())
        && Arrays.equals(normalized(getSiValues()), normalized(other.getSiValues()));
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(normalized(getSiValues())) * 31 + getDimensions().hashCode();
  }

  private static double[] normalized(double[] values) {
    for (int i = 0; i < values.length; i++) {
      values[i] += 0.0;
    }
    return values;
  }

  @Override
  public String toString() {
    String value = scalar ? Double.toString(values[0]) : Arrays.toString(values);
    return String.format("(%s, \"%s\")", value, unit.getName());
  }

  /**
   * Creates a builder resolving units against {@code registry}.
   */
  public static Builder builder(UnitRegistry registry) {
    return new Builder(registry);
  }

  /**
   * Builds quantities from a value and exactly one description of their units: a unit string, a
   * {@link Unit}, a {@link DimensionVector} (optionally with the {@link UnitSystem} to express it
   * in, SI by default) or a quantity-name map.  A quantity to copy from may stand in for both.
   * Without any unit description the quantity is dimensionless.
   */
  public static class Builder {
    private final UnitRegistry registry;

    private double[] values;
    private boolean scalar;
    private String units;
    private Unit unit;
    private DimensionVector dimensions;
    private UnitSystem system;
    private Map<String, Double> quantityMap;
    private Quantity copyFrom;

    private Builder(UnitRegistry registry) {
      this.registry = checkNotNull(registry);
    }

    public Builder value(double value) {
      this.values = new double[] {value};
      this.scalar = true;
      return this;
    }

    public Builder values(double... values) {
      checkNotNull(values);
      checkArgument(values.length > 0, "An array quantity needs at least one value");
      this.values = values.clone();
      this.scalar = false;
      return this;
    }

    public Builder units(String units) {
      this.units = checkNotNull(units);
      return this;
    }

    public Builder unit(Unit unit) {
      this.unit = checkNotNull(unit);
      return this;
    }

    public Builder dimensions(DimensionVector dimensions) {
      this.dimensions = checkNotNull(dimensions);
      return this;
    }

    /**
     * Sets the unit system a dimension vector is expressed in.
     */
    public Builder system(UnitSystem system) {
      this.system = checkNotNull(system);
      return this;
    }

    public Builder quantityMap(Map<String, ? extends Number> quantityMap) {
      checkNotNull(quantityMap);
      ImmutableMap.Builder<String, Double> exponents = ImmutableMap.builder();
      for (Map.Entry<String, ? extends Number> entry : quantityMap.entrySet()) {
        exponents.put(entry.getKey(), entry.getValue().doubleValue());
      }
      this.quantityMap = exponents.build();
      return this;
    }

    public Builder copyFrom(Quantity copyFrom) {
      this.copyFrom = checkNotNull(copyFrom);
      return this;
    }

    /**
     * Builds the quantity, converting it to a preferred unit of the registry when one matches its
     * dimensions.
     *
     * @throws ExcessiveParametersException if more than one unit description is given
     * @throws InsufficientArgumentsException if there is neither a value nor a quantity to copy
     */
    public Quantity build() {
      int descriptions = (units != null ? 1 : 0) + (unit != null ? 1 : 0)
          + (dimensions != null ? 1 : 0) + (quantityMap != null ? 1 : 0)
          + (copyFrom != null ? 1 : 0);
      if (descriptions > 1) {
        throw new ExcessiveParametersException("Quantity only accepts one of: units, unit, "
            + "dimensions, quantity map or a quantity to copy from.");
      }
      if (system != null && dimensions == null) {
        throw new InsufficientArgumentsException("A unit system applies only to dimensions.");
      }
      if (values == null && copyFrom == null) {
        throw new InsufficientArgumentsException(
            "Requires at least one value or a quantity to copy from.");
      }

      Quantity quantity;
      if (copyFrom != null) {
        quantity = values == null
            ? copyFrom
            : create(values.clone(), scalar, copyFrom.unit);
      } else {
        quantity = create(values.clone(), scalar, resolveUnit());
      }

      Unit preferred = registry.getPreferredUnit(quantity.getDimensions());
      if (preferred != null && !preferred.equals(quantity.unit)) {
        LOG.fine("Converting " + quantity + " to preferred unit " + preferred);
        quantity = quantity.to(preferred);
      }
      return quantity;
    }

    private Unit resolveUnit() {
      if (units != null) {
        return registry.unit(units);
      } else if (unit != null) {
        return unit;
      } else if (dimensions != null) {
        UnitSystem target = system != null ? system : UnitSystem.builder(registry).build();
        return target.unitFor(dimensions);
      } else if (quantityMap != null) {
        return new QuantityMap(registry, quantityMap).getUnit();
      }
      return registry.dimensionless();
    }
  }
}
