package com.featureprobe.sdk;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.google.gson.annotations.JsonAdapter;
import com.google.gson.stream.JsonWriter;

import java.io.IOException;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * An immutable instance of any data type that is allowed in JSON.
 * <p>
 * Toggle variations are held as {@link FPValue}s, so the SDK never has to guess at the runtime
 * type of a served value. Each kind has its own subclass and reports itself through {@link #getType()};
 * the typed accessors ({@link #booleanValue()}, {@link #doubleValue()}, {@link #stringValue()}) return
 * a neutral value (false, zero, null) for any other kind rather than throwing.
 * <p>
 * Values are compared deeply, so two arrays with equal elements are equal.
 */
@JsonAdapter(FPValueTypeAdapter.class)
public abstract class FPValue {
  static final Gson gson = new Gson();

  /**
   * Returns the same value if non-null, or {@link #ofNull()} if null.
   *
   * @param value an {@link FPValue} or null
   * @return an {@link FPValue} which will never be a null reference
   */
  public static FPValue normalize(FPValue value) {
    return value == null ? ofNull() : value;
  }

  /**
   * Returns an instance for a null value.
   *
   * @return an FPValue containing null
   */
  public static FPValue ofNull() {
    return FPValueNull.INSTANCE;
  }

  /**
   * Returns an instance for a boolean value.
   *
   * @param value a boolean value
   * @return an FPValue containing that value
   */
  public static FPValue of(boolean value) {
    return FPValueBool.fromBoolean(value);
  }

  /**
   * Returns an instance for a numeric value.
   *
   * @param value an integer numeric value
   * @return an FPValue containing that value
   */
  public static FPValue of(int value) {
    return FPValueNumber.fromDouble(value);
  }

  /**
   * Returns an instance for a numeric value.
   *
   * @param value a long integer numeric value
   * @return an FPValue containing that value
   */
  public static FPValue of(long value) {
    return FPValueNumber.fromDouble(value);
  }

  /**
   * Returns an instance for a numeric value.
   *
   * @param value a floating-point numeric value
   * @return an FPValue containing that value
   */
  public static FPValue of(double value) {
    return FPValueNumber.fromDouble(value);
  }

  /**
   * Returns an instance for a string value (or a null).
   *
   * @param stringValue a nullable String reference
   * @return an FPValue containing a string, or {@link #ofNull()} if the value was null
   */
  public static FPValue of(String stringValue) {
    return stringValue == null ? ofNull() : FPValueString.fromString(stringValue);
  }

  /**
   * Shortcut for creating an array of values.
   *
   * @param values any number of values
   * @return an immutable array value
   */
  public static FPValue arrayOf(FPValue... values) {
    ArrayBuilder ab = buildArray();
    for (FPValue v: values) {
      ab.add(v);
    }
    return ab.build();
  }

  /**
   * Starts building an array value.
   *
   * @return an {@link ArrayBuilder}
   */
  public static ArrayBuilder buildArray() {
    return new ArrayBuilder();
  }

  /**
   * Starts building an object value.
   *
   * @return an {@link ObjectBuilder}
   */
  public static ObjectBuilder buildObject() {
    return new ObjectBuilder();
  }

  /**
   * Parses a value from a JSON string.
   *
   * @param json a JSON string
   * @return the parsed value
   * @throws JsonParseException if the string is not valid JSON
   */
  public static FPValue parse(String json) {
    return normalize(gson.fromJson(json, FPValue.class));
  }

  /**
   * Returns the kind of this value.
   *
   * @return the value type
   */
  public abstract FPValueType getType();

  /**
   * Tests whether this value is a null.
   *
   * @return true if this is a null value
   */
  public boolean isNull() {
    return false;
  }

  /**
   * Tests whether this value is a number.
   *
   * @return true if this is a numeric value
   */
  public boolean isNumber() {
    return false;
  }

  /**
   * Tests whether this value is a string.
   *
   * @return true if this is a string value
   */
  public boolean isString() {
    return false;
  }

  /**
   * Returns this value as a boolean if it is explicitly a boolean. Otherwise returns false.
   *
   * @return a boolean
   */
  public boolean booleanValue() {
    return false;
  }

  /**
   * Returns this value as a {@code double} if it is numeric. Otherwise returns zero.
   *
   * @return a double value
   */
  public double doubleValue() {
    return 0;
  }

  /**
   * Returns this value as a {@code String} if it is a string. Otherwise returns null.
   *
   * @return a nullable string value
   */
  public String stringValue() {
    return null;
  }

  /**
   * Returns the number of elements in an array or object. Returns zero for all other types.
   *
   * @return the number of array elements or object properties
   */
  public int size() {
    return 0;
  }

  /**
   * Enumerates the property names in an object. Empty for all other types.
   *
   * @return the property names
   */
  public Iterable<String> keys() {
    return Collections.emptyList();
  }

  /**
   * Enumerates the values in an array or object. Empty for all other types.
   *
   * @return the values
   */
  public Iterable<FPValue> values() {
    return Collections.emptyList();
  }

  /**
   * Returns an array element by index, or {@link #ofNull()} if out of range or not an array.
   *
   * @param index the array index
   * @return the element value
   */
  public FPValue get(int index) {
    return ofNull();
  }

  /**
   * Returns an object property by name, or {@link #ofNull()} if not found or not an object.
   *
   * @param name the property name
   * @return the property value
   */
  public FPValue get(String name) {
    return ofNull();
  }

  /**
   * Converts this value to its JSON serialization.
   *
   * @return a JSON string
   */
  public String toJsonString() {
    StringWriter sw = new StringWriter();
    try (JsonWriter jw = new JsonWriter(sw)) {
      write(jw);
    } catch (IOException e) {
      throw new IllegalStateException(e); // StringWriter does not do I/O
    }
    return sw.toString();
  }

  abstract void write(JsonWriter writer) throws IOException;

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof FPValue)) {
      return false;
    }
    FPValue other = (FPValue)o;
    if (getType() != other.getType()) {
      return false;
    }
    switch (getType()) {
    case NULL:
      return true;
    case BOOLEAN:
      return booleanValue() == other.booleanValue();
    case NUMBER:
      return doubleValue() == other.doubleValue();
    case STRING:
      return stringValue().equals(other.stringValue());
    case ARRAY:
      if (size() != other.size()) {
        return false;
      }
      for (int i = 0; i < size(); i++) {
        if (!get(i).equals(other.get(i))) {
          return false;
        }
      }
      return true;
    case OBJECT:
      if (size() != other.size()) {
        return false;
      }
      for (String name: keys()) {
        if (!get(name).equals(other.get(name))) {
          return false;
        }
      }
      return true;
    default:
      return false;
    }
  }

  @Override
  public int hashCode() {
    switch (getType()) {
    case BOOLEAN:
      return Boolean.hashCode(booleanValue());
    case NUMBER:
      // 0.0 and -0.0 are equal, so they must hash alike
      return doubleValue() == 0 ? 0 : Double.hashCode(doubleValue());
    case STRING:
      return stringValue().hashCode();
    case ARRAY: {
      int h = 1;
      Iterator<FPValue> it = values().iterator();
      while (it.hasNext()) {
        h = h * 31 + it.next().hashCode();
      }
      return h;
    }
    case OBJECT: {
      // equality ignores property order, and so does the hash
      int h = 0;
      for (String name: keys()) {
        h += name.hashCode() ^ get(name).hashCode();
      }
      return h;
    }
    default:
      return 0;
    }
  }

  @Override
  public String toString() {
    return toJsonString();
  }

  /**
   * Builder for array values.
   */
  public static final class ArrayBuilder {
    private final List<FPValue> list = new ArrayList<>();

    /**
     * Adds a value to the array.
     *
     * @param value the element to add; null is stored as {@link FPValue#ofNull()}
     * @return the builder
     */
    public ArrayBuilder add(FPValue value) {
      list.add(normalize(value));
      return this;
    }

    /**
     * Returns the completed array.
     *
     * @return an immutable array value
     */
    public FPValue build() {
      return FPValueArray.fromList(list);
    }
  }

  /**
   * Builder for object values.
   */
  public static final class ObjectBuilder {
    private final Map<String, FPValue> map = new LinkedHashMap<>();

    /**
     * Sets a property, replacing any previous value with the same name.
     *
     * @param name the property name
     * @param value the property value; null is stored as {@link FPValue#ofNull()}
     * @return the builder
     */
    public ObjectBuilder put(String name, FPValue value) {
      map.put(Objects.requireNonNull(name), normalize(value));
      return this;
    }

    /**
     * Returns the completed object.
     *
     * @return an immutable object value
     */
    public FPValue build() {
      return FPValueObject.fromMap(map);
    }
  }
}
