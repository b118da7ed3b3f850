package io.github.simbo1905.json.classschema.beans;

import io.github.simbo1905.json.classschema.HostException;
import io.github.simbo1905.json.classschema.TypedArray;

import java.lang.reflect.Array;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static io.github.simbo1905.json.classschema.beans.BeanHostLogging.LOG;

/// Converts instantiated native values into the declared Java field types
final class ValueCoercion {

  private ValueCoercion() {}

  static Object coerce(Class<?> target, Type generic, Object value, String where) {
    if (value == null) {
      if (target.isPrimitive()) {
        throw failure(where, "null cannot be assigned to " + target.getName());
      }
      return null;
    }
    if (target == boolean.class || target == Boolean.class) {
      if (value instanceof Boolean) {
        return value;
      }
      throw mismatch(where, target, value);
    }
    if (target == long.class || target == Long.class) {
      return integral(value, Long.MIN_VALUE, Long.MAX_VALUE, where);
    }
    if (target == int.class || target == Integer.class) {
      return (int) integral(value, Integer.MIN_VALUE, Integer.MAX_VALUE, where);
    }
    if (target == short.class || target == Short.class) {
      return (short) integral(value, Short.MIN_VALUE, Short.MAX_VALUE, where);
    }
    if (target == byte.class || target == Byte.class) {
      return (byte) integral(value, Byte.MIN_VALUE, Byte.MAX_VALUE, where);
    }
    if (target == BigInteger.class) {
      if (value instanceof BigInteger) {
        return value;
      }
      if (value instanceof Long) {
        return BigInteger.valueOf((Long) value);
      }
      throw mismatch(where, target, value);
    }
    if (target == double.class || target == Double.class) {
      if (value instanceof Number number) {
        return number.doubleValue();
      }
      throw mismatch(where, target, value);
    }
    if (target == float.class || target == Float.class) {
      if (value instanceof Number number) {
        return number.floatValue();
      }
      throw mismatch(where, target, value);
    }
    if (target.isEnum()) {
      if (!(value instanceof Long)) {
        throw mismatch(where, target, value);
      }
      Object[] constants = target.getEnumConstants();
      long ordinal = (Long) value;
      if (ordinal < 0 || ordinal >= constants.length) {
        throw failure(where, "no " + target.getSimpleName() + " constant with ordinal " + ordinal);
      }
      return constants[(int) ordinal];
    }
    if (target.isArray()) {
      List<?> elements = elements(value, where);
      Class<?> component = target.getComponentType();
      Object array = Array.newInstance(component, elements.size());
      for (int i = 0; i < elements.size(); i++) {
        Array.set(array, i, coerce(component, component, elements.get(i), where + "[" + i + "]"));
      }
      return array;
    }
    if (Collection.class.isAssignableFrom(target)) {
      List<?> elements = elements(value, where);
      Class<?> elementType = elementClass(generic);
      Collection<Object> collection = Set.class.isAssignableFrom(target) ? new LinkedHashSet<>() : new ArrayList<>();
      for (int i = 0; i < elements.size(); i++) {
        Object element = elements.get(i);
        collection.add(elementType == null ? element : coerce(elementType, elementType, element, where + "[" + i + "]"));
      }
      return collection;
    }
    if (Map.class.isAssignableFrom(target)) {
      if (value instanceof Map<?, ?> map) {
        return new LinkedHashMap<>(map);
      }
      throw mismatch(where, target, value);
    }
    if (target == String.class || target == CharSequence.class) {
      if (value instanceof String) {
        return value;
      }
      throw mismatch(where, target, value);
    }
    if (target.isInstance(value)) {
      return value;
    }
    throw mismatch(where, target, value);
  }

  private static long integral(Object value, long min, long max, String where) {
    long result;
    if (value instanceof Long) {
      result = (Long) value;
    } else if (value instanceof BigInteger big && big.bitLength() < 64) {
      result = big.longValue();
    } else {
      throw failure(where, "expected an integer, got " + describe(value));
    }
    if (result < min || result > max) {
      throw failure(where, result + " outside [" + min + ", " + max + "]");
    }
    return result;
  }

  private static List<?> elements(Object value, String where) {
    if (value instanceof TypedArray typed) {
      return typed.values();
    }
    if (value instanceof List<?> list) {
      return list;
    }
    throw failure(where, "expected an array, got " + describe(value));
  }

  private static Class<?> elementClass(Type generic) {
    if (generic instanceof ParameterizedType parameterized) {
      Type[] arguments = parameterized.getActualTypeArguments();
      if (arguments.length == 1) {
        if (arguments[0] instanceof Class<?> cls) {
          return cls;
        }
        if (arguments[0] instanceof ParameterizedType nested && nested.getRawType() instanceof Class<?> raw) {
          return raw;
        }
      }
    }
    return null;
  }

  private static String describe(Object value) {
    return value.getClass().getSimpleName();
  }

  private static HostException mismatch(String where, Class<?> target, Object value) {
    return failure(where, "cannot assign " + describe(value) + " to " + target.getSimpleName());
  }

  private static HostException failure(String where, String message) {
    LOG.severe(() -> "ERROR: BEANS: " + where + ": " + message);
    return new HostException(where + ": " + message);
  }
}
