package io.github.simbo1905.json.classschema.beans;

import io.github.simbo1905.json.classschema.BuiltinType;
import io.github.simbo1905.json.classschema.ClassSource;
import io.github.simbo1905.json.classschema.CompositeValue;
import io.github.simbo1905.json.classschema.HostException;
import io.github.simbo1905.json.classschema.PropertyDescriptor;
import io.github.simbo1905.json.classschema.SchemaHost;
import io.github.simbo1905.json.classschema.ValueKind;

import java.lang.reflect.Constructor;
import java.lang.reflect.Field;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Modifier;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import static io.github.simbo1905.json.classschema.beans.BeanHostLogging.LOG;

/// Presents plain Java classes as a reflective host.
///
/// Classes are known by simple name once registered; classes reached through
/// object fields are registered on the way. Properties are the instance
/// fields a class declares, in declaration order.
///
/// Every Java integral field is described as a plain 64-bit `INT`, so the
/// schema accepts any `long`. A value that does not fit a narrower field
/// (`int`, `short`, `byte`) passes validation and is refused at assignment
/// with a [HostException] naming `Class.field`, not a conversion failure.
///
/// ```java
/// JavaBeanHost host = new JavaBeanHost().register(Person.class);
/// SchemaLibrary library = new SchemaLibrary(host);
/// Person person = (Person) library.instantiate(host.sourceOf(Person.class), json);
/// ```
public final class JavaBeanHost implements SchemaHost {

  private final Map<String, Class<?>> classes = new ConcurrentHashMap<>();
  private final Map<String, Class<?>> enums = new ConcurrentHashMap<>();

  /// Make classes findable by their simple names
  public JavaBeanHost register(Class<?>... types) {
    for (Class<?> type : types) {
      sourceOf(type);
    }
    return this;
  }

  /// The class source of a type, registering it first
  public ClassSource sourceOf(Class<?> type) {
    Objects.requireNonNull(type, "type");
    String name = type.getSimpleName();
    Class<?> previous = classes.putIfAbsent(name, type);
    if (previous == null) {
      LOG.fine(() -> "register: " + name + " -> " + type.getName());
    } else if (previous != type) {
      LOG.severe(() -> "ERROR: BEANS: simple name clash " + name + " " + previous.getName() + " vs " + type.getName());
      throw new IllegalArgumentException("Simple name " + name + " already registered for " + previous.getName());
    }
    return ClassSource.named(name);
  }

  @Override
  public Optional<ClassSource> findClass(String className) {
    return classes.containsKey(className) ? Optional.of(ClassSource.named(className)) : Optional.empty();
  }

  @Override
  public List<PropertyDescriptor> propertyList(ClassSource source) {
    Class<?> type = classOf(source);
    List<PropertyDescriptor> descriptors = new ArrayList<>();
    for (Field field : properties(type)) {
      descriptors.add(describe(field));
    }
    LOG.finer(() -> "propertyList: " + source.definitionName() + " -> " + descriptors.size() + " properties");
    return descriptors;
  }

  @Override
  public Map<String, Long> enumVariants(ClassSource owner, String enumName) {
    Class<?> enumType = enums.get(owner.definitionName() + "." + enumName);
    if (enumType == null) {
      Class<?> ownerType = classes.get(owner.definitionName());
      if (ownerType != null) {
        for (Class<?> nested : ownerType.getDeclaredClasses()) {
          if (nested.isEnum() && nested.getSimpleName().equals(enumName)) {
            enumType = nested;
            break;
          }
        }
      }
    }
    if (enumType == null) {
      return Map.of();
    }
    Map<String, Long> variants = new LinkedHashMap<>();
    for (Object constant : enumType.getEnumConstants()) {
      Enum<?> value = (Enum<?>) constant;
      variants.put(value.name(), (long) value.ordinal());
    }
    return variants;
  }

  @Override
  public Optional<String> description(ClassSource source) {
    Description description = classOf(source).getAnnotation(Description.class);
    return description == null ? Optional.empty() : Optional.of(description.value());
  }

  @Override
  public Optional<String> propertyDescription(ClassSource source, String propertyName) {
    Field field = field(classOf(source), propertyName);
    Description description = field.getAnnotation(Description.class);
    return description == null ? Optional.empty() : Optional.of(description.value());
  }

  @Override
  public Object construct(ClassSource source) {
    Class<?> type = classOf(source);
    try {
      Constructor<?> constructor = type.getDeclaredConstructor();
      constructor.setAccessible(true);
      return constructor.newInstance();
    } catch (NoSuchMethodException e) {
      LOG.severe(() -> "ERROR: BEANS: no no-arg constructor on " + type.getName());
      throw new HostException(type.getName() + " has no no-arg constructor", e);
    } catch (InstantiationException | IllegalAccessException | InvocationTargetException e) {
      LOG.severe(() -> "ERROR: BEANS: construction failed for " + type.getName() + ": " + e);
      throw new HostException("Could not construct " + type.getName(), e);
    }
  }

  @Override
  public void setProperty(Object handle, String name, Object value) {
    Objects.requireNonNull(handle, "handle");
    Field field = field(handle.getClass(), name);
    Object coerced = ValueCoercion.coerce(field.getType(), field.getGenericType(), value,
        handle.getClass().getSimpleName() + "." + name);
    try {
      field.setAccessible(true);
      field.set(handle, coerced);
    } catch (IllegalAccessException | RuntimeException e) {
      LOG.severe(() -> "ERROR: BEANS: cannot assign " + name + " on " + handle.getClass().getName() + ": " + e);
      throw new HostException("Could not assign " + handle.getClass().getSimpleName() + "." + name, e);
    }
    LOG.finest(() -> "setProperty: " + handle.getClass().getSimpleName() + "." + name);
  }

  private Class<?> classOf(ClassSource source) {
    Class<?> type = classes.get(source.definitionName());
    if (type == null) {
      LOG.severe(() -> "ERROR: BEANS: unknown class " + source.definitionName());
      throw new HostException("Unknown class " + source.definitionName());
    }
    return type;
  }

  static List<Field> properties(Class<?> type) {
    List<Field> fields = new ArrayList<>();
    for (Field field : type.getDeclaredFields()) {
      int modifiers = field.getModifiers();
      if (Modifier.isStatic(modifiers) || Modifier.isTransient(modifiers) || field.isSynthetic()) {
        continue;
      }
      fields.add(field);
    }
    return Collections.unmodifiableList(fields);
  }

  private static Field field(Class<?> type, String name) {
    for (Field field : properties(type)) {
      if (field.getName().equals(name)) {
        return field;
      }
    }
    LOG.severe(() -> "ERROR: BEANS: no property " + name + " on " + type.getName());
    throw new HostException("No property " + name + " on " + type.getName());
  }

  private PropertyDescriptor describe(Field field) {
    Class<?> type = field.getType();
    String name = field.getName();
    if (type.isEnum()) {
      return PropertyDescriptor.enumeration(name, enumPath(type, field));
    }
    if (type == CompositeValue.class) {
      return PropertyDescriptor.of(name, builtin(field).kind());
    }
    if (type.isArray() || Collection.class.isAssignableFrom(type)) {
      Class<?> element = elementClass(field);
      if (element == null) {
        return PropertyDescriptor.of(name, ValueKind.ARRAY);
      }
      return PropertyDescriptor.typedArray(name, spelling(element, field));
    }
    ValueKind kind = kindOf(type);
    if (kind == ValueKind.OBJECT) {
      return PropertyDescriptor.object(name, sourceOf(type).definitionName());
    }
    return PropertyDescriptor.of(name, kind);
  }

  /// Element type name as the resolver reads array hints
  private String spelling(Class<?> element, Field field) {
    if (element.isEnum()) {
      return enumPath(element, field);
    }
    if (element == CompositeValue.class) {
      return builtin(field).schemaName();
    }
    if (element.isArray() || Collection.class.isAssignableFrom(element)) {
      return "Array";
    }
    switch (kindOf(element)) {
      case BOOL:
        return "bool";
      case INT:
        return "int";
      case FLOAT:
        return "float";
      case STRING:
        return "String";
      case DICTIONARY:
        return "Dictionary";
      case OBJECT:
        return sourceOf(element).definitionName();
      default:
        LOG.severe(() -> "ERROR: BEANS: unsupported element type " + element.getName() + " of " + field);
        throw new HostException("Unsupported element type " + element.getName() + " of " + field.getName());
    }
  }

  /// `Owner.Enum`; the owner is the enclosing class of a nested enum, else the class declaring the field
  private String enumPath(Class<?> enumType, Field field) {
    Class<?> owner = enumType.getEnclosingClass() != null ? enumType.getEnclosingClass() : field.getDeclaringClass();
    String path = sourceOf(owner).definitionName() + "." + enumType.getSimpleName();
    enums.putIfAbsent(path, enumType);
    return path;
  }

  private static BuiltinType builtin(Field field) {
    Builtin builtin = field.getAnnotation(Builtin.class);
    if (builtin == null) {
      LOG.severe(() -> "ERROR: BEANS: composite field without @Builtin " + field);
      throw new HostException("Field " + field.getName() + " holds a CompositeValue but has no @Builtin");
    }
    return builtin.value();
  }

  private static Class<?> elementClass(Field field) {
    if (field.getType().isArray()) {
      return field.getType().getComponentType();
    }
    Type generic = field.getGenericType();
    if (generic instanceof ParameterizedType parameterized) {
      Type[] arguments = parameterized.getActualTypeArguments();
      if (arguments.length == 1) {
        Type argument = arguments[0];
        if (argument instanceof Class<?> cls) {
          return cls == Object.class ? null : cls;
        }
        if (argument instanceof ParameterizedType nested && nested.getRawType() instanceof Class<?> raw) {
          return raw;
        }
      }
    }
    return null;
  }

  static ValueKind kindOf(Class<?> type) {
    if (type == boolean.class || type == Boolean.class) {
      return ValueKind.BOOL;
    }
    if (type == int.class || type == long.class || type == short.class || type == byte.class
        || type == Integer.class || type == Long.class || type == Short.class || type == Byte.class
        || type == BigInteger.class) {
      return ValueKind.INT;
    }
    if (type == float.class || type == double.class || type == Float.class || type == Double.class) {
      return ValueKind.FLOAT;
    }
    if (type == String.class || type == CharSequence.class) {
      return ValueKind.STRING;
    }
    if (Map.class.isAssignableFrom(type)) {
      return ValueKind.DICTIONARY;
    }
    if (type == Object.class || type.isPrimitive() || type.isInterface()) {
      return ValueKind.NIL;
    }
    return ValueKind.OBJECT;
  }
}
