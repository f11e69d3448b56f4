package org.sensepitch.ipgeo.config;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.yaml.snakeyaml.nodes.MappingNode;
import org.yaml.snakeyaml.nodes.Node;
import org.yaml.snakeyaml.nodes.NodeTuple;
import org.yaml.snakeyaml.nodes.ScalarNode;
import org.yaml.snakeyaml.nodes.SequenceNode;

/**
 * Maps a SnakeYAML node tree onto configuration records, using the Lombok builder of each record.
 * Record components not present in the YAML keep the default of the record.
 *
 * @author Jens Wilke
 */
public class RecordConstructor {

  private static final Map<String, Boolean> BOOL_VALUES = new HashMap<>();

  static {
    BOOL_VALUES.put("yes", Boolean.TRUE);
    BOOL_VALUES.put("no", Boolean.FALSE);
    BOOL_VALUES.put("true", Boolean.TRUE);
    BOOL_VALUES.put("false", Boolean.FALSE);
    BOOL_VALUES.put("on", Boolean.TRUE);
    BOOL_VALUES.put("off", Boolean.FALSE);
  }

  @SuppressWarnings("unchecked")
  public static <T> T construct(Class<T> targetType, Node node) {
    if (targetType != null && targetType.isRecord() && node instanceof MappingNode mappingNode) {
      return (T) constructRecord((Class<? extends Record>) targetType, mappingNode);
    }
    throw new IllegalArgumentException(
        "Cannot construct record of type " + (targetType == null ? null : targetType.getName()));
  }

  static Object constructRecord(Class<? extends Record> recordClass, MappingNode node) {
    try {
      Method builderMethod = recordClass.getMethod("builder");
      Object builder = builderMethod.invoke(null);
      for (NodeTuple t : node.getValue()) {
        String key = scalarValue(t.getKeyNode());
        Method setMethod = findMethod(builder.getClass(), key);
        if (setMethod == null) {
          throw new IllegalArgumentException(
              "Unknown configuration key '" + key + "' for " + recordClass.getSimpleName());
        }
        Type type = setMethod.getGenericParameterTypes()[0];
        setMethod.invoke(builder, createValueObject(type, t.getValueNode()));
      }
      Method buildMethod = builder.getClass().getMethod("build");
      return buildMethod.invoke(builder);
    } catch (IllegalAccessException | InvocationTargetException | NoSuchMethodException e) {
      throw new IllegalStateException(e);
    }
  }

  static Object createValueObject(Type type, Node node) {
    if (type instanceof ParameterizedType parameterizedType) {
      Class<?> owner = (Class<?>) parameterizedType.getRawType();
      if (List.class.isAssignableFrom(owner)) {
        if (!(node instanceof SequenceNode sequenceNode)) {
          throw new IllegalArgumentException("Sequence expected");
        }
        Type elementType = parameterizedType.getActualTypeArguments()[0];
        List<Object> list = new ArrayList<>();
        sequenceNode.getValue().forEach(val -> list.add(createValueObject(elementType, val)));
        return list;
      }
      throw new IllegalArgumentException("Unsupported type " + type);
    }
    Class<?> cls = (Class<?>) type;
    if (cls.isRecord()) {
      return construct(cls, node);
    }
    return convertScalar(cls, scalarValue(node));
  }

  /** Converts text into one of the supported scalar types, shared with {@link EnvInjector}. */
  static Object convertScalar(Class<?> type, String text) {
    if (type.equals(String.class)) {
      return text;
    } else if (type.equals(int.class) || type.equals(Integer.class)) {
      return Integer.valueOf(text.trim());
    } else if (type.equals(long.class) || type.equals(Long.class)) {
      return Long.valueOf(text.trim());
    } else if (type.equals(boolean.class) || type.equals(Boolean.class)) {
      Boolean value = BOOL_VALUES.get(text.trim().toLowerCase());
      if (value == null) {
        throw new IllegalArgumentException("Boolean expected, got '" + text + "'");
      }
      return value;
    }
    throw new IllegalArgumentException("Unsupported type " + type.getName());
  }

  static Method findMethod(Class<?> builderClass, String methodName) {
    for (Method m : builderClass.getMethods()) {
      if (m.getParameterCount() == 1 && m.getName().equals(methodName)) {
        return m;
      }
    }
    return null;
  }

  static String scalarValue(Node n) {
    if (!(n instanceof ScalarNode scalarNode)) {
      throw new IllegalArgumentException("Scalar expected");
    }
    return scalarNode.getValue();
  }
}
