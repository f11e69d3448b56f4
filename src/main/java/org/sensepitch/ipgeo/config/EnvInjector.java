package org.sensepitch.ipgeo.config;

import java.lang.reflect.Method;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.RecordComponent;
import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Fills a configuration record builder from environment variables. A record component maps to
 * the upper case snake case variable name below the prefix, nested records extend the prefix, e.g.
 * {@code IPGEO_DATABASE_RELOAD_INTERVAL_SECONDS}. Lists of text are comma separated.
 *
 * @author Jens Wilke
 */
public class EnvInjector {

  /**
   * @param builder the Lombok builder of the record
   * @return the built record
   */
  public static Object injectFromEnv(String prefix, Map<String, String> env, Object builder) {
    try {
      Class<?> recordClass = builder.getClass().getMethod("build").getReturnType();
      for (RecordComponent component : recordClass.getRecordComponents()) {
        String name = prefix + toEnvName(component.getName());
        Method setter = RecordConstructor.findMethod(builder.getClass(), component.getName());
        if (setter == null) {
          continue;
        }
        Object value = valueFromEnv(name, component.getGenericType(), env);
        if (value != null) {
          setter.invoke(builder, value);
        }
      }
      return builder.getClass().getMethod("build").invoke(builder);
    } catch (ReflectiveOperationException e) {
      throw new IllegalStateException(e);
    }
  }

  private static Object valueFromEnv(String name, Type type, Map<String, String> env)
      throws ReflectiveOperationException {
    if (type instanceof ParameterizedType parameterizedType) {
      Class<?> owner = (Class<?>) parameterizedType.getRawType();
      Type elementType = parameterizedType.getActualTypeArguments()[0];
      if (List.class.isAssignableFrom(owner) && elementType instanceof Class<?> elementClass) {
        String text = env.get(name);
        if (text == null) {
          return null;
        }
        List<Object> list = new ArrayList<>();
        for (String item : text.split(",")) {
          if (!item.isBlank()) {
            list.add(RecordConstructor.convertScalar(elementClass, item.trim()));
          }
        }
        return list;
      }
      throw new IllegalArgumentException("Unsupported type " + type + " for " + name);
    }
    Class<?> cls = (Class<?>) type;
    if (cls.isRecord()) {
      String nestedPrefix = name + "_";
      if (env.keySet().stream().noneMatch(k -> k.startsWith(nestedPrefix))) {
        return null;
      }
      Object nestedBuilder = cls.getMethod("builder").invoke(null);
      return injectFromEnv(nestedPrefix, env, nestedBuilder);
    }
    String text = env.get(name);
    if (text == null) {
      return null;
    }
    return RecordConstructor.convertScalar(cls, text);
  }

  /** {@code trustProxyHeaders} becomes {@code TRUST_PROXY_HEADERS} */
  static String toEnvName(String componentName) {
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < componentName.length(); i++) {
      char c = componentName.charAt(i);
      if (Character.isUpperCase(c) && i > 0) {
        sb.append('_');
      }
      sb.append(c);
    }
    return sb.toString().toUpperCase(Locale.ROOT);
  }
}
