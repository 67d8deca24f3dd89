package io.shepherdproject.hojack;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.guava.GuavaModule;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;

import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * A {@link ConfigMapper} which hands the unwrapped HOCON tree to Jackson. Guava collections (as generated by
 * Immutables) and jdk8 {@link java.util.Optional Optionals} are supported.
 * <p/>
 * Before mapping, any object whose keys are all non-negative integers is folded into a list (ordered by index), so a
 * list can be written entry-by-entry, eg as system properties ({@code -Dshepherd.runner.environmentProbes.0=...}).
 * Note that such an object replaces a list defined elsewhere; to extend one, concatenate:
 * {@code strings.0: foo, strings: ${?strings} [bar, baz]}.
 */
public class HojackConfigMapper implements ConfigMapper {
  private final ObjectMapper objectMapper;

  public HojackConfigMapper() {
    this(buildDefaultObjectMapper());
  }

  public HojackConfigMapper(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  public static ObjectMapper buildDefaultObjectMapper() {
    return new ObjectMapper()
            .registerModule(new Jdk8Module())
            .registerModule(new GuavaModule())
            .registerModule(DurationConfigDeserializer.JACKSON_MODULE)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
  }

  @Override
  public <T> T map(Object configObject, Type mappedType) {
    JavaType javaType = objectMapper.constructType(mappedType);
    return objectMapper.convertValue(foldNumberedLists(configObject), javaType);
  }

  static Object foldNumberedLists(Object value) {
    if (value instanceof Map<?, ?> map) {
      if (!map.isEmpty() && map.keySet().stream().allMatch(HojackConfigMapper::isIndex)) {
        TreeMap<Integer, Object> byIndex = new TreeMap<>();
        map.forEach((k, v) -> byIndex.put(Integer.parseInt((String) k), foldNumberedLists(v)));
        return new ArrayList<>(byIndex.values());
      }
      Map<Object, Object> folded = new LinkedHashMap<>();
      map.forEach((k, v) -> folded.put(k, foldNumberedLists(v)));
      return folded;
    }
    if (value instanceof List<?> list) {
      List<Object> folded = new ArrayList<>(list.size());
      list.forEach(v -> folded.add(foldNumberedLists(v)));
      return folded;
    }
    return value;
  }

  private static boolean isIndex(Object key) {
    if (!(key instanceof String str) || str.isEmpty()) return false;
    for (int i = 0; i < str.length(); i++) {
      if (!Character.isDigit(str.charAt(i))) return false;
    }
    return true;
  }
}
