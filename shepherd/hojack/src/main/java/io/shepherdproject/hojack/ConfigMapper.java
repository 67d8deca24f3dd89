package io.shepherdproject.hojack;

import com.typesafe.config.Config;

import java.lang.reflect.Type;

/**
 * Maps HOCON {@link Config} trees onto typed objects.
 * @see HojackConfigMapper
 */
public interface ConfigMapper {
  <T> T map(Object configObject, Type mappedType);

  default <T> T mapSubConfig(Config config, String path, Class<T> mappedType) {
    return mappedType.cast(mapSubConfig(config, path, (Type) mappedType));
  }

  default <T> T mapSubConfig(Config config, String path, Type mappedType) {
    return map(config.getValue(path).unwrapped(), mappedType);
  }
}
