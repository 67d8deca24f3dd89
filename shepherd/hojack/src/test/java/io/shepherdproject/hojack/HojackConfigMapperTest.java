package io.shepherdproject.hojack;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.immutables.value.Value;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.google.common.truth.Truth.assertThat;
import static com.google.common.truth.Truth8.assertThat;

class HojackConfigMapperTest {
  private final HojackConfigMapper mapper = new HojackConfigMapper();

  @Test
  void numberedObjectBecomesList() {
    Config config = ConfigFactory.parseString("example.strings { 1: bar, 0: foo, 2: baz }").resolve();
    TestConfig mapped = mapper.mapSubConfig(config, "example", TestConfig.class);
    assertThat(mapped.strings).containsExactly("foo", "bar", "baz").inOrder();
  }

  @Test
  void humanDurationsAreParsed() {
    Config config = ConfigFactory.parseString("example { strings: [a], timeout: 12h, ignored: true }");
    TestConfig mapped = mapper.mapSubConfig(config, "example", TestConfig.class);
    assertThat(mapped.timeout).isEqualTo(Duration.ofHours(12));
    assertThat(mapped.strings).containsExactly("a");
  }

  @Test
  void nestedListsSurvive() {
    Config config = ConfigFactory.parseString("probes: [[uname, -a], [oc, version]]");
    List<?> probes = mapper.mapSubConfig(config, "probes", List.class);
    assertThat(probes).containsExactly(List.of("uname", "-a"), List.of("oc", "version")).inOrder();
  }

  @Test
  void numberedEntriesExtendAListByConcatenation() {
    Config config = ConfigFactory.parseString(
            "example.strings.0: foo, example.strings: ${?example.strings} [bar, baz]").resolve();
    TestConfig mapped = mapper.mapSubConfig(config, "example", TestConfig.class);
    assertThat(mapped.strings).containsExactly("foo", "bar", "baz").inOrder();
  }

  @Test
  void immutableValueWithCollections() {
    Config config = ConfigFactory.parseString(
            "tool { name: kubectl, probes: [[kubectl, version], [uname, -a]], labels { app: web }, timeout: 2s }");
    ToolConfig mapped = mapper.mapSubConfig(config, "tool", ToolConfig.class);

    assertThat(mapped.name()).isEqualTo("kubectl");
    assertThat(mapped.probes()).containsExactly(List.of("kubectl", "version"), List.of("uname", "-a")).inOrder();
    assertThat(mapped.labels()).containsExactly("app", "web");
    assertThat(mapped.timeout()).hasValue(Duration.ofSeconds(2));
  }

  @Test
  void immutableValueWithNumberedOverride() {
    Config config = ConfigFactory.parseString("tool.probes { 1: [oc, version], 0: [uname, -a] }")
            .withFallback(ConfigFactory.parseString("tool { name: oc, probes: [[kubectl, version]] }"));
    ToolConfig mapped = mapper.mapSubConfig(config, "tool", ToolConfig.class);

    assertThat(mapped.probes()).containsExactly(List.of("uname", "-a"), List.of("oc", "version")).inOrder();
    assertThat(mapped.labels()).isEmpty();
    assertThat(mapped.timeout()).isEmpty();
  }

  @Value.Immutable
  @JsonDeserialize(as = ImmutableToolConfig.class)
  interface ToolConfig {
    String name();

    List<List<String>> probes();

    Map<String, String> labels();

    Optional<Duration> timeout();
  }

  static class TestConfig {
    public List<String> strings;
    public Duration timeout;
  }
}
