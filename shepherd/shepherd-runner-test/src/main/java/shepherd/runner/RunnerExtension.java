package shepherd.runner;

import org.junit.jupiter.api.extension.ExtensionContext;
import org.junit.jupiter.api.extension.ParameterContext;
import org.junit.jupiter.api.extension.ParameterResolver;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * A junit-jupiter extension which supplies each test with a fresh {@link RunnerFixture}, so track numbering
 * starts at 1 in every test.
 *
 * Example:
 * <pre>{@code
 * @ExtendWith(RunnerExtension.class)
 * class MyCommandTest {
 *   @Test
 *   void listsPods(RunnerFixture fixture) {
 *     String pods = fixture.runner().getOutput(List.of("kubectl", "get", "pods"));
 *     assertThat(fixture.output().messages()).contains("[1] Capturing: kubectl get pods");
 *   }
 * }
 * }</pre>
 */
public class RunnerExtension implements ParameterResolver {
  @Override
  public boolean supportsParameter(ParameterContext parameterContext, ExtensionContext extensionContext) {
    return parameterContext.getParameter().getType() == RunnerFixture.class;
  }

  @Override
  public RunnerFixture resolveParameter(ParameterContext parameterContext, ExtensionContext extensionContext) {
    try {
      Path cacheDir = Files.createTempDirectory("shepherd-cache");
      cacheDir.toFile().deleteOnExit();
      return RunnerFixture.withCacheDir(cacheDir);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }
}
