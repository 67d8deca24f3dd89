package shepherd.util.exceptions;

@FunctionalInterface
public interface Fallible<E extends Exception> {
  void runOrThrow() throws E;
}
