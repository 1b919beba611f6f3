package io.intellixity.pleco;

/**
 * Base type for errors raised while turning filter/sort/page input into a query-builder program.
 * <p>
 * All subtypes are raised synchronously at compile time and describe caller or configuration mistakes,
 * never transient conditions.
 */
public class PlecoException extends RuntimeException {
  public PlecoException(String message) {
    super(message);
  }

  public PlecoException(String message, Throwable cause) {
    super(message, cause);
  }
}
