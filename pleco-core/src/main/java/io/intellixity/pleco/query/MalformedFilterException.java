package io.intellixity.pleco.query;

import io.intellixity.pleco.PlecoException;

/** Raised when filter input does not have one of the recognized shapes. */
public final class MalformedFilterException extends PlecoException {
  public MalformedFilterException(String message) {
    super(message);
  }

  public MalformedFilterException(String message, Throwable cause) {
    super(message, cause);
  }
}
