package fsc;

import java.io.IOException;

public class ProjectFormatException extends IOException {
  private static final long serialVersionUID = 1L;

  public ProjectFormatException(String message) {
    super(message);
  }
}
