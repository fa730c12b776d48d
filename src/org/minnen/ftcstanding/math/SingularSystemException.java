package org.minnen.ftcstanding.math;

/**
 * Thrown when a linear system has no unique, finite solution (pivot below epsilon or non-finite result).
 */
public class SingularSystemException extends Exception
{
  private static final long serialVersionUID = 1L;

  /** Column where elimination failed, or -1 if the failure was detected after elimination. */
  public final int          column;

  public SingularSystemException(int column, String message)
  {
    super(message);
    this.column = column;
  }
}
