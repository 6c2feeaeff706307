package dispersion;

/**
 * Thrown when the branches of candidate velocities are too dense to choose
 * a unique first pick and no earlier run of picks is available.
 */
public class AmbiguousFirstPickException extends InsufficientCoverageException {

  public AmbiguousFirstPickException(String message) {
    super(message);
  }

  private static final long serialVersionUID = 1L;
}
