package dispersion;

/**
 * Thrown when the final picks are too few or span too small a fraction of
 * the usable frequency range.
 */
public class InsufficientCoverageException extends PickException {

  public InsufficientCoverageException(String message) {
    super(message);
  }

  private static final long serialVersionUID = 1L;
}
