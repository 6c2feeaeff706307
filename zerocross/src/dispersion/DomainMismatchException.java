package dispersion;

/**
 * Thrown when the frequency ranges of the spectrum, the configured
 * frequency limits and the reference curve do not overlap, or when fewer
 * than two spectrum samples remain inside the overlap.
 */
public class DomainMismatchException extends PickException {

  public DomainMismatchException(String message) {
    super(message);
  }

  private static final long serialVersionUID = 1L;
}
