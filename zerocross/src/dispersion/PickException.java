package dispersion;

/**
 * Thrown when no dispersion measurement can be made for a station pair.
 * A failed pick is never a degraded result; no partial curve is available.
 */
public class PickException extends RuntimeException {

  public PickException(String message) {
    super(message);
  }

  private static final long serialVersionUID = 1L;
}
