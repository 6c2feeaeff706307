package dispersion;

/**
 * The outcome of a successful dispersion pick: all candidate crossings and
 * the accepted picks.
 */
public class DispersionResult {

  public DispersionResult(CrossingTable crossings, PickSequence picks) {
    _crossings = crossings;
    _picks = picks;
  }

  public CrossingTable getCrossingTable() {
    return _crossings;
  }

  public PickSequence getPickSequence() {
    return _picks;
  }

  /**
   * Returns the candidate crossings as an array[n][2] of
   * (frequency,velocity).
   */
  public double[][] getCrossings() {
    return _crossings.toArray();
  }

  /**
   * Returns the picks as an array[n][2] of (frequency,velocity).
   */
  public double[][] getPicks() {
    return _picks.toArray();
  }

  private CrossingTable _crossings;
  private PickSequence _picks;
}
