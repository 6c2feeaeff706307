package dispersion;

import static edu.mines.jtk.util.ArrayMath.*;

import edu.mines.jtk.util.Check;

/**
 * Picks a phase-velocity dispersion curve from the candidate velocities of
 * spectral zero crossings, guided by a reference curve.
 * <p>
 * Pickers never modify their inputs and keep no state between calls to
 * {@link #pick(Spectrum,ReferenceCurve)}. A failed pick throws a
 * {@link PickException}; no partial curve is returned.
 */
public abstract class DispersionPicker {

  /**
   * Constructs a picker for the specified interstation distance.
   * @param distance interstation distance, in km.
   * @param minCoverage default minimum coverage.
   */
  protected DispersionPicker(double distance, double minCoverage) {
    _zc = new ZeroCrossings(distance);
    _distance = distance;
    setMinimumCoverage(minCoverage);
  }

  /**
   * Sets the minimum frequency span of accepted picks, as a fraction of
   * the usable frequency width.
   */
  public void setMinimumCoverage(double minCoverage) {
    Check.argument(0.0<=minCoverage && minCoverage<=1.0,
      "0<=minCoverage<=1");
    _minCoverage = minCoverage;
  }

  public double getMinimumCoverage() {
    return _minCoverage;
  }

  /**
   * Sets the limits of candidate velocities. Defaults are 1.0 and 5.0 km/s.
   */
  public void setVelocityLimits(double vmin, double vmax) {
    _zc.setVelocityLimits(vmin,vmax);
  }

  /**
   * Sets the frequency range searched for crossings. Defaults are 0 and
   * 99 Hz.
   */
  public void setFrequencyLimits(double fmin, double fmax) {
    _zc.setFrequencyLimits(fmin,fmax);
  }

  public void setHorizontalPolarization(boolean horizontal) {
    _zc.setHorizontalPolarization(horizontal);
  }

  public void setSmoothSpectrum(boolean smooth) {
    _zc.setSmoothSpectrum(smooth);
  }

  public double getDistance() {
    return _distance;
  }

  /**
   * Returns the extractor used to find candidate crossings.
   */
  public ZeroCrossings getZeroCrossings() {
    return _zc;
  }

  /**
   * Extracts candidate crossings from a spectrum and picks a dispersion
   * curve from them.
   * @param s the cross-correlation spectrum.
   * @param ref the reference curve.
   * @return the crossings and picks.
   * @throws DomainMismatchException if the spectrum and reference curve do
   *  not overlap.
   * @throws InsufficientCoverageException if the picks are too few or
   *  cover too little of the frequency range.
   */
  public DispersionResult pick(Spectrum s, ReferenceCurve ref) {
    CrossingTable ct = _zc.extract(s,ref);
    PickSequence ps = pick(s,ct,ref);
    return new DispersionResult(ct,ps);
  }

  /**
   * Picks a dispersion curve from a table of candidate crossings.
   * @param s the spectrum the crossings were extracted from; null, if not
   *  available. Used only for amplitude gating.
   * @param ct the table of candidate crossings.
   * @param ref the reference curve.
   * @return the accepted picks.
   */
  public abstract PickSequence pick(
    Spectrum s, CrossingTable ct, ReferenceCurve ref);

  /**
   * Returns the usable frequency width: the reference domain intersected
   * with the frequency limits and, if specified, the frequency range of the
   * spectrum.
   * @throws DomainMismatchException if the intersection is empty.
   */
  protected double domainWidth(Spectrum s, ReferenceCurve ref) {
    double f0 = max(ref.getMinFrequency(),_zc.getMinFrequency());
    double f1 = min(ref.getMaxFrequency(),_zc.getMaxFrequency());
    if (s!=null) {
      f0 = max(f0,s.getFirstFrequency());
      f1 = min(f1,s.getLastFrequency());
    }
    if (f1<=f0)
      throw new DomainMismatchException(
        "reference domain ["+ref.getMinFrequency()+","+ref.getMaxFrequency()+
        "] does not overlap the usable frequency range");
    return f1-f0;
  }

  /**
   * Throws an exception unless the picks satisfy the acceptance rule.
   * @param ps the picks.
   * @param width the usable frequency width.
   * @param minPicks the smallest acceptable number of picks.
   */
  protected void checkCoverage(PickSequence ps, double width, int minPicks) {
    if (isAcceptable(ps,width,minPicks))
      return;
    if (ps.size()<minPicks)
      throw new InsufficientCoverageException(
        "only "+ps.size()+" picks, at least "+minPicks+" required");
    double coverage = ps.getSpan()/width;
    if (coverage<_minCoverage)
      throw new InsufficientCoverageException(
        "picks cover "+coverage+" of the frequency range,"+
        " at least "+_minCoverage+" required");
  }

  /**
   * Determines whether picks have at least minPicks picks and span at least
   * the minimum coverage of the usable frequency width.
   */
  protected boolean isAcceptable(PickSequence ps, double width, int minPicks) {
    return ps.size()>=minPicks && ps.getSpan()>=_minCoverage*width;
  }

  ///////////////////////////////////////////////////////////////////////////
  // private

  private ZeroCrossings _zc;
  private double _distance;
  private double _minCoverage;
}
