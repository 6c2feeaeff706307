package dispersion;

import static edu.mines.jtk.util.ArrayMath.*;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

import bessel.BesselZeros;
import edu.mines.jtk.util.Check;
import util.SmoothingSpline;

/**
 * Extracts zero crossings from the real part of a cross-correlation
 * spectrum and converts them to candidate phase velocities.
 * <p>
 * A crossing at frequency f that matches kernel zero z corresponds to
 * velocity 2*pi*f*d/z, where d is the interstation distance. Crossings from
 * negative to positive values are matched against zeros with odd index,
 * crossings from positive to negative values against zeros with even
 * index. Only velocities strictly inside the velocity limits are kept.
 */
public class ZeroCrossings {

  /**
   * Direction of a zero crossing.
   */
  public enum Direction {
    /** From positive to negative values. */
    TO_NEGATIVE,
    /** From negative to positive values. */
    TO_POSITIVE
  }

  /**
   * A zero crossing of the real spectrum.
   */
  public static class ZeroCrossing {
    public ZeroCrossing(double frequency, Direction direction) {
      _frequency = frequency;
      _direction = direction;
    }
    public double getFrequency() {
      return _frequency;
    }
    public Direction getDirection() {
      return _direction;
    }
    private double _frequency;
    private Direction _direction;
  }

  /**
   * Constructs an extractor for the specified interstation distance.
   * @param distance interstation distance, in km.
   */
  public ZeroCrossings(double distance) {
    Check.argument(distance>0.0,"distance>0.0");
    _distance = distance;
  }

  /**
   * Sets the limits of candidate velocities. Defaults are 1.0 and 5.0 km/s.
   * @param vmin minimum velocity.
   * @param vmax maximum velocity.
   */
  public void setVelocityLimits(double vmin, double vmax) {
    Check.argument(vmin>0.0,"vmin>0.0");
    Check.argument(vmin<vmax,"vmin<vmax");
    _vmin = vmin;
    _vmax = vmax;
  }

  /**
   * Sets the limits of frequencies searched for crossings. Defaults are
   * 0 and 99 Hz.
   * @param fmin minimum frequency.
   * @param fmax maximum frequency.
   */
  public void setFrequencyLimits(double fmin, double fmax) {
    Check.argument(fmin<=fmax,"fmin<=fmax");
    _fmin = fmin;
    _fmax = fmax;
  }

  /**
   * Sets the polarization of the spectrum. For horizontal polarization
   * (Love waves, radial Rayleigh waves) the kernel is J0-J2, otherwise J0.
   * Default is false.
   */
  public void setHorizontalPolarization(boolean horizontal) {
    _kernel = horizontal?BesselZeros.Kernel.J0_MINUS_J2:BesselZeros.Kernel.J0;
  }

  /**
   * Enables or disables smoothing of the real spectrum with a
   * least-squares spline before crossings are detected. Default is false.
   */
  public void setSmoothSpectrum(boolean smooth) {
    _smooth = smooth;
  }

  public double getDistance() {
    return _distance;
  }

  public double getMinVelocity() {
    return _vmin;
  }

  public double getMaxVelocity() {
    return _vmax;
  }

  public double getMinFrequency() {
    return _fmin;
  }

  public double getMaxFrequency() {
    return _fmax;
  }

  /**
   * Returns the candidate velocities for all crossings in the frequency
   * limits.
   * @param s the spectrum.
   * @return the table of candidates.
   */
  public CrossingTable extract(Spectrum s) {
    return extract(s,null);
  }

  /**
   * Returns the candidate velocities for all crossings in the frequency
   * limits and inside the domain of a reference curve.
   * @param s the spectrum.
   * @param ref the reference curve; null, for no domain restriction.
   * @return the table of candidates.
   * @throws DomainMismatchException if the frequency range holds fewer than
   *  two samples of the spectrum.
   */
  public CrossingTable extract(Spectrum s, ReferenceCurve ref) {
    double[] f = s.getFrequencies();
    double[] r = realPart(s);
    double f0 = _fmin;
    double f1 = _fmax;
    if (ref!=null) {
      f0 = max(f0,ref.getMinFrequency());
      f1 = min(f1,ref.getMaxFrequency());
    }
    int i0 = 0;
    int n = f.length;
    while (i0<n && f[i0]<f0)
      ++i0;
    int i1 = n-1;
    while (i1>=0 && f[i1]>f1)
      --i1;
    if (i1-i0+1<2)
      throw new DomainMismatchException(
        "frequency range ["+f0+","+f1+"] holds fewer than two samples"+
        " of the spectrum ["+s.getFirstFrequency()+","+s.getLastFrequency()+"]");
    int m = i1-i0+1;
    double[] fr = copy(m,i0,f);
    double[] rr = copy(m,i0,r);
    List<ZeroCrossing> crossings = findCrossings(fr,rr);
    double maxf = fr[m-1];
    double[] zeros = BesselZeros.compute(maxf,_distance,_vmin,_kernel);
    double[] zneg = BesselZeros.toNegative(zeros);
    double[] zpos = BesselZeros.toPositive(zeros);
    int nc = 0;
    double[] cf = new double[crossings.size()*max(1,zeros.length)];
    double[] cv = new double[cf.length];
    for (ZeroCrossing zc:crossings) {
      double fc = zc.getFrequency();
      double[] z = (zc.getDirection()==Direction.TO_POSITIVE)?zpos:zneg;
      for (double zk:z) {
        double v = fc*2.0*PI*_distance/zk;
        if (_vmin<v && v<_vmax) {
          cf[nc] = fc;
          cv[nc] = v;
          ++nc;
        }
      }
    }
    trace("extract: "+crossings.size()+" crossings, "+nc+" candidates"+
          " in ["+fr[0]+","+maxf+"] Hz");
    return new CrossingTable(copy(nc,cf),copy(nc,cv));
  }

  /**
   * Returns the zero crossings of sampled values. A crossing lies between
   * samples i and i+1 where y[i]*y[i+1]&lt;0; its frequency is found by
   * linear interpolation. The direction follows from the sign of y[i].
   * @param f array of increasing frequencies.
   * @param y array of values.
   * @return list of crossings, in increasing order of frequency.
   */
  public static List<ZeroCrossing> findCrossings(double[] f, double[] y) {
    Check.argument(f.length==y.length,"f.length==y.length");
    List<ZeroCrossing> list = new ArrayList<ZeroCrossing>();
    int n = f.length;
    for (int i=0; i<n-1; ++i) {
      if (y[i]*y[i+1]<0.0) {
        double fc = f[i]-y[i]/(y[i+1]-y[i])*(f[i+1]-f[i]);
        Direction d = (y[i]<0.0)?Direction.TO_POSITIVE:Direction.TO_NEGATIVE;
        list.add(new ZeroCrossing(fc,d));
      }
    }
    return list;
  }

  ///////////////////////////////////////////////////////////////////////////
  // private

  private static final Logger log =
    Logger.getLogger(ZeroCrossings.class.getName());

  private double _distance;
  private double _vmin = 1.0;
  private double _vmax = 5.0;
  private double _fmin = 0.0;
  private double _fmax = 99.0;
  private boolean _smooth = false;
  private BesselZeros.Kernel _kernel = BesselZeros.Kernel.J0;

  // Real part, smoothed over the full spectrum if requested. Knots are
  // spaced 0.5/distance, but never closer than two samples.
  private double[] realPart(Spectrum s) {
    double[] r = s.getReal();
    if (!_smooth || r.length<=4)
      return r;
    double[] f = s.getFrequencies();
    double df = s.getSampling().getDelta();
    double dt = max(0.5/_distance,2.0*df);
    return SmoothingSpline.withKnotSpacing(f,r,dt).evaluate(f);
  }

  private static void trace(String s) {
    log.fine(s);
  }
}
