package dispersion;

import static edu.mines.jtk.util.ArrayMath.*;

import org.apache.commons.math3.stat.regression.SimpleRegression;

import edu.mines.jtk.interp.CubicInterpolator;
import edu.mines.jtk.util.Check;

/**
 * A coarse a-priori phase-velocity curve, linearly interpolated between
 * control points. The interpolant is defined only inside the frequency
 * range of the control points, unless extrapolation is requested
 * explicitly.
 */
public class ReferenceCurve {

  /**
   * Constructs a reference curve.
   * @param f array of strictly increasing frequencies, in Hz.
   * @param v array of positive velocities, in km/s.
   */
  public ReferenceCurve(double[] f, double[] v) {
    int n = f.length;
    Check.argument(n>=2,"at least two control points");
    Check.argument(n==v.length,"f.length==v.length");
    for (int i=0; i<n; ++i) {
      Check.argument(v[i]>0.0,"velocities are positive");
      if (i>0)
        Check.argument(f[i]>f[i-1],"frequencies are strictly increasing");
    }
    _f = copy(f);
    _v = copy(v);
    _ci = new CubicInterpolator(
      CubicInterpolator.Method.LINEAR,toFloat(f),toFloat(v));
  }

  /**
   * Constructs a reference curve from rows of (frequency,velocity).
   * @param fv array[n][2] of control points.
   */
  public ReferenceCurve(double[][] fv) {
    this(column(fv,0),column(fv,1));
  }

  public double getMinFrequency() {
    return _f[0];
  }

  public double getMaxFrequency() {
    return _f[_f.length-1];
  }

  public double getMinVelocity() {
    return min(_v);
  }

  public double getMaxVelocity() {
    return max(_v);
  }

  /**
   * Returns the difference between largest and smallest velocity.
   */
  public double getVelocitySpan() {
    return getMaxVelocity()-getMinVelocity();
  }

  /**
   * Determines whether the frequency lies inside the domain of this curve.
   */
  public boolean contains(double f) {
    return getMinFrequency()<=f && f<=getMaxFrequency();
  }

  /**
   * Returns the reference velocity at frequency f.
   * @param f the frequency; must lie inside the domain of this curve.
   * @return the velocity.
   */
  public double velocity(double f) {
    return velocity(f,false);
  }

  /**
   * Returns the reference velocity at frequency f.
   * @param f the frequency.
   * @param extrapolate true, to extrapolate linearly outside the domain.
   * @return the velocity.
   */
  public double velocity(double f, boolean extrapolate) {
    if (!extrapolate)
      Check.argument(contains(f),"frequency "+f+" inside reference domain");
    return _ci.interpolate((float)f);
  }

  /**
   * Returns reference velocities at frequencies inside the domain.
   */
  public double[] velocities(double[] f) {
    int n = f.length;
    double[] v = new double[n];
    for (int i=0; i<n; ++i)
      v[i] = velocity(f[i]);
    return v;
  }

  /**
   * Returns the least-squares slope of this curve over the window
   * [f-window,f+window], or the part of it inside the domain.
   */
  public double slopeAt(double f, double window) {
    return slope(f-window,f+window);
  }

  /**
   * Returns the least-squares slope of this curve over the interval
   * [f0,f1], or the part of it inside the domain.
   */
  public double slope(double f0, double f1) {
    double a = max(f0,getMinFrequency());
    double b = min(f1,getMaxFrequency());
    if (b<=a)
      return segmentSlope(max(getMinFrequency(),min(f0,getMaxFrequency())));
    SimpleRegression sr = new SimpleRegression();
    double df = (b-a)/(SLOPE_SAMPLES-1);
    for (int i=0; i<SLOPE_SAMPLES; ++i) {
      double fi = a+i*df;
      sr.addData(fi,velocity(min(fi,b),true));
    }
    return sr.getSlope();
  }

  /**
   * Returns (v(f1)-v(f0))/(f1-f0), extrapolating outside the domain.
   */
  public double secantSlope(double f0, double f1) {
    Check.argument(f1>f0,"f1>f0");
    return (velocity(f1,true)-velocity(f0,true))/(f1-f0);
  }

  /**
   * Returns the control points as rows of (frequency,velocity).
   */
  public double[][] toArray() {
    int n = _f.length;
    double[][] fv = new double[n][];
    for (int i=0; i<n; ++i)
      fv[i] = new double[]{_f[i],_v[i]};
    return fv;
  }

  ///////////////////////////////////////////////////////////////////////////
  // private

  private static final int SLOPE_SAMPLES = 21;

  private double[] _f;
  private double[] _v;
  private CubicInterpolator _ci;

  private double segmentSlope(double f) {
    int n = _f.length;
    int i = 0;
    while (i<n-2 && f>=_f[i+1])
      ++i;
    return (_v[i+1]-_v[i])/(_f[i+1]-_f[i]);
  }

  private static double[] column(double[][] a, int j) {
    int n = a.length;
    double[] c = new double[n];
    for (int i=0; i<n; ++i)
      c[i] = a[i][j];
    return c;
  }

  private static float[] toFloat(double[] a) {
    int n = a.length;
    float[] b = new float[n];
    for (int i=0; i<n; ++i)
      b[i] = (float)a[i];
    return b;
  }
}
