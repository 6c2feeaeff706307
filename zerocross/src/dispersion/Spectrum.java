package dispersion;

import static edu.mines.jtk.util.ArrayMath.*;

import edu.mines.jtk.dsp.Sampling;
import edu.mines.jtk.util.Check;

/**
 * A cross-correlation spectrum sampled on a uniform, ascending frequency
 * axis. The spectrum may be real or complex. Instances are immutable;
 * accessors return copies.
 */
public class Spectrum {

  /**
   * Constructs a complex spectrum.
   * @param sf the frequency sampling; the first frequency must be >= 0.
   * @param re array of real parts.
   * @param im array of imaginary parts; null for a real spectrum.
   */
  public Spectrum(Sampling sf, double[] re, double[] im) {
    int n = sf.getCount();
    Check.argument(sf.getFirst()>=0.0,"frequencies are non-negative");
    Check.argument(sf.getDelta()>0.0,"frequencies are ascending");
    Check.argument(re.length==n,"re.length equals frequency count");
    Check.argument(im==null || im.length==n,"im.length equals frequency count");
    _sf = sf;
    _re = copy(re);
    _im = (im!=null)?copy(im):null;
  }

  /**
   * Constructs a complex spectrum from a uniformly sampled frequency array.
   * @param f array of ascending, uniformly spaced frequencies.
   * @param re array of real parts.
   * @param im array of imaginary parts; null for a real spectrum.
   */
  public Spectrum(double[] f, double[] re, double[] im) {
    this(sampling(f),re,im);
  }

  /**
   * Constructs a real spectrum from a uniformly sampled frequency array.
   * @param f array of ascending, uniformly spaced frequencies.
   * @param re array of spectrum values.
   */
  public Spectrum(double[] f, double[] re) {
    this(sampling(f),re,null);
  }

  public Sampling getSampling() {
    return _sf;
  }

  public int getCount() {
    return _sf.getCount();
  }

  public double getFrequency(int i) {
    return _sf.getValue(i);
  }

  public double getFirstFrequency() {
    return _sf.getFirst();
  }

  public double getLastFrequency() {
    return _sf.getLast();
  }

  public double[] getFrequencies() {
    return _sf.getValues();
  }

  public double[] getReal() {
    return copy(_re);
  }

  /**
   * Returns the imaginary parts; zeros for a real spectrum.
   */
  public double[] getImag() {
    return (_im!=null)?copy(_im):new double[_re.length];
  }

  /**
   * Returns the largest absolute value of the real part for frequencies
   * strictly between f0 and f1; zero if no sample lies in that range.
   */
  public double getPeakAmplitude(double f0, double f1) {
    double amax = 0.0;
    int n = _re.length;
    for (int i=0; i<n; ++i) {
      double f = _sf.getValue(i);
      if (f0<f && f<f1)
        amax = max(amax,abs(_re[i]));
    }
    return amax;
  }

  /**
   * Returns the largest absolute value of the real part.
   */
  public double getPeakAmplitude() {
    return max(abs(_re));
  }

  ///////////////////////////////////////////////////////////////////////////
  // private

  private Sampling _sf;
  private double[] _re;
  private double[] _im;

  private static Sampling sampling(double[] f) {
    int n = f.length;
    Check.argument(n>=2,"at least two frequencies");
    double df = (f[n-1]-f[0])/(n-1);
    Check.argument(df>0.0,"frequencies are ascending");
    for (int i=1; i<n; ++i) {
      double d = f[i]-f[i-1];
      Check.argument(abs(d-df)<=1.0e-4*df,"frequencies are uniformly spaced");
    }
    return new Sampling(n,df,f[0]);
  }
}
