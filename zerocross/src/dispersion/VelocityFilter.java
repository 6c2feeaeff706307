package dispersion;

import static edu.mines.jtk.util.ArrayMath.*;

import edu.mines.jtk.dsp.FftReal;
import edu.mines.jtk.dsp.Sampling;
import edu.mines.jtk.util.Check;
import util.Taper;

/**
 * Velocity filter for cross-correlation spectra. The spectrum is
 * transformed to a time-domain correlation, and lags corresponding to
 * velocities outside [cmin,cmax] at the interstation distance are muted
 * with a cosine-tapered window. The filtered correlation is transformed
 * back to a spectrum. Filtering often improves the signal-to-noise ratio of
 * zero crossings.
 * <p>
 * The spectrum must start at zero frequency; its N samples correspond to a
 * real correlation of 2*(N-1) samples with time sampling interval
 * 1/(2*fmax).
 */
public class VelocityFilter {

  /**
   * The filtered spectrum, correlation and window.
   */
  public static class Result {
    public Spectrum getSpectrum() {
      return _spectrum;
    }
    /**
     * Returns the filtered correlation, with lag 0 at index 0 and negative
     * lags wrapped to the end.
     */
    public double[] getCorrelation() {
      return copy(_correlation);
    }
    /**
     * Returns the filtered correlation with lag 0 at the center, to be
     * plotted against {@link #getTimes()}.
     */
    public double[] getCenteredCorrelation() {
      int nt = _correlation.length;
      double[] c = new double[nt];
      for (int it=0; it<nt; ++it)
        c[it] = _correlation[(it+nt/2)%nt];
      return c;
    }
    /**
     * Returns the window, with the same layout as the correlation.
     */
    public double[] getWindow() {
      return copy(_window);
    }
    /**
     * Returns the lag times of the centered correlation, in seconds.
     */
    public double[] getTimes() {
      int nt = _correlation.length;
      double[] t = new double[nt];
      for (int it=0; it<nt; ++it)
        t[it] = (it-0.5*nt)*_dt;
      return t;
    }
    private Result(Spectrum s, double[] c, double[] w, double dt) {
      _spectrum = s;
      _correlation = c;
      _window = w;
      _dt = dt;
    }
    private Spectrum _spectrum;
    private double[] _correlation;
    private double[] _window;
    private double _dt;
  }

  /**
   * Applies a velocity filter to a spectrum.
   * @param s the spectrum; first frequency must be zero.
   * @param distance interstation distance, in km.
   * @param cmin minimum velocity, in km/s.
   * @param cmax maximum velocity, in km/s.
   * @return the filtered spectrum, correlation and window.
   */
  public static Result apply(
      Spectrum s, double distance, double cmin, double cmax)
  {
    Check.argument(distance>0.0,"distance>0.0");
    Check.argument(0.0<cmin && cmin<cmax,"0<cmin<cmax");
    Sampling sf = s.getSampling();
    Check.argument(sf.getFirst()==0.0,"spectrum starts at zero frequency");
    int nf = sf.getCount();
    Check.argument(nf>=2,"at least two frequencies");
    int nt = 2*(nf-1);
    double dt = 1.0/(2.0*sf.getLast());
    int itmin = (int)(distance/cmax/dt*0.95);
    int itmax = min((int)(distance/cmin/dt*1.05),nt/2);
    itmin = min(itmin,itmax);
    double[] taper = Taper.cosine(itmax-itmin,0.1);
    double[] w = new double[nt];
    for (int k=0; k<taper.length; ++k) {
      w[itmin+k] = taper[k];
      int j = nt-itmax+1+k;
      if (j<nt)
        w[j] = taper[k];
    }
    double[] c = inverse(s.getReal(),s.getImag(),nt);
    mul(w,c,c);
    double[][] x = forward(c,nf);
    return new Result(new Spectrum(sf,x[0],x[1]),c,w,dt);
  }

  ///////////////////////////////////////////////////////////////////////////
  // private

  private static boolean isFftLength(int nt) {
    return nt%2==0 && FftReal.nfftSmall(nt)==nt;
  }

  // Real correlation of nt samples with the specified half spectrum.
  private static double[] inverse(double[] re, double[] im, int nt) {
    int nf = re.length;
    double[] c = new double[nt];
    if (isFftLength(nt)) {
      float[] cx = new float[nt+2];
      for (int k=0; k<nf; ++k) {
        cx[2*k  ] = (float)re[k];
        cx[2*k+1] = (float)im[k];
      }
      cx[1] = 0.0f;
      cx[2*nf-1] = 0.0f;
      float[] rx = new float[nt];
      new FftReal(nt).complexToReal(1,cx,rx);
      for (int it=0; it<nt; ++it)
        c[it] = rx[it]/nt;
    } else {
      for (int it=0; it<nt; ++it) {
        double sum = re[0]+re[nf-1]*((it%2==0)?1.0:-1.0);
        for (int k=1; k<nf-1; ++k) {
          double a = 2.0*PI*k*it/nt;
          sum += 2.0*(re[k]*cos(a)-im[k]*sin(a));
        }
        c[it] = sum/nt;
      }
    }
    return c;
  }

  // Half spectrum {re,im} of nf samples of a real correlation.
  private static double[][] forward(double[] c, int nf) {
    int nt = c.length;
    double[] re = new double[nf];
    double[] im = new double[nf];
    if (isFftLength(nt)) {
      float[] rx = new float[nt];
      for (int it=0; it<nt; ++it)
        rx[it] = (float)c[it];
      float[] cy = new float[nt+2];
      new FftReal(nt).realToComplex(-1,rx,cy);
      for (int k=0; k<nf; ++k) {
        re[k] = cy[2*k  ];
        im[k] = cy[2*k+1];
      }
    } else {
      for (int k=0; k<nf; ++k) {
        double sr = 0.0;
        double si = 0.0;
        for (int it=0; it<nt; ++it) {
          double a = 2.0*PI*k*it/nt;
          sr += c[it]*cos(a);
          si -= c[it]*sin(a);
        }
        re[k] = sr;
        im[k] = si;
      }
    }
    return new double[][]{re,im};
  }
}
