package dispersion;

import static edu.mines.jtk.util.ArrayMath.*;

import org.apache.commons.math3.special.BesselJ;

/**
 * Synthetic spectra for tests.
 */
class Synthetics {

  /**
   * Returns the real spectrum J0(2*pi*f*d/v) for n frequencies 0, df, 2*df,
   * and so on.
   */
  static Spectrum besselJ0(double d, double v, double df, int n) {
    double[] f = new double[n];
    double[] re = new double[n];
    for (int i=0; i<n; ++i) {
      f[i] = i*df;
      re[i] = j0(2.0*PI*f[i]*d/v);
    }
    return new Spectrum(f,re);
  }

  /**
   * Returns the standard test spectrum: d=100 km, v=3 km/s, frequencies
   * 0 to 0.5 Hz.
   */
  static Spectrum besselJ0() {
    return besselJ0(DISTANCE,VELOCITY,0.0005,1001);
  }

  /**
   * Returns a table with the candidates of all kernel branches through
   * velocity v, at distance DISTANCE and frequencies f. Candidates at
   * frequencies marked as shifted lie half a cycle off these branches.
   * @param shifted array of flags; null, for no shifted frequencies.
   */
  static CrossingTable branches(double[] f, double v, boolean[] shifted) {
    double d = DISTANCE;
    int n = f.length;
    double[] cf = new double[n*120];
    double[] cv = new double[n*120];
    int nc = 0;
    for (int i=0; i<n; ++i) {
      double x = 2.0*PI*f[i]*d/v;
      double offset = (shifted!=null && shifted[i])?PI:0.0;
      for (int m=-60; m<60; ++m) {
        double z = x+offset+2.0*PI*m;
        if (z<=0.0)
          continue;
        double c = 2.0*PI*f[i]*d/z;
        if (1.0<c && c<5.0) {
          cf[nc] = f[i];
          cv[nc] = c;
          ++nc;
        }
      }
    }
    return new CrossingTable(copy(nc,cf),copy(nc,cv));
  }

  /**
   * Returns n flags, true for indices in [i0,i1).
   */
  static boolean[] band(int n, int i0, int i1) {
    boolean[] b = new boolean[n];
    for (int i=i0; i<i1; ++i)
      b[i] = true;
    return b;
  }

  static final double DISTANCE = 100.0;
  static final double VELOCITY = 3.0;

  static double j0(double x) {
    return (x==0.0)?1.0:BesselJ.value(0.0,x);
  }
}
