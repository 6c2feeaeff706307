package bessel;

import static edu.mines.jtk.util.ArrayMath.*;

import org.apache.commons.math3.special.BesselJ;

import edu.mines.jtk.util.Check;

/**
 * Zeros of the Bessel kernels that relate the real part of an ambient-noise
 * cross-correlation spectrum to phase velocity. For a station pair at
 * distance r the real spectrum behaves like K(2*pi*f*r/c), where K is either
 * J0 (vertical components) or J0-J2 (Love waves and the radial component of
 * Rayleigh waves, see Aki 1957).
 * <p>
 * Both kernels equal 1 at x=0, so zeros with even index (0,2,4,...) are
 * crossings from positive to negative values and zeros with odd index are
 * crossings from negative to positive values.
 */
public class BesselZeros {

  /**
   * Kernel functions.
   */
  public enum Kernel {
    /** Bessel function of the first kind of order 0. */
    J0,
    /** Difference J0-J2 of Bessel functions of order 0 and 2. */
    J0_MINUS_J2
  }

  /**
   * Returns the ordered zeros of the kernel needed to interpret zero
   * crossings up to a maximum frequency. The zeros cover the argument range
   * [0,2*pi*fmax*distance/vmin].
   * @param fmax maximum frequency, in Hz.
   * @param distance interstation distance, in km.
   * @param vmin minimum velocity, in km/s.
   * @param kernel the kernel function.
   * @return array of zeros, in increasing order; may be empty.
   */
  public static double[] compute(
      double fmax, double distance, double vmin, Kernel kernel)
  {
    Check.argument(fmax>=0.0,"fmax>=0.0");
    Check.argument(distance>0.0,"distance>0.0");
    Check.argument(vmin>0.0,"vmin>0.0");
    int nz = count(fmax,distance,vmin);
    if (nz<1)
      return new double[0];
    if (kernel==Kernel.J0)
      return zerosJ0(nz);
    return zerosJ0J2(nz,2.0*PI*fmax*distance/vmin);
  }

  /**
   * Returns the number of zeros needed for the specified frequency, distance
   * and minimum velocity.
   */
  public static int count(double fmax, double distance, double vmin) {
    return (int)(2.0*fmax*distance/vmin);
  }

  /**
   * Returns the first n zeros of J0. Starting values are McMahon's
   * asymptotic estimates, refined by Newton iterations.
   * @param n the number of zeros.
   * @return array[n] of zeros.
   */
  public static double[] zerosJ0(int n) {
    double[] z = new double[n];
    for (int k=1; k<=n; ++k) {
      double b = (k-0.25)*PI;
      double x = b+1.0/(8.0*b)-31.0/(384.0*b*b*b);
      for (int iter=0; iter<NEWTON_ITERATIONS; ++iter) {
        double dx = BesselJ.value(0.0,x)/BesselJ.value(1.0,x); // J0' = -J1
        x += dx;
        if (abs(dx)<=NEWTON_TOLERANCE*x)
          break;
      }
      z[k-1] = x;
    }
    return z;
  }

  /**
   * Returns the zeros of J0-J2 in the range [0,xmax]. The function is
   * sampled at 5*n points; each sign change is estimated by linear
   * interpolation between the bracketing samples and then refined by
   * Newton iterations.
   * @param n the expected number of zeros.
   * @param xmax the largest argument.
   * @return array of zeros.
   */
  public static double[] zerosJ0J2(int n, double xmax) {
    int nx = max(2,5*n);
    double dx = xmax/(nx-1);
    double[] y = new double[nx];
    for (int ix=0; ix<nx; ++ix)
      y[ix] = j0j2(ix*dx);
    int nz = 0;
    double[] z = new double[nx];
    for (int ix=0; ix<nx-1; ++ix) {
      if (y[ix]*y[ix+1]<0.0) {
        double x = ix*dx-y[ix]/(y[ix+1]-y[ix])*dx;
        for (int iter=0; iter<NEWTON_ITERATIONS; ++iter) {
          double dz = j0j2(x)/j0j2Derivative(x);
          x -= dz;
          if (abs(dz)<=NEWTON_TOLERANCE*x)
            break;
        }
        z[nz++] = x;
      }
    }
    return copy(nz,z);
  }

  /**
   * Returns the zeros where the kernel changes from positive to negative.
   */
  public static double[] toNegative(double[] zeros) {
    return every2(0,zeros);
  }

  /**
   * Returns the zeros where the kernel changes from negative to positive.
   */
  public static double[] toPositive(double[] zeros) {
    return every2(1,zeros);
  }

  /**
   * Returns the value of J0(x)-J2(x).
   */
  public static double j0j2(double x) {
    if (x==0.0)
      return 1.0;
    return BesselJ.value(0.0,x)-BesselJ.value(2.0,x);
  }

  ///////////////////////////////////////////////////////////////////////////
  // private

  private static final int NEWTON_ITERATIONS = 20;
  private static final double NEWTON_TOLERANCE = 1.0e-14;

  // (J0-J2)' = -J1-(J1-J3)/2
  private static double j0j2Derivative(double x) {
    return -0.5*(3.0*BesselJ.value(1.0,x)-BesselJ.value(3.0,x));
  }

  private static double[] every2(int first, double[] zeros) {
    int n = zeros.length;
    int m = (n-first+1)/2;
    double[] z = new double[m];
    for (int i=first,j=0; i<n; i+=2,++j)
      z[j] = zeros[i];
    return z;
  }
}
