package util;

import edu.mines.jtk.util.Check;

/**
 * Centered running mean. Near the ends of the array the window shrinks
 * symmetrically, so that the first and last samples are returned unchanged
 * and a constant array stays constant.
 */
public class RunningMean {

  /**
   * Returns the running mean of x over windows of n samples. An even n is
   * increased by one.
   * @param x the input array.
   * @param n the window length.
   * @return the smoothed array.
   */
  public static double[] apply(double[] x, int n) {
    Check.argument(n>=1,"n>=1");
    if (n%2==0)
      n += 1;
    int nx = x.length;
    int h = (n-1)/2;
    double[] c = new double[nx+1];
    for (int i=0; i<nx; ++i)
      c[i+1] = c[i]+x[i];
    double[] y = new double[nx];
    for (int i=0; i<nx; ++i) {
      int k = Math.min(h,Math.min(i,nx-1-i));
      y[i] = (c[i+k+1]-c[i-k])/(2*k+1);
    }
    return y;
  }
}
