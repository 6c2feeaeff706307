package util;

import static edu.mines.jtk.util.ArrayMath.*;

import edu.mines.jtk.util.Check;

public class Taper {

  /**
   * Returns a cosine taper window of length n. The first and last
   * int(n*p/2+0.5) samples are half-cosine ramps between zero and one, all
   * other samples equal one. For p=0.1, 5% of the window is tapered.
   * @param n the window length.
   * @param p the tapered fraction of the window, between 0 and 1.
   * @return the taper window.
   */
  public static double[] cosine(int n, double p) {
    Check.argument(n>=0,"n>=0");
    Check.argument(p>=0.0 && p<=1.0,"0<=p<=1");
    double[] w = new double[n];
    if (n==0)
      return w;
    int frac = (int)(n*p/2.0+0.5);
    int i1 = 0;
    int i2 = frac-1;
    int i3 = n-frac;
    int i4 = n-1;
    if (i1==i2) i2 += 1;
    if (i3==i4) i3 -= 1;
    for (int i=max(0,i1); i<=i2 && i<n; ++i)
      w[i] = 0.5*(1.0-cos(PI*(i-i1)/(i2-i1)));
    for (int i=max(0,i2+1); i<i3 && i<n; ++i)
      w[i] = 1.0;
    for (int i=max(0,i3); i<=i4; ++i)
      w[i] = 0.5*(1.0+cos(PI*(i3-i)/(i4-i3)));
    if (i1==i2) w[i1] = 0.0;
    if (i3==i4 && i3>=0) w[i3] = 0.0;
    return w;
  }
}
