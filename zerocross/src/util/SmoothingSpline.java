package util;

import static edu.mines.jtk.util.ArrayMath.*;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.QRDecomposition;
import org.apache.commons.math3.linear.RealVector;

import edu.mines.jtk.util.Check;

/**
 * Least-squares cubic spline with fixed interior knots. The spline is the
 * cubic B-spline curve with knots {x[0],x[0],x[0],x[0],t[0],...,t[m-1],
 * x[n-1],x[n-1],x[n-1],x[n-1]} that best fits the samples y(x) in the
 * least-squares sense. Widely spaced knots smooth the data.
 */
public class SmoothingSpline {

  /**
   * Constructs a spline for the specified samples and interior knots.
   * @param x array of increasing sample coordinates.
   * @param y array of sample values.
   * @param t array of increasing interior knots, inside (x[0],x[n-1]).
   */
  public SmoothingSpline(double[] x, double[] y, double[] t) {
    int n = x.length;
    Check.argument(n==y.length,"x.length==y.length");
    Check.argument(n>DEGREE,"x.length>3");
    Check.argument(isIncreasing(x),"array x is increasing");
    Check.argument(isIncreasing(t),"array t is increasing");
    for (double tk:t)
      Check.argument(x[0]<tk && tk<x[n-1],"knots inside (x[0],x[n-1])");
    _knots = makeKnots(x[0],x[n-1],t);
    _nc = t.length+DEGREE+1;
    _coeffs = fit(x,y);
  }

  /**
   * Constructs a spline with interior knots x[1], x[1]+dt, x[1]+2*dt, ...
   * strictly less than x[n-1].
   * @param x array of increasing sample coordinates.
   * @param y array of sample values.
   * @param dt the knot spacing.
   * @return the spline.
   */
  public static SmoothingSpline withKnotSpacing(
      double[] x, double[] y, double dt)
  {
    Check.argument(dt>0.0,"dt>0.0");
    int n = x.length;
    Check.argument(n>DEGREE,"x.length>3");
    int nt = (int)ceil((x[n-1]-x[1])/dt);
    double[] t = new double[max(nt,0)];
    int m = 0;
    for (int it=0; it<nt; ++it) {
      double tk = x[1]+it*dt;
      if (tk<x[n-1])
        t[m++] = tk;
    }
    return new SmoothingSpline(x,y,copy(m,t));
  }

  /**
   * Returns the value of this spline at x.
   */
  public double evaluate(double x) {
    double[] b = new double[DEGREE+1];
    int span = basis(x,b);
    double y = 0.0;
    for (int j=0; j<=DEGREE; ++j)
      y += _coeffs[span-DEGREE+j]*b[j];
    return y;
  }

  /**
   * Returns the values of this spline at the specified coordinates.
   */
  public double[] evaluate(double[] x) {
    int n = x.length;
    double[] y = new double[n];
    for (int i=0; i<n; ++i)
      y[i] = evaluate(x[i]);
    return y;
  }

  ///////////////////////////////////////////////////////////////////////////
  // private

  private static final int DEGREE = 3;

  private double[] _knots; // full knot vector
  private int _nc; // number of coefficients
  private double[] _coeffs; // B-spline coefficients

  private static double[] makeKnots(double x0, double x1, double[] t) {
    int m = t.length;
    double[] k = new double[m+2*(DEGREE+1)];
    for (int i=0; i<=DEGREE; ++i) {
      k[i] = x0;
      k[m+DEGREE+1+i] = x1;
    }
    for (int i=0; i<m; ++i)
      k[DEGREE+1+i] = t[i];
    return k;
  }

  // Solves the normal equations B'B c = B'y. Each row of B has at most
  // four non-zero basis values.
  private double[] fit(double[] x, double[] y) {
    int n = x.length;
    double[][] a = new double[_nc][_nc];
    double[] r = new double[_nc];
    double[] b = new double[DEGREE+1];
    for (int i=0; i<n; ++i) {
      int span = basis(x[i],b);
      int j0 = span-DEGREE;
      for (int j=0; j<=DEGREE; ++j) {
        r[j0+j] += b[j]*y[i];
        for (int k=0; k<=DEGREE; ++k)
          a[j0+j][j0+k] += b[j]*b[k];
      }
    }
    QRDecomposition qr = new QRDecomposition(new Array2DRowRealMatrix(a,false));
    RealVector c = qr.getSolver().solve(new ArrayRealVector(r,false));
    return c.toArray();
  }

  // Index of the knot span containing x, clamped to the valid range.
  private int span(double x) {
    if (x>=_knots[_nc])
      return _nc-1;
    if (x<=_knots[DEGREE])
      return DEGREE;
    int lo = DEGREE;
    int hi = _nc;
    while (hi-lo>1) {
      int mid = (lo+hi)/2;
      if (x<_knots[mid])
        hi = mid;
      else
        lo = mid;
    }
    return lo;
  }

  // Computes the non-zero basis functions at x (Cox-de Boor recursion) and
  // returns the knot span. Basis b[j] belongs to coefficient span-3+j.
  private int basis(double x, double[] b) {
    int s = span(x);
    double[] left = new double[DEGREE+1];
    double[] right = new double[DEGREE+1];
    b[0] = 1.0;
    for (int r=1; r<=DEGREE; ++r) {
      left[r] = x-_knots[s+1-r];
      right[r] = _knots[s+r]-x;
      double saved = 0.0;
      for (int j=0; j<r; ++j) {
        double temp = b[j]/(right[j+1]+left[r-j]);
        b[j] = saved+right[j+1]*temp;
        saved = left[r-j]*temp;
      }
      b[r] = saved;
    }
    return s;
  }

  private static boolean isIncreasing(double[] a) {
    for (int i=1; i<a.length; ++i)
      if (a[i]<=a[i-1])
        return false;
    return true;
  }
}
