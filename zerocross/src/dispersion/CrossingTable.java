package dispersion;

import static edu.mines.jtk.util.ArrayMath.*;

import java.util.Arrays;
import java.util.Comparator;

import edu.mines.jtk.util.Check;

/**
 * Candidate (frequency,velocity) pairs for the zero crossings of a
 * spectrum. Rows are sorted by frequency, then by velocity. Several rows
 * share the frequency of one crossing, one per branch of the kernel.
 */
public class CrossingTable {

  /**
   * Constructs a table from arrays of frequencies and velocities. The rows
   * are sorted; the input arrays are not modified.
   * @param f array of frequencies.
   * @param v array of velocities.
   */
  public CrossingTable(double[] f, double[] v) {
    Check.argument(f.length==v.length,"f.length==v.length");
    int n = f.length;
    double[][] rows = new double[n][];
    for (int i=0; i<n; ++i)
      rows[i] = new double[]{f[i],v[i]};
    Arrays.sort(rows,ROW_ORDER);
    _f = new double[n];
    _v = new double[n];
    for (int i=0; i<n; ++i) {
      _f[i] = rows[i][0];
      _v[i] = rows[i][1];
    }
  }

  public int size() {
    return _f.length;
  }

  public boolean isEmpty() {
    return _f.length==0;
  }

  public double getFrequency(int i) {
    return _f[i];
  }

  public double getVelocity(int i) {
    return _v[i];
  }

  /**
   * Returns the rows of this table as an array[n][2] of
   * (frequency,velocity).
   */
  public double[][] toArray() {
    int n = _f.length;
    double[][] a = new double[n][];
    for (int i=0; i<n; ++i)
      a[i] = new double[]{_f[i],_v[i]};
    return a;
  }

  /**
   * Returns the distinct frequencies of this table, in increasing order.
   */
  public double[] getFrequencyAxis() {
    return getFrequencyAxis(Double.NEGATIVE_INFINITY,Double.POSITIVE_INFINITY);
  }

  /**
   * Returns the distinct frequencies strictly between fmin and fmax, in
   * increasing order.
   */
  public double[] getFrequencyAxis(double fmin, double fmax) {
    int n = _f.length;
    double[] w = new double[n];
    int m = 0;
    for (int i=0; i<n; ++i) {
      double f = _f[i];
      if (fmin<f && f<fmax && (m==0 || f!=w[m-1]))
        w[m++] = f;
    }
    return copy(m,w);
  }

  /**
   * Returns the candidate velocities for each frequency of the specified
   * axis, in increasing order. Frequencies not in this table get an empty
   * array.
   */
  public double[][] getCandidates(double[] axis) {
    int n = axis.length;
    double[][] c = new double[n][];
    for (int i=0; i<n; ++i)
      c[i] = getCandidates(axis[i]);
    return c;
  }

  /**
   * Returns the candidate velocities at frequency f, in increasing order.
   */
  public double[] getCandidates(double f) {
    int i0 = lowerBound(f);
    int i1 = i0;
    while (i1<_f.length && _f[i1]==f)
      ++i1;
    return copy(i1-i0,i0,_v);
  }

  ///////////////////////////////////////////////////////////////////////////
  // private

  private static final Comparator<double[]> ROW_ORDER =
    new Comparator<double[]>() {
      public int compare(double[] a, double[] b) {
        int c = Double.compare(a[0],b[0]);
        return (c!=0)?c:Double.compare(a[1],b[1]);
      }
    };

  private double[] _f;
  private double[] _v;

  private int lowerBound(double f) {
    int lo = 0;
    int hi = _f.length;
    while (lo<hi) {
      int mid = (lo+hi)>>>1;
      if (_f[mid]<f)
        lo = mid+1;
      else
        hi = mid;
    }
    return lo;
  }
}
