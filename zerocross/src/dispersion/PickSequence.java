package dispersion;

import static edu.mines.jtk.util.ArrayMath.*;

import java.util.ArrayList;
import java.util.List;

import edu.mines.jtk.util.Check;

/**
 * An ordered sequence of (frequency,velocity) picks with strictly
 * increasing frequencies.
 */
public class PickSequence {

  public PickSequence() {
    _f = new ArrayList<Double>();
    _v = new ArrayList<Double>();
  }

  /**
   * Constructs a copy of the specified sequence.
   */
  public PickSequence(PickSequence ps) {
    _f = new ArrayList<Double>(ps._f);
    _v = new ArrayList<Double>(ps._v);
  }

  /**
   * Appends a pick.
   * @param f frequency; must exceed the frequency of the last pick.
   * @param v velocity.
   */
  public void add(double f, double v) {
    Check.argument(isEmpty() || f>getLastFrequency(),
      "pick frequency "+f+" exceeds last frequency");
    _f.add(f);
    _v.add(v);
  }

  public int size() {
    return _f.size();
  }

  public boolean isEmpty() {
    return _f.isEmpty();
  }

  public void clear() {
    _f.clear();
    _v.clear();
  }

  public double getFrequency(int i) {
    return _f.get(i);
  }

  public double getVelocity(int i) {
    return _v.get(i);
  }

  public double getLastFrequency() {
    return _f.get(_f.size()-1);
  }

  public double getLastVelocity() {
    return _v.get(_v.size()-1);
  }

  /**
   * Returns the frequency span of this sequence; zero if fewer than two
   * picks.
   */
  public double getSpan() {
    return (size()<2)?0.0:getLastFrequency()-getFrequency(0);
  }

  public double[] getFrequencies() {
    return toArray(_f);
  }

  public double[] getVelocities() {
    return toArray(_v);
  }

  /**
   * Returns the picks as an array[n][2] of (frequency,velocity).
   */
  public double[][] toArray() {
    int n = size();
    double[][] a = new double[n][];
    for (int i=0; i<n; ++i)
      a[i] = new double[]{_f.get(i),_v.get(i)};
    return a;
  }

  /**
   * Removes the last pick.
   */
  public void removeLast() {
    Check.state(!isEmpty(),"sequence is not empty");
    _f.remove(_f.size()-1);
    _v.remove(_v.size()-1);
  }

  /**
   * Removes all picks with frequency greater than f.
   */
  public void removeAfter(double f) {
    while (!isEmpty() && getLastFrequency()>f)
      removeLast();
  }

  /**
   * Replaces the velocities of this sequence.
   * @param v array of velocities, one per pick.
   */
  public void setVelocities(double[] v) {
    Check.argument(v.length==size(),"v.length equals number of picks");
    for (int i=0; i<v.length; ++i)
      _v.set(i,v[i]);
  }

  /**
   * Returns the mean velocity of picks in the index range [i0,i1).
   */
  public double meanVelocity(int i0, int i1) {
    Check.argument(0<=i0 && i0<i1 && i1<=size(),"valid index range");
    return sum(copy(i1-i0,i0,getVelocities()))/(i1-i0);
  }

  ///////////////////////////////////////////////////////////////////////////
  // private

  private List<Double> _f;
  private List<Double> _v;

  private static double[] toArray(List<Double> list) {
    int n = list.size();
    double[] a = new double[n];
    for (int i=0; i<n; ++i)
      a[i] = list.get(i);
    return a;
  }
}
