package dispersion;

import static edu.mines.jtk.util.ArrayMath.*;

import junit.framework.TestCase;
import junit.framework.TestSuite;

public class RidgePickerTest extends TestCase {

  public void testRecoversConstantVelocity() {
    ReferenceCurve ref = new ReferenceCurve(
      new double[]{0.01,0.5},new double[]{3.2,3.2});
    RidgePicker rp = new RidgePicker(Synthetics.DISTANCE);
    double[][] p = rp.pick(Synthetics.besselJ0(),ref).getPicks();
    assertTrue(p.length>50);
    for (double[] pi:p)
      assertEquals(Synthetics.VELOCITY,pi[1],0.01*Synthetics.VELOCITY);
    assertTrue(p[p.length-1][0]-p[0][0]>0.4);
  }

  public void testReferenceTenPercentOff() {
    double[][] vr = {{3.3,3.3},{3.3,2.7},{2.7,2.7}};
    for (double[] v:vr) {
      ReferenceCurve ref = new ReferenceCurve(new double[]{0.01,0.5},v);
      RidgePicker rp = new RidgePicker(Synthetics.DISTANCE);
      double[][] p = rp.pick(Synthetics.besselJ0(),ref).getPicks();
      assertTrue(p.length>50);
      for (double[] pi:p)
        assertEquals(Synthetics.VELOCITY,pi[1],0.01*Synthetics.VELOCITY);
    }
  }

  public void testGapKeepsLongerRun() {
    // no crossings between 0.30 and 0.46 Hz
    double[] f = new double[39];
    int n = 0;
    for (int k=0; k<39; ++k) {
      double fk = 0.02+0.015*k;
      if (fk<=0.30 || fk>=0.46)
        f[n++] = fk;
    }
    f = copy(n,f);
    CrossingTable ct = Synthetics.branches(f,3.0,null);
    ReferenceCurve ref = new ReferenceCurve(
      new double[]{0.0,0.6},new double[]{3.05,2.95});
    RidgePicker rp = new RidgePicker(Synthetics.DISTANCE);
    PickSequence ps = rp.pick(null,ct,ref);
    assertTrue(ps.size()>50);
    assertTrue(ps.getFrequency(0)<0.05);
    assertTrue(ps.getLastFrequency()>0.30);
    assertTrue(ps.getLastFrequency()<0.46);
    for (int i=0; i<ps.size(); ++i)
      assertEquals(3.0,ps.getVelocity(i),0.03);
  }

  public void testRecoversDispersiveVelocity() {
    double d = Synthetics.DISTANCE;
    int n = 1001;
    double[] f = new double[n];
    double[] re = new double[n];
    for (int i=0; i<n; ++i) {
      f[i] = i*0.0005;
      re[i] = Synthetics.j0(2.0*PI*f[i]*d/(3.6-1.2*f[i]));
    }
    ReferenceCurve ref = new ReferenceCurve(
      new double[]{0.01,0.25,0.5},new double[]{3.8,3.25,2.9});
    RidgePicker rp = new RidgePicker(d);
    double[][] p = rp.pick(new Spectrum(f,re),ref).getPicks();
    assertTrue(p.length>50);
    double sum = 0.0;
    for (double[] pi:p) {
      double e = abs(pi[1]-(3.6-1.2*pi[0]));
      assertTrue(e<0.1);
      sum += e;
    }
    assertTrue(sum/p.length<0.02);
  }

  public void testFrequenciesIncrease() {
    ReferenceCurve ref = new ReferenceCurve(
      new double[]{0.01,0.5},new double[]{3.2,3.2});
    RidgePicker rp = new RidgePicker(Synthetics.DISTANCE);
    double[][] p = rp.pick(Synthetics.besselJ0(),ref).getPicks();
    for (int i=1; i<p.length; ++i)
      assertTrue(p[i][0]>p[i-1][0]);
  }

  public void testInsufficientCoverage() {
    CrossingTable ct = new CrossingTable(
      new double[]{0.50,0.525,0.55},new double[]{3.0,3.0,3.0});
    ReferenceCurve ref = new ReferenceCurve(
      new double[]{0.0,1.0},new double[]{3.2,3.0});
    RidgePicker rp = new RidgePicker(Synthetics.DISTANCE);
    try {
      rp.pick(null,ct,ref);
      fail("three crossings must not be accepted");
    } catch (InsufficientCoverageException e) {
      // expected
    }
  }

  public void testConfiguration() {
    RidgePicker rp = new RidgePicker(Synthetics.DISTANCE);
    assertEquals(0.15,rp.getMinimumCoverage(),0.0);
    try {
      rp.setOverlap(1.0,0.5);
      fail("overlap of one must fail");
    } catch (IllegalArgumentException e) {
      // expected
    }
  }

  ///////////////////////////////////////////////////////////////////////////
  // main

  public static junit.framework.Test suite() {
    return new TestSuite(RidgePickerTest.class);
  }

  public static void main(String[] args) {
    junit.textui.TestRunner.run(suite());
  }
}
