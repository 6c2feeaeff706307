package dispersion;

import static edu.mines.jtk.util.ArrayMath.*;

import junit.framework.TestCase;
import junit.framework.TestSuite;

public class SequentialPickerTest extends TestCase {

  public void testRecoversConstantVelocity() {
    DispersionResult dr = pick(Synthetics.besselJ0(),reference());
    double[][] p = dr.getPicks();
    assertTrue(p.length>=30);
    for (double[] pi:p)
      assertEquals(Synthetics.VELOCITY,pi[1],0.01);
    assertTrue(p[0][0]<0.02);
    assertTrue(p[p.length-1][0]>0.48);
  }

  public void testRecoversDispersiveVelocity() {
    double d = Synthetics.DISTANCE;
    int n = 1001;
    double[] f = new double[n];
    double[] re = new double[n];
    for (int i=0; i<n; ++i) {
      f[i] = i*0.0005;
      re[i] = Synthetics.j0(2.0*PI*f[i]*d/velocity(f[i]));
    }
    ReferenceCurve ref = new ReferenceCurve(
      new double[]{0.01,0.25,0.5},new double[]{3.8,3.25,2.9});
    double[][] p = pick(new Spectrum(f,re),ref).getPicks();
    assertTrue(p.length>=30);
    for (double[] pi:p)
      assertEquals(velocity(pi[0]),pi[1],0.01);
  }

  public void testFrequenciesIncrease() {
    double[][] p = pick(Synthetics.besselJ0(),reference()).getPicks();
    for (int i=1; i<p.length; ++i)
      assertTrue(p[i][0]>p[i-1][0]);
  }

  public void testPicksAreCrossings() {
    DispersionResult dr = pick(Synthetics.besselJ0(),reference());
    CrossingTable ct = dr.getCrossingTable();
    for (double[] pi:dr.getPicks()) {
      double[] c = ct.getCandidates(pi[0]);
      boolean found = false;
      for (double ci:c)
        found = found || ci==pi[1];
      assertTrue(found);
    }
  }

  public void testPickSpacing() {
    double d = Synthetics.DISTANCE;
    double[][] p = pick(Synthetics.besselJ0(),reference()).getPicks();
    for (int i=1; i<p.length; ++i) {
      double fstep = BranchJump.frequencyStep(p[i-1][1],d);
      double df = p[i][0]-p[i-1][0];
      assertTrue(df>=0.3*fstep);
      assertTrue(df<=3.0*fstep);
    }
  }

  public void testSkipsOffBranchCrossing() {
    double[] f = rampdouble(0.02,0.015,20);
    CrossingTable ct = Synthetics.branches(f,3.0,Synthetics.band(20,10,11));
    SequentialPicker sp = new SequentialPicker(Synthetics.DISTANCE);
    PickSequence ps = sp.pick(null,ct,flatReference());
    assertEquals(19,ps.size());
    for (int i=0; i<ps.size(); ++i) {
      assertTrue(ps.getFrequency(i)!=f[10]);
      assertEquals(3.0,ps.getVelocity(i),1.0e-9);
    }
  }

  public void testRestartKeepsLongerRun() {
    SequentialPicker sp = new SequentialPicker(Synthetics.DISTANCE);
    ReferenceCurve ref = flatReference();

    // seven good crossings, three off-branch, four good
    double[] f = rampdouble(0.02,0.015,14);
    CrossingTable ct = Synthetics.branches(f,3.0,Synthetics.band(14,7,10));
    PickSequence ps = sp.pick(null,ct,ref);
    assertEquals(7,ps.size());
    assertEquals(f[0],ps.getFrequency(0),0.0);
    assertEquals(f[6],ps.getLastFrequency(),0.0);

    // the same band, followed by sixteen good crossings
    f = rampdouble(0.02,0.015,26);
    ct = Synthetics.branches(f,3.0,Synthetics.band(26,7,10));
    ps = sp.pick(null,ct,ref);
    assertEquals(16,ps.size());
    assertEquals(f[10],ps.getFrequency(0),0.0);
    assertEquals(f[25],ps.getLastFrequency(),0.0);
  }

  public void testInsufficientCoverage() {
    // three crossings that span 5% of the reference domain
    CrossingTable ct = new CrossingTable(
      new double[]{0.50,0.525,0.55},new double[]{3.0,3.0,3.0});
    ReferenceCurve ref = new ReferenceCurve(
      new double[]{0.0,1.0},new double[]{3.2,3.0});
    SequentialPicker sp = new SequentialPicker(Synthetics.DISTANCE);
    try {
      sp.pick(null,ct,ref);
      fail("three crossings must not be accepted");
    } catch (InsufficientCoverageException e) {
      // expected
    }
  }

  public void testAmplitudeGate() {
    SequentialPicker sp = new SequentialPicker(Synthetics.DISTANCE);
    sp.setMinimumAmplitude(2.0);
    try {
      sp.pick(Synthetics.besselJ0(),reference());
      fail("no crossing has sufficient amplitude");
    } catch (InsufficientCoverageException e) {
      // expected
    }
  }

  public void testAmbiguousFirstPick() {
    // near 0.2 Hz adjacent branches differ by less than a third of the
    // velocity range of the reference curve
    ReferenceCurve ref = new ReferenceCurve(
      new double[]{0.2,0.5},new double[]{4.5,1.5});
    SequentialPicker sp = new SequentialPicker(Synthetics.DISTANCE);
    try {
      sp.pick(Synthetics.besselJ0(),ref);
      fail("first pick must be ambiguous");
    } catch (AmbiguousFirstPickException e) {
      // expected
    }
  }

  public void testDomainMismatch() {
    ReferenceCurve ref = new ReferenceCurve(
      new double[]{0.6,0.9},new double[]{3.0,2.8});
    SequentialPicker sp = new SequentialPicker(Synthetics.DISTANCE);
    try {
      sp.pick(Synthetics.besselJ0(),ref);
      fail("reference outside spectrum must fail");
    } catch (DomainMismatchException e) {
      // expected
    }
  }

  public void testInputsAreNotModified() {
    Spectrum s = Synthetics.besselJ0();
    double[] re = s.getReal();
    SequentialPicker sp = new SequentialPicker(Synthetics.DISTANCE);
    double[][] p1 = sp.pick(s,reference()).getPicks();
    double[][] p2 = sp.pick(s,reference()).getPicks();
    assertEquals(p1.length,p2.length);
    for (int i=0; i<p1.length; ++i)
      assertEquals(p1[i][1],p2[i][1],0.0);
    assertTrue(equal(re,s.getReal()));
  }

  private static ReferenceCurve flatReference() {
    return new ReferenceCurve(
      new double[]{0.0,0.5},new double[]{3.05,2.95});
  }

  private static ReferenceCurve reference() {
    return new ReferenceCurve(
      new double[]{0.01,0.5},new double[]{3.25,2.85});
  }

  private static double velocity(double f) {
    return 3.6-1.2*f;
  }

  private static DispersionResult pick(Spectrum s, ReferenceCurve ref) {
    SequentialPicker sp = new SequentialPicker(Synthetics.DISTANCE);
    return sp.pick(s,ref);
  }

  ///////////////////////////////////////////////////////////////////////////
  // main

  public static junit.framework.Test suite() {
    return new TestSuite(SequentialPickerTest.class);
  }

  public static void main(String[] args) {
    junit.textui.TestRunner.run(suite());
  }
}
