package dispersion;

import static edu.mines.jtk.util.ArrayMath.*;

import java.util.List;
import java.util.Random;

import junit.framework.TestCase;

public class ZeroCrossingsTest extends TestCase {

  public void testCandidatesOfBesselSpectrum() {
    Spectrum s = Synthetics.besselJ0();
    ReferenceCurve ref = new ReferenceCurve(
      new double[]{0.01,0.5},new double[]{3.25,2.85});
    ZeroCrossings zc = new ZeroCrossings(Synthetics.DISTANCE);
    CrossingTable ct = zc.extract(s,ref);
    double[] w = ct.getFrequencyAxis();
    assertTrue(w.length>=30);
    for (int i=0; i<w.length; ++i) {
      assertTrue(0.01<=w[i] && w[i]<=0.5);
      double[] c = ct.getCandidates(w[i]);
      assertTrue(nearest(c,3.0)<1.0e-3);
      if (i>0) {
        double df = w[i]-w[i-1];
        assertEquals(0.015,df,0.002);
      }
    }
    for (int i=0; i<ct.size(); ++i) {
      assertTrue(1.0<ct.getVelocity(i) && ct.getVelocity(i)<5.0);
      if (i>0)
        assertTrue(ct.getFrequency(i)>=ct.getFrequency(i-1));
    }
  }

  public void testParityOfCrossings() {
    Spectrum s = Synthetics.besselJ0();
    Spectrum t = new Spectrum(s.getFrequencies(),neg(s.getReal()));
    ZeroCrossings zc = new ZeroCrossings(Synthetics.DISTANCE);
    CrossingTable cs = zc.extract(s);
    CrossingTable ct = zc.extract(t);
    double[] ws = cs.getFrequencyAxis(0.05,0.5);
    double[] wt = ct.getFrequencyAxis(0.05,0.5);
    assertEquals(ws.length,wt.length);
    for (int i=0; i<ws.length; ++i) {
      assertTrue(nearest(cs.getCandidates(ws[i]),3.0)<1.0e-3);
      assertTrue(nearest(ct.getCandidates(wt[i]),3.0)>0.05);
    }
  }

  public void testDirections() {
    double[] f = {0.0,1.0,2.0,3.0,4.0};
    double[] y = {1.0,-1.0,-3.0,1.0,1.0};
    List<ZeroCrossings.ZeroCrossing> list = ZeroCrossings.findCrossings(f,y);
    assertEquals(2,list.size());
    assertEquals(0.5,list.get(0).getFrequency(),1.0e-12);
    assertEquals(ZeroCrossings.Direction.TO_NEGATIVE,list.get(0).getDirection());
    assertEquals(2.75,list.get(1).getFrequency(),1.0e-12);
    assertEquals(ZeroCrossings.Direction.TO_POSITIVE,list.get(1).getDirection());
  }

  public void testDomainMismatch() {
    Spectrum s = Synthetics.besselJ0();
    ReferenceCurve ref = new ReferenceCurve(
      new double[]{1.0,2.0},new double[]{3.0,2.5});
    ZeroCrossings zc = new ZeroCrossings(Synthetics.DISTANCE);
    try {
      zc.extract(s,ref);
      fail("disjoint reference domain must fail");
    } catch (DomainMismatchException e) {
      // expected
    }
    zc.setFrequencyLimits(0.6,0.7);
    try {
      zc.extract(s);
      fail("frequency limits outside spectrum must fail");
    } catch (DomainMismatchException e) {
      // expected
    }
  }

  public void testSmoothingRemovesNoiseCrossings() {
    Spectrum s = Synthetics.besselJ0();
    double[] re = s.getReal();
    Random r = new Random(7);
    for (int i=0; i<re.length; ++i)
      re[i] += 0.05*r.nextGaussian();
    Spectrum t = new Spectrum(s.getFrequencies(),re);
    ZeroCrossings zc = new ZeroCrossings(Synthetics.DISTANCE);
    int nraw = zc.extract(t).getFrequencyAxis().length;
    zc.setSmoothSpectrum(true);
    int nsmooth = zc.extract(t).getFrequencyAxis().length;
    assertTrue(nsmooth<nraw);
  }

  public void testHorizontalPolarization() {
    double d = Synthetics.DISTANCE;
    double v = Synthetics.VELOCITY;
    int n = 1001;
    double[] f = new double[n];
    double[] re = new double[n];
    for (int i=0; i<n; ++i) {
      f[i] = i*0.0005;
      re[i] = bessel.BesselZeros.j0j2(2.0*PI*f[i]*d/v);
    }
    Spectrum s = new Spectrum(f,re);
    ZeroCrossings zc = new ZeroCrossings(d);
    CrossingTable vertical = zc.extract(s);
    zc.setHorizontalPolarization(true);
    CrossingTable horizontal = zc.extract(s);
    double[] w = horizontal.getFrequencyAxis();
    assertTrue(w.length>30);
    for (double wi:w)
      assertTrue(nearest(horizontal.getCandidates(wi),v)<1.0e-3);

    // The kernels differ most at the lowest crossings.
    double[] wv = vertical.getFrequencyAxis();
    for (int i=0; i<3; ++i) {
      assertEquals(w[i],wv[i],0.0);
      assertTrue(nearest(vertical.getCandidates(wv[i]),v)>0.03);
    }
  }

  private static double nearest(double[] c, double v) {
    double d = Double.POSITIVE_INFINITY;
    for (double ci:c)
      d = min(d,abs(ci-v));
    return d;
  }
}
