package dispersion;

import junit.framework.TestCase;

public class PickSequenceTest extends TestCase {

  public void testIncreasingFrequencies() {
    PickSequence ps = new PickSequence();
    ps.add(0.1,3.0);
    ps.add(0.2,2.9);
    try {
      ps.add(0.2,2.8);
      fail("duplicate frequency must fail");
    } catch (IllegalArgumentException e) {
      // expected
    }
    try {
      ps.add(0.15,2.8);
      fail("decreasing frequency must fail");
    } catch (IllegalArgumentException e) {
      // expected
    }
    assertEquals(2,ps.size());
    assertEquals(0.1,ps.getSpan(),1.0e-12);
  }

  public void testRemove() {
    PickSequence ps = new PickSequence();
    for (int i=0; i<6; ++i)
      ps.add(0.1*i,3.0-0.1*i);
    ps.removeAfter(0.25);
    assertEquals(3,ps.size());
    assertEquals(0.2,ps.getLastFrequency(),1.0e-12);
    ps.removeLast();
    assertEquals(2.9,ps.getLastVelocity(),1.0e-12);
    PickSequence copy = new PickSequence(ps);
    ps.clear();
    assertTrue(ps.isEmpty());
    assertEquals(2,copy.size());
    assertEquals(0.0,ps.getSpan(),0.0);
  }

  public void testArrays() {
    PickSequence ps = new PickSequence();
    ps.add(1.0,3.0);
    ps.add(2.0,2.0);
    ps.add(3.0,1.0);
    double[][] a = ps.toArray();
    assertEquals(3,a.length);
    assertEquals(2.0,a[1][0],0.0);
    assertEquals(2.0,a[1][1],0.0);
    assertEquals(2.5,ps.meanVelocity(0,2),1.0e-12);
    ps.setVelocities(new double[]{4.0,5.0,6.0});
    assertEquals(6.0,ps.getLastVelocity(),0.0);
  }
}
