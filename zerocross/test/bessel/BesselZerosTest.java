package bessel;

import static edu.mines.jtk.util.ArrayMath.*;

import org.apache.commons.math3.special.BesselJ;

import junit.framework.TestCase;
import junit.framework.TestSuite;

public class BesselZerosTest extends TestCase {

  public void testFirstZerosOfJ0() {
    double[] z = BesselZeros.zerosJ0(3);
    assertEquals(2.404825557695773,z[0],1.0e-10);
    assertEquals(5.520078110286311,z[1],1.0e-10);
    assertEquals(8.653727912911013,z[2],1.0e-10);
  }

  public void testZerosOfJ0AreRoots() {
    double[] z = BesselZeros.zerosJ0(60);
    for (int i=0; i<z.length; ++i) {
      assertEquals(0.0,BesselJ.value(0.0,z[i]),1.0e-10);
      if (i>0)
        assertTrue(z[i]>z[i-1]+3.0);
    }
  }

  public void testZerosOfJ0MinusJ2() {
    // J0-J2 = 2*J1', so the zeros are the zeros of J1'
    double[] z = BesselZeros.compute(1.0,10.0,1.0,BesselZeros.Kernel.J0_MINUS_J2);
    assertEquals(1.841183781340659,z[0],1.0e-9);
    assertEquals(5.331442773525033,z[1],1.0e-9);
    assertEquals(8.536316366346285,z[2],1.0e-9);
    for (int i=0; i<z.length; ++i) {
      assertEquals(0.0,BesselZeros.j0j2(z[i]),1.0e-10);
      if (i>0)
        assertTrue(z[i]>z[i-1]+2.0);
    }
  }

  public void testCount() {
    assertEquals(100,BesselZeros.count(0.5,100.0,1.0));
    assertEquals(100,BesselZeros.compute(0.5,100.0,1.0,BesselZeros.Kernel.J0).length);
    assertEquals(0,BesselZeros.compute(0.001,1.0,5.0,BesselZeros.Kernel.J0).length);
  }

  public void testParity() {
    double[] z = BesselZeros.zerosJ0(7);
    double[] zn = BesselZeros.toNegative(z);
    double[] zp = BesselZeros.toPositive(z);
    assertEquals(4,zn.length);
    assertEquals(3,zp.length);
    for (double x:zn) {
      assertTrue(BesselJ.value(0.0,x-0.01)>0.0);
      assertTrue(BesselJ.value(0.0,x+0.01)<0.0);
    }
    for (double x:zp) {
      assertTrue(BesselJ.value(0.0,x-0.01)<0.0);
      assertTrue(BesselJ.value(0.0,x+0.01)>0.0);
    }
  }

  public void testJ0J2AtZero() {
    assertEquals(1.0,BesselZeros.j0j2(0.0),0.0);
    assertEquals(BesselJ.value(0.0,3.0)-BesselJ.value(2.0,3.0),
                 BesselZeros.j0j2(3.0),1.0e-15);
    assertTrue(abs(BesselZeros.j0j2(1.8412))<1.0e-3);
  }

  ///////////////////////////////////////////////////////////////////////////
  // main

  public static junit.framework.Test suite() {
    return new TestSuite(BesselZerosTest.class);
  }

  public static void main(String[] args) {
    junit.textui.TestRunner.run(suite());
  }
}
