package dispersion;

import static edu.mines.jtk.util.ArrayMath.*;

/**
 * Branch arithmetic shared by the dispersion pickers. At frequency f and
 * distance d, velocities on adjacent branches of the kernel differ by one
 * cycle of phase 2*pi*f*d/v. Consecutive zero crossings of the spectrum are
 * about v/(2*d) apart.
 */
public class BranchJump {

  /**
   * Phase difference, in radians, above which a velocity jump is treated as
   * a jump to another branch.
   */
  public static final double MAX_PHASE = 0.6*PI;

  /**
   * Returns the velocity difference between the branch through v and the
   * adjacent branch, at frequency f.
   */
  public static double cycleVelocity(double f, double v, double distance) {
    return abs(v-1.0/(1.0/(distance*f)+1.0/v));
  }

  /**
   * Returns the expected frequency increment between consecutive zero
   * crossings for velocity v.
   */
  public static double frequencyStep(double v, double distance) {
    return v/(2.0*distance);
  }

  /**
   * Returns the phase difference 2*pi*f*d*(1/vCand-1/vPred), in radians.
   */
  public static double phase(
      double f, double distance, double vPred, double vCand)
  {
    return 2.0*PI*f*distance*(1.0/vCand-1.0/vPred);
  }

  /**
   * Determines whether a candidate velocity stays on the branch of a
   * predicted velocity.
   */
  public static boolean isAcceptableBranchJump(
      double vPred, double vCand, double f, double distance)
  {
    return isAcceptableBranchJump(vPred,vCand,f,distance,MAX_PHASE);
  }

  /**
   * Determines whether the phase difference between a candidate and a
   * predicted velocity does not exceed a limit.
   * @param limit the largest acceptable phase difference, in radians.
   */
  public static boolean isAcceptableBranchJump(
      double vPred, double vCand, double f, double distance, double limit)
  {
    return abs(phase(f,distance,vPred,vCand))<=limit;
  }
}
