package dispersion;

import static edu.mines.jtk.util.ArrayMath.*;

import java.util.Arrays;
import java.util.Comparator;
import java.util.logging.Logger;

import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.regression.SimpleRegression;

import edu.mines.jtk.util.Check;

/**
 * Picks a dispersion curve by walking along the crossing frequencies,
 * choosing one candidate velocity per crossing.
 * <p>
 * The walk is a state machine. In state SEEK_FIRST the picker looks for a
 * crossing whose candidate closest to the reference curve is unambiguous.
 * In state TRACK it predicts the velocity at the next crossings by linear
 * regression over recent picks and accepts the candidate that stays on the
 * same kernel branch. Runs of picks that go wrong early are abandoned in
 * state RESTART; the longest abandoned run is kept as a fallback. The walk
 * ends in SUCCESS when all crossings are used, or FAIL when a stop rule
 * applies. In either case the longer of the current run and the fallback
 * must pass the acceptance rule.
 */
public class SequentialPicker extends DispersionPicker {

  /**
   * States of the picking walk.
   */
  public enum State {
    SEEK_FIRST,
    TRACK,
    RESTART,
    SUCCESS,
    FAIL
  }

  /**
   * Reasons for abandoning a run of picks.
   */
  public enum Restart {
    /** Crossings closer than half the expected frequency step. */
    SMALL_STEP,
    /** Too many skipped or shifted crossings early in a run. */
    TOO_MANY_ERRORS,
    /** Velocity increases between the first two picks. */
    VELOCITY_INCREASE,
    /** Slope of picks diverges from slope of the reference curve. */
    SLOPE_DIVERGENCE,
    /** No candidate stays on the branch of the prediction. */
    NO_SUITABLE_CANDIDATE,
    /** The best candidate skips more crossings than there are picks. */
    TOO_NOISY
  }

  /**
   * Constructs a picker for the specified interstation distance. The
   * minimum coverage is 0.10.
   * @param distance interstation distance, in km.
   */
  public SequentialPicker(double distance) {
    super(distance,0.10);
  }

  /**
   * Sets the minimum amplitude of the real spectrum near a crossing, as a
   * fraction of the largest amplitude. Crossings with smaller amplitude
   * are skipped. Default is 0, which disables this test.
   */
  public void setMinimumAmplitude(double minAmp) {
    Check.argument(minAmp>=0.0,"minAmp>=0.0");
    _minAmp = minAmp;
  }

  /**
   * Sets limits for the number of picking errors. Above the soft limit, an
   * early run is restarted; above the hard limit, picking stops. Defaults
   * are 2 and 6.
   */
  public void setErrorLimits(int soft, int hard) {
    Check.argument(0<=soft && soft<=hard,"0<=soft<=hard");
    _softErrors = soft;
    _hardErrors = hard;
  }

  /**
   * Sets the number of crossings skipped because neighboring branches are
   * too close, before the search for a first pick is abandoned. Default is
   * 20.
   */
  public void setFirstPickRetries(int retries) {
    Check.argument(retries>=0,"retries>=0");
    _maxRetries = retries;
  }

  @Override
  public PickSequence pick(Spectrum s, CrossingTable ct, ReferenceCurve ref) {
    double width = domainWidth(s,ref);
    double[] w = ct.getFrequencyAxis(ref.getMinFrequency(),
                                     ref.getMaxFrequency());
    if (w.length==0)
      throw new InsufficientCoverageException(
        "no crossings inside the reference domain");
    PickRun run = new PickRun(s,ct,ref,w,width);
    PickSequence ps = run.walk();
    if (run._ambiguous && !isAcceptable(ps,width,MIN_PICKS))
      throw new AmbiguousFirstPickException(
        "kernel branches too dense for a unique first pick");
    checkCoverage(ps,width,MIN_PICKS);
    return ps;
  }

  ///////////////////////////////////////////////////////////////////////////
  // private

  private static final Logger log =
    Logger.getLogger(SequentialPicker.class.getName());

  private static final int MIN_PICKS = 4;

  private double _minAmp = 0.0;
  private int _softErrors = 2;
  private int _hardErrors = 6;
  private int _maxRetries = 20;

  // State of one call to pick.
  private class PickRun {

    PickRun(Spectrum s, CrossingTable ct, ReferenceCurve ref,
            double[] w, double width) {
      _s = s;
      _ref = ref;
      _w = w;
      _n = w.length;
      _width = width;
      _d = getDistance();
      _cand = ct.getCandidates(w);
      _refv = ref.velocities(w);
      _ampMax = (s!=null)?s.getPeakAmplitude():0.0;
      _picks = new PickSequence();
      _fallback = new PickSequence();
    }

    PickSequence walk() {
      State state = State.SEEK_FIRST;
      while (state!=State.SUCCESS && state!=State.FAIL) {
        if (_i>=_n) {
          state = State.SUCCESS;
        } else if (state==State.SEEK_FIRST) {
          state = seek();
        } else if (state==State.TRACK) {
          state = track();
        } else if (state==State.RESTART) {
          state = restart();
        }
      }
      trace("walk: "+state+" with "+_picks.size()+" picks, fallback "+
            _fallback.size()+" picks");
      PickSequence ps = _picks;
      if (_fallback.size()>1 &&
          (_picks.isEmpty() || _fallback.getSpan()>_picks.getSpan()))
        ps = _fallback;
      return ps;
    }

    private Spectrum _s;
    private ReferenceCurve _ref;
    private double[] _w; // crossing frequencies inside reference domain
    private int _n;
    private double _width; // usable frequency width
    private double _d; // distance
    private double[][] _cand; // candidate velocities per frequency
    private double[] _refv; // reference velocities
    private double _ampMax;
    private PickSequence _picks;
    private PickSequence _fallback;
    private int _i; // index of current frequency
    private int _errors;
    private int _retries;
    private int _runStart = -1;
    private double _prevF;
    private boolean _ambiguous;
    private Restart _reason;

    private State seek() {
      int i = _i;
      double f = _w[i];
      double vref = _refv[i];
      double[] c = _cand[i];
      if (!isAmplitudeOk(i)) {
        ++_i;
        return State.SEEK_FIRST;
      }
      double dv = BranchJump.cycleVelocity(f,vref,_d);
      double span = _ref.getVelocitySpan();
      double density = (span>0.0)?dv/span:Double.POSITIVE_INFINITY;
      if (density<1.0/3.0) {
        trace("seek: f="+f+" branches too dense for a first pick");
        _ambiguous = true;
        return State.FAIL;
      }
      Integer[] k = order(c,vref);
      double vc = c[k[0]];
      if (abs(vc-vref)>0.5*dv) {
        ++_i;
        return State.SEEK_FIRST;
      }
      if (k.length>=2) {
        double dmin = abs(c[k[1]]-vc);
        if (k.length>=3)
          dmin = min(dmin,abs(c[k[2]]-vc));
        if (dmin<MIN_BRANCH_SEPARATION) {
          ++_i;
          if (++_retries>_maxRetries) {
            trace("seek: f="+f+" branches too close, giving up");
            _ambiguous = true;
            return State.FAIL;
          }
          return State.SEEK_FIRST;
        }
      }
      double fstep = BranchJump.frequencyStep(vref,_d);
      int np = clamp((int)ceil(0.05*_width/fstep),3,6);
      np = min(np,_n-i);
      if (np<2) {
        ++_i;
        return State.SEEK_FIRST;
      }
      double[] p = new double[np];
      double[] r = new double[np];
      for (int j=0; j<np; ++j) {
        double[] cj = _cand[i+j];
        p[j] = cj[closest(cj,_refv[i+j])];
        r[j] = _refv[i+j];
      }
      double vr = max(StatUtils.populationVariance(r),MIN_REF_VARIANCE);
      double ratio = StatUtils.populationVariance(p)/vr;
      if (ratio>MAX_VARIANCE_RATIO) {
        trace("seek: f="+f+" data variance too high: "+ratio);
        ++_i;
        return State.SEEK_FIRST;
      }
      _runStart = i;
      _errors = 0;
      return accept(f,vc);
    }

    private State track() {
      int i = _i;
      double f = _w[i];
      double vref = _refv[i];
      double[] c = _cand[i];
      if (!isAmplitudeOk(i)) {
        ++_errors;
        ++_i;
        return State.TRACK;
      }
      double vclosest = c[closest(c,vref)];
      if (_picks.size()==1)
        return accept(f,vclosest);
      double dv = BranchJump.cycleVelocity(f,vref,_d);
      double span = _ref.getVelocitySpan();
      double density = (span>0.0)?dv/span:Double.POSITIVE_INFINITY;
      int npick = _picks.size();
      double vlast = _picks.getLastVelocity();
      double fstep = BranchJump.frequencyStep(vlast,_d);
      if (npick==2 && vlast-_picks.getVelocity(0)>MAX_INITIAL_INCREASE)
        return restartFor(Restart.VELOCITY_INCREASE);
      double gap = f-_prevF;
      if (gap<0.5*fstep) {
        boolean early = coverage()<getMinimumCoverage();
        if (npick<4 && early)
          return restartFor(Restart.SMALL_STEP);
        ++_errors;
        if (_errors>_softErrors && early && npick<9 && density>0.5)
          return restartFor(Restart.TOO_MANY_ERRORS);
        if (_errors>_hardErrors) {
          trace("track: f="+f+" too many skipped crossings, stopping");
          return State.FAIL;
        }
      }

      // Linear prediction of velocity.
      int np = clamp((int)ceil(0.05*_width/fstep),3,8);
      double slope,intercept;
      if (npick<np) {
        slope = _ref.slope(_w[max(i-1,0)],_w[min(i+1,_n-1)]);
        intercept = vlast-slope*_picks.getLastFrequency();
      } else {
        double flast = _picks.getLastFrequency();
        double fprev = _picks.getFrequency(npick-2);
        double[] si;
        if (flast-fprev<2.0/3.0*fstep && np>3)
          si = regress(npick-np,npick-1);
        else
          si = regress(npick-np,npick);
        for (int j=1; si[0]*f+si[1]-vlast>0.0 && np+j<=npick; ++j)
          si = regress(npick-np-j,npick);
        slope = si[0];
        intercept = si[1];
        double sref = _ref.slope(_w[max(0,i-np)],f);
        if (abs(atan(slope)-atan(sref))>MAX_SLOPE_ANGLE) {
          if (coverage()<getMinimumCoverage())
            return restartFor(Restart.SLOPE_DIVERGENCE);
          trace("track: f="+f+" slope diverges from reference, stopping");
          return State.FAIL;
        }
      }

      // Candidates at the next crossings.
      int nc = 0;
      while (i+nc<_n && _w[i+nc]-_prevF<2.5*fstep)
        ++nc;
      double[] cf = new double[nc];
      double[] cv = new double[nc];
      double[] cp = new double[nc];
      boolean[] ok = new boolean[nc];
      boolean any = false;
      double vmean = (npick>3)?_picks.meanVelocity(npick-4,npick-1):0.0;
      for (int j=0; j<nc; ++j) {
        cf[j] = _w[i+j];
        cp[j] = slope*cf[j]+intercept;
        double[] cj = _cand[i+j];
        cv[j] = cj[closest(cj,cp[j])];
        ok[j] = BranchJump.isAcceptableBranchJump(cp[j],cv[j],cf[j],_d);
        if (ok[j] && npick>3)
          ok[j] = BranchJump.isAcceptableBranchJump(
            vmean,cv[j],cf[j],_d,MAX_SUSTAINED_PHASE);
        any = any || ok[j];
      }
      if (!any) {
        double vnear = c[closest(c,vlast)];
        boolean regular = 2.0/3.0*fstep<gap && gap<4.0/3.0*fstep;
        if (regular && BranchJump.isAcceptableBranchJump(
              vlast,vnear,f,_d,MAX_NEAR_PHASE))
          return accept(f,vnear);
        ++_errors;
        if (npick<8 || coverage()<getMinimumCoverage())
          return restartFor(Restart.NO_SUITABLE_CANDIDATE);
        if (_errors>_hardErrors) {
          trace("track: f="+f+" no candidate on branch, stopping");
          return State.FAIL;
        }
        ++_i;
        return State.TRACK;
      }

      // Prefer the next crossing, if it is close to its prediction.
      int k;
      if (ok[0] && cf[0]-_prevF<5.0/3.0*fstep &&
          abs(BranchJump.phase(cf[0],_d,cp[0],cv[0]))<MAX_NEXT_PHASE) {
        k = 0;
      } else {
        k = -1;
        for (int j=0; j<nc; ++j) {
          if (ok[j] && (k<0 || abs(cv[j]-cp[j])<abs(cv[k]-cp[k])))
            k = j;
        }
        if (k>npick)
          return restartFor(Restart.TOO_NOISY);
      }
      if (abs(cv[k]-cp[k])<abs(vclosest-cp[0])) {
        if (k!=0)
          ++_errors;
        _i += k;
        return accept(cf[k],cv[k]);
      }
      return accept(f,vclosest);
    }

    private State restartFor(Restart reason) {
      _reason = reason;
      return State.RESTART;
    }

    private State restart() {
      trace("restart: "+_reason+" at f="+_w[_i]+" after "+_picks.size()+
            " picks");
      if (_picks.size()>_fallback.size())
        _fallback = _picks;
      _picks = new PickSequence();
      _errors = 0;
      _i = max(_i-1,_runStart+1);
      return State.SEEK_FIRST;
    }

    private State accept(double f, double v) {
      _picks.add(f,v);
      _prevF = f;
      ++_i;
      if (_picks.size()<3 && f>0.5*(_w[0]+_w[_n-1])) {
        trace("accept: no picks over half the frequency axis, stopping");
        _picks.clear();
        return State.FAIL;
      }
      return State.TRACK;
    }

    private double coverage() {
      return _picks.getSpan()/_width;
    }

    // Amplitude near frequency i, compared with the largest amplitude.
    private boolean isAmplitudeOk(int i) {
      if (_minAmp==0.0 || _s==null || _n<3)
        return true;
      int j = clamp(i,1,_n-2);
      double amp = _s.getPeakAmplitude(_w[j-1],_w[j+1]);
      return amp>=_minAmp*_ampMax;
    }

    // Least-squares line through picks in the index range [i0,i1).
    private double[] regress(int i0, int i1) {
      SimpleRegression sr = new SimpleRegression();
      for (int i=i0; i<i1; ++i)
        sr.addData(_picks.getFrequency(i),_picks.getVelocity(i));
      return new double[]{sr.getSlope(),sr.getIntercept()};
    }
  }

  private static final double MIN_BRANCH_SEPARATION = 0.2;
  private static final double MIN_REF_VARIANCE = 1.0e-4;
  private static final double MAX_VARIANCE_RATIO = 20.0;
  private static final double MAX_INITIAL_INCREASE = 0.1;
  private static final double MAX_SLOPE_ANGLE = 0.7*PI;
  private static final double MAX_SUSTAINED_PHASE = 1.5*PI;
  private static final double MAX_NEAR_PHASE = 0.5*PI;
  private static final double MAX_NEXT_PHASE = 0.75*PI;

  private static int clamp(int k, int kmin, int kmax) {
    return max(kmin,min(kmax,k));
  }

  // Index of the first value closest to v.
  private static int closest(double[] c, double v) {
    int k = 0;
    for (int j=1; j<c.length; ++j)
      if (abs(c[j]-v)<abs(c[k]-v))
        k = j;
    return k;
  }

  // Indices of values, in order of increasing distance to v.
  private static Integer[] order(final double[] c, final double v) {
    Integer[] k = new Integer[c.length];
    for (int j=0; j<c.length; ++j)
      k[j] = j;
    Arrays.sort(k,new Comparator<Integer>() {
      public int compare(Integer a, Integer b) {
        return Double.compare(abs(c[a]-v),abs(c[b]-v));
      }
    });
    return k;
  }

  private static void trace(String s) {
    log.fine(s);
  }
}
