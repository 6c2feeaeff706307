package dispersion;

import static edu.mines.jtk.util.ArrayMath.*;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

import org.apache.commons.math3.stat.regression.SimpleRegression;

import edu.mines.jtk.dsp.RecursiveGaussianFilter;
import edu.mines.jtk.util.Check;
import util.RunningMean;

/**
 * Picks a dispersion curve as a ridge in an image of crossing density.
 * <p>
 * The picker steps along frequency in increments of a fraction of the
 * expected crossing spacing. At each step it scores a column of velocity
 * bins by the number of candidate crossings inside a window that is tilted
 * along the expected slope of the curve. The most recent columns are
 * smoothed with a Gaussian filter, and the ridge is picked in the center
 * column as the local maximum that is closest to a linear prediction and
 * that stands out from its neighboring minima. Finally, picks are smoothed
 * with a running mean.
 */
public class RidgePicker extends DispersionPicker {

  /**
   * Constructs a picker for the specified interstation distance. The
   * minimum coverage is 0.15.
   * @param distance interstation distance, in km.
   */
  public RidgePicker(double distance) {
    super(distance,0.15);
  }

  /**
   * Sets the size of the window used to count crossings. The half-width
   * is width times the expected crossing spacing; the half-height is height
   * times the velocity difference between adjacent branches. Defaults are
   * 5 and 0.2.
   */
  public void setFilterSize(double width, double height) {
    Check.argument(width>0.0,"width>0.0");
    Check.argument(height>0.0,"height>0.0");
    _filtWidth = width;
    _filtHeight = height;
  }

  /**
   * Sets the overlap of consecutive windows, in frequency and velocity.
   * Defaults are 0.75 and 0.75.
   */
  public void setOverlap(double xOverlap, double yOverlap) {
    Check.argument(0.0<=xOverlap && xOverlap<1.0,"0<=xOverlap<1");
    Check.argument(0.0<=yOverlap && yOverlap<1.0,"0<=yOverlap<1");
    _xOverlap = xOverlap;
    _yOverlap = yOverlap;
  }

  /**
   * Sets the smallest ratio of a ridge peak to its bounding minima. First
   * picks require twice this ratio. Default is 1.7.
   */
  public void setPickThreshold(double threshold) {
    Check.argument(threshold>0.0,"threshold>0.0");
    _pickThreshold = threshold;
  }

  @Override
  public PickSequence pick(Spectrum s, CrossingTable ct, ReferenceCurve ref) {
    double width = domainWidth(s,ref);
    double[] w = ct.getFrequencyAxis(ref.getMinFrequency(),
                                     ref.getMaxFrequency());
    if (w.length<2)
      throw new InsufficientCoverageException(
        "fewer than two crossings inside the reference domain");
    RidgeRun run = new RidgeRun(ct,ref,w);
    PickSequence ps = run.walk();
    if (ps.size()>run._three) {
      int nm = (int)(10.0*_xOverlap)+1;
      ps.setVelocities(RunningMean.apply(ps.getVelocities(),nm));
    }
    checkCoverage(ps,width,run._three+1);
    return ps;
  }

  ///////////////////////////////////////////////////////////////////////////
  // private

  private static final Logger log =
    Logger.getLogger(RidgePicker.class.getName());

  private double _filtWidth = 5.0;
  private double _filtHeight = 0.2;
  private double _xOverlap = 0.75;
  private double _yOverlap = 0.75;
  private double _pickThreshold = 1.7;

  // State of one call to pick.
  private class RidgeRun {

    RidgeRun(CrossingTable ct, ReferenceCurve ref, double[] w) {
      _ref = ref;
      _w = w;
      _d = getDistance();
      int nc = ct.size();
      _cf = new double[nc];
      _cv = new double[nc];
      for (int i=0; i<nc; ++i) {
        _cf[i] = ct.getFrequency(i);
        _cv[i] = ct.getVelocity(i);
      }
      double fmax = w[w.length-1];
      _dvMin = BranchJump.cycleVelocity(fmax,ref.velocity(fmax,true),_d);
      double vmin = getZeroCrossings().getMinVelocity();
      double vmax = getZeroCrossings().getMaxVelocity();
      int ny = (int)((vmax-vmin)/((1.0-_yOverlap)*_dvMin))*2+1;
      _y = new double[ny];
      for (int iy=0; iy<ny; ++iy)
        _y[iy] = (ny>1)?vmin+iy*(vmax-vmin)/(ny-1):vmin;
      _three = max(2,(int)(3.0/(1.0-_xOverlap)));
      _cols = new ArrayList<float[]>();
      _colf = new ArrayList<Double>();
      _picks = new PickSequence();
      _backup = new PickSequence();
    }

    PickSequence walk() {
      double fmin = _w[0];
      double fmax = _w[_w.length-1];
      double span = _ref.getVelocitySpan();
      double f = fmin;
      while (f<=fmax) {
        double vref = _ref.velocity(f,true);
        double fstep = BranchJump.frequencyStep(vref,_d);
        double dv = BranchJump.cycleVelocity(f,vref,_d);
        double sref = _ref.secantSlope(f-_filtWidth*fstep,f+_filtWidth*fstep);
        double slope = windowSlope(f,sref);
        _cols.add(column(f,slope,dv,fstep));
        _colf.add(f);
        if (_cols.size()>_three+1) {
          _cols.remove(0);
          _colf.remove(0);
        }
        _lastF = f;
        _lastStep = fstep;
        _lastDv = dv;
        if (!checkQuality(f,fstep,dv,span)) {
          _pickToEnd = false;
          break;
        }
        if (_cols.size()>_three) {
          smooth(dv);
          if (_picks.isEmpty()) {
            double dvRef = abs(_ref.velocity(_ref.getMinFrequency())-vref);
            if (dv/dvRef<0.25) {
              trace("walk: f="+f+" branches too dense, stopping");
              break;
            }
            pickFirst(vref,dv);
          } else {
            pickNext(slope,dv);
          }
        }
        double df = (1.0-_xOverlap)*fstep;
        if (f+df>fmax) {
          f += max(fmax-f,0.001);
        } else {
          f += df;
        }
      }
      if (_pickToEnd && !_picks.isEmpty() && _sm!=null)
        pickToEnd();
      trace("walk: "+_picks.size()+" picks, backup "+_backup.size()+" picks");
      if (_backup.size()>_picks.size())
        _picks = _backup;
      return _picks;
    }

    private ReferenceCurve _ref;
    private double[] _w; // crossing frequencies inside reference domain
    private double _d; // distance
    private double[] _cf,_cv; // candidate frequencies and velocities
    private double _dvMin; // branch separation at highest frequency
    private double[] _y; // velocity bins
    private int _three; // columns in three crossing spacings
    private List<float[]> _cols; // last columns of crossing density
    private List<Double> _colf; // their frequencies
    private float[][] _sm; // last smoothed columns
    private double[] _smf; // frequencies of last smoothed columns
    private PickSequence _picks;
    private PickSequence _backup;
    private boolean _pickToEnd = true;
    private double _lastF,_lastStep,_lastDv;

    // Slope of the counting window, never positive.
    private double windowSlope(double f, double sref) {
      int nr = _three/2;
      int np = _picks.size();
      double slope = sref;
      if (np>nr) {
        SimpleRegression sr = new SimpleRegression();
        for (int i=np-nr; i<np; ++i)
          sr.addData(_picks.getFrequency(i),_picks.getVelocity(i));
        slope = sr.getSlope();
      }
      if (abs(atan(slope)-atan(sref))>MAX_SLOPE_ANGLE) {
        trace("windowSlope: f="+f+" removing picks with inconsistent slope");
        slope = sref;
        int nd = min(_three/4+1,_picks.size());
        for (int i=0; i<nd; ++i)
          _picks.removeLast();
      } else {
        slope = 0.33*sref+0.66*slope;
      }
      return min(slope,0.0);
    }

    // Crossing density for all velocity bins, normalized by its maximum.
    // Near the ends of the crossing axis the window shrinks to stay
    // centered on f.
    private float[] column(double f, double slope, double dv, double fstep) {
      int ny = _y.length;
      float[] c = new float[ny];
      double edge = min(f-_w[0],_w[_w.length-1]-f)+fstep;
      double half = min(_filtWidth*fstep,edge);
      double x0 = f-half;
      double x1 = f+half;
      double h = _filtHeight*dv;
      int i0 = lowerBound(x0);
      boolean hasPicks = !_picks.isEmpty();
      double vlast = hasPicks?_picks.getLastVelocity():0.0;
      for (int iy=0; iy<ny; ++iy) {
        double v = _y[iy];
        if (hasPicks && abs(v-vlast)>3.0*dv)
          continue;
        double sum = 0.0;
        for (int i=i0; i<_cf.length && _cf[i]<x1; ++i) {
          if (_cf[i]<=x0)
            continue;
          double e = abs(_cv[i]-(v+slope*(_cf[i]-f)));
          if (e<h)
            sum += 1.0-e/h;
        }
        double dvSmall = BranchJump.cycleVelocity(f,v,_d);
        c[iy] = (float)(sum*dvSmall/dv);
      }
      float cmax = max(c);
      if (cmax>0.0f)
        mul(1.0f/cmax,c,c);
      return c;
    }

    // Gap and cycle-jump checks; returns false if picking must stop.
    private boolean checkQuality(
        double f, double fstep, double dv, double span) {
      if (!_picks.isEmpty() && f-_picks.getLastFrequency()>3.0*fstep) {
        double density = (span>0.0)?dv/span:Double.POSITIVE_INFINITY;
        if (density<1.0/3.0) {
          trace("checkQuality: f="+f+" gap in picks, stopping");
          return false;
        }
        trace("checkQuality: f="+f+" gap in picks, restarting");
        if (_backup.size()<_picks.size())
          _backup = _picks;
        _picks = new PickSequence();
      }
      if (!_picks.isEmpty())
        trimCycleJump(f,fstep);
      return true;
    }

    // Removes picks of the last two crossing spacings after a cycle jump.
    private void trimCycleJump(double f, double fstep) {
      int np = _picks.size();
      double fc = f-2.0*fstep;
      int k = 0;
      for (int i=1; i<np; ++i)
        if (abs(_picks.getFrequency(i)-fc)<abs(_picks.getFrequency(k)-fc))
          k = i;
      if (k==0)
        return;
      double vlast = _picks.getLastVelocity();
      if (!BranchJump.isAcceptableBranchJump(
            _picks.getVelocity(k),vlast,f,_d,MAX_CYCLE_PHASE) ||
          !BranchJump.isAcceptableBranchJump(
            _picks.getVelocity(np-2),vlast,f,_d,MAX_CYCLE_PHASE)) {
        trace("trimCycleJump: f="+f+" cycle jump detected");
        _picks.removeAfter(fc);
      }
    }

    // Smooths the last columns.
    private void smooth(double dv) {
      int nc = _cols.size();
      int ny = _y.length;
      float[][] x = new float[_three][];
      _smf = new double[_three];
      for (int j=0; j<_three; ++j) {
        x[j] = _cols.get(nc-_three+j);
        _smf[j] = _colf.get(nc-_three+j);
      }
      double sigma = max(1.0,0.5*dv/_dvMin);
      _sm = new float[_three][ny];
      new RecursiveGaussianFilter(sigma).apply00(x,_sm);
    }

    private void pickFirst(double vref, double dv) {
      PickSequence first = new PickSequence();
      for (int j=0; j<_three/2; ++j) {
        double v = pickColumn(_sm[j],vref,dv,2.0*_pickThreshold);
        if (Double.isNaN(v))
          continue;
        if (!first.isEmpty() && !BranchJump.isAcceptableBranchJump(
              first.getLastVelocity(),v,_smf[j],_d,MAX_FIRST_PHASE))
          continue;
        first.add(_smf[j],v);
      }
      if (first.size()<2)
        return;
      double vmean = first.meanVelocity(0,first.size());
      if (abs(vmean-vref)>dv/1.6) {
        trace("pickFirst: first picks too far from reference");
        return;
      }
      if (first.getLastVelocity()-first.getVelocity(0)>0.1*dv) {
        trace("pickFirst: first picks increase in velocity");
        return;
      }
      _picks = first;
    }

    private void pickNext(double slope, double dv) {
      int j = _three/2;
      double fp = _smf[j];
      double flast = _picks.getLastFrequency();
      if (fp<=flast)
        return;
      double vlast = _picks.getLastVelocity();
      double vp = vlast+slope*(fp-flast);
      double v = pickColumn(_sm[j],vp,dv,_pickThreshold);
      if (Double.isNaN(v) || !BranchJump.isAcceptableBranchJump(vlast,v,fp,_d))
        return;
      _picks.add(fp,v);
    }

    // Picks the remaining columns of the last smoothed window.
    private void pickToEnd() {
      double dv = _lastDv;
      for (int j=_three/2+1; j<_three; ++j) {
        if (_picks.isEmpty())
          break;
        double vlast = _picks.getLastVelocity();
        if (_smf[j]<=_picks.getLastFrequency())
          continue;
        double v = pickColumn(_sm[j],vlast,dv,_pickThreshold);
        if (Double.isNaN(v) ||
            !BranchJump.isAcceptableBranchJump(vlast,v,_smf[j],_d))
          continue;
        _picks.add(_smf[j],v);
      }
      if (!_picks.isEmpty())
        trimCycleJump(_lastF,_lastStep);
    }

    // Velocity of the local maximum closest to a target velocity, or NaN if
    // that maximum does not exceed its bounding minima by the threshold or
    // the column holds no ridge at all.
    private double pickColumn(
        float[] c, double target, double dv, double threshold) {
      int ny = c.length;
      float cmax = max(c);
      if (cmax<MIN_RIDGE_DENSITY)
        return Double.NaN;
      int kmax = -1;
      for (int iy=1; iy<ny-1; ++iy) {
        if (c[iy]>c[iy-1] && c[iy]>c[iy+1] && c[iy]>0.05f*cmax) {
          if (kmax<0 || abs(_y[iy]-target)<abs(_y[kmax]-target))
            kmax = iy;
        }
      }
      if (kmax<0)
        return Double.NaN;
      double lower = c[bin(_y[kmax]-0.5*dv)];
      for (int iy=kmax-1; iy>0; --iy) {
        if (c[iy]<c[iy-1] && c[iy]<c[iy+1]) {
          lower = c[iy];
          break;
        }
      }
      double upper = c[bin(_y[kmax]+0.5*dv)];
      for (int iy=kmax+1; iy<ny-1; ++iy) {
        if (c[iy]<c[iy-1] && c[iy]<c[iy+1]) {
          upper = c[iy];
          break;
        }
      }
      double ratio = c[kmax]/(0.5*(lower+upper)+1.0e-5);
      return (ratio>threshold)?_y[kmax]:Double.NaN;
    }

    // Index of the velocity bin nearest to v.
    private int bin(double v) {
      int ny = _y.length;
      if (ny==1)
        return 0;
      double dy = _y[1]-_y[0];
      int iy = (int)Math.round((v-_y[0])/dy);
      return max(0,min(ny-1,iy));
    }

    private int lowerBound(double f) {
      int lo = 0;
      int hi = _cf.length;
      while (lo<hi) {
        int mid = (lo+hi)>>>1;
        if (_cf[mid]<f)
          lo = mid+1;
        else
          hi = mid;
      }
      return lo;
    }
  }

  private static final double MAX_SLOPE_ANGLE = 0.8*PI;
  private static final double MAX_FIRST_PHASE = 0.4*PI;
  private static final double MAX_CYCLE_PHASE = PI;
  private static final float MIN_RIDGE_DENSITY = 0.1f;

  private static void trace(String s) {
    log.fine(s);
  }
}
