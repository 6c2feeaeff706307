package tools;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Properties;
import java.util.logging.Logger;

import dispersion.*;

/**
 * Picks a phase-velocity dispersion curve from a cross-correlation
 * spectrum stored in a text file.
 * <p>
 * The spectrum file has columns "frequency real [imag]"; the reference
 * file has columns "frequency velocity". Blank lines and lines starting
 * with '#' are ignored. Candidate crossings and picks are written to the
 * files crossings.txt and picks.txt in the output directory.
 * <p>
 * Usage:
 * <pre>
 *   java -Ddistance=100 -Dmethod=ridge tools.PickDispersion \
 *     spectrum.txt reference.txt [outDir]
 * </pre>
 * Options: distance (km, required), minVel, maxVel, freqMin, freqMax,
 * horizontal, smooth, method (sequential or ridge), and cmin and cmax to
 * apply a velocity filter first. The sequential method also reads minAmp;
 * the ridge method reads filtWidth, filtHeight, xOverlap, yOverlap and
 * pickThreshold.
 */
public class PickDispersion {

  public static void main(String[] args) throws IOException {
    String spectrumArg = arg(args,0,"spectrum");
    String referenceArg = arg(args,1,"reference");
    if (spectrumArg.isEmpty() || referenceArg.isEmpty()) {
      System.err.println("usage: PickDispersion spectrum reference [outDir]");
      System.exit(2);
    }
    Path spectrum = Paths.get(spectrumArg);
    Path reference = Paths.get(referenceArg);
    String outArg = arg(args,2,"outDir");
    Path outDir = outArg.isEmpty() ?
      spectrum.toAbsolutePath().getParent() : Paths.get(outArg);
    try {
      DispersionResult dr = run(spectrum,reference,outDir,System.getProperties());
      log.info("picked "+dr.getPickSequence().size()+" velocities");
    } catch (PickException e) {
      log.warning("no dispersion measurement: "+e.getMessage());
      System.exit(1);
    }
  }

  /**
   * Reads a spectrum and a reference curve, picks a dispersion curve and
   * writes crossings and picks to the output directory.
   * @param spectrum path of the spectrum file.
   * @param reference path of the reference file.
   * @param outDir the output directory; created if necessary.
   * @param options picking options.
   * @return the crossings and picks.
   * @throws IOException if a file cannot be read or written.
   * @throws PickException if no dispersion curve can be picked.
   */
  public static DispersionResult run(
      Path spectrum, Path reference, Path outDir, Properties options)
      throws IOException
  {
    String distanceOpt = options.getProperty("distance");
    if (distanceOpt==null)
      throw new IllegalArgumentException("option distance is required");
    double distance = Double.parseDouble(distanceOpt);
    Spectrum s = readSpectrum(spectrum);
    ReferenceCurve ref = new ReferenceCurve(readColumns(reference,2));
    log.info("spectrum: "+s.getCount()+" samples in ["+
             s.getFirstFrequency()+","+s.getLastFrequency()+"] Hz");

    String cmin = options.getProperty("cmin");
    String cmax = options.getProperty("cmax");
    if (cmin!=null || cmax!=null) {
      double c0 = (cmin!=null)?Double.parseDouble(cmin):1.0;
      double c1 = (cmax!=null)?Double.parseDouble(cmax):5.0;
      log.info("velocity filter: ["+c0+","+c1+"] km/s");
      s = VelocityFilter.apply(s,distance,c0,c1).getSpectrum();
    }

    DispersionPicker dp = makePicker(distance,options);
    DispersionResult dr = dp.pick(s,ref);
    Files.createDirectories(outDir);
    write(outDir.resolve("crossings.txt"),dr.getCrossings());
    write(outDir.resolve("picks.txt"),dr.getPicks());
    log.info("wrote "+dr.getCrossings().length+" crossings and "+
             dr.getPicks().length+" picks to "+outDir);
    return dr;
  }

  /**
   * Returns a picker configured with the specified options.
   */
  public static DispersionPicker makePicker(
      double distance, Properties options)
  {
    String method = options.getProperty("method","sequential");
    DispersionPicker dp;
    if (method.equalsIgnoreCase("sequential")) {
      SequentialPicker sp = new SequentialPicker(distance);
      sp.setMinimumAmplitude(number(options,"minAmp",0.0));
      dp = sp;
    } else if (method.equalsIgnoreCase("ridge")) {
      RidgePicker rp = new RidgePicker(distance);
      rp.setFilterSize(number(options,"filtWidth",5.0),
                       number(options,"filtHeight",0.2));
      rp.setOverlap(number(options,"xOverlap",0.75),
                    number(options,"yOverlap",0.75));
      rp.setPickThreshold(number(options,"pickThreshold",1.7));
      dp = rp;
    } else {
      throw new IllegalArgumentException("unknown method: "+method);
    }
    dp.setVelocityLimits(number(options,"minVel",1.0),
                         number(options,"maxVel",5.0));
    dp.setFrequencyLimits(number(options,"freqMin",0.0),
                          number(options,"freqMax",99.0));
    dp.setHorizontalPolarization(
      Boolean.parseBoolean(options.getProperty("horizontal","false")));
    dp.setSmoothSpectrum(
      Boolean.parseBoolean(options.getProperty("smooth","false")));
    return dp;
  }

  /**
   * Reads a spectrum file with columns "frequency real [imag]".
   */
  public static Spectrum readSpectrum(Path path) throws IOException {
    double[][] rows = readColumns(path,2);
    int n = rows.length;
    double[] f = new double[n];
    double[] re = new double[n];
    double[] im = null;
    for (int i=0; i<n; ++i) {
      f[i] = rows[i][0];
      re[i] = rows[i][1];
      if (rows[i].length>2) {
        if (im==null)
          im = new double[n];
        im[i] = rows[i][2];
      }
    }
    return new Spectrum(f,re,im);
  }

  /**
   * Reads rows of whitespace- or comma-separated numbers.
   * @param path the file.
   * @param minColumns the smallest number of columns in each row.
   * @return array of rows.
   */
  public static double[][] readColumns(Path path, int minColumns)
      throws IOException
  {
    List<double[]> rows = new ArrayList<double[]>();
    try (BufferedReader br = Files.newBufferedReader(path,StandardCharsets.UTF_8)) {
      String line;
      int lineNumber = 0;
      while ((line=br.readLine())!=null) {
        ++lineNumber;
        line = line.trim();
        if (line.isEmpty() || line.startsWith("#"))
          continue;
        String[] tokens = line.split("[\\s,]+");
        if (tokens.length<minColumns)
          throw new IOException(path+":"+lineNumber+": expected "+
                                minColumns+" columns");
        double[] row = new double[tokens.length];
        try {
          for (int j=0; j<tokens.length; ++j)
            row[j] = Double.parseDouble(tokens[j]);
        } catch (NumberFormatException e) {
          throw new IOException(path+":"+lineNumber+": "+e.getMessage(),e);
        }
        rows.add(row);
      }
    }
    return rows.toArray(new double[rows.size()][]);
  }

  ///////////////////////////////////////////////////////////////////////////
  // private

  private static final Logger log =
    Logger.getLogger(PickDispersion.class.getName());

  private static String arg(String[] args, int i, String property) {
    if (args!=null && args.length>i && args[i]!=null && !args[i].trim().isEmpty())
      return args[i].trim();
    return System.getProperty(property,"").trim();
  }

  private static double number(Properties p, String key, double value) {
    String s = p.getProperty(key);
    return (s!=null)?Double.parseDouble(s):value;
  }

  private static void write(Path path, double[][] rows) throws IOException {
    try (BufferedWriter bw = Files.newBufferedWriter(path,StandardCharsets.UTF_8)) {
      for (double[] row:rows) {
        bw.write(String.format(Locale.US,"%.6f %.6f",row[0],row[1]));
        bw.newLine();
      }
    }
  }
}
