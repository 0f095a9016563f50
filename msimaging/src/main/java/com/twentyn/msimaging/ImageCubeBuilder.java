/*************************************************************************
*                                                                        *
*  This file is part of the 20n/act project.                             *
*  20n/act enables DNA prediction for synthetic biology/bioengineering.  *
*  Copyright (C) 2017 20n Labs, Inc.                                     *
*                                                                        *
*  Please direct all queries to act@20n.com.                             *
*                                                                        *
*  This program is free software: you can redistribute it and/or modify  *
*  it under the terms of the GNU General Public License as published by  *
*  the Free Software Foundation, either version 3 of the License, or     *
*  (at your option) any later version.                                   *
*                                                                        *
*  This program is distributed in the hope that it will be useful,       *
*  but WITHOUT ANY WARRANTY; without even the implied warranty of        *
*  MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the         *
*  GNU General Public License for more details.                          *
*                                                                        *
*  You should have received a copy of the GNU General Public License     *
*  along with this program.  If not, see <http://www.gnu.org/licenses/>. *
*                                                                        *
*************************************************************************/

package com.twentyn.msimaging;

import com.twentyn.msimaging.image.ImageCube;
import com.twentyn.msimaging.image.ImageCubeStore;
import com.twentyn.msimaging.image.ImageGridder;
import com.twentyn.msimaging.image.JsonImageCubeStore;
import com.twentyn.msimaging.path.ScanDirection;
import com.twentyn.msimaging.path.ScanDirectionClassifier;
import com.twentyn.msimaging.path.ScanPositionEstimator;
import com.twentyn.msimaging.path.ScanPositions;
import com.twentyn.msimaging.path.StagePath;
import com.twentyn.msimaging.path.StagePathParser;
import com.twentyn.msimaging.spectra.DenseSpectra;
import com.twentyn.msimaging.spectra.MzMLSpectrumParser;
import com.twentyn.msimaging.spectra.SpectrumRasterizer;
import com.twentyn.msimaging.spectra.SpectrumSeries;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.commons.codec.digest.DigestUtils;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.xml.parsers.ParserConfigurationException;
import javax.xml.stream.XMLStreamException;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Reconstructs an (x, y, m/z) image cube from mass spectra collected while the sample stage follows a comb path.
 *
 * The stage sweeps each line twice, out and back.  Only the first sweep of every line is imaged: its timing, and so
 * its registration with the other lines, is more reliable than the return sweep's.
 */
public class ImageCubeBuilder {
  private static final Logger LOGGER = LogManager.getFormatterLogger(ImageCubeBuilder.class);

  public static final String OPTION_SPECTRA_FILE = "i";
  public static final String OPTION_POSITION_FILE = "p";
  public static final String OPTION_TIMING_FILE = "t";
  public static final String OPTION_STORE_DIR = "d";
  public static final String OPTION_CLOCK_OFFSET = "o";
  public static final String OPTION_PIXEL_PITCH = "x";
  public static final String OPTION_RESOLUTION = "n";
  public static final String OPTION_KERNEL_WIDTH = "k";
  public static final String OPTION_FORCE = "f";

  public static final String HELP_MESSAGE = StringUtils.join(new String[]{
      "This class builds an (x, y, m/z) image cube from the time-series mass spectra of a comb-path imaging run, ",
      "using the stage's waypoint and timing files to place each scan.  Cubes are written as JSON to a store ",
      "directory and reused when the same inputs and parameters are seen again."
  }, "");

  public static final List<Option.Builder> OPTION_BUILDERS = new ArrayList<Option.Builder>() {{
    add(Option.builder(OPTION_SPECTRA_FILE)
        .argName("mzML file")
        .desc("A path to the mzML file of time-series spectra")
        .hasArg().required()
        .longOpt("input")
    );
    add(Option.builder(OPTION_POSITION_FILE)
        .argName("position file")
        .desc("A path to the tab-delimited stage waypoint file (six columns per row, micrometers)")
        .hasArg().required()
        .longOpt("positions")
    );
    add(Option.builder(OPTION_TIMING_FILE)
        .argName("timing file")
        .desc("A path to the tab-delimited stage timing file (three columns per row, milliseconds)")
        .hasArg().required()
        .longOpt("timings")
    );
    add(Option.builder(OPTION_STORE_DIR)
        .argName("store directory")
        .desc("A directory in which image cubes are stored")
        .hasArg().required()
        .longOpt("store-dir")
    );
    add(Option.builder(OPTION_CLOCK_OFFSET)
        .argName("seconds")
        .desc("Seconds to add to each scan time to align the spectrometer's clock with the stage's (default 0)")
        .hasArg()
        .longOpt("offset")
    );
    add(Option.builder(OPTION_PIXEL_PITCH)
        .argName("micrometers")
        .desc("Pixel width; derived from the median number of scans per line when omitted")
        .hasArg()
        .longOpt("pitch")
    );
    add(Option.builder(OPTION_RESOLUTION)
        .argName("N")
        .desc(String.format("Mass axis resolution for centroided data: bins grow by (N+1)/N (default %d)",
            SpectrumRasterizer.DEFAULT_RESOLUTION))
        .hasArg()
        .longOpt("resolution")
    );
    add(Option.builder(OPTION_KERNEL_WIDTH)
        .argName("bins")
        .desc(String.format("Width of the Gaussian peak smoothing window for centroided data, odd (default %d)",
            SpectrumRasterizer.DEFAULT_KERNEL_WIDTH))
        .hasArg()
        .longOpt("kernel-width")
    );
    add(Option.builder(OPTION_FORCE)
        .argName("force")
        .desc("Rebuild the cube even if the store already holds one for these inputs")
        .longOpt("force")
    );
    add(Option.builder("h")
        .argName("help")
        .desc("Prints this help message")
        .longOpt("help")
    );
  }};

  public static final HelpFormatter HELP_FORMATTER = new HelpFormatter();

  static {
    HELP_FORMATTER.setWidth(100);
  }

  private final StagePathParser pathParser;
  private final ScanPositionEstimator positionEstimator;
  private final ScanDirectionClassifier directionClassifier;
  private final SpectrumRasterizer rasterizer;
  private final ImageGridder gridder;

  public ImageCubeBuilder() {
    this(new SpectrumRasterizer());
  }

  public ImageCubeBuilder(SpectrumRasterizer rasterizer) {
    this.pathParser = new StagePathParser();
    this.positionEstimator = new ScanPositionEstimator();
    this.directionClassifier = new ScanDirectionClassifier();
    this.rasterizer = rasterizer;
    this.gridder = new ImageGridder();
  }

  public static void main(String[] args) throws Exception {
    Options opts = new Options();
    for (Option.Builder b : OPTION_BUILDERS) {
      opts.addOption(b.build());
    }

    CommandLine cl = null;
    try {
      CommandLineParser parser = new DefaultParser();
      cl = parser.parse(opts, args);
    } catch (ParseException e) {
      System.err.format("Argument parsing failed: %s\n", e.getMessage());
      HELP_FORMATTER.printHelp(ImageCubeBuilder.class.getCanonicalName(), HELP_MESSAGE, opts, null, true);
      System.exit(1);
    }

    if (cl.hasOption("help")) {
      HELP_FORMATTER.printHelp(ImageCubeBuilder.class.getCanonicalName(), HELP_MESSAGE, opts, null, true);
      return;
    }

    for (String opt : new String[]{OPTION_SPECTRA_FILE, OPTION_POSITION_FILE, OPTION_TIMING_FILE}) {
      File f = new File(cl.getOptionValue(opt));
      if (!f.isFile()) {
        System.err.format("Cannot find input file at %s\n", f.getAbsolutePath());
        HELP_FORMATTER.printHelp(ImageCubeBuilder.class.getCanonicalName(), HELP_MESSAGE, opts, null, true);
        System.exit(1);
      }
    }

    SpectrumRasterizer rasterizer = new SpectrumRasterizer(
        Integer.parseInt(cl.getOptionValue(OPTION_RESOLUTION, String.valueOf(SpectrumRasterizer.DEFAULT_RESOLUTION))),
        Integer.parseInt(cl.getOptionValue(OPTION_KERNEL_WIDTH,
            String.valueOf(SpectrumRasterizer.DEFAULT_KERNEL_WIDTH))));
    double clockOffset = Double.parseDouble(cl.getOptionValue(OPTION_CLOCK_OFFSET, "0"));
    Optional<Double> pitch = cl.hasOption(OPTION_PIXEL_PITCH) ?
        Optional.of(Double.valueOf(cl.getOptionValue(OPTION_PIXEL_PITCH))) : Optional.empty();

    ImageCubeBuilder builder = new ImageCubeBuilder(rasterizer);
    ImageCube cube = builder.buildOrLoad(
        new File(cl.getOptionValue(OPTION_SPECTRA_FILE)),
        new File(cl.getOptionValue(OPTION_POSITION_FILE)),
        new File(cl.getOptionValue(OPTION_TIMING_FILE)),
        clockOffset,
        pitch,
        new JsonImageCubeStore(new File(cl.getOptionValue(OPTION_STORE_DIR))),
        cl.hasOption(OPTION_FORCE)
    );

    LOGGER.info("Done: %d lines x %d pixels x %d mass channels (%d degenerate lines)",
        cube.getLineCount(), cube.getPixelCount(), cube.getChannelCount(), cube.getDegenerateLines().size());
  }

  /**
   * Returns the stored cube for these inputs if there is one; otherwise reads the inputs, builds the cube and stores
   * it.
   * @param force Rebuild and overwrite even if the store already holds a cube for these inputs.
   */
  public ImageCube buildOrLoad(File spectraFile, File positionFile, File timingFile, double clockOffset,
                               Optional<Double> pitch, ImageCubeStore store, boolean force)
      throws IOException, ParserConfigurationException, XMLStreamException {
    String key = cacheKey(spectraFile, positionFile, timingFile, clockOffset, pitch);
    if (!force && store.contains(key)) {
      LOGGER.info("Found existing image cube %s, skipping reconstruction", key);
      return store.load(key);
    }

    // Path format errors surface before the spectra are read.
    StagePath path = pathParser.parse(positionFile, timingFile);
    SpectrumSeries series = SpectrumSeries.fromSpectra(new MzMLSpectrumParser().parse(spectraFile));

    ImageCube cube = build(series, path, clockOffset, pitch);
    store.save(key, cube);
    return cube;
  }

  public ImageCube build(SpectrumSeries series, StagePath path) {
    return build(series, path, 0.0, Optional.empty());
  }

  /**
   * Reconstructs the image cube for one run.
   * @param series The run's spectra, profile or centroided.
   * @param path The stage path the run followed.
   * @param clockOffset Seconds to add to scan times to put them on the stage's clock.
   * @param pitch Pixel width in µm, or empty to derive it from the scan density.
   */
  public ImageCube build(SpectrumSeries series, StagePath path, double clockOffset, Optional<Double> pitch) {
    ScanPositions positions = positionEstimator.estimate(series.getScanTimes(), path, clockOffset);
    ScanDirection[] directions = directionClassifier.classify(positions);

    DenseSpectra spectra = rasterizer.rasterize(series);

    ScanDirection firstPass = findFirstPassDirection(positions);
    ScanDirection returnPass = firstPass.opposite();
    LOGGER.info("First pass of each line runs %s; discarding %s scans", firstPass, returnPass);

    // Turnarounds stay in: they carry no direction label but still mark the extent of the sweep.
    List<Integer> keep = new ArrayList<>();
    for (int i = 0; i < positions.size(); i++) {
      if (positions.hasPosition(i) && directions[i] != returnPass) {
        keep.add(i);
      }
    }

    double[] scanX = positions.getX();
    double[] scanY = positions.getY();
    double[][] scanIntensities = spectra.getIntensities();
    double[] x = new double[keep.size()];
    double[] y = new double[keep.size()];
    double[][] intensities = new double[keep.size()][];
    for (int k = 0; k < keep.size(); k++) {
      int scan = keep.get(k);
      x[k] = scanX[scan];
      y[k] = scanY[scan];
      intensities[k] = scanIntensities[scan];
    }
    LOGGER.info("Using %d of %d scans for the image", keep.size(), series.size());

    return gridder.grid(x, y, intensities, positions.getLines(), spectra.getMassAxis(), pitch);
  }

  /**
   * Finds the direction of the stage's very first sweep from the first two consecutive scans that have positions and
   * differ in x.
   * @throws IllegalStateException if the stage never moves in x while scans are being acquired.
   */
  public static ScanDirection findFirstPassDirection(ScanPositions positions) {
    double[] x = positions.getX();
    for (int i = 1; i < x.length; i++) {
      if (!positions.hasPosition(i - 1) || !positions.hasPosition(i) || x[i] == x[i - 1]) {
        continue;
      }
      return x[i] > x[i - 1] ? ScanDirection.LEFT_TO_RIGHT : ScanDirection.RIGHT_TO_LEFT;
    }
    throw new IllegalStateException("The stage never moved in x while spectra were acquired");
  }

  /**
   * Derives a cache key from the contents of the input files and every parameter that affects the cube.
   */
  public String cacheKey(File spectraFile, File positionFile, File timingFile, double clockOffset,
                         Optional<Double> pitch) throws IOException {
    List<String> parts = new ArrayList<>();
    for (File f : new File[]{spectraFile, positionFile, timingFile}) {
      try (InputStream is = new FileInputStream(f)) {
        parts.add(DigestUtils.md5Hex(is));
      }
    }
    parts.add(String.valueOf(clockOffset));
    parts.add(pitch.map(String::valueOf).orElse("auto"));
    parts.add(String.valueOf(rasterizer.getResolution()));
    parts.add(String.valueOf(rasterizer.getKernelWidth()));
    return DigestUtils.md5Hex(StringUtils.join(parts, ':'));
  }
}
