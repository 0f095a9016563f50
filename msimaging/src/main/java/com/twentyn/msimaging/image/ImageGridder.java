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

package com.twentyn.msimaging.image;

import org.apache.commons.math3.analysis.interpolation.LinearInterpolator;
import org.apache.commons.math3.analysis.polynomials.PolynomialSplineFunction;
import org.apache.commons.math3.stat.descriptive.rank.Median;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Resamples scans acquired at irregular stage positions onto a regular (line, pixel) grid.
 *
 * Each line of the image is built independently: the scans on that line are linearly interpolated along x onto evenly
 * spaced pixel positions.  Pixels outside the span of a line's scans are zero; values are never extrapolated.
 */
public class ImageGridder {
  private static final Logger LOGGER = LogManager.getFormatterLogger(ImageGridder.class);

  // Scans within this distance (µm) of the overall x extent are left out of interpolation.
  public static final double EDGE_GUARD = 1.0;
  // Absorbs floating point error when deciding whether max(x) falls on the pixel grid.
  private static final double GRID_TOLERANCE = 1e-9;

  /**
   * Builds the image cube.
   * @param x Stage x-position of each scan (µm).  Must not contain NaNs.
   * @param y Stage y-position of each scan (µm).  Must not contain NaNs.
   * @param intensities One row of mass channel intensities per scan.
   * @param lines The y-offset of every image line, in output order.
   * @param mzAxis The m/z of each mass channel.
   * @param pitch The pixel width in µm; when absent, derived from the median number of scans per line.
   * @return A cube of lines.size() x pixels x mzAxis.length intensities.
   */
  public ImageCube grid(double[] x, double[] y, double[][] intensities, List<Double> lines, double[] mzAxis,
                        Optional<Double> pitch) {
    if (x.length == 0) {
      throw new IllegalArgumentException("No scans with a known position are available for gridding");
    }
    if (y.length != x.length || intensities.length != x.length) {
      throw new IllegalArgumentException(String.format(
          "Gridding inputs differ in length: %d x, %d y, %d intensity rows", x.length, y.length, intensities.length));
    }

    double minX = Double.POSITIVE_INFINITY, maxX = Double.NEGATIVE_INFINITY;
    for (double v : x) {
      minX = Math.min(minX, v);
      maxX = Math.max(maxX, v);
    }
    if (!(maxX > minX)) {
      throw new IllegalArgumentException(String.format("Scans span no x range (all at x = %f)", minX));
    }

    double pixelPitch = pitch.isPresent() ? pitch.get() : medianPitch(y, lines, maxX - minX);
    if (!(pixelPitch > 0.0) || Double.isInfinite(pixelPitch)) {
      throw new IllegalArgumentException(String.format("Pixel pitch must be positive and finite, got %f", pixelPitch));
    }

    int pixelCount = (int) Math.floor((maxX - minX) / pixelPitch + GRID_TOLERANCE) + 1;
    double[] xAxis = new double[pixelCount];
    for (int p = 0; p < pixelCount; p++) {
      xAxis[p] = minX + p * pixelPitch;
    }
    LOGGER.info("Gridding %d scans onto %d lines x %d pixels (pitch %.3f um) x %d mass channels",
        x.length, lines.size(), pixelCount, pixelPitch, mzAxis.length);

    double[][][] img = new double[lines.size()][pixelCount][mzAxis.length];
    List<Integer> degenerate = new ArrayList<>();
    for (int l = 0; l < lines.size(); l++) {
      double line = lines.get(l);
      List<Integer> scans = new ArrayList<>();
      for (int i = 0; i < x.length; i++) {
        if (y[i] == line && x[i] > minX + EDGE_GUARD && x[i] < maxX - EDGE_GUARD) {
          scans.add(i);
        }
      }

      if (!interpolateLine(x, intensities, scans, xAxis, img[l])) {
        LOGGER.warn("Line %d (y = %.3f) has %d usable scans, too few to interpolate; filling it with zeros",
            l, line, scans.size());
        degenerate.add(l);
      }
    }

    double[] yAxis = new double[lines.size()];
    for (int l = 0; l < yAxis.length; l++) {
      yAxis[l] = lines.get(l);
    }
    return new ImageCube(img, xAxis, yAxis, mzAxis, degenerate);
  }

  /**
   * Derives the pitch that gives each line as many pixels as the median line has scans.
   */
  double medianPitch(double[] y, List<Double> lines, double xRange) {
    if (lines.isEmpty()) {
      throw new IllegalArgumentException("No lines to grid; cannot derive a pixel pitch");
    }
    double[] scansPerLine = new double[lines.size()];
    for (int l = 0; l < lines.size(); l++) {
      double line = lines.get(l);
      for (double v : y) {
        if (v == line) {
          scansPerLine[l]++;
        }
      }
    }
    double median = new Median().evaluate(scansPerLine);
    if (median < 2.0) {
      throw new IllegalArgumentException(String.format(
          "Median of %.1f scans per line is too few to derive a pixel pitch; specify one explicitly", median));
    }
    return xRange / (median - 1.0);
  }

  /**
   * Fills one line of the image from the given scans.
   * @return False if there were fewer than two distinct x positions to interpolate between (the line stays zero).
   */
  private boolean interpolateLine(double[] x, double[][] intensities, List<Integer> scans,
                                  double[] xAxis, double[][] out) {
    scans.sort(Comparator.comparingDouble(i -> x[i]));

    // Collapse scans that share an x position into their mean so the knots are strictly increasing.
    List<Double> knots = new ArrayList<>();
    List<double[]> values = new ArrayList<>();
    int s = 0;
    while (s < scans.size()) {
      double knot = x[scans.get(s)];
      double[] sum = Arrays.copyOf(intensities[scans.get(s)], intensities[scans.get(s)].length);
      int n = 1;
      s++;
      while (s < scans.size() && x[scans.get(s)] == knot) {
        double[] row = intensities[scans.get(s)];
        for (int c = 0; c < sum.length; c++) {
          sum[c] += row[c];
        }
        n++;
        s++;
      }
      if (n > 1) {
        for (int c = 0; c < sum.length; c++) {
          sum[c] /= n;
        }
      }
      knots.add(knot);
      values.add(sum);
    }

    if (knots.size() < 2) {
      return false;
    }

    double[] k = new double[knots.size()];
    double[] knotIndex = new double[knots.size()];
    for (int i = 0; i < k.length; i++) {
      k[i] = knots.get(i);
      knotIndex[i] = i;
    }
    // Maps x to a fractional knot index: its integer part picks the segment, its fraction is the weight.  The
    // weights depend only on x, so one lookup serves every mass channel.
    PolynomialSplineFunction segmentOf = new LinearInterpolator().interpolate(k, knotIndex);

    for (int p = 0; p < xAxis.length; p++) {
      double px = xAxis[p];
      if (!segmentOf.isValidPoint(px)) {
        continue;
      }
      double position = segmentOf.value(px);
      int left = Math.min((int) Math.floor(position), k.length - 2);
      double w = position - left;
      double[] a = values.get(left);
      double[] b = values.get(left + 1);
      for (int c = 0; c < out[p].length; c++) {
        out[p][c] = a[c] + w * (b[c] - a[c]);
      }
    }
    return true;
  }
}
