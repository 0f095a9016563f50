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

package com.twentyn.msimaging.spectra;

import org.apache.commons.lang3.tuple.Pair;
import org.apache.commons.math3.util.MathArrays;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;

/**
 * Converts centroided scans into dense spectra over one shared, logarithmically spaced mass axis.
 *
 * Adjacent axis entries differ by a factor of (N+1)/N, so the spacing tracks the roughly constant relative mass
 * resolution of the instrument.  Each centroid is dropped into its nearest bin and then spread over its neighbours by
 * a normalized Gaussian window, which lets peaks whose centroids wander slightly from scan to scan line up.
 */
public class SpectrumRasterizer {
  private static final Logger LOGGER = LogManager.getFormatterLogger(SpectrumRasterizer.class);

  public static final int DEFAULT_RESOLUTION = 17000;
  public static final int DEFAULT_KERNEL_WIDTH = 11;
  // Same shape as MATLAB's gausswin default.
  public static final double GAUSSIAN_ALPHA = 2.5;

  private final int resolution;
  private final int kernelWidth;
  private final double logRatio;
  private final double[] window;

  public SpectrumRasterizer() {
    this(DEFAULT_RESOLUTION, DEFAULT_KERNEL_WIDTH);
  }

  /**
   * @param resolution N in the axis ratio (N+1)/N; larger values give finer bins.
   * @param kernelWidth Number of bins in the smoothing window; must be odd.
   */
  public SpectrumRasterizer(int resolution, int kernelWidth) {
    if (resolution < 1) {
      throw new IllegalArgumentException(String.format("Resolution must be positive, got %d", resolution));
    }
    if (kernelWidth < 1 || kernelWidth % 2 == 0) {
      throw new IllegalArgumentException(String.format("Kernel width must be a positive odd number, got %d",
          kernelWidth));
    }
    this.resolution = resolution;
    this.kernelWidth = kernelWidth;
    this.logRatio = Math.log((resolution + 1.0) / resolution);
    this.window = gaussianWindow(kernelWidth);
  }

  public int getResolution() {
    return resolution;
  }

  public int getKernelWidth() {
    return kernelWidth;
  }

  /**
   * Produces dense spectra for a series.  Profile series are passed through as they are.
   */
  public DenseSpectra rasterize(SpectrumSeries series) {
    if (!series.isCentroided()) {
      return new DenseSpectra(series.getMassAxis(), series.getProfileIntensities());
    }

    List<List<Pair<Double, Double>>> centroids = series.getCentroids();
    double minMZ = Double.POSITIVE_INFINITY, maxMZ = Double.NEGATIVE_INFINITY;
    for (int i = 0; i < centroids.size(); i++) {
      for (Pair<Double, Double> peak : centroids.get(i)) {
        double mz = peak.getLeft();
        // The axis is logarithmic, so every mass must lie strictly above zero.
        if (!(mz > 0.0) || Double.isInfinite(mz)) {
          throw new IllegalArgumentException(String.format(
              "Scan %d has a centroid at m/z %f; centroid masses must be positive and finite", i, mz));
        }
        minMZ = Math.min(minMZ, mz);
        maxMZ = Math.max(maxMZ, mz);
      }
    }
    if (minMZ > maxMZ) {
      throw new IllegalArgumentException("Centroid series contains no peaks; cannot derive a mass axis");
    }

    double[] binAxis = buildMassAxis(minMZ, maxMZ);
    LOGGER.info("Binning %d centroided scans into %d m/z bins between %.4f and %.4f",
        centroids.size(), binAxis.length, minMZ, maxMZ);
    double[][] binned = binCentroids(centroids, minMZ, binAxis.length);

    LOGGER.info("Smoothing peaks with a %d bin Gaussian window", kernelWidth);
    double[][] smoothed = new double[binned.length][];
    for (int i = 0; i < binned.length; i++) {
      smoothed[i] = smooth(binned[i]);
    }

    return new DenseSpectra(padMassAxis(minMZ, binAxis.length), smoothed);
  }

  /**
   * Builds the logarithmic axis covering [minMZ, maxMZ].
   * @return minMZ * ((N+1)/N)^k for k = 0 .. ceil(ln(maxMZ/minMZ) / ln((N+1)/N)).
   */
  public double[] buildMassAxis(double minMZ, double maxMZ) {
    int length = (int) Math.ceil(Math.log(maxMZ / minMZ) / logRatio) + 1;
    double[] axis = new double[length];
    for (int k = 0; k < length; k++) {
      axis[k] = minMZ * Math.exp(k * logRatio);
    }
    return axis;
  }

  /**
   * Builds the axis matching {@link #smooth(double[])} output: the unpadded axis extended by kernelWidth - 1 bins on
   * each side.
   */
  public double[] padMassAxis(double minMZ, int unpaddedLength) {
    int pad = kernelWidth - 1;
    double[] axis = new double[unpaddedLength + 2 * pad];
    for (int j = 0; j < axis.length; j++) {
      axis[j] = minMZ * Math.exp((j - pad) * logRatio);
    }
    return axis;
  }

  /**
   * Finds the bin nearest to a mass on the axis starting at minMZ.
   */
  public int massToBin(double mz, double minMZ) {
    return (int) Math.round(Math.log(mz / minMZ) / logRatio);
  }

  /**
   * Snaps every centroid to its nearest bin.  Peaks of one scan that land in the same bin are summed; scans never mix.
   * @return One row per scan of axisLength bins.
   */
  public double[][] binCentroids(List<List<Pair<Double, Double>>> centroids, double minMZ, int axisLength) {
    double[][] binned = new double[centroids.size()][axisLength];
    for (int i = 0; i < centroids.size(); i++) {
      for (Pair<Double, Double> peak : centroids.get(i)) {
        binned[i][massToBin(peak.getLeft(), minMZ)] += peak.getRight();
      }
    }
    return binned;
  }

  /**
   * Zero-pads a binned scan by kernelWidth - 1 bins on each side and convolves it with the centred Gaussian window.
   * The window sums to one, so total intensity is preserved.
   */
  public double[] smooth(double[] binned) {
    int pad = kernelWidth - 1;
    double[] out = new double[binned.length + 2 * pad];
    // The full convolution is kernelWidth - 1 bins longer than its input; centring it leaves half that on each side.
    double[] convolved = MathArrays.convolve(binned, window);
    System.arraycopy(convolved, 0, out, kernelWidth / 2, convolved.length);
    return out;
  }

  /**
   * Computes a Gaussian window of the given width, normalized to sum to one.
   */
  public static double[] gaussianWindow(int width) {
    double[] w = new double[width];
    if (width == 1) {
      w[0] = 1.0;
      return w;
    }
    double halfSpan = (width - 1) / 2.0;
    double sum = 0.0;
    for (int i = 0; i < width; i++) {
      double n = (i - halfSpan) / halfSpan;
      w[i] = Math.exp(-0.5 * Math.pow(GAUSSIAN_ALPHA * n, 2));
      sum += w[i];
    }
    for (int i = 0; i < width; i++) {
      w[i] /= sum;
    }
    return w;
  }
}
