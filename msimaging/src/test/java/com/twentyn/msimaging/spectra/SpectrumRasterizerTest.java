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
import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class SpectrumRasterizerTest {
  public static final double FP_TOLERANCE = 0.000001;

  private SpectrumRasterizer rasterizer;

  @Before
  public void setUp() throws Exception {
    rasterizer = new SpectrumRasterizer();
  }

  private static double sum(double[] values) {
    double s = 0.0;
    for (double v : values) {
      s += v;
    }
    return s;
  }

  @Test
  public void testMassAxisIsGeometricAndCoversTheRange() throws Exception {
    double[] axis = rasterizer.buildMassAxis(100.0, 200.0);
    double ratio = 17001.0 / 17000.0;

    assertEquals("Axis starts at the smallest mass", 100.0, axis[0], FP_TOLERANCE);
    assertTrue("Axis reaches the largest mass", axis[axis.length - 1] >= 200.0 - FP_TOLERANCE);
    assertTrue("Axis does not overshoot by a full bin", axis[axis.length - 2] < 200.0);
    assertEquals("Axis length follows from the ratio",
        (int) Math.ceil(Math.log(2.0) / Math.log(ratio)) + 1, axis.length);
    for (int k = 1; k < axis.length; k++) {
      assertTrue("Axis is strictly increasing", axis[k] > axis[k - 1]);
      assertEquals("Adjacent entries differ by (N+1)/N", ratio, axis[k] / axis[k - 1], 1e-12);
    }
  }

  @Test
  public void testSingleMassGivesOneBinAxis() throws Exception {
    assertEquals("A single mass needs a single bin", 1, rasterizer.buildMassAxis(500.0, 500.0).length);
  }

  @Test
  public void testBinningSnapsToNearestBin() throws Exception {
    double[] axis = rasterizer.buildMassAxis(100.0, 110.0);
    for (int k : new int[]{0, 1, 17, axis.length - 1}) {
      assertEquals("An axis mass maps to its own bin", k, rasterizer.massToBin(axis[k], 100.0));
    }
    double justAbove = axis[17] + (axis[18] - axis[17]) * 0.4;
    double justBelow = axis[17] + (axis[18] - axis[17]) * 0.6;
    assertEquals("Mass below the midpoint snaps down", 17, rasterizer.massToBin(justAbove, 100.0));
    assertEquals("Mass above the midpoint snaps up", 18, rasterizer.massToBin(justBelow, 100.0));
  }

  @Test
  public void testBinningConservesIntensityAndSumsCollisions() throws Exception {
    List<List<Pair<Double, Double>>> centroids = Arrays.asList(
        Arrays.asList(Pair.of(100.0, 2.0), Pair.of(100.0001, 3.0), Pair.of(150.0, 5.0)),
        Collections.singletonList(Pair.of(120.0, 7.0))
    );
    double[] axis = rasterizer.buildMassAxis(100.0, 150.0);
    double[][] binned = rasterizer.binCentroids(centroids, 100.0, axis.length);

    assertEquals("One row per scan", 2, binned.length);
    assertEquals("Peaks sharing a bin are summed", 5.0, binned[0][0], FP_TOLERANCE);
    assertEquals("First scan's intensity is conserved", 10.0, sum(binned[0]), FP_TOLERANCE);
    assertEquals("Second scan's intensity is conserved", 7.0, sum(binned[1]), FP_TOLERANCE);
    assertEquals("Scans never mix", 0.0, binned[1][0], FP_TOLERANCE);
  }

  @Test
  public void testGaussianWindowIsNormalizedAndSymmetric() throws Exception {
    double[] w = SpectrumRasterizer.gaussianWindow(11);

    assertEquals("Window has the requested width", 11, w.length);
    assertEquals("Window sums to one", 1.0, sum(w), 1e-12);
    for (int i = 0; i < w.length; i++) {
      assertEquals("Window is symmetric", w[i], w[w.length - 1 - i], 1e-15);
      assertTrue("Window peaks in the middle", w[i] <= w[5]);
    }
    assertEquals("Edge weight relative to centre matches alpha 2.5", Math.exp(-3.125), w[0] / w[5], 1e-12);
    assertEquals("Width one is the identity", 1.0, SpectrumRasterizer.gaussianWindow(1)[0], 0.0);
  }

  @Test
  public void testSmoothingIsCentredPaddedAndConservative() throws Exception {
    double[] binned = new double[5];
    binned[2] = 4.0;
    double[] smoothed = rasterizer.smooth(binned);

    int pad = SpectrumRasterizer.DEFAULT_KERNEL_WIDTH - 1;
    assertEquals("Output is padded on both sides", 5 + 2 * pad, smoothed.length);
    assertEquals("Intensity is conserved", 4.0, sum(smoothed), FP_TOLERANCE);
    int peak = 2 + pad;
    for (int i = 0; i < smoothed.length; i++) {
      assertTrue("Smoothed peak stays on its bin", smoothed[i] <= smoothed[peak]);
    }
    for (int d = 1; d <= SpectrumRasterizer.DEFAULT_KERNEL_WIDTH / 2; d++) {
      assertEquals("Spread is symmetric about the peak", smoothed[peak - d], smoothed[peak + d], 1e-12);
    }
  }

  @Test
  public void testRasterizeCentroidsOntoPaddedAxis() throws Exception {
    List<List<Pair<Double, Double>>> centroids = new ArrayList<>();
    centroids.add(Arrays.asList(Pair.of(100.0, 1.0), Pair.of(200.0, 2.0)));
    centroids.add(Collections.singletonList(Pair.of(150.0, 3.0)));
    SpectrumSeries series = SpectrumSeries.centroid(new double[]{0.0, 1.0}, centroids);

    DenseSpectra dense = rasterizer.rasterize(series);

    int pad = SpectrumRasterizer.DEFAULT_KERNEL_WIDTH - 1;
    int unpadded = rasterizer.buildMassAxis(100.0, 200.0).length;
    assertEquals("Axis is padded on both sides", unpadded + 2 * pad, dense.getChannelCount());
    assertEquals("One row per scan", 2, dense.getScanCount());
    assertEquals("Rows match the axis", dense.getChannelCount(), dense.getIntensities()[0].length);
    assertEquals("Axis entry after the padding is the smallest mass", 100.0, dense.getMassAxis()[pad], FP_TOLERANCE);
    assertEquals("First scan's intensity is conserved", 3.0, sum(dense.getIntensities()[0]), FP_TOLERANCE);
    assertEquals("Second scan's intensity is conserved", 3.0, sum(dense.getIntensities()[1]), FP_TOLERANCE);
  }

  @Test
  public void testRasterizePassesProfilesThrough() throws Exception {
    double[] axis = {100.0, 100.5, 101.0};
    double[][] intensities = {{1.0, 2.0, 3.0}, {4.0, 5.0, 6.0}};
    DenseSpectra dense = rasterizer.rasterize(SpectrumSeries.profile(new double[]{0.0, 1.0}, axis, intensities));

    assertArrayEquals("Profile axis is used as is", axis, dense.getMassAxis(), 0.0);
    assertSame("Profile intensities are used as is", intensities, dense.getIntensities());

    dense.getMassAxis()[0] = -1.0;
    axis[1] = -1.0;
    assertArrayEquals("The dense axis is a copy", new double[]{100.0, 100.5, 101.0}, dense.getMassAxis(), 0.0);
  }

  @Test
  public void testZeroMassIsRejectedWithItsScan() throws Exception {
    List<List<Pair<Double, Double>>> centroids = new ArrayList<>();
    centroids.add(Collections.singletonList(Pair.of(500.0, 1.0)));
    centroids.add(Arrays.asList(Pair.of(0.0, 5.0), Pair.of(500.0, 1.0)));
    try {
      rasterizer.rasterize(SpectrumSeries.centroid(new double[]{0.0, 1.0}, centroids));
      fail("Expected a centroid at m/z 0 to be rejected");
    } catch (IllegalArgumentException e) {
      assertTrue("Message names the scan", e.getMessage().startsWith("Scan 1 "));
    }
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNegativeMassIsRejected() throws Exception {
    List<List<Pair<Double, Double>>> centroids = new ArrayList<>();
    centroids.add(Arrays.asList(Pair.of(-1.0, 5.0), Pair.of(500.0, 1.0)));
    rasterizer.rasterize(SpectrumSeries.centroid(new double[]{0.0}, centroids));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNonFiniteMassIsRejected() throws Exception {
    List<List<Pair<Double, Double>>> centroids = new ArrayList<>();
    centroids.add(Arrays.asList(Pair.of(500.0, 1.0), Pair.of(Double.POSITIVE_INFINITY, 5.0)));
    rasterizer.rasterize(SpectrumSeries.centroid(new double[]{0.0}, centroids));
  }

  @Test
  public void testSmoothingMatchesTheWindowAroundEachPeak() throws Exception {
    double[] binned = {0.0, 3.0, 0.0, 0.0, 0.0, 0.0, 0.0, 0.0, 2.0, 0.0};
    double[] window = SpectrumRasterizer.gaussianWindow(SpectrumRasterizer.DEFAULT_KERNEL_WIDTH);
    double[] smoothed = rasterizer.smooth(binned);

    int pad = SpectrumRasterizer.DEFAULT_KERNEL_WIDTH - 1;
    int half = SpectrumRasterizer.DEFAULT_KERNEL_WIDTH / 2;
    for (int j = 0; j < smoothed.length; j++) {
      double expected = 0.0;
      for (int k = 0; k < binned.length; k++) {
        int w = j - (k + pad) + half;
        if (w >= 0 && w < window.length) {
          expected += binned[k] * window[w];
        }
      }
      assertEquals(String.format("Smoothed bin %d is the windowed sum of its neighbours", j),
          expected, smoothed[j], 1e-12);
    }
  }

  @Test(expected = IllegalArgumentException.class)
  public void testEmptyCentroidSeriesIsRejected() throws Exception {
    List<List<Pair<Double, Double>>> centroids = new ArrayList<>();
    centroids.add(new ArrayList<>());
    rasterizer.rasterize(SpectrumSeries.centroid(new double[]{0.0}, centroids));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testEvenKernelWidthIsRejected() throws Exception {
    new SpectrumRasterizer(17000, 10);
  }
}
