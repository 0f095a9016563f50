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
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The time-ordered scans of one imaging run, in one of two shapes:
 * <ul>
 *   <li>profile: every scan is a dense intensity vector over one shared mass axis;</li>
 *   <li>centroid: every scan is its own list of {mass/charge, intensity} peaks.</li>
 * </ul>
 */
public class SpectrumSeries {
  private static final Logger LOGGER = LogManager.getFormatterLogger(SpectrumSeries.class);

  private final double[] scanTimes;
  private final double[] massAxis;
  private final double[][] profileIntensities;
  private final List<List<Pair<Double, Double>>> centroids;

  private SpectrumSeries(double[] scanTimes, double[] massAxis, double[][] profileIntensities,
                         List<List<Pair<Double, Double>>> centroids) {
    this.scanTimes = scanTimes;
    this.massAxis = massAxis;
    this.profileIntensities = profileIntensities;
    this.centroids = centroids;
  }

  /**
   * Builds a profile series.
   * @param scanTimes Acquisition time of each scan, in seconds.
   * @param massAxis The m/z value of each channel, shared by all scans.
   * @param intensities One row per scan, one column per mass channel.
   */
  public static SpectrumSeries profile(double[] scanTimes, double[] massAxis, double[][] intensities) {
    if (intensities.length != scanTimes.length) {
      throw new IllegalArgumentException(String.format(
          "Profile series has %d scan times but %d intensity rows", scanTimes.length, intensities.length));
    }
    for (int i = 0; i < intensities.length; i++) {
      if (intensities[i].length != massAxis.length) {
        throw new IllegalArgumentException(String.format(
            "Scan %d has %d intensities but the mass axis has %d channels",
            i, intensities[i].length, massAxis.length));
      }
    }
    return new SpectrumSeries(scanTimes, massAxis, intensities, null);
  }

  /**
   * Builds a centroid series.
   * @param scanTimes Acquisition time of each scan, in seconds.
   * @param peaks One list of {mass/charge, intensity} peaks per scan.
   */
  public static SpectrumSeries centroid(double[] scanTimes, List<List<Pair<Double, Double>>> peaks) {
    if (peaks.size() != scanTimes.length) {
      throw new IllegalArgumentException(String.format(
          "Centroid series has %d scan times but %d peak lists", scanTimes.length, peaks.size()));
    }
    List<List<Pair<Double, Double>>> readOnly = new ArrayList<>(peaks.size());
    for (List<Pair<Double, Double>> scanPeaks : peaks) {
      readOnly.add(Collections.unmodifiableList(scanPeaks));
    }
    return new SpectrumSeries(scanTimes, null, null, Collections.unmodifiableList(readOnly));
  }

  /**
   * Assembles a series from individually read spectra.  The result is a profile series when every scan reports the
   * very same m/z values and none was flagged as centroided; otherwise each scan keeps its own peak list.
   * @param spectra Scans in acquisition order.
   */
  public static SpectrumSeries fromSpectra(List<MassSpectrum> spectra) {
    double[] times = new double[spectra.size()];
    List<List<Pair<Double, Double>>> peaks = new ArrayList<>(spectra.size());
    boolean sharedAxis = true;
    List<Pair<Double, Double>> first = spectra.isEmpty() ? null : spectra.get(0).getIntensities();
    for (int i = 0; i < spectra.size(); i++) {
      MassSpectrum spectrum = spectra.get(i);
      times[i] = spectrum.getTimeVal();
      peaks.add(spectrum.getIntensities());
      if (spectrum.isCentroided() || !sameMasses(first, spectrum.getIntensities())) {
        sharedAxis = false;
      }
    }

    if (!sharedAxis || first == null) {
      LOGGER.info("Treating %d scans as centroided spectra", spectra.size());
      return centroid(times, peaks);
    }

    LOGGER.info("Treating %d scans as profile spectra over %d m/z channels", spectra.size(), first.size());
    double[] massAxis = new double[first.size()];
    for (int c = 0; c < massAxis.length; c++) {
      massAxis[c] = first.get(c).getLeft();
    }
    double[][] intensities = new double[spectra.size()][massAxis.length];
    for (int i = 0; i < spectra.size(); i++) {
      List<Pair<Double, Double>> scan = peaks.get(i);
      for (int c = 0; c < massAxis.length; c++) {
        intensities[i][c] = scan.get(c).getRight();
      }
    }
    return profile(times, massAxis, intensities);
  }

  private static boolean sameMasses(List<Pair<Double, Double>> a, List<Pair<Double, Double>> b) {
    if (a.size() != b.size()) {
      return false;
    }
    for (int i = 0; i < a.size(); i++) {
      if (!a.get(i).getLeft().equals(b.get(i).getLeft())) {
        return false;
      }
    }
    return true;
  }

  public boolean isCentroided() {
    return centroids != null;
  }

  public int size() {
    return scanTimes.length;
  }

  public double[] getScanTimes() {
    return scanTimes;
  }

  /**
   * @return The shared m/z axis of a profile series; null for a centroid series.
   */
  public double[] getMassAxis() {
    return massAxis;
  }

  /**
   * @return The scans x channels intensity matrix of a profile series; null for a centroid series.
   */
  public double[][] getProfileIntensities() {
    return profileIntensities;
  }

  /**
   * @return The per-scan peak lists of a centroid series; null for a profile series.
   */
  public List<List<Pair<Double, Double>>> getCentroids() {
    return centroids;
  }
}
