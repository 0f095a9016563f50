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

package com.twentyn.msimaging.path;

import org.apache.commons.math3.analysis.interpolation.LinearInterpolator;
import org.apache.commons.math3.analysis.polynomials.PolynomialSplineFunction;
import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * Estimates where the stage was when each spectrum was acquired by linearly interpolating the planned waypoints
 * against their arrival times.
 */
public class ScanPositionEstimator {
  private static final Logger LOGGER = LogManager.getFormatterLogger(ScanPositionEstimator.class);

  public ScanPositions estimate(double[] scanTimes, StagePath path) {
    return estimate(scanTimes, path, 0.0);
  }

  /**
   * Interpolates x and y independently at each scan time.
   * @param scanTimes Acquisition times in seconds since the mass spectrometer started.
   * @param path The stage path, with arrival times in seconds since the stage started.
   * @param clockOffset Seconds added to every scan time to express it on the stage's clock.
   * @return Per-scan positions (NaN outside the path's time span) and the lines those positions cover.
   */
  public ScanPositions estimate(double[] scanTimes, StagePath path, double clockOffset) {
    path.checkLengths();

    double[] times = path.getTimes();
    for (int w = 1; w < times.length; w++) {
      if (!(times[w] > times[w - 1])) {
        throw new IllegalArgumentException(String.format(
            "Stage path times must be strictly increasing: waypoint %d at %f s follows waypoint %d at %f s",
            w, times[w], w - 1, times[w - 1]));
      }
    }
    PolynomialSplineFunction xOfT;
    PolynomialSplineFunction yOfT;
    try {
      LinearInterpolator interpolator = new LinearInterpolator();
      xOfT = interpolator.interpolate(times, path.getX());
      yOfT = interpolator.interpolate(times, path.getY());
    } catch (MathIllegalArgumentException e) {
      throw new IllegalArgumentException(
          String.format("Stage path of %d waypoints cannot be interpolated: %s", times.length, e.getMessage()), e);
    }

    double endTime = times[times.length - 1];
    double[] x = new double[scanTimes.length];
    double[] y = new double[scanTimes.length];
    int beyondPath = 0;
    double minY = Double.POSITIVE_INFINITY, maxY = Double.NEGATIVE_INFINITY;
    for (int i = 0; i < scanTimes.length; i++) {
      double t = scanTimes[i] + clockOffset;
      if (t > endTime) {
        beyondPath++;
      }

      if (xOfT.isValidPoint(t)) {
        x[i] = xOfT.value(t);
        y[i] = yOfT.value(t);
        minY = Math.min(minY, y[i]);
        maxY = Math.max(maxY, y[i]);
      } else {
        x[i] = Double.NaN;
        y[i] = Double.NaN;
      }
    }

    if (beyondPath > 0) {
      LOGGER.warn("%d of %d MS scans exceed the stage path (ends at %.3f s); those scans will be ignored",
          beyondPath, scanTimes.length, endTime);
    }

    // Ignore lines the stage never reached while the instrument was recording.
    List<Double> lines = new ArrayList<>();
    for (Double line : path.getLines()) {
      if (line >= minY && line <= maxY) {
        lines.add(line);
      }
    }
    if (lines.size() < path.getLines().size()) {
      LOGGER.info("%d of %d path lines have no scans and were dropped",
          path.getLines().size() - lines.size(), path.getLines().size());
    }

    return new ScanPositions(x, y, lines, beyondPath);
  }
}
