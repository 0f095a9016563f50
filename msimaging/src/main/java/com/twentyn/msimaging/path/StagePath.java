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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.TreeSet;

/**
 * The planned route of the sample stage, flattened into one chronological sequence of waypoints.
 *
 * The stage follows a "comb" pattern: each line of the pattern is a sweep to one turnaround point and back at a fixed
 * y-offset, after which the stage steps to the next y-offset.  Every waypoint carries its (x, y) position in
 * micrometers and the cumulative time in seconds at which the stage is expected to reach it.
 *
 * The arrays are copied on the way in and out, but their lengths are not checked; use {@link #checkLengths()} before
 * relying on them being parallel.
 */
public class StagePath {
  private final double[] x;
  private final double[] y;
  private final double[] times;
  private final List<Double> lines;

  public StagePath(double[] x, double[] y, double[] times) {
    this.x = x.clone();
    this.y = y.clone();
    this.times = times.clone();

    TreeSet<Double> distinctY = new TreeSet<>();
    for (double v : y) {
      distinctY.add(v);
    }
    this.lines = Collections.unmodifiableList(new ArrayList<>(distinctY));
  }

  public double[] getX() {
    return x.clone();
  }

  public double[] getY() {
    return y.clone();
  }

  /**
   * Gets the cumulative arrival time at each waypoint.
   * @return Arrival times in seconds, measured from the moment the stage starts moving.
   */
  public double[] getTimes() {
    return times.clone();
  }

  /**
   * Gets the y-offset of every line in the path.
   * @return The distinct waypoint y-values in ascending order.
   */
  public List<Double> getLines() {
    return lines;
  }

  public int size() {
    return x.length;
  }

  /**
   * Verifies that positions and times describe the same number of waypoints.
   * @throws StagePathLengthMismatchException if the x, y and time arrays disagree in length.
   */
  public void checkLengths() {
    if (x.length != y.length || x.length != times.length) {
      throw new StagePathLengthMismatchException(x.length, y.length, times.length);
    }
  }
}
