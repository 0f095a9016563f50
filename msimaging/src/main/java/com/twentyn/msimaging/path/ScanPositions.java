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

import java.util.List;

/**
 * Estimated stage positions for every scan of a spectrum series, parallel to the series' scan order.  Scans acquired
 * before the stage started or after it finished its path have NaN coordinates.
 */
public class ScanPositions {
  private final double[] x;
  private final double[] y;
  private final List<Double> lines;
  private final int scansBeyondPath;

  public ScanPositions(double[] x, double[] y, List<Double> lines, int scansBeyondPath) {
    this.x = x.clone();
    this.y = y.clone();
    this.lines = lines;
    this.scansBeyondPath = scansBeyondPath;
  }

  public double[] getX() {
    return x.clone();
  }

  public double[] getY() {
    return y.clone();
  }

  /**
   * Gets the path lines that were actually visited while scans were being acquired.
   * @return Line y-offsets in ascending order.
   */
  public List<Double> getLines() {
    return lines;
  }

  /**
   * Gets the number of scans acquired after the stage reached the end of its path.
   * @return The count of scans whose (offset-adjusted) time exceeds the path's final waypoint time.
   */
  public int getScansBeyondPath() {
    return scansBeyondPath;
  }

  public boolean hasPosition(int scan) {
    return !Double.isNaN(x[scan]) && !Double.isNaN(y[scan]);
  }

  public int size() {
    return x.length;
  }
}
