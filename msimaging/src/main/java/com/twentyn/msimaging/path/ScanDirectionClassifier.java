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

/**
 * Labels each scan with the direction the stage was sweeping when it was acquired.
 *
 * A scan is part of a left-to-right sweep when its predecessor lies to its left, its successor lies to its right and
 * all three share the same y; right-to-left is the mirror image.  Everything else (the first and last scans,
 * turnarounds, steps between lines, scans without a position) is {@link ScanDirection#NONE}.
 */
public class ScanDirectionClassifier {

  public ScanDirection[] classify(double[] x, double[] y) {
    ScanDirection[] directions = new ScanDirection[x.length];
    for (int i = 0; i < x.length; i++) {
      directions[i] = ScanDirection.NONE;
    }

    for (int i = 1; i < x.length - 1; i++) {
      // NaN positions fail every comparison below and so stay unlabeled.
      double dxBefore = x[i] - x[i - 1];
      double dxAfter = x[i + 1] - x[i];
      boolean sameLine = y[i - 1] == y[i] && y[i] == y[i + 1];
      if (!sameLine) {
        continue;
      }

      if (dxBefore > 0 && dxAfter > 0) {
        directions[i] = ScanDirection.LEFT_TO_RIGHT;
      } else if (dxBefore < 0 && dxAfter < 0) {
        directions[i] = ScanDirection.RIGHT_TO_LEFT;
      }
    }

    return directions;
  }

  public ScanDirection[] classify(ScanPositions positions) {
    return classify(positions.getX(), positions.getY());
  }

  public static boolean isLeftToRight(ScanDirection[] directions, int scan) {
    return directions[scan] == ScanDirection.LEFT_TO_RIGHT;
  }

  public static boolean isRightToLeft(ScanDirection[] directions, int scan) {
    return directions[scan] == ScanDirection.RIGHT_TO_LEFT;
  }
}
