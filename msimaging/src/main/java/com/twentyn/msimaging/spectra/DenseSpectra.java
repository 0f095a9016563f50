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

/**
 * Intensities of every scan sampled on one common mass axis.
 *
 * The mass axis is copied.  The intensity rows are shared with the caller and must not be modified afterwards.
 */
public class DenseSpectra {
  private final double[] massAxis;
  private final double[][] intensities;

  public DenseSpectra(double[] massAxis, double[][] intensities) {
    this.massAxis = massAxis.clone();
    this.intensities = intensities;
  }

  public double[] getMassAxis() {
    return massAxis.clone();
  }

  /**
   * @return One row per scan, one column per entry of {@link #getMassAxis()}.
   */
  public double[][] getIntensities() {
    return intensities;
  }

  public int getScanCount() {
    return intensities.length;
  }

  public int getChannelCount() {
    return massAxis.length;
  }
}
