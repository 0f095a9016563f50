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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * A reconstructed mass spectrometry image: one intensity per (line, pixel, mass channel), along with the stage
 * coordinates of every line and pixel and the m/z of every channel.
 */
public class ImageCube {
  @JsonProperty("intensities")
  private double[][][] intensities;

  @JsonProperty("x_axis")
  private double[] xAxis;

  @JsonProperty("y_axis")
  private double[] yAxis;

  @JsonProperty("mz_axis")
  private double[] mzAxis;

  @JsonProperty("degenerate_lines")
  private List<Integer> degenerateLines = new ArrayList<>();

  // For deserialization.
  protected ImageCube() {

  }

  public ImageCube(double[][][] intensities, double[] xAxis, double[] yAxis, double[] mzAxis,
                   List<Integer> degenerateLines) {
    this.intensities = intensities;
    this.xAxis = xAxis;
    this.yAxis = yAxis;
    this.mzAxis = mzAxis;
    this.degenerateLines = degenerateLines;
  }

  /**
   * @return Intensities indexed [line][pixel][mass channel].
   */
  public double[][][] getIntensities() {
    return intensities;
  }

  /**
   * @return The stage x-coordinate of each pixel, in micrometers.
   */
  @JsonProperty("x_axis")
  public double[] getXAxis() {
    return xAxis;
  }

  /**
   * @return The stage y-coordinate of each line, in micrometers.
   */
  @JsonProperty("y_axis")
  public double[] getYAxis() {
    return yAxis;
  }

  /**
   * @return The m/z of each mass channel.
   */
  @JsonProperty("mz_axis")
  public double[] getMzAxis() {
    return mzAxis;
  }

  /**
   * Lines with fewer than two usable scans cannot be interpolated and are left as zeros.
   * @return Indices (into {@link #getYAxis()}) of such lines.
   */
  public List<Integer> getDegenerateLines() {
    return degenerateLines;
  }

  @JsonIgnore
  public int getLineCount() {
    return yAxis.length;
  }

  @JsonIgnore
  public int getPixelCount() {
    return xAxis.length;
  }

  @JsonIgnore
  public int getChannelCount() {
    return mzAxis.length;
  }

  public double getIntensity(int line, int pixel, int channel) {
    return intensities[line][pixel][channel];
  }
}
