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

import java.util.List;

/**
 * One mass spectrometer scan: the time at which it was acquired and its {mass/charge, intensity} pairs.
 *
 * This object is usually constructed from mzML exported by the instrument software.
 */
public class MassSpectrum {
  private Integer index;
  private Double timeVal;
  private List<Pair<Double, Double>> intensities;
  private boolean centroided;

  public MassSpectrum(Integer index, Double timeVal, List<Pair<Double, Double>> intensities, boolean centroided) {
    this.index = index;
    this.timeVal = timeVal;
    this.intensities = intensities;
    this.centroided = centroided;
  }

  /**
   * Gets the index of this scan in its input file.  MS2 and other non-imaging scans are skipped when reading, so this
   * need not match the scan's position in a {@link SpectrumSeries}.
   * @return The index of this spectrum in the input file.
   */
  public Integer getIndex() {
    return index;
  }

  /**
   * Gets the acquisition time of this scan.
   * @return Seconds since the mass spectrometer started recording.
   */
  public Double getTimeVal() {
    return timeVal;
  }

  /**
   * Gets the {mass/charge, intensity} pairs of this scan.  For profile spectra these sample the instrument's m/z
   * range densely; for centroided spectra they are the picked peaks only, and their m/z values differ from scan to
   * scan.
   * @return A list of {mass/charge, intensity} pairs in ascending m/z order.
   */
  public List<Pair<Double, Double>> getIntensities() {
    return intensities;
  }

  /**
   * @return True if the instrument software reported this scan as peak-picked.
   */
  public boolean isCentroided() {
    return centroided;
  }
}
