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

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the stage controller's waypoint and timing files and flattens them into a {@link StagePath}.
 *
 * The waypoint file has six tab-delimited numbers per row, three (y, x) pairs in micrometers:
 * <pre>
 *   y_i  x_i  y_i+1  x_i+1  y_i+2  x_i+2
 * </pre>
 * where y_i = y_i+1 = y_i+2, x_i = x_i+2 is one turnaround point and x_i+1 the opposite one, e.g.:
 * <pre>
 *   6713.840  62190.250  6713.840  53190.250  6713.840  62191.250
 *   6513.840  62191.250  6513.840  53191.250  6513.840  62192.012
 * </pre>
 *
 * The timing file has three tab-delimited numbers per row: the time in milliseconds it took the stage to reach each
 * of the row's waypoints from the previous one, e.g.:
 * <pre>
 *   1512.000  60193.000  60206.000
 *   1513.000  60201.000  60199.000
 * </pre>
 */
public class StagePathParser {
  private static final Logger LOGGER = LogManager.getFormatterLogger(StagePathParser.class);

  public static final int WAYPOINT_COLUMNS = 6;
  public static final int TIMING_COLUMNS = 3;
  public static final double MILLISECONDS_PER_SECOND = 1000.0;

  public static final CSVFormat PATH_FILE_FORMAT = CSVFormat.newFormat('\t').
      withRecordSeparator('\n').withIgnoreEmptyLines(true).withIgnoreSurroundingSpaces(true);

  public StagePath parse(File waypointFile, File timingFile) throws IOException {
    List<double[]> waypointRows = readRows(waypointFile, WAYPOINT_COLUMNS);
    List<double[]> timingRows = readRows(timingFile, TIMING_COLUMNS);

    int waypointCount = waypointRows.size() * (WAYPOINT_COLUMNS / 2);
    double[] x = new double[waypointCount];
    double[] y = new double[waypointCount];
    int w = 0;
    for (double[] row : waypointRows) {
      for (int c = 0; c < WAYPOINT_COLUMNS; c += 2) {
        y[w] = row[c];
        x[w] = row[c + 1];
        w++;
      }
    }

    double[] times = new double[timingRows.size() * TIMING_COLUMNS];
    double elapsed = 0.0;
    int t = 0;
    for (int r = 0; r < timingRows.size(); r++) {
      for (double legMillis : timingRows.get(r)) {
        // Zero-length legs would give two waypoints the same arrival time, which interpolation cannot resolve.
        if (t > 0 && !(legMillis > 0.0)) {
          throw new StagePathFormatException(timingFile, String.format(
              "row %d: leg times after the first waypoint must be positive, found %f ms", r + 1, legMillis));
        }
        elapsed += legMillis / MILLISECONDS_PER_SECOND;
        times[t++] = elapsed;
      }
    }

    LOGGER.info("Read %d waypoints from %s and %d waypoint times from %s (%.3f s total)",
        waypointCount, waypointFile.getPath(), times.length, timingFile.getPath(), elapsed);

    return new StagePath(x, y, times);
  }

  private List<double[]> readRows(File file, int expectedColumns) throws IOException {
    List<double[]> rows = new ArrayList<>();
    try (CSVParser parser = new CSVParser(
        new InputStreamReader(new FileInputStream(file), StandardCharsets.UTF_8), PATH_FILE_FORMAT)) {
      for (CSVRecord record : parser) {
        if (record.size() != expectedColumns) {
          throw new StagePathFormatException(file, String.format(
              "row %d has %d columns, expected exactly %d", record.getRecordNumber(), record.size(), expectedColumns));
        }

        double[] row = new double[expectedColumns];
        for (int c = 0; c < expectedColumns; c++) {
          try {
            row[c] = Double.parseDouble(record.get(c));
          } catch (NumberFormatException e) {
            throw new StagePathFormatException(file, String.format(
                "row %d, column %d is not a number: '%s'", record.getRecordNumber(), c + 1, record.get(c)), e);
          }
        }
        rows.add(row);
      }
    }
    return rows;
  }
}
