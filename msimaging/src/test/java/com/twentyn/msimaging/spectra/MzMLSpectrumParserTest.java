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

import org.apache.commons.io.FileUtils;
import org.apache.commons.lang3.tuple.Pair;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Base64;
import java.util.Iterator;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class MzMLSpectrumParserTest {
  public static final double FP_TOLERANCE = 0.000001;

  @Rule
  public TemporaryFolder tempFolder = new TemporaryFolder();

  private File writeFixture() throws Exception {
    File mzml = tempFolder.newFile("run.mzML");
    MzMLTestFiles.write(mzml, Arrays.asList(
        new MzMLTestFiles.Entry(0, 1.5, new double[]{100.0, 200.25, 300.125}, new double[]{10.0, 20.0, 30.0}),
        new MzMLTestFiles.Entry(1, 1.6, new double[]{150.0}, new double[]{99.0}).asMSn(),
        new MzMLTestFiles.Entry(2, 0.5, new double[]{100.5, 250.75}, new double[]{2.25, 4.5})
            .inMinutes().float32().zlib().centroided()
    ));
    return mzml;
  }

  @Test
  public void testParseReadsOnlyMS1Spectra() throws Exception {
    List<MassSpectrum> spectra = new MzMLSpectrumParser().parse(writeFixture());

    assertEquals("The MSn spectrum is skipped", 2, spectra.size());
    assertEquals("First spectrum keeps its file index", Integer.valueOf(0), spectra.get(0).getIndex());
    assertEquals("Second spectrum keeps its file index", Integer.valueOf(2), spectra.get(1).getIndex());
  }

  @Test
  public void testUncompressed64BitArraysAreDecoded() throws Exception {
    MassSpectrum spectrum = new MzMLSpectrumParser().parse(writeFixture()).get(0);

    assertEquals("Time in seconds is kept as is", 1.5, spectrum.getTimeVal(), FP_TOLERANCE);
    assertFalse("Profile spectrum is not centroided", spectrum.isCentroided());
    List<Pair<Double, Double>> peaks = spectrum.getIntensities();
    assertEquals("All values are decoded", 3, peaks.size());
    assertEquals("M/z matches", 200.25, peaks.get(1).getLeft(), FP_TOLERANCE);
    assertEquals("Intensity matches", 20.0, peaks.get(1).getRight(), FP_TOLERANCE);
    assertEquals("Last m/z matches", 300.125, peaks.get(2).getLeft(), FP_TOLERANCE);
  }

  @Test
  public void testCompressed32BitArraysAndMinutesAreDecoded() throws Exception {
    MassSpectrum spectrum = new MzMLSpectrumParser().parse(writeFixture()).get(1);

    assertEquals("Time in minutes is converted to seconds", 30.0, spectrum.getTimeVal(), FP_TOLERANCE);
    assertTrue("Centroid flag is read", spectrum.isCentroided());
    List<Pair<Double, Double>> peaks = spectrum.getIntensities();
    assertEquals("All values are decoded", 2, peaks.size());
    assertEquals("M/z matches", 100.5, peaks.get(0).getLeft(), FP_TOLERANCE);
    assertEquals("Intensity matches", 2.25, peaks.get(0).getRight(), FP_TOLERANCE);
    assertEquals("M/z matches", 250.75, peaks.get(1).getLeft(), FP_TOLERANCE);
    assertEquals("Intensity matches", 4.5, peaks.get(1).getRight(), FP_TOLERANCE);
  }

  @Test
  public void testIteratorStreamsSpectraInFileOrder() throws Exception {
    Iterator<MassSpectrum> iter = new MzMLSpectrumParser().getIterator(writeFixture());
    List<Double> times = new ArrayList<>();
    while (iter.hasNext()) {
      times.add(iter.next().getTimeVal());
    }
    assertEquals("Times appear in file order", Arrays.asList(1.5, 30.0), times);
    assertFalse("Iterator stays exhausted", iter.hasNext());
  }

  @Test
  public void testMalformedDocumentFailsIteration() throws Exception {
    File mzml = tempFolder.newFile("broken.mzML");
    FileUtils.writeStringToFile(mzml,
        "<?xml version=\"1.0\" encoding=\"utf-8\"?>\n<mzML><run><spectrumList><spectrum index=\"0\">",
        StandardCharsets.UTF_8);
    try {
      new MzMLSpectrumParser().parse(mzml);
      fail("Expected a truncated document to fail");
    } catch (IllegalStateException e) {
      assertTrue("Message names the file", e.getMessage().contains(mzml.getPath()));
    }
  }

  @Test
  public void testIteratorIsExhaustedAfterAFailure() throws Exception {
    File mzml = tempFolder.newFile("truncated.mzML");
    FileUtils.writeStringToFile(mzml,
        "<?xml version=\"1.0\" encoding=\"utf-8\"?>\n<mzML><run><spectrumList><spectrum index=\"0\">",
        StandardCharsets.UTF_8);
    Iterator<MassSpectrum> iter = new MzMLSpectrumParser().getIterator(mzml);
    try {
      iter.hasNext();
      fail("Expected a truncated document to fail");
    } catch (IllegalStateException e) {
      assertTrue("Cause is kept", e.getCause() != null);
    }
    assertFalse("The file is released and nothing more is read", iter.hasNext());
  }

  @Test
  public void testToDoubleListHonorsWidth() throws Exception {
    byte[] doubles = Base64.getDecoder().decode(
        MzMLTestFiles.encode(new double[]{1.0, -2.5}, false, false));
    byte[] floats = Base64.getDecoder().decode(
        MzMLTestFiles.encode(new double[]{1.0, -2.5}, true, false));

    assertEquals("64-bit values decode", Arrays.asList(1.0, -2.5), MzMLSpectrumParser.toDoubleList(doubles, false));
    assertEquals("32-bit values decode", Arrays.asList(1.0, -2.5), MzMLSpectrumParser.toDoubleList(floats, true));
  }
}
