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

import org.apache.commons.io.input.ReaderInputStream;
import org.apache.commons.lang3.tuple.Pair;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.w3c.dom.Document;
import org.w3c.dom.Node;
import org.xml.sax.SAXException;

import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.stream.XMLEventReader;
import javax.xml.stream.XMLEventWriter;
import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLOutputFactory;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.events.XMLEvent;
import javax.xml.xpath.XPath;
import javax.xml.xpath.XPathConstants;
import javax.xml.xpath.XPathException;
import javax.xml.xpath.XPathFactory;
import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.StringReader;
import java.io.StringWriter;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.zip.DataFormatException;
import java.util.zip.Inflater;

/**
 * Reads the MS1 scans of an mzML file into {@link MassSpectrum} objects.
 *
 * mzML files exported from imaging runs can be very large, so the file is streamed: each {@code <spectrum>} element is
 * cut out of the event stream, re-read as its own small document and picked apart with XPath.  Things to be aware of:
 * <ul>
 *   <li>
 *     Only spectra carrying the "MS1 spectrum" term are returned; MSn and other scan kinds are skipped silently.
 *   </li>
 *   <li>
 *     The m/z and intensity arrays are base64-encoded little-endian IEEE 754 numbers, 32 or 64 bits wide, optionally
 *     zlib-compressed, as declared by each binaryDataArray's cvParams.
 *   </li>
 *   <li>
 *     Scan start times given in minutes are converted to seconds.
 *   </li>
 * </ul>
 */
public class MzMLSpectrumParser {
  private static final Logger LOGGER = LogManager.getFormatterLogger(MzMLSpectrumParser.class);

  public static final String SPECTRUM_OBJECT_TAG = "spectrum";
  public static final String XML_PREAMBLE = "<?xml version=\"1.0\" encoding=\"utf-8\"?>";

  public static final String SPECTRUM_PATH_INDEX = "/spectrum/@index";
  public static final String SPECTRUM_PATH_MS1 = "/spectrum/cvParam[@name='MS1 spectrum']";
  public static final String SPECTRUM_PATH_CENTROID = "/spectrum/cvParam[@name='centroid spectrum']";
  public static final String SPECTRUM_PATH_SCAN_START_TIME =
      "/spectrum/scanList/scan/cvParam[@name='scan start time']/@value";
  public static final String SPECTRUM_PATH_SCAN_START_TIME_UNIT =
      "/spectrum/scanList/scan/cvParam[@name='scan start time']/@unitName";
  public static final String SPECTRUM_PATH_MZ_ARRAY =
      "/spectrum/binaryDataArrayList/binaryDataArray[./cvParam/@name='m/z array']";
  public static final String SPECTRUM_PATH_INTENSITY_ARRAY =
      "/spectrum/binaryDataArrayList/binaryDataArray[./cvParam/@name='intensity array']";
  public static final String ARRAY_PATH_BINARY = "binary/text()";
  public static final String ARRAY_PATH_FLOAT32 = "cvParam[@name='32-bit float']";
  public static final String ARRAY_PATH_ZLIB = "cvParam[@name='zlib compression']";

  public static final String TIME_UNIT_MINUTE = "minute";
  public static final String TIME_UNIT_SECOND = "second";
  public static final double SECONDS_PER_MINUTE = 60.0;

  // XPathFactory is not thread-safe.
  private static final ThreadLocal<XPathFactory> XPATH_FACTORY = ThreadLocal.withInitial(XPathFactory::newInstance);

  /**
   * Builds a non-validating, DTD-ignoring DocumentBuilderFactory.  Namespace processing is switched off so that
   * unprefixed XPath expressions match elements of the default mzML namespace.
   */
  public static DocumentBuilderFactory mkDocBuilderFactory() throws ParserConfigurationException {
    DocumentBuilderFactory docFactory = DocumentBuilderFactory.newInstance();
    docFactory.setValidating(false);
    docFactory.setNamespaceAware(true);
    docFactory.setFeature("http://xml.org/sax/features/namespaces", false);
    docFactory.setFeature("http://xml.org/sax/features/validation", false);
    docFactory.setFeature("http://apache.org/xml/features/nonvalidating/load-dtd-grammar", false);
    docFactory.setFeature("http://apache.org/xml/features/nonvalidating/load-external-dtd", false);
    return docFactory;
  }

  public List<MassSpectrum> parse(File inputFile) throws ParserConfigurationException, IOException, XMLStreamException {
    List<MassSpectrum> spectra = new ArrayList<>();
    Iterator<MassSpectrum> iter = getIterator(inputFile);
    while (iter.hasNext()) {
      spectra.add(iter.next());
    }
    LOGGER.info("Read %d MS1 spectra from %s", spectra.size(), inputFile.getPath());
    return spectra;
  }

  public Iterator<MassSpectrum> getIterator(File inputFile)
      throws ParserConfigurationException, IOException, XMLStreamException {
    final DocumentBuilder docBuilder = mkDocBuilderFactory().newDocumentBuilder();
    final XMLOutputFactory xmlOutputFactory = XMLOutputFactory.newInstance();
    final InputStream in = new FileInputStream(inputFile);
    final XMLEventReader reader;
    try {
      reader = XMLInputFactory.newInstance().createXMLEventReader(in, "utf-8");
    } catch (XMLStreamException e) {
      in.close();
      throw e;
    }

    return new Iterator<MassSpectrum>() {
      private XMLEventReader xr = reader;
      private MassSpectrum next = null;

      private MassSpectrum readNextSpectrum() throws XMLStreamException, IOException, XPathException,
          SAXException, DataFormatException {
        boolean inEntry = false;
        StringWriter w = null;
        XMLEventWriter xw = null;
        while (xr.hasNext()) {
          XMLEvent e = xr.nextEvent();
          if (!inEntry && e.isStartElement() &&
              e.asStartElement().getName().getLocalPart().equals(SPECTRUM_OBJECT_TAG)) {
            w = new StringWriter().append(XML_PREAMBLE).append("\n");
            xw = xmlOutputFactory.createXMLEventWriter(w);
            xw.add(e);
            inEntry = true;
          } else if (inEntry && e.isEndElement() &&
              e.asEndElement().getName().getLocalPart().equals(SPECTRUM_OBJECT_TAG)) {
            xw.add(e);
            xw.flush();
            xw.close();
            inEntry = false;
            Document doc = docBuilder.parse(
                new ReaderInputStream(new StringReader(w.toString()), StandardCharsets.UTF_8));
            MassSpectrum spectrum = handleSpectrumEntry(doc);
            // Keep going past spectra we don't image (MS2, UV traces, etc.).
            if (spectrum != null) {
              return spectrum;
            }
          } else if (inEntry) {
            xw.add(e);
          }
        }

        xr.close();
        in.close();
        xr = null;
        return null;
      }

      private MassSpectrum tryParseNext() {
        if (xr == null) {
          return null;
        }
        try {
          return readNextSpectrum();
        } catch (Exception e) {
          IllegalStateException failure = new IllegalStateException(
              String.format("Unable to read spectrum from %s: %s", inputFile.getPath(), e.getMessage()), e);
          release(failure);
          throw failure;
        }
      }

      // Closes the event reader and the file; the iterator is exhausted afterwards.
      private void release(Exception failure) {
        try {
          xr.close();
        } catch (XMLStreamException closeError) {
          failure.addSuppressed(closeError);
        }
        try {
          in.close();
        } catch (IOException closeError) {
          failure.addSuppressed(closeError);
        }
        xr = null;
      }

      @Override
      public boolean hasNext() {
        if (this.next == null) {
          this.next = tryParseNext();
        }
        return this.next != null;
      }

      @Override
      public MassSpectrum next() {
        if (!hasNext()) {
          throw new NoSuchElementException();
        }
        MassSpectrum res = this.next;
        this.next = null;
        return res;
      }
    };
  }

  protected MassSpectrum handleSpectrumEntry(Document doc) throws XPathException, DataFormatException {
    XPath xpath = XPATH_FACTORY.get().newXPath();

    Double spectrumIndexD = (Double) xpath.evaluate(SPECTRUM_PATH_INDEX, doc, XPathConstants.NUMBER);
    if (spectrumIndexD == null || spectrumIndexD.isNaN()) {
      LOGGER.warn("Found spectrum document without index attribute, skipping");
      return null;
    }
    Integer spectrumIndex = spectrumIndexD.intValue();

    if (xpath.evaluate(SPECTRUM_PATH_MS1, doc, XPathConstants.NODE) == null) {
      LOGGER.debug("Spectrum %d is not an MS1 spectrum, skipping", spectrumIndex);
      return null;
    }

    Double scanStartTime = (Double) xpath.evaluate(SPECTRUM_PATH_SCAN_START_TIME, doc, XPathConstants.NUMBER);
    if (scanStartTime == null || scanStartTime.isNaN()) {
      LOGGER.warn("No scan start time found for spectrum %d, skipping", spectrumIndex);
      return null;
    }
    String unit = (String) xpath.evaluate(SPECTRUM_PATH_SCAN_START_TIME_UNIT, doc, XPathConstants.STRING);
    if (TIME_UNIT_MINUTE.equals(unit)) {
      scanStartTime *= SECONDS_PER_MINUTE;
    } else if (!TIME_UNIT_SECOND.equals(unit)) {
      LOGGER.warn("Unexpected scan start time unit '%s' for spectrum %d, assuming seconds", unit, spectrumIndex);
    }

    Node mzArray = (Node) xpath.evaluate(SPECTRUM_PATH_MZ_ARRAY, doc, XPathConstants.NODE);
    Node intensityArray = (Node) xpath.evaluate(SPECTRUM_PATH_INTENSITY_ARRAY, doc, XPathConstants.NODE);
    if (mzArray == null || intensityArray == null) {
      LOGGER.warn("Spectrum %d is missing its m/z or intensity array, skipping", spectrumIndex);
      return null;
    }

    List<Double> mzs = decodeBinaryArray(xpath, mzArray);
    List<Double> intensities = decodeBinaryArray(xpath, intensityArray);
    if (mzs.size() != intensities.size()) {
      LOGGER.warn("Spectrum %d has %d m/z values but %d intensities, skipping",
          spectrumIndex, mzs.size(), intensities.size());
      return null;
    }

    List<Pair<Double, Double>> mzIntensityPairs = new ArrayList<>(mzs.size());
    for (int i = 0; i < mzs.size(); i++) {
      mzIntensityPairs.add(Pair.of(mzs.get(i), intensities.get(i)));
    }

    boolean centroided = xpath.evaluate(SPECTRUM_PATH_CENTROID, doc, XPathConstants.NODE) != null;
    return new MassSpectrum(spectrumIndex, scanStartTime, mzIntensityPairs, centroided);
  }

  private static List<Double> decodeBinaryArray(XPath xpath, Node arrayNode)
      throws XPathException, DataFormatException {
    String b64 = ((String) xpath.evaluate(ARRAY_PATH_BINARY, arrayNode, XPathConstants.STRING)).trim();
    boolean float32 = xpath.evaluate(ARRAY_PATH_FLOAT32, arrayNode, XPathConstants.NODE) != null;
    boolean zlib = xpath.evaluate(ARRAY_PATH_ZLIB, arrayNode, XPathConstants.NODE) != null;

    byte[] bytes = Base64.getDecoder().decode(b64);
    if (zlib) {
      bytes = inflate(bytes);
    }
    return toDoubleList(bytes, float32);
  }

  protected static List<Double> toDoubleList(byte[] bytes, boolean float32) {
    ByteBuffer buf = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
    int width = float32 ? Float.BYTES : Double.BYTES;
    List<Double> values = new ArrayList<>(bytes.length / width);
    while (buf.remaining() >= width) {
      values.add(float32 ? (double) buf.getFloat() : buf.getDouble());
    }
    return values;
  }

  protected static byte[] inflate(byte[] compressed) throws DataFormatException {
    Inflater inflater = new Inflater();
    inflater.setInput(compressed);
    ByteArrayOutputStream out = new ByteArrayOutputStream(compressed.length * 4);
    byte[] chunk = new byte[8192];
    try {
      while (!inflater.finished()) {
        int n = inflater.inflate(chunk);
        if (n == 0 && (inflater.needsInput() || inflater.needsDictionary())) {
          throw new DataFormatException("Truncated zlib stream in binary data array");
        }
        out.write(chunk, 0, n);
      }
    } finally {
      inflater.end();
    }
    return out.toByteArray();
  }
}
