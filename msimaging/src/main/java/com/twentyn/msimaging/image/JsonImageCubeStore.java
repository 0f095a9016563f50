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

import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.File;
import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.io.IOException;

/**
 * Stores each cube as a JSON document named cube-&lt;key&gt;.json in one directory.
 */
public class JsonImageCubeStore implements ImageCubeStore {
  private static final Logger LOGGER = LogManager.getFormatterLogger(JsonImageCubeStore.class);
  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

  public static final String CUBE_FILE_PREFIX = "cube";
  public static final String CUBE_FILE_EXTENSION = ".json";

  private final File directory;

  public JsonImageCubeStore(File directory) {
    this.directory = directory;
  }

  public File getCubeFile(String key) {
    return new File(directory, String.format("%s-%s%s", CUBE_FILE_PREFIX, key, CUBE_FILE_EXTENSION));
  }

  @Override
  public boolean contains(String key) {
    return getCubeFile(key).isFile();
  }

  @Override
  public ImageCube load(String key) throws IOException {
    File cubeFile = getCubeFile(key);
    LOGGER.info("Loading image cube from %s", cubeFile.getAbsolutePath());
    try (FileInputStream fis = new FileInputStream(cubeFile)) {
      return OBJECT_MAPPER.readValue(fis, ImageCube.class);
    }
  }

  @Override
  public void save(String key, ImageCube cube) throws IOException {
    if (!directory.isDirectory() && !directory.mkdirs()) {
      throw new IOException(String.format("Unable to create cube store directory %s", directory.getAbsolutePath()));
    }
    File cubeFile = getCubeFile(key);
    LOGGER.info("Writing %d x %d x %d image cube to %s",
        cube.getLineCount(), cube.getPixelCount(), cube.getChannelCount(), cubeFile.getAbsolutePath());
    try (FileOutputStream fos = new FileOutputStream(cubeFile)) {
      OBJECT_MAPPER.writeValue(fos, cube);
    }
  }
}
