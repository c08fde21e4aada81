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

package com.twentyn.peakfitting.io;

import org.apache.commons.io.FileUtils;
import org.apache.commons.io.FilenameUtils;
import org.apache.commons.io.IOCase;
import org.apache.commons.io.filefilter.FileFilterUtils;
import org.apache.commons.io.filefilter.IOFileFilter;
import org.apache.commons.lang3.StringUtils;

import java.io.File;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Lists the spectrum files of a folder, sorted by name.
 */
public class SpectrumDirectory {
  public static final List<String> DEFAULT_EXTENSIONS =
      Collections.unmodifiableList(Arrays.asList("xy", "dat", "txt", "chi"));

  private final List<String> extensions;

  public SpectrumDirectory() {
    this(DEFAULT_EXTENSIONS);
  }

  public SpectrumDirectory(List<String> extensions) {
    List<String> normalized = new ArrayList<>(extensions.size());
    for (String e : extensions) {
      normalized.add(StringUtils.removeStart(e, ".").toLowerCase(Locale.ROOT));
    }
    this.extensions = Collections.unmodifiableList(normalized);
  }

  public List<String> getExtensions() {
    return extensions;
  }

  /**
   * All files in the directory (not recursing) with any of the configured extensions.
   */
  public List<File> list(File directory) {
    if (!directory.isDirectory()) {
      throw new IllegalArgumentException(String.format("%s is not a directory", directory.getAbsolutePath()));
    }
    return sorted(FileUtils.listFiles(directory, extensionFilter(extensions), null));
  }

  /**
   * Files in the same directory as the given one that share its extension, for previous/next navigation.
   */
  public List<File> siblings(File file) {
    File directory = file.getAbsoluteFile().getParentFile();
    String extension = FilenameUtils.getExtension(file.getName()).toLowerCase(Locale.ROOT);
    return sorted(FileUtils.listFiles(directory, extensionFilter(Collections.singletonList(extension)), null));
  }

  private static IOFileFilter extensionFilter(List<String> extensions) {
    List<IOFileFilter> filters = new ArrayList<>();
    for (String e : extensions) {
      filters.add(FileFilterUtils.suffixFileFilter("." + e, IOCase.INSENSITIVE));
    }
    return FileFilterUtils.and(FileFilterUtils.fileFileFilter(),
        FileFilterUtils.or(filters.toArray(new IOFileFilter[0])));
  }

  private static List<File> sorted(Collection<File> files) {
    List<File> out = new ArrayList<>(files);
    out.sort((a, b) -> a.getName().compareTo(b.getName()));
    return out;
  }
}
