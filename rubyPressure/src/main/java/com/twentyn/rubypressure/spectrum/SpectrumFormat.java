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

package com.twentyn.rubypressure.spectrum;

import java.util.ArrayList;
import java.util.List;

/**
 * Text layouts a spectrum file may have.  Both are two whitespace, comma or tab separated columns (wavelength,
 * intensity); they differ in how lines that are not two numbers are treated.
 */
public enum SpectrumFormat {
  /** Nothing but numeric rows; any other non-blank line is an error. */
  RAW_TXT("Raw txt", false),
  /** Spectrometer exports with header and footer lines; those are skipped. */
  METADATA_TXT("Metadata txt", true);

  private final String name;
  private final boolean skipUnparsableLines;

  SpectrumFormat(String name, boolean skipUnparsableLines) {
    this.name = name;
    this.skipUnparsableLines = skipUnparsableLines;
  }

  public String getName() {
    return name;
  }

  public boolean skipsUnparsableLines() {
    return skipUnparsableLines;
  }

  public static SpectrumFormat fromName(String name) {
    List<String> names = new ArrayList<>();
    for (SpectrumFormat format : values()) {
      if (format.name.equalsIgnoreCase(name)) {
        return format;
      }
      names.add(format.name);
    }
    throw new IllegalArgumentException(String.format(
        "Unknown reading strategy '%s', expected one of %s", name, names));
  }
}
