/*
 * Copyright 2019-present Facebook, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License"); you may
 * not use this file except in compliance with the License. You may obtain
 * a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS, WITHOUT
 * WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied. See the
 * License for the specific language governing permissions and limitations
 * under the License.
 */

package com.facebook.resmerge.zip;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.zip.CRC32;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;
import java.util.zip.ZipOutputStream;

/**
 * Rewrites a zip file so that its entries appear sorted by name and carry a fixed timestamp. The
 * linker consumes entries in archive order, so this keeps its output independent of the order in
 * which the compiler happened to write them.
 */
public class ZipSorter {

  /** 1985-02-01T00:00:00 local time, the same constant zip scrubbing tools use. */
  private static final long FIXED_TIME = 476_064_000_000L;

  /** Utility class: do not instantiate. */
  private ZipSorter() {}

  public static void sortZip(Path source, Path destination) throws IOException {
    SortedMap<String, ZipEntryContents> entries = new TreeMap<>();
    try (InputStream in = Files.newInputStream(source);
        ZipInputStream zip = new ZipInputStream(in)) {
      for (ZipEntry entry = zip.getNextEntry(); entry != null; entry = zip.getNextEntry()) {
        entries.put(
            entry.getName(), new ZipEntryContents(entry.getMethod(), zip.readAllBytes()));
      }
    }

    try (OutputStream out = Files.newOutputStream(destination);
        ZipOutputStream zip = new ZipOutputStream(out)) {
      for (Map.Entry<String, ZipEntryContents> entry : entries.entrySet()) {
        byte[] data = entry.getValue().data;
        ZipEntry zipEntry = new ZipEntry(entry.getKey());
        zipEntry.setTime(FIXED_TIME);
        if (entry.getValue().method == ZipEntry.STORED) {
          CRC32 crc = new CRC32();
          crc.update(data);
          zipEntry.setMethod(ZipEntry.STORED);
          zipEntry.setSize(data.length);
          zipEntry.setCompressedSize(data.length);
          zipEntry.setCrc(crc.getValue());
        } else {
          zipEntry.setMethod(ZipEntry.DEFLATED);
        }
        zip.putNextEntry(zipEntry);
        zip.write(data);
        zip.closeEntry();
      }
    }
  }

  private static class ZipEntryContents {
    private final int method;
    private final byte[] data;

    private ZipEntryContents(int method, byte[] data) {
      this.method = method;
      this.data = data;
    }
  }
}
