/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.registrationledger.storage.file;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

class AtomicFiles {

  private AtomicFiles() {
  }

  /**
   * Replaces the contents of {@code path} so that concurrent readers see either the old or the new contents in full.
   * The data is written to a temporary file in the same directory, which is then renamed over {@code path}.
   */
  static void write(final Path path, final byte[] contents) throws IOException {
    final Path directory = path.toAbsolutePath().getParent();
    // recursively create parent directories if they don't already exist
    if (directory != null) {
      Files.createDirectories(directory);
    }

    final Path temporaryFile = Files.createTempFile(directory, path.getFileName().toString(), ".tmp");
    try {
      Files.write(temporaryFile, contents);
      Files.move(temporaryFile, path, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    } finally {
      Files.deleteIfExists(temporaryFile);
    }
  }
}
