/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.registrationledger.storage.file;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.micronaut.context.annotation.Property;
import io.micronaut.context.annotation.Requires;
import jakarta.inject.Singleton;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import org.signal.registrationledger.RegistrationEntry;
import org.signal.registrationledger.storage.LedgerRepository;
import org.signal.registrationledger.util.ObjectMappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A ledger repository that stores all entries as a JSON array in a single file, replaced atomically on every store.
 */
@Singleton
@Requires(property = "storage.file.ledger")
public class FileLedgerRepository implements LedgerRepository {

  private static final Logger logger = LoggerFactory.getLogger(FileLedgerRepository.class);
  private static final TypeReference<List<RegistrationEntry>> ENTRY_LIST = new TypeReference<>() {
  };

  private final Path path;
  private final ObjectMapper objectMapper;

  public FileLedgerRepository(@Property(name = "storage.file.ledger") String fileName) {
    this.path = Paths.get(fileName);
    this.objectMapper = ObjectMappers.newObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
  }

  @Override
  public List<RegistrationEntry> getEntries() throws IOException {
    try {
      return List.copyOf(objectMapper.readValue(Files.readAllBytes(path), ENTRY_LIST));
    } catch (final NoSuchFileException e) {
      logger.info("Ledger file {} not found; starting empty", path);
      return List.of();
    } catch (final IOException e) {
      logger.error("Unexpected error reading ledger file {}", path, e);
      throw e;
    }
  }

  @Override
  public void storeEntries(final List<RegistrationEntry> entries) throws IOException {
    try {
      AtomicFiles.write(path, objectMapper.writeValueAsBytes(entries));
    } catch (final IOException e) {
      logger.error("Unexpected error writing ledger file {}", path, e);
      throw e;
    }
  }
}
