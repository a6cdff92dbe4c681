/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.registrationledger.storage.file;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.micronaut.context.annotation.Property;
import io.micronaut.context.annotation.Requires;
import jakarta.inject.Singleton;
import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;
import org.signal.registrationledger.RegistrationEntry;
import org.signal.registrationledger.storage.RegistrationRepository;
import org.signal.registrationledger.util.ObjectMappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A registration repository that keeps one {@code reg_<FINGERPRINT>.json} file per registered identity.
 */
@Singleton
@Requires(property = "storage.file.registrations-directory")
public class FileRegistrationRepository implements RegistrationRepository {

  private static final Logger logger = LoggerFactory.getLogger(FileRegistrationRepository.class);
  // fingerprints become file names, so only allow characters that can't escape the directory
  private static final Pattern FINGERPRINT_PATTERN = Pattern.compile("[A-Za-z0-9]{1,128}");
  private static final String FILE_NAME_PREFIX = "reg_";
  private static final String FILE_NAME_SUFFIX = ".json";

  private final Path directory;
  private final ObjectMapper objectMapper;

  public FileRegistrationRepository(@Property(name = "storage.file.registrations-directory") String directory) {
    this.directory = Paths.get(directory);
    this.objectMapper = ObjectMappers.newObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
  }

  static boolean isValidFingerprint(final String fingerprint) {
    return fingerprint != null && FINGERPRINT_PATTERN.matcher(fingerprint).matches();
  }

  @Override
  public Optional<RegistrationEntry> findByFingerprint(final String fingerprint) throws IOException {
    if (!isValidFingerprint(fingerprint)) {
      logger.warn("Ignoring lookup for malformed fingerprint");
      return Optional.empty();
    }

    final Path path = pathFor(fingerprint);
    try {
      return Optional.of(objectMapper.readValue(Files.readAllBytes(path), RegistrationEntry.class));
    } catch (final NoSuchFileException e) {
      logger.debug("No registration found at {}", path);
      return Optional.empty();
    } catch (final IOException e) {
      logger.error("Unexpected error reading registration {}", path, e);
      throw e;
    }
  }

  @Override
  public void store(final RegistrationEntry entry) throws IOException {
    if (!isValidFingerprint(entry.identityFingerprint())) {
      throw new IllegalArgumentException("Registration must carry an alphanumeric identity fingerprint");
    }

    final Path path = pathFor(entry.identityFingerprint());
    try {
      AtomicFiles.write(path, objectMapper.writeValueAsBytes(entry));
    } catch (final IOException e) {
      logger.error("Unexpected error writing registration {}", path, e);
      throw e;
    }
  }

  @Override
  public List<RegistrationEntry> findAll() throws IOException {
    if (!Files.isDirectory(directory)) {
      return List.of();
    }

    final List<RegistrationEntry> registrations = new ArrayList<>();
    try (final DirectoryStream<Path> paths =
        Files.newDirectoryStream(directory, FILE_NAME_PREFIX + "*" + FILE_NAME_SUFFIX)) {

      for (final Path path : paths) {
        try {
          registrations.add(objectMapper.readValue(Files.readAllBytes(path), RegistrationEntry.class));
        } catch (final IOException e) {
          // skip unreadable registrations
          logger.warn("Skipping unreadable registration {}", path, e);
        }
      }
    }
    return registrations;
  }

  private Path pathFor(final String fingerprint) {
    return directory.resolve(FILE_NAME_PREFIX + fingerprint.toUpperCase(Locale.ROOT) + FILE_NAME_SUFFIX);
  }
}
