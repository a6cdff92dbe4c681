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
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;
import java.util.regex.Pattern;
import org.signal.registrationledger.proposal.SubmittedProposal;
import org.signal.registrationledger.storage.ProposalRepository;
import org.signal.registrationledger.util.ObjectMappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A proposal repository that keeps one {@code proposal_<id>.json} file per proposal.
 */
@Singleton
@Requires(property = "storage.file.proposals-directory")
public class FileProposalRepository implements ProposalRepository {

  private static final Logger logger = LoggerFactory.getLogger(FileProposalRepository.class);
  private static final Pattern PROPOSAL_ID_PATTERN = Pattern.compile("[0-9a-f]{1,64}");

  private final Path directory;
  private final ObjectMapper objectMapper;

  public FileProposalRepository(@Property(name = "storage.file.proposals-directory") String directory) {
    this.directory = Paths.get(directory);
    this.objectMapper = ObjectMappers.newObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
  }

  @Override
  public Optional<SubmittedProposal> findById(final String proposalId) throws IOException {
    if (proposalId == null || !PROPOSAL_ID_PATTERN.matcher(proposalId).matches()) {
      return Optional.empty();
    }

    final Path path = pathFor(proposalId);
    try {
      return Optional.of(objectMapper.readValue(Files.readAllBytes(path), SubmittedProposal.class));
    } catch (final NoSuchFileException e) {
      return Optional.empty();
    } catch (final IOException e) {
      logger.error("Unexpected error reading proposal {}", path, e);
      throw e;
    }
  }

  // The existence check and the write must not interleave with another store
  @Override
  public synchronized boolean storeIfAbsent(final SubmittedProposal proposal) throws IOException {
    if (!PROPOSAL_ID_PATTERN.matcher(proposal.proposalId()).matches()) {
      throw new IllegalArgumentException("Proposal IDs must be lowercase hex");
    }

    final Path path = pathFor(proposal.proposalId());
    if (Files.exists(path)) {
      return false;
    }

    try {
      AtomicFiles.write(path, objectMapper.writeValueAsBytes(proposal));
      return true;
    } catch (final IOException e) {
      logger.error("Unexpected error writing proposal {}", path, e);
      throw e;
    }
  }

  private Path pathFor(final String proposalId) {
    return directory.resolve("proposal_" + proposalId + ".json");
  }
}
