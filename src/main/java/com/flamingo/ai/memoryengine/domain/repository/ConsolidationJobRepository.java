package com.flamingo.ai.memoryengine.domain.repository;

import com.flamingo.ai.memoryengine.domain.entity.ConsolidationJob;
import com.flamingo.ai.memoryengine.domain.enums.JobStatus;
import com.flamingo.ai.memoryengine.domain.enums.MemoryTier;
import java.util.Collection;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** Repository for ConsolidationJob entities. */
@Repository
public interface ConsolidationJobRepository extends JpaRepository<ConsolidationJob, UUID> {

  /** Finds the most recent job of a tier in one of the given states. */
  Optional<ConsolidationJob> findFirstByTierAndStatusInOrderByCreatedAtDesc(
      MemoryTier tier, Collection<JobStatus> statuses);
}
