package com.flamingo.ai.memoryengine.domain.repository;

import com.flamingo.ai.memoryengine.domain.entity.DeadLetterEntry;
import com.flamingo.ai.memoryengine.domain.enums.DeadLetterSubject;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** Repository for DeadLetterEntry entities. */
@Repository
public interface DeadLetterRepository extends JpaRepository<DeadLetterEntry, UUID> {

  Optional<DeadLetterEntry> findBySubjectTypeAndSubjectId(
      DeadLetterSubject subjectType, String subjectId);

  /** Whether the subject is in the dead-letter set. */
  boolean existsBySubjectTypeAndSubjectIdAndDeadLetteredTrue(
      DeadLetterSubject subjectType, String subjectId);

  /** Lists the dead-letter set for manual inspection. */
  List<DeadLetterEntry> findByDeadLetteredTrueOrderByDeadLetteredAtDesc();

  void deleteBySubjectTypeAndSubjectId(DeadLetterSubject subjectType, String subjectId);
}
