package com.oatcode.backend.revision.repo;

import com.oatcode.backend.revision.entity.RevisionSubmissionEntity;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.Instant;
import java.util.Optional;

public interface RevisionSubmissionRepository extends JpaRepository<RevisionSubmissionEntity, Long> {

    /** 冷卻期檢查：同一個 email 在 after 之後最近一次送出 */
    Optional<RevisionSubmissionEntity> findFirstBySubmitterEmailAndSubmittedAtUtcAfterOrderBySubmittedAtUtcDesc(
            String submitterEmail, Instant after);
}
