package com.oatcode.backend.revision.repo;

import com.oatcode.backend.revision.entity.RegenerationTaskEntity;
import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface RegenerationTaskRepository extends JpaRepository<RegenerationTaskEntity, String> {

    /**
     * ✅ 領取任務：PESSIMISTIC_WRITE + lock.timeout=-2（Hibernate 的 SKIP LOCKED）
     * 多個 instance 同時輪詢時，被別人鎖住的 row 直接跳過
     * 注意：要在交易內呼叫才會真的 lock
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints(@QueryHint(name = "jakarta.persistence.lock.timeout", value = "-2"))
    @Query("""
        select t from RegenerationTaskEntity t
         where t.taskStatus = com.oatcode.backend.revision.entity.RegenerationTaskEntity.TaskStatus.QUEUED
            or (t.taskStatus = com.oatcode.backend.revision.entity.RegenerationTaskEntity.TaskStatus.FAILED
                and t.nextRetryAtUtc is not null
                and t.nextRetryAtUtc <= :now)
         order by t.createdAtUtc asc
        """)
    List<RegenerationTaskEntity> claimRunnableForUpdate(@Param("now") Instant now, Pageable page);

    Optional<RegenerationTaskEntity> findFirstByRequestIdOrderByCreatedAtUtcDesc(Long requestId);

    List<RegenerationTaskEntity> findByRequestIdOrderByCreatedAtUtcDesc(Long requestId);

    long countByTaskStatus(RegenerationTaskEntity.TaskStatus status);

    /** worker 掛掉（process crash）留下的 RUNNING，超時就改回 FAILED 並立刻可重領 */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
        update RegenerationTaskEntity t
           set t.taskStatus = com.oatcode.backend.revision.entity.RegenerationTaskEntity.TaskStatus.FAILED,
               t.nextRetryAtUtc = :now,
               t.lastErrorCode = :code,
               t.lastErrorMessage = :msg,
               t.updatedAtUtc = :now
         where t.taskStatus = com.oatcode.backend.revision.entity.RegenerationTaskEntity.TaskStatus.RUNNING
           and t.updatedAtUtc <= :staleBefore
        """)
    int resetStaleRunning(@Param("staleBefore") Instant staleBefore,
                          @Param("now") Instant now,
                          @Param("code") String code,
                          @Param("msg") String msg);
}
