package com.oatcode.backend.revision.repo;

import com.oatcode.backend.revision.entity.CustomizationRequestEntity;
import com.oatcode.backend.revision.model.RequestStatus;
import com.oatcode.backend.revision.model.RequestType;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface CustomizationRequestRepository extends JpaRepository<CustomizationRequestEntity, Long> {

    Optional<CustomizationRequestEntity> findByActiveCustomerId(Long customerId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select r from CustomizationRequestEntity r where r.activeCustomerId = :customerId")
    Optional<CustomizationRequestEntity> findActiveByCustomerIdForUpdate(@Param("customerId") Long customerId);

    Optional<CustomizationRequestEntity> findFirstByCustomerIdAndStatusOrderByCreatedAtUtcDesc(Long customerId, RequestStatus status);

    List<CustomizationRequestEntity> findByStatusAndRequestTypeInOrderByCompletedAtUtcAsc(
            RequestStatus status, Collection<RequestType> types);

    List<CustomizationRequestEntity> findByCustomerIdOrderByCreatedAtUtcDesc(Long customerId);

    long countByStatus(RequestStatus status);

    // ===== guarded transitions：WHERE status = 舊狀態，回傳 0 代表別人先動了 =====

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
        update CustomizationRequestEntity r
           set r.status = com.oatcode.backend.revision.model.RequestStatus.PENDING_APPROVAL,
               r.versionId = :versionId,
               r.completedAtUtc = :now,
               r.lastErrorCode = null,
               r.lastErrorMessage = null,
               r.updatedAtUtc = :now
         where r.id = :id
           and r.status = com.oatcode.backend.revision.model.RequestStatus.PROCESSING
           and r.inputRevision = :inputRevision
        """)
    int markPendingApproval(@Param("id") Long id,
                            @Param("inputRevision") int inputRevision,
                            @Param("versionId") Long versionId,
                            @Param("now") Instant now);

    /** 同一份輸入跑了兩次（reaper 重領）：後完成的版本覆蓋 versionId，last write wins */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
        update CustomizationRequestEntity r
           set r.versionId = :versionId,
               r.completedAtUtc = :now,
               r.updatedAtUtc = :now
         where r.id = :id
           and r.status = com.oatcode.backend.revision.model.RequestStatus.PENDING_APPROVAL
           and r.inputRevision = :inputRevision
        """)
    int relinkPendingVersion(@Param("id") Long id,
                             @Param("inputRevision") int inputRevision,
                             @Param("versionId") Long versionId,
                             @Param("now") Instant now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
        update CustomizationRequestEntity r
           set r.status = com.oatcode.backend.revision.model.RequestStatus.APPROVED,
               r.approvedAtUtc = :now,
               r.activeCustomerId = null,
               r.updatedAtUtc = :now
         where r.id = :id
           and r.status = com.oatcode.backend.revision.model.RequestStatus.PENDING_APPROVAL
        """)
    int markApproved(@Param("id") Long id, @Param("now") Instant now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
        update CustomizationRequestEntity r
           set r.status = com.oatcode.backend.revision.model.RequestStatus.PROCESSING,
               r.requestText = :requestText,
               r.inputRevision = r.inputRevision + 1,
               r.approvedAtUtc = null,
               r.updatedAtUtc = :now
         where r.id = :id
           and r.status = com.oatcode.backend.revision.model.RequestStatus.PENDING_APPROVAL
        """)
    int reopenWithFeedback(@Param("id") Long id,
                           @Param("requestText") String requestText,
                           @Param("now") Instant now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
        update CustomizationRequestEntity r
           set r.lastErrorCode = :code,
               r.lastErrorMessage = :msg,
               r.updatedAtUtc = :now
         where r.id = :id
           and r.status = com.oatcode.backend.revision.model.RequestStatus.PROCESSING
        """)
    int recordFailure(@Param("id") Long id,
                      @Param("code") String code,
                      @Param("msg") String msg,
                      @Param("now") Instant now);
}
