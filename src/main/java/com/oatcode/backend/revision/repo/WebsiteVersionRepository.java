package com.oatcode.backend.revision.repo;

import com.oatcode.backend.revision.entity.WebsiteVersionEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface WebsiteVersionRepository extends JpaRepository<WebsiteVersionEntity, Long> {

    @Query("select coalesce(max(v.versionNumber), 0) from WebsiteVersionEntity v where v.customerId = :customerId")
    int findMaxVersionNumber(@Param("customerId") Long customerId);

    List<WebsiteVersionEntity> findByCustomerIdOrderByVersionNumberDesc(Long customerId);

    Optional<WebsiteVersionEntity> findFirstByCustomerIdAndCurrentTrue(Long customerId);

    long countByCustomerId(Long customerId);

    long countByCustomerIdAndCurrentTrue(Long customerId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update WebsiteVersionEntity v set v.current = false where v.customerId = :customerId and v.id <> :keepId and v.current = true")
    int clearCurrentExcept(@Param("customerId") Long customerId, @Param("keepId") Long keepId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update WebsiteVersionEntity v set v.current = true where v.id = :id")
    int markCurrent(@Param("id") Long id);
}
