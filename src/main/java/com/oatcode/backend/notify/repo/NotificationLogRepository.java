package com.oatcode.backend.notify.repo;

import com.oatcode.backend.notify.TemplateKind;
import com.oatcode.backend.notify.entity.NotificationLogEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface NotificationLogRepository extends JpaRepository<NotificationLogEntity, Long> {

    List<NotificationLogEntity> findByCustomerIdOrderBySentAtUtcDesc(Long customerId);

    List<NotificationLogEntity> findAllByOrderBySentAtUtcDesc(Pageable page);

    List<NotificationLogEntity> findByRequestIdAndKind(Long requestId, TemplateKind kind);
}
