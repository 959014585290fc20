package com.oatcode.backend.revision.service;

import com.oatcode.backend.customer.repo.CustomerRepo;
import com.oatcode.backend.revision.entity.WebsiteVersionEntity;
import com.oatcode.backend.revision.repo.WebsiteVersionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

@Slf4j
@RequiredArgsConstructor
@Service
public class WebsiteVersionService {

    private final WebsiteVersionRepository repo;
    private final CustomerRepo customerRepo;

    /**
     * 新增一個版本（current=false，審核通過才會變 current）
     * 版本號在客戶 row 的寫鎖下取 max+1，所以同一客戶不會跳號也不會重號
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public WebsiteVersionEntity appendVersion(Long customerId, Long requestId, String html, String description) {
        customerRepo.findByIdForUpdate(customerId)
                .orElseThrow(() -> new IllegalArgumentException("CUSTOMER_NOT_FOUND"));

        int next = repo.findMaxVersionNumber(customerId) + 1;

        WebsiteVersionEntity v = new WebsiteVersionEntity();
        v.setCustomerId(customerId);
        v.setRequestId(requestId);
        v.setVersionNumber(next);
        v.setHtmlContent(html);
        v.setChangeDescription(description);
        v.setCurrent(false);
        WebsiteVersionEntity saved = repo.saveAndFlush(v);

        log.info("website version appended. customerId={} requestId={} version={} id={}",
                customerId, requestId, next, saved.getId());
        return saved;
    }

    /**
     * 先清掉同客戶其他版本的 current，再設這一版；同一交易內完成
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void promoteToCurrent(Long versionId) {
        WebsiteVersionEntity v = repo.findById(versionId)
                .orElseThrow(() -> new IllegalArgumentException("VERSION_NOT_FOUND"));

        repo.clearCurrentExcept(v.getCustomerId(), v.getId());
        repo.markCurrent(v.getId());
    }

    @Transactional(readOnly = true)
    public List<WebsiteVersionEntity> history(Long customerId) {
        return repo.findByCustomerIdOrderByVersionNumberDesc(customerId);
    }

    @Transactional(readOnly = true)
    public Optional<WebsiteVersionEntity> findCurrent(Long customerId) {
        return repo.findFirstByCustomerIdAndCurrentTrue(customerId);
    }

    @Transactional(readOnly = true)
    public WebsiteVersionEntity require(Long versionId) {
        if (versionId == null) throw new IllegalArgumentException("VERSION_NOT_FOUND");
        return repo.findById(versionId)
                .orElseThrow(() -> new IllegalArgumentException("VERSION_NOT_FOUND"));
    }
}
