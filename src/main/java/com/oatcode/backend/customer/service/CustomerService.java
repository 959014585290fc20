package com.oatcode.backend.customer.service;

import com.oatcode.backend.customer.entity.Customer;
import com.oatcode.backend.customer.repo.CustomerRepo;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.util.Locale;

@Slf4j
@Service
public class CustomerService {

    static final String DEMO_BUSINESS_NAME = "Demo Customer";
    static final String DEMO_INDUSTRY = "services";

    private final CustomerRepo repo;
    private final TransactionTemplate requiresNew;

    public CustomerService(CustomerRepo repo, PlatformTransactionManager txManager) {
        this.repo = repo;
        this.requiresNew = new TransactionTemplate(txManager);
        this.requiresNew.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    @Transactional(readOnly = true)
    public Customer require(Long customerId) {
        if (customerId == null) throw new IllegalArgumentException("CUSTOMER_NOT_FOUND");
        return repo.findById(customerId)
                .orElseThrow(() -> new IllegalArgumentException("CUSTOMER_NOT_FOUND"));
    }

    /**
     * 購買前 prospect 用 email 找或建客戶
     * - 唯一鍵 ux_customers_email 是真正的防線：兩個請求同時 insert，輸的那個回頭再讀一次
     * - insert 跑在獨立交易；呼叫端不要包在外層交易裡，否則 re-read 看不到對方剛 commit 的 row
     */
    public Customer findOrCreateByEmail(String rawEmail) {
        String email = normalizeEmail(rawEmail);

        var existing = repo.findByEmailIgnoreCase(email);
        if (existing.isPresent()) return existing.get();

        try {
            return requiresNew.execute(s -> {
                Customer c = new Customer();
                c.setEmail(email);
                c.setBusinessName(DEMO_BUSINESS_NAME);
                c.setIndustry(DEMO_INDUSTRY);
                c.setMonthlyPrice(BigDecimal.ZERO);
                return repo.saveAndFlush(c);
            });
        } catch (DataIntegrityViolationException race) {
            log.info("customer insert lost race, re-reading. email={}", email);
            return repo.findByEmailIgnoreCase(email)
                    .orElseThrow(() -> new IllegalStateException("CUSTOMER_CREATE_FAILED", race));
        }
    }

    public static String normalizeEmail(String raw) {
        if (raw == null || raw.isBlank()) throw new IllegalArgumentException("EMAIL_REQUIRED");
        return raw.trim().toLowerCase(Locale.ROOT);
    }
}
