package com.oatcode.backend.customer.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.Instant;

@Getter
@Setter
@Entity
@Table(name = "customers",
        uniqueConstraints = @UniqueConstraint(name = "ux_customers_email", columnNames = "email"))
public class Customer {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 255)
    private String email;

    @Column(name = "business_name", length = 255)
    private String businessName;

    @Column(length = 64)
    private String industry;

    @Column(length = 32)
    private String phone;

    @Column(name = "stripe_subscription_id", length = 128)
    private String stripeSubscriptionId;

    @Column(name = "monthly_price", precision = 10, scale = 2)
    private BigDecimal monthlyPrice;

    @Column(name = "website_url", length = 512)
    private String websiteUrl;

    @Column(name = "created_at_utc", nullable = false)
    private Instant createdAtUtc;

    @Column(name = "updated_at_utc", nullable = false)
    private Instant updatedAtUtc;

    @PrePersist
    void prePersist() {
        Instant now = Instant.now();
        if (createdAtUtc == null) createdAtUtc = now;
        if (updatedAtUtc == null) updatedAtUtc = now;
    }

    @PreUpdate
    void preUpdate() {
        updatedAtUtc = Instant.now();
    }

    /**
     * 付費訂閱 vs 購買前 demo：有 Stripe 訂閱或月費 > 0 就算付費
     */
    public boolean isPaying() {
        if (stripeSubscriptionId != null && !stripeSubscriptionId.isBlank()) return true;
        return monthlyPrice != null && monthlyPrice.signum() > 0;
    }

    public String displayName() {
        return (businessName == null || businessName.isBlank()) ? email : businessName;
    }
}
