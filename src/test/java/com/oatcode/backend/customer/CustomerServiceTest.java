package com.oatcode.backend.customer;

import com.oatcode.backend.customer.entity.Customer;
import com.oatcode.backend.customer.repo.CustomerRepo;
import com.oatcode.backend.customer.service.CustomerService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.transaction.PlatformTransactionManager;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;

class CustomerServiceTest {

    private CustomerRepo repo;
    private CustomerService service;

    @BeforeEach
    void setUp() {
        repo = Mockito.mock(CustomerRepo.class);
        service = new CustomerService(repo, Mockito.mock(PlatformTransactionManager.class));
    }

    @Test
    void existing_email_is_reused_case_insensitively() {
        Customer c = new Customer();
        c.setId(1L);
        Mockito.when(repo.findByEmailIgnoreCase("owner@joes.com")).thenReturn(Optional.of(c));

        assertSame(c, service.findOrCreateByEmail("  Owner@Joes.com "));
        Mockito.verify(repo, Mockito.never()).saveAndFlush(any());
    }

    @Test
    void new_email_creates_demo_customer() {
        Mockito.when(repo.findByEmailIgnoreCase("new@prospect.com")).thenReturn(Optional.empty());
        Mockito.when(repo.saveAndFlush(any(Customer.class))).thenAnswer(inv -> inv.getArgument(0));

        Customer c = service.findOrCreateByEmail("new@prospect.com");

        assertEquals("new@prospect.com", c.getEmail());
        assertEquals("Demo Customer", c.getBusinessName());
        assertFalse(c.isPaying());
    }

    @Test
    void lost_insert_race_rereads_winner() {
        Customer winner = new Customer();
        winner.setId(5L);
        Mockito.when(repo.findByEmailIgnoreCase("race@prospect.com"))
                .thenReturn(Optional.empty(), Optional.of(winner));
        Mockito.when(repo.saveAndFlush(any(Customer.class)))
                .thenThrow(new DataIntegrityViolationException("ux_customers_email"));

        assertSame(winner, service.findOrCreateByEmail("race@prospect.com"));
    }

    @Test
    void blank_email_is_rejected() {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> service.findOrCreateByEmail(" "));
        assertEquals("EMAIL_REQUIRED", ex.getMessage());
    }

    @Test
    void unknown_customer_is_not_found() {
        Mockito.when(repo.findById(9L)).thenReturn(Optional.empty());

        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () -> service.require(9L));
        assertEquals("CUSTOMER_NOT_FOUND", ex.getMessage());
    }
}
