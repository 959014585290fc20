package com.oatcode.backend;

import com.oatcode.backend.revision.service.RegenerationQueue;
import com.oatcode.backend.revision.task.RegenerationQueueHealthIndicator;
import com.oatcode.backend.revision.task.RegenerationTaskReaper;
import com.oatcode.backend.revision.task.RegenerationTaskWorker;
import com.oatcode.backend.testsupport.BaseSpringTest;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.actuate.health.HealthContributorRegistry;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.mail.javamail.JavaMailSender;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
class ApplicationContextSmokeTest extends BaseSpringTest {

    @Autowired ApplicationContext ctx;
    @Autowired HealthContributorRegistry health;

    @Test
    void context_starts_with_workflow_beans() {
        assertThat(ctx.getBean(RegenerationQueue.class)).isNotNull();
        assertThat(ctx.getBean(RegenerationTaskWorker.class)).isNotNull();
        assertThat(ctx.getBean(RegenerationTaskReaper.class)).isNotNull();
        assertThat(ctx.getBean(JavaMailSender.class)).isNotNull();
    }

    @Test
    void queue_health_is_registered_under_its_own_name() {
        assertThat(ctx.getBean(RegenerationQueueHealthIndicator.class)).isNotNull();
        assertThat(health.getContributor("regenerationQueue")).isInstanceOf(RegenerationQueueHealthIndicator.class);
    }
}
