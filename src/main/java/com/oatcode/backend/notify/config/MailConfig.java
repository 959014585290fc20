package com.oatcode.backend.notify.config;

import org.springframework.boot.autoconfigure.mail.MailProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.JavaMailSenderImpl;

/**
 * 沒設定 spring.mail.host 時 Boot 不會自動建 JavaMailSender，這裡固定提供一個
 * （host 為空時寄送會失敗，由 dispatcher 吞掉並記到 notification_log）
 */
@Configuration
@EnableConfigurationProperties(MailProperties.class)
public class MailConfig {

    @Bean
    public JavaMailSender javaMailSender(MailProperties p) {
        var s = new JavaMailSenderImpl();
        s.setHost(p.getHost());
        if (p.getPort() != null) s.setPort(p.getPort());
        s.setUsername(p.getUsername());
        s.setPassword(p.getPassword());
        if (p.getDefaultEncoding() != null) s.setDefaultEncoding(p.getDefaultEncoding().name());
        s.getJavaMailProperties().putAll(p.getProperties());
        return s;
    }
}
