package com.oatcode.backend.revision.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(RevisionProperties.class)
public class RevisionConfig {}
