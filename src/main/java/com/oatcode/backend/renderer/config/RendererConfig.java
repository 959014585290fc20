package com.oatcode.backend.renderer.config;

import com.oatcode.backend.renderer.OpenAiWebsiteRenderer;
import com.oatcode.backend.renderer.StubWebsiteRenderer;
import com.oatcode.backend.renderer.WebsiteRenderer;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
@EnableConfigurationProperties(OpenAiRendererProperties.class)
public class RendererConfig {

    /**
     * ✅ 只有 openai enabled=false 才提供 stub，避免 WebsiteRenderer 變成兩個 Bean
     */
    @Bean
    @ConditionalOnProperty(prefix = "app.renderer.openai", name = "enabled", havingValue = "false", matchIfMissing = true)
    public WebsiteRenderer stubWebsiteRenderer() {
        return new StubWebsiteRenderer();
    }

    @Bean
    @ConditionalOnProperty(prefix = "app.renderer.openai", name = "enabled", havingValue = "true")
    public RestClient openAiRestClient(OpenAiRendererProperties props) {
        SimpleClientHttpRequestFactory f = new SimpleClientHttpRequestFactory();
        f.setConnectTimeout((int) props.getConnectTimeout().toMillis());
        f.setReadTimeout((int) props.getReadTimeout().toMillis());

        return RestClient.builder()
                .baseUrl(props.getBaseUrl())
                .requestFactory(f)
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + props.getApiKey())
                .build();
    }

    @Bean
    @ConditionalOnProperty(prefix = "app.renderer.openai", name = "enabled", havingValue = "true")
    public WebsiteRenderer openAiWebsiteRenderer(RestClient openAiRestClient,
                                                 OpenAiRendererProperties props,
                                                 ObjectMapper om) {
        // ✅ Fail-fast：啟動就抓到 key 缺失
        String k = props.getApiKey();
        if (k == null || k.isBlank()) throw new IllegalStateException("OPENAI_API_KEY_MISSING");
        if (props.getBaseUrl() == null || props.getBaseUrl().isBlank()) throw new IllegalStateException("OPENAI_BASE_URL_MISSING");

        return new OpenAiWebsiteRenderer(openAiRestClient, props, om);
    }
}
