package com.oatcode.backend.renderer.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "app.renderer.openai")
public class OpenAiRendererProperties {

    /** 開關：dev 沒 key 時走 stub（預設 false） */
    private boolean enabled = false;

    private String baseUrl = "https://api.openai.com";

    private String model = "gpt-4o";

    /** 用環境變數帶入：OPENAI_API_KEY */
    private String apiKey;

    private Duration connectTimeout = Duration.ofSeconds(5);

    /** 產整頁 HTML 很慢，read timeout 放寬；整體上限由 app.revision.renderer-timeout 控制 */
    private Duration readTimeout = Duration.ofMinutes(2);

    private int maxOutputTokens = 8000;

    private double temperature = 0.4;

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }

    public String getBaseUrl() { return baseUrl; }
    public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }

    public String getModel() { return model; }
    public void setModel(String model) { this.model = model; }

    public String getApiKey() { return apiKey; }
    public void setApiKey(String apiKey) { this.apiKey = apiKey; }

    public Duration getConnectTimeout() { return connectTimeout; }
    public void setConnectTimeout(Duration connectTimeout) { this.connectTimeout = connectTimeout; }

    public Duration getReadTimeout() { return readTimeout; }
    public void setReadTimeout(Duration readTimeout) { this.readTimeout = readTimeout; }

    public int getMaxOutputTokens() { return maxOutputTokens; }
    public void setMaxOutputTokens(int maxOutputTokens) { this.maxOutputTokens = maxOutputTokens; }

    public double getTemperature() { return temperature; }
    public void setTemperature(double temperature) { this.temperature = temperature; }
}
