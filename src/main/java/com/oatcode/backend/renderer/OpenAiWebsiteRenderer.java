package com.oatcode.backend.renderer;

import com.oatcode.backend.renderer.config.OpenAiRendererProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

import java.util.Locale;

@Slf4j
public class OpenAiWebsiteRenderer implements WebsiteRenderer {

    private static final int PREVIEW_LEN = 200;

    private static final String SYSTEM_PROMPT = """
            You are a senior web designer generating a complete single-file marketing website for a small business.
            Return ONLY the full HTML document (<!DOCTYPE html> ... </html>) with inline CSS.
            No markdown, no explanations. Keep the business contact details exactly as given.
            """;

    private final RestClient http;
    private final OpenAiRendererProperties props;
    private final ObjectMapper om;

    public OpenAiWebsiteRenderer(RestClient http, OpenAiRendererProperties props, ObjectMapper om) {
        this.http = http;
        this.props = props;
        this.om = om;
    }

    @Override
    public String rendererCode() { return "OPENAI"; }

    @Override
    public RenderedWebsite render(RenderInput input) {
        long t0 = System.nanoTime();
        JsonNode resp;
        try {
            resp = http.post()
                    .uri("/v1/chat/completions")
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(buildBody(input))
                    .retrieve()
                    .body(JsonNode.class);
        } catch (RestClientResponseException e) {
            int status = e.getStatusCode().value();
            String code = (status == 401 || status == 403) ? "RENDER_AUTH_FAILED"
                    : (status == 429) ? "RENDER_RATE_LIMITED"
                    : (status >= 500) ? "RENDER_UPSTREAM_ERROR"
                    : "RENDER_BAD_REQUEST";
            throw new RenderFailedException(code, "openai http " + status + ": " + preview(e.getResponseBodyAsString()), e);
        }

        String content = extractContent(resp);
        String html = stripFences(content);
        if (!looksLikeHtml(html)) {
            log.warn("openai_bad_output customerId={} preview={}", input.customerId(), preview(content));
            throw new RenderFailedException("RENDER_BAD_OUTPUT", "renderer returned no html document");
        }

        long ms = (System.nanoTime() - t0) / 1_000_000;
        log.info("openai_render_ok customerId={} model={} htmlLen={} latencyMs={}",
                input.customerId(), props.getModel(), html.length(), ms);

        return new RenderedWebsite(html, StubWebsiteRenderer.summarize(input.changeDescription()));
    }

    ObjectNode buildBody(RenderInput input) {
        ObjectNode body = om.createObjectNode();
        body.put("model", props.getModel());
        body.put("temperature", props.getTemperature());
        body.put("max_tokens", props.getMaxOutputTokens());

        ArrayNode messages = body.putArray("messages");
        messages.addObject().put("role", "system").put("content", SYSTEM_PROMPT);
        messages.addObject().put("role", "user").put("content", userPrompt(input));
        return body;
    }

    private static String userPrompt(RenderInput in) {
        StringBuilder sb = new StringBuilder();
        sb.append("Business name: ").append(nz(in.businessName(), "Your Business")).append('\n');
        sb.append("Industry: ").append(nz(in.industry(), "services")).append('\n');
        sb.append("Email: ").append(nz(in.email(), "")).append('\n');
        sb.append("Phone: ").append(nz(in.phone(), "")).append('\n');
        sb.append("\nRequested changes:\n").append(nz(in.changeDescription(), "Initial website generation")).append('\n');
        if (in.currentHtml() != null && !in.currentHtml().isBlank()) {
            sb.append("\nCurrent website HTML (apply the requested changes to it):\n").append(in.currentHtml());
        }
        return sb.toString();
    }

    private static String extractContent(JsonNode resp) {
        if (resp == null) throw new RenderFailedException("RENDER_EMPTY_RESPONSE", "empty response body");
        JsonNode content = resp.path("choices").path(0).path("message").path("content");
        if (content.isMissingNode() || content.isNull() || content.asText().isBlank()) {
            throw new RenderFailedException("RENDER_EMPTY_RESPONSE", "no message content");
        }
        return content.asText();
    }

    static String stripFences(String s) {
        if (s == null) return null;
        String t = s.strip();
        if (t.startsWith("```")) {
            int firstNl = t.indexOf('\n');
            t = (firstNl < 0) ? "" : t.substring(firstNl + 1);
            int end = t.lastIndexOf("```");
            if (end >= 0) t = t.substring(0, end);
        }
        return t.strip();
    }

    static boolean looksLikeHtml(String s) {
        if (s == null || s.isBlank()) return false;
        String lower = s.toLowerCase(Locale.ROOT);
        return lower.contains("<html") && lower.contains("</html>");
    }

    private static String nz(String s, String fallback) {
        return (s == null || s.isBlank()) ? fallback : s;
    }

    private static String preview(String s) {
        if (s == null) return "";
        String one = s.replaceAll("\\s+", " ");
        return one.length() <= PREVIEW_LEN ? one : one.substring(0, PREVIEW_LEN);
    }
}
