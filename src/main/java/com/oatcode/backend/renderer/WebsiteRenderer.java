package com.oatcode.backend.renderer;

/**
 * 外部網站產生器（LLM / 圖片 API）的邊界。
 * 同樣輸入可重複呼叫；結果不必逐字相同。失敗一律丟例外。
 */
public interface WebsiteRenderer {

    RenderedWebsite render(RenderInput input) throws Exception;

    String rendererCode();

    record RenderInput(
            Long customerId,
            String businessName,
            String industry,
            String email,
            String phone,
            String changeDescription,
            String currentHtml
    ) {}

    record RenderedWebsite(String html, String versionDescription) {}
}
