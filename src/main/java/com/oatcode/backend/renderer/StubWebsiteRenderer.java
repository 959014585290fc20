package com.oatcode.backend.renderer;

import org.springframework.web.util.HtmlUtils;

/**
 * 不打外網的 renderer：依客戶資料 + 修改描述組出固定版型，dev / test 用
 */
public class StubWebsiteRenderer implements WebsiteRenderer {

    @Override
    public String rendererCode() { return "STUB"; }

    @Override
    public RenderedWebsite render(RenderInput input) {
        String name = esc(input.businessName() == null ? "Your Business" : input.businessName());
        String industry = esc(input.industry() == null ? "services" : input.industry());
        String changes = esc(input.changeDescription() == null ? "" : input.changeDescription());

        String html = """
                <!DOCTYPE html>
                <html lang="en">
                <head><meta charset="UTF-8"><title>%s</title></head>
                <body>
                    <header><h1>%s</h1><p>Trusted %s professionals</p></header>
                    <section class="notes"><h2>Latest changes</h2><pre>%s</pre></section>
                    <section class="contact">
                        <h2>Get In Touch</h2>
                        <p>Phone: %s</p>
                        <p>Email: %s</p>
                    </section>
                </body>
                </html>
                """.formatted(name, name, industry, changes,
                esc(input.phone() == null ? "(555) 123-4567" : input.phone()),
                esc(input.email() == null ? "" : input.email()));

        return new RenderedWebsite(html, summarize(input.changeDescription()));
    }

    static String summarize(String description) {
        if (description == null || description.isBlank()) return "Initial version";
        String oneLine = description.strip().replaceAll("\\s+", " ");
        return oneLine.length() <= 200 ? oneLine : oneLine.substring(0, 197) + "...";
    }

    private static String esc(String s) {
        return HtmlUtils.htmlEscape(s);
    }
}
