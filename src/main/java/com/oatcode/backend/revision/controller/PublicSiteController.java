package com.oatcode.backend.revision.controller;

import com.oatcode.backend.revision.service.ReviewGateService;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

@Tag(name = "Sites", description = "Live (approved) customer websites")
@RequiredArgsConstructor
@RestController
public class PublicSiteController {

    private final ReviewGateService gate;

    @GetMapping(value = "/sites/{customerId}", produces = MediaType.TEXT_HTML_VALUE)
    public String live(@PathVariable Long customerId) {
        return gate.liveHtml(customerId);
    }
}
