package com.tazifor.rotator.controller;

import com.tazifor.rotator.service.RotationService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.List;

/**
 * BannerController - Banner Serving Endpoint
 *
 * GET /?category=travel&category=cars
 *
 * 200 text/html  banner markup
 * 204            nothing to show for these categories
 *
 * "category[]" is accepted as well, for clients that encode arrays PHP style.
 */
@RestController
public class BannerController {

    @Autowired
    private RotationService rotationService;

    @GetMapping(value = "/", produces = MediaType.TEXT_HTML_VALUE)
    public ResponseEntity<String> serve(
            @RequestParam(name = "category", required = false) List<String> categories,
            @RequestParam(name = "category[]", required = false) List<String> bracketed) {

        List<String> requested = new ArrayList<>();
        if (categories != null) {
            requested.addAll(categories);
        }
        if (bracketed != null) {
            requested.addAll(bracketed);
        }

        return rotationService.serve(requested)
            .map(markup -> ResponseEntity.ok().contentType(MediaType.TEXT_HTML).body(markup))
            .orElseGet(() -> ResponseEntity.noContent().build());
    }
}
