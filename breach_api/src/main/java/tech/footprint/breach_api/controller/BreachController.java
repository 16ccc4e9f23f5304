package tech.footprint.breach_api.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import tech.footprint.breach_api.ClientAddresses;
import tech.footprint.breach_api.model.*;
import tech.footprint.breach_api.service.BreachCatalogService;
import tech.footprint.breach_api.service.BreachCheckService;
import tech.footprint.breach_api.service.BreachImportService;
import tech.footprint.breach_api.service.PasswordRangeService;

import java.util.List;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/breach")
@RequiredArgsConstructor
public class BreachController {

    private final BreachCheckService breachCheckService;
    private final PasswordRangeService passwordRangeService;
    private final BreachImportService breachImportService;
    private final BreachCatalogService breachCatalogService;

    @Tag(name = "Breach")
    @Operation(summary = "Check whether an email appears in a cached breach")
    @PostMapping("/check-email")
    public EmailCheckResponse checkEmail(@Valid @RequestBody EmailCheckRequest request, HttpServletRequest http) {
        return breachCheckService.checkEmail(request.getEmail(), ClientAddresses.of(http));
    }

    @Tag(name = "Breach")
    @Operation(summary = "k-anonymity range: SUFFIX:COUNT lines for a 5 character SHA-1 prefix")
    @GetMapping(value = "/password/range/{prefix}", produces = MediaType.TEXT_PLAIN_VALUE)
    public String passwordRange(@PathVariable String prefix,
                                @RequestParam(defaultValue = "false") boolean live) {
        List<PasswordRangeEntry> entries = passwordRangeService.range(prefix, live);
        return entries.stream().map(PasswordRangeEntry::toLine).collect(Collectors.joining("\n"));
    }

    @Tag(name = "Breach")
    @Operation(summary = "Check a SHA-1 password digest")
    @PostMapping("/check-password")
    public PasswordCheckResponse checkPassword(@Valid @RequestBody PasswordCheckRequest request) {
        return passwordRangeService.checkHash(request.getHash(), request.isLive());
    }

    @Tag(name = "Import")
    @PostMapping("/import")
    public ResponseEntity<BreachImportResponse> importBreach(@Valid @RequestBody BreachImportRequest request) {
        BreachImportResponse response = breachImportService.importBreach(request);
        return response.isCreated()
                ? ResponseEntity.status(201).body(response)
                : ResponseEntity.ok(response);
    }

    @Tag(name = "Import")
    @PostMapping("/password/import")
    public PasswordImportResponse importPasswords(@Valid @RequestBody PasswordImportRequest request) {
        return breachImportService.importPasswords(request);
    }

    @Tag(name = "Catalog")
    @GetMapping("/breaches")
    public BreachListResponse breaches() {
        List<BreachSummary> breaches = breachCatalogService.listBreaches();
        return new BreachListResponse(breaches.size(), breaches);
    }

    @Tag(name = "Catalog")
    @GetMapping("/breaches/{name}")
    public BreachSummary breach(@PathVariable String name) {
        return breachCatalogService.findBreach(name);
    }

    @Tag(name = "Catalog")
    @GetMapping("/stats")
    public BreachStats stats() {
        return breachCatalogService.stats();
    }
}
