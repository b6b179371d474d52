package com.cdcportal.backend.modules.age.presentation;

import java.util.List;

import com.cdcportal.backend.modules.age.application.AgeBandCatalog;
import com.cdcportal.backend.modules.age.application.AgeBandCatalog.CatalogEntry;
import com.cdcportal.backend.modules.age.presentation.dto.AgeBandResponse;

import io.swagger.v3.oas.annotations.Operation;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/age-bands")
public class AgeBandController {

    private final AgeBandCatalog ageBandCatalog;

    public AgeBandController(AgeBandCatalog ageBandCatalog) {
        this.ageBandCatalog = ageBandCatalog;
    }

    @Operation(summary = "List age band catalog", description = "Catalog rows with parsed month ranges; unparseable rows are flagged.")
    @GetMapping
    public ResponseEntity<List<AgeBandResponse>> listAgeBands() {
        List<AgeBandResponse> response = ageBandCatalog.listEntries().stream()
                .map(this::toResponse)
                .toList();
        return ResponseEntity.ok(response);
    }

    private AgeBandResponse toResponse(CatalogEntry entry) {
        if (entry.range() == null) {
            return new AgeBandResponse(entry.id(), entry.rawRange(), false, null, null);
        }
        return new AgeBandResponse(entry.id(), entry.rawRange(), true,
                entry.range().minMonths(), entry.range().maxMonths());
    }
}
