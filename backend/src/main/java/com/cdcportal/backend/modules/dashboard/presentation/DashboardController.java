package com.cdcportal.backend.modules.dashboard.presentation;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.cdcportal.backend.global.security.SecurityUtils;
import com.cdcportal.backend.modules.dashboard.application.DashboardService;
import com.cdcportal.backend.modules.dashboard.application.DashboardService.AgeDistribution;
import com.cdcportal.backend.modules.dashboard.application.DashboardService.GeographyFilter;
import com.cdcportal.backend.modules.dashboard.presentation.dto.AgeDistributionResponse;
import com.cdcportal.backend.modules.dashboard.presentation.dto.CdcDistributionResponse;

import io.swagger.v3.oas.annotations.Operation;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/dashboard")
public class DashboardController {

    private final DashboardService dashboardService;

    public DashboardController(DashboardService dashboardService) {
        this.dashboardService = dashboardService;
    }

    @Operation(summary = "Enrolled children per age bucket")
    @GetMapping("/age-distribution")
    public ResponseEntity<AgeDistributionResponse> ageDistribution(
            @RequestParam(name = "province", required = false) String province,
            @RequestParam(name = "municipality", required = false) String municipality,
            @RequestParam(name = "barangay", required = false) String barangay
    ) {
        AgeDistribution distribution = dashboardService.ageDistribution(SecurityUtils.getCurrentIdentity(),
                new GeographyFilter(province, municipality, barangay));
        Map<String, Long> buckets = new LinkedHashMap<>();
        distribution.counts().forEach((bucket, count) -> buckets.put(bucket.label(), count));
        return ResponseEntity.ok(new AgeDistributionResponse(buckets, distribution.total()));
    }

    @Operation(summary = "Enrolled children per active CDC")
    @GetMapping("/cdc-distribution")
    public ResponseEntity<CdcDistributionResponse> cdcDistribution() {
        List<CdcDistributionResponse.Item> items = dashboardService.tenantDistribution(SecurityUtils.getCurrentIdentity())
                .stream()
                .map(count -> new CdcDistributionResponse.Item(count.tenantId(), count.tenantName(), count.students()))
                .toList();
        long total = items.stream().mapToLong(CdcDistributionResponse.Item::students).sum();
        return ResponseEntity.ok(new CdcDistributionResponse(items, total));
    }
}
