package com.identityguardian.mitigation.controller;

import com.identityguardian.mitigation.scan.ComplianceReport;
import com.identityguardian.mitigation.scan.ComplianceScanService;
import com.identityguardian.mitigation.scan.DormantAccountReport;
import com.identityguardian.mitigation.scan.DormantAccountScanService;
import com.identityguardian.mitigation.scan.SegregationOfDutiesScanService;
import com.identityguardian.mitigation.scan.SodReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

/** Read-only tenant-wide scans. None of them changes the directory. */
@RestController
@RequestMapping("/api/v1/risk/scan")
public class ScanController {

    private static final Logger log = LoggerFactory.getLogger(ScanController.class);

    private final ComplianceScanService complianceScan;
    private final DormantAccountScanService dormantScan;
    private final SegregationOfDutiesScanService sodScan;

    public ScanController(ComplianceScanService complianceScan,
                          DormantAccountScanService dormantScan,
                          SegregationOfDutiesScanService sodScan) {
        this.complianceScan = complianceScan;
        this.dormantScan    = dormantScan;
        this.sodScan        = sodScan;
    }

    @PostMapping
    public Mono<ResponseEntity<ComplianceReport>> compliance() {
        log.info("Compliance scan requested");
        return complianceScan.scan()
            .map(ResponseEntity::ok)
            .doOnError(e -> log.error("Compliance scan endpoint error", e));
    }

    @PostMapping("/dormant")
    public Mono<ResponseEntity<DormantAccountReport>> dormant(@RequestParam(required = false) Integer inactiveDays) {
        log.info("Dormant account scan requested. inactiveDays={}", inactiveDays);
        Mono<DormantAccountReport> report = inactiveDays == null ? dormantScan.scan() : dormantScan.scan(inactiveDays);
        return report.map(ResponseEntity::ok);
    }

    @PostMapping("/sod")
    public Mono<ResponseEntity<SodReport>> segregationOfDuties() {
        log.info("Segregation of duties scan requested");
        return sodScan.scan().map(ResponseEntity::ok);
    }
}
