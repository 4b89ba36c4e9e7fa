package com.shomee.spices.controller;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import com.shomee.spices.dto.DiagnosticsReport;
import com.shomee.spices.dto.MessageResponse;
import com.shomee.spices.service.DiagnosticsService;

@RestController
public class RootController {

    private static final Logger logger = LoggerFactory.getLogger(RootController.class);

    static final String RUNNING_MESSAGE = "Shomee Spices Backend Running";

    private final DiagnosticsService diagnosticsService;

    public RootController(DiagnosticsService diagnosticsService) {
        this.diagnosticsService = diagnosticsService;
    }

    @GetMapping("/")
    public MessageResponse root() {
        return new MessageResponse(RUNNING_MESSAGE);
    }

    @GetMapping("/test")
    public DiagnosticsReport test() {
        DiagnosticsReport report = diagnosticsService.probe();
        logger.atInfo().log("Probe: database={}, status={}", report.database(), report.connectionStatus());
        return report;
    }
}
