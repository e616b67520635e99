package com.smurthy.ai.agri.controllers;

import com.smurthy.ai.agri.observability.DispatchMetrics;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Monitoring endpoint
 */
@RestController
@RequestMapping("/monitoring")
class MonitoringController {

    private final DispatchMetrics dispatchMetrics;

    public MonitoringController(DispatchMetrics dispatchMetrics) {
        this.dispatchMetrics = dispatchMetrics;
    }

    @GetMapping("/dispatch")
    public DispatchMetrics.MetricsSummary getDispatchMetrics() {
        return dispatchMetrics.getMetricsSummary();
    }

    @PostMapping("/dispatch/reset")
    public void resetDispatchMetrics() {
        dispatchMetrics.resetMetrics();
    }
}
