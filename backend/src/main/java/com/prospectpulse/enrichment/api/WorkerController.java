package com.prospectpulse.enrichment.api;

import com.prospectpulse.enrichment.model.WorkerDrainResponse;
import com.prospectpulse.enrichment.model.WorkerStatusResponse;
import com.prospectpulse.enrichment.service.WorkerDaemonService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/worker")
public class WorkerController {
    private final WorkerDaemonService daemonService;

    public WorkerController(WorkerDaemonService daemonService) {
        this.daemonService = daemonService;
    }

    @PostMapping("/start")
    public WorkerStatusResponse start() {
        daemonService.start();
        return daemonService.getStatus();
    }

    @PostMapping("/stop")
    public WorkerStatusResponse stop() {
        daemonService.stop();
        return daemonService.getStatus();
    }

    @GetMapping("/status")
    public WorkerStatusResponse status() {
        return daemonService.getStatus();
    }

    @PostMapping("/drain")
    public WorkerDrainResponse drain(
        @RequestParam(name = "max", required = false, defaultValue = "100") int max
    ) {
        return daemonService.drain(max);
    }
}
