package com.previewenv.api.rest;

import com.previewenv.sweeper.PurgeReport;
import com.previewenv.sweeper.ReconcilingSweeper;
import com.previewenv.sweeper.SweepReport;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Manual sweeper passes, for operators and for deployments that run the schedule elsewhere.
 */
@RestController
@RequestMapping("/api/v1/sweeps")
public class SweepController {

    private final ReconcilingSweeper sweeper;

    public SweepController(ReconcilingSweeper sweeper) {
        this.sweeper = sweeper;
    }

    @PostMapping
    public ResponseEntity<SweepReport> sweep() {
        return ResponseEntity.ok(sweeper.sweep());
    }

    @PostMapping("/purge")
    public ResponseEntity<PurgeReport> purge() {
        return ResponseEntity.ok(sweeper.purge());
    }
}
