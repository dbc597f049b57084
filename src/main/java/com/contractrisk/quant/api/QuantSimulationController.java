package com.contractrisk.quant.api;

import com.contractrisk.quant.domain.model.RiskInput;
import com.contractrisk.quant.domain.model.SimulationResult;
import com.contractrisk.quant.domain.service.advisor.DistributionModelResolver;
import com.contractrisk.quant.domain.service.montecarlo.QuantitativeRiskService;
import com.contractrisk.quant.domain.service.montecarlo.SimulationRequest;
import com.contractrisk.quant.domain.service.snapshot.SnapshotMetadata;
import com.contractrisk.quant.domain.service.snapshot.SnapshotReader;
import com.contractrisk.quant.domain.service.snapshot.SnapshotView;
import com.contractrisk.quant.domain.service.snapshot.SnapshotWriter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/quant")
@RequiredArgsConstructor
@CrossOrigin(origins = "*")
public class QuantSimulationController {

    private final QuantitativeRiskService quantService;
    private final DistributionModelResolver distributionModelResolver;
    private final SnapshotWriter snapshotWriter;
    private final SnapshotReader snapshotReader;

    @PostMapping("/simulate")
    public ResponseEntity<SimulationRunResponse> simulate(@RequestBody SimulationRunRequest body) {
        int riskCount = body.getRisks() != null ? body.getRisks().size() : 0;
        log.info("[Quant API] 시뮬레이션 요청: project={}, revision={}, risks={}, iterations={}, target={}, seed={}",
                body.getProjectId(), body.getRevisionId(), riskCount,
                body.getIterations(), body.getTargetPercentile(), body.getSeed());

        // advisor fill-in happens here, before the register reaches the simulation core
        List<RiskInput> risks = distributionModelResolver.resolveMissing(body.getRisks());

        SimulationResult result = quantService.simulate(SimulationRequest.builder()
                .risks(risks)
                .iterations(body.getIterations())
                .targetPercentile(body.getTargetPercentile())
                .seed(body.getSeed())
                .build());

        Long snapshotId = null;
        if (body.hasSnapshotTarget()) {
            snapshotId = snapshotWriter.write(
                    new SnapshotMetadata(body.getProjectId(), body.getRevisionId()), result);
        }

        return ResponseEntity.ok(new SimulationRunResponse(result, snapshotId));
    }

    @GetMapping("/snapshots/latest")
    public ResponseEntity<Object> latest(@RequestParam String revisionId) {
        return snapshotReader.findLatest(revisionId)
                .<ResponseEntity<Object>>map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.ok(Map.of(
                        "success", false,
                        "revisionId", revisionId,
                        "message", "No simulation snapshot recorded for this revision yet. Run /api/quant/simulate with projectId and revisionId first.")));
    }

    @GetMapping("/snapshots")
    public ResponseEntity<List<SnapshotView>> listByProject(@RequestParam String projectId) {
        return ResponseEntity.ok(snapshotReader.findByProject(projectId));
    }
}
