package com.modelrouter.router.controller;

import com.modelrouter.common.scoring.AbilityCheckpoint;
import com.modelrouter.router.policy.PolicyStore;
import com.modelrouter.router.scoring.AbilityCheckpointHolder;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/admin")
public class AdminController {

    private final AbilityCheckpointHolder checkpointHolder;
    private final PolicyStore policyStore;

    public AdminController(AbilityCheckpointHolder checkpointHolder, PolicyStore policyStore) {
        this.checkpointHolder = checkpointHolder;
        this.policyStore      = policyStore;
    }

    @PostMapping("/checkpoint/reload")
    public Map<String, Object> reloadCheckpoint() {
        AbilityCheckpoint loaded = checkpointHolder.reload();
        return Map.of(
            "version",    loaded.version(),
            "dimensions", loaded.dimensions(),
            "models",     loaded.abilities().size());
    }

    @PostMapping("/policies/invalidate")
    public ResponseEntity<Void> invalidatePolicies() {
        policyStore.invalidate();
        return ResponseEntity.noContent().build();
    }
}
