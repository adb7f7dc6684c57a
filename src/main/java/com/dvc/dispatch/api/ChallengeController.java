package com.dvc.dispatch.api;

import com.dvc.core.catalog.ChallengeCatalog;
import com.dvc.core.model.ChallengeDefinition;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Read-only access to the challenge catalog.
 */
@RestController
@RequestMapping("/api/v1/challenges")
public class ChallengeController {

    private final ChallengeCatalog catalog;

    public ChallengeController(ChallengeCatalog catalog) {
        this.catalog = catalog;
    }

    @GetMapping
    public List<ChallengeDefinition> list() {
        return catalog.list();
    }

    @GetMapping("/{challengeId}")
    public ResponseEntity<Object> get(@PathVariable String challengeId) {
        return catalog.find(challengeId)
                .<ResponseEntity<Object>>map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.status(404).body(Map.of(
                        "error", "Not Found",
                        "kind", "UNKNOWN_CHALLENGE",
                        "message", "Unknown challenge: " + challengeId)));
    }
}
