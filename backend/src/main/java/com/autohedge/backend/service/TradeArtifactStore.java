package com.autohedge.backend.service;

import com.autohedge.backend.config.WorkspaceProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;

/**
 * Mirrors completed trade results to {@code <workspace>/<tradeId>.json}. A no-op when no
 * workspace directory is configured. The database stays the source of truth, so I/O failures
 * are logged and do not fail the trade.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TradeArtifactStore {

    private final WorkspaceProperties workspaceProperties;

    public void write(String tradeId, String json) {
        if (!workspaceProperties.isEnabled()) {
            return;
        }
        Path target = pathFor(tradeId);
        try {
            Files.createDirectories(target.getParent());
            Path tmp = target.resolveSibling(tradeId + ".json.tmp");
            Files.writeString(tmp, json, StandardCharsets.UTF_8);
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            log.debug("Wrote trade artifact {}", target);
        } catch (IOException e) {
            log.warn("Could not write trade artifact {}: {}", target, e.getMessage());
        }
    }

    public void delete(String tradeId) {
        if (!workspaceProperties.isEnabled()) {
            return;
        }
        Path target = pathFor(tradeId);
        try {
            if (Files.deleteIfExists(target)) {
                log.debug("Deleted trade artifact {}", target);
            }
        } catch (IOException e) {
            log.warn("Could not delete trade artifact {}: {}", target, e.getMessage());
        }
    }

    Path pathFor(String tradeId) {
        return Paths.get(workspaceProperties.getDir()).resolve(tradeId + ".json");
    }
}
