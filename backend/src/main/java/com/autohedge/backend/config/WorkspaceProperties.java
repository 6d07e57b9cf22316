package com.autohedge.backend.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "autohedge.workspace")
@Data
public class WorkspaceProperties {

    /** Directory receiving one JSON artifact per completed trade; blank disables file artifacts. */
    private String dir;

    public boolean isEnabled() {
        return dir != null && !dir.isBlank();
    }
}
