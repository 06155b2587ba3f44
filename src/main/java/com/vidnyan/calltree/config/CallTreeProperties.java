package com.vidnyan.calltree.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the call-tree engine.
 * Can be configured via application.yml or command-line arguments (--calltree.*).
 */
@Data
@Component
@ConfigurationProperties(prefix = "calltree")
public class CallTreeProperties {

    /**
     * Directory to scan. Empty = no analysis run on startup.
     */
    private String sourcePath = "";

    /**
     * File extensions treated as C sources.
     */
    private List<String> extensions = new ArrayList<>(List.of(".c"));

    /**
     * Parallel file scanners. Default: available processors
     */
    private int workerThreads = Runtime.getRuntime().availableProcessors();

    /**
     * Name prefix of Runtime-Environment calls.
     */
    private String rtePrefix = "Rte_";

    /**
     * Function to expand into a call tree. Empty = graph only.
     */
    private String rootFunction = "";

    private int maxDepth = 3;

    private boolean includeRte = true;

    /**
     * Where to write the JSON report. Empty = no export.
     */
    private String outputFile = "";
}
