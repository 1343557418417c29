package com.vidnyan.hdlint;

import com.vidnyan.hdlint.domain.flow.FlowExtractor;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the analysis pipeline.
 * Can be configured via application.properties or application.yml
 */
@Data
@Component
@ConfigurationProperties(prefix = "hdlint.analysis")
public class AnalysisProperties {

    /**
     * Number of top units analyzed concurrently.
     */
    private int parallelism = Runtime.getRuntime().availableProcessors();

    /**
     * Upper bound on the control paths enumerated for a single process.
     */
    private int maxPathsPerProcess = FlowExtractor.DEFAULT_MAX_PATHS;

    /**
     * Top units to analyze when a request names none.
     * Default: every unit that no other unit instantiates
     */
    private List<String> topUnits = new ArrayList<>();
}
