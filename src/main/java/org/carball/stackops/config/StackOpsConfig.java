package org.carball.stackops.config;

import lombok.Data;

import java.nio.file.Path;

@Data
public class StackOpsConfig {
    private Path snapshotFile;
    private Path queryFile;
    private String checkName;
    private Integer checkDays;
    private String projectId;
    private String outputFile;
    private OutputFormat outputFormat;
    private Boolean prettyPrint;
    private String groupBy;
    private Path configFile;
    private boolean verbose;
    private QueryEngineConfig engineConfig;

    public boolean isCheckMode() {
        return checkName != null;
    }
}
