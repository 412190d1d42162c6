package fr.lapetina.llama.orchestrator.backend;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Contents of {@code installed.json}, written last by a successful install.
 */
public record InstallMarker(
        @JsonProperty("version") String version,
        @JsonProperty("backend_id") String backendId,
        @JsonProperty("cuda_version") String cudaVersion,
        @JsonProperty("asset_name") String assetName,
        @JsonProperty("installed_date") String installedDate,
        @JsonProperty("platform") String platform,
        @JsonProperty("arch") String arch
) {
    public static final String FILE_NAME = "installed.json";
}
