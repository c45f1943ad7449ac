package im.arun.scenebridge.service;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import im.arun.scenebridge.model.GeneratedRoot;
import im.arun.scenebridge.model.ReconciliationPlan;
import im.arun.scenebridge.model.RenderClassification;
import im.arun.scenebridge.util.ImportDiagnostics;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything one import run hands back to the caller.
 */
@Data
@NoArgsConstructor
public class ImportResult {

    @JsonProperty("document_name")
    private String documentName;

    @JsonProperty("roots")
    private List<GeneratedRoot> roots = new ArrayList<>();

    @JsonProperty("classifications")
    private Map<String, RenderClassification> classifications = new LinkedHashMap<>();

    /** Image fill references to download, in first-seen order. */
    @JsonProperty("image_fill_ids")
    private List<String> imageFillIds = new ArrayList<>();

    @JsonIgnore
    private Map<String, byte[]> renderedImages = new LinkedHashMap<>();

    @JsonProperty("plan")
    private ReconciliationPlan plan = new ReconciliationPlan();

    @JsonProperty("diagnostics")
    private List<ImportDiagnostics.Entry> diagnostics = new ArrayList<>();

    @JsonProperty("missing_component_ids")
    private List<String> missingComponentIds = new ArrayList<>();

    @JsonProperty("promoted_component_ids")
    private List<String> promotedComponentIds = new ArrayList<>();

    /** Screen the prototype starts on, empty when the document defines no flow. */
    @JsonProperty("flow_start_screen_id")
    private String flowStartScreenId = "";
}
