package im.arun.scenebridge.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The parsed design file: a document root plus the component metadata the design tool declares.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class DesignDocument {

    @JsonProperty("name")
    private String name;

    @JsonProperty("document")
    private DocumentNode document;

    @JsonProperty("components")
    private Map<String, ComponentDescription> components = new LinkedHashMap<>();

    public DesignDocument(String name, DocumentNode document) {
        this.name = name;
        this.document = document;
    }
}
