package im.arun.scenebridge.config;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class SceneBridgeConfig {
    private boolean onlyImportSelectedPages = false;
    private boolean onlyImportImagesFromSelectedPages = false;
    private List<String> selectedPageIds = new ArrayList<>();
    private boolean centerPivot = true;
    private boolean applyDelta = true;
    private boolean updateBackups = true;
    private boolean parallelClassification = false;
    private String assetRootPath = "Assets/Figma";
}
