package im.arun.scenebridge.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Ordered list of what reconciliation decided for every root and node.
 */
@Data
public class ReconciliationPlan {

    @JsonProperty("entries")
    private final List<PlanEntry> entries = new ArrayList<>();

    public synchronized void add(String rootKey, String path, PlanAction action) {
        entries.add(new PlanEntry(rootKey, path, action));
    }

    public synchronized void addAll(ReconciliationPlan other) {
        entries.addAll(other.getEntries());
    }

    public List<PlanEntry> entriesFor(PlanAction action) {
        return entries.stream()
            .filter(entry -> entry.getAction() == action)
            .collect(Collectors.toList());
    }

    public List<PlanEntry> entriesForRoot(String rootKey) {
        return entries.stream()
            .filter(entry -> entry.getRootKey().equals(rootKey))
            .collect(Collectors.toList());
    }
}
