package im.arun.scenebridge.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.regex.Pattern;

/**
 * Identity of a generated root across import runs: its slot plus a file-safe name.
 * Backups are paired with fresh roots by {@link #key()}, never by content.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class LogicalRoot {
    private static final Pattern UNSAFE = Pattern.compile("[<>:\"/\\\\|?*\\x00-\\x1F.]+");

    private RootKind kind;
    private String name;

    /**
     * Builds the root for a node name, appending {@code _n} for the n-th duplicate.
     */
    public static LogicalRoot of(RootKind kind, String nodeName, int duplicateCount) {
        String base = nodeName != null ? nodeName : "Untitled";
        if (duplicateCount > 0) {
            base += "_" + duplicateCount;
        }
        return new LogicalRoot(kind, safeFileName(base));
    }

    @JsonIgnore
    public String key() {
        return kind.getFolder() + "/" + name;
    }

    public static String safeFileName(String name) {
        return UNSAFE.matcher(name.trim()).replaceAll("_");
    }

    @Override
    public String toString() {
        return key();
    }
}
