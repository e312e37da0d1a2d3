package deskgate.core.model.upload;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A parsed multipart request: its file parts and its plain form fields.
 *
 * @param files every file part, in arrival order
 * @param fields every non-file field, by name
 */
public record UploadForm(List<UploadCandidate> files, Map<String, List<String>> fields) {

    public UploadForm {
        Objects.requireNonNull(files, "files must not be null");
        files = List.copyOf(files);
        fields = fields == null ? Map.of() : Map.copyOf(fields);
    }

    /**
     * Number of non-file values across all fields.
     *
     * @return the field value count
     */
    public int fieldCount() {
        return fields.values().stream().mapToInt(List::size).sum();
    }
}
