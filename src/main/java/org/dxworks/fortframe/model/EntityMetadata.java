package org.dxworks.fortframe.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;
import java.util.Set;

/**
 * Per-entity overrides read from the leading {@code key: value} lines of a documentation block.
 * A {@code null} field means "not set here"; inheritable settings are resolved during correlation.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class EntityMetadata {
    public static final Set<String> KEYS = Set.of(
            "author", "date", "version", "category", "summary", "deprecated",
            "display", "source", "graph", "proc_internals", "license");

    public String author;
    public String date;
    public String version;
    public String category;
    public String summary;
    public String license;
    public Boolean deprecated;
    public List<String> display;
    public Boolean source;
    public Boolean graph;
    public Boolean procInternals;

    @JsonIgnore
    public boolean isEmpty() {
        return author == null && date == null && version == null && category == null
                && summary == null && license == null && deprecated == null && display == null
                && source == null && graph == null && procInternals == null;
    }
}
