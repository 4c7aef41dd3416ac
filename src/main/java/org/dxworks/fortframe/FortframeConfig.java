package org.dxworks.fortframe;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.dxworks.fortframe.diagnostics.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable reader, parser and project settings. Built from {@link Settings}, which mirrors the
 * YAML file, and validated before any source is touched.
 */
public class FortframeConfig {
    private static final Logger logger = LoggerFactory.getLogger(FortframeConfig.class);

    private static final String CONFIG_FILE_NAME = "fortframe-config.yml";
    private static final Set<String> DISPLAY_VALUES = Set.of("public", "private", "protected", "none");

    private final String docmark;
    private final String docmarkAlt;
    private final String predocmark;
    private final String predocmarkAlt;
    private final List<String> extensions;
    private final List<String> fixedExtensions;
    private final List<String> fppExtensions;
    private final Map<String, String> extraFiletypes;
    private final boolean fixedLengthLimit;
    private final int fixedColumnLimit;
    private final Charset encoding;
    private final List<String> exclude;
    private final List<String> excludeDir;
    private final Map<String, String> extraMods;
    private final Map<String, String> external;
    private final List<String> display;
    private final boolean lower;
    private final boolean force;
    private final boolean strict;
    private final boolean warn;
    private final int parallel;
    private final List<String> macros;
    private final List<String> includeDirs;
    private final String preprocessor;
    private final boolean keepComments;
    private final boolean procInternals;
    private final List<String> extraVartypes;
    private final int maxNestingDepth;

    private FortframeConfig(Settings s) {
        this.docmark = s.docmark;
        this.docmarkAlt = s.docmarkAlt;
        this.predocmark = s.predocmark;
        this.predocmarkAlt = s.predocmarkAlt;
        this.extensions = List.copyOf(s.extensions);
        this.fixedExtensions = List.copyOf(s.fixedExtensions);
        this.fppExtensions = List.copyOf(s.fppExtensions);
        this.extraFiletypes = Collections.unmodifiableMap(new LinkedHashMap<>(s.extraFiletypes));
        this.fixedLengthLimit = s.fixedLengthLimit;
        this.fixedColumnLimit = s.fixedColumnLimit;
        this.encoding = Charset.forName(s.encoding);
        this.exclude = List.copyOf(s.exclude);
        this.excludeDir = List.copyOf(s.excludeDir);
        this.extraMods = Map.copyOf(s.extraMods);
        this.external = Map.copyOf(s.external);
        this.display = s.display.stream().map(String::toLowerCase).toList();
        this.lower = s.lower;
        this.force = s.force;
        this.strict = s.strict;
        this.warn = s.warn;
        this.parallel = s.parallel;
        this.macros = List.copyOf(s.macros);
        this.includeDirs = List.copyOf(s.includeDirs);
        this.preprocessor = s.preprocessor;
        this.keepComments = s.keepComments;
        this.procInternals = s.procInternals;
        this.extraVartypes = List.copyOf(s.extraVartypes);
        this.maxNestingDepth = s.maxNestingDepth;
    }

    public static FortframeConfig defaults() {
        return from(new Settings());
    }

    public static FortframeConfig from(Settings settings) {
        validate(settings);
        return new FortframeConfig(settings);
    }

    /** Reads {@value #CONFIG_FILE_NAME} from the working directory, or uses defaults when it is absent. */
    public static FortframeConfig load() {
        Path configPath = Paths.get(CONFIG_FILE_NAME);
        if (!Files.exists(configPath)) {
            return defaults();
        }
        return load(configPath);
    }

    public static FortframeConfig load(Path configPath) {
        try {
            ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory())
                    .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true);
            Settings settings = yamlMapper.readValue(configPath.toFile(), Settings.class);
            if (settings == null) {
                return defaults();
            }
            logger.debug("Loaded configuration from {}", configPath);
            return from(settings);
        } catch (IOException e) {
            throw new ConfigurationException("cannot read configuration " + configPath + ": " + e.getMessage(), e);
        }
    }

    private static void validate(Settings s) {
        Map<String, String> marks = new LinkedHashMap<>();
        marks.put("docmark", s.docmark);
        marks.put("docmarkAlt", s.docmarkAlt);
        marks.put("predocmark", s.predocmark);
        marks.put("predocmarkAlt", s.predocmarkAlt);
        List<Map.Entry<String, String>> entries = new ArrayList<>(marks.entrySet());
        for (Map.Entry<String, String> entry : entries) {
            if (entry.getValue() == null || entry.getValue().length() > 1) {
                throw new ConfigurationException(entry.getKey() + " must be a single character, got '" + entry.getValue() + "'");
            }
        }
        for (int i = 0; i < entries.size(); i++) {
            for (int j = i + 1; j < entries.size(); j++) {
                String a = entries.get(i).getValue();
                String b = entries.get(j).getValue();
                if (!a.isEmpty() && a.equals(b)) {
                    throw new ConfigurationException(entries.get(i).getKey() + " and " + entries.get(j).getKey()
                            + " are both '" + a + "'");
                }
            }
        }
        for (String ext : s.fixedExtensions) {
            if (s.extensions.contains(ext)) {
                throw new ConfigurationException("extension '" + ext + "' is listed as both free-form and fixed-form");
            }
        }
        for (Map.Entry<String, String> filetype : s.extraFiletypes.entrySet()) {
            if (filetype.getValue() == null || filetype.getValue().isBlank()) {
                throw new ConfigurationException("extra file type '" + filetype.getKey() + "' needs a comment marker");
            }
            if (s.extensions.contains(filetype.getKey()) || s.fixedExtensions.contains(filetype.getKey())
                    || s.fppExtensions.contains(filetype.getKey())) {
                throw new ConfigurationException("extension '" + filetype.getKey()
                        + "' is listed as both a Fortran and an extra file type");
            }
        }
        for (String module : s.extraMods.keySet()) {
            if (s.external.containsKey(module)) {
                throw new ConfigurationException("module '" + module + "' is listed in both extraMods and external");
            }
        }
        for (String value : s.display) {
            if (!DISPLAY_VALUES.contains(value.toLowerCase())) {
                throw new ConfigurationException("unknown display value '" + value + "'");
            }
        }
        if (s.parallel < 0) {
            throw new ConfigurationException("parallel must not be negative");
        }
        if (s.fixedColumnLimit < 7) {
            throw new ConfigurationException("fixedColumnLimit must leave room for a statement field");
        }
        if (s.maxNestingDepth < 1) {
            throw new ConfigurationException("maxNestingDepth must be positive");
        }
        if (!isSupportedCharset(s.encoding)) {
            throw new ConfigurationException("unknown encoding '" + s.encoding + "'");
        }
    }

    private static boolean isSupportedCharset(String name) {
        try {
            return name != null && Charset.isSupported(name);
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    public String getDocmark() {
        return docmark;
    }

    public String getDocmarkAlt() {
        return docmarkAlt;
    }

    public String getPredocmark() {
        return predocmark;
    }

    public String getPredocmarkAlt() {
        return predocmarkAlt;
    }

    public List<String> getExtensions() {
        return extensions;
    }

    public List<String> getFixedExtensions() {
        return fixedExtensions;
    }

    public List<String> getFppExtensions() {
        return fppExtensions;
    }

    /** Extension to comment marker of the non-Fortran files whose documentation is read. */
    public Map<String, String> getExtraFiletypes() {
        return extraFiletypes;
    }

    public boolean isFixedLengthLimit() {
        return fixedLengthLimit;
    }

    public int getFixedColumnLimit() {
        return fixedColumnLimit;
    }

    public Charset getEncoding() {
        return encoding;
    }

    public List<String> getExclude() {
        return exclude;
    }

    public List<String> getExcludeDir() {
        return excludeDir;
    }

    public Map<String, String> getExtraMods() {
        return extraMods;
    }

    public Map<String, String> getExternal() {
        return external;
    }

    public List<String> getDisplay() {
        return display;
    }

    public boolean isLower() {
        return lower;
    }

    public boolean isForce() {
        return force;
    }

    public boolean isStrict() {
        return strict;
    }

    public boolean isWarn() {
        return warn;
    }

    public int getParallel() {
        return parallel;
    }

    public List<String> getMacros() {
        return macros;
    }

    public List<String> getIncludeDirs() {
        return includeDirs;
    }

    public String getPreprocessor() {
        return preprocessor;
    }

    public boolean isKeepComments() {
        return keepComments;
    }

    public boolean isProcInternals() {
        return procInternals;
    }

    public List<String> getExtraVartypes() {
        return extraVartypes;
    }

    public int getMaxNestingDepth() {
        return maxNestingDepth;
    }

    /** Mutable mirror of the YAML file. Every field has a default. */
    public static class Settings {
        public String docmark = "!";
        public String docmarkAlt = "*";
        public String predocmark = ">";
        public String predocmarkAlt = "|";
        public List<String> extensions = new ArrayList<>(List.of("f90", "f95", "f03", "f08", "f15"));
        public List<String> fixedExtensions = new ArrayList<>(List.of("f", "for", "F", "FOR"));
        public List<String> fppExtensions = new ArrayList<>(List.of("F90", "F95", "F03", "F08", "F15", "F", "FOR"));
        public Map<String, String> extraFiletypes = new LinkedHashMap<>();
        public boolean fixedLengthLimit = true;
        public int fixedColumnLimit = 72;
        public String encoding = "UTF-8";
        public List<String> exclude = new ArrayList<>();
        public List<String> excludeDir = new ArrayList<>();
        public Map<String, String> extraMods = new LinkedHashMap<>();
        public Map<String, String> external = new LinkedHashMap<>();
        public List<String> display = new ArrayList<>(List.of("public", "protected"));
        public boolean lower;
        public boolean force;
        public boolean strict;
        public boolean warn;
        public int parallel;
        public List<String> macros = new ArrayList<>();
        public List<String> includeDirs = new ArrayList<>();
        public String preprocessor = "cpp -traditional-cpp -E -P -D__GFORTRAN__";
        public boolean keepComments;
        public boolean procInternals;
        public List<String> extraVartypes = new ArrayList<>();
        public int maxNestingDepth = 64;
    }
}
