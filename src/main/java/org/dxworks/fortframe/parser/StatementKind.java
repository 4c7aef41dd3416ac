package org.dxworks.fortframe.parser;

import java.util.regex.Pattern;

/**
 * Statement kinds in matching order. The first kind whose pattern matches (and whose context guard
 * holds) classifies the statement. Patterns run on string-masked text and ignore case.
 */
public enum StatementKind {
    CONTAINS("^contains\\s*$"),
    ACCESS_DEFAULT("^(public|private|protected)\\s*$"),
    SEQUENCE("^sequence\\s*$"),
    FORMAT("^format\\s*\\(.*\\)\\s*$"),
    PARAMETER("^parameter\\s*\\((.*)\\)\\s*$"),
    ATTRIBUTE("^(asynchronous|allocatable|bind\\s*\\([^()]*\\)|data|dimension|external|intent\\s*\\(\\s*\\w+\\s*\\)"
            + "|optional|parameter|pointer|private|protected|public|save|target|value|volatile|contiguous)"
            + "(?:\\s+|\\s*::\\s*)((/|\\(|\\w).*?)\\s*$"),
    END("^end\\s*(?:(module|submodule|subroutine|function|procedure|program|type|interface|enum"
            + "|block\\s*data|block|associate)(?:\\s+(\\w.*?))?)?\\s*$"),
    MODULE_PROCEDURE("^(module\\s+)?procedure\\s*(?:::|\\s)\\s*(\\w.*)$"),
    BLOCK_DATA("^block\\s*data(?:\\s+(\\w+))?\\s*$"),
    BLOCK("^(?:\\w+\\s*:)?\\s*block\\s*$"),
    ASSOCIATE("^(?:\\w+\\s*:)?\\s*associate\\s*\\((.+)\\)\\s*$"),
    MODULE("^module(?:\\s+(\\w+))?\\s*$"),
    SUBMODULE("^submodule\\s*\\(\\s*(\\w+)\\s*(?::\\s*(\\w+))?\\s*\\)\\s*(\\w+)\\s*$"),
    PROGRAM("^program(?:\\s+(\\w+))?\\s*$"),
    SUBROUTINE("^(?:(.+?)\\s+)?subroutine\\s+(\\w+)\\s*(\\([^()]*\\))?(?:\\s*bind\\s*\\(\\s*([^()]*?)\\s*\\))?\\s*$"),
    NAMELIST("^namelist\\s*/\\s*(\\w+)\\s*/\\s*(.*)$"),
    FUNCTION("^(?:(.+?)\\s*)?function\\s+(\\w+)\\s*(\\([^()]*\\))?"
            + "(?=(?:.*result\\s*\\(\\s*(\\w+)\\s*\\))?)(?=(?:.*bind\\s*\\(\\s*([^()]*?)\\s*\\))?).*$"),
    DERIVED_TYPE("^type(?:\\s+|\\s*(,.*)?::\\s*)((?!(?:is\\s*\\())\\w+)\\s*(\\([^()]*\\))?\\s*$"),
    INTERFACE("^(abstract\\s+)?interface(?:\\s+(\\S.*?))?\\s*$"),
    ENUM("^enum(?:\\s*,\\s*bind\\s*\\(\\s*([^()]*?)\\s*\\))?(?:\\s*::\\s*(\\w+))?\\s*$"),
    BOUND_PROCEDURE("^(generic|procedure)\\s*(\\([^()]*\\))?\\s*(?:,\\s*(\\w[^:]*))?\\s*(?:::)?\\s*(\\w.*)$"),
    COMMON("^common(\\s*/.*|\\s+\\w.*)$"),
    FINAL("^final\\s*(?:::)?\\s*(\\w.*)$"),
    VARIABLE(null),
    USE("^use(?:\\s*(?:,\\s*((?:non_)?intrinsic)\\s*)?::\\s*|\\s+)(\\w+)\\s*($|,.*)"),
    ARITHMETIC_IF("^if\\s*\\(.*\\)\\s*\\d+\\s*,\\s*\\d+\\s*,\\s*\\d+\\s*$"),
    IGNORED("^(implicit|import|include|equivalence|entry|intrinsic|save|generic|external"
            + "|dimension|data|continue)\\b.*$"),
    EXECUTABLE(null);

    static final String VARIABLE_TYPES = "integer|real|double\\s*precision|character|complex|double\\s*complex"
            + "|logical|type(?!\\s+is)|class(?!\\s+is|\\s+default)|procedure|enumerator";

    private final Pattern pattern;

    StatementKind(String regex) {
        this.pattern = regex == null ? null : Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
    }

    Pattern pattern() {
        return pattern;
    }

    /** Declaration pattern, optionally extended with extra type keywords. */
    static Pattern variablePattern(Iterable<String> extraVartypes) {
        StringBuilder types = new StringBuilder(VARIABLE_TYPES);
        for (String extra : extraVartypes) {
            types.append('|').append(Pattern.quote(extra));
        }
        return Pattern.compile("^(" + types + ")\\s*((?:\\(|\\s\\w|[:,*]).*)$", Pattern.CASE_INSENSITIVE);
    }
}
