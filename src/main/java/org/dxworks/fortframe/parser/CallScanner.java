package org.dxworks.fortframe.parser;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lexical scan of executable statements for procedure references. Produces lower-cased call chains
 * such as {@code [solver, step]} for {@code call solver%step(dt)}. No semantic check is made;
 * array references look like function calls and are sorted out during correlation.
 */
final class CallScanner {
    private static final String CHAIN = "((?:[a-z_]\\w*\\s*(?:\\([^()]*\\))?\\s*%\\s*)*[a-z_]\\w*)";
    private static final Pattern SUBROUTINE_CALL = Pattern.compile(
            "^(?:if\\s*\\(.*\\)\\s*)?call\\s+" + CHAIN, Pattern.CASE_INSENSITIVE);
    private static final Pattern FUNCTION_REFERENCE = Pattern.compile(
            "(?<![\\w%.])" + CHAIN + "\\s*\\(", Pattern.CASE_INSENSITIVE);
    private static final Pattern CHAIN_SEPARATOR = Pattern.compile("\\s*%\\s*");
    private static final Pattern INDEX = Pattern.compile("\\([^()]*\\)");

    private static final Set<String> KEYWORDS = Set.of(
            "if", "elseif", "then", "else", "while", "case", "select", "selectcase", "where", "elsewhere",
            "forall", "do", "concurrent", "print", "write", "read", "allocate", "deallocate", "open", "close",
            "inquire", "rewind", "backspace", "endfile", "flush", "wait", "format", "return", "stop", "error",
            "go", "goto", "call", "nullify", "associate", "block", "type", "class", "rank", "result", "sync",
            "images", "memory", "lock", "unlock", "critical", "change", "team", "event", "post", "fail",
            "exit", "cycle", "continue", "pause", "data", "entry", "dimension", "intent", "kind", "len",
            "in", "out", "inout", "default", "is", "real", "integer", "logical", "character", "complex");

    private CallScanner() {
        // utility class
    }

    /** Chains referenced by one executable statement, in order of appearance, without duplicates. */
    static List<List<String>> scan(String maskedStatement) {
        List<List<String>> chains = new ArrayList<>();
        Matcher call = SUBROUTINE_CALL.matcher(maskedStatement);
        if (call.find()) {
            addChain(chains, call.group(1));
        }
        Matcher reference = FUNCTION_REFERENCE.matcher(maskedStatement);
        while (reference.find()) {
            addChain(chains, reference.group(1));
        }
        return chains;
    }

    static void addChain(List<List<String>> chains, String text) {
        String stripped = text;
        String previous;
        do {
            previous = stripped;
            stripped = INDEX.matcher(stripped).replaceAll("");
        } while (!stripped.equals(previous));
        List<String> chain = Arrays.stream(CHAIN_SEPARATOR.split(stripped.trim().toLowerCase(Locale.ROOT)))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
        if (chain.isEmpty()) {
            return;
        }
        if (chain.size() == 1 && KEYWORDS.contains(chain.get(0))) {
            return;
        }
        if (!chains.contains(chain)) {
            chains.add(chain);
        }
    }
}
