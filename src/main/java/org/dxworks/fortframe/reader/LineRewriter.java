package org.dxworks.fortframe.reader;

import java.util.List;

/**
 * Rewrites physical source lines before they are read as statements.
 */
public interface LineRewriter {

	List<String> processLines(List<String> lines);

}
