package com.genflow.quality;

import com.genflow.core.generation.GenerationException;
import com.genflow.quality.model.FixResult;

import java.util.List;

/**
 * Produces a revised version of content addressing a list of issues.
 */
@FunctionalInterface
public interface ContentFixer {
    
    /**
     * One fix pass.
     *
     * @param content     current content
     * @param issues      issues to address, in priority order
     * @param contentType content type, e.g. {@code prd}
     * @return revised content; unchanged content when nothing could be fixed
     */
    FixResult fix(String content, List<String> issues, String contentType) throws GenerationException;
}
