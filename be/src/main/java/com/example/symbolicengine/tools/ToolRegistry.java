package com.example.symbolicengine.tools;

import java.util.List;

/**
 * Registry of agent tools by id.
 */
public interface ToolRegistry {

    /**
     * Returns tool instances for the given ids, in order. Unknown ids are skipped.
     */
    Object[] getTools(List<String> toolIds);

    /**
     * Returns the ids of all registered tools, sorted.
     */
    List<String> getAvailableToolIds();
}
