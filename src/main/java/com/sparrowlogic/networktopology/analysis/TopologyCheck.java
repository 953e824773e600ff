package com.sparrowlogic.networktopology.analysis;

import com.sparrowlogic.networktopology.catalog.NetworkCatalog;
import com.sparrowlogic.networktopology.model.Finding;

import java.util.List;

/**
 * One independent inspection of a completed catalog. Checks only read the catalog, so the findings
 * of one never depend on whether another ran.
 */
public interface TopologyCheck {

    /**
     * Stable name used to enable or disable the check from configuration.
     */
    String name();

    List<Finding> run(NetworkCatalog catalog);
}
