package com.sparrowlogic.networktopology.analysis;

import com.sparrowlogic.networktopology.catalog.NetworkCatalog;
import com.sparrowlogic.networktopology.model.Finding;
import com.sparrowlogic.networktopology.model.FindingKind;
import com.sparrowlogic.networktopology.model.Severity;

import java.util.List;

public class PeeringStatusCheck implements TopologyCheck {

    @Override
    public String name() {
        return "inactive-peerings";
    }

    @Override
    public List<Finding> run(NetworkCatalog catalog) {
        return catalog.getPeerings().values().stream()
            .filter(pcx -> !pcx.isActive())
            .map(pcx -> new Finding(FindingKind.PEERING, Severity.WARNING, pcx.displayName(),
                "VPC Peering " + pcx.displayName() + " is not active (status: " + pcx.status() + ")"))
            .toList();
    }
}
