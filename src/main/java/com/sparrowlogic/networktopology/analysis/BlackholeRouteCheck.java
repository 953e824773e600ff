package com.sparrowlogic.networktopology.analysis;

import com.sparrowlogic.networktopology.catalog.NetworkCatalog;
import com.sparrowlogic.networktopology.model.Finding;
import com.sparrowlogic.networktopology.model.FindingKind;
import com.sparrowlogic.networktopology.model.Severity;

import java.util.ArrayList;
import java.util.List;

public class BlackholeRouteCheck implements TopologyCheck {

    @Override
    public String name() {
        return "blackhole-routes";
    }

    @Override
    public List<Finding> run(NetworkCatalog catalog) {
        var findings = new ArrayList<Finding>();
        for (var rt : catalog.getTgwRouteTables().values()) {
            for (var route : rt.getRoutes()) {
                if (route.isBlackhole()) {
                    findings.add(new Finding(FindingKind.BLACKHOLE, Severity.WARNING, rt.displayName(),
                        "Blackhole route to " + route.destination() + " in " + rt.displayName()));
                }
            }
        }
        return findings;
    }
}
