package com.sparrowlogic.networktopology.analysis;

import com.sparrowlogic.networktopology.catalog.NetworkCatalog;
import com.sparrowlogic.networktopology.model.Finding;
import com.sparrowlogic.networktopology.model.FindingKind;
import com.sparrowlogic.networktopology.model.Severity;

import java.util.ArrayList;
import java.util.List;

/**
 * Reports every overlapping CIDR pair between two different VPCs. Each unordered VPC pair is
 * compared once; CIDRs that do not parse are skipped.
 */
public class CidrOverlapCheck implements TopologyCheck {

    @Override
    public String name() {
        return "cidr-overlaps";
    }

    @Override
    public List<Finding> run(NetworkCatalog catalog) {
        var findings = new ArrayList<Finding>();
        var vpcs = new ArrayList<>(catalog.getVpcs().values());
        for (var i = 0; i < vpcs.size(); i++) {
            var vpc1 = vpcs.get(i);
            for (var j = i + 1; j < vpcs.size(); j++) {
                var vpc2 = vpcs.get(j);
                for (var cidr1 : vpc1.getCidrs()) {
                    for (var cidr2 : vpc2.getCidrs()) {
                        if (overlaps(cidr1, cidr2)) {
                            findings.add(new Finding(FindingKind.OVERLAP, Severity.WARNING,
                                vpc1.displayName() + " / " + vpc2.displayName(),
                                "CIDR overlap: " + vpc1.displayName() + " (" + cidr1 + ") overlaps with "
                                    + vpc2.displayName() + " (" + cidr2 + ")"));
                        }
                    }
                }
            }
        }
        return findings;
    }

    private static boolean overlaps(String cidr1, String cidr2) {
        var net1 = Cidr.parse(cidr1);
        var net2 = Cidr.parse(cidr2);
        return net1.isPresent() && net2.isPresent() && net1.get().overlaps(net2.get());
    }
}
