package com.sparrowlogic.networktopology.analysis;

import com.sparrowlogic.networktopology.catalog.NetworkCatalog;
import com.sparrowlogic.networktopology.model.Finding;
import com.sparrowlogic.networktopology.model.FindingKind;
import com.sparrowlogic.networktopology.model.RouteOrigin;
import com.sparrowlogic.networktopology.model.RouteState;
import com.sparrowlogic.networktopology.model.Severity;
import com.sparrowlogic.networktopology.model.TgwRoute;
import com.sparrowlogic.networktopology.model.TransitGateway;
import com.sparrowlogic.networktopology.model.VpcPeering;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static com.sparrowlogic.networktopology.analysis.TestCatalogs.*;
import static org.junit.jupiter.api.Assertions.*;

class ConnectivityAnalyzerTest {

    @Test
    void shouldRunDefaultChecksInFixedOrder() {
        var names = ConnectivityAnalyzer.withDefaultChecks().getChecks().stream().map(TopologyCheck::name).toList();

        assertEquals(List.of("blackhole-routes", "asymmetric-routing", "inactive-peerings", "cidr-overlaps",
            "missing-tgw-routes", "vpn-tunnels", "direct-connect"), names);
    }

    @Test
    void shouldSkipDisabledChecks() {
        var analyzer = ConnectivityAnalyzer.withDefaultChecksExcept(Set.of("cidr-overlaps", "no-such-check"));

        assertEquals(6, analyzer.getChecks().size());
        assertTrue(analyzer.getChecks().stream().noneMatch(c -> c instanceof CidrOverlapCheck));
    }

    @Test
    void shouldReportEmptyCatalogAsClean() {
        assertTrue(ConnectivityAnalyzer.withDefaultChecks().findIssues(new NetworkCatalog("")).isEmpty());
    }

    @Test
    void shouldReportSingleBlackholeForStaticRouteAndBlackhole() {
        var catalog = new NetworkCatalog(ACCOUNT);
        catalog.getTransitGateways().put("tgw-1", new TransitGateway("tgw-1", "core", ACCOUNT, 64512, "available"));
        var rt = routeTable(catalog, "rt-1");
        vpcAttachment(catalog, "X", "172.16.0.0/12", rt);
        rt.addRoute(new TgwRoute("172.16.0.0/12", null, "X", "vpc-X", "vpc", RouteOrigin.STATIC, RouteState.ACTIVE));
        rt.addRoute(blackhole("192.168.0.0/16"));
        vpc(catalog, "vpc-unattached", "10.0.0.0/16");

        var findings = ConnectivityAnalyzer.withDefaultChecks().findIssues(catalog);

        assertEquals(1, findings.stream().filter(f -> f.kind() == FindingKind.BLACKHOLE).count());
        assertEquals(0, findings.stream().filter(f -> f.kind() == FindingKind.MISSING_ROUTE).count());
    }

    @Test
    void shouldKeepFindingsOfEachCheckContiguous() {
        var catalog = new NetworkCatalog(ACCOUNT);
        var rt = routeTable(catalog, "rt-1");
        rt.addRoute(blackhole("192.168.0.0/16"));
        vpc(catalog, "vpc-a", "10.0.0.0/16");
        vpc(catalog, "vpc-b", "10.0.0.0/24");
        catalog.getPeerings().put("pcx-1", new VpcPeering("pcx-1", "", "failed", "vpc-a", "", "vpc-b", ""));

        var kinds = ConnectivityAnalyzer.withDefaultChecks().findIssues(catalog).stream().map(Finding::kind).toList();

        assertEquals(List.of(FindingKind.BLACKHOLE, FindingKind.PEERING, FindingKind.OVERLAP), kinds);
    }

    @Test
    void shouldRunCustomChecks() {
        TopologyCheck alwaysFails = new TopologyCheck() {
            @Override
            public String name() {
                return "always";
            }

            @Override
            public List<Finding> run(NetworkCatalog catalog) {
                return List.of(new Finding(FindingKind.BLACKHOLE, Severity.ERROR, "here", "broken"));
            }
        };

        var findings = new ConnectivityAnalyzer(List.of(alwaysFails, alwaysFails)).findIssues(new NetworkCatalog(""));

        assertEquals(2, findings.size());
    }
}
