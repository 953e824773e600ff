package com.sparrowlogic.networktopology.analysis;

import com.sparrowlogic.networktopology.catalog.NetworkCatalog;
import com.sparrowlogic.networktopology.model.FindingKind;
import org.junit.jupiter.api.Test;

import static com.sparrowlogic.networktopology.analysis.TestCatalogs.*;
import static org.junit.jupiter.api.Assertions.*;

class CidrOverlapCheckTest {

    private final CidrOverlapCheck check = new CidrOverlapCheck();

    @Test
    void shouldReportOverlappingPairOnce() {
        var catalog = new NetworkCatalog(ACCOUNT);
        vpc(catalog, "vpc-a", "10.0.0.0/16");
        vpc(catalog, "vpc-b", "10.0.5.0/24");

        var findings = check.run(catalog);

        assertEquals(1, findings.size());
        assertEquals(FindingKind.OVERLAP, findings.get(0).kind());
        assertEquals("vpc-a / vpc-b", findings.get(0).location());
        assertEquals("CIDR overlap: vpc-a (10.0.0.0/16) overlaps with vpc-b (10.0.5.0/24)", findings.get(0).message());
    }

    @Test
    void shouldReportSameResultRegardlessOfOrder() {
        var catalog = new NetworkCatalog(ACCOUNT);
        vpc(catalog, "vpc-b", "10.0.5.0/24");
        vpc(catalog, "vpc-a", "10.0.0.0/16");

        assertEquals(1, check.run(catalog).size());
    }

    @Test
    void shouldNotCompareVpcWithItself() {
        var catalog = new NetworkCatalog(ACCOUNT);
        vpc(catalog, "vpc-a", "10.0.0.0/16", "10.0.0.0/16");

        assertTrue(check.run(catalog).isEmpty());
    }

    @Test
    void shouldSkipUnparseableAndMixedFamilyCidrs() {
        var catalog = new NetworkCatalog(ACCOUNT);
        vpc(catalog, "vpc-a", "garbage", "10.0.0.0/16");
        vpc(catalog, "vpc-b", "garbage", "2001:db8::/32");

        assertTrue(check.run(catalog).isEmpty());
    }

    @Test
    void shouldSkipCidrWithLeadingZeroOctet() {
        var catalog = new NetworkCatalog(ACCOUNT);
        vpc(catalog, "vpc-a", "010.0.0.0/16");
        vpc(catalog, "vpc-b", "10.0.5.0/24");

        assertTrue(check.run(catalog).isEmpty());
    }

    @Test
    void shouldReportEachOverlappingCidrPair() {
        var catalog = new NetworkCatalog(ACCOUNT);
        vpc(catalog, "vpc-a", "10.0.0.0/16", "10.1.0.0/16");
        vpc(catalog, "vpc-b", "10.0.0.0/8");

        assertEquals(2, check.run(catalog).size());
    }
}
