package com.sparrowlogic.networktopology.catalog;

import com.sparrowlogic.networktopology.model.CustomerGateway;
import com.sparrowlogic.networktopology.model.DxConnection;
import com.sparrowlogic.networktopology.model.DxGateway;
import com.sparrowlogic.networktopology.model.DxVirtualInterface;
import com.sparrowlogic.networktopology.model.NatGateway;
import com.sparrowlogic.networktopology.model.Subnet;
import com.sparrowlogic.networktopology.model.TgwAttachment;
import com.sparrowlogic.networktopology.model.TgwRouteTable;
import com.sparrowlogic.networktopology.model.TransitGateway;
import com.sparrowlogic.networktopology.model.Vpc;
import com.sparrowlogic.networktopology.model.VpcPeering;
import com.sparrowlogic.networktopology.model.VpcRouteTable;
import com.sparrowlogic.networktopology.model.VpnConnection;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * In-memory store of one network snapshot, keyed by provider id.
 *
 * <p>A catalog is built for a single pipeline run: the correlator writes it, the subnet classifier
 * annotates it, and from then on the analyzer and the renderers only read it. Maps keep insertion
 * order so that findings and diagrams come out in feed order.
 */
public class NetworkCatalog {

    private final String localAccountId;

    private final Map<String, TransitGateway> transitGateways = new LinkedHashMap<>();
    private final Map<String, TgwRouteTable> tgwRouteTables = new LinkedHashMap<>();
    private final Map<String, TgwAttachment> tgwAttachments = new LinkedHashMap<>();
    private final Map<String, Vpc> vpcs = new LinkedHashMap<>();
    private final Map<String, VpcRouteTable> vpcRouteTables = new LinkedHashMap<>();
    private final Map<String, Subnet> subnets = new LinkedHashMap<>();
    private final Map<String, VpcPeering> peerings = new LinkedHashMap<>();
    private final Map<String, VpnConnection> vpnConnections = new LinkedHashMap<>();
    private final Map<String, CustomerGateway> customerGateways = new LinkedHashMap<>();
    private final Map<String, DxConnection> dxConnections = new LinkedHashMap<>();
    private final Map<String, DxVirtualInterface> dxVirtualInterfaces = new LinkedHashMap<>();
    private final Map<String, DxGateway> dxGateways = new LinkedHashMap<>();
    private final Map<String, String> internetGateways = new LinkedHashMap<>();
    private final Map<String, NatGateway> natGateways = new LinkedHashMap<>();
    private final Map<String, String> prefixLists = new LinkedHashMap<>();

    public NetworkCatalog(String localAccountId) {
        this.localAccountId = localAccountId != null ? localAccountId : "";
    }

    public String getLocalAccountId() {
        return localAccountId;
    }

    public Map<String, TransitGateway> getTransitGateways() {
        return transitGateways;
    }

    public Map<String, TgwRouteTable> getTgwRouteTables() {
        return tgwRouteTables;
    }

    public Map<String, TgwAttachment> getTgwAttachments() {
        return tgwAttachments;
    }

    public Map<String, Vpc> getVpcs() {
        return vpcs;
    }

    public Map<String, VpcRouteTable> getVpcRouteTables() {
        return vpcRouteTables;
    }

    public Map<String, Subnet> getSubnets() {
        return subnets;
    }

    public Map<String, VpcPeering> getPeerings() {
        return peerings;
    }

    public Map<String, VpnConnection> getVpnConnections() {
        return vpnConnections;
    }

    public Map<String, CustomerGateway> getCustomerGateways() {
        return customerGateways;
    }

    public Map<String, DxConnection> getDxConnections() {
        return dxConnections;
    }

    public Map<String, DxVirtualInterface> getDxVirtualInterfaces() {
        return dxVirtualInterfaces;
    }

    public Map<String, DxGateway> getDxGateways() {
        return dxGateways;
    }

    /**
     * Internet gateway id to the id of the VPC it is attached to.
     */
    public Map<String, String> getInternetGateways() {
        return internetGateways;
    }

    public Map<String, NatGateway> getNatGateways() {
        return natGateways;
    }

    /**
     * Prefix list id to friendly name.
     */
    public Map<String, String> getPrefixLists() {
        return prefixLists;
    }

    // Derived queries

    /**
     * True when this account owns at least one Transit Gateway.
     */
    public boolean isHub() {
        return !transitGateways.isEmpty();
    }

    /**
     * True when this account owns no Transit Gateway but has attachments into one.
     */
    public boolean isSpoke() {
        return transitGateways.isEmpty() && !tgwAttachments.isEmpty();
    }

    /**
     * Gateway ids named by attachments. For a spoke account this is the only way to name the
     * gateway it is plugged into.
     */
    public Set<String> referencedTgwIds() {
        var ids = new TreeSet<String>();
        tgwAttachments.values().stream()
            .map(TgwAttachment::getTgwId)
            .filter(id -> id != null && !id.isEmpty())
            .forEach(ids::add);
        return Collections.unmodifiableSet(ids);
    }

    public List<TgwAttachment> crossAccountAttachments() {
        return tgwAttachments.values().stream().filter(TgwAttachment::isCrossAccount).toList();
    }

    public List<TgwAttachment> localAttachments() {
        return tgwAttachments.values().stream().filter(a -> !a.isCrossAccount()).toList();
    }

    /**
     * Attachments grouped by the gateway they attach to, gateways in order of first appearance.
     */
    public Map<String, List<TgwAttachment>> attachmentsByGateway() {
        var grouped = new LinkedHashMap<String, List<TgwAttachment>>();
        tgwAttachments.values().forEach(att ->
            grouped.computeIfAbsent(att.getTgwId(), k -> new ArrayList<>()).add(att));
        return grouped;
    }

    public List<TgwRouteTable> routeTablesOfGateway(String tgwId) {
        return tgwRouteTables.values().stream().filter(rt -> rt.getTgwId().equals(tgwId)).toList();
    }

    public List<VpcRouteTable> routeTablesOfVpc(String vpcId) {
        return vpcRouteTables.values().stream().filter(rt -> rt.getVpcId().equals(vpcId)).toList();
    }

    public String prefixListName(String prefixListId) {
        return prefixLists.getOrDefault(prefixListId, prefixListId);
    }
}
