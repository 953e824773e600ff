package com.sparrowlogic.networktopology.ingest;

/**
 * One per-type record batch of a snapshot, with the file the export script writes it to and the
 * top-level key the AWS CLI nests the records under.
 */
public enum ResourceKind {
    TRANSIT_GATEWAYS("transit-gateways.json", "TransitGateways"),
    TGW_ATTACHMENTS("transit-gateway-attachments.json", "TransitGatewayAttachments"),
    TGW_ROUTE_TABLES("transit-gateway-route-tables.json", "TransitGatewayRouteTables"),
    VPCS("vpcs.json", "Vpcs"),
    SUBNETS("subnets.json", "Subnets"),
    VPC_ROUTE_TABLES("vpc-route-tables.json", "RouteTables"),
    INTERNET_GATEWAYS("internet-gateways.json", "InternetGateways"),
    NAT_GATEWAYS("nat-gateways.json", "NatGateways"),
    VPC_PEERINGS("vpc-peering-connections.json", "VpcPeeringConnections"),
    VPN_CONNECTIONS("vpn-connections.json", "VpnConnections"),
    CUSTOMER_GATEWAYS("customer-gateways.json", "CustomerGateways"),
    DX_CONNECTIONS("dx-connections.json", "connections"),
    DX_GATEWAYS("dx-gateways.json", "directConnectGateways"),
    DX_VIRTUAL_INTERFACES("dx-vifs.json", "virtualInterfaces"),
    PREFIX_LISTS("prefix-lists.json", "PrefixLists");

    private final String fileName;
    private final String rootKey;

    ResourceKind(String fileName, String rootKey) {
        this.fileName = fileName;
        this.rootKey = rootKey;
    }

    public String fileName() {
        return fileName;
    }

    public String rootKey() {
        return rootKey;
    }
}
