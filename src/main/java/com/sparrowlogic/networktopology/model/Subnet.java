package com.sparrowlogic.networktopology.model;

public class Subnet {

    private final String id;
    private final String vpcId;
    private final String cidr;
    private final String availabilityZone;
    private final String name;
    private String routeTableId;
    private SubnetClass subnetClass = SubnetClass.ISOLATED;

    public Subnet(String id, String vpcId, String cidr, String availabilityZone, String name) {
        this.id = id;
        this.vpcId = vpcId;
        this.cidr = cidr;
        this.availabilityZone = availabilityZone;
        this.name = name;
    }

    public String getId() {
        return id;
    }

    public String getVpcId() {
        return vpcId;
    }

    public String getCidr() {
        return cidr;
    }

    public String getAvailabilityZone() {
        return availabilityZone;
    }

    public String getName() {
        return name;
    }

    public String displayName() {
        return name.isBlank() ? id : name;
    }

    /**
     * Explicitly associated route table, or {@code null} when the VPC's main table governs the subnet.
     */
    public String getRouteTableId() {
        return routeTableId;
    }

    public void setRouteTableId(String routeTableId) {
        this.routeTableId = routeTableId;
    }

    public SubnetClass getSubnetClass() {
        return subnetClass;
    }

    public void setSubnetClass(SubnetClass subnetClass) {
        this.subnetClass = subnetClass;
    }
}
