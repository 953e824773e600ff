package com.sparrowlogic.networktopology.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class VpcRouteTable {

    private final String id;
    private final String vpcId;
    private final String name;
    private boolean main;
    private final List<VpcRoute> routes;
    private final List<String> subnetIds = new ArrayList<>();

    public VpcRouteTable(String id, String vpcId, String name, List<VpcRoute> routes) {
        this.id = id;
        this.vpcId = vpcId;
        this.name = name;
        this.routes = List.copyOf(routes);
    }

    public String getId() {
        return id;
    }

    public String getVpcId() {
        return vpcId;
    }

    public String getName() {
        return name;
    }

    public String displayName() {
        return name.isBlank() ? id : name;
    }

    public boolean isMain() {
        return main;
    }

    public void markMain() {
        this.main = true;
    }

    public List<VpcRoute> getRoutes() {
        return routes;
    }

    public List<String> getSubnetIds() {
        return Collections.unmodifiableList(subnetIds);
    }

    public void addSubnetId(String subnetId) {
        if (!subnetIds.contains(subnetId)) {
            subnetIds.add(subnetId);
        }
    }
}
