package com.sparrowlogic.networktopology.topology;

import com.sparrowlogic.networktopology.catalog.NetworkCatalog;
import com.sparrowlogic.networktopology.model.Subnet;
import com.sparrowlogic.networktopology.model.SubnetClass;
import com.sparrowlogic.networktopology.model.VpcRouteTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;

/**
 * Classifies each subnet by the first default route ({@code 0.0.0.0/0} or {@code ::/0}) of its
 * effective route table: the explicitly associated table, else the VPC's main table.
 */
public class SubnetClassifier {

    private static final Logger log = LoggerFactory.getLogger(SubnetClassifier.class);

    public void classify(NetworkCatalog catalog) {
        var counts = new EnumMap<SubnetClass, Integer>(SubnetClass.class);
        for (var subnet : catalog.getSubnets().values()) {
            var subnetClass = classify(subnet, catalog);
            subnet.setSubnetClass(subnetClass);
            counts.merge(subnetClass, 1, Integer::sum);
        }
        log.debug("Classified {} subnet(s): {}", catalog.getSubnets().size(), counts);
    }

    SubnetClass classify(Subnet subnet, NetworkCatalog catalog) {
        var routeTable = effectiveRouteTable(subnet, catalog);
        if (routeTable == null) {
            return SubnetClass.ISOLATED;
        }
        for (var route : routeTable.getRoutes()) {
            if (!route.isDefaultRoute()) {
                continue;
            }
            return switch (route.targetType()) {
                case IGW -> SubnetClass.PUBLIC;
                case NAT -> SubnetClass.PRIVATE;
                case TGW -> SubnetClass.TGW_ATTACHED;
                default -> SubnetClass.ISOLATED;
            };
        }
        return SubnetClass.ISOLATED;
    }

    static VpcRouteTable effectiveRouteTable(Subnet subnet, NetworkCatalog catalog) {
        var routeTableId = subnet.getRouteTableId();
        if (routeTableId == null) {
            var vpc = catalog.getVpcs().get(subnet.getVpcId());
            if (vpc != null) {
                routeTableId = vpc.getMainRouteTableId();
            }
        }
        return routeTableId != null ? catalog.getVpcRouteTables().get(routeTableId) : null;
    }
}
