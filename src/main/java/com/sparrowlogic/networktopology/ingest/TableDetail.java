package com.sparrowlogic.networktopology.ingest;

/**
 * Per route table batches, exported once for every Transit Gateway route table as
 * {@code <prefix><route-table-id>.json}.
 */
public enum TableDetail {
    ROUTES("routes-", "Routes"),
    ASSOCIATIONS("associations-", "Associations"),
    PROPAGATIONS("propagations-", "TransitGatewayRouteTablePropagations");

    private final String filePrefix;
    private final String rootKey;

    TableDetail(String filePrefix, String rootKey) {
        this.filePrefix = filePrefix;
        this.rootKey = rootKey;
    }

    public String filePrefix() {
        return filePrefix;
    }

    public String rootKey() {
        return rootKey;
    }
}
