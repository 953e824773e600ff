package com.sparrowlogic.networktopology.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A Transit Gateway route table. Routes are kept in feed order; associations and propagations are
 * filled in by the correlator and only contain attachments whose membership is settled.
 */
public class TgwRouteTable {

    private final String id;
    private final String tgwId;
    private final String name;
    private final boolean defaultAssociation;
    private final boolean defaultPropagation;
    private final List<TgwRoute> routes = new ArrayList<>();
    private final Set<String> associations = new LinkedHashSet<>();
    private final Set<String> propagations = new LinkedHashSet<>();

    public TgwRouteTable(String id, String tgwId, String name, boolean defaultAssociation, boolean defaultPropagation) {
        this.id = id;
        this.tgwId = tgwId;
        this.name = name;
        this.defaultAssociation = defaultAssociation;
        this.defaultPropagation = defaultPropagation;
    }

    public String getId() {
        return id;
    }

    public String getTgwId() {
        return tgwId;
    }

    public String getName() {
        return name;
    }

    public String displayName() {
        return name.isBlank() ? id : name;
    }

    public boolean isDefaultAssociation() {
        return defaultAssociation;
    }

    public boolean isDefaultPropagation() {
        return defaultPropagation;
    }

    public List<TgwRoute> getRoutes() {
        return Collections.unmodifiableList(routes);
    }

    public void addRoute(TgwRoute route) {
        routes.add(route);
    }

    public Set<String> getAssociations() {
        return Collections.unmodifiableSet(associations);
    }

    public void addAssociation(String attachmentId) {
        associations.add(attachmentId);
    }

    public Set<String> getPropagations() {
        return Collections.unmodifiableSet(propagations);
    }

    public void addPropagation(String attachmentId) {
        propagations.add(attachmentId);
    }
}
