package com.sysmuse.leadership.model;

import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Populated content of one configured section: either a {@link TreeSection}
 * or a {@link ListSection}, chosen from the section's configuration.
 */
public abstract class HierarchySection {

    private final String key;

    protected HierarchySection(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }

    public abstract boolean isList();

    public abstract boolean isEmpty();

    /**
     * Every person held by this section in output order.
     */
    public abstract List<PersonInfo> getPersons();

    /**
     * Serialisable value: nested maps for trees, a list of records for lists.
     */
    public abstract Object toValue();

    abstract HierarchySection mapPersons(UnaryOperator<PersonInfo> mapper);
}
