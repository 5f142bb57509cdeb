package com.sysmuse.leadership.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;

/**
 * Flat member list; vacant members are kept like any other row.
 */
public class ListSection extends HierarchySection {

    private final List<RosterEntry> members = new ArrayList<>();

    public ListSection(String key) {
        super(key);
    }

    @Override
    public boolean isList() {
        return true;
    }

    @Override
    public boolean isEmpty() {
        return members.isEmpty();
    }

    void add(RosterEntry entry) {
        members.add(entry);
    }

    public List<RosterEntry> getMembers() {
        return Collections.unmodifiableList(members);
    }

    @Override
    public List<PersonInfo> getPersons() {
        List<PersonInfo> persons = new ArrayList<>(members.size());
        for (RosterEntry entry : members) {
            persons.add(entry.getPerson());
        }
        return persons;
    }

    @Override
    public List<Map<String, Object>> toValue() {
        List<Map<String, Object>> records = new ArrayList<>(members.size());
        for (RosterEntry entry : members) {
            records.add(entry.toRecord());
        }
        return records;
    }

    @Override
    ListSection mapPersons(UnaryOperator<PersonInfo> mapper) {
        ListSection copy = new ListSection(getKey());
        for (RosterEntry entry : members) {
            copy.members.add(entry.withPerson(mapper.apply(entry.getPerson())));
        }
        return copy;
    }
}
