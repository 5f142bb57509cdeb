package com.sysmuse.leadership.model;

import java.util.Map;

/**
 * Member of a list section, tagged with a key derived from the raw position text.
 */
public final class RosterEntry {

    private final String positionKey;
    private final PersonInfo person;

    public RosterEntry(String positionKey, PersonInfo person) {
        this.positionKey = positionKey;
        this.person = person;
    }

    public String getPositionKey() {
        return positionKey;
    }

    public PersonInfo getPerson() {
        return person;
    }

    public RosterEntry withPerson(PersonInfo updated) {
        return new RosterEntry(positionKey, updated);
    }

    public Map<String, Object> toRecord() {
        Map<String, Object> record = person.toRecord();
        record.put("position_key", positionKey);
        return record;
    }
}
