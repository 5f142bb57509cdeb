package com.sysmuse.leadership.model;

import com.sysmuse.leadership.config.PositionConfig;
import com.sysmuse.leadership.config.TreeSectionConfig;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;

/**
 * Role-keyed section. Seats are stored flat by role key and nested into
 * sub-section / team levels only when serialised, following the declaration
 * order of the section's positions.
 */
public class TreeSection extends HierarchySection {

    private final TreeSectionConfig config;
    private final Map<String, PersonInfo> seats = new LinkedHashMap<>();

    public TreeSection(TreeSectionConfig config) {
        super(config.getKey());
        this.config = config;
    }

    public TreeSectionConfig getConfig() {
        return config;
    }

    @Override
    public boolean isList() {
        return false;
    }

    @Override
    public boolean isEmpty() {
        return seats.isEmpty();
    }

    /**
     * @return the person previously in the seat, or null
     */
    PersonInfo put(PositionConfig position, PersonInfo person) {
        return seats.put(position.getRoleKey(), person);
    }

    public PersonInfo get(String roleKey) {
        return seats.get(roleKey);
    }

    /**
     * Filled seats keyed by role key, in the order they were filled.
     */
    public Map<String, PersonInfo> getSeats() {
        return Collections.unmodifiableMap(seats);
    }

    @Override
    public List<PersonInfo> getPersons() {
        List<PersonInfo> persons = new ArrayList<>();
        for (PositionConfig position : config.getPositions()) {
            PersonInfo person = seats.get(position.getRoleKey());
            if (person != null) {
                persons.add(person);
            }
        }
        return persons;
    }

    @Override
    @SuppressWarnings("unchecked")
    public Map<String, Object> toValue() {
        Map<String, Object> root = new LinkedHashMap<>();
        for (PositionConfig position : config.getPositions()) {
            PersonInfo person = seats.get(position.getRoleKey());
            if (person == null) {
                continue;
            }
            Map<String, Object> level = root;
            if (position.getSubSection() != null) {
                level = (Map<String, Object>) level.computeIfAbsent(position.getSubSection(),
                        k -> new LinkedHashMap<String, Object>());
            }
            if (position.getTeam() != null) {
                level = (Map<String, Object>) level.computeIfAbsent(position.getTeam(),
                        k -> new LinkedHashMap<String, Object>());
            }
            level.put(position.getRole(), person.toRecord());
        }
        return root;
    }

    @Override
    TreeSection mapPersons(UnaryOperator<PersonInfo> mapper) {
        TreeSection copy = new TreeSection(config);
        for (Map.Entry<String, PersonInfo> seat : seats.entrySet()) {
            copy.seats.put(seat.getKey(), mapper.apply(seat.getValue()));
        }
        return copy;
    }
}
