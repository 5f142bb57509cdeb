package com.sysmuse.leadership.model;

import com.sysmuse.leadership.config.HierarchyConfig;
import com.sysmuse.leadership.config.PositionConfig;
import com.sysmuse.leadership.config.SectionConfig;
import com.sysmuse.leadership.config.TreeSectionConfig;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.function.UnaryOperator;

/**
 * Leadership roster organised by configured section.
 *
 * <p>Created with one empty slot per configured section, filled row by row while a
 * roster is parsed, then frozen. Vacant seats live only in the vacant set and are
 * never written into a tree section.</p>
 */
public class LeadershipHierarchy {

    public static final String VACANT_POSITIONS_KEY = "vacant_positions";

    private final HierarchyConfig config;
    private final Map<String, HierarchySection> sections = new LinkedHashMap<>();
    private final SortedSet<String> vacantPositions = new TreeSet<>();
    private boolean frozen;

    public LeadershipHierarchy(HierarchyConfig config) {
        this.config = config;
        for (SectionConfig section : config.getSections().values()) {
            if (section.isList()) {
                sections.put(section.getKey(), new ListSection(section.getKey()));
            } else {
                sections.put(section.getKey(), new TreeSection((TreeSectionConfig) section));
            }
        }
    }

    public HierarchyConfig getConfig() {
        return config;
    }

    // ---- population ----

    /**
     * Write a person into a tree seat.
     *
     * @return the person that previously held the seat, or null
     */
    public PersonInfo addPosition(String sectionKey, PositionConfig position, PersonInfo person) {
        checkMutable();
        if (person.isVacant()) {
            throw new IllegalArgumentException("Vacant seats go to the vacant set: " + sectionKey + "."
                    + position.getRoleKey());
        }
        String path = sectionKey + "." + position.getRoleKey();
        vacantPositions.remove(path);
        return getTreeSection(sectionKey).put(position, person);
    }

    /**
     * Record a vacant seat. A seat already filled by an earlier row stays filled.
     *
     * @return false when the seat is already filled
     */
    public boolean addVacant(String sectionKey, PositionConfig position) {
        checkMutable();
        TreeSection section = getTreeSection(sectionKey);
        if (section.get(position.getRoleKey()) != null) {
            return false;
        }
        vacantPositions.add(sectionKey + "." + position.getRoleKey());
        return true;
    }

    public void addMember(String sectionKey, RosterEntry entry) {
        checkMutable();
        getListSection(sectionKey).add(entry);
    }

    /**
     * Make the hierarchy read-only. Called once parsing finishes.
     */
    public LeadershipHierarchy freeze() {
        frozen = true;
        return this;
    }

    public boolean isFrozen() {
        return frozen;
    }

    private void checkMutable() {
        if (frozen) {
            throw new IllegalStateException("Hierarchy is read-only once built");
        }
    }

    // ---- queries ----

    public Map<String, HierarchySection> getSections() {
        return Collections.unmodifiableMap(sections);
    }

    public HierarchySection getSection(String sectionKey) {
        HierarchySection section = sections.get(sectionKey);
        if (section == null) {
            throw new IllegalArgumentException("Unknown section: " + sectionKey);
        }
        return section;
    }

    public TreeSection getTreeSection(String sectionKey) {
        HierarchySection section = getSection(sectionKey);
        if (section.isList()) {
            throw new IllegalArgumentException("Section " + sectionKey + " is a list section");
        }
        return (TreeSection) section;
    }

    public ListSection getListSection(String sectionKey) {
        HierarchySection section = getSection(sectionKey);
        if (!section.isList()) {
            throw new IllegalArgumentException("Section " + sectionKey + " is not a list section");
        }
        return (ListSection) section;
    }

    /**
     * Look up a filled seat. Unknown sections, list sections and vacant seats all give empty.
     */
    public Optional<PersonInfo> getPosition(String sectionKey, String role, String subSection, String team) {
        HierarchySection section = sections.get(sectionKey);
        if (section == null || section.isList()) {
            return Optional.empty();
        }
        StringBuilder roleKey = new StringBuilder();
        if (subSection != null) {
            roleKey.append(subSection).append('.');
            if (team != null) {
                roleKey.append(team).append('.');
            }
        } else if (team != null) {
            return Optional.empty();
        }
        roleKey.append(role);
        return Optional.ofNullable(((TreeSection) section).get(roleKey.toString()));
    }

    public Optional<PersonInfo> getPosition(String sectionKey, String role) {
        return getPosition(sectionKey, role, null, null);
    }

    public Optional<PersonInfo> getPosition(HierarchyPath path) {
        return getPosition(path.getSection(), path.getRole(), path.getSubSection(), path.getTeam());
    }

    /**
     * Sorted dot paths of every vacant seat.
     */
    public SortedSet<String> getVacantPositions() {
        return Collections.unmodifiableSortedSet(vacantPositions);
    }

    public boolean isVacant(String dotPath) {
        return vacantPositions.contains(dotPath);
    }

    /**
     * Distinct, non-empty primary emails of every non-vacant person, in output order.
     * Emails are trimmed and lower-cased, so addresses differing only in case collapse.
     */
    public List<String> extractEmails() {
        Set<String> emails = new LinkedHashSet<>();
        for (HierarchySection section : sections.values()) {
            for (PersonInfo person : section.getPersons()) {
                if (!person.isVacant() && !person.getBarsEmail().trim().isEmpty()) {
                    emails.add(normalizeEmail(person.getBarsEmail()));
                }
            }
        }
        return new ArrayList<>(emails);
    }

    public HierarchySummary getSummary() {
        int total = 0;
        int withSlackId = 0;
        for (HierarchySection section : sections.values()) {
            for (PersonInfo person : section.getPersons()) {
                if (person.isVacant()) {
                    continue;
                }
                total++;
                if (person.hasSlackUserId()) {
                    withSlackId++;
                }
            }
        }
        return new HierarchySummary(total, withSlackId, vacantPositions.size());
    }

    /**
     * Plain nested structure: every configured section key in configuration order,
     * then {@value #VACANT_POSITIONS_KEY} holding the sorted vacant paths.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> out = new LinkedHashMap<>();
        for (HierarchySection section : sections.values()) {
            out.put(section.getKey(), section.toValue());
        }
        out.put(VACANT_POSITIONS_KEY, new ArrayList<>(vacantPositions));
        return out;
    }

    /**
     * Copy with external account ids attached by primary email. Persons whose email
     * has no id keep whatever id they already had.
     */
    public LeadershipHierarchy withAccountIds(Map<String, String> idsByEmail) {
        Map<String, String> ids = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : idsByEmail.entrySet()) {
            ids.put(normalizeEmail(entry.getKey()), entry.getValue());
        }
        return mapPersons(person -> {
            String id = ids.get(normalizeEmail(person.getBarsEmail()));
            return id == null ? person : person.withSlackUserId(id);
        });
    }

    static String normalizeEmail(String email) {
        return email.trim().toLowerCase(Locale.ROOT);
    }

    LeadershipHierarchy mapPersons(UnaryOperator<PersonInfo> mapper) {
        LeadershipHierarchy copy = new LeadershipHierarchy(config);
        for (Map.Entry<String, HierarchySection> entry : sections.entrySet()) {
            copy.sections.put(entry.getKey(), entry.getValue().mapPersons(mapper));
        }
        copy.vacantPositions.addAll(vacantPositions);
        copy.frozen = frozen;
        return copy;
    }

    @Override
    public String toString() {
        return "LeadershipHierarchy" + getSummary();
    }
}
