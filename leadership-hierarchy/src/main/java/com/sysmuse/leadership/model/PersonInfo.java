package com.sysmuse.leadership.model;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * One person as read from a roster row. Immutable; enrichment produces a copy
 * through {@link #withSlackUserId(String)}.
 *
 * <p>The primary organisational email is never null (empty when blank); the
 * personal email, phone, birthday and external account id are null when absent.</p>
 */
public final class PersonInfo {

    public static final String VACANT = "vacant";

    private final String position;
    private final String name;
    private final String barsEmail;
    private final String personalEmail;
    private final String phone;
    private final String birthday;
    private final String slackUserId;

    public PersonInfo(String position, String name, String barsEmail,
                      String personalEmail, String phone, String birthday, String slackUserId) {
        this.position = position == null ? "" : position;
        this.name = name == null ? "" : name;
        this.barsEmail = barsEmail == null ? "" : barsEmail;
        this.personalEmail = emptyToNull(personalEmail);
        this.phone = emptyToNull(phone);
        this.birthday = emptyToNull(birthday);
        this.slackUserId = emptyToNull(slackUserId);
    }

    /**
     * Vacant seat: the name is kept as written, every contact field is empty.
     */
    public static PersonInfo vacant(String position, String name) {
        return new PersonInfo(position, name, "", null, null, null, null);
    }

    public static boolean isVacantName(String name) {
        return name != null && VACANT.equals(name.trim().toLowerCase(Locale.ROOT));
    }

    public String getPosition() {
        return position;
    }

    public String getName() {
        return name;
    }

    public String getBarsEmail() {
        return barsEmail;
    }

    public String getPersonalEmail() {
        return personalEmail;
    }

    public String getPhone() {
        return phone;
    }

    public String getBirthday() {
        return birthday;
    }

    public String getSlackUserId() {
        return slackUserId;
    }

    public boolean isVacant() {
        return isVacantName(name);
    }

    /**
     * A non-vacant person with both a name and a primary email.
     */
    public boolean isComplete() {
        return !isVacant() && !name.trim().isEmpty() && !barsEmail.trim().isEmpty();
    }

    public boolean hasSlackUserId() {
        return slackUserId != null;
    }

    public PersonInfo withSlackUserId(String id) {
        return new PersonInfo(position, name, barsEmail, personalEmail, phone, birthday, id);
    }

    /**
     * Flat record with a fixed key order; absent optional values map to null.
     */
    public Map<String, Object> toRecord() {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("position", position);
        record.put("name", name);
        record.put("bars_email", barsEmail);
        record.put("personal_email", personalEmail);
        record.put("phone", phone);
        record.put("birthday", birthday);
        record.put("slack_user_id", slackUserId);
        return record;
    }

    private static String emptyToNull(String value) {
        return value == null || value.trim().isEmpty() ? null : value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PersonInfo)) {
            return false;
        }
        PersonInfo other = (PersonInfo) o;
        return position.equals(other.position)
                && name.equals(other.name)
                && barsEmail.equals(other.barsEmail)
                && Objects.equals(personalEmail, other.personalEmail)
                && Objects.equals(phone, other.phone)
                && Objects.equals(birthday, other.birthday)
                && Objects.equals(slackUserId, other.slackUserId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(position, name, barsEmail, personalEmail, phone, birthday, slackUserId);
    }

    @Override
    public String toString() {
        return name + " <" + barsEmail + "> (" + position + ")";
    }
}
