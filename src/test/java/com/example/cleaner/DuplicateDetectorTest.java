package com.example.cleaner;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class DuplicateDetectorTest {

    private static UserRecord user(String id, String login, String mail) {
        return UserRecord.builder().id(id).loginId(login).mailAddress(mail).build();
    }

    @Test
    void batchScoped_flagsEveryMemberOfAGroup() {
        List<UserRecord> batch = List.of(
                user("1", "a", "a@x.com"),
                user("2", "b", "b@x.com"),
                user("3", "a", "a@x.com"),
                user("4", "a", "a@x.com"),
                user("5", "a", "other@x.com"));

        boolean[] flags = DuplicateDetector.batchScoped().flagDuplicates(batch);

        assertThat(flags).containsExactly(true, false, true, true, false);
    }

    @Test
    void batchScoped_nullKeysCompareEqual() {
        List<UserRecord> batch = List.of(user("1", null, "m@x.com"), user("2", null, "m@x.com"), user("3", "x", null));

        assertThat(DuplicateDetector.batchScoped().flagDuplicates(batch)).containsExactly(true, true, false);
    }

    @Test
    void batchScoped_keyIsCaseSensitive() {
        List<UserRecord> batch = List.of(user("1", "a", "A@x.com"), user("2", "a", "a@x.com"));

        assertThat(DuplicateDetector.batchScoped().flagDuplicates(batch)).containsExactly(false, false);
    }

    @Test
    void datasetIndex_usesCountsFromWholeInput() {
        DatasetDuplicateIndex index = new DatasetDuplicateIndex(Map.of(
                new DuplicateKey("a", "a@x.com"), 2,
                new DuplicateKey("b", "b@x.com"), 1));

        boolean[] flags = index.flagDuplicates(List.of(user("1", "a", "a@x.com"), user("2", "b", "b@x.com"), user("3", "c", "c@x.com")));

        assertThat(flags).containsExactly(true, false, false);
    }
}
