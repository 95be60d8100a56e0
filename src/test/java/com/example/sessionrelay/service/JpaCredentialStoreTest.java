package com.example.sessionrelay.service;

import com.example.sessionrelay.model.CredentialSnapshot;
import com.example.sessionrelay.persistence.CredentialEntity;
import com.example.sessionrelay.persistence.CredentialRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataJpaTest
class JpaCredentialStoreTest {

    @Autowired
    private CredentialRepository repository;

    private JpaCredentialStore store;

    @BeforeEach
    void setUp() {
        store = new JpaCredentialStore(repository);
    }

    @Test
    void unknownUserHasEmptySnapshot() {
        assertThat(store.find("nobody")).isEmpty();
        CredentialSnapshot s = store.snapshot("nobody");
        assertThat(s.getCsrfToken()).isNull();
        assertThat(s.getCookies()).isEmpty();
        assertThat(s.isCompleteForServerCall()).isFalse();
    }

    @Test
    void saveThenFindKeepsCookieOrder() {
        Map<String, String> cookies = new LinkedHashMap<>();
        cookies.put("JSESSIONID", "ajax:1");
        cookies.put("li_at", "AQE");
        cookies.put("bcookie", "v=2");

        store.save("u1", "ajax:1", cookies);
        CredentialSnapshot s = store.find("u1").orElseThrow();

        assertThat(s.getCsrfToken()).isEqualTo("ajax:1");
        assertThat(s.getCookies()).containsExactly(
                Map.entry("JSESSIONID", "ajax:1"), Map.entry("li_at", "AQE"), Map.entry("bcookie", "v=2"));
        assertThat(s.isCompleteForServerCall()).isTrue();
        assertThat(s.getCapturedAtEpochMs()).isPositive();
    }

    @Test
    void saveReplacesPreviousSnapshot() {
        store.save("u1", "ajax:1", Map.of("li_at", "old"));
        store.save("u1", null, Map.of("bcookie", "x"));

        CredentialSnapshot s = store.snapshot("u1");
        assertThat(s.getCsrfToken()).isNull();
        assertThat(s.getCookies()).containsOnlyKeys("bcookie");
        assertThat(repository.count()).isEqualTo(1);
    }

    @Test
    void unreadableCookieColumnReadsAsNoCookies() {
        repository.save(new CredentialEntity("u2", "ajax:2", "{not json", 5L));

        CredentialSnapshot s = store.snapshot("u2");

        assertThat(s.getCsrfToken()).isEqualTo("ajax:2");
        assertThat(s.getCookies()).isEmpty();
    }

    @Test
    void userIdIsRequired() {
        assertThatThrownBy(() -> store.save(" ", "x", Map.of())).isInstanceOf(IllegalArgumentException.class);
    }
}
