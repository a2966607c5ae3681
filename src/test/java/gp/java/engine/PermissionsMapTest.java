package gp.java.engine;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class PermissionsMapTest {

    @Test
    void testLookup_emptyWhenAbsent() {
        PermissionsMap map = new PermissionsMap();

        assertEquals(Optional.empty(), map.lookup("https://a.example"));
        assertFalse(map.contains("https://a.example"));
    }

    @Test
    void testRecord_keepsFirstInsertionPosition() {
        PermissionsMap map = new PermissionsMap();
        map.record("https://a.example", true);
        map.record("https://b.example", false);
        map.record("https://a.example", false);

        assertEquals(List.of("https://a.example", "https://b.example"), List.copyOf(map.origins()));
        assertEquals(Optional.of(false), map.lookup("https://a.example"));
        assertEquals(2, map.size());
    }

    @Test
    void testRemove_reportsWhetherPresent() {
        PermissionsMap map = new PermissionsMap();
        map.record("https://a.example", false);

        assertTrue(map.remove("https://a.example"));
        assertFalse(map.remove("https://a.example"));
        assertEquals(0, map.size());
    }

    @Test
    void testOrigins_isDetachedSnapshot() {
        PermissionsMap map = new PermissionsMap();
        map.record("https://a.example", true);

        Set<String> origins = map.origins();
        map.clear();

        assertEquals(Set.of("https://a.example"), origins);
        assertEquals(0, map.size());
    }
}
