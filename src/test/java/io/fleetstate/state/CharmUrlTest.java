package io.fleetstate.state;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class CharmUrlTest {
    @Test
    void parseShouldSplitUserNameAndRevision() {
        CharmUrl url = CharmUrl.parse("cs:~acme/wordpress-12");
        assertEquals("cs", url.schema());
        assertEquals("acme", url.user());
        assertEquals("wordpress", url.name());
        assertEquals(12, url.revision());
        assertEquals("cs:~acme/wordpress-12", url.toString());
    }

    @Test
    void parseShouldKeepDashedNamesWithoutRevision() {
        CharmUrl url = CharmUrl.parse("local:mysql-router");
        assertNull(url.user());
        assertEquals("mysql-router", url.name());
        assertEquals(-1, url.revision());
        assertEquals("local:mysql-router", url.toString());
    }

    @Test
    void parseShouldRejectMalformedUrls() {
        assertThrows(IllegalArgumentException.class, () -> CharmUrl.parse(""));
        assertThrows(IllegalArgumentException.class, () -> CharmUrl.parse("wordpress"));
        assertThrows(IllegalArgumentException.class, () -> CharmUrl.parse("http:wordpress"));
        assertThrows(IllegalArgumentException.class, () -> CharmUrl.parse("cs:~/wordpress"));
        assertThrows(IllegalArgumentException.class, () -> CharmUrl.parse("cs:7up"));
    }
}
