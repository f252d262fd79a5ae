package com.schoolsync.identity;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import org.junit.jupiter.api.Test;

class IdentityPageParserTest {

    @Test
    void extractUserId_readsInlineState() {
        String html = "<html><script>window.__STATE__={data:{user:{id:5550123,name:\"x\"}}}</script></html>";

        assertEquals("5550123", IdentityPageParser.extractUserId(html));
    }

    @Test
    void extractUserId_fallsBackToScriptBlocks() {
        String html = """
                <html><head>
                <script type="text/javascript">var a = 1;</script>
                <SCRIPT>
                  init({ session: {user:{id:987654, role:"teacher"}} });
                </SCRIPT>
                </head></html>
                """;

        assertEquals("987654", IdentityPageParser.extractUserId(html));
    }

    @Test
    void extractUserId_returnsNullWhenAbsent() {
        assertNull(IdentityPageParser.extractUserId("<html><body>Not found</body></html>"));
        assertNull(IdentityPageParser.extractUserId(""));
        assertNull(IdentityPageParser.extractUserId(null));
    }
}
