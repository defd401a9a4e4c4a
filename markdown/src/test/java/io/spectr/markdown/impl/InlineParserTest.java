package io.spectr.markdown.impl;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

public class InlineParserTest {

    @ParameterizedTest
    @CsvSource(quoteCharacter = '"', value = {
        "auth,              auth, \"\",    \"\"",
        "auth|Login,        auth, Login,   \"\"",
        "auth#flow,         auth, \"\",    flow",
        "auth|Login#flow,   auth, Login,   flow",
        "\" auth | Login \", auth, Login,   \"\"",
        "auth#a|b,          auth, \"\",    a|b",
    })
    void linkParts(String content, String target, String display, String anchor) {
        assertEquals(new NodeAttributes.Link(target, display, anchor), InlineParser.parseLink(content));
    }
}
