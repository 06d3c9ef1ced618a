package com.williamcallahan.mathcore.service.mathml;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

class XmlEscaperTest {

    @Test
    void content_escapesMarkupButNotQuotes() {
        assertEquals("a &lt; b &amp;&amp; c &gt; \"d\"", XmlEscaper.content("a < b && c > \"d\""));
    }

    @Test
    void attribute_alsoEscapesDoubleQuotes() {
        assertEquals("say &quot;hi&quot; &amp; &lt;go&gt;", XmlEscaper.attribute("say \"hi\" & <go>"));
    }

    @Test
    void nullAndEmptyBecomeEmpty() {
        assertEquals("", XmlEscaper.content(null));
        assertEquals("", XmlEscaper.attribute(""));
    }
}
