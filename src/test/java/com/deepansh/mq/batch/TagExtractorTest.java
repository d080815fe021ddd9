package com.deepansh.mq.batch;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class TagExtractorTest {

    @Test
    void extract_singleTag_mapsToTrimmedString() {
        Map<String, Object> tags = TagExtractor.extract("Sure. <answer>  42 </answer> done");

        assertThat(tags).containsExactly(Map.entry("answer", "42"));
    }

    @Test
    void extract_repeatedTag_mapsToListInOrder() {
        Map<String, Object> tags = TagExtractor.extract("<item>a</item> <item>b</item><item>c</item>");

        assertThat(tags.get("item")).isEqualTo(List.of("a", "b", "c"));
    }

    @Test
    void extract_multilineValue_isCaptured() {
        Map<String, Object> tags = TagExtractor.extract("<code>\nline1\nline2\n</code>");

        assertThat(tags.get("code")).isEqualTo("line1\nline2");
    }

    @Test
    void extract_mismatchedOrMissing_returnsEmpty() {
        assertThat(TagExtractor.extract("<a>open only")).isEmpty();
        assertThat(TagExtractor.extract("<a>x</b>")).isEmpty();
        assertThat(TagExtractor.extract(null)).isEmpty();
    }

    @Test
    void extract_keepsFirstSeenOrder() {
        Map<String, Object> tags = TagExtractor.extract("<b>2</b><a>1</a>");

        assertThat(tags.keySet()).containsExactly("b", "a");
    }
}
