package org.github.zzf.mqttd.auth;

import static org.assertj.core.api.Assertions.catchThrowable;
import static org.assertj.core.api.BDDAssertions.then;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvFileSource;
import org.junit.jupiter.params.provider.ValueSource;

class TopicFilterTest {

    @ParameterizedTest
    @CsvFileSource(resources = "/auth/topic_filter_match.csv")
    void givenFilterAndTopic_whenMatches_thenAsExpected(String filter, String topic, boolean expected) {
        then(TopicFilter.matches(filter, topic)).isEqualTo(expected);
    }

    /**
     * '#' must be the last level
     */
    @ParameterizedTest
    @ValueSource(strings = {"a/#/b", "#/a", "a/b#", "a/#b/c", "a+/b", "a/+b", ""})
    void givenIllegalFilter_whenValidate_thenConfigException(String filter) {
        Throwable t = catchThrowable(() -> TopicFilter.validate(filter));
        then(t).isInstanceOf(ConfigException.class);
        then(TopicFilter.isValid(filter)).isFalse();
    }

    @ParameterizedTest
    @ValueSource(strings = {"a/b", "#", "+", "a/#", "+/+/#", "/a", "a/", "$SYS/#"})
    void givenLegalFilter_whenValidate_thenPass(String filter) {
        TopicFilter.validate(filter);
        then(TopicFilter.isValid(filter)).isTrue();
    }

    @Test
    void givenTopicNames_whenIsTopicName_thenWildcardsRejected() {
        then(TopicFilter.isTopicName("a/b")).isTrue();
        then(TopicFilter.isTopicName("a/+")).isFalse();
        then(TopicFilter.isTopicName("a/#")).isFalse();
        then(TopicFilter.isTopicName("")).isFalse();
        then(TopicFilter.isTopicName(null)).isFalse();
    }

    @Test
    void givenGeneralAndSpecificFilters_whenCovers_thenSubsetDetected() {
        then(TopicFilter.covers("a/#", "a/b")).isTrue();
        then(TopicFilter.covers("a/#", "a/+/c")).isTrue();
        then(TopicFilter.covers("a/+", "a/b")).isTrue();
        then(TopicFilter.covers("#", "a/#")).isTrue();
        then(TopicFilter.covers("a/b", "a/b")).isTrue();
        // a/+ does not match a/b/c
        then(TopicFilter.covers("a/+", "a/#")).isFalse();
        then(TopicFilter.covers("a/b", "a/+")).isFalse();
        then(TopicFilter.covers("a/b", "a/b/c")).isFalse();
        then(TopicFilter.covers("#", "$SYS/a")).isFalse();
    }

}
